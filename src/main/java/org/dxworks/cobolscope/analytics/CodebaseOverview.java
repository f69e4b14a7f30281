package org.dxworks.cobolscope.analytics;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class CodebaseOverview {
    public int totalPrograms;
    public int totalCopybooks;
    public long totalLinesOfCode;
    public long averageLinesPerProgram;
    public Map<String, Integer> complexityDistribution = new LinkedHashMap<>();
    public int totalUniqueDependencies;
    public List<DependencyCount> mostCommonDependencies = new ArrayList<>();
    public Map<String, Integer> sizeDistribution = new LinkedHashMap<>();
}
