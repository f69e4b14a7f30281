package org.dxworks.cobolscope.analytics;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class ProgramRelationships {
    public int totalRelationships;
    public int programsWithDependencies;
    public int isolatedPrograms;
    public List<DependencyCount> mostDependedOn = new ArrayList<>();
    public Map<String, List<String>> dependencyGraph = new TreeMap<>();
    public List<Relationship> relationships = new ArrayList<>();
}
