package org.dxworks.cobolscope.analytics;

import java.util.ArrayList;
import java.util.List;

public class RefactoringOpportunities {
    public List<ProgramFinding> highComplexityPrograms = new ArrayList<>();
    public List<ProgramFinding> largePrograms = new ArrayList<>();
    public List<ProgramFinding> highlyDependentPrograms = new ArrayList<>();
    public List<ProgramFinding> isolatedPrograms = new ArrayList<>();
    public List<DependencyPattern> duplicateDependencies = new ArrayList<>();
}
