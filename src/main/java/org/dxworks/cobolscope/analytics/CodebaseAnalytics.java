package org.dxworks.cobolscope.analytics;

import org.dxworks.cobolscope.index.CodeIndex;
import org.dxworks.cobolscope.index.IndexSnapshot;
import org.dxworks.cobolscope.index.UnitIndex;
import org.dxworks.cobolscope.model.Complexity;
import org.dxworks.cobolscope.model.Edge;
import org.dxworks.cobolscope.model.EdgeKind;
import org.dxworks.cobolscope.model.ProgramModel;
import org.dxworks.cobolscope.source.UnitKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Codebase-wide figures computed from the latest committed snapshot: size and complexity
 * overview, the COPY/CALL dependency graph between programs, and refactoring candidates.
 */
public class CodebaseAnalytics {

    static final int TOP_COUNT = 5;
    static final int LARGE_PROGRAM_LINES = 1000;
    static final int MANY_DEPENDENCIES = 10;

    private static final String SMALL = "Small (< 100 lines)";
    private static final String MEDIUM = "Medium (100-500 lines)";
    private static final String LARGE = "Large (500-1000 lines)";
    private static final String VERY_LARGE = "Very Large (> 1000 lines)";

    private final CodeIndex index;

    public CodebaseAnalytics(CodeIndex index) {
        this.index = index;
    }

    public AnalyticsReport report() {
        IndexSnapshot snapshot = index.snapshot();
        List<Program> programs = programs(snapshot);
        AnalyticsReport report = new AnalyticsReport();
        report.generation = snapshot.getGeneration();
        report.overview = overview(snapshot, programs);
        report.relationships = relationships(programs);
        report.refactoring = refactoring(programs);
        return report;
    }

    public CodebaseOverview overview() {
        IndexSnapshot snapshot = index.snapshot();
        return overview(snapshot, programs(snapshot));
    }

    public ProgramRelationships relationships() {
        return relationships(programs(index.snapshot()));
    }

    public RefactoringOpportunities refactoringOpportunities() {
        return refactoring(programs(index.snapshot()));
    }

    // Extract codebase size, complexity and dependency totals
    private static CodebaseOverview overview(IndexSnapshot snapshot, List<Program> programs) {
        CodebaseOverview overview = new CodebaseOverview();
        overview.totalPrograms = programs.size();
        overview.totalCopybooks = (int) snapshot.units().stream()
                .filter(u -> u.getModel().getKind() == UnitKind.COPYBOOK)
                .count();
        overview.totalLinesOfCode = programs.stream().mapToLong(p -> p.lineCount).sum();
        overview.averageLinesPerProgram = programs.isEmpty() ? 0 : overview.totalLinesOfCode / programs.size();

        for (Complexity complexity : Complexity.values()) {
            overview.complexityDistribution.put(complexity.name(), 0);
        }
        programs.forEach(p -> overview.complexityDistribution.merge(p.complexity.name(), 1, Integer::sum));

        List<String> allDependencies = programs.stream()
                .flatMap(p -> p.dependencies.stream())
                .collect(Collectors.toList());
        overview.totalUniqueDependencies = new TreeSet<>(allDependencies).size();
        overview.mostCommonDependencies = mostCommon(allDependencies);

        overview.sizeDistribution.put(SMALL, 0);
        overview.sizeDistribution.put(MEDIUM, 0);
        overview.sizeDistribution.put(LARGE, 0);
        overview.sizeDistribution.put(VERY_LARGE, 0);
        programs.forEach(p -> overview.sizeDistribution.merge(sizeCategory(p.lineCount), 1, Integer::sum));
        return overview;
    }

    // Extract the dependency graph between programs
    private static ProgramRelationships relationships(List<Program> programs) {
        ProgramRelationships result = new ProgramRelationships();
        List<String> targets = new ArrayList<>();
        for (Program program : programs) {
            result.dependencyGraph.put(program.name, new ArrayList<>(program.dependencies));
            for (String member : program.copybooks) {
                result.relationships.add(new Relationship(program.name, member, "COPY"));
                targets.add(member);
            }
            for (String called : program.calls) {
                result.relationships.add(new Relationship(program.name, called, "CALL"));
                targets.add(called);
            }
        }
        result.totalRelationships = result.relationships.size();
        result.programsWithDependencies = (int) programs.stream().filter(p -> !p.dependencies.isEmpty()).count();
        result.isolatedPrograms = programs.size() - result.programsWithDependencies;
        result.mostDependedOn = mostCommon(targets);
        return result;
    }

    // Extract programs worth a closer look before refactoring
    private static RefactoringOpportunities refactoring(List<Program> programs) {
        RefactoringOpportunities result = new RefactoringOpportunities();
        Map<List<String>, List<String>> patterns = new TreeMap<>(Comparator.comparing(List::toString));
        for (Program program : programs) {
            if (program.complexity == Complexity.HIGH) {
                result.highComplexityPrograms.add(program.finding(false));
            }
            if (program.lineCount > LARGE_PROGRAM_LINES) {
                result.largePrograms.add(program.finding(false));
            }
            if (program.dependencies.size() > MANY_DEPENDENCIES) {
                result.highlyDependentPrograms.add(program.finding(true));
            }
            if (program.dependencies.isEmpty()) {
                result.isolatedPrograms.add(program.finding(false));
            }
            if (program.dependencies.size() > 1) {
                patterns.computeIfAbsent(program.dependencies, k -> new ArrayList<>()).add(program.name);
            }
        }
        patterns.forEach((pattern, names) -> {
            if (names.size() > 1) {
                DependencyPattern duplicate = new DependencyPattern();
                duplicate.pattern.addAll(pattern);
                duplicate.programs.addAll(names);
                result.duplicateDependencies.add(duplicate);
            }
        });
        return result;
    }

    private static List<Program> programs(IndexSnapshot snapshot) {
        List<Program> programs = new ArrayList<>();
        for (UnitIndex unit : snapshot.units()) {
            if (unit.getModel().getKind() == UnitKind.PROGRAM) {
                programs.add(new Program(unit.getModel()));
            }
        }
        return programs;
    }

    private static List<DependencyCount> mostCommon(List<String> items) {
        Map<String, Integer> counts = new HashMap<>();
        items.forEach(item -> counts.merge(item, 1, Integer::sum));
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry::getKey))
                .limit(TOP_COUNT)
                .map(e -> new DependencyCount(e.getKey(), e.getValue()))
                .collect(Collectors.toList());
    }

    private static String sizeCategory(int lineCount) {
        if (lineCount < 100) {
            return SMALL;
        }
        if (lineCount < 500) {
            return MEDIUM;
        }
        if (lineCount < 1000) {
            return LARGE;
        }
        return VERY_LARGE;
    }

    private static final class Program {
        private final String name;
        private final String unitId;
        private final int lineCount;
        private final Complexity complexity;
        private final List<String> copybooks;
        private final List<String> calls;
        private final List<String> dependencies;

        private Program(ProgramModel model) {
            this.unitId = model.getUnitId();
            this.name = model.getProgramId() != null ? model.getProgramId() : model.getUnitId();
            this.lineCount = model.getMetrics() != null ? model.getMetrics().getLineCount() : 0;
            this.complexity = model.getMetrics() != null ? model.getMetrics().getComplexity() : Complexity.LOW;
            this.copybooks = model.getCopybooks();
            this.calls = model.getEdges().stream()
                    .filter(e -> e.getKind() == EdgeKind.CALL)
                    .map(Edge::getTarget)
                    .filter(Objects::nonNull)
                    .distinct()
                    .sorted()
                    .collect(Collectors.toList());
            TreeSet<String> all = new TreeSet<>(copybooks);
            all.addAll(calls);
            this.dependencies = new ArrayList<>(all);
        }

        private ProgramFinding finding(boolean withDependencyCount) {
            ProgramFinding finding = new ProgramFinding();
            finding.programId = name;
            finding.unitId = unitId;
            finding.lineCount = lineCount;
            finding.complexity = complexity.name();
            finding.dependencyCount = withDependencyCount ? dependencies.size() : null;
            return finding;
        }
    }
}
