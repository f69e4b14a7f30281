package org.dxworks.cobolscope.analytics;

import org.dxworks.cobolscope.TestUtils;
import org.dxworks.cobolscope.diagnostic.DiagnosticCollector;
import org.dxworks.cobolscope.index.CodeIndex;
import org.dxworks.cobolscope.model.ProgramModel;
import org.dxworks.cobolscope.source.SourceUnit;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class CodebaseAnalyticsTest {

    private static CodeIndex index;
    private static CodebaseAnalytics analytics;

    @BeforeAll
    static void indexSamples() {
        index = new CodeIndex();
        for (String file : List.of("CUSTUPD.cbl", "AUDITLOG.cbl", "DANGLER.cbl", "LOOPER.cbl", "CUSTREC.cpy")) {
            index.commit(TestUtils.sampleModel(file));
        }
        index.commit(build(TestUtils.program("DUPE.cbl",
                "IDENTIFICATION DIVISION.",
                "PROGRAM-ID. DUPE.",
                "DATA DIVISION.",
                "WORKING-STORAGE SECTION.",
                "    COPY CUSTREC.",
                "PROCEDURE DIVISION.",
                "MAIN-PARA.",
                "    CALL 'AUDITLOG' USING CUSTOMER-REC",
                "    GOBACK.")));
        analytics = new CodebaseAnalytics(index);
    }

    private static ProgramModel build(SourceUnit unit) {
        return TestUtils.samplesPipeline().run(unit, new DiagnosticCollector());
    }

    @Test
    void overviewCountsProgramsCopybooksAndDependencies() {
        CodebaseOverview overview = analytics.overview();

        assertEquals(5, overview.totalPrograms);
        assertEquals(1, overview.totalCopybooks);
        assertEquals(2, overview.totalUniqueDependencies);
        assertEquals(overview.totalLinesOfCode / 5, overview.averageLinesPerProgram);
        assertEquals(5, overview.sizeDistribution.get("Small (< 100 lines)"));
        assertEquals(0, overview.sizeDistribution.get("Very Large (> 1000 lines)"));
        assertEquals(5, overview.complexityDistribution.values().stream().mapToInt(Integer::intValue).sum());
        assertEquals(List.of("AUDITLOG", "CUSTREC"),
                overview.mostCommonDependencies.stream().map(d -> d.name).collect(Collectors.toList()));
        assertEquals(2, overview.mostCommonDependencies.get(0).count);
    }

    @Test
    void relationshipsListCopyAndCallEdges() {
        ProgramRelationships relationships = analytics.relationships();

        assertEquals(4, relationships.totalRelationships);
        assertEquals(2, relationships.programsWithDependencies);
        assertEquals(3, relationships.isolatedPrograms);
        assertEquals(List.of("AUDITLOG", "CUSTREC"), relationships.dependencyGraph.get("CUSTUPD"));
        assertTrue(relationships.dependencyGraph.get("LOOPER").isEmpty());
        assertTrue(relationships.relationships.stream()
                .anyMatch(r -> r.source.equals("DUPE") && r.target.equals("AUDITLOG") && r.type.equals("CALL")));
        assertTrue(relationships.relationships.stream()
                .anyMatch(r -> r.source.equals("CUSTUPD") && r.target.equals("CUSTREC") && r.type.equals("COPY")));
    }

    @Test
    void refactoringFindsIsolatedProgramsAndSharedPatterns() {
        RefactoringOpportunities opportunities = analytics.refactoringOpportunities();

        assertEquals(List.of("AUDITLOG", "DANGLER", "LOOPER"),
                opportunities.isolatedPrograms.stream().map(f -> f.programId).collect(Collectors.toList()));
        assertEquals(1, opportunities.duplicateDependencies.size());
        DependencyPattern pattern = opportunities.duplicateDependencies.get(0);
        assertEquals(List.of("AUDITLOG", "CUSTREC"), pattern.pattern);
        assertEquals(List.of("CUSTUPD", "DUPE"), pattern.programs);
        assertTrue(opportunities.largePrograms.isEmpty());
        assertTrue(opportunities.highlyDependentPrograms.isEmpty());
    }

    @Test
    void largeProgramIsFlagged() {
        List<String> lines = new ArrayList<>(List.of(
                "IDENTIFICATION DIVISION.",
                "PROGRAM-ID. BIGPROG.",
                "PROCEDURE DIVISION.",
                "MAIN-PARA."));
        for (int i = 0; i < 1000; i++) {
            lines.add("    DISPLAY 'LINE'.");
        }
        CodeIndex single = new CodeIndex();
        single.commit(build(TestUtils.program("BIGPROG.cbl", lines.toArray(new String[0]))));

        RefactoringOpportunities opportunities = new CodebaseAnalytics(single).refactoringOpportunities();

        assertEquals(1, opportunities.largePrograms.size());
        assertEquals("BIGPROG", opportunities.largePrograms.get(0).programId);
        assertEquals(1004, opportunities.largePrograms.get(0).lineCount);
        assertEquals(1, new CodebaseAnalytics(single).overview().sizeDistribution.get("Very Large (> 1000 lines)"));
    }

    @Test
    void reportCarriesTheSnapshotGeneration() {
        AnalyticsReport report = analytics.report();

        assertEquals("analytics", report.kind);
        assertEquals(index.snapshot().getGeneration(), report.generation);
        assertNotNull(report.overview);
        assertNotNull(report.relationships);
        assertNotNull(report.refactoring);
    }

    @Test
    void emptyIndexGivesZeroes() {
        CodebaseOverview overview = new CodebaseAnalytics(new CodeIndex()).overview();

        assertEquals(0, overview.totalPrograms);
        assertEquals(0, overview.averageLinesPerProgram);
        assertTrue(overview.mostCommonDependencies.isEmpty());
    }
}
