package org.dxworks.cobolscope.query;

import org.dxworks.cobolscope.TestUtils;
import org.dxworks.cobolscope.index.CodeIndex;
import org.dxworks.cobolscope.model.AccessKind;
import org.dxworks.cobolscope.model.DataAccess;
import org.dxworks.cobolscope.model.EdgeKind;
import org.dxworks.cobolscope.model.SymbolKind;
import org.dxworks.cobolscope.model.SymbolOccurrence;
import org.dxworks.cobolscope.model.SymbolRole;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class QueryEngineTest {

    private static CodeIndex index;
    private static QueryEngine engine;

    @BeforeAll
    static void indexSamples() {
        index = new CodeIndex();
        for (String file : List.of("CUSTUPD.cbl", "AUDITLOG.cbl", "DANGLER.cbl", "LOOPER.cbl")) {
            index.commit(TestUtils.sampleModel(file));
        }
        engine = new QueryEngine(index);
    }

    @Test
    void unqualifiedDefinitionFindsEveryDeclaration() {
        List<Definition> definitions = engine.findDefinition("balance");

        assertEquals(2, definitions.size());
        assertTrue(definitions.stream().allMatch(d -> d.getKind() == SymbolKind.DATA_ITEM
                && d.getUnitId().equals("CUSTUPD.cbl")));
    }

    @Test
    void qualifiedDefinitionNarrowsToOneDeclaration() {
        List<Definition> definitions = engine.findDefinition("BALANCE OF CUSTOMER-REC");

        assertEquals(1, definitions.size());
        assertEquals(List.of("BALANCE", "CUSTOMER-REC"), definitions.get(0).getQualification());
        assertEquals("CUSTREC.cpy", definitions.get(0).getRange().getFile());
        assertTrue(engine.findDefinition("BALANCE IN NO-SUCH-GROUP").isEmpty());
    }

    @Test
    void procedureAndProgramDefinitions() {
        List<Definition> paragraph = engine.findDefinition("UPDATE-BALANCE");
        assertEquals(1, paragraph.size());
        assertEquals(SymbolKind.PROCEDURE, paragraph.get(0).getKind());
        assertEquals("PROCEDURE/UPDATE-BALANCE", paragraph.get(0).getNodeId());

        List<Definition> program = engine.findDefinition("AUDITLOG");
        assertEquals(1, program.size());
        assertEquals(SymbolKind.PROGRAM, program.get(0).getKind());
        assertEquals("AUDITLOG.cbl", program.get(0).getUnitId());
    }

    @Test
    void definitionLookupCanBeLimitedToOneUnit() {
        assertTrue(engine.findDefinition("BALANCE", "AUDITLOG.cbl").isEmpty());
        assertTrue(engine.findDefinition("BALANCE", "NOT-INDEXED.cbl").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> engine.findDefinition(" "));
    }

    @Test
    void referencesIncludeDeclarationsAndEveryUse() {
        List<SymbolOccurrence> references = engine.findReferences("BALANCE OF CUSTOMER-REC");

        assertTrue(references.stream().allMatch(o -> o.getText().equals("BALANCE")));
        assertEquals(2, references.stream().filter(o -> o.getRole() == SymbolRole.DEFINITION).count());
        List<Integer> useLines = references.stream()
                .filter(o -> o.getRole() == SymbolRole.REFERENCE)
                .map(o -> o.getRange().getStartLine())
                .distinct()
                .collect(Collectors.toList());
        assertTrue(useLines.containsAll(List.of(30, 31, 35)), useLines.toString());
        for (int i = 1; i < references.size(); i++) {
            assertTrue(references.get(i - 1).getRange().compareTo(references.get(i).getRange()) <= 0);
        }
    }

    @Test
    void searchRanksExactThenPrefixThenSubstring() {
        List<SearchHit> hits = engine.search("balance");

        assertEquals(MatchKind.EXACT, hits.get(0).getMatch());
        List<MatchKind> kinds = hits.stream().map(SearchHit::getMatch).collect(Collectors.toList());
        for (int i = 1; i < kinds.size(); i++) {
            assertTrue(kinds.get(i - 1).compareTo(kinds.get(i)) <= 0);
        }
        assertTrue(hits.stream().anyMatch(h -> h.getMatch() == MatchKind.SUBSTRING
                && h.getOccurrence().getText().equals("UPDATE-BALANCE")));
    }

    @Test
    void searchIsDeterministic() {
        List<String> first = engine.search("PARA").stream().map(QueryEngineTest::describe).collect(Collectors.toList());
        List<String> second = engine.search("PARA").stream().map(QueryEngineTest::describe).collect(Collectors.toList());

        assertFalse(first.isEmpty());
        assertEquals(first, second);
        assertTrue(engine.search("  ").isEmpty());
    }

    private static String describe(SearchHit hit) {
        return hit.getMatch() + " " + hit.getUnitId() + " " + hit.getOccurrence().getRange().key();
    }

    @Test
    void qualifiedDataAccessesKeepOnlyTheBoundDeclaration() {
        List<DataAccess> account = engine.dataAccesses("BALANCE OF ACCOUNT-REC", "CUSTUPD.cbl");

        assertEquals(1, account.size());
        assertEquals(AccessKind.WRITE, account.get(0).getKind());
        assertEquals("MOVE", account.get(0).getVerb());
        assertTrue(engine.dataAccesses("BALANCE", "CUSTUPD.cbl").size() > account.size());
    }

    @Test
    void callGraphFollowsPerformAndCrossUnitCall() {
        GraphResult graph = engine.callGraphNeighborhood(ProcedureRef.of("CUSTUPD.cbl", "MAIN-PARA"), 1);

        assertEquals(List.of("CUSTUPD.cbl#PROCEDURE/MAIN-PARA", "CUSTUPD.cbl#PROCEDURE/UPDATE-BALANCE",
                        "AUDITLOG.cbl#PROCEDURE/WRITE-ENTRY"),
                graph.getNodes().stream().map(GraphNode::getKey).collect(Collectors.toList()));
        assertEquals(List.of(EdgeKind.PERFORM, EdgeKind.CALL),
                graph.getEdges().stream().map(GraphEdge::getKind).collect(Collectors.toList()));
        assertEquals(1, graph.node("AUDITLOG.cbl#PROCEDURE/WRITE-ENTRY").orElseThrow().getDepth());
    }

    @Test
    void depthZeroReturnsOnlyTheStart() {
        GraphResult graph = engine.callGraphNeighborhood(ProcedureRef.anyUnit("MAIN-PARA"), 0);

        assertEquals(1, graph.getNodes().size());
        assertTrue(graph.getEdges().isEmpty());
        assertThrows(IllegalArgumentException.class,
                () -> engine.callGraphNeighborhood(ProcedureRef.anyUnit("MAIN-PARA"), -1));
    }

    @Test
    void performCycleTerminates() {
        GraphResult graph = engine.callGraphNeighborhood(ProcedureRef.of("LOOPER.cbl", "PARA-A"), 50);

        assertEquals(2, graph.getNodes().size());
        assertEquals(2, graph.getEdges().size());
    }

    @Test
    void danglingTargetBecomesAnUnresolvedNode() {
        GraphResult graph = engine.callGraphNeighborhood(ProcedureRef.of("DANGLER.cbl", "FIRST-PARA"), 3);

        GraphNode missing = graph.node("unresolved:DANGLER.cbl#MISSING-PARA").orElseThrow();
        assertEquals(GraphNodeKind.UNRESOLVED, missing.getKind());
        assertEquals(1, graph.getEdges().size());
    }

    @Test
    void backwardTraversalFindsCrossUnitCallers() {
        GraphResult graph = engine.callGraphNeighborhood(ProcedureRef.of("AUDITLOG.cbl", "WRITE-ENTRY"), 2,
                Direction.BACKWARD);

        assertTrue(graph.node("CUSTUPD.cbl#PROCEDURE/MAIN-PARA").isPresent());
        GraphEdge call = graph.getEdges().get(0);
        assertEquals(EdgeKind.CALL, call.getKind());
        assertEquals("AUDITLOG.cbl#PROCEDURE/WRITE-ENTRY", call.getTo());
        assertFalse(graph.node("CUSTUPD.cbl#PROCEDURE/UPDATE-BALANCE").isPresent());
    }

    @Test
    void callToUnindexedProgramIsExternal() {
        CodeIndex alone = new CodeIndex();
        alone.commit(TestUtils.sampleModel("CUSTUPD.cbl"));

        GraphResult graph = new QueryEngine(alone)
                .callGraphNeighborhood(ProcedureRef.anyUnit("MAIN-PARA"), 1);

        assertEquals(GraphNodeKind.EXTERNAL, graph.node("program:AUDITLOG").orElseThrow().getKind());
    }

    @Test
    void unknownProcedureGivesAnEmptyGraph() {
        assertTrue(engine.callGraphNeighborhood(ProcedureRef.anyUnit("NO-SUCH-PARA"), 3).isEmpty());
    }

    @Test
    void excerptCollectsEdgesAndTouchedItems() {
        List<ProcedureExcerpt> excerpts = engine.excerpt(ProcedureRef.of("CUSTUPD.cbl", "UPDATE-BALANCE"));

        assertEquals(1, excerpts.size());
        ProcedureExcerpt excerpt = excerpts.get(0);
        assertEquals("CUSTUPD", excerpt.getProgramId());
        assertEquals(1, excerpt.getIncoming().size());
        assertTrue(excerpt.getDataItems().stream().anyMatch(i -> i.getName().equals("WS-AMOUNT")));
        assertEquals(2, excerpt.getDataItems().stream().filter(i -> i.getName().equals("BALANCE")).count());
    }

    @Test
    void excerptOfEntryParagraphListsCrossUnitCallers() {
        ProcedureExcerpt excerpt = engine.excerpt(ProcedureRef.anyUnit("WRITE-ENTRY")).get(0);

        assertEquals(1, excerpt.getIncoming().size());
        assertEquals(EdgeKind.CALL, excerpt.getIncoming().get(0).getKind());
    }

    @Test
    void excerptJsonIsStable() {
        ProcedureRef ref = ProcedureRef.of("CUSTUPD.cbl", "UPDATE-BALANCE");

        String json = engine.excerptJson(ref);

        assertEquals(json, engine.excerptJson(ref));
        assertTrue(json.contains("\"UPDATE-BALANCE\""));
    }
}
