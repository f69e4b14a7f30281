package org.dxworks.cobolscope.builder;

import org.dxworks.cobolscope.TestUtils;
import org.dxworks.cobolscope.diagnostic.DiagnosticCollector;
import org.dxworks.cobolscope.diagnostic.DiagnosticKind;
import org.dxworks.cobolscope.dialect.DialectOptions;
import org.dxworks.cobolscope.ingest.UnitPipeline;
import org.dxworks.cobolscope.model.AccessKind;
import org.dxworks.cobolscope.model.Edge;
import org.dxworks.cobolscope.model.EdgeKind;
import org.dxworks.cobolscope.model.ProcedureNode;
import org.dxworks.cobolscope.model.ProgramModel;
import org.dxworks.cobolscope.model.SymbolOccurrence;
import org.dxworks.cobolscope.preprocessor.CopybookResolver;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ProcedureDivisionPassTest {

    private final DiagnosticCollector diagnostics = new DiagnosticCollector();

    private ProgramModel build(String... lines) {
        return new UnitPipeline(CopybookResolver.none(), DialectOptions.defaults())
                .run(TestUtils.program("FLOW.cbl", lines), diagnostics);
    }

    private static List<EdgeKind> kinds(ProcedureNode procedure) {
        return procedure.getEdges().stream().map(Edge::getKind).collect(Collectors.toList());
    }

    @Test
    void performThruAndGoToDependingOn() {
        ProgramModel model = build(
                "IDENTIFICATION DIVISION.",
                "PROGRAM-ID. FLOW.",
                "DATA DIVISION.",
                "WORKING-STORAGE SECTION.",
                "01  WS-CHOICE PIC 9.",
                "PROCEDURE DIVISION.",
                "MAIN-PARA.",
                "    PERFORM STEP-1 THRU STEP-3.",
                "    GO TO STEP-1 STEP-2 STEP-3 DEPENDING ON WS-CHOICE.",
                "    GO TO FINISH.",
                "STEP-1.",
                "    DISPLAY 'ONE'.",
                "STEP-2.",
                "    DISPLAY 'TWO'.",
                "STEP-3.",
                "    DISPLAY 'THREE'.",
                "FINISH.",
                "    STOP RUN.");

        ProcedureNode main = model.procedure("PROCEDURE/MAIN-PARA").orElseThrow();
        List<Edge> edges = main.getEdges();
        assertEquals(List.of(EdgeKind.PERFORM, EdgeKind.GO_TO, EdgeKind.GO_TO, EdgeKind.GO_TO, EdgeKind.GO_TO),
                kinds(main));

        Edge perform = edges.get(0);
        assertEquals("PROCEDURE/STEP-1", perform.getTargetId());
        assertEquals("STEP-3", perform.getThru());
        assertEquals("PROCEDURE/STEP-3", perform.getThruId());

        assertEquals(List.of("PROCEDURE/STEP-1", "PROCEDURE/STEP-2", "PROCEDURE/STEP-3", "PROCEDURE/FINISH"),
                edges.subList(1, 5).stream().map(Edge::getTargetId).collect(Collectors.toList()));
        assertTrue(main.getDataAccesses().stream().anyMatch(a -> a.getName().equals("WS-CHOICE")
                && a.getKind() == AccessKind.READ && a.getVerb().equals("GO")));
        assertTrue(diagnostics.ofKind(DiagnosticKind.DANGLING_TARGET).isEmpty());
    }

    @Test
    void evaluateBranchesContributeEdgesAndReads() {
        ProgramModel model = build(
                "IDENTIFICATION DIVISION.",
                "PROGRAM-ID. FLOW.",
                "DATA DIVISION.",
                "WORKING-STORAGE SECTION.",
                "01  WS-CHOICE PIC 9.",
                "PROCEDURE DIVISION.",
                "MAIN-PARA.",
                "    EVALUATE WS-CHOICE",
                "        WHEN 1",
                "            PERFORM STEP-1",
                "        WHEN OTHER",
                "            PERFORM STEP-2",
                "    END-EVALUATE.",
                "    STOP RUN.",
                "STEP-1.",
                "    DISPLAY 'ONE'.",
                "STEP-2.",
                "    DISPLAY 'TWO'.");

        ProcedureNode main = model.procedure("PROCEDURE/MAIN-PARA").orElseThrow();
        assertEquals(List.of("PROCEDURE/STEP-1", "PROCEDURE/STEP-2"),
                main.getEdges().stream().map(Edge::getTargetId).collect(Collectors.toList()));
        assertTrue(main.getDataAccesses().stream().anyMatch(a -> a.getName().equals("WS-CHOICE")
                && a.getKind() == AccessKind.READ && a.getVerb().equals("EVALUATE")));
        assertTrue(model.getMetrics().getDecisionPoints() >= 2);
    }

    @Test
    void anonymousDuplicateAndNestedStatementIdsAreStable() {
        String[] lines = {
                "IDENTIFICATION DIVISION.",
                "PROGRAM-ID. FLOW.",
                "DATA DIVISION.",
                "WORKING-STORAGE SECTION.",
                "01  WS-N PIC 9(4).",
                "PROCEDURE DIVISION.",
                "    DISPLAY 'START'.",
                "MAIN-PARA.",
                "    PERFORM 3 TIMES",
                "        ADD 1 TO WS-N",
                "    END-PERFORM.",
                "DUP-PARA.",
                "    DISPLAY 'FIRST'.",
                "DUP-PARA.",
                "    DISPLAY 'SECOND'."};

        ProgramModel model = build(lines);

        assertEquals(List.of("PROCEDURE/#p1", "PROCEDURE/MAIN-PARA", "PROCEDURE/DUP-PARA", "PROCEDURE/DUP-PARA~2"),
                model.getProcedures().stream().map(ProcedureNode::getId).collect(Collectors.toList()));
        assertNull(model.getProcedures().get(0).getName());
        List<String> counterNodes = model.getSymbols().stream()
                .filter(s -> s.getText().equals("WS-N") && s.getNodeId().startsWith("PROCEDURE/"))
                .map(SymbolOccurrence::getNodeId)
                .collect(Collectors.toList());
        assertEquals(List.of("PROCEDURE/MAIN-PARA/s1/1.1"), counterNodes);
        assertTrue(model.procedure("PROCEDURE/MAIN-PARA").orElseThrow().getDataAccesses().stream()
                .anyMatch(a -> a.getName().equals("WS-N") && a.getKind() == AccessKind.WRITE));

        ProgramModel again = build(lines);
        assertEquals(model.getProcedures().stream().map(ProcedureNode::getId).collect(Collectors.toList()),
                again.getProcedures().stream().map(ProcedureNode::getId).collect(Collectors.toList()));
        assertEquals(model.getSymbols().stream().map(SymbolOccurrence::getNodeId).collect(Collectors.toList()),
                again.getSymbols().stream().map(SymbolOccurrence::getNodeId).collect(Collectors.toList()));
    }

    @Test
    void unqualifiedDuplicateTargetIsAmbiguous() {
        ProgramModel model = build(
                "IDENTIFICATION DIVISION.",
                "PROGRAM-ID. FLOW.",
                "PROCEDURE DIVISION.",
                "MAIN-PARA.",
                "    PERFORM DUP-PARA.",
                "    STOP RUN.",
                "DUP-PARA.",
                "    DISPLAY 'FIRST'.",
                "DUP-PARA.",
                "    DISPLAY 'SECOND'.");

        Edge edge = model.procedure("PROCEDURE/MAIN-PARA").orElseThrow().getEdges().get(0);
        assertEquals("DUP-PARA", edge.getTarget());
        assertNull(edge.getTargetId());
        assertEquals(1, diagnostics.ofKind(DiagnosticKind.AMBIGUOUS_TARGET).size());
        assertTrue(diagnostics.ofKind(DiagnosticKind.DANGLING_TARGET).isEmpty());
    }

    @Test
    void qualifiedPerformPicksTheParagraphInThatSection() {
        ProgramModel model = build(
                "IDENTIFICATION DIVISION.",
                "PROGRAM-ID. FLOW.",
                "PROCEDURE DIVISION.",
                "MAIN-SEC SECTION.",
                "MAIN-PARA.",
                "    PERFORM WORK-PARA OF SEC-B.",
                "    STOP RUN.",
                "SEC-A SECTION.",
                "WORK-PARA.",
                "    DISPLAY 'A'.",
                "SEC-B SECTION.",
                "WORK-PARA.",
                "    DISPLAY 'B'.");

        Edge edge = model.procedure("PROCEDURE/MAIN-SEC/MAIN-PARA").orElseThrow().getEdges().get(0);
        assertEquals("PROCEDURE/SEC-B/WORK-PARA", edge.getTargetId());
        assertTrue(diagnostics.ofKind(DiagnosticKind.AMBIGUOUS_TARGET).isEmpty());
    }

    @Test
    void cicsLinkAndXctlBecomeCalls() {
        ProgramModel model = build(
                "IDENTIFICATION DIVISION.",
                "PROGRAM-ID. FLOW.",
                "DATA DIVISION.",
                "WORKING-STORAGE SECTION.",
                "01  WS-NEXT PIC X(8) VALUE 'MENUPGM'.",
                "PROCEDURE DIVISION.",
                "MAIN-PARA.",
                "    EXEC CICS LINK PROGRAM('ACCTINQ') END-EXEC.",
                "    EXEC CICS XCTL PROGRAM(WS-NEXT) END-EXEC.");

        List<Edge> calls = model.procedure("PROCEDURE/MAIN-PARA").orElseThrow().getEdges();
        assertEquals(List.of(EdgeKind.CALL, EdgeKind.CALL), calls.stream().map(Edge::getKind).collect(Collectors.toList()));
        assertEquals("ACCTINQ", calls.get(0).getTarget());
        assertFalse(calls.get(0).isDynamic());
        assertEquals("MENUPGM", calls.get(1).getTarget());
        assertTrue(calls.get(1).isDynamic());
        assertEquals(List.of("CICS"), model.getExecKinds());
    }
}
