package org.dxworks.cobolscope.query;

import org.approvaltests.Approvals;
import org.dxworks.cobolscope.TestUtils;
import org.dxworks.cobolscope.index.CodeIndex;
import org.dxworks.cobolscope.model.EdgeKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class DotRendererApprovalTest {

    @Test
    void render_NodeAndEdgeStyles() {
        String main = "U.cbl#PROCEDURE/MAIN";
        GraphResult graph = new GraphResult(
                List.of(new GraphNode(main, GraphNodeKind.PROCEDURE, "U.cbl", "PROCEDURE/MAIN", "MAIN", null, 0),
                        new GraphNode("unresolved:U.cbl#GONE", GraphNodeKind.UNRESOLVED, "U.cbl", null, "GONE",
                                null, 1),
                        new GraphNode("program:EXT", GraphNodeKind.EXTERNAL, null, null, "EXT", null, 1)),
                List.of(new GraphEdge(main, "unresolved:U.cbl#GONE", EdgeKind.PERFORM, "GONE-EXIT", false, null),
                        new GraphEdge(main, "program:EXT", EdgeKind.CALL, null, true, null),
                        new GraphEdge(main, main, EdgeKind.GO_TO, null, false, null)));

        Approvals.verify(DotRenderer.render(graph));
    }

    @Test
    void render_QueriedNeighborhood() {
        CodeIndex index = new CodeIndex();
        index.commit(TestUtils.sampleModel("LOOPER.cbl"));
        GraphResult graph = new QueryEngine(index).callGraphNeighborhood(ProcedureRef.anyUnit("PARA-A"), 5);

        Approvals.verify(DotRenderer.render(graph, "LOOPER"));
    }

    @Test
    void quotesAreEscaped() {
        GraphResult graph = new GraphResult(
                List.of(new GraphNode("program:\"Q\"", GraphNodeKind.PROGRAM, "P.cbl", null, "\"Q\"", null, 0)),
                List.of());

        assertEquals("digraph \"callgraph\" {\n"
                + "  rankdir=LR;\n"
                + "  node [shape=box, fontname=\"Helvetica\"];\n"
                + "  \"program:\\\"Q\\\"\" [label=\"\\\"Q\\\"\", shape=ellipse];\n"
                + "}\n", DotRenderer.render(graph));
    }
}
