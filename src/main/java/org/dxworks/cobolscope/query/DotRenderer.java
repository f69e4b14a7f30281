package org.dxworks.cobolscope.query;

/**
 * Renders a {@link GraphResult} as a Graphviz DOT digraph for presentation layers.
 */
public final class DotRenderer {

    private DotRenderer() {
    }

    public static String render(GraphResult graph) {
        return render(graph, "callgraph");
    }

    public static String render(GraphResult graph, String name) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph ").append(quote(name)).append(" {\n");
        sb.append("  rankdir=LR;\n");
        sb.append("  node [shape=box, fontname=\"Helvetica\"];\n");
        for (GraphNode node : graph.getNodes()) {
            sb.append("  ").append(quote(node.getKey()))
                    .append(" [label=").append(quote(label(node))).append(style(node)).append("];\n");
        }
        for (GraphEdge edge : graph.getEdges()) {
            sb.append("  ").append(quote(edge.getFrom())).append(" -> ").append(quote(edge.getTo()))
                    .append(" [label=").append(quote(edgeLabel(edge))).append(edgeStyle(edge)).append("];\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    private static String label(GraphNode node) {
        if (node.getKind() == GraphNodeKind.PROCEDURE && node.getUnitId() != null) {
            return node.getDisplayName() + "\n" + node.getUnitId();
        }
        return node.getDisplayName();
    }

    private static String style(GraphNode node) {
        switch (node.getKind()) {
            case EXTERNAL:
                return ", shape=ellipse, style=dashed";
            case PROGRAM:
                return ", shape=ellipse";
            case UNRESOLVED:
                return ", style=dashed, color=red";
            default:
                return "";
        }
    }

    private static String edgeLabel(GraphEdge edge) {
        String label = edge.getKind().name().replace('_', ' ');
        return edge.getThru() != null ? label + " THRU " + edge.getThru() : label;
    }

    private static String edgeStyle(GraphEdge edge) {
        switch (edge.getKind()) {
            case CONTAINS:
                return ", style=dotted, arrowhead=none";
            case GO_TO:
                return ", style=bold";
            case CALL:
                return edge.isDynamic() ? ", style=dashed" : "";
            default:
                return "";
        }
    }

    private static String quote(String text) {
        return '"' + text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + '"';
    }
}
