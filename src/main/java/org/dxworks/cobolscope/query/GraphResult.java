package org.dxworks.cobolscope.query;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Nodes in breadth-first discovery order, each at most once, and the edges traversed between them.
 */
public final class GraphResult {

    private final List<GraphNode> nodes;
    private final List<GraphEdge> edges;

    GraphResult(List<GraphNode> nodes, List<GraphEdge> edges) {
        this.nodes = Collections.unmodifiableList(nodes);
        this.edges = Collections.unmodifiableList(edges);
    }

    public List<GraphNode> getNodes() {
        return nodes;
    }

    public List<GraphEdge> getEdges() {
        return edges;
    }

    public Optional<GraphNode> node(String key) {
        return nodes.stream().filter(n -> n.getKey().equals(key)).findFirst();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
