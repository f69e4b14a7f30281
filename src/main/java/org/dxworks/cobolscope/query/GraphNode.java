package org.dxworks.cobolscope.query;

import org.dxworks.cobolscope.source.SourceRange;

import java.util.Objects;

/**
 * A vertex of a call-graph query result. {@code key} is unique within the result and stable
 * across runs: {@code unit#procedureId} for procedures, {@code program:NAME} and
 * {@code unresolved:unit#NAME} otherwise.
 */
public final class GraphNode {

    private final String key;
    private final GraphNodeKind kind;
    private final String unitId;
    private final String procedureId;
    private final String displayName;
    private final SourceRange range;
    private final int depth;

    GraphNode(String key, GraphNodeKind kind, String unitId, String procedureId, String displayName,
              SourceRange range, int depth) {
        this.key = key;
        this.kind = kind;
        this.unitId = unitId;
        this.procedureId = procedureId;
        this.displayName = displayName;
        this.range = range;
        this.depth = depth;
    }

    public String getKey() {
        return key;
    }

    public GraphNodeKind getKind() {
        return kind;
    }

    public String getUnitId() {
        return unitId;
    }

    public String getProcedureId() {
        return procedureId;
    }

    public String getDisplayName() {
        return displayName;
    }

    public SourceRange getRange() {
        return range;
    }

    /**
     * Number of edges between this node and the nearest starting node.
     */
    public int getDepth() {
        return depth;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GraphNode)) return false;
        return key.equals(((GraphNode) o).key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key);
    }

    @Override
    public String toString() {
        return key;
    }
}
