package org.dxworks.cobolscope.query;

import org.dxworks.cobolscope.model.EdgeKind;
import org.dxworks.cobolscope.source.SourceRange;

import java.util.Objects;

public final class GraphEdge {

    private final String from;
    private final String to;
    private final EdgeKind kind;
    private final String thru;
    private final boolean dynamic;
    private final SourceRange range;

    GraphEdge(String from, String to, EdgeKind kind, String thru, boolean dynamic, SourceRange range) {
        this.from = from;
        this.to = to;
        this.kind = kind;
        this.thru = thru;
        this.dynamic = dynamic;
        this.range = range;
    }

    /**
     * Key of the source node.
     */
    public String getFrom() {
        return from;
    }

    /**
     * Key of the target node.
     */
    public String getTo() {
        return to;
    }

    public EdgeKind getKind() {
        return kind;
    }

    public String getThru() {
        return thru;
    }

    public boolean isDynamic() {
        return dynamic;
    }

    public SourceRange getRange() {
        return range;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GraphEdge)) return false;
        GraphEdge that = (GraphEdge) o;
        return dynamic == that.dynamic
                && from.equals(that.from)
                && to.equals(that.to)
                && kind == that.kind
                && Objects.equals(thru, that.thru)
                && Objects.equals(range, that.range);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, kind, thru, dynamic, range);
    }

    @Override
    public String toString() {
        return from + " -" + kind + "-> " + to;
    }
}
