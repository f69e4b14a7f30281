package org.dxworks.cobolscope.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.dxworks.cobolscope.source.SourceRange;

import java.util.Objects;

/**
 * A directed control edge out of a procedure.
 *
 * <p>{@code targetId} is the id of the resolved procedure in the same unit. It stays null for
 * calls to other programs and for dangling or ambiguous targets; those edges are
 * {@link #isExternal() external}.</p>
 */
public final class Edge {

    private final String from;
    private final EdgeKind kind;
    private final String target;
    private final String targetId;
    private final String thru;
    private final String thruId;
    private final boolean dynamic;
    private final SourceRange range;

    @JsonCreator
    public Edge(@JsonProperty("from") String from,
                @JsonProperty("kind") EdgeKind kind,
                @JsonProperty("target") String target,
                @JsonProperty("targetId") String targetId,
                @JsonProperty("thru") String thru,
                @JsonProperty("thruId") String thruId,
                @JsonProperty("dynamic") boolean dynamic,
                @JsonProperty("range") SourceRange range) {
        this.from = Objects.requireNonNull(from, "from");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.target = target;
        this.targetId = targetId;
        this.thru = thru;
        this.thruId = thruId;
        this.dynamic = dynamic;
        this.range = range;
    }

    public String getFrom() {
        return from;
    }

    public EdgeKind getKind() {
        return kind;
    }

    /**
     * Target name as written (upper-cased): a procedure name, or a program name for CALL.
     */
    public String getTarget() {
        return target;
    }

    public String getTargetId() {
        return targetId;
    }

    /**
     * Last procedure of a {@code PERFORM ... THRU} range.
     */
    public String getThru() {
        return thru;
    }

    public String getThruId() {
        return thruId;
    }

    /**
     * A CALL through an identifier whose value could not be determined statically.
     */
    public boolean isDynamic() {
        return dynamic;
    }

    public SourceRange getRange() {
        return range;
    }

    @JsonIgnore
    public boolean isExternal() {
        return targetId == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Edge)) return false;
        Edge edge = (Edge) o;
        return dynamic == edge.dynamic
                && from.equals(edge.from)
                && kind == edge.kind
                && Objects.equals(target, edge.target)
                && Objects.equals(targetId, edge.targetId)
                && Objects.equals(thru, edge.thru)
                && Objects.equals(thruId, edge.thruId)
                && Objects.equals(range, edge.range);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, kind, target, targetId, thru, thruId, dynamic, range);
    }

    @Override
    public String toString() {
        return from + " -" + kind + "-> " + (targetId != null ? targetId : target)
                + (thru != null ? " THRU " + thru : "");
    }
}
