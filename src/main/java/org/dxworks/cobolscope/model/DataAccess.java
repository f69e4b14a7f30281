package org.dxworks.cobolscope.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.dxworks.cobolscope.source.SourceRange;

/**
 * A read or write of a data name by a statement inside a procedure.
 */
public final class DataAccess {

    private final String name;
    private final Integer itemIndex;
    private final AccessKind kind;
    private final String procedureId;
    private final String verb;
    private final SourceRange range;

    @JsonCreator
    public DataAccess(@JsonProperty("name") String name,
                      @JsonProperty("itemIndex") Integer itemIndex,
                      @JsonProperty("kind") AccessKind kind,
                      @JsonProperty("procedureId") String procedureId,
                      @JsonProperty("verb") String verb,
                      @JsonProperty("range") SourceRange range) {
        this.name = name;
        this.itemIndex = itemIndex;
        this.kind = kind;
        this.procedureId = procedureId;
        this.verb = verb;
        this.range = range;
    }

    public String getName() {
        return name;
    }

    /**
     * Index of the accessed item when the name resolves to exactly one item, null otherwise.
     */
    public Integer getItemIndex() {
        return itemIndex;
    }

    public AccessKind getKind() {
        return kind;
    }

    public String getProcedureId() {
        return procedureId;
    }

    public String getVerb() {
        return verb;
    }

    public SourceRange getRange() {
        return range;
    }

    @Override
    public String toString() {
        return kind + " " + name + " by " + verb + " in " + procedureId;
    }
}
