package org.dxworks.cobolscope.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.dxworks.cobolscope.source.SourceRange;

/**
 * One appearance of a user-defined name. {@code nodeId} is the structure node containing it.
 */
public final class SymbolOccurrence {

    private final String text;
    private final SourceRange range;
    private final SymbolRole role;
    private final SymbolKind symbolKind;
    private final String nodeId;

    @JsonCreator
    public SymbolOccurrence(@JsonProperty("text") String text,
                            @JsonProperty("range") SourceRange range,
                            @JsonProperty("role") SymbolRole role,
                            @JsonProperty("symbolKind") SymbolKind symbolKind,
                            @JsonProperty("nodeId") String nodeId) {
        this.text = text;
        this.range = range;
        this.role = role;
        this.symbolKind = symbolKind;
        this.nodeId = nodeId;
    }

    /**
     * Upper-cased name.
     */
    public String getText() {
        return text;
    }

    public SourceRange getRange() {
        return range;
    }

    public SymbolRole getRole() {
        return role;
    }

    public SymbolKind getSymbolKind() {
        return symbolKind;
    }

    public String getNodeId() {
        return nodeId;
    }

    @Override
    public String toString() {
        return role + " " + symbolKind + " " + text + " at " + range;
    }
}
