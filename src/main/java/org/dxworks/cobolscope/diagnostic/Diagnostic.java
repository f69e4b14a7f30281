package org.dxworks.cobolscope.diagnostic;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.dxworks.cobolscope.source.SourceRange;

import java.util.Objects;

public final class Diagnostic {

    private final DiagnosticKind kind;
    private final String message;
    private final SourceRange range;

    @JsonCreator
    public Diagnostic(@JsonProperty("kind") DiagnosticKind kind,
                      @JsonProperty("message") String message,
                      @JsonProperty("range") SourceRange range) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = message;
        this.range = range;
    }

    public DiagnosticKind getKind() {
        return kind;
    }

    public DiagnosticCategory getCategory() {
        return kind.getCategory();
    }

    public String getMessage() {
        return message;
    }

    public SourceRange getRange() {
        return range;
    }

    @Override
    public String toString() {
        return kind + (range != null ? " at " + range.key() : "") + ": " + message;
    }
}
