package org.dxworks.cobolscope.preprocessor;

import java.util.Objects;

/**
 * One side of a REPLACING / REPLACE clause: pseudo-text ({@code ==...==}), a literal or a word.
 */
public final class ReplacementOperand {

    public enum Kind {
        PSEUDO_TEXT,
        LITERAL,
        WORD
    }

    private final Kind kind;
    private final String text;

    public ReplacementOperand(Kind kind, String text) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = Objects.requireNonNull(text, "text");
    }

    /**
     * Builds an operand from its source spelling; {@code ==X==} becomes pseudo-text {@code X}.
     */
    public static ReplacementOperand parse(String raw) {
        if (raw.length() >= 4 && raw.startsWith("==") && raw.endsWith("==")) {
            return new ReplacementOperand(Kind.PSEUDO_TEXT, raw.substring(2, raw.length() - 2).trim());
        }
        if (!raw.isEmpty() && (raw.charAt(0) == '"' || raw.charAt(0) == '\'')) {
            return new ReplacementOperand(Kind.LITERAL, raw);
        }
        return new ReplacementOperand(Kind.WORD, raw);
    }

    public Kind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public boolean isLiteral() {
        return kind == Kind.LITERAL;
    }

    @Override
    public String toString() {
        return kind == Kind.PSEUDO_TEXT ? "==" + text + "==" : text;
    }
}
