package org.dxworks.cobolscope.lexer;

public enum TokenKind {
    KEYWORD,
    IDENTIFIER,
    STRING_LITERAL,
    NUMERIC_LITERAL,
    PICTURE_STRING,
    OPERATOR,
    SEPARATOR,
    COMMENT,
    CONTINUATION_MARKER;

    public boolean isLiteral() {
        return this == STRING_LITERAL || this == NUMERIC_LITERAL;
    }

    /**
     * Tokens the parser never sees.
     */
    public boolean isTrivia() {
        return this == COMMENT || this == CONTINUATION_MARKER;
    }
}
