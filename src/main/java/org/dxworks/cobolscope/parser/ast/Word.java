package org.dxworks.cobolscope.parser.ast;

import org.dxworks.cobolscope.lexer.Token;
import org.dxworks.cobolscope.lexer.TokenKind;
import org.dxworks.cobolscope.source.SourceRange;

import java.util.Locale;

/**
 * A token as kept in the tree: text, kind and where it came from.
 */
public final class Word {

    private final String text;
    private final TokenKind kind;
    private final SourceRange range;
    private final boolean areaA;
    private final boolean synthetic;

    public Word(String text, TokenKind kind, SourceRange range, boolean areaA, boolean synthetic) {
        this.text = text;
        this.kind = kind;
        this.range = range;
        this.areaA = areaA;
        this.synthetic = synthetic;
    }

    public static Word of(Token token) {
        return new Word(token.getText(), token.getKind(), token.getRange(), token.isAreaA(), token.isSynthetic());
    }

    public String getText() {
        return text;
    }

    public String upper() {
        return text.toUpperCase(Locale.ROOT);
    }

    public TokenKind getKind() {
        return kind;
    }

    public SourceRange getRange() {
        return range;
    }

    public boolean isAreaA() {
        return areaA;
    }

    public boolean isSynthetic() {
        return synthetic;
    }

    public boolean is(String word) {
        return (kind == TokenKind.KEYWORD || kind == TokenKind.IDENTIFIER) && text.equalsIgnoreCase(word);
    }

    public boolean isIdentifier() {
        return kind == TokenKind.IDENTIFIER;
    }

    public boolean isSeparator(char c) {
        return kind == TokenKind.SEPARATOR && text.length() == 1 && text.charAt(0) == c;
    }

    /**
     * Literal value without quotes or prefix for string literals, the text otherwise.
     */
    public String literalValue() {
        if (kind != TokenKind.STRING_LITERAL) {
            return text;
        }
        int quote = 0;
        while (quote < text.length() && text.charAt(quote) != '"' && text.charAt(quote) != '\'') {
            quote++;
        }
        if (quote >= text.length()) {
            return text;
        }
        char q = text.charAt(quote);
        int end = text.lastIndexOf(q);
        String body = end > quote ? text.substring(quote + 1, end) : text.substring(quote + 1);
        return body.replace(String.valueOf(q) + q, String.valueOf(q));
    }

    @Override
    public String toString() {
        return text;
    }
}
