package org.dxworks.cobolscope.lexer;

import org.dxworks.cobolscope.source.SourceRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * A lexical token. A token continued onto following lines has one segment per physical line;
 * its text is the concatenation of the segments.
 */
public final class Token {

    private final TokenKind kind;
    private final String text;
    private final List<SourceRange> segments;
    private final int line;
    private final boolean areaA;
    private final boolean synthetic;

    public Token(TokenKind kind, String text, List<SourceRange> segments, int line, boolean areaA, boolean synthetic) {
        this.kind = kind;
        this.text = text;
        this.segments = Collections.unmodifiableList(new ArrayList<>(segments));
        this.line = line;
        this.areaA = areaA;
        this.synthetic = synthetic;
    }

    public TokenKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public String upper() {
        return text.toUpperCase(Locale.ROOT);
    }

    public boolean is(String word) {
        return (kind == TokenKind.KEYWORD || kind == TokenKind.IDENTIFIER) && text.equalsIgnoreCase(word);
    }

    public boolean isSeparator(char c) {
        return kind == TokenKind.SEPARATOR && text.length() == 1 && text.charAt(0) == c;
    }

    public boolean isPeriod() {
        return isSeparator('.');
    }

    public boolean isWord() {
        return kind == TokenKind.KEYWORD || kind == TokenKind.IDENTIFIER;
    }

    public SourceRange getRange() {
        return SourceRange.span(segments.get(0), segments.get(segments.size() - 1));
    }

    public List<SourceRange> getSegments() {
        return segments;
    }

    /**
     * Index of the expanded line the token starts on.
     */
    public int getLine() {
        return line;
    }

    /**
     * True when the token starts in Area A (columns 8-11).
     */
    public boolean isAreaA() {
        return areaA;
    }

    /**
     * True when the token comes from text rewritten by REPLACE / REPLACING, so its columns do not
     * address the physical line.
     */
    public boolean isSynthetic() {
        return synthetic;
    }

    Token continuedWith(String more, SourceRange segment) {
        List<SourceRange> all = new ArrayList<>(segments);
        all.add(segment);
        return new Token(kind, text + more, all, line, areaA, synthetic);
    }

    Token withKind(TokenKind newKind) {
        return new Token(newKind, text, segments, line, areaA, synthetic);
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")@" + segments.get(0).key();
    }
}
