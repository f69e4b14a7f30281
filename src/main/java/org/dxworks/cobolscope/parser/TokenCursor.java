package org.dxworks.cobolscope.parser;

import org.dxworks.cobolscope.lexer.Token;
import org.dxworks.cobolscope.source.SourceRange;

import java.util.List;

/**
 * Forward-only position over a token list.
 */
final class TokenCursor {

    private final List<Token> tokens;
    private int pos;

    TokenCursor(List<Token> tokens) {
        this.tokens = tokens;
    }

    boolean atEnd() {
        return pos >= tokens.size();
    }

    Token peek() {
        return peek(0);
    }

    Token peek(int ahead) {
        int i = pos + ahead;
        return i < tokens.size() ? tokens.get(i) : null;
    }

    boolean peekIs(String word) {
        Token t = peek();
        return t != null && t.is(word);
    }

    boolean peekIs(int ahead, String word) {
        Token t = peek(ahead);
        return t != null && t.is(word);
    }

    Token next() {
        if (atEnd()) {
            throw new SentenceSyntaxException("Unexpected end of sentence",
                    tokens.isEmpty() ? null : tokens.get(tokens.size() - 1));
        }
        return tokens.get(pos++);
    }

    void skip(int count) {
        for (int i = 0; i < count; i++) {
            next();
        }
    }

    Token previous() {
        return pos > 0 ? tokens.get(pos - 1) : null;
    }

    int position() {
        return pos;
    }

    SourceRange rangeFrom(Token first) {
        Token last = previous();
        return SourceRange.span(first.getRange(), last != null ? last.getRange() : null);
    }
}
