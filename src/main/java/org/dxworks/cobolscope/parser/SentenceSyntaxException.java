package org.dxworks.cobolscope.parser;

import org.dxworks.cobolscope.exception.CobolScopeException;
import org.dxworks.cobolscope.lexer.Token;

/**
 * Raised while structuring one sentence; the parser catches it and keeps the sentence as an
 * opaque statement.
 */
class SentenceSyntaxException extends CobolScopeException {

    private final transient Token token;

    SentenceSyntaxException(String message, Token token) {
        super(message);
        this.token = token;
    }

    Token getToken() {
        return token;
    }
}
