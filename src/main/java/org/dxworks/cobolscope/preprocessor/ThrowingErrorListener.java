package org.dxworks.cobolscope.preprocessor;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.dxworks.cobolscope.exception.MalformedDirectiveException;

/**
 * Turns the first ANTLR syntax error into a {@link MalformedDirectiveException}; a directive is
 * either understood completely or left inert.
 */
final class ThrowingErrorListener extends BaseErrorListener {

    static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                            int line, int charPositionInLine, String msg,
                            RecognitionException e) {
        throw new MalformedDirectiveException("col " + (charPositionInLine + 1) + ": " + msg);
    }
}
