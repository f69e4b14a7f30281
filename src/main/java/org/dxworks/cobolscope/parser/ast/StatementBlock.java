package org.dxworks.cobolscope.parser.ast;

import java.util.Collections;
import java.util.List;

/**
 * A labelled group of nested statements: the THEN / ELSE branches of an IF, the WHEN branches of
 * an EVALUATE or SEARCH, an inline PERFORM body, or a conditional phrase such as AT END.
 * For WHEN branches the words hold the selection objects.
 */
public final class StatementBlock {

    private final String label;
    private final List<Word> words;
    private final List<CobolNode> statements;

    public StatementBlock(String label, List<Word> words, List<CobolNode> statements) {
        this.label = label;
        this.words = Collections.unmodifiableList(words);
        this.statements = Collections.unmodifiableList(statements);
    }

    public String getLabel() {
        return label;
    }

    public List<Word> getWords() {
        return words;
    }

    public List<CobolNode> getStatements() {
        return statements;
    }
}
