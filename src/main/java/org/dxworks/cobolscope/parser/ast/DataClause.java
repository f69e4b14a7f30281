package org.dxworks.cobolscope.parser.ast;

import java.util.Collections;
import java.util.List;

/**
 * A data description clause: its keyword (PIC, USAGE, VALUE, OCCURS, REDEFINES, ...) and the
 * words that follow it up to the next clause.
 */
public final class DataClause {

    private final String keyword;
    private final Word keywordWord;
    private final List<Word> operands;

    public DataClause(String keyword, Word keywordWord, List<Word> operands) {
        this.keyword = keyword;
        this.keywordWord = keywordWord;
        this.operands = Collections.unmodifiableList(operands);
    }

    public String getKeyword() {
        return keyword;
    }

    public Word getKeywordWord() {
        return keywordWord;
    }

    public List<Word> getOperands() {
        return operands;
    }

    @Override
    public String toString() {
        return keyword + " " + operands;
    }
}
