package org.dxworks.cobolscope.parser.ast;

import org.dxworks.cobolscope.source.SourceRange;

import java.util.Collections;
import java.util.List;

/**
 * An FD or SD entry with the record descriptions that follow it.
 */
public class FileDescriptionNode extends CobolNode {

    private final String indicator;
    private final Word nameWord;
    private final List<Word> clauseWords;
    private final List<DataEntryNode> records;

    public FileDescriptionNode(String id, String name, SourceRange range, String indicator, Word nameWord,
                               List<Word> clauseWords, List<DataEntryNode> records) {
        super(id, name, range);
        this.indicator = indicator;
        this.nameWord = nameWord;
        this.clauseWords = Collections.unmodifiableList(clauseWords);
        this.records = Collections.unmodifiableList(records);
    }

    /**
     * {@code FD} or {@code SD}.
     */
    public String getIndicator() {
        return indicator;
    }

    public Word getNameWord() {
        return nameWord;
    }

    public List<Word> getClauseWords() {
        return clauseWords;
    }

    public List<DataEntryNode> getRecords() {
        return records;
    }

    @Override
    public List<DataEntryNode> getChildren() {
        return records;
    }

    @Override
    public <R> R accept(CobolNodeVisitor<R> visitor) {
        return visitor.visitFileDescription(this);
    }
}
