package org.dxworks.cobolscope.parser.ast;

import org.dxworks.cobolscope.source.SourceRange;

import java.util.Collections;
import java.util.List;

/**
 * A sentence of the identification or environment division kept as its words,
 * e.g. a FILE-CONTROL {@code SELECT} entry.
 */
public class EntryNode extends CobolNode {

    private final List<Word> words;

    public EntryNode(String id, SourceRange range, List<Word> words) {
        super(id, null, range);
        this.words = Collections.unmodifiableList(words);
    }

    public List<Word> getWords() {
        return words;
    }

    @Override
    public List<CobolNode> getChildren() {
        return List.of();
    }

    @Override
    public <R> R accept(CobolNodeVisitor<R> visitor) {
        return visitor.visitEntry(this);
    }
}
