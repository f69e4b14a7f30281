package org.dxworks.cobolscope.parser.ast;

import org.dxworks.cobolscope.source.SourceRange;

import java.util.Collections;
import java.util.List;

public class ParagraphNode extends CobolNode {

    private final Word nameWord;
    private final List<SentenceNode> sentences;

    public ParagraphNode(String id, String name, Word nameWord, SourceRange range, List<SentenceNode> sentences) {
        super(id, name, range);
        this.nameWord = nameWord;
        this.sentences = Collections.unmodifiableList(sentences);
    }

    public Word getNameWord() {
        return nameWord;
    }

    public boolean isAnonymous() {
        return getName() == null;
    }

    public List<SentenceNode> getSentences() {
        return sentences;
    }

    @Override
    public List<SentenceNode> getChildren() {
        return sentences;
    }

    @Override
    public <R> R accept(CobolNodeVisitor<R> visitor) {
        return visitor.visitParagraph(this);
    }
}
