package org.dxworks.cobolscope.parser.ast;

import org.dxworks.cobolscope.source.SourceRange;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Text the parser could not structure, kept verbatim so nothing is lost.
 */
public class OpaqueStatementNode extends CobolNode {

    private final List<Word> words;
    private final String reason;

    public OpaqueStatementNode(String id, SourceRange range, List<Word> words, String reason) {
        super(id, null, range);
        this.words = Collections.unmodifiableList(words);
        this.reason = reason;
    }

    public List<Word> getWords() {
        return words;
    }

    public String getReason() {
        return reason;
    }

    public String getText() {
        return words.stream().map(Word::getText).collect(Collectors.joining(" "));
    }

    @Override
    public List<CobolNode> getChildren() {
        return List.of();
    }

    @Override
    public <R> R accept(CobolNodeVisitor<R> visitor) {
        return visitor.visitOpaqueStatement(this);
    }
}
