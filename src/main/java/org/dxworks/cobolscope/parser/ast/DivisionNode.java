package org.dxworks.cobolscope.parser.ast;

import org.dxworks.cobolscope.source.SourceRange;

import java.util.Collections;
import java.util.List;

public class DivisionNode extends CobolNode {

    private final DivisionKind kind;
    private final List<Word> headerWords;
    private final List<CobolNode> children;

    public DivisionNode(DivisionKind kind, SourceRange range, List<Word> headerWords, List<CobolNode> children) {
        super(kind.name(), kind.name(), range);
        this.kind = kind;
        this.headerWords = Collections.unmodifiableList(headerWords);
        this.children = Collections.unmodifiableList(children);
    }

    public DivisionKind getKind() {
        return kind;
    }

    /**
     * Words between {@code DIVISION} and the header period, e.g. {@code USING A B RETURNING C}.
     */
    public List<Word> getHeaderWords() {
        return headerWords;
    }

    @Override
    public List<CobolNode> getChildren() {
        return children;
    }

    @Override
    public <R> R accept(CobolNodeVisitor<R> visitor) {
        return visitor.visitDivision(this);
    }
}
