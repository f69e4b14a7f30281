package org.dxworks.cobolscope.parser.ast;

import org.dxworks.cobolscope.source.SourceRange;

import java.util.Collections;
import java.util.List;

public class SentenceNode extends CobolNode {

    private final List<CobolNode> statements;

    public SentenceNode(String id, SourceRange range, List<CobolNode> statements) {
        super(id, null, range);
        this.statements = Collections.unmodifiableList(statements);
    }

    @Override
    public List<CobolNode> getChildren() {
        return statements;
    }

    @Override
    public <R> R accept(CobolNodeVisitor<R> visitor) {
        return visitor.visitSentence(this);
    }
}
