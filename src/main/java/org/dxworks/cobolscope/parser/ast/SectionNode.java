package org.dxworks.cobolscope.parser.ast;

import org.dxworks.cobolscope.source.SourceRange;

import java.util.Collections;
import java.util.List;

public class SectionNode extends CobolNode {

    private final Word nameWord;
    private final boolean declarative;
    private final List<CobolNode> children;

    public SectionNode(String id, String name, Word nameWord, boolean declarative, SourceRange range,
                       List<CobolNode> children) {
        super(id, name, range);
        this.nameWord = nameWord;
        this.declarative = declarative;
        this.children = Collections.unmodifiableList(children);
    }

    public Word getNameWord() {
        return nameWord;
    }

    public boolean isDeclarative() {
        return declarative;
    }

    @Override
    public List<CobolNode> getChildren() {
        return children;
    }

    @Override
    public <R> R accept(CobolNodeVisitor<R> visitor) {
        return visitor.visitSection(this);
    }
}
