package org.dxworks.cobolscope.parser.ast;

import org.dxworks.cobolscope.source.SourceRange;

import java.util.List;

/**
 * Base of the parse tree. Every node carries a stable identifier derived from its enclosing
 * scope and ordinal position, so re-parsing identical text yields identical identifiers.
 */
public abstract class CobolNode {

    private final String id;
    private final String name;
    private final SourceRange range;

    protected CobolNode(String id, String name, SourceRange range) {
        this.id = id;
        this.name = name;
        this.range = range;
    }

    public String getId() {
        return id;
    }

    /**
     * Upper-cased name, or null for anonymous nodes.
     */
    public String getName() {
        return name;
    }

    public SourceRange getRange() {
        return range;
    }

    public abstract List<? extends CobolNode> getChildren();

    public abstract <R> R accept(CobolNodeVisitor<R> visitor);
}
