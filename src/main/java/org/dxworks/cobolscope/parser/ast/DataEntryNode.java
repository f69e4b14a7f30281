package org.dxworks.cobolscope.parser.ast;

import org.dxworks.cobolscope.source.SourceRange;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * One data description entry as written; nesting is resolved later from level numbers.
 */
public class DataEntryNode extends CobolNode {

    private final int level;
    private final Word levelWord;
    private final Word nameWord;
    private final List<DataClause> clauses;

    public DataEntryNode(String id, String name, SourceRange range, int level, Word levelWord, Word nameWord,
                         List<DataClause> clauses) {
        super(id, name, range);
        this.level = level;
        this.levelWord = levelWord;
        this.nameWord = nameWord;
        this.clauses = Collections.unmodifiableList(clauses);
    }

    /**
     * Level number, or -1 when the level text is not a number.
     */
    public int getLevel() {
        return level;
    }

    public Word getLevelWord() {
        return levelWord;
    }

    public Word getNameWord() {
        return nameWord;
    }

    public boolean isFiller() {
        return getName() == null;
    }

    public List<DataClause> getClauses() {
        return clauses;
    }

    public Optional<DataClause> clause(String keyword) {
        return clauses.stream().filter(c -> c.getKeyword().equals(keyword)).findFirst();
    }

    @Override
    public List<CobolNode> getChildren() {
        return List.of();
    }

    @Override
    public <R> R accept(CobolNodeVisitor<R> visitor) {
        return visitor.visitDataEntry(this);
    }
}
