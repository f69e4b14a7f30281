package org.dxworks.cobolscope.parser.ast;

import org.dxworks.cobolscope.source.SourceRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One procedural statement. {@code words} are the statement's own operands after the verb, in
 * source order; nested statements live in {@link #getBlocks() blocks}.
 */
public class StatementNode extends CobolNode {

    private final Word verbWord;
    private final List<Word> words;
    private final List<StatementBlock> blocks;
    private final boolean inline;

    public StatementNode(String id, Word verbWord, SourceRange range, List<Word> words,
                         List<StatementBlock> blocks, boolean inline) {
        super(id, null, range);
        this.verbWord = verbWord;
        this.words = Collections.unmodifiableList(words);
        this.blocks = Collections.unmodifiableList(blocks);
        this.inline = inline;
    }

    public String getVerb() {
        return verbWord.upper();
    }

    public Word getVerbWord() {
        return verbWord;
    }

    public List<Word> getWords() {
        return words;
    }

    public List<StatementBlock> getBlocks() {
        return blocks;
    }

    /**
     * True for a PERFORM that carries its own statements instead of naming a procedure.
     */
    public boolean isInline() {
        return inline;
    }

    @Override
    public List<CobolNode> getChildren() {
        List<CobolNode> children = new ArrayList<>();
        for (StatementBlock block : blocks) {
            children.addAll(block.getStatements());
        }
        return children;
    }

    @Override
    public <R> R accept(CobolNodeVisitor<R> visitor) {
        return visitor.visitStatement(this);
    }

    @Override
    public String toString() {
        return getVerb() + " " + words;
    }
}
