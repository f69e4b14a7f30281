package org.dxworks.cobolscope.parser.ast;

/**
 * Visits the parse tree. Every method defaults to visiting the children and returning the
 * default result, so a visitor overrides only the nodes it cares about.
 */
public abstract class CobolNodeVisitor<R> {

    protected R defaultResult() {
        return null;
    }

    public R visitChildren(CobolNode node) {
        R result = defaultResult();
        for (CobolNode child : node.getChildren()) {
            result = child.accept(this);
        }
        return result;
    }

    public R visitCompilationUnit(CompilationUnitNode node) {
        return visitChildren(node);
    }

    public R visitDivision(DivisionNode node) {
        return visitChildren(node);
    }

    public R visitSection(SectionNode node) {
        return visitChildren(node);
    }

    public R visitParagraph(ParagraphNode node) {
        return visitChildren(node);
    }

    public R visitSentence(SentenceNode node) {
        return visitChildren(node);
    }

    public R visitStatement(StatementNode node) {
        return visitChildren(node);
    }

    public R visitOpaqueStatement(OpaqueStatementNode node) {
        return defaultResult();
    }

    public R visitEntry(EntryNode node) {
        return defaultResult();
    }

    public R visitDataEntry(DataEntryNode node) {
        return defaultResult();
    }

    public R visitFileDescription(FileDescriptionNode node) {
        return visitChildren(node);
    }
}
