package org.dxworks.cobolscope.builder;

import org.dxworks.cobolscope.model.StructureKind;
import org.dxworks.cobolscope.model.StructureNode;
import org.dxworks.cobolscope.parser.ast.CobolNode;
import org.dxworks.cobolscope.parser.ast.CobolNodeVisitor;
import org.dxworks.cobolscope.parser.ast.DataEntryNode;
import org.dxworks.cobolscope.parser.ast.DivisionNode;
import org.dxworks.cobolscope.parser.ast.EntryNode;
import org.dxworks.cobolscope.parser.ast.FileDescriptionNode;
import org.dxworks.cobolscope.parser.ast.OpaqueStatementNode;
import org.dxworks.cobolscope.parser.ast.ParagraphNode;
import org.dxworks.cobolscope.parser.ast.SectionNode;
import org.dxworks.cobolscope.parser.ast.SentenceNode;
import org.dxworks.cobolscope.parser.ast.StatementNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Copies the parse tree into serializable {@link StructureNode}s.
 */
class StructureMirror extends CobolNodeVisitor<StructureNode> {

    @Override
    public StructureNode visitDivision(DivisionNode node) {
        return node(StructureKind.DIVISION, node, node.getKind().name());
    }

    @Override
    public StructureNode visitSection(SectionNode node) {
        return node(StructureKind.SECTION, node, node.getName());
    }

    @Override
    public StructureNode visitParagraph(ParagraphNode node) {
        return node(StructureKind.PARAGRAPH, node, node.getName());
    }

    @Override
    public StructureNode visitSentence(SentenceNode node) {
        return node(StructureKind.SENTENCE, node, null);
    }

    @Override
    public StructureNode visitStatement(StatementNode node) {
        return node(StructureKind.STATEMENT, node, node.getVerb());
    }

    @Override
    public StructureNode visitOpaqueStatement(OpaqueStatementNode node) {
        return node(StructureKind.OPAQUE_STATEMENT, node, null);
    }

    @Override
    public StructureNode visitEntry(EntryNode node) {
        return node(StructureKind.ENTRY, node, null);
    }

    @Override
    public StructureNode visitDataEntry(DataEntryNode node) {
        return node(StructureKind.DATA_ENTRY, node, node.getName());
    }

    @Override
    public StructureNode visitFileDescription(FileDescriptionNode node) {
        return node(StructureKind.FILE_DESCRIPTION, node, node.getName());
    }

    private StructureNode node(StructureKind kind, CobolNode node, String name) {
        List<StructureNode> children = new ArrayList<>();
        for (CobolNode child : node.getChildren()) {
            children.add(child.accept(this));
        }
        return new StructureNode(kind, node.getId(), name, node.getRange(), children);
    }
}
