package org.dxworks.cobolscope.query;

import org.dxworks.cobolscope.model.SymbolKind;
import org.dxworks.cobolscope.source.SourceRange;

import java.util.Collections;
import java.util.List;

/**
 * One candidate declaration for a looked-up name. {@code qualification} lists the name followed
 * by its enclosing group items (data items) or its section (paragraphs).
 */
public final class Definition {

    private final String unitId;
    private final String name;
    private final SymbolKind kind;
    private final List<String> qualification;
    private final String nodeId;
    private final SourceRange range;

    public Definition(String unitId, String name, SymbolKind kind, List<String> qualification, String nodeId,
                      SourceRange range) {
        this.unitId = unitId;
        this.name = name;
        this.kind = kind;
        this.qualification = Collections.unmodifiableList(qualification);
        this.nodeId = nodeId;
        this.range = range;
    }

    public String getUnitId() {
        return unitId;
    }

    public String getName() {
        return name;
    }

    public SymbolKind getKind() {
        return kind;
    }

    public List<String> getQualification() {
        return qualification;
    }

    public String getNodeId() {
        return nodeId;
    }

    public SourceRange getRange() {
        return range;
    }

    @Override
    public String toString() {
        return kind + " " + String.join(" OF ", qualification) + " at " + range;
    }
}
