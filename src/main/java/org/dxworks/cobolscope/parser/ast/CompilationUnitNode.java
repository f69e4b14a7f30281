package org.dxworks.cobolscope.parser.ast;

import org.dxworks.cobolscope.source.SourceRange;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

public class CompilationUnitNode extends CobolNode {

    private final String programId;
    private final SourceRange programIdRange;
    private final boolean fragment;
    private final List<DivisionNode> divisions;

    public CompilationUnitNode(String unit, String programId, SourceRange programIdRange, boolean fragment,
                               SourceRange range, List<DivisionNode> divisions) {
        super(unit, programId, range);
        this.programId = programId;
        this.programIdRange = programIdRange;
        this.fragment = fragment;
        this.divisions = Collections.unmodifiableList(divisions);
    }

    public Optional<String> getProgramId() {
        return Optional.ofNullable(programId);
    }

    public SourceRange getProgramIdRange() {
        return programIdRange;
    }

    /**
     * True for a copy member parsed without division headers.
     */
    public boolean isFragment() {
        return fragment;
    }

    public List<DivisionNode> getDivisions() {
        return divisions;
    }

    public Optional<DivisionNode> division(DivisionKind kind) {
        return divisions.stream().filter(d -> d.getKind() == kind).findFirst();
    }

    @Override
    public List<DivisionNode> getChildren() {
        return divisions;
    }

    @Override
    public <R> R accept(CobolNodeVisitor<R> visitor) {
        return visitor.visitCompilationUnit(this);
    }
}
