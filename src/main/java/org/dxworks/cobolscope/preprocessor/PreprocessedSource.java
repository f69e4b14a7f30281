package org.dxworks.cobolscope.preprocessor;

import org.dxworks.cobolscope.preprocessor.line.CobolLine;
import org.dxworks.cobolscope.source.ProvenanceMap;
import org.dxworks.cobolscope.source.SourceUnit;

import java.util.Collections;
import java.util.List;

/**
 * Output of the preprocessor: the expanded line stream, the unit carrying its provenance and
 * content hash, and the COPY member names met on the way.
 */
public final class PreprocessedSource {

    private final SourceUnit unit;
    private final List<CobolLine> lines;
    private final List<String> copyMembers;

    public PreprocessedSource(SourceUnit unit, List<CobolLine> lines, List<String> copyMembers) {
        this.unit = unit;
        this.lines = Collections.unmodifiableList(lines);
        this.copyMembers = Collections.unmodifiableList(copyMembers);
    }

    public SourceUnit getUnit() {
        return unit;
    }

    public List<CobolLine> getLines() {
        return lines;
    }

    public List<String> getCopyMembers() {
        return copyMembers;
    }

    public ProvenanceMap getProvenance() {
        return unit.getProvenance().orElseThrow();
    }

    public String getContentHash() {
        return unit.getContentHash().orElseThrow();
    }

    /**
     * The expanded text, one line per expanded line, as the compiler sees it (indicator and program text).
     */
    public String expandedText() {
        StringBuilder sb = new StringBuilder();
        for (CobolLine line : lines) {
            sb.append(line.compilerText()).append('\n');
        }
        return sb.toString();
    }
}
