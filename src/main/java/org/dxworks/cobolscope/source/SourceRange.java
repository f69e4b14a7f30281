package org.dxworks.cobolscope.source;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;
import java.util.Objects;

/**
 * A span of source text, addressed by the ingesting unit, the physical file the text came
 * from (the unit itself or a copy member) and 1-based inclusive line/column bounds.
 */
public final class SourceRange implements Comparable<SourceRange> {

    public static final Comparator<SourceRange> ORDER = Comparator
            .comparing(SourceRange::getUnit)
            .thenComparing(SourceRange::getFile)
            .thenComparingInt(SourceRange::getStartLine)
            .thenComparingInt(SourceRange::getStartColumn)
            .thenComparingInt(SourceRange::getEndLine)
            .thenComparingInt(SourceRange::getEndColumn);

    private final String unit;
    private final String file;
    private final int startLine;
    private final int startColumn;
    private final int endLine;
    private final int endColumn;

    @JsonCreator
    public SourceRange(@JsonProperty("unit") String unit,
                       @JsonProperty("file") String file,
                       @JsonProperty("startLine") int startLine,
                       @JsonProperty("startColumn") int startColumn,
                       @JsonProperty("endLine") int endLine,
                       @JsonProperty("endColumn") int endColumn) {
        this.unit = Objects.requireNonNull(unit, "unit");
        this.file = Objects.requireNonNull(file, "file");
        this.startLine = startLine;
        this.startColumn = startColumn;
        this.endLine = endLine;
        this.endColumn = endColumn;
    }

    public static SourceRange onLine(String unit, String file, int line, int startColumn, int endColumn) {
        return new SourceRange(unit, file, line, startColumn, line, endColumn);
    }

    /**
     * Spans from the start of {@code first} to the end of {@code last}. When the two ranges sit in
     * different files (a node that straddles a copy member) the result stays within the first file.
     */
    public static SourceRange span(SourceRange first, SourceRange last) {
        if (last == null || !first.file.equals(last.file) || !first.unit.equals(last.unit)) {
            return first;
        }
        if (last.endLine < first.startLine
                || (last.endLine == first.startLine && last.endColumn < first.startColumn)) {
            return first;
        }
        return new SourceRange(first.unit, first.file, first.startLine, first.startColumn, last.endLine, last.endColumn);
    }

    public String getUnit() {
        return unit;
    }

    public String getFile() {
        return file;
    }

    public int getStartLine() {
        return startLine;
    }

    public int getStartColumn() {
        return startColumn;
    }

    public int getEndLine() {
        return endLine;
    }

    public int getEndColumn() {
        return endColumn;
    }

    public boolean fromCopyMember() {
        return !unit.equals(file);
    }

    /**
     * Stable, reproducible key used by collaborators (annotation storage) to address this span.
     */
    public String key() {
        StringBuilder sb = new StringBuilder(unit);
        if (fromCopyMember()) {
            sb.append('>').append(file);
        }
        return sb.append(':').append(startLine).append(':').append(startColumn)
                .append('-').append(endLine).append(':').append(endColumn)
                .toString();
    }

    @Override
    public int compareTo(SourceRange other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceRange)) return false;
        SourceRange that = (SourceRange) o;
        return startLine == that.startLine
                && startColumn == that.startColumn
                && endLine == that.endLine
                && endColumn == that.endColumn
                && unit.equals(that.unit)
                && file.equals(that.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(unit, file, startLine, startColumn, endLine, endColumn);
    }

    @Override
    public String toString() {
        return key();
    }
}
