package org.dxworks.cobolscope.source;

import java.util.Objects;

/**
 * Where an expanded line came from: the physical file (unit or copy member) and its line number.
 */
public final class LineOrigin {

    private final String file;
    private final int line;

    public LineOrigin(String file, int line) {
        this.file = Objects.requireNonNull(file, "file");
        this.line = line;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LineOrigin)) return false;
        LineOrigin that = (LineOrigin) o;
        return line == that.line && file.equals(that.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, line);
    }

    @Override
    public String toString() {
        return file + ":" + line;
    }
}
