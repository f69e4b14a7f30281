package org.dxworks.cobolscope.source;

/**
 * One physical line of an ingested file, numbered from 1.
 */
public final class SourceLine {

    private final int number;
    private final String text;

    public SourceLine(int number, String text) {
        this.number = number;
        this.text = text;
    }

    public int getNumber() {
        return number;
    }

    public String getText() {
        return text;
    }

    /**
     * Returns the text between the 1-based inclusive columns, clipped to the physical line.
     */
    public String slice(int startColumn, int endColumn) {
        int from = Math.max(0, startColumn - 1);
        int to = Math.min(text.length(), endColumn);
        if (from >= to) {
            return "";
        }
        return text.substring(from, to);
    }

    @Override
    public String toString() {
        return number + ": " + text;
    }
}
