package org.dxworks.cobolscope.preprocessor.line;

import java.util.Objects;

/**
 * A fixed-format source line split into its column areas: sequence area (columns 1-6),
 * indicator (column 7), program text (columns 8-72, Area A is 8-11 and Area B 12-72) and the
 * ignored identification area (columns 73 and up).
 */
public final class CobolLine {

    public static final int CONTENT_START_COLUMN = 8;
    public static final int AREA_B_START_COLUMN = 12;
    public static final int CONTENT_END_COLUMN = 72;

    private final String file;
    private final int number;
    private final String sequenceArea;
    private final char indicator;
    private final CobolLineType type;
    private final String content;
    private final String identificationArea;
    private final boolean rewritten;
    private final String raw;

    public CobolLine(String file, int number, String sequenceArea, char indicator, CobolLineType type,
                     String content, String identificationArea, boolean rewritten, String raw) {
        this.file = Objects.requireNonNull(file, "file");
        this.number = number;
        this.sequenceArea = sequenceArea;
        this.indicator = indicator;
        this.type = type;
        this.content = content;
        this.identificationArea = identificationArea;
        this.rewritten = rewritten;
        this.raw = raw;
    }

    public String getFile() {
        return file;
    }

    public int getNumber() {
        return number;
    }

    public String getSequenceArea() {
        return sequenceArea;
    }

    public char getIndicator() {
        return indicator;
    }

    public CobolLineType getType() {
        return type;
    }

    /**
     * Program text starting at column 8; index {@code i} is column {@code 8 + i}.
     */
    public String getContent() {
        return content;
    }

    public String getIdentificationArea() {
        return identificationArea;
    }

    /**
     * True when text replacement changed this line, so columns no longer match the physical line.
     */
    public boolean isRewritten() {
        return rewritten;
    }

    /**
     * The physical line as read, before tab expansion.
     */
    public String getRaw() {
        return raw;
    }

    /**
     * True when the physical line held tabs; columns then count from the tab-expanded text.
     */
    public boolean isTabExpanded() {
        return raw.indexOf('\t') >= 0;
    }

    public static int columnOf(int contentIndex) {
        return CONTENT_START_COLUMN + contentIndex;
    }

    public boolean isBlankContent() {
        return content.isBlank();
    }

    /**
     * True when Area A (columns 8-11) holds any non-blank character.
     */
    public boolean hasAreaAText() {
        int limit = Math.min(content.length(), AREA_B_START_COLUMN - CONTENT_START_COLUMN);
        for (int i = 0; i < limit; i++) {
            if (content.charAt(i) != ' ') {
                return true;
            }
        }
        return false;
    }

    public CobolLine withContent(String newContent, boolean rewrite) {
        return new CobolLine(file, number, sequenceArea, indicator, type, newContent, identificationArea,
                rewritten || rewrite, raw);
    }

    /**
     * Copy with content positions {@code [from, to)} replaced by blanks; columns are preserved.
     */
    public CobolLine blank(int from, int to) {
        int start = Math.max(0, Math.min(from, content.length()));
        int end = Math.max(start, Math.min(to, content.length()));
        String blanked = content.substring(0, start) + " ".repeat(end - start) + content.substring(end);
        return new CobolLine(file, number, sequenceArea, indicator, type, blanked, identificationArea, rewritten,
                raw);
    }

    /**
     * Line text as seen by the compiler: indicator plus program text.
     */
    public String compilerText() {
        return indicator + content;
    }

    @Override
    public String toString() {
        return file + ":" + number + " [" + type + "] " + content;
    }
}
