package org.dxworks.cobolscope.preprocessor.line;

import org.dxworks.cobolscope.dialect.DialectExtension;
import org.dxworks.cobolscope.dialect.DialectOptions;
import org.dxworks.cobolscope.source.SourceLine;
import org.dxworks.cobolscope.source.SourceUnit;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads reference-format (fixed column) source. Tabs are expanded to 8-column stops before the
 * areas are cut so columns agree with what editors show; every column a token or range carries is
 * a column of the expanded text, and {@link CobolLine#getRaw()} keeps the line as read.
 */
public class FixedFormatLineReader implements CobolLineReader {

    private static final int SEQUENCE_AREA_LENGTH = 6;
    private static final int INDICATOR_INDEX = 6;
    private static final int TAB_WIDTH = 8;

    private final DialectOptions dialect;

    public FixedFormatLineReader(DialectOptions dialect) {
        this.dialect = dialect;
    }

    @Override
    public List<CobolLine> processLines(String lines, String file) {
        List<SourceLine> physical = SourceUnit.splitLines(lines);
        List<CobolLine> result = new ArrayList<>(physical.size());
        for (SourceLine line : physical) {
            result.add(parseLine(line.getText(), line.getNumber(), file));
        }
        return result;
    }

    @Override
    public CobolLine parseLine(String line, int lineNumber, String file) {
        String text = expandTabs(line);

        if (text.length() <= INDICATOR_INDEX) {
            return new CobolLine(file, lineNumber, text, ' ', CobolLineType.BLANK, "", "", false, line);
        }

        String sequenceArea = text.substring(0, SEQUENCE_AREA_LENGTH);
        char indicator = text.charAt(INDICATOR_INDEX);
        int contentEnd = Math.min(text.length(), CobolLine.CONTENT_END_COLUMN);
        String content = text.substring(INDICATOR_INDEX + 1, contentEnd);
        String identificationArea = text.length() > CobolLine.CONTENT_END_COLUMN
                ? text.substring(CobolLine.CONTENT_END_COLUMN)
                : "";

        CobolLineType type = classify(indicator, content);
        return new CobolLine(file, lineNumber, sequenceArea, indicator, type, content, identificationArea, false,
                line);
    }

    private CobolLineType classify(char indicator, String content) {
        switch (indicator) {
            case '*':
            case '/':
                return CobolLineType.COMMENT;
            case '-':
                return CobolLineType.CONTINUATION;
            case 'D':
            case 'd':
                if (!dialect.has(DialectExtension.DEBUG_LINES_AS_CODE)) {
                    return CobolLineType.COMMENT;
                }
                break;
            case '$':
                return CobolLineType.COMPILER_DIRECTIVE;
            default:
                break;
        }
        String trimmed = content.trim();
        if (trimmed.isEmpty()) {
            return CobolLineType.BLANK;
        }
        if (trimmed.startsWith(">>")) {
            return CobolLineType.COMPILER_DIRECTIVE;
        }
        if (trimmed.startsWith("*>") && dialect.has(DialectExtension.FLOATING_COMMENTS)) {
            return CobolLineType.COMMENT;
        }
        return CobolLineType.NORMAL;
    }

    /**
     * Expands tab characters to the next multiple-of-8 column; other text is unchanged.
     */
    public static String expandTabs(String line) {
        if (line.indexOf('\t') < 0) {
            return line;
        }
        StringBuilder sb = new StringBuilder(line.length() + 16);
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\t') {
                int spaces = TAB_WIDTH - (sb.length() % TAB_WIDTH);
                sb.append(" ".repeat(spaces));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
