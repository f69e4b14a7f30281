package org.dxworks.cobolscope.lexer;

import org.dxworks.cobolscope.dialect.DialectExtension;
import org.dxworks.cobolscope.dialect.DialectOptions;
import org.dxworks.cobolscope.diagnostic.DiagnosticCollector;
import org.dxworks.cobolscope.diagnostic.DiagnosticKind;
import org.dxworks.cobolscope.preprocessor.line.CobolLine;
import org.dxworks.cobolscope.preprocessor.line.CobolLineType;
import org.dxworks.cobolscope.source.SourceRange;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Tokenizes the expanded line stream one line at a time under reference-format column rules.
 * Only columns 8-72 are read; comment lines yield nothing; a continuation line extends the
 * literal or word that ended the previous code line.
 */
public class CobolLexer {

    private static final Set<String> COMMENT_ENTRY_PARAGRAPHS = Set.of(
            "AUTHOR", "INSTALLATION", "DATE-WRITTEN", "DATE-COMPILED", "SECURITY", "REMARKS");

    private static final String[] OPERATORS = {"**", ">=", "<=", "<>", "==", "=", ">", "<", "+", "-", "*", "/", "&", ":"};

    private final String unit;
    private final DialectOptions dialect;
    private final DiagnosticCollector diagnostics;

    private final List<Token> tokens = new ArrayList<>();
    private PendingLiteral pendingLiteral;
    private boolean inIdentificationDivision;
    private boolean inCommentEntry;
    private int previousCodeLine = -1;

    public CobolLexer(String unit, DialectOptions dialect, DiagnosticCollector diagnostics) {
        this.unit = unit;
        this.dialect = dialect;
        this.diagnostics = diagnostics;
    }

    public List<Token> tokenize(List<CobolLine> lines) {
        for (int index = 0; index < lines.size(); index++) {
            CobolLine line = lines.get(index);
            CobolLineType type = line.getType();
            if (!type.isCode()) {
                continue;
            }
            if (pendingLiteral != null && type != CobolLineType.CONTINUATION) {
                reportUnterminated();
            }
            if (type == CobolLineType.CONTINUATION) {
                lexContinuation(line, index);
            } else {
                lexLine(line, index, 0);
            }
            previousCodeLine = index;
        }
        if (pendingLiteral != null) {
            reportUnterminated();
        }
        return tokens;
    }

    private void lexContinuation(CobolLine line, int index) {
        tokens.add(new Token(TokenKind.CONTINUATION_MARKER, "-",
                List.of(SourceRange.onLine(unit, line.getFile(), line.getNumber(), 7, 7)),
                index, false, line.isRewritten()));

        String content = line.getContent();
        int first = skipSpaces(content, 0);
        if (first >= content.length()) {
            return;
        }

        if (pendingLiteral != null) {
            char c = content.charAt(first);
            if (c == pendingLiteral.quote) {
                continueLiteral(line, index, first + 1);
                return;
            }
            diagnostics.report(DiagnosticKind.MALFORMED_LITERAL,
                    "Continued literal must resume with a quote on the continuation line",
                    range(line, first, first + 1));
            finishPending();
            lexLine(line, index, first);
            return;
        }

        Token last = lastCodeToken();
        if (last != null && lastLineOf(last) == previousCodeLine
                && (last.isWord() || last.getKind() == TokenKind.NUMERIC_LITERAL)
                && isWordChar(content.charAt(first))) {
            int end = scanWord(content, first);
            Token merged = last.continuedWith(content.substring(first, end), range(line, first, end));
            if (merged.getKind() == TokenKind.IDENTIFIER && ReservedWords.isReserved(merged.getText())) {
                merged = merged.withKind(TokenKind.KEYWORD);
            } else if (merged.getKind() == TokenKind.KEYWORD && !ReservedWords.isReserved(merged.getText())) {
                merged = merged.withKind(TokenKind.IDENTIFIER);
            }
            tokens.set(indexOfLastCodeToken(), merged);
            lexLine(line, index, end);
            return;
        }
        lexLine(line, index, first);
    }

    private void continueLiteral(CobolLine line, int index, int from) {
        String content = line.getContent();
        int close = findClosingQuote(content, from, pendingLiteral.quote);
        if (close < 0) {
            pendingLiteral.append(content.substring(from), range(line, from, content.length()));
            return;
        }
        pendingLiteral.append(content.substring(from, close + 1), range(line, from, close + 1));
        finishPending();
        lexLine(line, index, close + 1);
    }

    private void lexLine(CobolLine line, int index, int start) {
        String content = line.getContent();
        boolean synthetic = line.isRewritten();

        if (inCommentEntry) {
            if (line.hasAreaAText() && start == 0) {
                inCommentEntry = false;
            } else {
                addCommentEntry(line, index, start);
                return;
            }
        }

        int i = start;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c == ' ') {
                i++;
                continue;
            }

            if (c == '*' && i + 1 < content.length() && content.charAt(i + 1) == '>'
                    && dialect.has(DialectExtension.FLOATING_COMMENTS)) {
                int end = content.stripTrailing().length();
                add(TokenKind.COMMENT, line, index, i, end, synthetic);
                break;
            }

            if (c == '"' || c == '\'') {
                i = lexLiteral(line, index, i, i, synthetic);
                continue;
            }

            int prefixLength = literalPrefixLength(content, i);
            if (prefixLength > 0) {
                i = lexLiteral(line, index, i, i + prefixLength, synthetic);
                continue;
            }

            if (expectsPicture()) {
                int end = scanPicture(content, i);
                add(TokenKind.PICTURE_STRING, line, index, i, end, synthetic);
                i = end;
                continue;
            }

            if (c == ',' || c == ';' || (c == '.' && (i + 1 >= content.length() || content.charAt(i + 1) == ' '))) {
                add(TokenKind.SEPARATOR, line, index, i, i + 1, synthetic);
                i++;
                if (c == '.' && startsCommentEntry()) {
                    inCommentEntry = true;
                    addCommentEntry(line, index, i);
                    return;
                }
                continue;
            }

            if (c == '(' || c == ')') {
                add(TokenKind.SEPARATOR, line, index, i, i + 1, synthetic);
                i++;
                continue;
            }

            if (Character.isDigit(c) || (isSignOrPoint(c) && startsNumber(content, i))) {
                int end = scanNumberOrWord(content, i);
                String text = content.substring(i, end);
                TokenKind kind = isNumeric(text) ? TokenKind.NUMERIC_LITERAL : classifyWord(text);
                add(kind, line, index, i, end, synthetic);
                i = end;
                continue;
            }

            if (Character.isLetter(c) || (c == '_' && isWordChar(c))) {
                int end = scanWord(content, i);
                String text = content.substring(i, end);
                add(classifyWord(text), line, index, i, end, synthetic);
                trackDivision(text);
                i = end;
                continue;
            }

            int opEnd = scanOperator(content, i);
            add(TokenKind.OPERATOR, line, index, i, opEnd, synthetic);
            i = opEnd;
        }
    }

    private int lexLiteral(CobolLine line, int index, int start, int quoteAt, boolean synthetic) {
        String content = line.getContent();
        char quote = content.charAt(quoteAt);
        int close = findClosingQuote(content, quoteAt + 1, quote);
        if (close >= 0) {
            add(TokenKind.STRING_LITERAL, line, index, start, close + 1, synthetic);
            return close + 1;
        }
        pendingLiteral = new PendingLiteral(quote, index, start < 4, synthetic);
        pendingLiteral.append(content.substring(start), range(line, start, content.length()));
        return content.length();
    }

    private void addCommentEntry(CobolLine line, int index, int from) {
        String content = line.getContent();
        int first = skipSpaces(content, from);
        int end = content.stripTrailing().length();
        if (first < end) {
            add(TokenKind.COMMENT, line, index, first, end, line.isRewritten());
        }
    }

    private boolean startsCommentEntry() {
        if (!inIdentificationDivision || tokens.size() < 2) {
            return false;
        }
        Token paragraph = tokens.get(tokens.size() - 2);
        return paragraph.isWord() && COMMENT_ENTRY_PARAGRAPHS.contains(paragraph.upper());
    }

    private void trackDivision(String word) {
        if (!word.equalsIgnoreCase("DIVISION") || tokens.size() < 2) {
            return;
        }
        Token header = tokens.get(tokens.size() - 2);
        inIdentificationDivision = header.is("IDENTIFICATION") || header.is("ID");
    }

    private boolean expectsPicture() {
        Token last = lastCodeToken();
        if (last == null) {
            return false;
        }
        if (last.is("PIC") || last.is("PICTURE")) {
            return true;
        }
        if (last.is("IS") && tokens.size() >= 2) {
            Token before = tokens.get(tokens.size() - 2);
            return before.is("PIC") || before.is("PICTURE");
        }
        return false;
    }

    private void reportUnterminated() {
        Token salvaged = pendingLiteral.toToken();
        diagnostics.report(DiagnosticKind.MALFORMED_LITERAL,
                "Literal is not closed and not continued: " + salvaged.getText().trim(),
                salvaged.getRange());
        finishPending();
    }

    private void finishPending() {
        tokens.add(pendingLiteral.toToken());
        pendingLiteral = null;
    }

    private void add(TokenKind kind, CobolLine line, int index, int start, int end, boolean synthetic) {
        boolean areaA = start < CobolLine.AREA_B_START_COLUMN - CobolLine.CONTENT_START_COLUMN;
        tokens.add(new Token(kind, line.getContent().substring(start, end),
                List.of(range(line, start, end)), index, areaA, synthetic));
    }

    private SourceRange range(CobolLine line, int start, int endExclusive) {
        int end = Math.max(start + 1, endExclusive);
        return SourceRange.onLine(unit, line.getFile(), line.getNumber(),
                CobolLine.columnOf(start), CobolLine.columnOf(end - 1));
    }

    private TokenKind classifyWord(String text) {
        return ReservedWords.isReserved(text) ? TokenKind.KEYWORD : TokenKind.IDENTIFIER;
    }

    private static int lastLineOf(Token token) {
        return token.getLine() + token.getSegments().size() - 1;
    }

    private Token lastCodeToken() {
        int i = indexOfLastCodeToken();
        return i >= 0 ? tokens.get(i) : null;
    }

    private int indexOfLastCodeToken() {
        for (int i = tokens.size() - 1; i >= 0; i--) {
            if (!tokens.get(i).getKind().isTrivia()) {
                return i;
            }
        }
        return -1;
    }

    private boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '-' || (c == '_' && dialect.has(DialectExtension.UNDERSCORE_IN_WORDS));
    }

    private int scanWord(String content, int from) {
        int i = from;
        while (i < content.length() && isWordChar(content.charAt(i))) {
            i++;
        }
        return i;
    }

    private int scanNumberOrWord(String content, int from) {
        int i = from;
        char c = content.charAt(i);
        if (c == '+' || c == '-') {
            i++;
        }
        if (content.charAt(i) == '.') {
            return scanDigits(content, i + 1);
        }
        int end = scanWord(content, i);
        // decimal part: 12.50 but not a separator period
        if (content.substring(i, end).chars().allMatch(Character::isDigit)
                && end + 1 < content.length() && content.charAt(end) == '.'
                && Character.isDigit(content.charAt(end + 1))) {
            end = scanDigits(content, end + 1);
        }
        return end;
    }

    private static int scanDigits(String content, int from) {
        int i = from;
        while (i < content.length() && Character.isDigit(content.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean isNumeric(String text) {
        return text.matches("[+-]?(\\d+(\\.\\d+)?|\\.\\d+)");
    }

    private static boolean isSignOrPoint(char c) {
        return c == '+' || c == '-' || c == '.';
    }

    private boolean startsNumber(String content, int i) {
        char c = content.charAt(i);
        if (i + 1 >= content.length() || !Character.isDigit(content.charAt(i + 1))) {
            return false;
        }
        if (c == '.') {
            return true;
        }
        // a sign binds to the number only where an operand cannot precede it
        Token last = lastCodeToken();
        return last == null || last.getKind() == TokenKind.KEYWORD || last.getKind() == TokenKind.OPERATOR
                || last.isSeparator('(') || last.isSeparator(',') || last.isPeriod();
    }

    private static int scanPicture(String content, int from) {
        int i = from;
        while (i < content.length() && content.charAt(i) != ' ') {
            i++;
        }
        char last = content.charAt(i - 1);
        if (i - 1 > from && (last == '.' || last == ',' || last == ';')) {
            i--;
        }
        return i;
    }

    private static int scanOperator(String content, int i) {
        for (String op : OPERATORS) {
            if (content.startsWith(op, i)) {
                return i + op.length();
            }
        }
        return i + 1;
    }

    private static int literalPrefixLength(String content, int i) {
        char c = Character.toUpperCase(content.charAt(i));
        if (i > 0 && Character.isLetterOrDigit(content.charAt(i - 1))) {
            return 0;
        }
        if (c == 'N' && i + 2 < content.length() && Character.toUpperCase(content.charAt(i + 1)) == 'X'
                && isQuote(content.charAt(i + 2))) {
            return 2;
        }
        if ((c == 'X' || c == 'N' || c == 'Z' || c == 'G' || c == 'B') && i + 1 < content.length()
                && isQuote(content.charAt(i + 1))) {
            return 1;
        }
        return 0;
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }

    private static int findClosingQuote(String content, int from, char quote) {
        int i = from;
        while (i < content.length()) {
            if (content.charAt(i) == quote) {
                if (i + 1 < content.length() && content.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i;
            }
            i++;
        }
        return -1;
    }

    private static int skipSpaces(String content, int from) {
        int i = from;
        while (i < content.length() && content.charAt(i) == ' ') {
            i++;
        }
        return i;
    }

    private static final class PendingLiteral {
        private final char quote;
        private final int line;
        private final boolean areaA;
        private final boolean synthetic;
        private final StringBuilder text = new StringBuilder();
        private final List<SourceRange> segments = new ArrayList<>();

        private PendingLiteral(char quote, int line, boolean areaA, boolean synthetic) {
            this.quote = quote;
            this.line = line;
            this.areaA = areaA;
            this.synthetic = synthetic;
        }

        void append(String part, SourceRange segment) {
            text.append(part);
            segments.add(segment);
        }

        Token toToken() {
            return new Token(TokenKind.STRING_LITERAL, text.toString(), segments, line, areaA, synthetic);
        }
    }
}
