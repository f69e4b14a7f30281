package org.dxworks.cobolscope.lexer;

import org.dxworks.cobolscope.TestUtils;
import org.dxworks.cobolscope.diagnostic.DiagnosticCollector;
import org.dxworks.cobolscope.diagnostic.DiagnosticKind;
import org.dxworks.cobolscope.dialect.DialectOptions;
import org.dxworks.cobolscope.preprocessor.line.CobolLine;
import org.dxworks.cobolscope.preprocessor.line.FixedFormatLineReader;
import org.dxworks.cobolscope.source.SourceRange;
import org.dxworks.cobolscope.source.SourceUnit;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class CobolLexerTest {

    private final DiagnosticCollector diagnostics = new DiagnosticCollector();

    private List<Token> tokenize(String text) {
        DialectOptions dialect = DialectOptions.defaults();
        return new CobolLexer("T.cbl", dialect, diagnostics)
                .tokenize(new FixedFormatLineReader(dialect).processLines(text, "T.cbl"));
    }

    @Test
    void tokenRangesSliceBackToTheirText() {
        SourceUnit unit = TestUtils.sample("CUSTUPD.cbl");
        List<Token> tokens = tokenize(String.join("\n",
                unit.getLines().stream().map(l -> l.getText()).collect(Collectors.toList())));

        assertFalse(tokens.isEmpty());
        for (Token token : tokens) {
            if (token.isSynthetic() || token.getSegments().size() != 1) {
                continue;
            }
            SourceRange range = token.getRange();
            String line = FixedFormatLineReader.expandTabs(unit.line(range.getStartLine()).orElseThrow().getText());
            assertEquals(token.getText(), line.substring(range.getStartColumn() - 1, range.getEndColumn()),
                    "token " + token);
        }
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void ignoresSequenceAndIdentificationAreas() {
        List<Token> tokens = tokenize(String.format("%-72s%s\n", "000100     MOVE A TO B.", "CHANGED1"));

        assertEquals(List.of("MOVE", "A", "TO", "B", "."),
                tokens.stream().map(Token::getText).collect(Collectors.toList()));
        assertEquals(12, tokens.get(0).getRange().getStartColumn());
        assertFalse(tokens.get(0).isAreaA());
    }

    @Test
    void tabsAreExpandedButTheRawLineIsKept() {
        String physical = "000100\tMOVE A TO B.";
        CobolLine line = new FixedFormatLineReader(DialectOptions.defaults()).parseLine(physical, 1, "T.cbl");

        assertEquals(physical, line.getRaw());
        assertTrue(line.isTabExpanded());
        assertEquals(" MOVE A TO B.", line.getContent());

        Token move = tokenize(physical).get(0);
        assertEquals(9, move.getRange().getStartColumn());
        assertEquals("MOVE", FixedFormatLineReader.expandTabs(line.getRaw()).substring(8, 12));
    }

    @Test
    void commentLinesYieldNoTokens() {
        List<Token> tokens = tokenize(
                "      * full line comment\n" +
                "      / page eject\n" +
                "           *> floating comment\n");

        assertTrue(tokens.isEmpty());
    }

    @Test
    void floatingCommentAfterCodeIsTrivia() {
        List<Token> tokens = tokenize(TestUtils.fixed("    MOVE A TO B *> copy the key"));

        Token last = tokens.get(tokens.size() - 1);
        assertEquals(TokenKind.COMMENT, last.getKind());
        assertEquals("*> copy the key", last.getText());
    }

    @Test
    void continuedLiteralKeepsOneSegmentPerLine() {
        List<Token> tokens = tokenize(
                "       01  WS-MSG PIC X(40) VALUE 'HELLO\n" +
                "      -    'WORLD'.\n");

        Token literal = tokens.stream()
                .filter(t -> t.getKind() == TokenKind.STRING_LITERAL)
                .findFirst()
                .orElseThrow();
        assertEquals("'HELLOWORLD'", literal.getText());
        assertEquals(2, literal.getSegments().size());
        assertEquals(1, literal.getRange().getStartLine());
        assertEquals(2, literal.getRange().getEndLine());
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void continuedWordIsJoined() {
        List<Token> tokens = tokenize(
                "           MOVE CUSTOMER-\n" +
                "      -    NAME TO WS-NAME.\n");

        assertTrue(tokens.stream().anyMatch(t -> t.getText().equals("CUSTOMER-NAME")
                && t.getKind() == TokenKind.IDENTIFIER));
    }

    @Test
    void unterminatedLiteralIsReportedAndSalvaged() {
        List<Token> tokens = tokenize(TestUtils.fixed(
                "    DISPLAY 'NO END",
                "    STOP RUN."));

        assertEquals(1, diagnostics.ofKind(DiagnosticKind.MALFORMED_LITERAL).size());
        assertTrue(tokens.stream().anyMatch(t -> t.getKind() == TokenKind.STRING_LITERAL
                && t.getText().startsWith("'NO END")));
        assertTrue(tokens.stream().anyMatch(t -> t.is("STOP")));
    }

    @Test
    void pictureStringsAreSingleTokens() {
        List<Token> tokens = tokenize(TestUtils.fixed("01  WS-AMT PIC S9(7)V99."));

        Token picture = tokens.stream()
                .filter(t -> t.getKind() == TokenKind.PICTURE_STRING)
                .findFirst()
                .orElseThrow();
        assertEquals("S9(7)V99", picture.getText());
        assertTrue(tokens.get(tokens.size() - 1).isPeriod());
    }

    @Test
    void classifiesReservedWordsAndNumbers() {
        List<Token> tokens = tokenize(TestUtils.fixed("    ADD 12.50 TO WS-TOTAL."));

        assertEquals(TokenKind.KEYWORD, tokens.get(0).getKind());
        assertEquals(TokenKind.NUMERIC_LITERAL, tokens.get(1).getKind());
        assertEquals("12.50", tokens.get(1).getText());
        assertEquals(TokenKind.IDENTIFIER, tokens.get(3).getKind());
    }

    @Test
    void authorParagraphIsACommentEntry() {
        List<Token> tokens = tokenize(TestUtils.fixed(
                "IDENTIFICATION DIVISION.",
                "PROGRAM-ID. DEMO.",
                "AUTHOR. MOVE IS NOT A VERB HERE.",
                "DATA DIVISION."));

        assertTrue(tokens.stream().noneMatch(t -> t.is("MOVE")));
        assertTrue(tokens.stream().anyMatch(t -> t.is("DATA") && t.isAreaA()));
    }
}
