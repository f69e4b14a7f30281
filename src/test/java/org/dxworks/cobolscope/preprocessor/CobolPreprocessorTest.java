package org.dxworks.cobolscope.preprocessor;

import org.dxworks.cobolscope.TestUtils;
import org.dxworks.cobolscope.diagnostic.Diagnostic;
import org.dxworks.cobolscope.diagnostic.DiagnosticCollector;
import org.dxworks.cobolscope.diagnostic.DiagnosticKind;
import org.dxworks.cobolscope.dialect.DialectOptions;
import org.dxworks.cobolscope.preprocessor.line.CobolLine;
import org.dxworks.cobolscope.source.SourceUnit;
import org.dxworks.cobolscope.source.UnitKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class CobolPreprocessorTest {

    private final DiagnosticCollector diagnostics = new DiagnosticCollector();

    private PreprocessedSource process(CopybookResolver resolver, SourceUnit unit) {
        return new CobolPreprocessor(resolver, DialectOptions.defaults()).process(unit, diagnostics);
    }

    private static List<String> codeLines(PreprocessedSource source) {
        return source.getLines().stream()
                .filter(l -> !l.isBlankContent())
                .map(l -> l.getContent().trim())
                .collect(Collectors.toList());
    }

    @Test
    void copyInsertsMemberLinesAfterTheDirective() {
        CopybookResolver resolver = CopybookResolver.of(Map.of("REC.cpy", TestUtils.fixed("01  REC-A PIC X.")));
        SourceUnit unit = TestUtils.program("MAIN.cbl",
                "DATA DIVISION.",
                "WORKING-STORAGE SECTION.",
                "    COPY REC.",
                "01  AFTER-ITEM PIC X.");

        PreprocessedSource source = process(resolver, unit);

        assertEquals(List.of("DATA DIVISION.", "WORKING-STORAGE SECTION.", "01  REC-A PIC X.",
                "01  AFTER-ITEM PIC X."), codeLines(source));
        assertEquals(List.of("REC"), source.getCopyMembers());
        CobolLine memberLine = source.getLines().get(3);
        assertEquals("REC.cpy", memberLine.getFile());
        assertEquals(1, memberLine.getNumber());
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void circularIncludeIsReportedOnceAndExpansionContinues() {
        PreprocessedSource source = process(
                new CopybookRepository(List.of(TestUtils.SAMPLES), List.of("cpy")), TestUtils.sample("CIRCPROG.cbl"));

        List<Diagnostic> circular = diagnostics.ofKind(DiagnosticKind.CIRCULAR_INCLUDE);
        assertEquals(1, circular.size());
        assertEquals("CIRCB.cpy", circular.get(0).getRange().getFile());

        List<String> lines = codeLines(source);
        assertEquals(1, lines.stream().filter(l -> l.startsWith("01  CIRC-A-ITEM")).count());
        assertEquals(1, lines.stream().filter(l -> l.startsWith("01  CIRC-B-ITEM")).count());
        assertTrue(lines.stream().anyMatch(l -> l.startsWith("01  WS-FLAG")));
        assertEquals(List.of("CIRCA", "CIRCB", "NOSUCH"), source.getCopyMembers());
    }

    @Test
    void unresolvedIncludeIsReportedAgainstTheDirective() {
        PreprocessedSource source = process(
                new CopybookRepository(List.of(TestUtils.SAMPLES), List.of("cpy")), TestUtils.sample("CIRCPROG.cbl"));

        List<Diagnostic> unresolved = diagnostics.ofKind(DiagnosticKind.UNRESOLVED_INCLUDE);
        assertEquals(1, unresolved.size());
        assertEquals("CIRCPROG.cbl", unresolved.get(0).getRange().getFile());
        assertEquals(7, unresolved.get(0).getRange().getStartLine());
        assertTrue(source.getLines().stream().noneMatch(l -> l.getContent().contains("NOSUCH")));
    }

    @Test
    void unitCannotCopyItself() {
        CopybookResolver resolver = CopybookResolver.of(Map.of("SELF.cpy", TestUtils.fixed("    COPY SELF.")));
        SourceUnit unit = SourceUnit.read("SELF.cpy", UnitKind.COPYBOOK,
                TestUtils.fixed("    COPY SELF."));

        process(resolver, unit);

        assertEquals(1, diagnostics.ofKind(DiagnosticKind.CIRCULAR_INCLUDE).size());
    }

    @Test
    void replacingRewritesMemberText() {
        CopybookResolver resolver = CopybookResolver.of(Map.of("CUST.cpy", TestUtils.fixed(
                "01  CUST-REC.",
                "    05  CUST-ID PIC 9(6).")));
        SourceUnit unit = TestUtils.program("MAIN.cbl",
                "DATA DIVISION.",
                "WORKING-STORAGE SECTION.",
                "    COPY CUST REPLACING LEADING ==CUST-== BY ==CLI-==.");

        PreprocessedSource source = process(resolver, unit);

        List<String> lines = codeLines(source);
        assertTrue(lines.contains("01  CLI-REC."), lines.toString());
        assertTrue(lines.stream().anyMatch(l -> l.startsWith("05  CLI-ID")), lines.toString());
        assertTrue(source.getLines().stream().anyMatch(CobolLine::isRewritten));
    }

    @Test
    void contentHashFollowsExpandedText() {
        SourceUnit unit = TestUtils.program("MAIN.cbl",
                "DATA DIVISION.",
                "WORKING-STORAGE SECTION.",
                "    COPY REC.");
        String first = process(CopybookResolver.of(Map.of("REC.cpy", TestUtils.fixed("01  A PIC X."))), unit)
                .getContentHash();
        String same = process(CopybookResolver.of(Map.of("REC.cpy", TestUtils.fixed("01  A PIC X."))), unit)
                .getContentHash();
        String changed = process(CopybookResolver.of(Map.of("REC.cpy", TestUtils.fixed("01  B PIC X."))), unit)
                .getContentHash();

        assertEquals(first, same);
        assertNotEquals(first, changed);
    }

    @Test
    void malformedDirectiveIsReported() {
        SourceUnit unit = TestUtils.program("MAIN.cbl",
                "PROCEDURE DIVISION.",
                "    COPY.");

        process(CopybookResolver.none(), unit);

        assertEquals(1, diagnostics.ofKind(DiagnosticKind.MALFORMED_DIRECTIVE).size());
    }

    @Test
    void replaceAppliesUntilReplaceOff() {
        SourceUnit unit = TestUtils.program("MAIN.cbl",
                "DATA DIVISION.",
                "WORKING-STORAGE SECTION.",
                "01  OLD-NAME PIC X.",
                "    REPLACE ==OLD-NAME== BY ==NEW-NAME==.",
                "01  OLD-NAME PIC 9.",
                "    REPLACE OFF.",
                "01  OLD-NAME PIC A.");

        PreprocessedSource source = process(CopybookResolver.none(), unit);

        List<String> lines = codeLines(source);
        assertEquals(5, lines.size(), lines.toString());
        assertTrue(lines.get(2).startsWith("01  OLD-NAME") && lines.get(2).endsWith("PIC X."), lines.toString());
        assertTrue(lines.get(3).contains("NEW-NAME") && lines.get(3).endsWith("PIC 9."), lines.toString());
        assertTrue(lines.get(4).startsWith("01  OLD-NAME") && lines.get(4).endsWith("PIC A."), lines.toString());
        List<CobolLine> rewritten = source.getLines().stream().filter(CobolLine::isRewritten).collect(Collectors.toList());
        assertEquals(1, rewritten.size());
        assertEquals(5, rewritten.get(0).getNumber());
        assertEquals(7, source.getLines().size());
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void laterReplaceSupersedesTheEarlierOne() {
        SourceUnit unit = TestUtils.program("MAIN.cbl",
                "DATA DIVISION.",
                "WORKING-STORAGE SECTION.",
                "    REPLACE ==ITEM-A== BY ==FIRST-A==.",
                "01  ITEM-A PIC X.",
                "    REPLACE ==ITEM-A== BY ==SECOND-A==.",
                "01  ITEM-A PIC 9.");

        List<String> lines = codeLines(process(CopybookResolver.none(), unit));

        assertTrue(lines.get(2).contains("FIRST-A"), lines.toString());
        assertTrue(lines.get(3).contains("SECOND-A"), lines.toString());
    }
}
