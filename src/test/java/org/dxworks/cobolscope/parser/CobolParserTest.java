package org.dxworks.cobolscope.parser;

import org.dxworks.cobolscope.TestUtils;
import org.dxworks.cobolscope.diagnostic.DiagnosticCollector;
import org.dxworks.cobolscope.diagnostic.DiagnosticKind;
import org.dxworks.cobolscope.dialect.DialectExtension;
import org.dxworks.cobolscope.dialect.DialectOptions;
import org.dxworks.cobolscope.exception.UnitFailedException;
import org.dxworks.cobolscope.ingest.UnitPipeline;
import org.dxworks.cobolscope.parser.ast.CobolNode;
import org.dxworks.cobolscope.parser.ast.CompilationUnitNode;
import org.dxworks.cobolscope.parser.ast.DivisionKind;
import org.dxworks.cobolscope.parser.ast.DivisionNode;
import org.dxworks.cobolscope.parser.ast.OpaqueStatementNode;
import org.dxworks.cobolscope.parser.ast.ParagraphNode;
import org.dxworks.cobolscope.parser.ast.SentenceNode;
import org.dxworks.cobolscope.parser.ast.StatementBlock;
import org.dxworks.cobolscope.parser.ast.StatementNode;
import org.dxworks.cobolscope.preprocessor.CopybookResolver;
import org.dxworks.cobolscope.preprocessor.PreprocessedSource;
import org.dxworks.cobolscope.source.SourceUnit;
import org.dxworks.cobolscope.source.UnitKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class CobolParserTest {

    private final DiagnosticCollector diagnostics = new DiagnosticCollector();

    private CompilationUnitNode parse(SourceUnit unit) {
        return parse(unit, DialectOptions.defaults());
    }

    private CompilationUnitNode parse(SourceUnit unit, DialectOptions dialect) {
        UnitPipeline pipeline = new UnitPipeline(CopybookResolver.none(), dialect);
        PreprocessedSource source = pipeline.preprocess(unit, diagnostics);
        return new CobolParser(dialect).parse(source.getUnit(), pipeline.tokenize(source, diagnostics), diagnostics);
    }

    private static List<ParagraphNode> paragraphs(CompilationUnitNode ast) {
        DivisionNode procedure = ast.division(DivisionKind.PROCEDURE).orElseThrow();
        return procedure.getChildren().stream()
                .filter(ParagraphNode.class::isInstance)
                .map(ParagraphNode.class::cast)
                .collect(Collectors.toList());
    }

    @Test
    void parsesDivisionsAndParagraphs() {
        CompilationUnitNode ast = parse(TestUtils.program("DEMO.cbl",
                "IDENTIFICATION DIVISION.",
                "PROGRAM-ID. DEMO.",
                "DATA DIVISION.",
                "WORKING-STORAGE SECTION.",
                "01  WS-A PIC X.",
                "PROCEDURE DIVISION.",
                "FIRST-PARA.",
                "    MOVE 'Y' TO WS-A",
                "    PERFORM SECOND-PARA.",
                "SECOND-PARA.",
                "    DISPLAY WS-A.",
                "    STOP RUN."));

        assertEquals("DEMO", ast.getProgramId().orElseThrow());
        assertFalse(ast.isFragment());
        assertEquals(List.of(DivisionKind.IDENTIFICATION, DivisionKind.DATA, DivisionKind.PROCEDURE),
                ast.getDivisions().stream().map(DivisionNode::getKind).collect(Collectors.toList()));

        List<ParagraphNode> paragraphs = paragraphs(ast);
        assertEquals(List.of("FIRST-PARA", "SECOND-PARA"),
                paragraphs.stream().map(ParagraphNode::getName).collect(Collectors.toList()));
        assertEquals("PROCEDURE/FIRST-PARA", paragraphs.get(0).getId());

        SentenceNode first = paragraphs.get(0).getSentences().get(0);
        assertEquals(List.of("MOVE", "PERFORM"), first.getChildren().stream()
                .map(n -> ((StatementNode) n).getVerb())
                .collect(Collectors.toList()));
        assertEquals(2, paragraphs.get(1).getSentences().size());
        assertTrue(diagnostics.isEmpty(), diagnostics.all().toString());
    }

    @Test
    void unrecognizedSentenceBecomesOpaqueAndParsingContinues() {
        CompilationUnitNode ast = parse(TestUtils.program("DEMO.cbl",
                "IDENTIFICATION DIVISION.",
                "PROGRAM-ID. DEMO.",
                "PROCEDURE DIVISION.",
                "MAIN-PARA.",
                "    FROBNICATE WS-FLAG.",
                "    STOP RUN."));

        assertEquals(1, diagnostics.ofKind(DiagnosticKind.OPAQUE_STATEMENT).size());
        List<SentenceNode> sentences = paragraphs(ast).get(0).getSentences();
        assertEquals(2, sentences.size());
        OpaqueStatementNode opaque = (OpaqueStatementNode) sentences.get(0).getChildren().get(0);
        assertTrue(opaque.getText().contains("FROBNICATE"));
        assertEquals("STOP", ((StatementNode) sentences.get(1).getChildren().get(0)).getVerb());
    }

    @Test
    void programWithoutDivisionsFails() {
        SourceUnit unit = TestUtils.program("BROKEN.cbl",
                "    MOVE A TO B.",
                "    DISPLAY B.");

        UnitFailedException failure = assertThrows(UnitFailedException.class, () -> parse(unit));

        assertEquals(DiagnosticKind.NO_DIVISION_STRUCTURE, failure.getDiagnostic().getKind());
    }

    @Test
    void copybookWithoutDivisionsIsAFragment() {
        SourceUnit unit = SourceUnit.read("REC.cpy", UnitKind.COPYBOOK, TestUtils.fixed(
                "01  REC.",
                "    05  REC-ID PIC 9(4)."));

        CompilationUnitNode ast = parse(unit);

        assertTrue(ast.isFragment());
        assertTrue(ast.getProgramId().isEmpty());
    }

    @Test
    void paragraphHeaderOutsideAreaAIsReported() {
        SourceUnit unit = TestUtils.program("DEMO.cbl",
                "IDENTIFICATION DIVISION.",
                "PROGRAM-ID. DEMO.",
                "PROCEDURE DIVISION.",
                "    LATE-PARA.",
                "    STOP RUN.");

        parse(unit);

        assertEquals(1, diagnostics.ofKind(DiagnosticKind.AREA_A_VIOLATION).size());
    }

    @Test
    void relaxedDialectAcceptsHeadersInAreaB() {
        SourceUnit unit = TestUtils.program("DEMO.cbl",
                "IDENTIFICATION DIVISION.",
                "PROGRAM-ID. DEMO.",
                "PROCEDURE DIVISION.",
                "    LATE-PARA.",
                "    STOP RUN.");

        CompilationUnitNode ast = parse(unit, DialectOptions.defaults().with(DialectExtension.RELAXED_AREA_A));

        assertTrue(diagnostics.ofKind(DiagnosticKind.AREA_A_VIOLATION).isEmpty());
        assertEquals("LATE-PARA", paragraphs(ast).get(0).getName());
    }

    @Test
    void divisionsOutOfOrderAreReported() {
        parse(TestUtils.program("DEMO.cbl",
                "IDENTIFICATION DIVISION.",
                "PROGRAM-ID. DEMO.",
                "PROCEDURE DIVISION.",
                "MAIN-PARA.",
                "    STOP RUN.",
                "DATA DIVISION.",
                "WORKING-STORAGE SECTION.",
                "01  WS-A PIC X."));

        assertEquals(1, diagnostics.ofKind(DiagnosticKind.DIVISION_ORDER).size());
    }

    @Test
    void evaluateKeepsOneBlockPerWhen() {
        CompilationUnitNode ast = parse(TestUtils.program("DEMO.cbl",
                "IDENTIFICATION DIVISION.",
                "PROGRAM-ID. DEMO.",
                "PROCEDURE DIVISION.",
                "MAIN-PARA.",
                "    EVALUATE WS-CODE",
                "        WHEN 'A'",
                "            DISPLAY 'ALPHA'",
                "        WHEN OTHER",
                "            DISPLAY 'OTHER'",
                "            DISPLAY 'DONE'",
                "    END-EVALUATE.",
                "    STOP RUN."));

        StatementNode evaluate = (StatementNode) paragraphs(ast).get(0).getSentences().get(0).getChildren().get(0);
        assertEquals("EVALUATE", evaluate.getVerb());
        assertEquals(List.of("WHEN", "WHEN OTHER"),
                evaluate.getBlocks().stream().map(StatementBlock::getLabel).collect(Collectors.toList()));
        List<CobolNode> otherBranch = evaluate.getBlocks().get(1).getStatements();
        assertEquals(2, otherBranch.size());
        assertEquals("PROCEDURE/MAIN-PARA/s1/1.3", otherBranch.get(1).getId());
        assertTrue(diagnostics.ofKind(DiagnosticKind.OPAQUE_STATEMENT).isEmpty());
    }

    @Test
    void subscriptsDoNotSplitSentences() {
        CompilationUnitNode ast = parse(TestUtils.program("DEMO.cbl",
                "IDENTIFICATION DIVISION.",
                "PROGRAM-ID. DEMO.",
                "PROCEDURE DIVISION.",
                "MAIN-PARA.",
                "    MOVE WS-TABLE (WS-IDX) TO WS-A",
                "    DISPLAY WS-A.",
                "    STOP RUN."));

        assertEquals(2, paragraphs(ast).get(0).getSentences().size());
        assertTrue(diagnostics.ofKind(DiagnosticKind.UNBALANCED_PARENTHESES).isEmpty());
    }

    @Test
    void unclosedParenthesisEndsAtItsSentencePeriod() {
        CompilationUnitNode ast = parse(TestUtils.program("DEMO.cbl",
                "IDENTIFICATION DIVISION.",
                "PROGRAM-ID. DEMO.",
                "PROCEDURE DIVISION.",
                "MAIN-PARA.",
                "    COMPUTE WS-A = (WS-B + WS-C.",
                "NEXT-PARA.",
                "    DISPLAY WS-A.",
                "    STOP RUN."));

        assertEquals(1, diagnostics.ofKind(DiagnosticKind.UNBALANCED_PARENTHESES).size());
        assertEquals(5, diagnostics.ofKind(DiagnosticKind.UNBALANCED_PARENTHESES).get(0).getRange().getStartLine());
        List<ParagraphNode> paragraphs = paragraphs(ast);
        assertEquals(List.of("MAIN-PARA", "NEXT-PARA"),
                paragraphs.stream().map(ParagraphNode::getName).collect(Collectors.toList()));
        assertEquals(2, paragraphs.get(1).getSentences().size());
    }
}
