package org.dxworks.cobolscope.parser;

import org.dxworks.cobolscope.dialect.DialectExtension;
import org.dxworks.cobolscope.dialect.DialectOptions;
import org.dxworks.cobolscope.diagnostic.Diagnostic;
import org.dxworks.cobolscope.diagnostic.DiagnosticCollector;
import org.dxworks.cobolscope.diagnostic.DiagnosticKind;
import org.dxworks.cobolscope.exception.UnitFailedException;
import org.dxworks.cobolscope.lexer.Token;
import org.dxworks.cobolscope.lexer.TokenKind;
import org.dxworks.cobolscope.parser.ast.CobolNode;
import org.dxworks.cobolscope.parser.ast.CompilationUnitNode;
import org.dxworks.cobolscope.parser.ast.DataClause;
import org.dxworks.cobolscope.parser.ast.DataEntryNode;
import org.dxworks.cobolscope.parser.ast.DivisionKind;
import org.dxworks.cobolscope.parser.ast.DivisionNode;
import org.dxworks.cobolscope.parser.ast.EntryNode;
import org.dxworks.cobolscope.parser.ast.FileDescriptionNode;
import org.dxworks.cobolscope.parser.ast.OpaqueStatementNode;
import org.dxworks.cobolscope.parser.ast.ParagraphNode;
import org.dxworks.cobolscope.parser.ast.SectionNode;
import org.dxworks.cobolscope.parser.ast.SentenceNode;
import org.dxworks.cobolscope.parser.ast.Word;
import org.dxworks.cobolscope.source.SourceRange;
import org.dxworks.cobolscope.source.SourceUnit;
import org.dxworks.cobolscope.source.UnitKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Recursive-descent parser over divisions, sections, paragraphs and sentences.
 *
 * <p>Only two conditions fail a unit: a program without any division header, and a division
 * header that never reaches its period. Everything else is reported and parsing goes on; a
 * sentence whose statements cannot be structured is kept as an {@link OpaqueStatementNode}.</p>
 */
public class CobolParser {

    private static final Logger LOG = LoggerFactory.getLogger(CobolParser.class);

    private static final Map<String, DivisionKind> DIVISION_HEADERS = Map.of(
            "IDENTIFICATION", DivisionKind.IDENTIFICATION,
            "ID", DivisionKind.IDENTIFICATION,
            "ENVIRONMENT", DivisionKind.ENVIRONMENT,
            "DATA", DivisionKind.DATA,
            "PROCEDURE", DivisionKind.PROCEDURE);

    private static final Set<String> IDENTIFICATION_PARAGRAPHS = Set.of(
            "PROGRAM-ID", "AUTHOR", "INSTALLATION", "DATE-WRITTEN", "DATE-COMPILED", "SECURITY", "REMARKS");

    private static final Set<String> ENVIRONMENT_PARAGRAPHS = Set.of(
            "SOURCE-COMPUTER", "OBJECT-COMPUTER", "SPECIAL-NAMES", "REPOSITORY", "FILE-CONTROL", "I-O-CONTROL");

    private static final Set<String> FILE_INDICATORS = Set.of("FD", "SD", "RD", "CD");

    private static final Set<String> CLAUSE_KEYWORDS = Set.of(
            "REDEFINES", "PIC", "PICTURE", "USAGE", "VALUE", "VALUES", "OCCURS", "SIGN", "SYNC", "SYNCHRONIZED",
            "JUST", "JUSTIFIED", "BLANK", "EXTERNAL", "GLOBAL", "RENAMES", "INDEXED", "ASCENDING", "DESCENDING",
            "DEPENDING");

    private static final Set<String> USAGE_WORDS = Set.of(
            "COMP", "COMP-1", "COMP-2", "COMP-3", "COMP-4", "COMP-5", "COMPUTATIONAL", "COMPUTATIONAL-1",
            "COMPUTATIONAL-2", "COMPUTATIONAL-3", "COMPUTATIONAL-4", "COMPUTATIONAL-5", "BINARY", "PACKED-DECIMAL",
            "DISPLAY", "INDEX", "POINTER", "NATIONAL", "FUNCTION-POINTER", "PROCEDURE-POINTER");

    private final DialectOptions dialect;
    private final StatementParser statementParser;

    public CobolParser(DialectOptions dialect) {
        this.dialect = dialect;
        this.statementParser = new StatementParser(dialect);
    }

    public CompilationUnitNode parse(SourceUnit unit, List<Token> allTokens, DiagnosticCollector diagnostics) {
        return new UnitParse(unit, allTokens, diagnostics).run();
    }

    private final class UnitParse {
        private final SourceUnit unit;
        private final List<Token> tokens;
        private final DiagnosticCollector diagnostics;
        private String programId;
        private SourceRange programIdRange;

        private UnitParse(SourceUnit unit, List<Token> allTokens, DiagnosticCollector diagnostics) {
            this.unit = unit;
            this.tokens = allTokens.stream().filter(t -> !t.getKind().isTrivia()).collect(Collectors.toList());
            this.diagnostics = diagnostics;
        }

        CompilationUnitNode run() {
            List<Token> body = cutEndProgram(tokens);
            List<Integer> headers = findDivisionHeaders(body);

            if (headers.isEmpty()) {
                if (unit.getKind() == UnitKind.COPYBOOK) {
                    return fragment(body);
                }
                SourceRange at = body.isEmpty() ? null : body.get(0).getRange();
                throw new UnitFailedException(new Diagnostic(DiagnosticKind.NO_DIVISION_STRUCTURE,
                        "No division header found in " + unit.getId(), at));
            }

            if (headers.get(0) > 0) {
                List<Token> stray = body.subList(0, headers.get(0));
                diagnostics.report(DiagnosticKind.STRAY_TEXT,
                        "Text before the first division header is ignored", spanOf(stray));
            }

            List<DivisionNode> divisions = new ArrayList<>();
            DivisionKind previous = null;
            for (int h = 0; h < headers.size(); h++) {
                int start = headers.get(h);
                int end = h + 1 < headers.size() ? headers.get(h + 1) : body.size();
                Token headerToken = body.get(start);
                DivisionKind kind = DIVISION_HEADERS.get(headerToken.upper());

                int period = findHeaderPeriod(body, start + 2, end);
                if (period < 0) {
                    throw new UnitFailedException(new Diagnostic(DiagnosticKind.UNTERMINATED_DIVISION_HEADER,
                            kind + " DIVISION header is not terminated by a period", headerToken.getRange()));
                }
                checkAreaA(headerToken, kind + " DIVISION header");
                if (previous != null && kind.ordinal() <= previous.ordinal()) {
                    diagnostics.report(DiagnosticKind.DIVISION_ORDER,
                            kind + " DIVISION follows " + previous + " DIVISION", headerToken.getRange());
                }
                previous = kind;

                List<Word> headerWords = words(body.subList(start + 2, period));
                List<Token> content = body.subList(period + 1, end);
                SourceRange range = spanOf(body.subList(start, end));
                divisions.add(division(kind, range, headerWords, content));
            }

            SourceRange unitRange = body.isEmpty() ? null : spanOf(body);
            LOG.debug("Parsed {}: {} divisions, program {}", unit.getId(), divisions.size(), programId);
            return new CompilationUnitNode(unit.getId(), programId, programIdRange, false, unitRange, divisions);
        }

        private CompilationUnitNode fragment(List<Token> body) {
            List<DivisionNode> divisions = new ArrayList<>();
            if (!body.isEmpty()) {
                Token first = body.get(0);
                boolean data = levelNumber(first) != null || FILE_INDICATORS.contains(first.upper());
                DivisionKind kind = data ? DivisionKind.DATA : DivisionKind.PROCEDURE;
                divisions.add(division(kind, spanOf(body), List.of(), body));
            }
            SourceRange range = body.isEmpty() ? null : spanOf(body);
            return new CompilationUnitNode(unit.getId(), null, null, true, range, divisions);
        }

        private List<Token> cutEndProgram(List<Token> all) {
            for (int i = 0; i + 1 < all.size(); i++) {
                if (all.get(i).is("END") && all.get(i + 1).is("PROGRAM")) {
                    int after = i + 2;
                    while (after < all.size() && !all.get(after).isPeriod()) {
                        after++;
                    }
                    if (after + 1 < all.size()) {
                        diagnostics.report(DiagnosticKind.STRAY_TEXT,
                                "Text after END PROGRAM is ignored", spanOf(all.subList(after + 1, all.size())));
                    }
                    return all.subList(0, i);
                }
            }
            return all;
        }

        private List<Integer> findDivisionHeaders(List<Token> body) {
            List<Integer> headers = new ArrayList<>();
            for (int i = 0; i + 1 < body.size(); i++) {
                Token t = body.get(i);
                if (t.isWord() && DIVISION_HEADERS.containsKey(t.upper()) && body.get(i + 1).is("DIVISION")) {
                    headers.add(i);
                }
            }
            return headers;
        }

        private int findHeaderPeriod(List<Token> body, int from, int end) {
            for (int i = from; i < body.size(); i++) {
                if (body.get(i).isPeriod()) {
                    return i < end || end == body.size() ? i : -1;
                }
            }
            return -1;
        }

        private DivisionNode division(DivisionKind kind, SourceRange range, List<Word> headerWords, List<Token> content) {
            List<List<Token>> sentences = splitSentences(content);
            List<CobolNode> children;
            switch (kind) {
                case IDENTIFICATION:
                    children = identification(sentences);
                    break;
                case ENVIRONMENT:
                    children = environment(sentences);
                    break;
                case DATA:
                    children = data(sentences);
                    break;
                default:
                    children = procedure(sentences);
                    break;
            }
            return new DivisionNode(kind, range, headerWords, children);
        }

        // IDENTIFICATION DIVISION

        private List<CobolNode> identification(List<List<Token>> sentences) {
            String divisionId = DivisionKind.IDENTIFICATION.name();
            List<CobolNode> paragraphs = new ArrayList<>();
            ParagraphBuilder current = null;
            for (List<Token> sentence : sentences) {
                Token first = sentence.get(0);
                if (first.isWord() && IDENTIFICATION_PARAGRAPHS.contains(first.upper())) {
                    if (current != null) {
                        paragraphs.add(current.build());
                    }
                    checkAreaA(first, first.upper() + " paragraph");
                    current = new ParagraphBuilder(divisionId + "/" + first.upper(), first.upper(), Word.of(first), first);
                    List<Token> rest = withoutPeriod(sentence).subList(1, withoutPeriod(sentence).size());
                    if (!rest.isEmpty()) {
                        current.addEntry(rest, sentence);
                    }
                    continue;
                }
                if (current == null) {
                    diagnostics.report(DiagnosticKind.STRAY_TEXT,
                            "Text outside any IDENTIFICATION DIVISION paragraph", spanOf(sentence));
                    continue;
                }
                current.addEntry(withoutPeriod(sentence), sentence);
            }
            if (current != null) {
                paragraphs.add(current.build());
            }

            for (CobolNode node : paragraphs) {
                ParagraphNode paragraph = (ParagraphNode) node;
                if ("PROGRAM-ID".equals(paragraph.getName()) && !paragraph.getSentences().isEmpty()) {
                    EntryNode entry = (EntryNode) paragraph.getSentences().get(0).getChildren().get(0);
                    if (!entry.getWords().isEmpty()) {
                        Word name = entry.getWords().get(0);
                        programId = name.literalValue().trim().toUpperCase(Locale.ROOT);
                        programIdRange = name.getRange();
                    }
                }
            }
            return paragraphs;
        }

        // ENVIRONMENT DIVISION

        private List<CobolNode> environment(List<List<Token>> sentences) {
            String divisionId = DivisionKind.ENVIRONMENT.name();
            List<CobolNode> children = new ArrayList<>();
            SectionBuilder section = null;
            ParagraphBuilder paragraph = null;

            for (List<Token> sentence : sentences) {
                List<Token> words = withoutPeriod(sentence);
                Token first = sentence.get(0);
                if (isSectionHeader(words)) {
                    if (paragraph != null) {
                        addTo(section, children, paragraph.build());
                        paragraph = null;
                    }
                    if (section != null) {
                        children.add(section.build());
                    }
                    checkAreaA(first, first.upper() + " SECTION header");
                    section = new SectionBuilder(divisionId + "/" + first.upper(), first.upper(), Word.of(first), false, first);
                    continue;
                }
                if (words.size() == 1 && first.isWord() && ENVIRONMENT_PARAGRAPHS.contains(first.upper())) {
                    if (paragraph != null) {
                        addTo(section, children, paragraph.build());
                    }
                    checkAreaA(first, first.upper() + " paragraph");
                    String parentId = section != null ? section.id : divisionId;
                    paragraph = new ParagraphBuilder(parentId + "/" + first.upper(), first.upper(), Word.of(first), first);
                    continue;
                }
                if (paragraph == null) {
                    diagnostics.report(DiagnosticKind.STRAY_TEXT,
                            "Text outside any ENVIRONMENT DIVISION paragraph", spanOf(sentence));
                    continue;
                }
                paragraph.addEntry(words, sentence);
            }
            if (paragraph != null) {
                addTo(section, children, paragraph.build());
            }
            if (section != null) {
                children.add(section.build());
            }
            return children;
        }

        private void addTo(SectionBuilder section, List<CobolNode> divisionChildren, CobolNode node) {
            if (section != null) {
                section.children.add(node);
            } else {
                divisionChildren.add(node);
            }
        }

        // DATA DIVISION

        private List<CobolNode> data(List<List<Token>> sentences) {
            String divisionId = DivisionKind.DATA.name();
            List<CobolNode> sections = new ArrayList<>();
            SectionBuilder section = null;
            FileBuilder file = null;
            int anonymousSections = 0;

            for (List<Token> sentence : sentences) {
                List<Token> words = withoutPeriod(sentence);
                Token first = sentence.get(0);

                if (isSectionHeader(words)) {
                    if (file != null) {
                        section.children.add(file.build());
                        file = null;
                    }
                    if (section != null) {
                        sections.add(section.build());
                    }
                    checkAreaA(first, first.upper() + " SECTION header");
                    section = new SectionBuilder(divisionId + "/" + first.upper(), first.upper(), Word.of(first), false, first);
                    continue;
                }

                if (section == null) {
                    anonymousSections++;
                    section = new SectionBuilder(divisionId + "/#s" + anonymousSections, null, null, false, first);
                }

                if (first.isWord() && FILE_INDICATORS.contains(first.upper())) {
                    if (file != null) {
                        section.children.add(file.build());
                    }
                    checkAreaA(first, first.upper() + " entry");
                    section.fileCount++;
                    file = new FileBuilder(section.id + "/fd" + section.fileCount, first, words, sentence);
                    continue;
                }

                Integer level = levelNumber(first);
                if (level != null) {
                    section.entryCount++;
                    DataEntryNode entry = dataEntry(section.id + "/d" + section.entryCount, level, words, sentence);
                    if (level == 1 || level == 77) {
                        checkAreaA(first, "Level " + first.getText() + " entry");
                    }
                    if (file != null && level != 77) {
                        file.records.add(entry);
                        file.last = sentence.get(sentence.size() - 1);
                    } else {
                        if (file != null) {
                            section.children.add(file.build());
                            file = null;
                        }
                        section.children.add(entry);
                    }
                    continue;
                }

                section.entryCount++;
                String id = section.id + "/d" + section.entryCount;
                if (first.is("EXEC")) {
                    section.children.add(sentenceOrOpaque(id, sentence));
                    continue;
                }
                diagnostics.report(DiagnosticKind.OPAQUE_STATEMENT,
                        "Unrecognized data description: " + first.getText(), spanOf(sentence));
                section.children.add(new OpaqueStatementNode(id, spanOf(sentence), words(words),
                        "not a data description entry"));
            }

            if (file != null) {
                section.children.add(file.build());
            }
            if (section != null) {
                sections.add(section.build());
            }
            return sections;
        }

        private DataEntryNode dataEntry(String id, int level, List<Token> words, List<Token> sentence) {
            Token levelToken = words.get(0);
            int i = 1;
            Word nameWord = null;
            String name = null;
            if (i < words.size()) {
                Token candidate = words.get(i);
                if (candidate.getKind() == TokenKind.IDENTIFIER) {
                    nameWord = Word.of(candidate);
                    name = candidate.upper();
                    i++;
                } else if (candidate.is("FILLER")) {
                    nameWord = Word.of(candidate);
                    i++;
                }
            }

            List<DataClause> clauses = new ArrayList<>();
            String keyword = null;
            Word keywordWord = null;
            List<Word> operands = new ArrayList<>();
            for (; i < words.size(); i++) {
                Token t = words.get(i);
                String upper = t.upper();
                boolean startsClause = t.isWord() && CLAUSE_KEYWORDS.contains(upper);
                boolean usageWord = t.isWord() && USAGE_WORDS.contains(upper)
                        && !("USAGE".equals(keyword) && operands.stream().noneMatch(w -> !w.is("IS")));
                if (startsClause || usageWord) {
                    if (keyword != null) {
                        clauses.add(new DataClause(keyword, keywordWord, operands));
                    }
                    keywordWord = Word.of(t);
                    operands = new ArrayList<>();
                    if (usageWord) {
                        keyword = "USAGE";
                        operands.add(Word.of(t));
                    } else {
                        keyword = canonicalClause(upper);
                    }
                    continue;
                }
                if (keyword == null) {
                    keyword = "?";
                    keywordWord = Word.of(t);
                }
                operands.add(Word.of(t));
            }
            if (keyword != null) {
                clauses.add(new DataClause(keyword, keywordWord, operands));
            }
            return new DataEntryNode(id, name, spanOf(sentence), level, Word.of(levelToken), nameWord, clauses);
        }

        private String canonicalClause(String keyword) {
            switch (keyword) {
                case "PICTURE":
                    return "PIC";
                case "VALUES":
                    return "VALUE";
                case "SYNCHRONIZED":
                    return "SYNC";
                case "JUSTIFIED":
                    return "JUST";
                default:
                    return keyword;
            }
        }

        // PROCEDURE DIVISION

        private List<CobolNode> procedure(List<List<Token>> sentences) {
            String divisionId = DivisionKind.PROCEDURE.name();
            List<CobolNode> children = new ArrayList<>();
            Map<String, Integer> sectionNames = new HashMap<>();
            SectionBuilder section = null;
            ParagraphBuilder paragraph = null;
            Map<String, Integer> paragraphNames = new HashMap<>();
            int paragraphOrdinal = 0;
            boolean declaratives = false;

            for (List<Token> sentence : sentences) {
                List<Token> words = withoutPeriod(sentence);
                Token first = sentence.get(0);

                if (words.size() == 1 && first.is("DECLARATIVES")) {
                    declaratives = true;
                    continue;
                }
                if (words.size() == 2 && first.is("END") && words.get(1).is("DECLARATIVES")) {
                    if (paragraph != null) {
                        addTo(section, children, paragraph.build());
                        paragraph = null;
                    }
                    if (section != null) {
                        children.add(section.build());
                        section = null;
                    }
                    declaratives = false;
                    continue;
                }

                if (isProcedureSectionHeader(words)) {
                    if (paragraph != null) {
                        addTo(section, children, paragraph.build());
                        paragraph = null;
                    }
                    if (section != null) {
                        children.add(section.build());
                    }
                    checkAreaA(first, "Section header " + first.getText());
                    String name = first.upper();
                    String id = unique(divisionId + "/" + name, sectionNames);
                    section = new SectionBuilder(id, name, Word.of(first), declaratives, first);
                    paragraphNames = new HashMap<>();
                    paragraphOrdinal = 0;
                    continue;
                }

                if (words.size() == 1 && isProcedureName(first)) {
                    if (paragraph != null) {
                        addTo(section, children, paragraph.build());
                    }
                    checkAreaA(first, "Paragraph header " + first.getText());
                    paragraphOrdinal++;
                    String parentId = section != null ? section.id : divisionId;
                    String name = first.upper();
                    paragraph = new ParagraphBuilder(unique(parentId + "/" + name, paragraphNames), name, Word.of(first), first);
                    continue;
                }

                if (paragraph == null) {
                    paragraphOrdinal++;
                    String parentId = section != null ? section.id : divisionId;
                    paragraph = new ParagraphBuilder(parentId + "/#p" + paragraphOrdinal, null, null, first);
                }
                paragraph.sentenceCount++;
                String sentenceId = paragraph.id + "/s" + paragraph.sentenceCount;
                paragraph.sentences.add(sentenceOrOpaque(sentenceId, sentence));
                paragraph.last = sentence.get(sentence.size() - 1);
            }

            if (paragraph != null) {
                addTo(section, children, paragraph.build());
            }
            if (section != null) {
                children.add(section.build());
            }
            return children;
        }

        private SentenceNode sentenceOrOpaque(String sentenceId, List<Token> sentence) {
            List<Token> words = withoutPeriod(sentence);
            SourceRange range = spanOf(sentence);
            try {
                return new SentenceNode(sentenceId, range, statementParser.parse(words, sentenceId));
            } catch (SentenceSyntaxException e) {
                SourceRange at = e.getToken() != null ? e.getToken().getRange() : range;
                diagnostics.report(DiagnosticKind.OPAQUE_STATEMENT, e.getMessage(), at);
                OpaqueStatementNode opaque = new OpaqueStatementNode(sentenceId + "/1", range, words(words), e.getMessage());
                return new SentenceNode(sentenceId, range, List.of(opaque));
            }
        }

        private boolean isProcedureSectionHeader(List<Token> words) {
            if (words.size() < 2 || words.size() > 3 || !isProcedureName(words.get(0)) || !words.get(1).is("SECTION")) {
                return false;
            }
            return words.size() == 2 || words.get(2).getKind() == TokenKind.NUMERIC_LITERAL;
        }

        private boolean isProcedureName(Token token) {
            return token.getKind() == TokenKind.IDENTIFIER
                    || (token.getKind() == TokenKind.NUMERIC_LITERAL && token.getText().chars().allMatch(Character::isDigit));
        }

        private String unique(String id, Map<String, Integer> seen) {
            int count = seen.merge(id, 1, Integer::sum);
            return count == 1 ? id : id + "~" + count;
        }

        // shared helpers

        private boolean isSectionHeader(List<Token> words) {
            return words.size() == 2 && words.get(0).isWord() && words.get(1).is("SECTION");
        }

        private void checkAreaA(Token token, String what) {
            if (!token.isAreaA() && !dialect.has(DialectExtension.RELAXED_AREA_A)) {
                diagnostics.report(DiagnosticKind.AREA_A_VIOLATION, what + " does not start in Area A", token.getRange());
            }
        }

        private List<List<Token>> splitSentences(List<Token> content) {
            List<List<Token>> sentences = new ArrayList<>();
            int start = 0;
            int depth = 0;
            int pendingPeriod = -1;
            boolean inExec = false;
            for (int i = 0; i < content.size(); i++) {
                Token t = content.get(i);
                if (t.is("EXEC")) {
                    inExec = true;
                } else if (t.is("END-EXEC")) {
                    inExec = false;
                } else if (t.isSeparator('(')) {
                    depth++;
                } else if (t.isSeparator(')')) {
                    depth = Math.max(0, depth - 1);
                    if (depth == 0) {
                        pendingPeriod = -1;
                    }
                } else if (t.isPeriod() && !inExec) {
                    if (depth == 0) {
                        if (i > start) {
                            sentences.add(content.subList(start, i + 1));
                        }
                        start = i + 1;
                    } else if (pendingPeriod < 0) {
                        pendingPeriod = i;
                    }
                }
                if (i == content.size() - 1 && depth > 0 && pendingPeriod >= 0) {
                    // never closed: end the sentence at the first period inside it and rescan the rest
                    diagnostics.report(DiagnosticKind.UNBALANCED_PARENTHESES,
                            "Unclosed parenthesis before end of sentence", content.get(pendingPeriod).getRange());
                    sentences.add(content.subList(start, pendingPeriod + 1));
                    start = pendingPeriod + 1;
                    i = pendingPeriod;
                    depth = 0;
                    pendingPeriod = -1;
                    inExec = false;
                }
            }
            if (start < content.size()) {
                sentences.add(content.subList(start, content.size()));
            }
            return sentences;
        }
    }

    private static Integer levelNumber(Token token) {
        if (token.getKind() != TokenKind.NUMERIC_LITERAL || !token.getText().chars().allMatch(Character::isDigit)
                || token.getText().length() > 2) {
            return null;
        }
        return Integer.parseInt(token.getText());
    }

    private static List<Token> withoutPeriod(List<Token> sentence) {
        if (!sentence.isEmpty() && sentence.get(sentence.size() - 1).isPeriod()) {
            return sentence.subList(0, sentence.size() - 1);
        }
        return sentence;
    }

    private static List<Word> words(List<Token> tokens) {
        List<Word> words = new ArrayList<>(tokens.size());
        for (Token t : tokens) {
            words.add(Word.of(t));
        }
        return words;
    }

    private static SourceRange spanOf(List<Token> tokens) {
        return SourceRange.span(tokens.get(0).getRange(), tokens.get(tokens.size() - 1).getRange());
    }

    private static final class SectionBuilder {
        private final String id;
        private final String name;
        private final Word nameWord;
        private final boolean declarative;
        private final Token first;
        private final List<CobolNode> children = new ArrayList<>();
        private int entryCount;
        private int fileCount;

        private SectionBuilder(String id, String name, Word nameWord, boolean declarative, Token first) {
            this.id = id;
            this.name = name;
            this.nameWord = nameWord;
            this.declarative = declarative;
            this.first = first;
        }

        SectionNode build() {
            SourceRange last = children.isEmpty() ? null : children.get(children.size() - 1).getRange();
            return new SectionNode(id, name, nameWord, declarative, SourceRange.span(first.getRange(), last), children);
        }
    }

    private static final class ParagraphBuilder {
        private final String id;
        private final String name;
        private final Word nameWord;
        private final Token first;
        private final List<SentenceNode> sentences = new ArrayList<>();
        private Token last;
        private int sentenceCount;

        private ParagraphBuilder(String id, String name, Word nameWord, Token first) {
            this.id = id;
            this.name = name;
            this.nameWord = nameWord;
            this.first = first;
            this.last = first;
        }

        void addEntry(List<Token> words, List<Token> sentence) {
            sentenceCount++;
            String sentenceId = id + "/s" + sentenceCount;
            SourceRange range = spanOf(sentence);
            EntryNode entry = new EntryNode(sentenceId + "/e", range, words(words));
            sentences.add(new SentenceNode(sentenceId, range, List.of(entry)));
            last = sentence.get(sentence.size() - 1);
        }

        ParagraphNode build() {
            return new ParagraphNode(id, name, nameWord, SourceRange.span(first.getRange(), last.getRange()), sentences);
        }
    }

    private static final class FileBuilder {
        private final String id;
        private final Token indicator;
        private final Word nameWord;
        private final List<Word> clauseWords;
        private final List<DataEntryNode> records = new ArrayList<>();
        private Token last;

        private FileBuilder(String id, Token indicator, List<Token> words, List<Token> sentence) {
            this.id = id;
            this.indicator = indicator;
            this.nameWord = words.size() > 1 ? Word.of(words.get(1)) : null;
            this.clauseWords = words.size() > 2 ? words(words.subList(2, words.size())) : List.of();
            this.last = sentence.get(sentence.size() - 1);
        }

        FileDescriptionNode build() {
            String name = nameWord != null ? nameWord.upper() : null;
            return new FileDescriptionNode(id, name, SourceRange.span(indicator.getRange(), last.getRange()),
                    indicator.upper(), nameWord, clauseWords, records);
        }
    }
}
