package org.dxworks.cobolscope.builder;

import org.dxworks.cobolscope.diagnostic.DiagnosticCollector;
import org.dxworks.cobolscope.diagnostic.DiagnosticKind;
import org.dxworks.cobolscope.lexer.TokenKind;
import org.dxworks.cobolscope.model.AccessKind;
import org.dxworks.cobolscope.model.DataAccess;
import org.dxworks.cobolscope.model.DataItem;
import org.dxworks.cobolscope.model.DataItemTable;
import org.dxworks.cobolscope.model.Edge;
import org.dxworks.cobolscope.model.EdgeKind;
import org.dxworks.cobolscope.model.ProcedureKind;
import org.dxworks.cobolscope.model.ProcedureNode;
import org.dxworks.cobolscope.model.SymbolKind;
import org.dxworks.cobolscope.model.SymbolOccurrence;
import org.dxworks.cobolscope.model.SymbolRole;
import org.dxworks.cobolscope.parser.ast.CobolNode;
import org.dxworks.cobolscope.parser.ast.DivisionNode;
import org.dxworks.cobolscope.parser.ast.OpaqueStatementNode;
import org.dxworks.cobolscope.parser.ast.ParagraphNode;
import org.dxworks.cobolscope.parser.ast.SectionNode;
import org.dxworks.cobolscope.parser.ast.SentenceNode;
import org.dxworks.cobolscope.parser.ast.StatementBlock;
import org.dxworks.cobolscope.parser.ast.StatementNode;
import org.dxworks.cobolscope.parser.ast.Word;
import org.dxworks.cobolscope.source.SourceRange;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Second builder pass: collects sections and paragraphs as procedures, scans each sentence for
 * control transfers and data accesses, and resolves PERFORM and GO TO targets within the unit.
 *
 * <p>A procedure name resolves by qualification ({@code P OF S}) first, then to the unique
 * procedure of that name, then to the unique paragraph of that name in the referring section.
 * Names that match nothing are dangling; names that match several are ambiguous. Either way the
 * edge is kept with a null target id.</p>
 */
class ProcedureDivisionPass {

    private static final Set<String> USING_NOISE = Set.of("BY", "REFERENCE", "VALUE", "CONTENT", "OPTIONAL");
    private static final Set<String> DECISION_WORDS = Set.of("WHEN", "UNTIL", "WHILE");

    private final DataItemTable data;
    private final Set<String> fileNames;
    private final Set<String> indexNames;
    private final DiagnosticCollector diagnostics;

    private final List<Procedure> procedures = new ArrayList<>();
    private final Map<String, List<Procedure>> byName = new LinkedHashMap<>();
    private final List<SymbolOccurrence> symbols = new ArrayList<>();
    private final List<String> using = new ArrayList<>();
    private final Set<String> execKinds = new TreeSet<>();
    private String returning;
    private int statementCount;
    private int decisionPoints;

    ProcedureDivisionPass(DataItemTable data, Set<String> fileNames, Set<String> indexNames,
                          DiagnosticCollector diagnostics) {
        this.data = data;
        this.fileNames = fileNames;
        this.indexNames = indexNames;
        this.diagnostics = diagnostics;
    }

    List<ProcedureNode> run(Optional<DivisionNode> division) {
        if (division.isEmpty()) {
            return List.of();
        }
        DivisionNode procedureDivision = division.get();
        extractUsingParameters(procedureDivision.getHeaderWords());
        collectProcedures(procedureDivision);
        for (Procedure procedure : procedures) {
            scan(procedure);
        }
        return procedures.stream().map(Procedure::toNode).collect(Collectors.toList());
    }

    List<SymbolOccurrence> getSymbols() {
        return symbols;
    }

    List<String> getUsing() {
        return using;
    }

    String getReturning() {
        return returning;
    }

    List<String> getExecKinds() {
        return new ArrayList<>(execKinds);
    }

    int getStatementCount() {
        return statementCount;
    }

    int getDecisionPoints() {
        return decisionPoints;
    }

    // Extract PROCEDURE DIVISION USING / RETURNING parameter names.
    private void extractUsingParameters(List<Word> header) {
        boolean inUsing = false;
        boolean inReturning = false;
        for (Word w : header) {
            if (w.is("USING")) {
                inUsing = true;
                inReturning = false;
            } else if (w.is("RETURNING")) {
                inUsing = false;
                inReturning = true;
            } else if (w.isIdentifier() && (inUsing || inReturning)) {
                if (inUsing) {
                    using.add(w.upper());
                } else if (returning == null) {
                    returning = w.upper();
                }
                symbols.add(new SymbolOccurrence(w.upper(), w.getRange(), SymbolRole.REFERENCE, classify(w.upper()),
                        "PROCEDURE"));
            } else if (!USING_NOISE.contains(w.upper())) {
                inUsing = false;
            }
        }
    }

    // Track sections and their paragraphs in source order.
    private void collectProcedures(DivisionNode division) {
        for (CobolNode child : division.getChildren()) {
            if (child instanceof SectionNode) {
                SectionNode section = (SectionNode) child;
                Procedure sectionProcedure = register(new Procedure(section.getId(), ProcedureKind.SECTION,
                        section.getName(), null, section.isDeclarative(), section.getRange(), List.of()));
                defineName(section.getNameWord(), section.getId());
                for (CobolNode sectionChild : section.getChildren()) {
                    if (sectionChild instanceof ParagraphNode) {
                        ParagraphNode paragraph = (ParagraphNode) sectionChild;
                        Procedure p = register(new Procedure(paragraph.getId(), ProcedureKind.PARAGRAPH,
                                paragraph.getName(), section.getName(), section.isDeclarative(), paragraph.getRange(),
                                paragraph.getSentences()));
                        defineName(paragraph.getNameWord(), paragraph.getId());
                        if (p.name != null) {
                            sectionProcedure.edges.add(new Edge(section.getId(), EdgeKind.CONTAINS, p.name, p.id,
                                    null, null, false, paragraph.getRange()));
                        }
                    }
                }
            } else if (child instanceof ParagraphNode) {
                ParagraphNode paragraph = (ParagraphNode) child;
                register(new Procedure(paragraph.getId(), ProcedureKind.PARAGRAPH, paragraph.getName(), null, false,
                        paragraph.getRange(), paragraph.getSentences()));
                defineName(paragraph.getNameWord(), paragraph.getId());
            }
        }
    }

    private Procedure register(Procedure procedure) {
        procedures.add(procedure);
        if (procedure.name != null) {
            byName.computeIfAbsent(procedure.name, k -> new ArrayList<>()).add(procedure);
        }
        return procedure;
    }

    private void defineName(Word nameWord, String id) {
        if (nameWord != null) {
            symbols.add(new SymbolOccurrence(nameWord.upper(), nameWord.getRange(), SymbolRole.DEFINITION,
                    SymbolKind.PROCEDURE, id));
        }
    }

    private void scan(Procedure procedure) {
        for (SentenceNode sentence : procedure.sentences) {
            for (CobolNode node : sentence.getChildren()) {
                scanNode(procedure, node);
            }
        }
    }

    private void scanNode(Procedure procedure, CobolNode node) {
        if (node instanceof StatementNode) {
            visitStatement(procedure, (StatementNode) node);
        } else if (node instanceof OpaqueStatementNode) {
            visitOpaque(procedure, (OpaqueStatementNode) node);
        }
    }

    private void visitStatement(Procedure procedure, StatementNode statement) {
        statementCount++;
        String verb = statement.getVerb();
        List<Word> words = statement.getWords();
        Map<Word, SymbolKind> procedureWords = new IdentityHashMap<>();

        switch (verb) {
            case "IF":
                decisionPoints++;
                addAccesses(procedure, statement, DataAccessExtractor.conditionOperands(words));
                break;
            case "EVALUATE":
                addAccesses(procedure, statement, DataAccessExtractor.conditionOperands(words));
                break;
            case "PERFORM":
                decisionPoints++;
                visitPerform(procedure, statement, procedureWords);
                break;
            case "GO":
                visitGoTo(procedure, statement, procedureWords);
                break;
            case "CALL":
                visitCall(procedure, statement);
                break;
            case "EXEC":
                visitExec(procedure, statement);
                break;
            default:
                addAccesses(procedure, statement, DataAccessExtractor.operands(verb, words));
                break;
        }
        decisionPoints += countDecisionWords(words);
        referenceSymbols(words, statement.getId(), procedureWords);

        for (StatementBlock block : statement.getBlocks()) {
            if (block.getLabel().startsWith("WHEN")) {
                decisionPoints++;
            }
            addAccesses(procedure, statement, DataAccessExtractor.conditionOperands(block.getWords()));
            referenceSymbols(block.getWords(), statement.getId(), Map.of());
            for (CobolNode nested : block.getStatements()) {
                scanNode(procedure, nested);
            }
        }
    }

    // Extract PERFORM calls (target procedure and optional THRU procedure).
    private void visitPerform(Procedure procedure, StatementNode statement, Map<Word, SymbolKind> procedureWords) {
        List<Word> words = statement.getWords();
        if (statement.isInline()) {
            addAccesses(procedure, statement, DataAccessExtractor.operands("PERFORM", words));
            return;
        }
        int i = 0;
        ProcedureRef target = procedureRef(words, i);
        i = target.next;
        ProcedureRef thru = null;
        if (i < words.size() && (words.get(i).is("THRU") || words.get(i).is("THROUGH"))) {
            thru = procedureRef(words, i + 1);
            i = thru.next;
        }
        String targetId = resolve(target, procedure, true, procedureWords);
        String thruId = thru != null ? resolve(thru, procedure, true, procedureWords) : null;
        procedure.edges.add(new Edge(procedure.id, EdgeKind.PERFORM, target.name, targetId,
                thru != null ? thru.name : null, thruId, false, statement.getRange()));
        addAccesses(procedure, statement, DataAccessExtractor.operands("PERFORM", words.subList(i, words.size())));
    }

    // Extract GO TO targets; DEPENDING ON adds one edge per listed procedure.
    private void visitGoTo(Procedure procedure, StatementNode statement, Map<Word, SymbolKind> procedureWords) {
        List<Word> words = statement.getWords();
        int i = 0;
        if (i < words.size() && words.get(i).is("TO")) {
            i++;
        }
        while (i < words.size() && !words.get(i).is("DEPENDING")) {
            Word w = words.get(i);
            if (!w.isIdentifier() && w.getKind() != TokenKind.NUMERIC_LITERAL) {
                i++;
                continue;
            }
            ProcedureRef target = procedureRef(words, i);
            String targetId = resolve(target, procedure, true, procedureWords);
            procedure.edges.add(new Edge(procedure.id, EdgeKind.GO_TO, target.name, targetId, null, null, false,
                    statement.getRange()));
            i = target.next;
        }
        addAccesses(procedure, statement, DataAccessExtractor.operands("GO", words.subList(i, words.size())));
    }

    // Extract external calls; an identifier target resolves through its VALUE literal when it has one.
    private void visitCall(Procedure procedure, StatementNode statement) {
        List<Word> words = statement.getWords();
        if (words.isEmpty()) {
            return;
        }
        Word program = words.get(0);
        String target;
        boolean dynamic;
        if (program.getKind() == TokenKind.STRING_LITERAL) {
            target = program.literalValue().trim().toUpperCase(Locale.ROOT);
            dynamic = false;
            symbols.add(new SymbolOccurrence(target, program.getRange(), SymbolRole.REFERENCE, SymbolKind.PROGRAM,
                    statement.getId()));
        } else {
            target = staticValueOf(program.upper()).orElse(program.upper());
            dynamic = true;
            addAccesses(procedure, statement,
                    List.of(new DataAccessExtractor.Operand(program, List.of(), AccessKind.READ)));
        }
        addCallEdge(procedure, target, dynamic, statement.getRange());
        addAccesses(procedure, statement, DataAccessExtractor.operands("CALL", words));
    }

    // EXEC blocks: record the kind, link CICS LINK/XCTL as calls, classify host variables.
    private void visitExec(Procedure procedure, StatementNode statement) {
        List<Word> words = statement.getWords();
        if (words.isEmpty()) {
            return;
        }
        String kind = words.get(0).upper();
        execKinds.add(kind);
        if ("CICS".equals(kind)) {
            boolean transfer = words.stream().anyMatch(w -> w.is("LINK") || w.is("XCTL"));
            for (int i = 0; transfer && i + 2 < words.size(); i++) {
                if (words.get(i).is("PROGRAM") && words.get(i + 1).isSeparator('(')) {
                    Word program = words.get(i + 2);
                    boolean literal = program.getKind() == TokenKind.STRING_LITERAL;
                    String target = literal
                            ? program.literalValue().trim().toUpperCase(Locale.ROOT)
                            : staticValueOf(program.upper()).orElse(program.upper());
                    addCallEdge(procedure, target, !literal, statement.getRange());
                    break;
                }
            }
        }

        List<DataAccessExtractor.Operand> hostVariables = new ArrayList<>();
        AccessKind zone = AccessKind.READ;
        for (int i = 0; i < words.size(); i++) {
            Word w = words.get(i);
            if (w.is("INTO")) {
                zone = AccessKind.WRITE;
            } else if (w.is("FROM") || w.is("WHERE") || w.is("VALUES") || w.is("SET") || w.is("USING")) {
                zone = AccessKind.READ;
            } else if (w.isIdentifier() && i > 0 && ":".equals(words.get(i - 1).getText())) {
                hostVariables.add(new DataAccessExtractor.Operand(w, List.of(), zone));
            }
        }
        addAccesses(procedure, statement, hostVariables);
    }

    // Opaque statements keep their control transfers when they can be recognized.
    private void visitOpaque(Procedure procedure, OpaqueStatementNode opaque) {
        List<Word> words = opaque.getWords();
        Map<Word, SymbolKind> procedureWords = new IdentityHashMap<>();
        for (int i = 0; i < words.size(); i++) {
            Word w = words.get(i);
            if (w.is("PERFORM") || w.is("IF")) {
                decisionPoints++;
            } else if (DECISION_WORDS.contains(w.upper())) {
                decisionPoints++;
            }
            if (w.is("PERFORM") && i + 1 < words.size() && isProcedureName(words.get(i + 1))) {
                ProcedureRef target = procedureRef(words, i + 1);
                String targetId = resolve(target, procedure, false, procedureWords);
                if (targetId != null) {
                    procedure.edges.add(new Edge(procedure.id, EdgeKind.PERFORM, target.name, targetId, null, null,
                            false, words.get(i + 1).getRange()));
                }
            } else if (w.is("GO")) {
                int at = i + 1 < words.size() && words.get(i + 1).is("TO") ? i + 2 : i + 1;
                if (at < words.size() && isProcedureName(words.get(at))) {
                    ProcedureRef target = procedureRef(words, at);
                    String targetId = resolve(target, procedure, false, procedureWords);
                    if (targetId != null) {
                        procedure.edges.add(new Edge(procedure.id, EdgeKind.GO_TO, target.name, targetId, null, null,
                                false, words.get(at).getRange()));
                    }
                }
            } else if (w.is("CALL") && i + 1 < words.size()
                    && words.get(i + 1).getKind() == TokenKind.STRING_LITERAL) {
                Word program = words.get(i + 1);
                addCallEdge(procedure, program.literalValue().trim().toUpperCase(Locale.ROOT), false,
                        program.getRange());
            }
        }
        referenceSymbols(words, opaque.getId(), procedureWords);
    }

    private void addCallEdge(Procedure procedure, String target, boolean dynamic, SourceRange range) {
        procedure.edges.add(new Edge(procedure.id, EdgeKind.CALL, target, null, null, null, dynamic, range));
        diagnostics.report(DiagnosticKind.EXTERNAL_CALL,
                "CALL to external program " + target + (dynamic ? " (dynamic)" : ""), range);
    }

    private Optional<String> staticValueOf(String dataName) {
        List<DataItem> candidates = data.lookup(dataName);
        if (candidates.size() != 1) {
            return Optional.empty();
        }
        String value = candidates.get(0).getValue();
        if (value == null || value.length() < 2 || (value.charAt(0) != '\'' && value.charAt(0) != '"')) {
            return Optional.empty();
        }
        char quote = value.charAt(0);
        int end = value.lastIndexOf(quote);
        if (end <= 0) {
            return Optional.empty();
        }
        return Optional.of(value.substring(1, end).trim().toUpperCase(Locale.ROOT));
    }

    private ProcedureRef procedureRef(List<Word> words, int at) {
        if (at >= words.size()) {
            return new ProcedureRef(null, null, null, at);
        }
        Word nameWord = words.get(at);
        int next = at + 1;
        String qualifier = null;
        if (next + 1 < words.size() && (words.get(next).is("OF") || words.get(next).is("IN"))) {
            qualifier = words.get(next + 1).upper();
            next += 2;
        }
        return new ProcedureRef(nameWord, nameWord.upper(), qualifier, next);
    }

    /**
     * Resolves a procedure reference to an id. With {@code report} set, dangling and ambiguous
     * references are recorded as diagnostics.
     */
    private String resolve(ProcedureRef ref, Procedure from, boolean report, Map<Word, SymbolKind> procedureWords) {
        if (ref.name == null) {
            return null;
        }
        String resolved = null;
        boolean ambiguous = false;
        if (ref.qualifier != null) {
            resolved = byName.getOrDefault(ref.name, List.of()).stream()
                    .filter(p -> p.kind == ProcedureKind.PARAGRAPH && ref.qualifier.equals(p.section))
                    .map(p -> p.id)
                    .findFirst()
                    .orElse(null);
        } else {
            List<Procedure> candidates = byName.getOrDefault(ref.name, List.of());
            if (candidates.size() == 1) {
                resolved = candidates.get(0).id;
            } else if (candidates.size() > 1) {
                List<Procedure> local = candidates.stream()
                        .filter(p -> p.kind == ProcedureKind.PARAGRAPH && from.section != null
                                && from.section.equals(p.section))
                        .collect(Collectors.toList());
                if (local.size() == 1) {
                    resolved = local.get(0).id;
                } else {
                    ambiguous = true;
                }
            }
        }

        if (ref.word != null) {
            procedureWords.put(ref.word, resolved != null ? SymbolKind.PROCEDURE : SymbolKind.UNRESOLVED);
        }
        if (resolved == null && report) {
            String display = ref.qualifier != null ? ref.name + " OF " + ref.qualifier : ref.name;
            SourceRange at = ref.word != null ? ref.word.getRange() : null;
            if (ambiguous) {
                diagnostics.report(DiagnosticKind.AMBIGUOUS_TARGET,
                        "Procedure name " + display + " is ambiguous; qualify it with OF section", at);
            } else {
                diagnostics.report(DiagnosticKind.DANGLING_TARGET,
                        "Procedure " + display + " is not declared in this unit", at);
            }
        }
        return resolved;
    }

    private void addAccesses(Procedure procedure, StatementNode statement, List<DataAccessExtractor.Operand> operands) {
        for (DataAccessExtractor.Operand operand : operands) {
            String name = operand.getWord().upper();
            List<DataItem> candidates = data.lookup(name, operand.getQualifiers());
            if (candidates.isEmpty()) {
                continue;
            }
            Integer index = candidates.size() == 1 ? candidates.get(0).getIndex() : null;
            procedure.accesses.add(new DataAccess(name, index, operand.getKind(), procedure.id, statement.getVerb(),
                    operand.getWord().getRange()));
        }
    }

    private void referenceSymbols(List<Word> words, String nodeId, Map<Word, SymbolKind> procedureWords) {
        for (Word w : words) {
            if (!w.isIdentifier()) {
                continue;
            }
            SymbolKind kind = procedureWords.containsKey(w) ? procedureWords.get(w) : classify(w.upper());
            symbols.add(new SymbolOccurrence(w.upper(), w.getRange(), SymbolRole.REFERENCE, kind, nodeId));
        }
    }

    private SymbolKind classify(String name) {
        List<DataItem> items = data.lookup(name);
        if (!items.isEmpty()) {
            return items.stream().allMatch(DataItem::isCondition) ? SymbolKind.CONDITION : SymbolKind.DATA_ITEM;
        }
        if (fileNames.contains(name)) {
            return SymbolKind.FILE;
        }
        if (indexNames.contains(name)) {
            return SymbolKind.INDEX_NAME;
        }
        if (byName.containsKey(name)) {
            return SymbolKind.PROCEDURE;
        }
        return SymbolKind.UNRESOLVED;
    }

    private static boolean isProcedureName(Word w) {
        return w.isIdentifier() || (w.getKind() == TokenKind.NUMERIC_LITERAL
                && w.getText().chars().allMatch(Character::isDigit));
    }

    private static int countDecisionWords(List<Word> words) {
        int count = 0;
        for (Word w : words) {
            if (DECISION_WORDS.contains(w.upper())) {
                count++;
            }
        }
        return count;
    }

    private static final class ProcedureRef {
        private final Word word;
        private final String name;
        private final String qualifier;
        private final int next;

        private ProcedureRef(Word word, String name, String qualifier, int next) {
            this.word = word;
            this.name = name;
            this.qualifier = qualifier;
            this.next = next;
        }
    }

    private static final class Procedure {
        private final String id;
        private final ProcedureKind kind;
        private final String name;
        private final String section;
        private final boolean declarative;
        private final SourceRange range;
        private final List<SentenceNode> sentences;
        private final List<Edge> edges = new ArrayList<>();
        private final List<DataAccess> accesses = new ArrayList<>();

        private Procedure(String id, ProcedureKind kind, String name, String section, boolean declarative,
                          SourceRange range, List<SentenceNode> sentences) {
            this.id = id;
            this.kind = kind;
            this.name = name;
            this.section = section;
            this.declarative = declarative;
            this.range = range;
            this.sentences = sentences;
        }

        ProcedureNode toNode() {
            return new ProcedureNode(id, kind, name, section, declarative, range, edges, accesses);
        }
    }
}
