package org.dxworks.cobolscope.preprocessor;

import org.dxworks.cobolscope.dialect.DialectExtension;
import org.dxworks.cobolscope.dialect.DialectOptions;
import org.dxworks.cobolscope.diagnostic.DiagnosticCollector;
import org.dxworks.cobolscope.diagnostic.DiagnosticKind;
import org.dxworks.cobolscope.exception.CircularIncludeException;
import org.dxworks.cobolscope.exception.MalformedDirectiveException;
import org.dxworks.cobolscope.exception.UnresolvedIncludeException;
import org.dxworks.cobolscope.preprocessor.line.CobolLine;
import org.dxworks.cobolscope.preprocessor.line.CobolLineReader;
import org.dxworks.cobolscope.preprocessor.line.CobolLineRewriter;
import org.dxworks.cobolscope.preprocessor.line.FixedFormatLineReader;
import org.dxworks.cobolscope.source.LineOrigin;
import org.dxworks.cobolscope.source.ProvenanceMap;
import org.dxworks.cobolscope.source.SourceLine;
import org.dxworks.cobolscope.source.SourceRange;
import org.dxworks.cobolscope.source.SourceUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Expands COPY statements and applies REPLACING / REPLACE text substitution.
 *
 * <p>Directive text is blanked in place so surrounding program text keeps its columns. Member
 * text is inserted after the line holding the start of the COPY statement; whatever follows the
 * statement's separator period on its last line is emitted after the member. COPY REPLACING is
 * applied to the member as it is inserted; REPLACE statements act on the expanded stream from the
 * statement onwards until {@code REPLACE OFF} or the next REPLACE.</p>
 *
 * <p>Include problems never fail the unit: a cycle, an unknown member or a malformed statement is
 * reported against the directive, which is then left inert.</p>
 */
public class CobolPreprocessor {

    private static final Logger LOG = LoggerFactory.getLogger(CobolPreprocessor.class);

    private final CopybookResolver resolver;
    private final DialectOptions dialect;
    private final CobolLineReader lineReader;
    private final DirectiveParser directiveParser = new DirectiveParser();

    public CobolPreprocessor(CopybookResolver resolver, DialectOptions dialect) {
        this.resolver = resolver;
        this.dialect = dialect;
        this.lineReader = new FixedFormatLineReader(dialect);
    }

    public PreprocessedSource process(SourceUnit unit, DiagnosticCollector diagnostics) {
        Expansion expansion = new Expansion(unit.getId(), diagnostics);
        List<CobolLine> lines = new ArrayList<>(unit.getLines().size());
        for (SourceLine line : unit.getLines()) {
            lines.add(lineReader.parseLine(line.getText(), line.getNumber(), unit.getId()));
        }

        List<String> stack = new ArrayList<>();
        stack.add(normalizeMember(unit.memberName()));
        expand(lines, stack, expansion);

        List<CobolLine> expanded = expansion.applyReplaceStatements();
        List<LineOrigin> origins = new ArrayList<>(expanded.size());
        for (CobolLine line : expanded) {
            origins.add(new LineOrigin(line.getFile(), line.getNumber()));
        }

        SourceUnit expandedUnit = unit.expanded(new ProvenanceMap(unit.getId(), origins), contentHash(expanded));
        LOG.debug("Preprocessed {}: {} lines expanded to {}, {} COPY members",
                unit.getId(), lines.size(), expanded.size(), expansion.copyMembers.size());
        return new PreprocessedSource(expandedUnit, expanded, new ArrayList<>(expansion.copyMembers));
    }

    private void expand(List<CobolLine> lines, List<String> stack, Expansion expansion) {
        int i = 0;
        while (i < lines.size()) {
            CobolLine line = lines.get(i);
            if (!line.getType().isCode()) {
                expansion.emit(line);
                i++;
                continue;
            }

            CobolLine current = line;
            int currentIndex = i;
            int from = 0;
            while (true) {
                int start = findDirectiveStart(current.getContent(), from);
                if (start < 0) {
                    expansion.emit(current);
                    break;
                }

                DirectiveSpan span = collectDirective(lines, currentIndex, current, start);
                expansion.emit(current.blank(start, current.getContent().length()));
                for (int k = currentIndex + 1; k < span.endLine; k++) {
                    CobolLine between = lines.get(k);
                    expansion.emit(between.getType().isCode()
                            ? between.blank(0, between.getContent().length())
                            : between);
                }

                handleDirective(span, current, stack, expansion);

                CobolLine last = span.endLine == currentIndex ? current : lines.get(span.endLine);
                CobolLine rest = last.blank(0, span.endPos + 1);
                boolean multiLine = span.endLine != currentIndex;
                currentIndex = span.endLine;
                if (rest.isBlankContent()) {
                    if (multiLine) {
                        expansion.emit(rest);
                    }
                    break;
                }
                current = rest;
                from = span.endPos + 1;
            }
            i = currentIndex + 1;
        }
    }

    private void handleDirective(DirectiveSpan span, CobolLine startLine, List<String> stack, Expansion expansion) {
        SourceRange range = new SourceRange(expansion.unit, startLine.getFile(),
                startLine.getNumber(), CobolLine.columnOf(span.startPos),
                span.endLineNumber, CobolLine.columnOf(span.endPos));
        DirectiveStatement statement;
        try {
            statement = directiveParser.parse(span.text);
        } catch (MalformedDirectiveException e) {
            expansion.diagnostics.report(DiagnosticKind.MALFORMED_DIRECTIVE,
                    "Cannot parse directive '" + span.text.trim() + "': " + e.getMessage(), range);
            return;
        }

        if (statement instanceof ReplaceStatement) {
            expansion.markReplace((ReplaceStatement) statement);
            return;
        }

        CopyStatement copy = (CopyStatement) statement;
        expansion.copyMembers.add(copy.getMember().toUpperCase(Locale.ROOT));
        try {
            includeMember(copy, stack, expansion);
        } catch (CircularIncludeException e) {
            expansion.diagnostics.report(DiagnosticKind.CIRCULAR_INCLUDE, e.getMessage(), range);
        } catch (UnresolvedIncludeException e) {
            expansion.diagnostics.report(DiagnosticKind.UNRESOLVED_INCLUDE, e.getMessage(), range);
        }
    }

    private void includeMember(CopyStatement copy, List<String> stack, Expansion expansion) {
        String key = normalizeMember(copy.getMember());
        int open = stack.indexOf(key);
        if (open >= 0) {
            List<String> cycle = new ArrayList<>(stack.subList(open, stack.size()));
            cycle.add(key);
            throw new CircularIncludeException(cycle);
        }

        String library = copy.getLibrary().orElse(null);
        Copybook copybook = resolver.resolve(copy.getMember(), library)
                .orElseThrow(() -> new UnresolvedIncludeException(copy.getMember(), library));

        List<CobolLine> memberLines = lineReader.processLines(copybook.getText(), copybook.getFile());
        int first = expansion.size();
        stack.add(key);
        try {
            expand(memberLines, stack, expansion);
        } finally {
            stack.remove(stack.size() - 1);
        }
        if (!copy.getReplacing().isEmpty()) {
            expansion.rewrite(first, new ReplacingRewriter(copy.getReplacing()));
        }
    }

    /**
     * Index of the next COPY or REPLACE word at or after {@code from}, outside literals and
     * floating comments; -1 when there is none.
     */
    int findDirectiveStart(String content, int from) {
        int i = from;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c == '"' || c == '\'') {
                i = skipLiteral(content, i);
                continue;
            }
            if (c == '*' && i + 1 < content.length() && content.charAt(i + 1) == '>'
                    && dialect.has(DialectExtension.FLOATING_COMMENTS)) {
                return -1;
            }
            if (ReplacementRule.isWordChar(c) && (i == 0 || !ReplacementRule.isWordChar(content.charAt(i - 1)))) {
                int end = i;
                while (end < content.length() && ReplacementRule.isWordChar(content.charAt(end))) {
                    end++;
                }
                String word = content.substring(i, end);
                if (word.equalsIgnoreCase("COPY") || word.equalsIgnoreCase("REPLACE")) {
                    return i;
                }
                i = end;
                continue;
            }
            i++;
        }
        return -1;
    }

    private static int skipLiteral(String content, int open) {
        char quote = content.charAt(open);
        int i = open + 1;
        while (i < content.length()) {
            if (content.charAt(i) == quote) {
                if (i + 1 < content.length() && content.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return content.length();
    }

    /**
     * Collects directive text up to its separator period, which may sit on a later code line.
     * Without a period the directive ends with its first line.
     */
    private DirectiveSpan collectDirective(List<CobolLine> lines, int lineIndex, CobolLine first, int start) {
        StringBuilder text = new StringBuilder();
        boolean inPseudoText = false;
        char quote = 0;

        for (int k = lineIndex; k < lines.size(); k++) {
            CobolLine line = k == lineIndex ? first : lines.get(k);
            if (k != lineIndex && !line.getType().isCode()) {
                continue;
            }
            String content = line.getContent();
            int i = k == lineIndex ? start : 0;
            if (k != lineIndex) {
                text.append(' ');
            }
            while (i < content.length()) {
                char c = content.charAt(i);
                if (quote != 0) {
                    if (c == quote) {
                        quote = 0;
                    }
                } else if (inPseudoText) {
                    if (c == '=' && i + 1 < content.length() && content.charAt(i + 1) == '=') {
                        inPseudoText = false;
                        text.append("==");
                        i += 2;
                        continue;
                    }
                } else if (c == '"' || c == '\'') {
                    quote = c;
                } else if (c == '=' && i + 1 < content.length() && content.charAt(i + 1) == '=') {
                    inPseudoText = true;
                    text.append("==");
                    i += 2;
                    continue;
                } else if (c == '.' && (i + 1 >= content.length() || content.charAt(i + 1) == ' ')) {
                    text.append('.');
                    return new DirectiveSpan(text.toString(), start, k, line.getNumber(), i);
                }
                text.append(c);
                i++;
            }
        }

        String content = first.getContent();
        int end = content.stripTrailing().length() - 1;
        return new DirectiveSpan(content.substring(start), start, lineIndex, first.getNumber(), Math.max(start, end));
    }

    private static String normalizeMember(String member) {
        return CopybookRepository.normalizeCopybookToken(CopybookRepository.stripExtension(member))
                .toUpperCase(Locale.ROOT);
    }

    private static String contentHash(List<CobolLine> lines) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            for (CobolLine line : lines) {
                digest.update(line.getFile().getBytes(StandardCharsets.UTF_8));
                digest.update((byte) '\t');
                digest.update(Integer.toString(line.getNumber()).getBytes(StandardCharsets.UTF_8));
                digest.update((byte) '\t');
                digest.update(line.compilerText().getBytes(StandardCharsets.UTF_8));
                digest.update((byte) '\n');
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static final class DirectiveSpan {
        private final String text;
        private final int startPos;
        private final int endLine;
        private final int endLineNumber;
        private final int endPos;

        private DirectiveSpan(String text, int startPos, int endLine, int endLineNumber, int endPos) {
            this.text = text;
            this.startPos = startPos;
            this.endLine = endLine;
            this.endLineNumber = endLineNumber;
            this.endPos = endPos;
        }
    }

    /**
     * Output sink shared by the whole include tree of one unit.
     */
    private static final class Expansion {
        private final String unit;
        private final DiagnosticCollector diagnostics;
        private final List<CobolLine> out = new ArrayList<>();
        private final List<Integer> replaceAt = new ArrayList<>();
        private final List<ReplaceStatement> replaceStatements = new ArrayList<>();
        private final Set<String> copyMembers = new LinkedHashSet<>();

        private Expansion(String unit, DiagnosticCollector diagnostics) {
            this.unit = unit;
            this.diagnostics = diagnostics;
        }

        void emit(CobolLine line) {
            out.add(line);
        }

        int size() {
            return out.size();
        }

        void rewrite(int from, CobolLineRewriter rewriter) {
            List<CobolLine> region = out.subList(from, out.size());
            List<CobolLine> rewritten = rewriter.processLines(region);
            region.clear();
            out.addAll(rewritten);
        }

        void markReplace(ReplaceStatement statement) {
            replaceAt.add(out.size());
            replaceStatements.add(statement);
        }

        List<CobolLine> applyReplaceStatements() {
            if (replaceStatements.isEmpty()) {
                return out;
            }
            List<CobolLine> result = new ArrayList<>(out.subList(0, replaceAt.get(0)));
            for (int r = 0; r < replaceStatements.size(); r++) {
                ReplaceStatement statement = replaceStatements.get(r);
                int end = r + 1 < replaceAt.size() ? replaceAt.get(r + 1) : out.size();
                // a later REPLACE supersedes this one; REPLACE OFF leaves its region as is
                List<CobolLine> region = out.subList(replaceAt.get(r), end);
                result.addAll(statement.isOff() ? region : new ReplacingRewriter(statement.getRules()).processLines(region));
            }
            return result;
        }
    }
}
