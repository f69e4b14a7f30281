package org.dxworks.cobolscope.preprocessor;

import org.dxworks.cobolscope.preprocessor.line.CobolLine;
import org.dxworks.cobolscope.preprocessor.line.CobolLineRewriter;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Applies REPLACING / REPLACE rules to the program text of code lines. Each line is scanned once
 * left to right; at every position the earliest match wins (ties go to the rule listed first) and
 * replaced text is not scanned again.
 */
public class ReplacingRewriter implements CobolLineRewriter {

    private final List<ReplacementRule> rules;

    public ReplacingRewriter(List<ReplacementRule> rules) {
        this.rules = rules;
    }

    @Override
    public List<CobolLine> processLines(List<CobolLine> lines) {
        List<CobolLine> result = new ArrayList<>(lines.size());
        for (CobolLine line : lines) {
            result.add(processLine(line));
        }
        return result;
    }

    public CobolLine processLine(CobolLine line) {
        if (!line.getType().isCode() || rules.isEmpty()) {
            return line;
        }
        String content = line.getContent();
        String rewritten = rewrite(content);
        if (rewritten.equals(content)) {
            return line;
        }
        return line.withContent(rewritten, true);
    }

    String rewrite(String content) {
        List<int[]> literals = literalSpans(content);
        List<Matcher> matchers = new ArrayList<>(rules.size());
        for (ReplacementRule rule : rules) {
            matchers.add(rule.matcher(content));
        }

        StringBuilder out = new StringBuilder(content.length());
        int pos = 0;
        while (pos < content.length()) {
            int bestStart = -1;
            int bestEnd = -1;
            ReplacementRule best = null;
            for (int r = 0; r < rules.size(); r++) {
                ReplacementRule rule = rules.get(r);
                if (rule.isEmpty()) {
                    continue;
                }
                int[] match = nextMatch(matchers.get(r), pos, literals, rule.matchesInsideLiterals());
                if (match != null && (best == null || match[0] < bestStart)) {
                    bestStart = match[0];
                    bestEnd = match[1];
                    best = rule;
                }
            }
            if (best == null) {
                break;
            }
            out.append(content, pos, bestStart).append(best.replacementText());
            pos = bestEnd;
        }
        out.append(content.substring(Math.min(pos, content.length())));
        return out.toString();
    }

    private static int[] nextMatch(Matcher matcher, int from, List<int[]> literals, boolean insideLiterals) {
        int start = from;
        while (start <= matcher.regionEnd() && matcher.find(start)) {
            int s = matcher.start();
            int e = matcher.end();
            if (e == s) {
                start = s + 1;
                continue;
            }
            if (insideLiterals || !overlapsLiteral(s, e, literals)) {
                return new int[]{s, e};
            }
            start = s + 1;
        }
        return null;
    }

    private static boolean overlapsLiteral(int start, int end, List<int[]> literals) {
        for (int[] span : literals) {
            if (start < span[1] && end > span[0]) {
                return true;
            }
        }
        return false;
    }

    /**
     * Spans {@code [start, end)} of quoted literals on the line, unterminated ones running to the end.
     */
    static List<int[]> literalSpans(String content) {
        List<int[]> spans = new ArrayList<>();
        int i = 0;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c == '"' || c == '\'') {
                int start = i;
                i++;
                while (i < content.length()) {
                    if (content.charAt(i) == c) {
                        if (i + 1 < content.length() && content.charAt(i + 1) == c) {
                            i += 2;
                            continue;
                        }
                        break;
                    }
                    i++;
                }
                spans.add(new int[]{start, Math.min(i + 1, content.length())});
            }
            i++;
        }
        return spans;
    }
}
