package org.dxworks.cobolscope.preprocessor;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A compiled {@code replaceable BY replacement} pair. Matching is case-insensitive and respects
 * word boundaries wherever the operand itself starts or ends with a word character.
 */
public final class ReplacementRule {

    public enum Mode {
        FULL,
        LEADING,
        TRAILING
    }

    private static final String WORD_CHAR = "[A-Za-z0-9_\\-]";

    private final Mode mode;
    private final ReplacementOperand replaceable;
    private final ReplacementOperand replacement;
    private final Pattern pattern;

    public ReplacementRule(Mode mode, ReplacementOperand replaceable, ReplacementOperand replacement) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.replaceable = Objects.requireNonNull(replaceable, "replaceable");
        this.replacement = Objects.requireNonNull(replacement, "replacement");
        this.pattern = compile(mode, replaceable.getText());
    }

    private static Pattern compile(Mode mode, String text) {
        String[] parts = text.trim().split("\\s+");
        StringBuilder body = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                body.append("\\s+");
            }
            body.append(Pattern.quote(parts[i]));
        }

        String trimmed = text.trim();
        boolean wordStart = !trimmed.isEmpty() && isWordChar(trimmed.charAt(0));
        boolean wordEnd = !trimmed.isEmpty() && isWordChar(trimmed.charAt(trimmed.length() - 1));

        StringBuilder regex = new StringBuilder();
        if (wordStart && mode != Mode.TRAILING) {
            regex.append("(?<!").append(WORD_CHAR).append(')');
        }
        regex.append(body);
        if (wordEnd && mode != Mode.LEADING) {
            regex.append("(?!").append(WORD_CHAR).append(')');
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE);
    }

    static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '-' || c == '_';
    }

    public Mode getMode() {
        return mode;
    }

    public ReplacementOperand getReplaceable() {
        return replaceable;
    }

    public ReplacementOperand getReplacement() {
        return replacement;
    }

    Matcher matcher(String content) {
        return pattern.matcher(content);
    }

    boolean isEmpty() {
        return replaceable.getText().isBlank();
    }

    String replacementText() {
        return replacement.getText();
    }

    boolean matchesInsideLiterals() {
        return replaceable.isLiteral();
    }

    @Override
    public String toString() {
        return (mode == Mode.FULL ? "" : mode + " ") + replaceable + " BY " + replacement;
    }
}
