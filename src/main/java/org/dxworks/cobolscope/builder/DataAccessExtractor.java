package org.dxworks.cobolscope.builder;

import org.dxworks.cobolscope.model.AccessKind;
import org.dxworks.cobolscope.parser.ast.Word;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Classifies the data names a statement mentions as read or written, from the verb and the
 * phrase keywords that separate sending from receiving operands.
 *
 * <p>Subscripts and qualifiers are handled here: {@code A OF B (I)} yields one operand for A
 * qualified by B, plus a read of I.</p>
 */
final class DataAccessExtractor {

    private enum Zone {
        NONE,
        READ,
        WRITE,
        READ_WRITE
    }

    private static final class Rules {
        private final Zone initial;
        private final Map<String, Zone> switches = new HashMap<>();
        private final Map<String, Zone> once = new HashMap<>();
        private Zone afterFirst;

        private Rules(Zone initial) {
            this.initial = initial;
        }

        private Rules afterFirst(Zone zone) {
            afterFirst = zone;
            return this;
        }

        private Rules on(String keyword, Zone zone) {
            switches.put(keyword, zone);
            return this;
        }

        private Rules onceAfter(String keyword, Zone zone) {
            once.put(keyword, zone);
            return this;
        }
    }

    /**
     * One data reference with its qualifiers.
     */
    static final class Operand {
        private final Word word;
        private final List<String> qualifiers;
        private final AccessKind kind;

        Operand(Word word, List<String> qualifiers, AccessKind kind) {
            this.word = word;
            this.qualifiers = Collections.unmodifiableList(qualifiers);
            this.kind = kind;
        }

        Word getWord() {
            return word;
        }

        List<String> getQualifiers() {
            return qualifiers;
        }

        AccessKind getKind() {
            return kind;
        }
    }

    private DataAccessExtractor() {
    }

    static List<Operand> conditionOperands(List<Word> words) {
        return extract(new Rules(Zone.READ).onceAfter("VARYING", Zone.WRITE), words);
    }

    static List<Operand> operands(String verb, List<Word> words) {
        return extract(rules(verb, words), words);
    }

    private static Rules rules(String verb, List<Word> words) {
        boolean giving = words.stream().anyMatch(w -> w.is("GIVING"));
        Zone accumulated = giving ? Zone.READ : Zone.READ_WRITE;
        switch (verb) {
            case "MOVE":
                return new Rules(Zone.READ).on("TO", Zone.WRITE);
            case "ADD":
                return new Rules(Zone.READ).on("TO", accumulated).on("GIVING", Zone.WRITE);
            case "SUBTRACT":
                return new Rules(Zone.READ).on("FROM", accumulated).on("GIVING", Zone.WRITE);
            case "MULTIPLY":
                return new Rules(Zone.READ).on("BY", accumulated).on("GIVING", Zone.WRITE);
            case "DIVIDE":
                return new Rules(Zone.READ).on("INTO", accumulated).on("BY", Zone.READ)
                        .on("GIVING", Zone.WRITE).on("REMAINDER", Zone.WRITE);
            case "COMPUTE":
                return new Rules(Zone.WRITE).on("=", Zone.READ).on("EQUAL", Zone.READ);
            case "SET":
                return new Rules(Zone.WRITE).on("TO", Zone.READ).on("UP", Zone.READ).on("DOWN", Zone.READ);
            case "INITIALIZE":
                return new Rules(Zone.WRITE).on("REPLACING", Zone.READ);
            case "INSPECT":
                boolean rewrites = words.stream().anyMatch(w -> w.is("REPLACING") || w.is("CONVERTING"));
                return new Rules(rewrites ? Zone.READ_WRITE : Zone.READ).afterFirst(Zone.READ)
                        .onceAfter("TALLYING", Zone.WRITE);
            case "STRING":
                return new Rules(Zone.READ).on("INTO", Zone.WRITE).on("POINTER", Zone.WRITE);
            case "UNSTRING":
                return new Rules(Zone.READ).on("INTO", Zone.WRITE).on("POINTER", Zone.WRITE)
                        .on("TALLYING", Zone.WRITE);
            case "ACCEPT":
                return new Rules(Zone.WRITE).on("FROM", Zone.READ);
            case "DISPLAY":
                return new Rules(Zone.READ).on("UPON", Zone.NONE);
            case "READ":
            case "RETURN":
                return new Rules(Zone.NONE).on("INTO", Zone.WRITE).on("KEY", Zone.READ);
            case "WRITE":
            case "REWRITE":
            case "RELEASE":
                return new Rules(Zone.WRITE).on("FROM", Zone.READ).on("ADVANCING", Zone.READ);
            case "CALL":
                return new Rules(Zone.NONE).on("USING", Zone.READ).on("RETURNING", Zone.WRITE)
                        .on("GIVING", Zone.WRITE);
            case "GO":
                return new Rules(Zone.NONE).on("DEPENDING", Zone.READ);
            case "OPEN":
            case "CLOSE":
            case "DELETE":
            case "CANCEL":
            case "USE":
                return new Rules(Zone.NONE);
            case "START":
            case "SORT":
            case "MERGE":
                return new Rules(Zone.NONE).on("KEY", Zone.READ).on("USING", Zone.NONE).on("GIVING", Zone.NONE);
            case "SEARCH":
            case "PERFORM":
                return new Rules(Zone.READ).onceAfter("VARYING", Zone.WRITE);
            default:
                return new Rules(Zone.READ);
        }
    }

    private static List<Operand> extract(Rules rules, List<Word> words) {
        List<Operand> result = new ArrayList<>();
        Zone zone = rules.initial;
        Zone pendingOnce = rules.afterFirst;
        Zone afterOnce = null;
        int depth = 0;

        for (int i = 0; i < words.size(); i++) {
            Word w = words.get(i);
            if (w.isSeparator('(')) {
                depth++;
                continue;
            }
            if (w.isSeparator(')')) {
                depth = Math.max(0, depth - 1);
                continue;
            }
            if (depth > 0) {
                if (w.isIdentifier()) {
                    result.add(new Operand(w, List.of(), AccessKind.READ));
                }
                continue;
            }
            String upper = w.upper();
            if (!w.isIdentifier()) {
                if (rules.switches.containsKey(upper)) {
                    zone = rules.switches.get(upper);
                    afterOnce = null;
                } else if (rules.once.containsKey(upper)) {
                    afterOnce = zone;
                    zone = rules.once.get(upper);
                }
                continue;
            }

            List<String> qualifiers = new ArrayList<>();
            while (i + 2 < words.size() && (words.get(i + 1).is("OF") || words.get(i + 1).is("IN"))
                    && words.get(i + 2).isIdentifier()) {
                qualifiers.add(words.get(i + 2).upper());
                i += 2;
            }
            addOperand(result, w, qualifiers, zone);

            if (afterOnce != null) {
                zone = afterOnce;
                afterOnce = null;
            } else if (pendingOnce != null) {
                zone = pendingOnce;
                pendingOnce = null;
            }
        }
        return result;
    }

    private static void addOperand(List<Operand> result, Word w, List<String> qualifiers, Zone zone) {
        switch (zone) {
            case READ:
                result.add(new Operand(w, qualifiers, AccessKind.READ));
                break;
            case WRITE:
                result.add(new Operand(w, qualifiers, AccessKind.WRITE));
                break;
            case READ_WRITE:
                result.add(new Operand(w, qualifiers, AccessKind.READ));
                result.add(new Operand(w, qualifiers, AccessKind.WRITE));
                break;
            default:
                break;
        }
    }
}
