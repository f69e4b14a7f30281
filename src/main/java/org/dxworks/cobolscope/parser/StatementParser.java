package org.dxworks.cobolscope.parser;

import org.dxworks.cobolscope.dialect.DialectOptions;
import org.dxworks.cobolscope.lexer.Token;
import org.dxworks.cobolscope.lexer.TokenKind;
import org.dxworks.cobolscope.parser.ast.CobolNode;
import org.dxworks.cobolscope.parser.ast.StatementBlock;
import org.dxworks.cobolscope.parser.ast.StatementNode;
import org.dxworks.cobolscope.parser.ast.Word;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structures the statements of one procedure-division sentence. Nested statement lists end at
 * the delimiters of every enclosing statement (ELSE, WHEN, END-x, conditional phrases), which
 * gives unterminated IFs and phrases their COBOL meaning.
 */
class StatementParser {

    static final Set<String> VERBS = Set.of(
            "ACCEPT", "ADD", "ALTER", "CALL", "CANCEL", "CLOSE", "COMPUTE", "CONTINUE", "DELETE", "DISPLAY",
            "DIVIDE", "ENTRY", "EVALUATE", "EXEC", "EXIT", "GENERATE", "GO", "GOBACK", "IF", "INITIALIZE",
            "INITIATE", "INSPECT", "MERGE", "MOVE", "MULTIPLY", "NEXT", "OPEN", "PERFORM", "READ", "RELEASE",
            "RETURN", "REWRITE", "SEARCH", "SET", "SORT", "START", "STOP", "STRING", "SUBTRACT", "TERMINATE",
            "UNSTRING", "USE", "WRITE");

    private static final Set<String> EXIT_OBJECTS = Set.of(
            "PROGRAM", "PERFORM", "CYCLE", "PARAGRAPH", "SECTION", "METHOD", "FUNCTION");

    private final Set<String> verbs;

    StatementParser(DialectOptions dialect) {
        Set<String> all = new HashSet<>(VERBS);
        all.addAll(dialect.getExtraVerbs());
        this.verbs = all;
    }

    boolean isVerb(Token token) {
        return token != null && token.isWord() && verbs.contains(token.upper());
    }

    List<CobolNode> parse(List<Token> tokens, String sentenceId) {
        TokenCursor cursor = new TokenCursor(tokens);
        List<CobolNode> statements = statements(cursor, sentenceId + "/", new int[1], Set.of(), false);
        if (!cursor.atEnd()) {
            Token t = cursor.peek();
            throw new SentenceSyntaxException("Unexpected '" + t.getText() + "'", t);
        }
        return statements;
    }

    private List<CobolNode> statements(TokenCursor c, String prefix, int[] ordinal, Set<String> stops,
                                       boolean phraseStops) {
        List<CobolNode> result = new ArrayList<>();
        while (!c.atEnd()) {
            if (isStop(c, stops, phraseStops)) {
                break;
            }
            Token t = c.peek();
            if (!isVerbAt(c)) {
                throw new SentenceSyntaxException("Expected a statement but found '" + t.getText() + "'", t);
            }
            ordinal[0]++;
            result.add(statement(c, prefix + ordinal[0], stops, phraseStops));
        }
        return result;
    }

    private StatementNode statement(TokenCursor c, String id, Set<String> stops, boolean phraseStops) {
        Token verb = c.next();
        switch (verb.upper()) {
            case "IF":
                return parseIf(c, id, verb, stops, phraseStops);
            case "EVALUATE":
                return parseEvaluate(c, id, verb, stops, phraseStops);
            case "PERFORM":
                return parsePerform(c, id, verb, stops, phraseStops);
            case "SEARCH":
                return parseSearch(c, id, verb, stops, phraseStops);
            case "EXEC":
                return parseExec(c, id, verb);
            case "NEXT":
                c.next();
                return new StatementNode(id, Word.of(verb), c.rangeFrom(verb), List.of(), List.of(), false);
            case "EXIT":
                return parseExit(c, id, verb);
            default:
                return parseGeneric(c, id, verb, stops, phraseStops);
        }
    }

    private StatementNode parseIf(TokenCursor c, String id, Token verb, Set<String> stops, boolean phraseStops) {
        List<Word> condition = new ArrayList<>();
        while (!c.atEnd() && !isVerbAt(c) && !c.peekIs("THEN") && !isStop(c, stops, phraseStops)) {
            condition.add(Word.of(c.next()));
        }
        if (condition.isEmpty()) {
            throw new SentenceSyntaxException("IF without a condition", verb);
        }
        if (c.peekIs("THEN")) {
            c.next();
        }

        int[] ordinal = new int[1];
        String prefix = id + ".";
        List<StatementBlock> blocks = new ArrayList<>();
        Set<String> thenStops = union(stops, "ELSE", "END-IF");
        blocks.add(new StatementBlock("THEN", List.of(), statements(c, prefix, ordinal, thenStops, phraseStops)));
        if (c.peekIs("ELSE")) {
            c.next();
            Set<String> elseStops = union(stops, "END-IF");
            blocks.add(new StatementBlock("ELSE", List.of(), statements(c, prefix, ordinal, elseStops, phraseStops)));
        }
        if (c.peekIs("END-IF")) {
            c.next();
        }
        return new StatementNode(id, Word.of(verb), c.rangeFrom(verb), condition, blocks, false);
    }

    private StatementNode parseEvaluate(TokenCursor c, String id, Token verb, Set<String> stops, boolean phraseStops) {
        List<Word> subjects = new ArrayList<>();
        while (!c.atEnd() && !c.peekIs("WHEN")) {
            if (isVerbAt(c)) {
                throw new SentenceSyntaxException("EVALUATE subject followed by a statement", c.peek());
            }
            subjects.add(Word.of(c.next()));
        }
        if (!c.peekIs("WHEN")) {
            throw new SentenceSyntaxException("EVALUATE without WHEN", verb);
        }

        int[] ordinal = new int[1];
        List<StatementBlock> blocks = whenBlocks(c, id + ".", ordinal, union(stops, "WHEN", "END-EVALUATE"), phraseStops);
        if (c.peekIs("END-EVALUATE")) {
            c.next();
        }
        return new StatementNode(id, Word.of(verb), c.rangeFrom(verb), subjects, blocks, false);
    }

    private List<StatementBlock> whenBlocks(TokenCursor c, String prefix, int[] ordinal, Set<String> stops,
                                            boolean phraseStops) {
        List<StatementBlock> blocks = new ArrayList<>();
        while (c.peekIs("WHEN")) {
            c.next();
            List<Word> objects = new ArrayList<>();
            while (!c.atEnd() && !isVerbAt(c) && !c.peekIs("WHEN") && !isStop(c, stops, phraseStops)) {
                objects.add(Word.of(c.next()));
            }
            String label = objects.size() == 1 && objects.get(0).is("OTHER") ? "WHEN OTHER" : "WHEN";
            blocks.add(new StatementBlock(label, objects, statements(c, prefix, ordinal, stops, phraseStops)));
        }
        return blocks;
    }

    private StatementNode parsePerform(TokenCursor c, String id, Token verb, Set<String> stops, boolean phraseStops) {
        Token target = c.peek();
        boolean outOfLine = target != null
                && (target.getKind() == TokenKind.IDENTIFIER || target.getKind() == TokenKind.NUMERIC_LITERAL)
                && !c.peekIs(1, "TIMES");

        List<Word> words = new ArrayList<>();
        if (outOfLine) {
            while (!c.atEnd() && !isVerbAt(c) && !isStop(c, stops, phraseStops)) {
                words.add(Word.of(c.next()));
            }
            return new StatementNode(id, Word.of(verb), c.rangeFrom(verb), words, List.of(), false);
        }

        while (!c.atEnd() && !isVerbAt(c) && !c.peekIs("END-PERFORM") && !isStop(c, stops, phraseStops)) {
            words.add(Word.of(c.next()));
        }
        List<CobolNode> body = statements(c, id + ".", new int[1], union(stops, "END-PERFORM"), phraseStops);
        if (!c.peekIs("END-PERFORM")) {
            throw new SentenceSyntaxException("Inline PERFORM without END-PERFORM", verb);
        }
        c.next();
        return new StatementNode(id, Word.of(verb), c.rangeFrom(verb), words,
                List.of(new StatementBlock("BODY", List.of(), body)), true);
    }

    private StatementNode parseSearch(TokenCursor c, String id, Token verb, Set<String> stops, boolean phraseStops) {
        List<Word> words = new ArrayList<>();
        while (!c.atEnd() && !isVerbAt(c) && !c.peekIs("WHEN") && phraseAt(c) == null
                && !isStop(c, stops, phraseStops)) {
            words.add(Word.of(c.next()));
        }
        int[] ordinal = new int[1];
        List<StatementBlock> blocks = new ArrayList<>();
        Set<String> inner = union(stops, "WHEN", "END-SEARCH");
        Phrase phrase = phraseAt(c);
        if (phrase != null) {
            c.skip(phrase.length);
            blocks.add(new StatementBlock(phrase.label, List.of(), statements(c, id + ".", ordinal, inner, true)));
        }
        if (!c.peekIs("WHEN")) {
            throw new SentenceSyntaxException("SEARCH without WHEN", verb);
        }
        blocks.addAll(whenBlocks(c, id + ".", ordinal, inner, phraseStops));
        if (c.peekIs("END-SEARCH")) {
            c.next();
        }
        return new StatementNode(id, Word.of(verb), c.rangeFrom(verb), words, blocks, false);
    }

    private StatementNode parseExec(TokenCursor c, String id, Token verb) {
        List<Word> words = new ArrayList<>();
        while (!c.atEnd() && !c.peekIs("END-EXEC")) {
            words.add(Word.of(c.next()));
        }
        if (c.atEnd()) {
            throw new SentenceSyntaxException("EXEC without END-EXEC", verb);
        }
        c.next();
        return new StatementNode(id, Word.of(verb), c.rangeFrom(verb), words, List.of(), false);
    }

    private StatementNode parseExit(TokenCursor c, String id, Token verb) {
        List<Word> words = new ArrayList<>();
        while (!c.atEnd() && c.peek().isWord() && EXIT_OBJECTS.contains(c.peek().upper())) {
            words.add(Word.of(c.next()));
        }
        return new StatementNode(id, Word.of(verb), c.rangeFrom(verb), words, List.of(), false);
    }

    private StatementNode parseGeneric(TokenCursor c, String id, Token verb, Set<String> stops, boolean phraseStops) {
        String terminator = "END-" + verb.upper();
        List<Word> words = new ArrayList<>();
        while (!c.atEnd() && !isVerbAt(c) && !c.peekIs(terminator) && phraseAt(c) == null
                && !isStop(c, stops, phraseStops)) {
            words.add(Word.of(c.next()));
        }

        int[] ordinal = new int[1];
        List<StatementBlock> blocks = new ArrayList<>();
        Set<String> inner = union(stops, terminator);
        Phrase phrase = phraseAt(c);
        while (phrase != null) {
            c.skip(phrase.length);
            blocks.add(new StatementBlock(phrase.label, List.of(), statements(c, id + ".", ordinal, inner, true)));
            phrase = phraseAt(c);
        }
        if (c.peekIs(terminator)) {
            c.next();
        }
        return new StatementNode(id, Word.of(verb), c.rangeFrom(verb), words, blocks, false);
    }

    private boolean isVerbAt(TokenCursor c) {
        Token t = c.peek();
        if (!isVerb(t)) {
            return false;
        }
        if (t.is("NEXT")) {
            return c.peekIs(1, "SENTENCE");
        }
        return true;
    }

    private static boolean isStop(TokenCursor c, Set<String> stops, boolean phraseStops) {
        Token t = c.peek();
        if (t == null) {
            return true;
        }
        if (t.isWord() && stops.contains(t.upper())) {
            return true;
        }
        return phraseStops && phraseAt(c) != null;
    }

    /**
     * Recognizes a conditional phrase (AT END, INVALID KEY, ON SIZE ERROR, ON EXCEPTION,
     * ON OVERFLOW, AT END-OF-PAGE and their NOT forms) at the cursor.
     */
    static Phrase phraseAt(TokenCursor c) {
        int i = 0;
        boolean not = false;
        if (c.peekIs("NOT")) {
            not = true;
            i++;
        }
        Phrase base = basePhrase(c, i);
        if (base == null) {
            return null;
        }
        return not ? new Phrase("NOT " + base.label, base.length + 1) : base;
    }

    private static Phrase basePhrase(TokenCursor c, int i) {
        if (c.peekIs(i, "AT")) {
            if (c.peekIs(i + 1, "END")) {
                return new Phrase("AT END", 2);
            }
            if (c.peekIs(i + 1, "END-OF-PAGE") || c.peekIs(i + 1, "EOP")) {
                return new Phrase("AT END-OF-PAGE", 2);
            }
            return null;
        }
        if (c.peekIs(i, "END-OF-PAGE") || c.peekIs(i, "EOP")) {
            return new Phrase("AT END-OF-PAGE", 1);
        }
        if (c.peekIs(i, "INVALID")) {
            return new Phrase("INVALID KEY", c.peekIs(i + 1, "KEY") ? 2 : 1);
        }
        int on = c.peekIs(i, "ON") ? 1 : 0;
        if (c.peekIs(i + on, "SIZE") && c.peekIs(i + on + 1, "ERROR")) {
            return new Phrase("ON SIZE ERROR", on + 2);
        }
        if (c.peekIs(i + on, "EXCEPTION")) {
            return new Phrase("ON EXCEPTION", on + 1);
        }
        if (c.peekIs(i + on, "OVERFLOW")) {
            return new Phrase("ON OVERFLOW", on + 1);
        }
        return null;
    }

    private static Set<String> union(Set<String> stops, String... more) {
        Set<String> all = new HashSet<>(stops);
        all.addAll(List.of(more));
        return all;
    }

    static final class Phrase {
        final String label;
        final int length;

        Phrase(String label, int length) {
            this.label = label;
            this.length = length;
        }
    }
}
