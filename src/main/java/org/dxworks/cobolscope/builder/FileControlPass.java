package org.dxworks.cobolscope.builder;

import org.dxworks.cobolscope.model.FileControl;
import org.dxworks.cobolscope.model.SymbolKind;
import org.dxworks.cobolscope.model.SymbolOccurrence;
import org.dxworks.cobolscope.model.SymbolRole;
import org.dxworks.cobolscope.parser.ast.CobolNode;
import org.dxworks.cobolscope.parser.ast.DivisionNode;
import org.dxworks.cobolscope.parser.ast.EntryNode;
import org.dxworks.cobolscope.parser.ast.ParagraphNode;
import org.dxworks.cobolscope.parser.ast.SentenceNode;
import org.dxworks.cobolscope.parser.ast.Word;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Extracts FILE-CONTROL {@code SELECT} entries from the environment division.
 */
class FileControlPass {

    private static final Set<String> ORGANIZATIONS = Set.of("SEQUENTIAL", "INDEXED", "RELATIVE", "LINE");
    private static final Set<String> ACCESS_MODES = Set.of("SEQUENTIAL", "RANDOM", "DYNAMIC", "EXCLUSIVE");
    private static final Set<String> NOISE = Set.of("IS", "MODE", "TO", "KEY", "OPTIONAL");

    private final List<FileControl> fileControls = new ArrayList<>();
    private final List<SymbolOccurrence> symbols = new ArrayList<>();

    List<FileControl> run(Optional<DivisionNode> division) {
        division.ifPresent(this::visit);
        return fileControls;
    }

    List<SymbolOccurrence> getSymbols() {
        return symbols;
    }

    private void visit(CobolNode node) {
        if (node instanceof ParagraphNode && "FILE-CONTROL".equals(node.getName())) {
            for (SentenceNode sentence : ((ParagraphNode) node).getSentences()) {
                for (CobolNode child : sentence.getChildren()) {
                    if (child instanceof EntryNode) {
                        visitEntry((EntryNode) child);
                    }
                }
            }
            return;
        }
        for (CobolNode child : node.getChildren()) {
            visit(child);
        }
    }

    // Extract FILE-CONTROL metadata from a SELECT clause.
    private void visitEntry(EntryNode entry) {
        List<Word> words = entry.getWords();
        if (words.isEmpty() || !words.get(0).is("SELECT")) {
            return;
        }
        int i = 1;
        if (i < words.size() && words.get(i).is("OPTIONAL")) {
            i++;
        }
        if (i >= words.size()) {
            return;
        }
        Word nameWord = words.get(i++);
        String fileName = nameWord.upper();
        symbols.add(new SymbolOccurrence(fileName, nameWord.getRange(), SymbolRole.DEFINITION, SymbolKind.FILE,
                entry.getId()));

        String assignTo = null;
        String organization = null;
        String accessMode = null;
        String recordKey = null;
        String fileStatus = null;

        while (i < words.size()) {
            Word w = words.get(i);
            String upper = w.upper();
            if ("ASSIGN".equals(upper)) {
                i = skipNoise(words, i + 1);
                if (i < words.size()) {
                    assignTo = words.get(i).literalValue();
                }
            } else if ("ORGANIZATION".equals(upper)) {
                i = skipNoise(words, i + 1);
                if (i < words.size()) {
                    organization = organization(words.get(i).upper());
                }
            } else if (ORGANIZATIONS.contains(upper) && organization == null) {
                organization = organization(upper);
            } else if ("ACCESS".equals(upper)) {
                i = skipNoise(words, i + 1);
                if (i < words.size() && ACCESS_MODES.contains(words.get(i).upper())) {
                    accessMode = words.get(i).upper();
                }
            } else if ("RECORD".equals(upper) && i + 1 < words.size() && words.get(i + 1).is("KEY")) {
                i = skipNoise(words, i + 1);
                if (i < words.size()) {
                    recordKey = words.get(i).upper();
                    reference(words.get(i), entry);
                }
            } else if ("STATUS".equals(upper)) {
                i = skipNoise(words, i + 1);
                if (i < words.size()) {
                    fileStatus = words.get(i).upper();
                    reference(words.get(i), entry);
                }
            }
            i++;
        }
        fileControls.add(new FileControl(fileName, assignTo, organization, accessMode, recordKey, fileStatus,
                entry.getRange()));
    }

    private void reference(Word word, EntryNode entry) {
        if (word.isIdentifier()) {
            symbols.add(new SymbolOccurrence(word.upper(), word.getRange(), SymbolRole.REFERENCE,
                    SymbolKind.DATA_ITEM, entry.getId()));
        }
    }

    private static String organization(String word) {
        return "LINE".equals(word) ? "LINE SEQUENTIAL" : word;
    }

    private static int skipNoise(List<Word> words, int from) {
        int i = from;
        while (i < words.size() && NOISE.contains(words.get(i).upper())) {
            i++;
        }
        return i;
    }
}
