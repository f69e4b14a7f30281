package org.dxworks.cobolscope.builder;

import org.dxworks.cobolscope.diagnostic.DiagnosticCollector;
import org.dxworks.cobolscope.diagnostic.DiagnosticKind;
import org.dxworks.cobolscope.model.DataItem;
import org.dxworks.cobolscope.model.FileDescriptor;
import org.dxworks.cobolscope.model.OccursClause;
import org.dxworks.cobolscope.model.SymbolKind;
import org.dxworks.cobolscope.model.SymbolOccurrence;
import org.dxworks.cobolscope.model.SymbolRole;
import org.dxworks.cobolscope.parser.ast.CobolNode;
import org.dxworks.cobolscope.parser.ast.DataClause;
import org.dxworks.cobolscope.parser.ast.DataEntryNode;
import org.dxworks.cobolscope.parser.ast.DivisionNode;
import org.dxworks.cobolscope.parser.ast.FileDescriptionNode;
import org.dxworks.cobolscope.parser.ast.SectionNode;
import org.dxworks.cobolscope.parser.ast.Word;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * First builder pass: turns the data division's flat entry list into the data item table.
 *
 * <p>A higher level number nests under the nearest preceding lower one. Level 88 attaches to
 * the last non-88 item, level 66 to the current record. REDEFINES may only name an item
 * declared earlier; OCCURS DEPENDING ON may name any item of the unit.</p>
 */
class DataDivisionPass {

    private static final Set<String> NOISE = Set.of("IS", "ARE", "ON", "BY", "KEY", "TIMES", "TO");

    private final DiagnosticCollector diagnostics;
    private final boolean fragment;

    private final List<Draft> drafts = new ArrayList<>();
    private final List<FileDescriptor> fileDescriptors = new ArrayList<>();
    private final List<SymbolOccurrence> symbols = new ArrayList<>();
    private final List<PendingCounter> pendingCounters = new ArrayList<>();
    private final Deque<Draft> hierarchy = new ArrayDeque<>();
    private Draft lastNonCondition;

    DataDivisionPass(DiagnosticCollector diagnostics, boolean fragment) {
        this.diagnostics = diagnostics;
        this.fragment = fragment;
    }

    List<DataItem> run(Optional<DivisionNode> division) {
        division.ifPresent(d -> {
            for (CobolNode child : d.getChildren()) {
                if (child instanceof SectionNode) {
                    visitSection((SectionNode) child);
                }
            }
        });
        resolveCounters();
        return buildItems();
    }

    List<FileDescriptor> getFileDescriptors() {
        return fileDescriptors;
    }

    List<SymbolOccurrence> getSymbols() {
        return symbols;
    }

    // Track the section and restart the level hierarchy for each one.
    private void visitSection(SectionNode section) {
        String sectionName = section.getName();
        resetHierarchy();
        for (CobolNode child : section.getChildren()) {
            if (child instanceof DataEntryNode) {
                addEntry((DataEntryNode) child, sectionName, null);
            } else if (child instanceof FileDescriptionNode) {
                visitFileDescription((FileDescriptionNode) child, sectionName);
            }
        }
        resetHierarchy();
    }

    // FD/SD entries own the records that follow them.
    private void visitFileDescription(FileDescriptionNode fd, String sectionName) {
        resetHierarchy();
        if (fd.getNameWord() != null) {
            define(fd.getNameWord(), SymbolKind.FILE, fd.getId());
        }
        List<Integer> records = new ArrayList<>();
        for (DataEntryNode record : fd.getRecords()) {
            Draft draft = addEntry(record, sectionName, fd.getName());
            if (draft.level == 1) {
                records.add(draft.index);
            }
        }
        fileDescriptors.add(new FileDescriptor(fd.getIndicator(), fd.getName(), records, fd.getRange()));
        resetHierarchy();
    }

    private void resetHierarchy() {
        hierarchy.clear();
        lastNonCondition = null;
    }

    private Draft addEntry(DataEntryNode entry, String sectionName, String fileName) {
        int level = entry.getLevel();
        Draft draft = new Draft(drafts.size(), level, entry.getName());
        drafts.add(draft);
        draft.builder.index(draft.index).level(level).name(entry.getName()).nodeId(entry.getId())
                .range(entry.getRange()).section(sectionName).fileName(fileName);

        if (entry.getNameWord() != null && entry.getName() != null) {
            define(entry.getNameWord(), level == 88 ? SymbolKind.CONDITION : SymbolKind.DATA_ITEM, entry.getId());
        }

        if (!isValidLevel(level)) {
            diagnostics.report(DiagnosticKind.INVALID_LEVEL_NUMBER,
                    "Invalid level number " + entry.getLevelWord().getText(), entry.getLevelWord().getRange());
            applyClauses(entry, draft);
            return draft;
        }

        if (level == 88) {
            attachCondition(entry, draft);
        } else if (level == 66) {
            attachRenames(entry, draft);
        } else if (level == 77) {
            resetHierarchy();
            lastNonCondition = draft;
        } else {
            nest(entry, draft);
            hierarchy.push(draft);
            lastNonCondition = draft;
        }
        applyClauses(entry, draft);
        return draft;
    }

    private static boolean isValidLevel(int level) {
        return (level >= 1 && level <= 49) || level == 66 || level == 77 || level == 88;
    }

    private void nest(DataEntryNode entry, Draft draft) {
        Draft popped = null;
        while (!hierarchy.isEmpty() && hierarchy.peek().level >= draft.level) {
            popped = hierarchy.pop();
        }
        if (popped != null && popped.level != draft.level && !hierarchy.isEmpty()) {
            diagnostics.report(DiagnosticKind.LEVEL_NUMBER_INCONSISTENT,
                    "Level " + draft.level + " does not match sibling level " + popped.level,
                    entry.getLevelWord().getRange());
        }
        if (hierarchy.isEmpty()) {
            if (draft.level != 1 && !fragment) {
                diagnostics.report(DiagnosticKind.LEVEL_NUMBER_INCONSISTENT,
                        "Level " + draft.level + " item has no enclosing record", entry.getLevelWord().getRange());
            }
            return;
        }
        draft.setParent(hierarchy.peek());
    }

    private void attachCondition(DataEntryNode entry, Draft draft) {
        if (lastNonCondition == null) {
            diagnostics.report(DiagnosticKind.LEVEL_NUMBER_INCONSISTENT,
                    "Level 88 condition without a conditional variable", entry.getLevelWord().getRange());
            return;
        }
        draft.setParent(lastNonCondition);
    }

    private void attachRenames(DataEntryNode entry, Draft draft) {
        Draft record = hierarchy.peekLast();
        if (record == null) {
            diagnostics.report(DiagnosticKind.LEVEL_NUMBER_INCONSISTENT,
                    "Level 66 RENAMES outside a record", entry.getLevelWord().getRange());
            return;
        }
        draft.setParent(record);
    }

    private void applyClauses(DataEntryNode entry, Draft draft) {
        Integer occursMin = null;
        Integer occursMax = null;
        String dependingOn = null;
        List<String> indexedBy = new ArrayList<>();
        boolean hasOccurs = false;

        for (DataClause clause : entry.getClauses()) {
            List<Word> operands = significant(clause.getOperands());
            switch (clause.getKeyword()) {
                case "PIC":
                    if (!operands.isEmpty()) {
                        draft.builder.picture(operands.get(0).getText());
                    }
                    break;
                case "USAGE":
                    if (!operands.isEmpty()) {
                        draft.builder.usage(joinUpper(operands));
                    }
                    break;
                case "VALUE":
                    applyValue(draft, clause.getOperands());
                    break;
                case "REDEFINES":
                    if (!operands.isEmpty()) {
                        resolveRedefines(draft, operands.get(0), entry);
                    }
                    break;
                case "OCCURS":
                    hasOccurs = true;
                    List<Integer> bounds = integers(operands);
                    if (!bounds.isEmpty()) {
                        occursMin = bounds.get(0);
                        occursMax = bounds.size() > 1 ? bounds.get(1) : bounds.get(0);
                    }
                    break;
                case "DEPENDING":
                    if (!operands.isEmpty()) {
                        Word counter = operands.get(0);
                        dependingOn = counter.upper();
                        pendingCounters.add(new PendingCounter(draft, counter, entry.getId()));
                    }
                    break;
                case "INDEXED":
                    for (Word w : operands) {
                        if (w.isIdentifier()) {
                            indexedBy.add(w.upper());
                            define(w, SymbolKind.INDEX_NAME, entry.getId());
                        }
                    }
                    break;
                case "RENAMES":
                    List<String> renamed = new ArrayList<>();
                    for (Word w : clause.getOperands()) {
                        if (w.isIdentifier()) {
                            renamed.add(w.upper());
                            reference(w, entry.getId());
                        }
                    }
                    draft.builder.renames(renamed);
                    break;
                case "EXTERNAL":
                    draft.builder.external(true);
                    break;
                case "GLOBAL":
                    draft.builder.global(true);
                    break;
                default:
                    break;
            }
        }
        if (hasOccurs || dependingOn != null) {
            draft.occursMin = occursMin;
            draft.occursMax = occursMax;
            draft.dependingOn = dependingOn;
            draft.indexedBy = indexedBy;
        }
    }

    private void applyValue(Draft draft, List<Word> operands) {
        List<String> values = new ArrayList<>();
        StringBuilder current = null;
        boolean range = false;
        for (Word w : operands) {
            if (w.is("IS") || w.is("ARE")) {
                continue;
            }
            if (w.is("THRU") || w.is("THROUGH")) {
                range = current != null;
                continue;
            }
            if (range) {
                current.append(" THRU ").append(w.getText());
                range = false;
                continue;
            }
            if (current != null) {
                values.add(current.toString());
            }
            current = new StringBuilder(w.getText());
        }
        if (current != null) {
            values.add(current.toString());
        }
        if (values.isEmpty()) {
            return;
        }
        draft.builder.value(String.join(" ", values));
        if (draft.level == 88) {
            draft.builder.conditionValues(values);
        }
    }

    private void resolveRedefines(Draft draft, Word target, DataEntryNode entry) {
        String name = target.upper();
        draft.builder.redefines(name);
        for (int i = draft.index - 1; i >= 0; i--) {
            Draft candidate = drafts.get(i);
            if (name.equals(candidate.name)) {
                draft.builder.redefinesIndex(candidate.index);
                symbols.add(new SymbolOccurrence(name, target.getRange(), SymbolRole.REFERENCE,
                        SymbolKind.DATA_ITEM, entry.getId()));
                return;
            }
        }
        diagnostics.report(DiagnosticKind.UNRESOLVED_REDEFINES,
                "REDEFINES target " + name + " is not declared before " + describe(draft), target.getRange());
        symbols.add(new SymbolOccurrence(name, target.getRange(), SymbolRole.REFERENCE,
                SymbolKind.UNRESOLVED, entry.getId()));
    }

    private void resolveCounters() {
        for (PendingCounter pending : pendingCounters) {
            String name = pending.word.upper();
            Integer found = null;
            for (Draft candidate : drafts) {
                if (name.equals(candidate.name) && candidate.level != 88) {
                    found = candidate.index;
                    break;
                }
            }
            if (found == null) {
                diagnostics.report(DiagnosticKind.UNRESOLVED_OCCURS_COUNTER,
                        "OCCURS DEPENDING ON counter " + name + " is not declared", pending.word.getRange());
            }
            pending.draft.dependingOnIndex = found;
            symbols.add(new SymbolOccurrence(name, pending.word.getRange(), SymbolRole.REFERENCE,
                    found != null ? SymbolKind.DATA_ITEM : SymbolKind.UNRESOLVED, pending.nodeId));
        }
    }

    private List<DataItem> buildItems() {
        List<DataItem> items = new ArrayList<>(drafts.size());
        for (Draft draft : drafts) {
            if (draft.indexedBy != null) {
                draft.builder.occurs(new OccursClause(draft.occursMin, draft.occursMax, draft.dependingOn,
                        draft.dependingOnIndex, draft.indexedBy));
            }
            draft.builder.qualification(qualification(draft)).children(draft.children);
            items.add(draft.builder.build());
        }
        return items;
    }

    private static List<String> qualification(Draft draft) {
        List<String> chain = new ArrayList<>();
        for (Draft d = draft; d != null; d = d.parent) {
            if (d.name != null) {
                chain.add(d.name);
            }
        }
        return chain;
    }

    private void define(Word word, SymbolKind kind, String nodeId) {
        symbols.add(new SymbolOccurrence(word.upper(), word.getRange(), SymbolRole.DEFINITION, kind, nodeId));
    }

    private void reference(Word word, String nodeId) {
        symbols.add(new SymbolOccurrence(word.upper(), word.getRange(), SymbolRole.REFERENCE, SymbolKind.DATA_ITEM, nodeId));
    }

    private static List<Word> significant(List<Word> operands) {
        List<Word> result = new ArrayList<>();
        for (Word w : operands) {
            if (w.getKind().isLiteral() || !NOISE.contains(w.upper())) {
                result.add(w);
            }
        }
        return result;
    }

    private List<Integer> integers(List<Word> operands) {
        List<Integer> result = new ArrayList<>();
        for (Word w : operands) {
            if (w.getText().isEmpty() || !w.getText().chars().allMatch(Character::isDigit)) {
                continue;
            }
            try {
                result.add(Integer.parseInt(w.getText()));
            } catch (NumberFormatException e) {
                diagnostics.report(DiagnosticKind.NUMERIC_OUT_OF_RANGE,
                        "Integer " + w.getText() + " is out of range", w.getRange());
            }
        }
        return result;
    }

    private static String joinUpper(List<Word> words) {
        StringBuilder sb = new StringBuilder();
        for (Word w : words) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(w.upper());
        }
        return sb.toString();
    }

    private static String describe(Draft draft) {
        return draft.name != null ? draft.name : "FILLER at level " + draft.level;
    }

    private static final class Draft {
        private final int index;
        private final int level;
        private final String name;
        private final DataItem.Builder builder = DataItem.builder();
        private final List<Integer> children = new ArrayList<>();
        private Draft parent;
        private Integer occursMin;
        private Integer occursMax;
        private String dependingOn;
        private Integer dependingOnIndex;
        private List<String> indexedBy;

        private Draft(int index, int level, String name) {
            this.index = index;
            this.level = level;
            this.name = name;
        }

        void setParent(Draft parent) {
            this.parent = parent;
            builder.parentIndex(parent.index);
            parent.children.add(index);
        }
    }

    private static final class PendingCounter {
        private final Draft draft;
        private final Word word;
        private final String nodeId;

        private PendingCounter(Draft draft, Word word, String nodeId) {
            this.draft = draft;
            this.word = word;
            this.nodeId = nodeId;
        }
    }
}
