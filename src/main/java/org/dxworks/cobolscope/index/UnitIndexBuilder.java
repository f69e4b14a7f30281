package org.dxworks.cobolscope.index;

import org.dxworks.cobolscope.model.Edge;
import org.dxworks.cobolscope.model.ProcedureNode;
import org.dxworks.cobolscope.model.ProgramModel;
import org.dxworks.cobolscope.model.SymbolOccurrence;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives a unit's {@link UnitIndex} from its program model. The result depends on the model
 * alone, so a model loaded from the store indexes exactly like a freshly built one.
 */
public final class UnitIndexBuilder {

    private static final Comparator<SymbolOccurrence> BY_RANGE =
            Comparator.comparing(SymbolOccurrence::getRange);
    private static final Comparator<Edge> EDGE_ORDER =
            Comparator.comparing(Edge::getRange, Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparing(Edge::getFrom);

    private UnitIndexBuilder() {
    }

    public static UnitIndex build(ProgramModel model) {
        Map<String, List<SymbolOccurrence>> byName = new TreeMap<>();
        for (SymbolOccurrence occurrence : model.getSymbols()) {
            if (occurrence.getText() == null || occurrence.getRange() == null) {
                continue;
            }
            String key = occurrence.getText().toUpperCase(Locale.ROOT);
            byName.computeIfAbsent(key, k -> new ArrayList<>()).add(occurrence);
        }
        TreeMap<String, IndexEntry> entries = new TreeMap<>();
        byName.forEach((name, occurrences) -> {
            occurrences.sort(BY_RANGE);
            entries.put(name, new IndexEntry(name, occurrences));
        });

        Map<String, List<Edge>> outgoing = new LinkedHashMap<>();
        Map<String, List<Edge>> incoming = new TreeMap<>();
        for (ProcedureNode procedure : model.getProcedures()) {
            outgoing.put(procedure.getId(), List.copyOf(procedure.getEdges()));
            for (Edge edge : procedure.getEdges()) {
                if (edge.getTargetId() != null) {
                    incoming.computeIfAbsent(edge.getTargetId(), k -> new ArrayList<>()).add(edge);
                }
            }
        }
        incoming.replaceAll((id, edges) -> {
            edges.sort(EDGE_ORDER);
            return List.copyOf(edges);
        });

        return new UnitIndex(model, entries, outgoing, incoming);
    }
}
