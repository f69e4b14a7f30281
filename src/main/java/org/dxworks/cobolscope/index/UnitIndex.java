package org.dxworks.cobolscope.index;

import org.dxworks.cobolscope.model.Edge;
import org.dxworks.cobolscope.model.EdgeKind;
import org.dxworks.cobolscope.model.ProgramModel;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The index contribution of a single unit: the inverted name index and the procedure adjacency
 * built from its {@link ProgramModel}. Instances are immutable and replaced wholesale when the
 * unit is re-ingested.
 */
public final class UnitIndex {

    private final ProgramModel model;
    private final NavigableMap<String, IndexEntry> entries;
    private final Map<String, List<Edge>> outgoing;
    private final Map<String, List<Edge>> incoming;

    UnitIndex(ProgramModel model,
              NavigableMap<String, IndexEntry> entries,
              Map<String, List<Edge>> outgoing,
              Map<String, List<Edge>> incoming) {
        this.model = model;
        this.entries = Collections.unmodifiableNavigableMap(entries);
        this.outgoing = Collections.unmodifiableMap(outgoing);
        this.incoming = Collections.unmodifiableMap(incoming);
    }

    public String getUnitId() {
        return model.getUnitId();
    }

    public Optional<String> getProgramId() {
        return Optional.ofNullable(model.getProgramId());
    }

    public String getContentHash() {
        return model.getContentHash();
    }

    public ProgramModel getModel() {
        return model;
    }

    /**
     * Entries keyed by upper-case name, in name order.
     */
    public NavigableMap<String, IndexEntry> getEntries() {
        return entries;
    }

    public Optional<IndexEntry> entry(String normalizedName) {
        return Optional.ofNullable(entries.get(normalizedName));
    }

    public List<Edge> outgoing(String procedureId) {
        return outgoing.getOrDefault(procedureId, List.of());
    }

    public List<Edge> incoming(String procedureId) {
        return incoming.getOrDefault(procedureId, List.of());
    }

    /**
     * CALL edges of the unit whose target is a program name, in source order.
     */
    public List<Edge> calls() {
        return outgoing.values().stream()
                .flatMap(List::stream)
                .filter(e -> e.getKind() == EdgeKind.CALL && e.getTarget() != null)
                .sorted(Comparator.comparing(Edge::getRange, Comparator.nullsLast(Comparator.naturalOrder())))
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "UnitIndex{" + getUnitId() + ", " + entries.size() + " names}";
    }
}
