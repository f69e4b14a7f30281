package org.dxworks.cobolscope.query;

import org.dxworks.cobolscope.index.CallSite;
import org.dxworks.cobolscope.index.CodeIndex;
import org.dxworks.cobolscope.index.IndexSnapshot;
import org.dxworks.cobolscope.index.UnitIndex;
import org.dxworks.cobolscope.model.DataAccess;
import org.dxworks.cobolscope.model.DataItem;
import org.dxworks.cobolscope.model.Edge;
import org.dxworks.cobolscope.model.EdgeKind;
import org.dxworks.cobolscope.model.ProcedureNode;
import org.dxworks.cobolscope.model.ProgramModel;
import org.dxworks.cobolscope.model.SymbolKind;
import org.dxworks.cobolscope.model.SymbolOccurrence;
import org.dxworks.cobolscope.model.SymbolRole;
import org.dxworks.cobolscope.store.CanonicalJson;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Read-only structural queries over the committed index.
 *
 * <p>Every operation reads the latest snapshot once and answers entirely from it, so concurrent
 * ingestion never shows through half-way. Ambiguous names are never narrowed silently: all
 * candidates are returned.</p>
 */
public class QueryEngine {

    private static final Set<SymbolKind> NAMED_DEFINITIONS =
            EnumSet.of(SymbolKind.FILE, SymbolKind.PROGRAM, SymbolKind.INDEX_NAME);
    private static final Comparator<Edge> EDGE_ORDER =
            Comparator.comparing(Edge::getRange, Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparing(Edge::getFrom);

    private final CodeIndex index;

    public QueryEngine(CodeIndex index) {
        this.index = index;
    }

    public List<Definition> findDefinition(String name) {
        return findDefinition(name, null);
    }

    /**
     * Declarations matching {@code name}, which may be qualified ({@code A OF B IN C}).
     *
     * @param unitId restricts the lookup to one unit; null searches every unit
     */
    public List<Definition> findDefinition(String name, String unitId) {
        QualifiedName wanted = QualifiedName.parse(name);
        List<Definition> result = new ArrayList<>();
        for (UnitIndex unit : scope(index.snapshot(), unitId)) {
            ProgramModel model = unit.getModel();
            for (DataItem item : model.getDataItemTable().lookup(wanted.getName(), wanted.getQualifiers())) {
                result.add(new Definition(unit.getUnitId(), item.getName(),
                        item.isCondition() ? SymbolKind.CONDITION : SymbolKind.DATA_ITEM,
                        item.getQualification(), item.getNodeId(), item.getRange()));
            }
            if (wanted.getQualifiers().size() <= 1) {
                for (ProcedureNode procedure : model.getProcedures()) {
                    if (matches(procedure, wanted)) {
                        result.add(new Definition(unit.getUnitId(), procedure.getName(), SymbolKind.PROCEDURE,
                                procedureChain(procedure), procedure.getId(), procedure.getRange()));
                    }
                }
            }
            if (!wanted.isQualified()) {
                unit.entry(wanted.getName()).ifPresent(entry -> entry.getOccurrences().stream()
                        .filter(o -> o.getRole() == SymbolRole.DEFINITION)
                        .filter(o -> NAMED_DEFINITIONS.contains(o.getSymbolKind()))
                        .forEach(o -> result.add(new Definition(unit.getUnitId(), o.getText(), o.getSymbolKind(),
                                List.of(o.getText()), o.getNodeId(), o.getRange()))));
            }
        }
        result.sort(Comparator.comparing(Definition::getUnitId)
                .thenComparing(Definition::getRange, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(Definition::getKind));
        return result;
    }

    public List<SymbolOccurrence> findReferences(String name) {
        return findReferences(name, null);
    }

    /**
     * Every occurrence, declarations included, of the base name of {@code name}. Qualifiers are
     * not applied: an occurrence does not record which declaration it binds to.
     */
    public List<SymbolOccurrence> findReferences(String name, String unitId) {
        String key = QualifiedName.parse(name).getName();
        List<SymbolOccurrence> result = new ArrayList<>();
        for (UnitIndex unit : scope(index.snapshot(), unitId)) {
            unit.entry(key).ifPresent(entry -> result.addAll(entry.getOccurrences()));
        }
        result.sort(Comparator.comparing(SymbolOccurrence::getRange));
        return result;
    }

    /**
     * Occurrences whose name equals, starts with or contains {@code fragment}, ranked in that order,
     * ties broken by unit id and position.
     */
    public List<SearchHit> search(String fragment) {
        String needle = fragment == null ? "" : fragment.trim().toUpperCase(Locale.ROOT);
        if (needle.isEmpty()) {
            return List.of();
        }
        List<SearchHit> hits = new ArrayList<>();
        for (UnitIndex unit : index.snapshot().units()) {
            unit.getEntries().forEach((name, entry) -> {
                MatchKind match = match(name, needle);
                if (match != null) {
                    entry.getOccurrences().forEach(o -> hits.add(new SearchHit(match, unit.getUnitId(), o)));
                }
            });
        }
        hits.sort(SearchHit.RANKING);
        return hits;
    }

    /**
     * Reads and writes of a data item by procedure statements. With a qualified name only accesses
     * bound to one of the matching declarations are returned.
     */
    public List<DataAccess> dataAccesses(String name, String unitId) {
        QualifiedName wanted = QualifiedName.parse(name);
        List<DataAccess> result = new ArrayList<>();
        for (UnitIndex unit : scope(index.snapshot(), unitId)) {
            ProgramModel model = unit.getModel();
            Set<Integer> declarations = model.getDataItemTable()
                    .lookup(wanted.getName(), wanted.getQualifiers()).stream()
                    .map(DataItem::getIndex)
                    .collect(Collectors.toSet());
            for (ProcedureNode procedure : model.getProcedures()) {
                for (DataAccess access : procedure.getDataAccesses()) {
                    if (!wanted.getName().equals(access.getName())) {
                        continue;
                    }
                    if (!wanted.isQualified() || declarations.contains(access.getItemIndex())) {
                        result.add(access);
                    }
                }
            }
        }
        result.sort(Comparator.comparing(DataAccess::getRange, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(DataAccess::getKind));
        return result;
    }

    public GraphResult callGraphNeighborhood(ProcedureRef ref, int depth) {
        return callGraphNeighborhood(ref, depth, Direction.FORWARD);
    }

    /**
     * Breadth-first closure over control edges from the procedures {@code ref} names, up to
     * {@code depth} edges away. Each node is visited once, so PERFORM cycles terminate. A CALL to a
     * program committed in another unit continues at that unit's entry procedure.
     */
    public GraphResult callGraphNeighborhood(ProcedureRef ref, int depth, Direction direction) {
        if (depth < 0) {
            throw new IllegalArgumentException("depth must not be negative: " + depth);
        }
        IndexSnapshot snapshot = index.snapshot();
        Map<String, GraphNode> nodes = new LinkedHashMap<>();
        Set<GraphEdge> edges = new LinkedHashSet<>();
        Deque<Visit> queue = new ArrayDeque<>();

        for (Located seed : resolve(snapshot, ref)) {
            Visit visit = procedureVisit(seed.unit, seed.procedure, 0);
            if (nodes.putIfAbsent(visit.node.getKey(), visit.node) == null) {
                queue.add(visit);
            }
        }

        while (!queue.isEmpty()) {
            Visit visit = queue.poll();
            if (visit.procedure == null || visit.node.getDepth() >= depth) {
                continue;
            }
            int next = visit.node.getDepth() + 1;
            if (direction.forward()) {
                for (Edge edge : visit.unit.outgoing(visit.procedure.getId())) {
                    GraphNode target = discover(nodes, queue, forwardTarget(snapshot, visit.unit, edge, next));
                    edges.add(new GraphEdge(visit.node.getKey(), target.getKey(), edge.getKind(), edge.getThru(),
                            edge.isDynamic(), edge.getRange()));
                }
            }
            if (direction.backward()) {
                for (Edge edge : visit.unit.incoming(visit.procedure.getId())) {
                    Optional<ProcedureNode> caller = visit.unit.getModel().procedure(edge.getFrom());
                    if (caller.isPresent()) {
                        GraphNode source = discover(nodes, queue, procedureVisit(visit.unit, caller.get(), next));
                        edges.add(new GraphEdge(source.getKey(), visit.node.getKey(), edge.getKind(), edge.getThru(),
                                edge.isDynamic(), edge.getRange()));
                    }
                }
                for (CallSite call : crossUnitCallers(snapshot, visit.unit, visit.procedure)) {
                    Optional<ProcedureNode> caller = snapshot.unit(call.getUnitId())
                            .flatMap(u -> u.getModel().procedure(call.getEdge().getFrom()));
                    if (caller.isPresent()) {
                        UnitIndex callerUnit = snapshot.unit(call.getUnitId()).orElseThrow();
                        GraphNode source = discover(nodes, queue, procedureVisit(callerUnit, caller.get(), next));
                        Edge edge = call.getEdge();
                        edges.add(new GraphEdge(source.getKey(), visit.node.getKey(), edge.getKind(), null,
                                edge.isDynamic(), edge.getRange()));
                    }
                }
            }
        }
        return new GraphResult(new ArrayList<>(nodes.values()), new ArrayList<>(edges));
    }

    /**
     * Excerpts for every procedure {@code ref} names; more than one when the name is ambiguous.
     */
    public List<ProcedureExcerpt> excerpt(ProcedureRef ref) {
        IndexSnapshot snapshot = index.snapshot();
        List<ProcedureExcerpt> result = new ArrayList<>();
        for (Located located : resolve(snapshot, ref)) {
            ProgramModel model = located.unit.getModel();
            ProcedureNode procedure = located.procedure;

            List<Edge> incoming = new ArrayList<>(located.unit.incoming(procedure.getId()));
            crossUnitCallers(snapshot, located.unit, procedure).forEach(call -> incoming.add(call.getEdge()));
            incoming.sort(EDGE_ORDER);

            Set<Integer> itemIndices = new TreeSet<>();
            for (DataAccess access : procedure.getDataAccesses()) {
                if (access.getItemIndex() != null) {
                    itemIndices.add(access.getItemIndex());
                }
            }
            List<DataItem> items = new ArrayList<>();
            itemIndices.forEach(i -> model.dataItem(i).ifPresent(items::add));

            result.add(new ProcedureExcerpt(located.unit.getUnitId(), model.getProgramId(), procedure,
                    procedure.getEdges(), incoming, items));
        }
        return result;
    }

    /**
     * The excerpts of {@link #excerpt(ProcedureRef)} in canonical JSON; identical models give
     * identical text.
     */
    public String excerptJson(ProcedureRef ref) {
        return CanonicalJson.write(excerpt(ref));
    }

    private static List<CallSite> crossUnitCallers(IndexSnapshot snapshot, UnitIndex unit, ProcedureNode procedure) {
        Optional<String> programId = unit.getProgramId();
        Optional<ProcedureNode> entry = unit.getModel().entryProcedure();
        if (programId.isEmpty() || entry.isEmpty() || !entry.get().getId().equals(procedure.getId())) {
            return List.of();
        }
        return snapshot.callsTo(programId.get());
    }

    private static GraphNode discover(Map<String, GraphNode> nodes, Deque<Visit> queue, Visit candidate) {
        GraphNode known = nodes.get(candidate.node.getKey());
        if (known != null) {
            return known;
        }
        nodes.put(candidate.node.getKey(), candidate.node);
        queue.add(candidate);
        return candidate.node;
    }

    private static Visit forwardTarget(IndexSnapshot snapshot, UnitIndex unit, Edge edge, int depth) {
        if (edge.getTargetId() != null) {
            Optional<ProcedureNode> target = unit.getModel().procedure(edge.getTargetId());
            if (target.isPresent()) {
                return procedureVisit(unit, target.get(), depth);
            }
        }
        String name = edge.getTarget() == null ? "?" : edge.getTarget();
        if (edge.getKind() != EdgeKind.CALL) {
            GraphNode node = new GraphNode("unresolved:" + unit.getUnitId() + "#" + name, GraphNodeKind.UNRESOLVED,
                    unit.getUnitId(), null, name, edge.getRange(), depth);
            return new Visit(node, unit, null);
        }
        List<String> calledUnits = snapshot.unitsForProgram(name);
        if (!calledUnits.isEmpty()) {
            UnitIndex called = snapshot.unit(calledUnits.get(0)).orElseThrow();
            Optional<ProcedureNode> entry = called.getModel().entryProcedure();
            if (entry.isPresent()) {
                return procedureVisit(called, entry.get(), depth);
            }
            GraphNode node = new GraphNode("program:" + name, GraphNodeKind.PROGRAM, called.getUnitId(), null,
                    name, null, depth);
            return new Visit(node, called, null);
        }
        GraphNode node = new GraphNode("program:" + name, GraphNodeKind.EXTERNAL, null, null, name, null, depth);
        return new Visit(node, unit, null);
    }

    private static Visit procedureVisit(UnitIndex unit, ProcedureNode procedure, int depth) {
        GraphNode node = new GraphNode(unit.getUnitId() + "#" + procedure.getId(), GraphNodeKind.PROCEDURE,
                unit.getUnitId(), procedure.getId(), procedure.getDisplayName(), procedure.getRange(), depth);
        return new Visit(node, unit, procedure);
    }

    private static List<Located> resolve(IndexSnapshot snapshot, ProcedureRef ref) {
        List<Located> result = new ArrayList<>();
        for (UnitIndex unit : scope(snapshot, ref.getUnitId())) {
            Optional<ProcedureNode> byId = unit.getModel().procedure(ref.getProcedure());
            if (byId.isPresent()) {
                result.add(new Located(unit, byId.get()));
                continue;
            }
            QualifiedName wanted = QualifiedName.parse(ref.getProcedure());
            for (ProcedureNode procedure : unit.getModel().getProcedures()) {
                if (matches(procedure, wanted)) {
                    result.add(new Located(unit, procedure));
                }
            }
        }
        return result;
    }

    private static boolean matches(ProcedureNode procedure, QualifiedName wanted) {
        if (procedure.getName() == null || !procedure.getName().equals(wanted.getName())) {
            return false;
        }
        if (!wanted.isQualified()) {
            return true;
        }
        return wanted.getQualifiers().size() == 1 && wanted.getQualifiers().get(0).equals(procedure.getSection());
    }

    private static List<String> procedureChain(ProcedureNode procedure) {
        if (procedure.getSection() == null) {
            return List.of(procedure.getName());
        }
        return List.of(procedure.getName(), procedure.getSection());
    }

    private static Collection<UnitIndex> scope(IndexSnapshot snapshot, String unitId) {
        if (unitId == null) {
            return snapshot.units();
        }
        return snapshot.unit(unitId).map(List::of).orElse(List.of());
    }

    private static MatchKind match(String name, String needle) {
        if (name.equals(needle)) {
            return MatchKind.EXACT;
        }
        if (name.startsWith(needle)) {
            return MatchKind.PREFIX;
        }
        if (name.contains(needle)) {
            return MatchKind.SUBSTRING;
        }
        return null;
    }

    private static final class Located {
        private final UnitIndex unit;
        private final ProcedureNode procedure;

        private Located(UnitIndex unit, ProcedureNode procedure) {
            this.unit = unit;
            this.procedure = procedure;
        }
    }

    private static final class Visit {
        private final GraphNode node;
        private final UnitIndex unit;
        private final ProcedureNode procedure;

        private Visit(GraphNode node, UnitIndex unit, ProcedureNode procedure) {
            this.node = node;
            this.unit = unit;
            this.procedure = procedure;
        }
    }
}
