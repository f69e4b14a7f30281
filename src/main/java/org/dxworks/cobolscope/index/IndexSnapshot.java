package org.dxworks.cobolscope.index;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * An immutable view of every committed unit contribution. Readers hold on to one snapshot for the
 * duration of an operation and never observe a partially replaced unit.
 */
public final class IndexSnapshot {

    private static final IndexSnapshot EMPTY = new IndexSnapshot(0L, new TreeMap<>());

    private final long generation;
    private final NavigableMap<String, UnitIndex> units;
    private final Map<String, List<String>> unitsByProgram;
    private final Map<String, List<CallSite>> callsByProgram;

    private IndexSnapshot(long generation, TreeMap<String, UnitIndex> units) {
        this.generation = generation;
        this.units = Collections.unmodifiableNavigableMap(units);

        Map<String, List<String>> programs = new TreeMap<>();
        Map<String, List<CallSite>> calls = new TreeMap<>();
        for (UnitIndex unit : units.values()) {
            unit.getProgramId().ifPresent(programId ->
                    programs.computeIfAbsent(programId.toUpperCase(Locale.ROOT), k -> new ArrayList<>())
                            .add(unit.getUnitId()));
            unit.calls().forEach(call -> calls
                    .computeIfAbsent(call.getTarget().toUpperCase(Locale.ROOT), k -> new ArrayList<>())
                    .add(new CallSite(unit.getUnitId(), call)));
        }
        programs.replaceAll((k, v) -> List.copyOf(v));
        calls.replaceAll((k, v) -> List.copyOf(v));
        this.unitsByProgram = Collections.unmodifiableMap(programs);
        this.callsByProgram = Collections.unmodifiableMap(calls);
    }

    public static IndexSnapshot empty() {
        return EMPTY;
    }

    /**
     * A new snapshot with {@code unit} added, or replacing the previous contribution of the same unit id.
     */
    IndexSnapshot with(UnitIndex unit) {
        TreeMap<String, UnitIndex> next = new TreeMap<>(units);
        next.put(unit.getUnitId(), unit);
        return new IndexSnapshot(generation + 1, next);
    }

    IndexSnapshot without(String unitId) {
        if (!units.containsKey(unitId)) {
            return this;
        }
        TreeMap<String, UnitIndex> next = new TreeMap<>(units);
        next.remove(unitId);
        return new IndexSnapshot(generation + 1, next);
    }

    /**
     * Incremented by every commit or removal.
     */
    public long getGeneration() {
        return generation;
    }

    /**
     * Unit contributions in unit id order.
     */
    public Collection<UnitIndex> units() {
        return units.values();
    }

    public Optional<UnitIndex> unit(String unitId) {
        return Optional.ofNullable(units.get(unitId));
    }

    public int size() {
        return units.size();
    }

    /**
     * Units whose PROGRAM-ID equals {@code programName}, ignoring case.
     */
    public List<String> unitsForProgram(String programName) {
        if (programName == null) {
            return List.of();
        }
        return unitsByProgram.getOrDefault(programName.toUpperCase(Locale.ROOT), List.of());
    }

    /**
     * CALL edges, from any unit, naming {@code programName} as their target.
     */
    public List<CallSite> callsTo(String programName) {
        if (programName == null) {
            return List.of();
        }
        return callsByProgram.getOrDefault(programName.toUpperCase(Locale.ROOT), List.of());
    }
}
