package org.dxworks.cobolscope.index;

import org.dxworks.cobolscope.model.SymbolOccurrence;

import java.util.Collections;
import java.util.List;

/**
 * Every occurrence of one normalized (upper-case) name within a unit, in source order.
 */
public final class IndexEntry {

    private final String name;
    private final List<SymbolOccurrence> occurrences;

    public IndexEntry(String name, List<SymbolOccurrence> occurrences) {
        this.name = name;
        this.occurrences = Collections.unmodifiableList(occurrences);
    }

    public String getName() {
        return name;
    }

    public List<SymbolOccurrence> getOccurrences() {
        return occurrences;
    }

    @Override
    public String toString() {
        return name + " x" + occurrences.size();
    }
}
