package org.dxworks.cobolscope.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Multimap from unqualified data name to every item declared under it. A name is never assumed
 * to be unique; qualified lookups filter candidates by their qualification chain.
 */
public final class DataItemTable {

    private final Map<String, List<DataItem>> byName = new LinkedHashMap<>();

    public DataItemTable(List<DataItem> items) {
        for (DataItem item : items) {
            if (item.getName() != null) {
                byName.computeIfAbsent(item.getName(), k -> new ArrayList<>()).add(item);
            }
        }
        byName.replaceAll((k, v) -> Collections.unmodifiableList(v));
    }

    public List<DataItem> lookup(String name) {
        return byName.getOrDefault(name.toUpperCase(Locale.ROOT), List.of());
    }

    /**
     * Candidates for {@code name OF q1 OF q2 ...}: every qualifier must appear among the item's
     * ancestors, in the given order, though intermediate levels may be skipped.
     */
    public List<DataItem> lookup(String name, List<String> qualifiers) {
        List<DataItem> candidates = lookup(name);
        if (qualifiers.isEmpty()) {
            return candidates;
        }
        List<DataItem> result = new ArrayList<>();
        for (DataItem item : candidates) {
            if (matchesQualifiers(item.getQualification(), qualifiers)) {
                result.add(item);
            }
        }
        return result;
    }

    static boolean matchesQualifiers(List<String> chain, List<String> qualifiers) {
        int at = 1;
        for (String qualifier : qualifiers) {
            String wanted = qualifier.toUpperCase(Locale.ROOT);
            while (at < chain.size() && !chain.get(at).equals(wanted)) {
                at++;
            }
            if (at >= chain.size()) {
                return false;
            }
            at++;
        }
        return true;
    }

    public boolean contains(String name) {
        return !lookup(name).isEmpty();
    }

    public Map<String, List<DataItem>> asMap() {
        return Collections.unmodifiableMap(byName);
    }
}
