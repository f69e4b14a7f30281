package org.dxworks.cobolscope.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Maps each line of the expanded (copy-resolved) text back to its originating file and line.
 */
public final class ProvenanceMap {

    private final String unit;
    private final List<LineOrigin> origins;

    public ProvenanceMap(String unit, List<LineOrigin> origins) {
        this.unit = unit;
        this.origins = Collections.unmodifiableList(new ArrayList<>(origins));
    }

    public LineOrigin origin(int expandedIndex) {
        return origins.get(expandedIndex);
    }

    public boolean isCopied(int expandedIndex) {
        return !origins.get(expandedIndex).getFile().equals(unit);
    }

    public int size() {
        return origins.size();
    }

    public List<LineOrigin> origins() {
        return origins;
    }

    /**
     * Files that contributed lines to the expansion, unit first, in order of first appearance.
     */
    public Set<String> contributingFiles() {
        Set<String> files = new LinkedHashSet<>();
        files.add(unit);
        for (LineOrigin origin : origins) {
            files.add(origin.getFile());
        }
        return files;
    }
}
