package org.dxworks.cobolscope.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One ingested program or copy member. The raw lines are fixed when the unit is read; the
 * provenance map and content hash are attached once the preprocessor has expanded it, which
 * yields a new instance.
 */
public final class SourceUnit {

    private final String id;
    private final UnitKind kind;
    private final List<SourceLine> lines;
    private final ProvenanceMap provenance;
    private final String contentHash;

    private SourceUnit(String id, UnitKind kind, List<SourceLine> lines, ProvenanceMap provenance, String contentHash) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.lines = lines;
        this.provenance = provenance;
        this.contentHash = contentHash;
    }

    public static SourceUnit read(String id, UnitKind kind, String text) {
        return new SourceUnit(id, kind, splitLines(text), null, null);
    }

    public SourceUnit expanded(ProvenanceMap provenance, String contentHash) {
        return new SourceUnit(id, kind, lines, provenance, contentHash);
    }

    public static List<SourceLine> splitLines(String text) {
        String source = text == null ? "" : text;
        if (source.startsWith("\uFEFF")) {
            source = source.substring(1);
        }
        String[] raw = source.split("\r?\n", -1);
        int count = raw.length;
        // a trailing newline does not open another line
        if (count > 0 && raw[count - 1].isEmpty()) {
            count--;
        }
        List<SourceLine> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            result.add(new SourceLine(i + 1, raw[i]));
        }
        return Collections.unmodifiableList(result);
    }

    public String getId() {
        return id;
    }

    public UnitKind getKind() {
        return kind;
    }

    public List<SourceLine> getLines() {
        return lines;
    }

    public Optional<SourceLine> line(int number) {
        if (number < 1 || number > lines.size()) {
            return Optional.empty();
        }
        return Optional.of(lines.get(number - 1));
    }

    public Optional<ProvenanceMap> getProvenance() {
        return Optional.ofNullable(provenance);
    }

    public Optional<String> getContentHash() {
        return Optional.ofNullable(contentHash);
    }

    /**
     * Member name used for include-cycle detection: the file name without directories or extension.
     */
    public String memberName() {
        String name = id.replace('\\', '/');
        int slash = name.lastIndexOf('/');
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        return name;
    }

    @Override
    public String toString() {
        return id;
    }
}
