package org.dxworks.cobolscope.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.dxworks.cobolscope.source.SourceRange;

import java.util.Collections;
import java.util.List;

/**
 * A section or paragraph of the procedure division together with the control edges and data
 * accesses of its own sentences. A section's edges include CONTAINS edges to its paragraphs but
 * not the statements of those paragraphs.
 */
public final class ProcedureNode {

    private final String id;
    private final ProcedureKind kind;
    private final String name;
    private final String section;
    private final boolean declarative;
    private final SourceRange range;
    private final List<Edge> edges;
    private final List<DataAccess> dataAccesses;

    @JsonCreator
    public ProcedureNode(@JsonProperty("id") String id,
                         @JsonProperty("kind") ProcedureKind kind,
                         @JsonProperty("name") String name,
                         @JsonProperty("section") String section,
                         @JsonProperty("declarative") boolean declarative,
                         @JsonProperty("range") SourceRange range,
                         @JsonProperty("edges") List<Edge> edges,
                         @JsonProperty("dataAccesses") List<DataAccess> dataAccesses) {
        this.id = id;
        this.kind = kind;
        this.name = name;
        this.section = section;
        this.declarative = declarative;
        this.range = range;
        this.edges = edges == null ? List.of() : Collections.unmodifiableList(edges);
        this.dataAccesses = dataAccesses == null ? List.of() : Collections.unmodifiableList(dataAccesses);
    }

    public String getId() {
        return id;
    }

    public ProcedureKind getKind() {
        return kind;
    }

    /**
     * Upper-cased name, null for the anonymous paragraph that opens a division or section.
     */
    public String getName() {
        return name;
    }

    /**
     * Name of the enclosing section for paragraphs, null otherwise.
     */
    public String getSection() {
        return section;
    }

    public boolean isDeclarative() {
        return declarative;
    }

    public SourceRange getRange() {
        return range;
    }

    public List<Edge> getEdges() {
        return edges;
    }

    public List<DataAccess> getDataAccesses() {
        return dataAccesses;
    }

    @JsonIgnore
    public String getDisplayName() {
        if (name == null) {
            return id;
        }
        return section != null ? name + " OF " + section : name;
    }

    @Override
    public String toString() {
        return kind + " " + id;
    }
}
