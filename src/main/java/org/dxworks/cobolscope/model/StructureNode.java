package org.dxworks.cobolscope.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.dxworks.cobolscope.source.SourceRange;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Serializable mirror of the parsed division tree: every node keeps its stable id, display name
 * and source range. Statements carry their verb as the name.
 */
public final class StructureNode {

    private final StructureKind kind;
    private final String id;
    private final String name;
    private final SourceRange range;
    private final List<StructureNode> children;

    @JsonCreator
    public StructureNode(@JsonProperty("kind") StructureKind kind,
                         @JsonProperty("id") String id,
                         @JsonProperty("name") String name,
                         @JsonProperty("range") SourceRange range,
                         @JsonProperty("children") List<StructureNode> children) {
        this.kind = kind;
        this.id = id;
        this.name = name;
        this.range = range;
        this.children = children == null ? List.of() : Collections.unmodifiableList(children);
    }

    public StructureKind getKind() {
        return kind;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public SourceRange getRange() {
        return range;
    }

    public List<StructureNode> getChildren() {
        return children;
    }

    public Optional<StructureNode> find(String nodeId) {
        if (id.equals(nodeId)) {
            return Optional.of(this);
        }
        for (StructureNode child : children) {
            Optional<StructureNode> found = child.find(nodeId);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return kind + " " + id;
    }
}
