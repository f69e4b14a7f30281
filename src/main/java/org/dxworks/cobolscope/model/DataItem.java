package org.dxworks.cobolscope.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import org.dxworks.cobolscope.source.SourceRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One data description entry with its resolved place in the level hierarchy.
 *
 * <p>Items are addressed by {@link #getIndex() index} into the owning model's item list; the
 * parent and children relations are indices, never object references.</p>
 */
@JsonDeserialize(builder = DataItem.Builder.class)
public final class DataItem {

    private final int index;
    private final int level;
    private final String name;
    private final String nodeId;
    private final SourceRange range;
    private final String section;
    private final String fileName;
    private final String picture;
    private final String usage;
    private final String value;
    private final String redefines;
    private final Integer redefinesIndex;
    private final OccursClause occurs;
    private final Integer parentIndex;
    private final List<Integer> children;
    private final List<String> qualification;
    private final List<String> renames;
    private final List<String> conditionValues;
    private final boolean external;
    private final boolean global;

    private DataItem(Builder b) {
        this.index = b.index;
        this.level = b.level;
        this.name = b.name;
        this.nodeId = b.nodeId;
        this.range = b.range;
        this.section = b.section;
        this.fileName = b.fileName;
        this.picture = b.picture;
        this.usage = b.usage;
        this.value = b.value;
        this.redefines = b.redefines;
        this.redefinesIndex = b.redefinesIndex;
        this.occurs = b.occurs;
        this.parentIndex = b.parentIndex;
        this.children = Collections.unmodifiableList(new ArrayList<>(b.children));
        this.qualification = Collections.unmodifiableList(new ArrayList<>(b.qualification));
        this.renames = Collections.unmodifiableList(new ArrayList<>(b.renames));
        this.conditionValues = Collections.unmodifiableList(new ArrayList<>(b.conditionValues));
        this.external = b.external;
        this.global = b.global;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .index(index).level(level).name(name).nodeId(nodeId).range(range)
                .section(section).fileName(fileName).picture(picture).usage(usage).value(value)
                .redefines(redefines).redefinesIndex(redefinesIndex).occurs(occurs).parentIndex(parentIndex)
                .children(children).qualification(qualification).renames(renames)
                .conditionValues(conditionValues).external(external).global(global);
    }

    public int getIndex() {
        return index;
    }

    public int getLevel() {
        return level;
    }

    /**
     * Upper-cased name, or null for FILLER and unnamed entries.
     */
    public String getName() {
        return name;
    }

    @JsonIgnore
    public boolean isFiller() {
        return name == null;
    }

    public String getNodeId() {
        return nodeId;
    }

    public SourceRange getRange() {
        return range;
    }

    public String getSection() {
        return section;
    }

    public String getFileName() {
        return fileName;
    }

    public String getPicture() {
        return picture;
    }

    public String getUsage() {
        return usage;
    }

    public String getValue() {
        return value;
    }

    public String getRedefines() {
        return redefines;
    }

    public Integer getRedefinesIndex() {
        return redefinesIndex;
    }

    public OccursClause getOccurs() {
        return occurs;
    }

    public Integer getParentIndex() {
        return parentIndex;
    }

    public List<Integer> getChildren() {
        return children;
    }

    /**
     * The item's name followed by the names of its named ancestors, innermost first.
     */
    public List<String> getQualification() {
        return qualification;
    }

    public List<String> getRenames() {
        return renames;
    }

    public List<String> getConditionValues() {
        return conditionValues;
    }

    public boolean isExternal() {
        return external;
    }

    public boolean isGlobal() {
        return global;
    }

    @JsonIgnore
    public boolean isGroup() {
        return !children.isEmpty() && picture == null;
    }

    @JsonIgnore
    public boolean isCondition() {
        return level == 88;
    }

    @Override
    public String toString() {
        return String.format("%02d %s", level, name == null ? "FILLER" : String.join(" OF ", qualification));
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private int index;
        private int level;
        private String name;
        private String nodeId;
        private SourceRange range;
        private String section;
        private String fileName;
        private String picture;
        private String usage;
        private String value;
        private String redefines;
        private Integer redefinesIndex;
        private OccursClause occurs;
        private Integer parentIndex;
        private List<Integer> children = new ArrayList<>();
        private List<String> qualification = new ArrayList<>();
        private List<String> renames = new ArrayList<>();
        private List<String> conditionValues = new ArrayList<>();
        private boolean external;
        private boolean global;

        public Builder index(int index) {
            this.index = index;
            return this;
        }

        public Builder level(int level) {
            this.level = level;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder nodeId(String nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public Builder range(SourceRange range) {
            this.range = range;
            return this;
        }

        public Builder section(String section) {
            this.section = section;
            return this;
        }

        public Builder fileName(String fileName) {
            this.fileName = fileName;
            return this;
        }

        public Builder picture(String picture) {
            this.picture = picture;
            return this;
        }

        public Builder usage(String usage) {
            this.usage = usage;
            return this;
        }

        public Builder value(String value) {
            this.value = value;
            return this;
        }

        public Builder redefines(String redefines) {
            this.redefines = redefines;
            return this;
        }

        public Builder redefinesIndex(Integer redefinesIndex) {
            this.redefinesIndex = redefinesIndex;
            return this;
        }

        public Builder occurs(OccursClause occurs) {
            this.occurs = occurs;
            return this;
        }

        public Builder parentIndex(Integer parentIndex) {
            this.parentIndex = parentIndex;
            return this;
        }

        public Builder children(List<Integer> children) {
            this.children = new ArrayList<>(children);
            return this;
        }

        public Builder qualification(List<String> qualification) {
            this.qualification = new ArrayList<>(qualification);
            return this;
        }

        public Builder renames(List<String> renames) {
            this.renames = new ArrayList<>(renames);
            return this;
        }

        public Builder conditionValues(List<String> conditionValues) {
            this.conditionValues = new ArrayList<>(conditionValues);
            return this;
        }

        public Builder external(boolean external) {
            this.external = external;
            return this;
        }

        public Builder global(boolean global) {
            this.global = global;
            return this;
        }

        public DataItem build() {
            return new DataItem(this);
        }
    }
}
