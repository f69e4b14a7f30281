package org.dxworks.cobolscope.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/**
 * OCCURS bounds. A fixed table has {@code min == max}; a variable-length table names its counter
 * in {@code dependingOn}, resolved to {@code dependingOnIndex} when the counter item exists.
 */
public final class OccursClause {

    private final Integer min;
    private final Integer max;
    private final String dependingOn;
    private final Integer dependingOnIndex;
    private final List<String> indexedBy;

    @JsonCreator
    public OccursClause(@JsonProperty("min") Integer min,
                        @JsonProperty("max") Integer max,
                        @JsonProperty("dependingOn") String dependingOn,
                        @JsonProperty("dependingOnIndex") Integer dependingOnIndex,
                        @JsonProperty("indexedBy") List<String> indexedBy) {
        this.min = min;
        this.max = max;
        this.dependingOn = dependingOn;
        this.dependingOnIndex = dependingOnIndex;
        this.indexedBy = indexedBy == null ? List.of() : Collections.unmodifiableList(indexedBy);
    }

    public Integer getMin() {
        return min;
    }

    public Integer getMax() {
        return max;
    }

    public String getDependingOn() {
        return dependingOn;
    }

    public Integer getDependingOnIndex() {
        return dependingOnIndex;
    }

    public List<String> getIndexedBy() {
        return indexedBy;
    }

    @JsonIgnore
    public boolean isVariable() {
        return dependingOn != null;
    }

    @Override
    public String toString() {
        String bounds = min != null && !min.equals(max) ? min + " TO " + max : String.valueOf(max);
        return dependingOn == null ? bounds : bounds + " DEPENDING ON " + dependingOn;
    }
}
