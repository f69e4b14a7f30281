package org.dxworks.cobolscope.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.dxworks.cobolscope.source.SourceRange;

import java.util.Collections;
import java.util.List;

/**
 * An FD/SD entry and the indices of its record (level 01) items.
 */
public final class FileDescriptor {

    private final String indicator;
    private final String fileName;
    private final List<Integer> recordIndices;
    private final SourceRange range;

    @JsonCreator
    public FileDescriptor(@JsonProperty("indicator") String indicator,
                          @JsonProperty("fileName") String fileName,
                          @JsonProperty("recordIndices") List<Integer> recordIndices,
                          @JsonProperty("range") SourceRange range) {
        this.indicator = indicator;
        this.fileName = fileName;
        this.recordIndices = recordIndices == null ? List.of() : Collections.unmodifiableList(recordIndices);
        this.range = range;
    }

    public String getIndicator() {
        return indicator;
    }

    public String getFileName() {
        return fileName;
    }

    public List<Integer> getRecordIndices() {
        return recordIndices;
    }

    public SourceRange getRange() {
        return range;
    }
}
