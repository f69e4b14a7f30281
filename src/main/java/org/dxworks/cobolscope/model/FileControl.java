package org.dxworks.cobolscope.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.dxworks.cobolscope.source.SourceRange;

/**
 * A FILE-CONTROL {@code SELECT} entry.
 */
public final class FileControl {

    private final String fileName;
    private final String assignTo;
    private final String organization;
    private final String accessMode;
    private final String recordKey;
    private final String fileStatus;
    private final SourceRange range;

    @JsonCreator
    public FileControl(@JsonProperty("fileName") String fileName,
                       @JsonProperty("assignTo") String assignTo,
                       @JsonProperty("organization") String organization,
                       @JsonProperty("accessMode") String accessMode,
                       @JsonProperty("recordKey") String recordKey,
                       @JsonProperty("fileStatus") String fileStatus,
                       @JsonProperty("range") SourceRange range) {
        this.fileName = fileName;
        this.assignTo = assignTo;
        this.organization = organization;
        this.accessMode = accessMode;
        this.recordKey = recordKey;
        this.fileStatus = fileStatus;
        this.range = range;
    }

    public String getFileName() {
        return fileName;
    }

    public String getAssignTo() {
        return assignTo;
    }

    public String getOrganization() {
        return organization;
    }

    public String getAccessMode() {
        return accessMode;
    }

    public String getRecordKey() {
        return recordKey;
    }

    public String getFileStatus() {
        return fileStatus;
    }

    public SourceRange getRange() {
        return range;
    }
}
