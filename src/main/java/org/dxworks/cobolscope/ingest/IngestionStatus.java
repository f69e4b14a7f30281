package org.dxworks.cobolscope.ingest;

public enum IngestionStatus {
    /** A new or changed model was built (or loaded from the store) and committed. */
    COMMITTED,
    /** The expanded source hash matches the committed model; nothing was rebuilt. */
    UNCHANGED,
    /** The unit is structurally unrecoverable; any previous contribution was removed. */
    FAILED,
    /** The batch was cancelled before this unit started. */
    CANCELLED
}
