package org.dxworks.cobolscope.model;

public enum StructureKind {
    DIVISION,
    SECTION,
    PARAGRAPH,
    SENTENCE,
    STATEMENT,
    OPAQUE_STATEMENT,
    ENTRY,
    DATA_ENTRY,
    FILE_DESCRIPTION
}
