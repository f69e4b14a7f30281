package org.dxworks.cobolscope.model;

public enum ProcedureKind {
    SECTION,
    PARAGRAPH
}
