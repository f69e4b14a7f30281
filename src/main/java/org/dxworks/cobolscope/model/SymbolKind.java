package org.dxworks.cobolscope.model;

public enum SymbolKind {
    DATA_ITEM,
    CONDITION,
    PROCEDURE,
    FILE,
    PROGRAM,
    INDEX_NAME,
    UNRESOLVED
}
