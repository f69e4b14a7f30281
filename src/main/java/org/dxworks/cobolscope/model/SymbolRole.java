package org.dxworks.cobolscope.model;

public enum SymbolRole {
    DEFINITION,
    REFERENCE
}
