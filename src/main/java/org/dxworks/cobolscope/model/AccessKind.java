package org.dxworks.cobolscope.model;

public enum AccessKind {
    READ,
    WRITE
}
