package org.dxworks.cobolscope.model;

public enum EdgeKind {
    PERFORM,
    GO_TO,
    CALL,
    CONTAINS
}
