package org.dxworks.cobolscope.source;

public enum UnitKind {
    PROGRAM,
    COPYBOOK
}
