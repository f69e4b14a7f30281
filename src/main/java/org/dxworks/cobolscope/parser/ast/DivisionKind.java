package org.dxworks.cobolscope.parser.ast;

public enum DivisionKind {
    IDENTIFICATION,
    ENVIRONMENT,
    DATA,
    PROCEDURE
}
