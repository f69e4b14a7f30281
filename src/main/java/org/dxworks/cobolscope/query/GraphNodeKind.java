package org.dxworks.cobolscope.query;

public enum GraphNodeKind {
    /** A section or paragraph of a committed unit. */
    PROCEDURE,
    /** A called program that is committed but has no procedure division. */
    PROGRAM,
    /** A called program that is not part of the index. */
    EXTERNAL,
    /** A PERFORM or GO TO target that resolves to nothing in its unit. */
    UNRESOLVED
}
