package org.dxworks.cobolscope.query;

public enum Direction {
    /** Follow edges from caller to callee. */
    FORWARD,
    /** Follow edges from callee back to its callers. */
    BACKWARD,
    BOTH;

    boolean forward() {
        return this != BACKWARD;
    }

    boolean backward() {
        return this != FORWARD;
    }
}
