package org.dxworks.cobolscope.model;

public enum Complexity {
    LOW,
    MEDIUM,
    HIGH;

    public static Complexity of(int score) {
        if (score < 10) {
            return LOW;
        }
        return score < 50 ? MEDIUM : HIGH;
    }
}
