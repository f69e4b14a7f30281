package org.dxworks.cobolscope.analytics;

public class Relationship {
    /** Program that depends. */
    public String source;
    /** Copybook member or called program. */
    public String target;
    /** COPY or CALL. */
    public String type;

    public Relationship() {
    }

    public Relationship(String source, String target, String type) {
        this.source = source;
        this.target = target;
        this.type = type;
    }
}
