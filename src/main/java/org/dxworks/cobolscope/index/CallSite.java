package org.dxworks.cobolscope.index;

import org.dxworks.cobolscope.model.Edge;

/**
 * A CALL edge together with the unit it was written in.
 */
public final class CallSite {

    private final String unitId;
    private final Edge edge;

    CallSite(String unitId, Edge edge) {
        this.unitId = unitId;
        this.edge = edge;
    }

    public String getUnitId() {
        return unitId;
    }

    public Edge getEdge() {
        return edge;
    }

    @Override
    public String toString() {
        return unitId + ": " + edge;
    }
}
