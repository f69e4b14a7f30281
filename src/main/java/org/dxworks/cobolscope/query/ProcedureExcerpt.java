package org.dxworks.cobolscope.query;

import org.dxworks.cobolscope.model.DataItem;
import org.dxworks.cobolscope.model.Edge;
import org.dxworks.cobolscope.model.ProcedureNode;

import java.util.Collections;
import java.util.List;

/**
 * The bounded neighborhood of one procedure handed to explanation services: the procedure, the
 * edges leaving and entering it, and the data items its statements touch.
 */
public final class ProcedureExcerpt {

    private final String unitId;
    private final String programId;
    private final ProcedureNode procedure;
    private final List<Edge> outgoing;
    private final List<Edge> incoming;
    private final List<DataItem> dataItems;

    ProcedureExcerpt(String unitId, String programId, ProcedureNode procedure, List<Edge> outgoing,
                     List<Edge> incoming, List<DataItem> dataItems) {
        this.unitId = unitId;
        this.programId = programId;
        this.procedure = procedure;
        this.outgoing = Collections.unmodifiableList(outgoing);
        this.incoming = Collections.unmodifiableList(incoming);
        this.dataItems = Collections.unmodifiableList(dataItems);
    }

    public String getUnitId() {
        return unitId;
    }

    public String getProgramId() {
        return programId;
    }

    public ProcedureNode getProcedure() {
        return procedure;
    }

    public List<Edge> getOutgoing() {
        return outgoing;
    }

    /**
     * Edges into the procedure, including CALLs from other units when it is a program's entry.
     */
    public List<Edge> getIncoming() {
        return incoming;
    }

    public List<DataItem> getDataItems() {
        return dataItems;
    }
}
