package org.dxworks.cobolscope.query;

import java.util.Objects;

/**
 * Names a procedure for graph and excerpt queries: either its id within the unit, or its name,
 * optionally qualified by section ({@code P OF S}). A null unit searches every unit.
 */
public final class ProcedureRef {

    private final String unitId;
    private final String procedure;

    private ProcedureRef(String unitId, String procedure) {
        this.unitId = unitId;
        this.procedure = Objects.requireNonNull(procedure, "procedure");
    }

    public static ProcedureRef of(String unitId, String procedure) {
        return new ProcedureRef(unitId, procedure);
    }

    public static ProcedureRef anyUnit(String procedure) {
        return new ProcedureRef(null, procedure);
    }

    public String getUnitId() {
        return unitId;
    }

    public String getProcedure() {
        return procedure;
    }

    @Override
    public String toString() {
        return (unitId != null ? unitId + ":" : "") + procedure;
    }
}
