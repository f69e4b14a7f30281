package org.dxworks.cobolscope.ingest;

import org.dxworks.cobolscope.diagnostic.Diagnostic;
import org.dxworks.cobolscope.model.ProgramModel;

import java.util.List;
import java.util.Optional;

public final class IngestionResult {

    private final String unitId;
    private final IngestionStatus status;
    private final ProgramModel model;
    private final List<Diagnostic> diagnostics;
    private final String message;

    private IngestionResult(String unitId, IngestionStatus status, ProgramModel model, List<Diagnostic> diagnostics,
                            String message) {
        this.unitId = unitId;
        this.status = status;
        this.model = model;
        this.diagnostics = List.copyOf(diagnostics);
        this.message = message;
    }

    static IngestionResult committed(ProgramModel model) {
        return new IngestionResult(model.getUnitId(), IngestionStatus.COMMITTED, model, model.getDiagnostics(), null);
    }

    static IngestionResult unchanged(ProgramModel model) {
        return new IngestionResult(model.getUnitId(), IngestionStatus.UNCHANGED, model, model.getDiagnostics(), null);
    }

    static IngestionResult failed(String unitId, List<Diagnostic> diagnostics, String message) {
        return new IngestionResult(unitId, IngestionStatus.FAILED, null, diagnostics, message);
    }

    static IngestionResult cancelled(String unitId) {
        return new IngestionResult(unitId, IngestionStatus.CANCELLED, null, List.of(), "cancelled");
    }

    public String getUnitId() {
        return unitId;
    }

    public IngestionStatus getStatus() {
        return status;
    }

    /**
     * The committed model; empty for failed and cancelled units.
     */
    public Optional<ProgramModel> getModel() {
        return Optional.ofNullable(model);
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public String getMessage() {
        return message;
    }

    public boolean isSuccess() {
        return status == IngestionStatus.COMMITTED || status == IngestionStatus.UNCHANGED;
    }

    @Override
    public String toString() {
        return unitId + ": " + status + (message != null ? " (" + message + ")" : "");
    }
}
