package org.dxworks.cobolscope.exception;

import org.dxworks.cobolscope.diagnostic.Diagnostic;

import java.util.List;

/**
 * The unit has no recoverable structure; no program model is produced for it.
 */
public class UnitFailedException extends CobolScopeException {

    private final transient Diagnostic diagnostic;

    public UnitFailedException(Diagnostic diagnostic) {
        super(diagnostic.getMessage());
        this.diagnostic = diagnostic;
    }

    public Diagnostic getDiagnostic() {
        return diagnostic;
    }

    public List<Diagnostic> diagnostics() {
        return List.of(diagnostic);
    }
}
