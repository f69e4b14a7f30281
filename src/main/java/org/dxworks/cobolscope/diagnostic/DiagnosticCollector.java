package org.dxworks.cobolscope.diagnostic;

import org.dxworks.cobolscope.source.SourceRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-unit sink for diagnostics. One collector is owned by a single unit pipeline, so it is not
 * shared between threads.
 */
public final class DiagnosticCollector {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public Diagnostic report(DiagnosticKind kind, String message, SourceRange range) {
        Diagnostic diagnostic = new Diagnostic(kind, message, range);
        diagnostics.add(diagnostic);
        return diagnostic;
    }

    public void addAll(List<Diagnostic> others) {
        diagnostics.addAll(others);
    }

    public List<Diagnostic> all() {
        return Collections.unmodifiableList(diagnostics);
    }

    public List<Diagnostic> ofKind(DiagnosticKind kind) {
        List<Diagnostic> result = new ArrayList<>();
        for (Diagnostic d : diagnostics) {
            if (d.getKind() == kind) {
                result.add(d);
            }
        }
        return result;
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }
}
