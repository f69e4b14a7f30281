package org.dxworks.cobolscope.diagnostic;

public enum DiagnosticCategory {
    /** No program model can be produced for the unit. */
    FATAL_TO_UNIT,
    /** A single compiler directive is left inert; the unit is still ingested. */
    FATAL_TO_DIRECTIVE,
    /** Recorded against the offending range; the model is still produced and queryable. */
    RECOVERABLE,
    /** Noteworthy but not a defect, such as a call leaving the unit. */
    INFORMATIONAL
}
