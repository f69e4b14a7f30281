package org.dxworks.cobolscope.diagnostic;

import static org.dxworks.cobolscope.diagnostic.DiagnosticCategory.FATAL_TO_DIRECTIVE;
import static org.dxworks.cobolscope.diagnostic.DiagnosticCategory.FATAL_TO_UNIT;
import static org.dxworks.cobolscope.diagnostic.DiagnosticCategory.INFORMATIONAL;
import static org.dxworks.cobolscope.diagnostic.DiagnosticCategory.RECOVERABLE;

public enum DiagnosticKind {
    NO_DIVISION_STRUCTURE(FATAL_TO_UNIT),
    UNTERMINATED_DIVISION_HEADER(FATAL_TO_UNIT),

    CIRCULAR_INCLUDE(FATAL_TO_DIRECTIVE),
    UNRESOLVED_INCLUDE(FATAL_TO_DIRECTIVE),
    MALFORMED_DIRECTIVE(FATAL_TO_DIRECTIVE),

    MALFORMED_LITERAL(RECOVERABLE),
    AREA_A_VIOLATION(RECOVERABLE),
    OPAQUE_STATEMENT(RECOVERABLE),
    DIVISION_ORDER(RECOVERABLE),
    UNBALANCED_PARENTHESES(RECOVERABLE),
    STRAY_TEXT(RECOVERABLE),
    INVALID_LEVEL_NUMBER(RECOVERABLE),
    LEVEL_NUMBER_INCONSISTENT(RECOVERABLE),
    UNRESOLVED_REDEFINES(RECOVERABLE),
    UNRESOLVED_OCCURS_COUNTER(RECOVERABLE),
    NUMERIC_OUT_OF_RANGE(RECOVERABLE),
    DANGLING_TARGET(RECOVERABLE),
    AMBIGUOUS_TARGET(RECOVERABLE),

    EXTERNAL_CALL(INFORMATIONAL);

    private final DiagnosticCategory category;

    DiagnosticKind(DiagnosticCategory category) {
        this.category = category;
    }

    public DiagnosticCategory getCategory() {
        return category;
    }
}
