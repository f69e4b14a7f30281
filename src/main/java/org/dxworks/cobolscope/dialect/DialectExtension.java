package org.dxworks.cobolscope.dialect;

/**
 * Non-standard source conventions the single grammar core can be told to accept.
 */
public enum DialectExtension {
    /** Paragraph and section headers are accepted in Area B without an Area A diagnostic. */
    RELAXED_AREA_A,
    /** Lines with a {@code D} indicator are compiled instead of treated as comments. */
    DEBUG_LINES_AS_CODE,
    /** {@code *>} starts a comment that runs to the end of the line. */
    FLOATING_COMMENTS,
    /** Underscores are allowed inside user-defined words. */
    UNDERSCORE_IN_WORDS
}
