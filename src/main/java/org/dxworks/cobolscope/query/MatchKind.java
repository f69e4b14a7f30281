package org.dxworks.cobolscope.query;

/**
 * How a search fragment matched a name, strongest first.
 */
public enum MatchKind {
    EXACT,
    PREFIX,
    SUBSTRING
}
