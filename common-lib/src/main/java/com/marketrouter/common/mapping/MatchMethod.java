package com.marketrouter.common.mapping;

/**
 * How a raw column was resolved, in precedence order. {@code UNMAPPED} marks a column
 * that kept its name because its resolved target was already claimed by an
 * earlier column.
 */
public enum MatchMethod {
    EXACT,
    CUSTOM,
    FUZZY,
    INFERRED,
    UNMAPPED
}
