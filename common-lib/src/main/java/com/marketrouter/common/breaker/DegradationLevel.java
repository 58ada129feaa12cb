package com.marketrouter.common.breaker;

/**
 * Graded severity of a provider outage, ordered from healthy to unusable.
 * Callers use it to pick fallback behaviour while a breaker is open.
 */
public enum DegradationLevel {
    NONE,
    MINOR,
    MODERATE,
    SEVERE,
    CRITICAL;

    /** One step towards {@link #NONE}; {@code NONE} stays {@code NONE}. */
    public DegradationLevel relaxed() {
        return this == NONE ? NONE : values()[ordinal() - 1];
    }
}
