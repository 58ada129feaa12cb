package com.marketrouter.common.breaker;

/**
 * Diagnostic classification of a provider failure. Attached to every
 * {@link FailureRecord}; it never changes how the breaker transitions.
 */
public enum FailureType {
    TIMEOUT(Severity.MEDIUM),
    CONNECTION(Severity.HIGH),
    RATE_LIMIT(Severity.LOW),
    SERVER_ERROR(Severity.MEDIUM),
    DATA_QUALITY(Severity.MEDIUM),
    UNKNOWN(Severity.MEDIUM);

    public enum Severity { LOW, MEDIUM, HIGH }

    private final Severity severity;

    FailureType(Severity severity) {
        this.severity = severity;
    }

    public Severity severity() {
        return severity;
    }
}
