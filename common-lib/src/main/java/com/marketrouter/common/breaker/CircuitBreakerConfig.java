package com.marketrouter.common.breaker;

import java.time.Duration;

/**
 * Immutable circuit breaker settings. Out-of-range values are clamped in the
 * canonical constructor rather than rejected:
 * <pre>
 *   windowSize        [1, 1000]
 *   minimumCalls      >= 1   (effective minimum is min(minimumCalls, windowSize))
 *   failureThreshold  >= 1
 *   rate thresholds   [0, 1]
 *   halfOpenMaxCalls  >= 1
 *   successThreshold  [1, halfOpenMaxCalls]
 *   adaptiveFactor    [0, 0.5]
 * </pre>
 *
 * <p>Degradation thresholds map the window failure rate at the moment of opening
 * to a {@link DegradationLevel}; anything below {@code moderateRate} is MINOR.
 */
public record CircuitBreakerConfig(
    int windowSize,
    int minimumCalls,
    int failureThreshold,
    double failureRateThreshold,
    Duration slowCallThreshold,
    double slowCallRateThreshold,
    Duration recoveryTimeout,
    int halfOpenMaxCalls,
    int successThreshold,
    boolean adaptive,
    double adaptiveFactor,
    double criticalRate,
    double severeRate,
    double moderateRate
) {
    static final int MAX_WINDOW_SIZE = 1000;

    public CircuitBreakerConfig {
        windowSize            = Math.max(1, Math.min(MAX_WINDOW_SIZE, windowSize));
        minimumCalls          = Math.max(1, minimumCalls);
        failureThreshold      = Math.max(1, failureThreshold);
        failureRateThreshold  = clamp01(failureRateThreshold);
        slowCallThreshold     = slowCallThreshold == null ? Duration.ofSeconds(5) : slowCallThreshold;
        slowCallRateThreshold = clamp01(slowCallRateThreshold);
        recoveryTimeout       = recoveryTimeout == null ? Duration.ofSeconds(60) : recoveryTimeout;
        halfOpenMaxCalls      = Math.max(1, halfOpenMaxCalls);
        successThreshold      = Math.max(1, Math.min(halfOpenMaxCalls, successThreshold));
        adaptiveFactor        = Math.max(0.0, Math.min(0.5, adaptiveFactor));
        criticalRate          = clamp01(criticalRate);
        severeRate            = clamp01(severeRate);
        moderateRate          = clamp01(moderateRate);
    }

    public static CircuitBreakerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Number of window samples required before the breaker may trip. */
    public int effectiveMinimumCalls() {
        return Math.min(minimumCalls, windowSize);
    }

    DegradationLevel degradationFor(double failureRate) {
        if (failureRate >= criticalRate) return DegradationLevel.CRITICAL;
        if (failureRate >= severeRate)   return DegradationLevel.SEVERE;
        if (failureRate >= moderateRate) return DegradationLevel.MODERATE;
        return DegradationLevel.MINOR;
    }

    private static double clamp01(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }

    public static final class Builder {
        private int windowSize = 10;
        private int minimumCalls = 10;
        private int failureThreshold = 5;
        private double failureRateThreshold = 0.5;
        private Duration slowCallThreshold = Duration.ofSeconds(5);
        private double slowCallRateThreshold = 0.3;
        private Duration recoveryTimeout = Duration.ofSeconds(60);
        private int halfOpenMaxCalls = 3;
        private int successThreshold = 3;
        private boolean adaptive = false;
        private double adaptiveFactor = 0.1;
        private double criticalRate = 0.8;
        private double severeRate = 0.6;
        private double moderateRate = 0.4;

        private Builder() {}

        public Builder windowSize(int v)                 { this.windowSize = v; return this; }
        public Builder minimumCalls(int v)               { this.minimumCalls = v; return this; }
        public Builder failureThreshold(int v)           { this.failureThreshold = v; return this; }
        public Builder failureRateThreshold(double v)    { this.failureRateThreshold = v; return this; }
        public Builder slowCallThreshold(Duration v)     { this.slowCallThreshold = v; return this; }
        public Builder slowCallRateThreshold(double v)   { this.slowCallRateThreshold = v; return this; }
        public Builder recoveryTimeout(Duration v)       { this.recoveryTimeout = v; return this; }
        public Builder halfOpenMaxCalls(int v)           { this.halfOpenMaxCalls = v; return this; }
        public Builder successThreshold(int v)           { this.successThreshold = v; return this; }
        public Builder adaptive(boolean v)               { this.adaptive = v; return this; }
        public Builder adaptiveFactor(double v)          { this.adaptiveFactor = v; return this; }

        public Builder degradationThresholds(double critical, double severe, double moderate) {
            this.criticalRate = critical;
            this.severeRate   = severe;
            this.moderateRate = moderate;
            return this;
        }

        public CircuitBreakerConfig build() {
            return new CircuitBreakerConfig(windowSize, minimumCalls, failureThreshold, failureRateThreshold,
                                            slowCallThreshold, slowCallRateThreshold, recoveryTimeout,
                                            halfOpenMaxCalls, successThreshold, adaptive, adaptiveFactor,
                                            criticalRate, severeRate, moderateRate);
        }
    }
}
