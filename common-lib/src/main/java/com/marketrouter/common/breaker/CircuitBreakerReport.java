package com.marketrouter.common.breaker;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read-only snapshot of one breaker, safe to hand to monitoring layers.
 */
public record CircuitBreakerReport(
    @JsonProperty("name")                     String name,
    @JsonProperty("state")                    CircuitState state,
    @JsonProperty("degradationLevel")         DegradationLevel degradationLevel,
    @JsonProperty("windowCalls")              int windowCalls,
    @JsonProperty("windowFailures")           int windowFailures,
    @JsonProperty("failureRate")              double failureRate,
    @JsonProperty("slowCallRate")             double slowCallRate,
    @JsonProperty("totalCalls")               long totalCalls,
    @JsonProperty("totalSuccesses")           long totalSuccesses,
    @JsonProperty("totalFailures")            long totalFailures,
    @JsonProperty("totalRejected")            long totalRejected,
    @JsonProperty("totalSlowCalls")           long totalSlowCalls,
    @JsonProperty("averageResponseTimeMs")    double averageResponseTimeMs,
    @JsonProperty("effectiveFailureThreshold") int effectiveFailureThreshold,
    @JsonProperty("effectiveRecoveryTimeoutMs") long effectiveRecoveryTimeoutMs,
    @JsonProperty("halfOpenCallCount")        int halfOpenCallCount,
    @JsonProperty("failuresByType")           Map<FailureType, Long> failuresByType,
    @JsonProperty("recentFailures")           List<FailureRecord> recentFailures,
    @JsonProperty("stateChangedAt")           Instant stateChangedAt,
    @JsonProperty("lastFailureTime")          Instant lastFailureTime
) {}
