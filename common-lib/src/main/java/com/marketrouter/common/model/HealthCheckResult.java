package com.marketrouter.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Outcome of a single provider health probe.
 */
public record HealthCheckResult(
    @JsonProperty("healthy")   boolean healthy,
    @JsonProperty("message")   String message,
    @JsonProperty("latencyMs") long latencyMs,
    @JsonProperty("checkedAt") Instant checkedAt
) {
    public static HealthCheckResult healthy(String message, long latencyMs) {
        return new HealthCheckResult(true, message, latencyMs, Instant.now());
    }

    public static HealthCheckResult unhealthy(String message, long latencyMs) {
        return new HealthCheckResult(false, message, latencyMs, Instant.now());
    }
}
