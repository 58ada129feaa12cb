package com.marketrouter.routing.registry;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketrouter.common.breaker.CircuitState;
import com.marketrouter.common.model.ProviderCapability;

import java.time.Instant;

/**
 * Immutable view of one provider's capability, metrics and breaker state, taken under the
 * registry's read lock. This is the only form in which routing code sees provider state.
 */
public record ProviderSnapshot(
    @JsonProperty("providerId")        String providerId,
    @JsonProperty("capability")        ProviderCapability capability,
    @JsonProperty("status")            ProviderStatus status,
    @JsonProperty("weight")            double weight,
    @JsonProperty("totalRequests")     long totalRequests,
    @JsonProperty("successRequests")   long successRequests,
    @JsonProperty("failedRequests")    long failedRequests,
    @JsonProperty("avgResponseTimeMs") double avgResponseTimeMs,
    @JsonProperty("qualityScore")      double qualityScore,
    @JsonProperty("availabilityScore") double availabilityScore,
    @JsonProperty("currentLoad")       int currentLoad,
    @JsonProperty("healthScore")       double healthScore,
    @JsonProperty("circuitState")      CircuitState circuitState,
    @JsonProperty("recentErrorRate")   double recentErrorRate,
    @JsonProperty("recentCalls")       int recentCalls,
    @JsonProperty("lastSuccess")       Instant lastSuccess,
    @JsonProperty("lastFailure")       Instant lastFailure,
    @JsonProperty("lastHealthCheck")   Instant lastHealthCheck,
    @JsonProperty("lastHealthMessage") String lastHealthMessage
) {
    /** Success ratio over all recorded requests; 1.0 before the first request. */
    @JsonProperty("successRate")
    public double successRate() {
        return totalRequests == 0 ? 1.0 : (double) successRequests / totalRequests;
    }

    public int priority() {
        return capability.priority();
    }
}
