package com.marketrouter.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate of one extract-with-failover run.
 *
 * <p>{@code attempts} counts providers whose extraction was actually invoked.
 * Providers skipped because their circuit breaker rejected the call are listed in
 * {@code skippedProviders} and are not counted as attempts. {@code errorMessages}
 * keeps one entry per failed or skipped provider, in ranking order.
 */
public record FailoverResult(
    @JsonProperty("success")            boolean success,
    @JsonIgnore                         DataTable data,
    @JsonProperty("attempts")           int attempts,
    @JsonProperty("failedProviders")    List<String> failedProviders,
    @JsonProperty("skippedProviders")   List<String> skippedProviders,
    @JsonProperty("successfulProvider") String successfulProvider,
    @JsonProperty("errorMessages")      Map<String, String> errorMessages,
    @JsonProperty("extractionTimeMs")   long extractionTimeMs,
    @JsonProperty("totalTimeMs")        long totalTimeMs
) {
    public FailoverResult {
        failedProviders  = failedProviders == null ? List.of() : List.copyOf(failedProviders);
        skippedProviders = skippedProviders == null ? List.of() : List.copyOf(skippedProviders);
        errorMessages    = errorMessages == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(errorMessages));
    }

    /** Providers that were tried or skipped, in ranking order. */
    @JsonIgnore
    public List<String> attemptedProviders() {
        return List.copyOf(errorMessages.keySet());
    }
}
