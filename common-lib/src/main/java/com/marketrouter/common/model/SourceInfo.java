package com.marketrouter.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Where a result came from and what it took to get it.
 */
public record SourceInfo(
    @JsonProperty("providerId")       String providerId,
    @JsonProperty("attempts")         int attempts,
    @JsonProperty("failedProviders")  List<String> failedProviders,
    @JsonProperty("errorMessages")    Map<String, String> errorMessages,
    @JsonProperty("strategy")         String strategy,
    @JsonProperty("extractionTimeMs") long extractionTimeMs,
    @JsonProperty("totalTimeMs")      long totalTimeMs,
    @JsonProperty("fromCache")        boolean fromCache
) {
    public SourceInfo {
        failedProviders = failedProviders == null ? List.of() : List.copyOf(failedProviders);
        errorMessages   = errorMessages == null ? Map.of() : errorMessages;
    }

    public static SourceInfo from(FailoverResult failover, String strategy) {
        return new SourceInfo(failover.successfulProvider(), failover.attempts(), failover.failedProviders(),
                              failover.errorMessages(), strategy, failover.extractionTimeMs(),
                              failover.totalTimeMs(), false);
    }

    public SourceInfo asCached() {
        return new SourceInfo(providerId, attempts, failedProviders, errorMessages, strategy,
                              extractionTimeMs, totalTimeMs, true);
    }
}
