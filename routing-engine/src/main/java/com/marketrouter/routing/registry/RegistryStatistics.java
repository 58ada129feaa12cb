package com.marketrouter.routing.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record RegistryStatistics(
    @JsonProperty("totalProviders")   int totalProviders,
    @JsonProperty("activeProviders")  int activeProviders,
    @JsonProperty("errorProviders")   int errorProviders,
    @JsonProperty("disabledProviders") int disabledProviders,
    @JsonProperty("unknownProviders") int unknownProviders,
    @JsonProperty("totalRequests")    long totalRequests,
    @JsonProperty("successRate")      double successRate,
    @JsonProperty("indexBuckets")     int indexBuckets,
    @JsonProperty("markets")          int markets,
    @JsonProperty("lastHealthCheck")  Instant lastHealthCheck
) {}
