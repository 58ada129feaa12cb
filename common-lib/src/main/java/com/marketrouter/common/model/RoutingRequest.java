package com.marketrouter.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Map;

/**
 * Provider-agnostic request handed to routing strategies and to a provider's
 * {@code extract} call. Derived from a {@link StandardQuery}.
 */
public record RoutingRequest(
    @JsonProperty("symbol")             String symbol,
    @JsonProperty("assetType")          AssetType assetType,
    @JsonProperty("dataType")           DataType dataType,
    @JsonProperty("market")             String market,
    @JsonProperty("startDate")          LocalDate startDate,
    @JsonProperty("endDate")            LocalDate endDate,
    @JsonProperty("period")             String period,
    @JsonProperty("priority")           int priority,
    @JsonProperty("timeout")            Duration timeout,
    @JsonProperty("retryBudget")        int retryBudget,
    @JsonProperty("qualityRequirement") double qualityRequirement,
    @JsonProperty("extraParams")        Map<String, Object> extraParams,
    @JsonProperty("traceId")            String traceId
) {
    public RoutingRequest {
        extraParams = extraParams == null ? Map.of() : extraParams;
    }

    /** Request for a symbol with the default period, timeout and retry budget. */
    public static RoutingRequest of(String symbol, AssetType assetType, DataType dataType) {
        return new RoutingRequest(symbol, assetType, dataType, null, null, null, "D",
                                  0, Duration.ofSeconds(5), 3, 0.0, Map.of(), null);
    }
}
