package com.marketrouter.routing.intelligent;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketrouter.routing.strategy.StrategyType;

import java.util.Map;

public record RoutingStatistics(
    @JsonProperty("intelligentRoutingEnabled") boolean intelligentRoutingEnabled,
    @JsonProperty("adaptiveWeightsEnabled")    boolean adaptiveWeightsEnabled,
    @JsonProperty("totalDecisions")            long totalDecisions,
    @JsonProperty("cacheHits")                 long cacheHits,
    @JsonProperty("decisionCacheSize")         int decisionCacheSize,
    @JsonProperty("strategyPerformance")       Map<StrategyType, StrategyPerformance> strategyPerformance,
    @JsonProperty("strategyWeights")           Map<StrategyType, Double> strategyWeights,
    @JsonProperty("historySizes")              Map<String, Integer> historySizes
) {}
