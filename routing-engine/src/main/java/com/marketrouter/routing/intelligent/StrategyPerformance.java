package com.marketrouter.routing.intelligent;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-strategy record: EWMA of "the first pick succeeded" and how often the strategy was used.
 */
public record StrategyPerformance(
    @JsonProperty("successRate") double successRate,
    @JsonProperty("usageCount")  long usageCount
) {
    static StrategyPerformance initial() {
        return new StrategyPerformance(1.0, 0);
    }

    StrategyPerformance record(boolean success, double alpha) {
        double sample = success ? 1.0 : 0.0;
        return new StrategyPerformance(alpha * sample + (1 - alpha) * successRate, usageCount + 1);
    }
}
