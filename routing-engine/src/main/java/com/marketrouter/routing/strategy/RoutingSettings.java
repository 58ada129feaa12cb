package com.marketrouter.routing.strategy;

/**
 * @param defaultStrategy        used when dynamic selection is off, or when no request rule applies
 * @param dynamicSelection       choose the strategy per request via {@link StrategySelector}
 * @param roundRobinHealthFloor  health score a provider must exceed to join the rotation
 * @param breakerErrorThreshold  recent error rate above which the breaker-aware strategy drops a provider
 * @param breakerMinRequests     recent calls needed before that error rate counts
 */
public record RoutingSettings(
    StrategyType defaultStrategy,
    boolean dynamicSelection,
    double roundRobinHealthFloor,
    double breakerErrorThreshold,
    int breakerMinRequests
) {
    public RoutingSettings {
        if (defaultStrategy == null || defaultStrategy == StrategyType.INTELLIGENT) {
            defaultStrategy = StrategyType.HEALTH_BASED;
        }
        breakerMinRequests = Math.max(1, breakerMinRequests);
    }

    public static RoutingSettings defaults() {
        return new RoutingSettings(StrategyType.HEALTH_BASED, true,
                                   RoundRobinStrategy.DEFAULT_HEALTH_FLOOR,
                                   CircuitBreakerAwareStrategy.DEFAULT_ERROR_RATE_THRESHOLD,
                                   CircuitBreakerAwareStrategy.DEFAULT_MIN_REQUESTS);
    }
}
