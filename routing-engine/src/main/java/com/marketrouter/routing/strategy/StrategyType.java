package com.marketrouter.routing.strategy;

/**
 * Selection algorithms known to the router. {@link #INTELLIGENT} names the composite
 * scoring path of {@link com.marketrouter.routing.intelligent.IntelligentRoutingEngine};
 * it has no {@link RoutingStrategy} implementation of its own.
 */
public enum StrategyType {
    PRIORITY,
    ROUND_ROBIN,
    WEIGHTED_ROUND_ROBIN,
    HEALTH_BASED,
    CIRCUIT_BREAKER_AWARE,
    LEAST_LOAD,
    QUALITY_WEIGHTED,
    INTELLIGENT
}
