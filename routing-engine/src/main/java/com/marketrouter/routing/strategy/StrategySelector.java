package com.marketrouter.routing.strategy;

import com.marketrouter.common.model.RoutingRequest;

/**
 * Per-request strategy choice from request attributes.
 *
 * <pre>
 *   priority            &gt; 80   → HEALTH_BASED
 *   qualityRequirement  &gt; 0.9  → QUALITY_WEIGHTED
 *   candidates          &gt; 3    → ROUND_ROBIN      spread load across many providers
 *   otherwise                  → the supplied default
 * </pre>
 */
public final class StrategySelector {

    static final int HIGH_PRIORITY = 80;
    static final double HIGH_QUALITY = 0.9;
    static final int MANY_CANDIDATES = 3;

    private StrategySelector() {}

    public static StrategyType resolve(RoutingRequest request, int candidateCount, StrategyType defaultType) {
        if (request.priority() > HIGH_PRIORITY) {
            return StrategyType.HEALTH_BASED;
        }
        if (request.qualityRequirement() > HIGH_QUALITY) {
            return StrategyType.QUALITY_WEIGHTED;
        }
        if (candidateCount > MANY_CANDIDATES) {
            return StrategyType.ROUND_ROBIN;
        }
        return defaultType;
    }
}
