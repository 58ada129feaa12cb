package com.marketrouter.routing.intelligent;

import java.time.Duration;

/**
 * Tunables of {@link IntelligentRoutingEngine}. Every value has a default; none of the
 * defaults is claimed to be optimal.
 *
 * <pre>
 *   composite = healthWeight      × health
 *             + performanceWeight × historicalPerformance
 *             + loadWeight        × loadBalance
 *             + contextWeight     × contextMatch
 *             + learningWeight    × learningAdjustment
 * </pre>
 *
 * Strategy weights produced by {@link IntelligentRoutingEngine#optimizeRoutingParameters()}
 * are clamped to {@code [strategyWeightFloor, strategyWeightCeiling]} before renormalising.
 */
public record IntelligentRoutingConfig(
    double healthWeight,
    double performanceWeight,
    double loadWeight,
    double contextWeight,
    double learningWeight,
    Duration decisionCacheTtl,
    int decisionCacheMaxSize,
    int historyWindow,
    int performanceWindow,
    double learningRate,
    double learningBound,
    double strategyEwmaAlpha,
    double strategyWeightFloor,
    double strategyWeightCeiling,
    int minTotalSamples,
    int minStrategySamples
) {
    public IntelligentRoutingConfig {
        decisionCacheTtl      = decisionCacheTtl == null ? Duration.ofMinutes(5) : decisionCacheTtl;
        decisionCacheMaxSize  = Math.max(1, decisionCacheMaxSize);
        historyWindow         = Math.max(20, historyWindow);
        performanceWindow     = Math.max(1, Math.min(performanceWindow, historyWindow));
        learningBound         = Math.abs(learningBound);
        strategyEwmaAlpha     = Math.max(0.01, Math.min(1.0, strategyEwmaAlpha));
        strategyWeightFloor   = Math.max(0.0, strategyWeightFloor);
        strategyWeightCeiling = Math.max(strategyWeightFloor, Math.min(1.0, strategyWeightCeiling));
    }

    public static IntelligentRoutingConfig defaults() {
        return new IntelligentRoutingConfig(
            0.30, 0.25, 0.20, 0.15, 0.10,
            Duration.ofMinutes(5), 1000,
            100, 20,
            0.1, 0.2,
            0.1, 0.05, 0.6,
            100, 10);
    }

    public IntelligentRoutingConfig withScoreWeights(double health, double performance, double load,
                                                     double context, double learning) {
        return new IntelligentRoutingConfig(health, performance, load, context, learning,
            decisionCacheTtl, decisionCacheMaxSize, historyWindow, performanceWindow,
            learningRate, learningBound, strategyEwmaAlpha, strategyWeightFloor, strategyWeightCeiling,
            minTotalSamples, minStrategySamples);
    }
}
