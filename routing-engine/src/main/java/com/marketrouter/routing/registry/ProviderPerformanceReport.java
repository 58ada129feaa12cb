package com.marketrouter.routing.registry;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketrouter.common.breaker.CircuitState;

import java.util.List;

/**
 * Graded view of one provider's performance against its data-type latency baseline.
 *
 * <pre>
 *   score = 0.4 × successRate + 0.3 × latencyScore + 0.3 × qualityScore
 *   latencyScore = min(1, baselineMs / avgResponseTimeMs)
 *   grade: ≥0.95 A+, ≥0.90 A, ≥0.80 B, ≥0.70 C, else D
 * </pre>
 */
public record ProviderPerformanceReport(
    @JsonProperty("providerId")        String providerId,
    @JsonProperty("grade")             String grade,
    @JsonProperty("score")             double score,
    @JsonProperty("successRate")       double successRate,
    @JsonProperty("avgResponseTimeMs") double avgResponseTimeMs,
    @JsonProperty("baselineMs")        double baselineMs,
    @JsonProperty("qualityScore")      double qualityScore,
    @JsonProperty("availabilityScore") double availabilityScore,
    @JsonProperty("healthScore")       double healthScore,
    @JsonProperty("totalRequests")     long totalRequests,
    @JsonProperty("circuitState")      CircuitState circuitState,
    @JsonProperty("recommendations")   List<String> recommendations
) {
    public static String grade(double score) {
        if (score >= 0.95) return "A+";
        if (score >= 0.90) return "A";
        if (score >= 0.80) return "B";
        if (score >= 0.70) return "C";
        return "D";
    }
}
