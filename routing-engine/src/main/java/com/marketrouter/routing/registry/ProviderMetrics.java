package com.marketrouter.routing.registry;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mutable health and metrics record for one provider. Guarded by the registry's lock,
 * except {@link #load} which is updated on the hot path without it.
 */
final class ProviderMetrics {

    static final int RECENT_WINDOW = 50;

    long totalRequests;
    long successRequests;
    long failedRequests;
    double avgResponseTimeMs;
    double qualityScore;
    double availabilityScore = 1.0;
    double healthScore = 1.0;
    ProviderStatus status = ProviderStatus.UNKNOWN;
    Instant lastSuccess;
    Instant lastFailure;
    Instant lastHealthCheck;
    String lastHealthMessage;

    final AtomicInteger load = new AtomicInteger();
    private final Deque<Boolean> recent = new ArrayDeque<>(RECENT_WINDOW);

    ProviderMetrics(double initialQuality) {
        this.qualityScore = initialQuality;
    }

    void record(boolean success, double latencyMs, double quality, double alpha, Instant now) {
        totalRequests++;
        if (success) {
            successRequests++;
            lastSuccess = now;
        } else {
            failedRequests++;
            lastFailure = now;
        }

        if (latencyMs >= 0) {
            avgResponseTimeMs = totalRequests == 1 ? latencyMs : ewma(avgResponseTimeMs, latencyMs, alpha);
        }
        if (success && quality >= 0 && quality <= 1) {
            qualityScore = ewma(qualityScore, quality, alpha);
        }
        availabilityScore = ewma(availabilityScore, success ? 1.0 : 0.0, alpha);

        if (recent.size() == RECENT_WINDOW) {
            recent.removeFirst();
        }
        recent.addLast(success);
    }

    double successRate() {
        return totalRequests == 0 ? 1.0 : (double) successRequests / totalRequests;
    }

    double recentErrorRate() {
        if (recent.isEmpty()) {
            return 0.0;
        }
        long failures = recent.stream().filter(ok -> !ok).count();
        return (double) failures / recent.size();
    }

    int recentCalls() {
        return recent.size();
    }

    private static double ewma(double current, double sample, double alpha) {
        return alpha * sample + (1 - alpha) * current;
    }
}
