package com.marketrouter.routing.strategy;

import com.marketrouter.common.breaker.CircuitState;
import com.marketrouter.common.model.RoutingRequest;
import com.marketrouter.routing.registry.ProviderSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drops providers that look about to trip, then ranks the rest with
 * {@link HealthBasedStrategy}.
 *
 * <p>A provider is dropped when its breaker is OPEN, or when it has at least
 * {@code minRequests} recent calls and its recent error rate exceeds
 * {@code errorRateThreshold}, even while its breaker is still CLOSED. Dropped providers
 * go to the end of the failover order rather than disappearing. When every candidate is
 * dropped the full list is ranked instead.
 */
public class CircuitBreakerAwareStrategy implements RoutingStrategy {

    public static final double DEFAULT_ERROR_RATE_THRESHOLD = 0.5;
    public static final int DEFAULT_MIN_REQUESTS = 10;

    private final double errorRateThreshold;
    private final int minRequests;
    private final HealthBasedStrategy delegate;

    public CircuitBreakerAwareStrategy() {
        this(DEFAULT_ERROR_RATE_THRESHOLD, DEFAULT_MIN_REQUESTS, new HealthBasedStrategy());
    }

    public CircuitBreakerAwareStrategy(double errorRateThreshold, int minRequests, HealthBasedStrategy delegate) {
        this.errorRateThreshold = errorRateThreshold;
        this.minRequests        = minRequests;
        this.delegate           = delegate;
    }

    @Override
    public StrategyType type() {
        return StrategyType.CIRCUIT_BREAKER_AWARE;
    }

    @Override
    public Optional<String> select(List<String> candidates, RoutingRequest request, Map<String, ProviderSnapshot> snapshots) {
        return rank(candidates, request, snapshots).stream().findFirst();
    }

    @Override
    public List<String> rank(List<String> candidates, RoutingRequest request, Map<String, ProviderSnapshot> snapshots) {
        List<String> passing = new ArrayList<>();
        List<String> dropped = new ArrayList<>();
        for (String id : candidates) {
            (isSuspect(snapshots.get(id)) ? dropped : passing).add(id);
        }
        if (passing.isEmpty()) {
            return delegate.rank(candidates, request, snapshots);
        }
        List<String> out = new ArrayList<>(delegate.rank(passing, request, snapshots));
        out.addAll(delegate.rank(dropped, request, snapshots));
        return out;
    }

    boolean isSuspect(ProviderSnapshot s) {
        if (s == null) {
            return false;
        }
        if (s.circuitState() == CircuitState.OPEN) {
            return true;
        }
        return s.recentCalls() >= minRequests && s.recentErrorRate() > errorRateThreshold;
    }
}
