package com.marketrouter.routing.strategy;

import com.marketrouter.common.model.RoutingRequest;
import com.marketrouter.routing.registry.ProviderSnapshot;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Smooth weighted round-robin.
 *
 * <pre>
 *   effective(p) = weight(p) × health(p)
 *   every call:  credit(p) += effective(p) for every candidate p
 *                pick the max-credit candidate (first in candidate order on ties)
 *                credit(pick) −= Σ effective
 * </pre>
 * Over any run of calls each provider is picked in proportion to its effective weight.
 * Credits are kept per provider across calls, so this strategy is stateful. A provider
 * that drops out of the candidate list loses its credit and restarts from zero.
 */
public class WeightedRoundRobinStrategy implements RoutingStrategy {

    private final Map<String, Double> credits = new HashMap<>();

    @Override
    public StrategyType type() {
        return StrategyType.WEIGHTED_ROUND_ROBIN;
    }

    @Override
    public synchronized Optional<String> select(List<String> candidates, RoutingRequest request,
                                                Map<String, ProviderSnapshot> snapshots) {
        credits.keySet().retainAll(candidates);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        double total = 0.0;
        String best = null;
        double bestCredit = Double.NEGATIVE_INFINITY;
        for (String id : candidates) {
            ProviderSnapshot s = snapshots.get(id);
            double effective = s == null ? 0.0 : s.weight() * s.healthScore();
            total += effective;
            double credit = credits.merge(id, effective, Double::sum);
            if (credit > bestCredit) {
                bestCredit = credit;
                best = id;
            }
        }
        if (total <= 0.0) {
            return Optional.of(candidates.get(0));
        }
        credits.merge(best, -total, Double::sum);
        return Optional.of(best);
    }

    synchronized int trackedProviders() {
        return credits.size();
    }

    /** Forgets all accumulated credit. */
    public synchronized void reset() {
        credits.clear();
    }
}
