package com.marketrouter.routing.strategy;

import com.marketrouter.common.model.RoutingRequest;
import com.marketrouter.routing.registry.ProviderSnapshot;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Highest composite health wins.
 *
 * <pre>
 *   score = 0.4 × health + 0.4 × successRate + 0.2 × inverseLatency
 *   inverseLatency = (1 / (1 + avgMs)) / max over candidates of (1 / (1 + avgMs))
 * </pre>
 * Ties keep candidate order.
 */
public class HealthBasedStrategy implements RoutingStrategy {

    static final double HEALTH_WEIGHT  = 0.4;
    static final double SUCCESS_WEIGHT = 0.4;
    static final double LATENCY_WEIGHT = 0.2;

    @Override
    public StrategyType type() {
        return StrategyType.HEALTH_BASED;
    }

    @Override
    public Optional<String> select(List<String> candidates, RoutingRequest request, Map<String, ProviderSnapshot> snapshots) {
        return rank(candidates, request, snapshots).stream().findFirst();
    }

    @Override
    public List<String> rank(List<String> candidates, RoutingRequest request, Map<String, ProviderSnapshot> snapshots) {
        Map<String, Double> scores = scores(candidates, snapshots);
        List<String> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparingDouble((String id) -> scores.get(id)).reversed());
        return sorted;
    }

    public Map<String, Double> scores(List<String> candidates, Map<String, ProviderSnapshot> snapshots) {
        double maxInverse = 0.0;
        for (String id : candidates) {
            maxInverse = Math.max(maxInverse, inverseLatency(snapshots, id));
        }
        Map<String, Double> scores = new LinkedHashMap<>();
        for (String id : candidates) {
            double latencyTerm = maxInverse > 0.0 ? inverseLatency(snapshots, id) / maxInverse : 0.0;
            scores.put(id, HEALTH_WEIGHT * Snapshots.health(snapshots, id)
                         + SUCCESS_WEIGHT * Snapshots.successRate(snapshots, id)
                         + LATENCY_WEIGHT * latencyTerm);
        }
        return scores;
    }

    private static double inverseLatency(Map<String, ProviderSnapshot> snapshots, String id) {
        return snapshots.containsKey(id) ? 1.0 / (1.0 + Snapshots.latencyMs(snapshots, id)) : 0.0;
    }
}
