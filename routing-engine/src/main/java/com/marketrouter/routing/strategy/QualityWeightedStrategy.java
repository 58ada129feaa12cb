package com.marketrouter.routing.strategy;

import com.marketrouter.common.model.RoutingRequest;
import com.marketrouter.routing.registry.ProviderSnapshot;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Random pick with probability proportional to
 * <pre>
 *   weight = quality × availability × 1 / (1 + avgResponseTimeSeconds)
 * </pre>
 * The only deliberately non-deterministic strategy; inject a seeded {@link Random} to
 * make it reproducible. Falls back to the first candidate when every weight is zero.
 */
public class QualityWeightedStrategy implements RoutingStrategy {

    private final Random random;

    public QualityWeightedStrategy() {
        this(new Random());
    }

    public QualityWeightedStrategy(Random random) {
        this.random = random;
    }

    @Override
    public StrategyType type() {
        return StrategyType.QUALITY_WEIGHTED;
    }

    @Override
    public Optional<String> select(List<String> candidates, RoutingRequest request, Map<String, ProviderSnapshot> snapshots) {
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        double[] weights = new double[candidates.size()];
        double total = 0.0;
        for (int i = 0; i < candidates.size(); i++) {
            weights[i] = weight(snapshots.get(candidates.get(i)));
            total += weights[i];
        }
        if (total <= 0.0) {
            return Optional.of(candidates.get(0));
        }
        double draw;
        synchronized (random) {
            draw = random.nextDouble() * total;
        }
        double cumulative = 0.0;
        for (int i = 0; i < candidates.size(); i++) {
            cumulative += weights[i];
            if (draw < cumulative) {
                return Optional.of(candidates.get(i));
            }
        }
        return Optional.of(candidates.get(candidates.size() - 1));
    }

    static double weight(ProviderSnapshot s) {
        if (s == null) {
            return 0.0;
        }
        double latencySeconds = s.avgResponseTimeMs() / 1000.0;
        return s.qualityScore() * s.availabilityScore() / (1.0 + latencySeconds);
    }
}
