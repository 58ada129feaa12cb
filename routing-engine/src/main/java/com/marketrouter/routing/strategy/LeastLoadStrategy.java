package com.marketrouter.routing.strategy;

import com.marketrouter.common.model.RoutingRequest;
import com.marketrouter.routing.registry.ProviderSnapshot;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fewest in-flight calls first, ties by health score descending.
 */
public class LeastLoadStrategy implements RoutingStrategy {

    @Override
    public StrategyType type() {
        return StrategyType.LEAST_LOAD;
    }

    @Override
    public Optional<String> select(List<String> candidates, RoutingRequest request, Map<String, ProviderSnapshot> snapshots) {
        return rank(candidates, request, snapshots).stream().findFirst();
    }

    @Override
    public List<String> rank(List<String> candidates, RoutingRequest request, Map<String, ProviderSnapshot> snapshots) {
        List<String> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator
            .comparingInt((String id) -> Snapshots.load(snapshots, id))
            .thenComparing(Comparator.comparingDouble((String id) -> Snapshots.health(snapshots, id)).reversed()));
        return sorted;
    }
}
