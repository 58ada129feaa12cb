package com.marketrouter.routing.strategy;

import com.marketrouter.common.model.RoutingRequest;
import com.marketrouter.routing.registry.ProviderSnapshot;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Declared priority ascending (lower first), ties by health score descending.
 * The sort is stable, so remaining ties keep candidate order.
 */
public class PriorityStrategy implements RoutingStrategy {

    @Override
    public StrategyType type() {
        return StrategyType.PRIORITY;
    }

    @Override
    public Optional<String> select(List<String> candidates, RoutingRequest request, Map<String, ProviderSnapshot> snapshots) {
        return rank(candidates, request, snapshots).stream().findFirst();
    }

    @Override
    public List<String> rank(List<String> candidates, RoutingRequest request, Map<String, ProviderSnapshot> snapshots) {
        List<String> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator
            .comparingInt((String id) -> Snapshots.priority(snapshots, id))
            .thenComparing(Comparator.comparingDouble((String id) -> Snapshots.health(snapshots, id)).reversed()));
        return sorted;
    }
}
