package com.marketrouter.routing.strategy;

import com.marketrouter.common.model.RoutingRequest;
import com.marketrouter.routing.registry.ProviderSnapshot;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Picks one provider out of a candidate list.
 *
 * <p>Implementations read provider state only through the snapshot map, which the caller
 * takes from the registry immediately before the call. Candidates missing from the map
 * are treated as having no health. Apart from the explicitly stateful rotations
 * ({@link RoundRobinStrategy}, {@link WeightedRoundRobinStrategy}) and the probabilistic
 * {@link QualityWeightedStrategy}, identical inputs always give the same answer.
 */
public interface RoutingStrategy {

    StrategyType type();

    /**
     * @return the chosen provider id, or empty when {@code candidates} is empty
     */
    Optional<String> select(List<String> candidates, RoutingRequest request, Map<String, ProviderSnapshot> snapshots);

    /**
     * Full failover order: the selected provider first, then the rest by health score
     * descending, ties in candidate order.
     */
    default List<String> rank(List<String> candidates, RoutingRequest request, Map<String, ProviderSnapshot> snapshots) {
        Optional<String> first = select(candidates, request, snapshots);
        List<String> rest = new ArrayList<>(candidates);
        first.ifPresent(rest::remove);
        rest.sort(Comparator.comparingDouble((String id) -> Snapshots.health(snapshots, id)).reversed());
        List<String> out = new ArrayList<>(candidates.size());
        first.ifPresent(out::add);
        out.addAll(rest);
        return out;
    }
}
