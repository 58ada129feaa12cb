package com.marketrouter.routing.strategy;

import com.marketrouter.common.model.RoutingRequest;
import com.marketrouter.routing.registry.ProviderSnapshot;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Rotates through the candidates whose health score is above {@code healthFloor}. When
 * none are, rotates through all of them.
 */
public class RoundRobinStrategy implements RoutingStrategy {

    public static final double DEFAULT_HEALTH_FLOOR = 0.5;

    private final double healthFloor;
    private final AtomicLong counter = new AtomicLong();

    public RoundRobinStrategy() {
        this(DEFAULT_HEALTH_FLOOR);
    }

    public RoundRobinStrategy(double healthFloor) {
        this.healthFloor = healthFloor;
    }

    @Override
    public StrategyType type() {
        return StrategyType.ROUND_ROBIN;
    }

    @Override
    public Optional<String> select(List<String> candidates, RoutingRequest request, Map<String, ProviderSnapshot> snapshots) {
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        List<String> healthy = candidates.stream()
            .filter(id -> Snapshots.health(snapshots, id) > healthFloor)
            .toList();
        List<String> pool = healthy.isEmpty() ? candidates : healthy;
        int index = (int) Math.floorMod(counter.getAndIncrement(), (long) pool.size());
        return Optional.of(pool.get(index));
    }
}
