package com.marketrouter.routing.strategy;

import com.marketrouter.common.model.RoutingRequest;
import com.marketrouter.routing.registry.ProviderSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Holds one instance of every {@link RoutingStrategy} and ranks candidates with the
 * strategy that is fixed by configuration or chosen per request.
 */
public class ProviderRouter {

    private static final Logger log = LoggerFactory.getLogger(ProviderRouter.class);

    private final RoutingSettings settings;
    private final Map<StrategyType, RoutingStrategy> strategies = new EnumMap<>(StrategyType.class);

    public ProviderRouter(RoutingSettings settings) {
        this(settings, new Random());
    }

    public ProviderRouter(RoutingSettings settings, Random random) {
        this.settings = settings;
        HealthBasedStrategy healthBased = new HealthBasedStrategy();
        register(new PriorityStrategy());
        register(new RoundRobinStrategy(settings.roundRobinHealthFloor()));
        register(new WeightedRoundRobinStrategy());
        register(healthBased);
        register(new CircuitBreakerAwareStrategy(settings.breakerErrorThreshold(), settings.breakerMinRequests(), healthBased));
        register(new LeastLoadStrategy());
        register(new QualityWeightedStrategy(random));
    }

    private void register(RoutingStrategy strategy) {
        strategies.put(strategy.type(), strategy);
    }

    /** Strategy for this request: dynamic rules first when enabled, else {@code fallback}. */
    public StrategyType chooseStrategy(RoutingRequest request, int candidateCount, StrategyType fallback) {
        StrategyType base = fallback == null || !strategies.containsKey(fallback) ? settings.defaultStrategy() : fallback;
        return settings.dynamicSelection() ? StrategySelector.resolve(request, candidateCount, base) : base;
    }

    public List<String> rank(StrategyType type, List<String> candidates, RoutingRequest request,
                             Map<String, ProviderSnapshot> snapshots) {
        RoutingStrategy strategy = strategy(type);
        List<String> ranking = strategy.rank(candidates, request, snapshots);
        log.debug("ROUTING_RANKED strategy={} symbol={} ranking={}", strategy.type(), request.symbol(), ranking);
        return ranking;
    }

    public RoutingStrategy strategy(StrategyType type) {
        RoutingStrategy s = strategies.get(type);
        return s != null ? s : strategies.get(settings.defaultStrategy());
    }

    public RoutingSettings getSettings() {
        return settings;
    }
}
