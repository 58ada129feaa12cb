package com.marketrouter.routing.intelligent;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketrouter.routing.strategy.StrategyType;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of one routing call: the failover order and how it was produced.
 *
 * @param ranking  every candidate exactly once, best first
 * @param scores   composite scores when {@link StrategyType#INTELLIGENT} produced the ranking, else empty
 * @param cached   the first pick came from the decision cache
 */
public record RoutingDecision(
    @JsonProperty("ranking")  List<String> ranking,
    @JsonProperty("strategy") StrategyType strategy,
    @JsonProperty("scores")   Map<String, Double> scores,
    @JsonProperty("cached")   boolean cached
) {
    public RoutingDecision {
        ranking = List.copyOf(ranking);
        scores  = scores == null ? Map.of() : Map.copyOf(scores);
    }

    public Optional<String> selected() {
        return ranking.isEmpty() ? Optional.empty() : Optional.of(ranking.get(0));
    }
}
