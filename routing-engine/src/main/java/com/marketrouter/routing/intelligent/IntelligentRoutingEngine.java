package com.marketrouter.routing.intelligent;

import com.marketrouter.common.model.ProviderCapability;
import com.marketrouter.common.model.RoutingRequest;
import com.marketrouter.routing.registry.ProviderSnapshot;
import com.marketrouter.routing.strategy.ProviderRouter;
import com.marketrouter.routing.strategy.StrategyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Adaptive provider ranking on top of the plain strategies.
 *
 * <h3>Composite score (intelligent mode)</h3>
 * <pre>
 *   health       snapshot health score
 *   performance  last N outcomes, recency weighted:  0.7 × successRate + 0.3 × max(0, 1 − avgMs / 10000)
 *                0.8 when there is no history
 *   load         1.0 when the peer average load is 0, else max(0, 1 − load / avgLoad × 0.5)
 *   context      0.5 base, asset type +0.2 / −0.3, data type +0.2 / −0.3,
 *                priority &gt; 80 and successRate &gt; 0.95 +0.1, priority &lt; 30 +0.05, clamped to [0, 1]
 *   learning     (successRate of last 10 − successRate of the 10 before) × learningRate, clamped ±learningBound
 * </pre>
 * Highest composite first; ties by provider id ascending.
 *
 * <h3>Strategy mode</h3>
 * With intelligent routing off, candidates are ranked by a {@link ProviderRouter} strategy.
 * Request rules pick the strategy first; otherwise the strategy with the highest adaptive
 * weight is used. {@link #optimizeRoutingParameters()} moves those weights with each
 * strategy's observed first-pick success rate.
 *
 * <h3>Decision cache</h3>
 * Keyed by sorted candidate ids plus asset type, data type, market and priority. Entries
 * live for {@code decisionCacheTtl}; past {@code decisionCacheMaxSize} the oldest entry is
 * evicted on insert. A provider failure evicts every entry that points at the provider.
 * Rotating and probabilistic strategies are never cached.
 *
 * <p>This engine holds no reference to the registry or the pipeline. Callers hand it
 * snapshots and report outcomes back.
 */
public class IntelligentRoutingEngine {

    private static final Logger log = LoggerFactory.getLogger(IntelligentRoutingEngine.class);

    static final double NO_HISTORY_PERFORMANCE = 0.8;
    static final double LATENCY_BASELINE_MS    = 10_000.0;
    static final int TREND_WINDOW              = 10;

    private static final Set<StrategyType> UNCACHEABLE = EnumSet.of(
        StrategyType.ROUND_ROBIN, StrategyType.WEIGHTED_ROUND_ROBIN, StrategyType.QUALITY_WEIGHTED);

    private record CachedDecision(String providerId, StrategyType strategy, Instant createdAt) {}

    private record Outcome(boolean success, long latencyMs) {}

    private final ProviderRouter router;
    private final IntelligentRoutingConfig config;
    private final Clock clock;

    private volatile boolean intelligentEnabled = true;
    private volatile boolean adaptiveWeightsEnabled = true;

    private final ConcurrentHashMap<String, CachedDecision> decisionCache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Deque<Outcome>> history = new ConcurrentHashMap<>();

    private final Object strategyLock = new Object();
    private final Map<StrategyType, StrategyPerformance> strategyPerformance = new EnumMap<>(StrategyType.class);
    private final Map<StrategyType, Double> strategyWeights = new EnumMap<>(StrategyType.class);

    private final AtomicLong totalDecisions = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();

    public IntelligentRoutingEngine(ProviderRouter router, IntelligentRoutingConfig config) {
        this(router, config, Clock.systemUTC());
    }

    public IntelligentRoutingEngine(ProviderRouter router, IntelligentRoutingConfig config, Clock clock) {
        this.router = router;
        this.config = config;
        this.clock  = clock;
        for (StrategyType type : StrategyType.values()) {
            strategyPerformance.put(type, StrategyPerformance.initial());
        }
        strategyWeights.put(StrategyType.HEALTH_BASED, 0.4);
        strategyWeights.put(StrategyType.QUALITY_WEIGHTED, 0.3);
        strategyWeights.put(StrategyType.ROUND_ROBIN, 0.2);
        strategyWeights.put(StrategyType.CIRCUIT_BREAKER_AWARE, 0.1);
    }

    // ── routing ───────────────────────────────────────────────────────────────

    public RoutingDecision route(List<String> candidates, RoutingRequest request, Map<String, ProviderSnapshot> snapshots) {
        totalDecisions.incrementAndGet();
        if (candidates.size() <= 1) {
            StrategyType trivial = intelligentEnabled ? StrategyType.INTELLIGENT : router.getSettings().defaultStrategy();
            return new RoutingDecision(candidates, trivial, null, false);
        }

        boolean intelligent = intelligentEnabled;
        String key = cacheKey(candidates, request, intelligent);
        CachedDecision cached = cachedDecision(key);
        if (cached != null && candidates.contains(cached.providerId())) {
            cacheHits.incrementAndGet();
            RoutingDecision fresh = rank(cached.strategy(), candidates, request, snapshots);
            List<String> ranking = new ArrayList<>(fresh.ranking());
            ranking.remove(cached.providerId());
            ranking.add(0, cached.providerId());
            log.debug("ROUTING_CACHE_HIT symbol={} providerId={}", request.symbol(), cached.providerId());
            return new RoutingDecision(ranking, cached.strategy(), fresh.scores(), true);
        }

        StrategyType type = intelligent
            ? StrategyType.INTELLIGENT
            : router.chooseStrategy(request, candidates.size(), favouredStrategy());
        RoutingDecision decision = rank(type, candidates, request, snapshots);

        if (!UNCACHEABLE.contains(decision.strategy())) {
            decision.selected().ifPresent(id -> cacheDecision(key, id, decision.strategy()));
        }
        log.debug("ROUTING_DECISION symbol={} strategy={} selected={}",
                  request.symbol(), decision.strategy(), decision.selected().orElse(null));
        return decision;
    }

    private RoutingDecision rank(StrategyType type, List<String> candidates, RoutingRequest request,
                                 Map<String, ProviderSnapshot> snapshots) {
        if (type == StrategyType.INTELLIGENT) {
            Map<String, Double> scores = compositeScores(candidates, request, snapshots);
            List<String> ranking = new ArrayList<>(candidates);
            ranking.sort(Comparator.comparing((String id) -> scores.get(id)).reversed()
                                   .thenComparing(Comparator.naturalOrder()));
            return new RoutingDecision(ranking, StrategyType.INTELLIGENT, scores, false);
        }
        return new RoutingDecision(router.rank(type, candidates, request, snapshots), type, null, false);
    }

    /** Composite score per candidate, in candidate order. */
    public Map<String, Double> compositeScores(List<String> candidates, RoutingRequest request,
                                               Map<String, ProviderSnapshot> snapshots) {
        double avgLoad = candidates.stream()
            .mapToInt(id -> snapshots.containsKey(id) ? snapshots.get(id).currentLoad() : 0)
            .average().orElse(0.0);

        Map<String, Double> scores = new LinkedHashMap<>();
        for (String id : candidates) {
            ProviderSnapshot s = snapshots.get(id);
            double score = config.healthWeight() * (s == null ? 0.0 : s.healthScore())
                         + config.performanceWeight() * performanceScore(id)
                         + config.loadWeight() * loadScore(s, avgLoad)
                         + config.contextWeight() * contextScore(s, request)
                         + config.learningWeight() * learningAdjustment(id);
            scores.put(id, Math.max(0.0, Math.min(1.0, score)));
        }
        return scores;
    }

    double performanceScore(String providerId) {
        List<Outcome> recent = recentOutcomes(providerId, config.performanceWindow());
        if (recent.isEmpty()) {
            return NO_HISTORY_PERFORMANCE;
        }
        double weightSum = 0.0;
        double successSum = 0.0;
        double latencySum = 0.0;
        for (int i = 0; i < recent.size(); i++) {
            double w = i + 1;
            Outcome o = recent.get(i);
            weightSum  += w;
            successSum += w * (o.success() ? 1.0 : 0.0);
            latencySum += w * o.latencyMs();
        }
        double successRate = successSum / weightSum;
        double timeScore   = Math.max(0.0, 1.0 - (latencySum / weightSum) / LATENCY_BASELINE_MS);
        return 0.7 * successRate + 0.3 * timeScore;
    }

    static double loadScore(ProviderSnapshot s, double avgLoad) {
        if (avgLoad <= 0.0) {
            return 1.0;
        }
        int load = s == null ? 0 : s.currentLoad();
        return Math.max(0.0, 1.0 - load / avgLoad * 0.5);
    }

    static double contextScore(ProviderSnapshot s, RoutingRequest request) {
        double score = 0.5;
        if (s != null) {
            ProviderCapability cap = s.capability();
            score += cap.assetTypes().contains(request.assetType()) ? 0.2 : -0.3;
            score += cap.dataTypes().contains(request.dataType()) ? 0.2 : -0.3;
            if (request.priority() > 80 && s.successRate() > 0.95) {
                score += 0.1;
            } else if (request.priority() < 30) {
                score += 0.05;
            }
        } else {
            score -= 0.6;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    double learningAdjustment(String providerId) {
        List<Outcome> recent = recentOutcomes(providerId, 2 * TREND_WINDOW);
        if (recent.size() < 2 * TREND_WINDOW) {
            return 0.0;
        }
        double older  = successRate(recent.subList(0, TREND_WINDOW));
        double latest = successRate(recent.subList(TREND_WINDOW, 2 * TREND_WINDOW));
        double adjustment = (latest - older) * config.learningRate();
        return Math.max(-config.learningBound(), Math.min(config.learningBound(), adjustment));
    }

    private static double successRate(List<Outcome> outcomes) {
        return outcomes.stream().filter(Outcome::success).count() / (double) outcomes.size();
    }

    private List<Outcome> recentOutcomes(String providerId, int n) {
        Deque<Outcome> deque = history.get(providerId);
        if (deque == null) {
            return List.of();
        }
        synchronized (deque) {
            List<Outcome> all = new ArrayList<>(deque);
            return all.subList(Math.max(0, all.size() - n), all.size());
        }
    }

    // ── feedback ──────────────────────────────────────────────────────────────

    /** One extraction attempt's outcome. A failure evicts cached decisions naming the provider. */
    public void recordOutcome(String providerId, boolean success, long latencyMs) {
        Deque<Outcome> deque = history.computeIfAbsent(providerId, k -> new ArrayDeque<>());
        synchronized (deque) {
            deque.addLast(new Outcome(success, Math.max(0, latencyMs)));
            while (deque.size() > config.historyWindow()) {
                deque.removeFirst();
            }
        }
        if (!success) {
            evictDecisionsFor(providerId);
        }
    }

    /** Whether the first provider a strategy picked for a request succeeded. */
    public void recordStrategyOutcome(StrategyType strategy, boolean firstPickSucceeded) {
        synchronized (strategyLock) {
            strategyPerformance.compute(strategy, (type, current) ->
                (current == null ? StrategyPerformance.initial() : current)
                    .record(firstPickSucceeded, config.strategyEwmaAlpha()));
        }
    }

    /**
     * Moves strategy weights toward strategies whose first picks succeed.
     *
     * <pre>
     *   only when Σ usage &gt; minTotalSamples; per strategy only when usage &gt; minStrategySamples
     *   successRate &gt; 0.9 → weight × 1.1        successRate &lt; 0.7 → weight × 0.9
     *   clamp to [floor, ceiling], renormalise to sum 1, clamp again
     * </pre>
     *
     * @return true when at least one weight actually moved
     */
    public boolean optimizeRoutingParameters() {
        if (!adaptiveWeightsEnabled) {
            return false;
        }
        Map<StrategyType, Double> snapshot;
        synchronized (strategyLock) {
            long totalUsage = strategyPerformance.values().stream().mapToLong(StrategyPerformance::usageCount).sum();
            if (totalUsage <= config.minTotalSamples()) {
                return false;
            }
            Map<StrategyType, Double> before = new EnumMap<>(strategyWeights);
            boolean adjusted = false;
            for (Map.Entry<StrategyType, Double> e : strategyWeights.entrySet()) {
                StrategyPerformance perf = strategyPerformance.get(e.getKey());
                if (perf.usageCount() <= config.minStrategySamples()) {
                    continue;
                }
                double w = e.getValue();
                if (perf.successRate() > 0.9) {
                    w = w * 1.1;
                } else if (perf.successRate() < 0.7) {
                    w = w * 0.9;
                }
                double clamped = clampWeight(w);
                if (clamped != e.getValue()) {
                    e.setValue(clamped);
                    adjusted = true;
                }
            }
            if (!adjusted) {
                log.debug("ROUTING_WEIGHTS_UNCHANGED totalUsage={}", totalUsage);
                return false;
            }
            double total = strategyWeights.values().stream().mapToDouble(Double::doubleValue).sum();
            if (total > 0.0) {
                strategyWeights.replaceAll((k, v) -> clampWeight(v / total));
            }
            if (strategyWeights.equals(before)) {
                return false;
            }
            snapshot = new EnumMap<>(strategyWeights);
        }
        log.info("ROUTING_WEIGHTS_OPTIMIZED weights={}", snapshot);
        return true;
    }

    private double clampWeight(double w) {
        return Math.max(config.strategyWeightFloor(), Math.min(config.strategyWeightCeiling(), w));
    }

    /** Highest-weighted strategy; ties go to the earlier enum constant. */
    StrategyType favouredStrategy() {
        synchronized (strategyLock) {
            StrategyType best = null;
            double bestWeight = Double.NEGATIVE_INFINITY;
            for (Map.Entry<StrategyType, Double> e : strategyWeights.entrySet()) {
                if (e.getValue() > bestWeight) {
                    bestWeight = e.getValue();
                    best = e.getKey();
                }
            }
            return best;
        }
    }

    // ── decision cache ────────────────────────────────────────────────────────

    /** Keyed on the routing mode too, so toggling intelligent routing never reuses the other mode's picks. */
    static String cacheKey(List<String> candidates, RoutingRequest request, boolean intelligent) {
        List<String> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.naturalOrder());
        return (intelligent ? "intelligent|" : "strategy|")
            + String.join(",", sorted)
            + "|" + request.assetType()
            + "|" + request.dataType()
            + "|" + request.market()
            + "|" + request.priority();
    }

    private CachedDecision cachedDecision(String key) {
        CachedDecision entry = decisionCache.get(key);
        if (entry == null) {
            return null;
        }
        if (isExpired(entry, clock.instant())) {
            decisionCache.remove(key, entry);
            return null;
        }
        return entry;
    }

    private boolean isExpired(CachedDecision entry, Instant now) {
        return Duration.between(entry.createdAt(), now).compareTo(config.decisionCacheTtl()) >= 0;
    }

    private void cacheDecision(String key, String providerId, StrategyType strategy) {
        decisionCache.put(key, new CachedDecision(providerId, strategy, clock.instant()));
        while (decisionCache.size() > config.decisionCacheMaxSize()) {
            decisionCache.entrySet().stream()
                .min(Comparator.comparing((Map.Entry<String, CachedDecision> e) -> e.getValue().createdAt()))
                .ifPresent(oldest -> decisionCache.remove(oldest.getKey(), oldest.getValue()));
        }
    }

    private void evictDecisionsFor(String providerId) {
        int before = decisionCache.size();
        decisionCache.values().removeIf(d -> d.providerId().equals(providerId));
        int evicted = before - decisionCache.size();
        if (evicted > 0) {
            log.debug("ROUTING_CACHE_EVICTED providerId={} entries={}", providerId, evicted);
        }
    }

    /** Drops expired decisions. Returns how many were removed. */
    public int purgeExpiredDecisions() {
        Instant now = clock.instant();
        int before = decisionCache.size();
        decisionCache.values().removeIf(d -> isExpired(d, now));
        return before - decisionCache.size();
    }

    public void resetDecisionCache() {
        decisionCache.clear();
        log.info("ROUTING_CACHE_RESET");
    }

    public int decisionCacheSize() {
        return decisionCache.size();
    }

    // ── control & statistics ──────────────────────────────────────────────────

    public void enableIntelligentRouting(boolean enabled) {
        this.intelligentEnabled = enabled;
        log.info("INTELLIGENT_ROUTING_TOGGLED enabled={}", enabled);
    }

    public void enableAdaptiveWeights(boolean enabled) {
        this.adaptiveWeightsEnabled = enabled;
        log.info("ADAPTIVE_WEIGHTS_TOGGLED enabled={}", enabled);
    }

    public boolean isIntelligentRoutingEnabled() {
        return intelligentEnabled;
    }

    /** Clears one provider's history, or all history when {@code providerId} is null. */
    public void clearHistory(String providerId) {
        if (providerId == null) {
            history.clear();
        } else {
            history.remove(providerId);
        }
    }

    public Map<StrategyType, Double> strategyWeights() {
        synchronized (strategyLock) {
            return new EnumMap<>(strategyWeights);
        }
    }

    public RoutingStatistics statistics() {
        Map<StrategyType, StrategyPerformance> perf;
        Map<StrategyType, Double> weights;
        synchronized (strategyLock) {
            perf    = new EnumMap<>(strategyPerformance);
            weights = new EnumMap<>(strategyWeights);
        }
        Map<String, Integer> sizes = new TreeMap<>();
        history.forEach((id, deque) -> {
            synchronized (deque) {
                sizes.put(id, deque.size());
            }
        });
        return new RoutingStatistics(intelligentEnabled, adaptiveWeightsEnabled,
            totalDecisions.get(), cacheHits.get(), decisionCache.size(), perf, weights, sizes);
    }

    public IntelligentRoutingConfig getConfig() {
        return config;
    }
}
