package com.marketrouter.routing.intelligent;

import com.marketrouter.common.model.AssetType;
import com.marketrouter.common.model.DataType;
import com.marketrouter.common.model.RoutingRequest;
import com.marketrouter.routing.MutableClock;
import com.marketrouter.routing.SnapshotBuilder;
import com.marketrouter.routing.registry.ProviderSnapshot;
import com.marketrouter.routing.strategy.ProviderRouter;
import com.marketrouter.routing.strategy.RoutingSettings;
import com.marketrouter.routing.strategy.StrategyType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static com.marketrouter.routing.SnapshotBuilder.provider;
import static org.junit.jupiter.api.Assertions.*;

class IntelligentRoutingEngineTest {

    private static final RoutingRequest REQUEST = RoutingRequest.of("600000", AssetType.STOCK, DataType.HISTORICAL_KLINE);

    private MutableClock clock;
    private IntelligentRoutingEngine engine;

    @BeforeEach
    void setUp() {
        clock  = new MutableClock(Instant.parse("2024-03-01T09:30:00Z"));
        engine = newEngine(IntelligentRoutingConfig.defaults());
    }

    private IntelligentRoutingEngine newEngine(IntelligentRoutingConfig config) {
        return new IntelligentRoutingEngine(new ProviderRouter(RoutingSettings.defaults(), new Random(11)), config, clock);
    }

    private static Map<String, ProviderSnapshot> snapshots(SnapshotBuilder... builders) {
        Map<String, ProviderSnapshot> out = new LinkedHashMap<>();
        for (SnapshotBuilder b : builders) {
            ProviderSnapshot s = b.build();
            out.put(s.providerId(), s);
        }
        return out;
    }

    private static List<String> ids(Map<String, ProviderSnapshot> snapshots) {
        return new ArrayList<>(snapshots.keySet());
    }

    @Nested
    @DisplayName("composite scoring")
    class Scoring {

        @Test
        @DisplayName("healthier provider ranks first with the documented weights")
        void compositeScore() {
            Map<String, ProviderSnapshot> s = snapshots(provider("b").health(0.5), provider("a").health(1.0));

            RoutingDecision decision = engine.route(ids(s), REQUEST, s);

            // context: base 0.5 + asset 0.2 + data type 0.2 + low request priority 0.05
            double context = 0.95;
            assertEquals(0.30 * 1.0 + 0.25 * 0.8 + 0.20 * 1.0 + 0.15 * context, decision.scores().get("a"), 1e-9);
            assertEquals(0.30 * 0.5 + 0.25 * 0.8 + 0.20 * 1.0 + 0.15 * context, decision.scores().get("b"), 1e-9);
            assertEquals(List.of("a", "b"), decision.ranking());
            assertEquals(StrategyType.INTELLIGENT, decision.strategy());
            assertFalse(decision.cached());
        }

        @Test
        @DisplayName("equal scores are broken by provider id")
        void tieById() {
            Map<String, ProviderSnapshot> s = snapshots(provider("zeta"), provider("alpha"));

            assertEquals(List.of("alpha", "zeta"), engine.route(ids(s), REQUEST, s).ranking());
        }

        @Test
        @DisplayName("mismatched capability and missing snapshot lower the context score")
        void contextScore() {
            ProviderSnapshot crypto = provider("c").assetTypes(EnumSet.of(AssetType.CRYPTO)).build();

            assertEquals(0.45, IntelligentRoutingEngine.contextScore(crypto, REQUEST), 1e-9);
            assertEquals(0.0, IntelligentRoutingEngine.contextScore(null, REQUEST), 1e-9);
        }

        @Test
        void loadScore() {
            assertEquals(1.0, IntelligentRoutingEngine.loadScore(provider("a").load(3).build(), 0.0), 1e-9);
            assertEquals(0.0, IntelligentRoutingEngine.loadScore(provider("a").load(4).build(), 2.0), 1e-9);
            assertEquals(0.5, IntelligentRoutingEngine.loadScore(provider("a").load(2).build(), 2.0), 1e-9);
        }

        @Test
        @DisplayName("history feeds performance and an improving trend earns a bounded bonus")
        void historyAndLearning() {
            assertEquals(IntelligentRoutingEngine.NO_HISTORY_PERFORMANCE, engine.performanceScore("a"), 1e-9);
            assertEquals(0.0, engine.learningAdjustment("a"), 1e-9);

            for (int i = 0; i < 10; i++) {
                engine.recordOutcome("a", false, 0);
            }
            for (int i = 0; i < 10; i++) {
                engine.recordOutcome("a", true, 0);
            }

            assertEquals(0.1, engine.learningAdjustment("a"), 1e-9);
            assertTrue(engine.performanceScore("a") > 0.5);

            engine.clearHistory("a");
            assertEquals(IntelligentRoutingEngine.NO_HISTORY_PERFORMANCE, engine.performanceScore("a"), 1e-9);
        }

        @Test
        @DisplayName("failures pull a provider below an otherwise identical peer")
        void failuresLowerRanking() {
            Map<String, ProviderSnapshot> s = snapshots(provider("a"), provider("b"));
            for (int i = 0; i < 5; i++) {
                engine.recordOutcome("a", false, 3000);
                engine.recordOutcome("b", true, 100);
            }

            assertEquals(List.of("b", "a"), engine.route(ids(s), REQUEST, s).ranking());
        }
    }

    @Nested
    @DisplayName("decision cache")
    class Cache {

        @Test
        @DisplayName("second call for the same candidate set is served from cache")
        void hit() {
            Map<String, ProviderSnapshot> s = snapshots(provider("a").health(1.0), provider("b").health(0.5));
            engine.route(ids(s), REQUEST, s);

            RoutingDecision second = engine.route(List.of("b", "a"), REQUEST, s);

            assertTrue(second.cached());
            assertEquals(List.of("a", "b"), second.ranking());
            assertEquals(2, engine.statistics().totalDecisions());
            assertEquals(1, engine.statistics().cacheHits());
        }

        @Test
        @DisplayName("a cache hit leads with the cached pick and ranks the rest by score")
        void hitReranksRemainder() {
            Map<String, ProviderSnapshot> s = snapshots(
                provider("a").health(1.0), provider("b").health(0.5), provider("c").health(0.8));
            engine.route(ids(s), REQUEST, s);

            RoutingDecision second = engine.route(List.of("b", "c", "a"), REQUEST, s);

            assertTrue(second.cached());
            assertEquals(List.of("a", "c", "b"), second.ranking());
        }

        @Test
        @DisplayName("toggling intelligent routing does not reuse the other mode's decisions")
        void modeIsPartOfTheKey() {
            Map<String, ProviderSnapshot> s = snapshots(provider("a").health(1.0), provider("b").health(0.5));
            engine.route(ids(s), REQUEST, s);

            engine.enableIntelligentRouting(false);
            RoutingDecision decision = engine.route(ids(s), REQUEST, s);

            assertFalse(decision.cached());
            assertNotEquals(StrategyType.INTELLIGENT, decision.strategy());
        }

        @Test
        @DisplayName("entries expire after the TTL")
        void ttl() {
            Map<String, ProviderSnapshot> s = snapshots(provider("a"), provider("b"));
            engine.route(ids(s), REQUEST, s);

            clock.advance(Duration.ofMinutes(5));

            assertFalse(engine.route(ids(s), REQUEST, s).cached());
        }

        @Test
        @DisplayName("a failure evicts decisions pointing at the failed provider")
        void failureEvicts() {
            Map<String, ProviderSnapshot> s = snapshots(provider("a").health(1.0), provider("b").health(0.5));
            engine.route(ids(s), REQUEST, s);
            assertEquals(1, engine.decisionCacheSize());

            engine.recordOutcome("b", false, 100);
            assertEquals(1, engine.decisionCacheSize());

            engine.recordOutcome("a", false, 100);
            assertEquals(0, engine.decisionCacheSize());
        }

        @Test
        @DisplayName("size stays bounded and expired entries can be purged")
        void boundedAndPurge() {
            IntelligentRoutingConfig d = IntelligentRoutingConfig.defaults();
            IntelligentRoutingConfig small = new IntelligentRoutingConfig(
                d.healthWeight(), d.performanceWeight(), d.loadWeight(), d.contextWeight(), d.learningWeight(),
                Duration.ofMinutes(1), 2, d.historyWindow(), d.performanceWindow(),
                d.learningRate(), d.learningBound(), d.strategyEwmaAlpha(),
                d.strategyWeightFloor(), d.strategyWeightCeiling(), d.minTotalSamples(), d.minStrategySamples());
            IntelligentRoutingEngine bounded = newEngine(small);
            Map<String, ProviderSnapshot> s = snapshots(provider("a"), provider("b"), provider("c"), provider("d"));

            bounded.route(List.of("a", "b"), REQUEST, s);
            clock.advance(Duration.ofSeconds(1));
            bounded.route(List.of("b", "c"), REQUEST, s);
            clock.advance(Duration.ofSeconds(1));
            bounded.route(List.of("c", "d"), REQUEST, s);

            assertEquals(2, bounded.decisionCacheSize());

            clock.advance(Duration.ofMinutes(2));
            assertEquals(2, bounded.purgeExpiredDecisions());
            assertEquals(0, bounded.decisionCacheSize());
        }

        @Test
        @DisplayName("a single candidate bypasses scoring and the cache")
        void singleCandidate() {
            Map<String, ProviderSnapshot> s = snapshots(provider("a"));

            RoutingDecision decision = engine.route(ids(s), REQUEST, s);

            assertEquals(List.of("a"), decision.ranking());
            assertEquals(0, engine.decisionCacheSize());
        }
    }

    @Nested
    @DisplayName("strategy mode and adaptive weights")
    class StrategyMode {

        @BeforeEach
        void disableIntelligent() {
            engine.enableIntelligentRouting(false);
        }

        @Test
        @DisplayName("falls back to the highest-weighted strategy")
        void favouredStrategy() {
            Map<String, ProviderSnapshot> s = snapshots(
                provider("a").health(0.6).requests(10, 6), provider("b").health(0.9).requests(10, 10));

            RoutingDecision decision = engine.route(ids(s), REQUEST, s);

            assertFalse(engine.isIntelligentRoutingEnabled());
            assertEquals(StrategyType.HEALTH_BASED, decision.strategy());
            assertEquals(List.of("b", "a"), decision.ranking());
            assertTrue(decision.scores().isEmpty());
        }

        @Test
        @DisplayName("rotating strategies are not cached")
        void roundRobinNotCached() {
            Map<String, ProviderSnapshot> s = snapshots(provider("a"), provider("b"), provider("c"), provider("d"));

            RoutingDecision first  = engine.route(ids(s), REQUEST, s);
            RoutingDecision second = engine.route(ids(s), REQUEST, s);

            assertEquals(StrategyType.ROUND_ROBIN, first.strategy());
            assertNotEquals(first.selected(), second.selected());
            assertEquals(0, engine.decisionCacheSize());
        }

        @Test
        @DisplayName("weights move only after enough samples and stay normalised")
        void optimize() {
            assertFalse(engine.optimizeRoutingParameters());

            for (int i = 0; i < 60; i++) {
                engine.recordStrategyOutcome(StrategyType.HEALTH_BASED, true);
            }
            for (int i = 0; i < 50; i++) {
                engine.recordStrategyOutcome(StrategyType.ROUND_ROBIN, false);
            }

            assertTrue(engine.optimizeRoutingParameters());

            Map<StrategyType, Double> weights = engine.strategyWeights();
            assertEquals(0.44 / 1.02, weights.get(StrategyType.HEALTH_BASED), 1e-9);
            assertEquals(0.18 / 1.02, weights.get(StrategyType.ROUND_ROBIN), 1e-9);
            assertEquals(0.30 / 1.02, weights.get(StrategyType.QUALITY_WEIGHTED), 1e-9);
            assertEquals(1.0, weights.values().stream().mapToDouble(Double::doubleValue).sum(), 1e-9);
            assertEquals(60, engine.statistics().strategyPerformance().get(StrategyType.HEALTH_BASED).usageCount());
        }

        @Test
        @DisplayName("samples for unweighted strategies alone leave the weights untouched")
        void noWeightMoves() {
            for (int i = 0; i < 120; i++) {
                engine.recordStrategyOutcome(StrategyType.INTELLIGENT, true);
            }
            Map<StrategyType, Double> before = engine.strategyWeights();

            assertFalse(engine.optimizeRoutingParameters());
            assertEquals(before, engine.strategyWeights());
        }

        @Test
        void adaptiveWeightsCanBeDisabled() {
            for (int i = 0; i < 120; i++) {
                engine.recordStrategyOutcome(StrategyType.HEALTH_BASED, true);
            }
            engine.enableAdaptiveWeights(false);

            assertFalse(engine.optimizeRoutingParameters());
            assertEquals(0.4, engine.strategyWeights().get(StrategyType.HEALTH_BASED), 1e-9);
        }
    }

    @Test
    void statisticsReportHistorySizes() {
        engine.recordOutcome("a", true, 10);
        engine.recordOutcome("a", true, 10);
        engine.recordOutcome("b", false, 10);

        RoutingStatistics stats = engine.statistics();

        assertEquals(Map.of("a", 2, "b", 1), stats.historySizes());
        assertTrue(stats.intelligentRoutingEnabled());

        engine.clearHistory(null);
        assertTrue(engine.statistics().historySizes().isEmpty());
    }
}
