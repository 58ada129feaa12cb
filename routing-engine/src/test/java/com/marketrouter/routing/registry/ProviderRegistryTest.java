package com.marketrouter.routing.registry;

import com.marketrouter.common.breaker.CircuitBreakerConfig;
import com.marketrouter.common.breaker.CircuitBreakerRegistry;
import com.marketrouter.common.breaker.CircuitState;
import com.marketrouter.common.model.AssetType;
import com.marketrouter.common.model.DataTable;
import com.marketrouter.common.model.DataType;
import com.marketrouter.common.model.ProviderCapability;
import com.marketrouter.common.model.RoutingRequest;
import com.marketrouter.common.provider.DataSourcePlugin;
import com.marketrouter.routing.FakeProvider;
import com.marketrouter.routing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Registration, capability indexing, availability filtering and metrics of {@link ProviderRegistry}.
 */
class ProviderRegistryTest {

    private MutableClock clock;
    private ProviderRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-04T01:30:00Z"));
        CircuitBreakerConfig config = CircuitBreakerConfig.builder()
            .windowSize(5).minimumCalls(3).failureThreshold(3)
            .recoveryTimeout(Duration.ofSeconds(30))
            .build();
        registry = new ProviderRegistry(new CircuitBreakerRegistry(config, clock), RegistrySettings.defaults(), clock);
    }

    private List<String> klineStock(String market) {
        return registry.getAvailable(DataType.HISTORICAL_KLINE, AssetType.STOCK, market);
    }

    // ── test providers ────────────────────────────────────────────────────────

    public static class CsvStyleSource {
        public List<String> getSupportedDataTypes() {
            return List.of("kline");
        }

        public List<Map<String, Object>> fetchData(String symbol, String dataType, Map<String, Object> params) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("code", symbol);
            row.put("dt", dataType);
            row.put("period", params.get("period"));
            return List.of(row);
        }
    }

    @DataSourcePlugin(name = "crypto feed", assetTypes = {"crypto"}, dataTypes = {"realtime"}, priority = 15)
    public static class CryptoFeed {
        public Map<String, List<?>> getData(RoutingRequest request) {
            Map<String, List<?>> columns = new LinkedHashMap<>();
            columns.put("symbol", List.of(request.symbol(), request.symbol()));
            columns.put("price", List.of(1.0, 2.0));
            return columns;
        }
    }

    public static class OrphanDataSource {
        public String describe() {
            return "no extraction method";
        }
    }

    // ── registration ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("registration")
    class Registration {

        @Test
        @DisplayName("interface provider keeps its declared priority and lands in the index")
        void interfaceProvider() {
            assertTrue(registry.register("a", FakeProvider.stockKline(10), -1, 1.0));

            assertEquals(ProbeMethod.INTERFACE, registry.getProbeMethod("a").orElseThrow());
            assertEquals(10, registry.getCapability("a").orElseThrow().priority());
            assertEquals(List.of("a"), klineStock(null));
        }

        @Test
        @DisplayName("a second registration under the same id is rejected")
        void duplicateRejected() {
            assertTrue(registry.register("a", FakeProvider.stockKline(10)));
            assertFalse(registry.register("a", FakeProvider.stockKline(20)));
            assertEquals(10, registry.getCapability("a").orElseThrow().priority());
        }

        @Test
        @DisplayName("explicit priority argument overrides the declared one")
        void explicitPriorityWins() {
            assertTrue(registry.register("a", FakeProvider.stockKline(10), 3, 2.0));

            ProviderSnapshot s = registry.snapshot("a").orElseThrow();
            assertEquals(3, s.priority());
            assertEquals(2.0, s.weight());
        }

        @Test
        @DisplayName("undeclared priority is derived from the name")
        void autoPriority() {
            ProviderCapability undeclared = ProviderCapability.of(
                EnumSet.of(AssetType.STOCK), EnumSet.of(DataType.HISTORICAL_KLINE), Set.of());
            assertTrue(registry.register("mock-feed", new FakeProvider(undeclared)));

            assertEquals(CapabilityInference.LOW_PRIORITY - CapabilityInference.KLINE_BONUS,
                         registry.getCapability("mock-feed").orElseThrow().priority());
        }

        @Test
        @DisplayName("method-shaped provider is adapted once and extracts through the contract")
        void requiredMethodsProvider() {
            assertTrue(registry.register("csv", new CsvStyleSource()));

            assertEquals(ProbeMethod.REQUIRED_METHODS, registry.getProbeMethod("csv").orElseThrow());
            ProviderCapability cap = registry.getCapability("csv").orElseThrow();
            assertEquals(Set.of(DataType.HISTORICAL_KLINE), cap.dataTypes());
            assertEquals(Set.of(AssetType.STOCK), cap.assetTypes());

            DataTable table = registry.getProvider("csv").orElseThrow()
                .extract(RoutingRequest.of("600000", AssetType.STOCK, DataType.HISTORICAL_KLINE));
            assertEquals(1, table.rowCount());
            assertEquals("600000", table.rows().get(0).get("code"));
            assertEquals("historical_kline", table.rows().get(0).get("dt"));
            assertEquals("D", table.rows().get(0).get("period"));
        }

        @Test
        @DisplayName("annotated provider takes capability and priority from the annotation")
        void annotatedProvider() {
            assertTrue(registry.register("cf", new CryptoFeed()));

            assertEquals(ProbeMethod.DECLARED_TYPE, registry.getProbeMethod("cf").orElseThrow());
            ProviderCapability cap = registry.getCapability("cf").orElseThrow();
            assertEquals(Set.of(AssetType.CRYPTO), cap.assetTypes());
            assertEquals(Set.of(DataType.REAL_TIME_QUOTE), cap.dataTypes());
            assertEquals(15, cap.priority());

            DataTable table = registry.getProvider("cf").orElseThrow()
                .extract(RoutingRequest.of("BTCUSDT", AssetType.CRYPTO, DataType.REAL_TIME_QUOTE));
            assertEquals(2, table.rowCount());
            assertEquals(List.of(1.0, 2.0), table.columnValues("price"));
        }

        @Test
        @DisplayName("discover reports one outcome per candidate")
        void discover() {
            Map<String, Object> candidates = new LinkedHashMap<>();
            candidates.put("good", FakeProvider.stockKline(10));
            candidates.put("text", "not a provider");
            candidates.put("orphan", new OrphanDataSource());

            Map<String, DiscoveryOutcome> outcomes = registry.discover(candidates);

            assertEquals(DiscoveryOutcome.REGISTERED, outcomes.get("good"));
            assertEquals(DiscoveryOutcome.SKIPPED_NOT_DATA_SOURCE, outcomes.get("text"));
            assertEquals(DiscoveryOutcome.FAILED, outcomes.get("orphan"));
            assertEquals(List.of("good"), registry.providerIds());
        }

        @Test
        @DisplayName("deregistration removes the provider from the index and disconnects it")
        void deregister() {
            FakeProvider p = FakeProvider.stockKline(10);
            registry.register("a", p);

            assertTrue(registry.deregister("a"));
            assertFalse(registry.deregister("a"));
            assertEquals(1, p.disconnectCount());
            assertTrue(klineStock(null).isEmpty());
            assertTrue(registry.snapshot("a").isEmpty());
        }

        @Test
        @DisplayName("late outcomes for a deregistered provider do not bring its breaker back")
        void lateOutcomesAfterDeregister() {
            registry.register("a", FakeProvider.stockKline(10));
            registry.deregister("a");

            registry.recordFailure("a", new IllegalStateException("late"), Duration.ofMillis(5));
            registry.recordSuccess("a", Duration.ofMillis(5), 1.0);

            assertTrue(registry.circuitBreaker("a").isEmpty());
            assertTrue(registry.getCircuitBreakers().find("a").isEmpty());
            assertTrue(registry.getCircuitBreakers().reports().isEmpty());
        }
    }

    // ── index & availability ──────────────────────────────────────────────────

    @Nested
    @DisplayName("availability")
    class Availability {

        @Test
        @DisplayName("index order is priority ascending, then id")
        void indexOrder() {
            registry.register("b", FakeProvider.stockKline(20));
            registry.register("c", FakeProvider.stockKline(10));
            registry.register("a", FakeProvider.stockKline(10));

            assertEquals(List.of("a", "c", "b"), klineStock(null));
            assertTrue(registry.getAvailable(DataType.REAL_TIME_QUOTE, AssetType.STOCK, null).isEmpty());
        }

        @Test
        @DisplayName("market filter applies only to markets known to the index")
        void marketFilter() {
            registry.register("sh", FakeProvider.stockKline(10));
            registry.register("us", new FakeProvider(new ProviderCapability(
                EnumSet.of(AssetType.STOCK), EnumSet.of(DataType.HISTORICAL_KLINE), Set.of("US"), 20, 0.8, 0.8)));

            assertEquals(List.of("us"), klineStock("US"));
            assertEquals(List.of("sh"), klineStock("SZ"));
            assertEquals(List.of("sh", "us"), klineStock("LSE"));
            assertEquals(List.of("sh", "us"), klineStock(null));
        }

        @Test
        @DisplayName("disabled providers are excluded until enabled again")
        void disabled() {
            registry.register("a", FakeProvider.stockKline(10));

            assertTrue(registry.disable("a"));
            assertTrue(klineStock(null).isEmpty());

            assertTrue(registry.enable("a"));
            assertEquals(List.of("a"), klineStock(null));
        }

        @Test
        @DisplayName("an unhealthy provider is excluded until the grace period passes")
        void errorGracePeriod() {
            FakeProvider p = FakeProvider.stockKline(10);
            registry.register("a", p);
            p.setHealthy(false);

            registry.performHealthCheck();

            assertEquals(ProviderStatus.ERROR, registry.snapshot("a").orElseThrow().status());
            assertTrue(klineStock(null).isEmpty());

            clock.advance(RegistrySettings.defaults().healthGracePeriod());
            assertEquals(List.of("a"), klineStock(null));
        }

        @Test
        @DisplayName("a successful call moves an ERROR provider back to ACTIVE")
        void successRecovers() {
            FakeProvider p = FakeProvider.stockKline(10);
            registry.register("a", p);
            p.setHealthy(false);
            registry.performHealthCheck();

            registry.recordOutcome("a", true, 50, 0.9);

            assertEquals(ProviderStatus.ACTIVE, registry.snapshot("a").orElseThrow().status());
        }

        @Test
        @DisplayName("providers whose breaker rejects calls are excluded until recovery is due")
        void openBreakerExcluded() {
            registry.register("a", FakeProvider.stockKline(10));
            registry.register("b", FakeProvider.stockKline(20));
            for (int i = 0; i < 3; i++) {
                registry.recordFailure("a", new RuntimeException("boom"), Duration.ofMillis(5));
            }

            assertEquals(CircuitState.OPEN, registry.circuitBreaker("a").orElseThrow().getState());
            assertEquals(List.of("b"), klineStock(null));

            clock.advance(Duration.ofSeconds(31));
            assertEquals(List.of("a", "b"), klineStock(null));
        }
    }

    // ── metrics ───────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("metrics")
    class Metrics {

        @Test
        @DisplayName("health score combines success rate, breaker state and latency")
        void healthScore() {
            registry.register("a", FakeProvider.stockKline(10));
            assertEquals(1.0, registry.snapshot("a").orElseThrow().healthScore(), 1e-9);

            registry.recordOutcome("a", true, 0, 1.0);
            registry.recordOutcome("a", false, 0, -1);

            ProviderSnapshot s = registry.snapshot("a").orElseThrow();
            assertEquals(2, s.totalRequests());
            assertEquals(1, s.failedRequests());
            assertEquals(0.5 * 0.5 + 0.3 + 0.2, s.healthScore(), 1e-9);
        }

        @Test
        @DisplayName("an open breaker drops the breaker term of the health score")
        void healthFollowsBreaker() {
            registry.register("a", FakeProvider.stockKline(10));
            for (int i = 0; i < 3; i++) {
                registry.recordFailure("a", new RuntimeException("boom"), Duration.ZERO);
            }

            ProviderSnapshot s = registry.snapshot("a").orElseThrow();
            assertEquals(CircuitState.OPEN, s.circuitState());
            assertEquals(0.2, s.healthScore(), 1e-9);
            assertEquals(1.0, s.recentErrorRate(), 1e-9);
            assertEquals(3, s.recentCalls());
        }

        @Test
        @DisplayName("load counter never goes below zero")
        void loadCounter() {
            registry.register("a", FakeProvider.stockKline(10));

            registry.acquire("a");
            registry.acquire("a");
            assertEquals(2, registry.snapshot("a").orElseThrow().currentLoad());

            registry.release("a");
            registry.release("a");
            registry.release("a");
            assertEquals(0, registry.snapshot("a").orElseThrow().currentLoad());
        }

        @Test
        @DisplayName("fast reliable provider grades A+, slow failing provider grades D")
        void performanceGrades() {
            registry.register("fast", FakeProvider.stockKline(10));
            registry.register("slow", FakeProvider.stockKline(20));
            for (int i = 0; i < 10; i++) {
                registry.recordOutcome("fast", true, 100, 1.0);
                registry.recordOutcome("slow", false, 5_000, -1);
            }

            ProviderPerformanceReport fast = registry.performanceReport("fast").orElseThrow();
            ProviderPerformanceReport slow = registry.performanceReport("slow").orElseThrow();

            assertEquals("A+", fast.grade());
            assertTrue(fast.recommendations().isEmpty());
            assertEquals("D", slow.grade());
            assertFalse(slow.recommendations().isEmpty());
        }

        @Test
        @DisplayName("statistics count providers by status")
        void statistics() {
            FakeProvider down = FakeProvider.stockKline(20);
            registry.register("up", FakeProvider.stockKline(10));
            registry.register("down", down);
            registry.register("off", FakeProvider.stockKline(30));
            down.setHealthy(false);
            registry.performHealthCheck();
            registry.disable("off");

            RegistryStatistics stats = registry.statistics();

            assertEquals(3, stats.totalProviders());
            assertEquals(1, stats.activeProviders());
            assertEquals(1, stats.errorProviders());
            assertEquals(1, stats.disabledProviders());
            assertNotNull(stats.lastHealthCheck());
        }
    }

    // ── inference ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("capability inference")
    class Inference {

        @Test
        void keywordsPickAssetTypeAndMarkets() {
            assertEquals(Set.of(AssetType.CRYPTO), CapabilityInference.infer("binance-spot").assetTypes());
            ProviderCapability futures = CapabilityInference.infer("ctp-gateway");
            assertEquals(Set.of(AssetType.FUTURES), futures.assetTypes());
            assertTrue(futures.markets().contains("SHFE"));
            ProviderCapability fallback = CapabilityInference.infer("whatever");
            assertEquals(Set.of(AssetType.STOCK), fallback.assetTypes());
            assertEquals(Set.of("SH", "SZ"), fallback.markets());
        }

        @Test
        void autoPriorityAppliesVendorAndDataTypeBonuses() {
            assertEquals(40 - 5 - 3, CapabilityInference.autoPriority("tushare-pro",
                EnumSet.of(DataType.HISTORICAL_KLINE, DataType.REAL_TIME_QUOTE)));
            assertEquals(90, CapabilityInference.autoPriority("test-provider", EnumSet.noneOf(DataType.class)));
            assertEquals(50, CapabilityInference.autoPriority("unknown", EnumSet.of(DataType.FUNDAMENTAL)));
        }

        @Test
        void partialDeclarationIsCompleted() {
            ProviderCapability partial = ProviderCapability.of(Set.of(), EnumSet.of(DataType.REAL_TIME_QUOTE), Set.of());

            ProviderCapability completed = CapabilityInference.complete("okx-feed", partial);

            assertEquals(Set.of(AssetType.CRYPTO), completed.assetTypes());
            assertEquals(Set.of(DataType.REAL_TIME_QUOTE), completed.dataTypes());
        }
    }

    // ── background monitor ────────────────────────────────────────────────────

    @Nested
    @DisplayName("health monitor")
    class Monitor {

        @Test
        @DisplayName("runs health checks in the background until stopped")
        void runsUntilStopped() throws InterruptedException {
            FakeProvider p = FakeProvider.stockKline(10);
            registry.register("a", p);
            p.setHealthy(false);

            try (ProviderHealthMonitor monitor = new ProviderHealthMonitor(registry, Duration.ofMillis(20))) {
                monitor.start();
                assertTrue(monitor.isRunning());
                long deadline = System.currentTimeMillis() + 5_000;
                while (registry.statistics().lastHealthCheck() == null && System.currentTimeMillis() < deadline) {
                    Thread.sleep(10);
                }
                monitor.stop();
                assertFalse(monitor.isRunning());
            }

            assertNotNull(registry.statistics().lastHealthCheck());
            assertEquals(ProviderStatus.ERROR, registry.snapshot("a").orElseThrow().status());
        }
    }
}
