package com.marketrouter.marketdata.scheduler;

import com.marketrouter.common.breaker.CircuitBreakerConfig;
import com.marketrouter.common.breaker.CircuitBreakerRegistry;
import com.marketrouter.common.mapping.FieldMappingEngine;
import com.marketrouter.common.model.AssetType;
import com.marketrouter.common.model.DataType;
import com.marketrouter.common.model.StandardQuery;
import com.marketrouter.marketdata.MutableClock;
import com.marketrouter.marketdata.ScriptedProvider;
import com.marketrouter.marketdata.pipeline.ExtractTransformPipeline;
import com.marketrouter.marketdata.pipeline.PipelineSettings;
import com.marketrouter.marketdata.transform.DataTransformer;
import com.marketrouter.routing.intelligent.IntelligentRoutingConfig;
import com.marketrouter.routing.intelligent.IntelligentRoutingEngine;
import com.marketrouter.routing.registry.ProviderRegistry;
import com.marketrouter.routing.registry.RegistrySettings;
import com.marketrouter.routing.strategy.ProviderRouter;
import com.marketrouter.routing.strategy.RoutingSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RoutingMaintenanceSchedulerTest {

    private MutableClock clock;
    private ExtractTransformPipeline pipeline;
    private RoutingMaintenanceScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-02T09:30:00Z"));
        ProviderRegistry registry = new ProviderRegistry(
            new CircuitBreakerRegistry(CircuitBreakerConfig.defaults(), clock), RegistrySettings.defaults(), clock);
        registry.register("alpha", ScriptedProvider.returning(ScriptedProvider.chineseKline()), 10, 1.0);
        IntelligentRoutingEngine engine = new IntelligentRoutingEngine(
            new ProviderRouter(RoutingSettings.defaults()), IntelligentRoutingConfig.defaults(), clock);
        pipeline = new ExtractTransformPipeline(registry, engine,
            new DataTransformer(new FieldMappingEngine()), PipelineSettings.defaults(), clock);
        scheduler = new RoutingMaintenanceScheduler(engine, pipeline);
    }

    @AfterEach
    void tearDown() {
        pipeline.close();
    }

    @Test
    @DisplayName("a maintenance pass purges results older than the cache TTL")
    void purgesExpiredResults() {
        pipeline.process(StandardQuery.builder("000001", AssetType.STOCK, DataType.HISTORICAL_KLINE).build());
        assertEquals(1, pipeline.statistics().resultCacheSize());

        scheduler.runOnce();
        assertEquals(1, pipeline.statistics().resultCacheSize());

        clock.advance(Duration.ofMinutes(5));
        scheduler.runOnce();
        assertEquals(0, pipeline.statistics().resultCacheSize());
    }

    @Test
    @DisplayName("stop before start is harmless")
    void stopWithoutStart() {
        assertDoesNotThrow(scheduler::stop);
    }
}
