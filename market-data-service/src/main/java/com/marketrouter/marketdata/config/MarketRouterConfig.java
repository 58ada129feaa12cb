package com.marketrouter.marketdata.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.marketrouter.common.breaker.CircuitBreakerConfig;
import com.marketrouter.common.breaker.CircuitBreakerRegistry;
import com.marketrouter.common.mapping.FieldMappingEngine;
import com.marketrouter.marketdata.pipeline.ExtractTransformPipeline;
import com.marketrouter.marketdata.pipeline.PipelineSettings;
import com.marketrouter.marketdata.transform.DataTransformer;
import com.marketrouter.routing.intelligent.IntelligentRoutingConfig;
import com.marketrouter.routing.intelligent.IntelligentRoutingEngine;
import com.marketrouter.routing.registry.ProviderHealthMonitor;
import com.marketrouter.routing.registry.ProviderRegistry;
import com.marketrouter.routing.registry.RegistrySettings;
import com.marketrouter.routing.strategy.ProviderRouter;
import com.marketrouter.routing.strategy.RoutingSettings;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Random;

/**
 * Wires the routing core from {@link RouterProperties}. Every component is built with its
 * collaborators passed in; nothing reaches for a global instance.
 */
@Configuration
@EnableConfigurationProperties(RouterProperties.class)
public class MarketRouterConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(RouterProperties props, Clock clock) {
        RouterProperties.Breaker b = props.getBreaker();
        CircuitBreakerConfig config = CircuitBreakerConfig.builder()
            .windowSize(b.getWindowSize())
            .minimumCalls(b.getMinimumCalls())
            .failureThreshold(b.getFailureThreshold())
            .failureRateThreshold(b.getFailureRateThreshold())
            .slowCallThreshold(b.getSlowCallThreshold())
            .slowCallRateThreshold(b.getSlowCallRateThreshold())
            .recoveryTimeout(b.getRecoveryTimeout())
            .halfOpenMaxCalls(b.getHalfOpenMaxCalls())
            .successThreshold(b.getSuccessThreshold())
            .adaptive(b.isAdaptive())
            .adaptiveFactor(b.getAdaptiveFactor())
            .degradationThresholds(b.getCriticalRate(), b.getSevereRate(), b.getModerateRate())
            .build();
        return new CircuitBreakerRegistry(config, clock);
    }

    @Bean
    public ProviderRegistry providerRegistry(CircuitBreakerRegistry breakers, RouterProperties props, Clock clock) {
        RouterProperties.Registry r = props.getRegistry();
        RegistrySettings settings = new RegistrySettings(r.getHealthCheckInterval(), r.getHealthGracePeriod(),
                                                         r.getEwmaAlpha(), r.getResponseTimeBaselineMs());
        return new ProviderRegistry(breakers, settings, clock);
    }

    /** Started by {@link ProviderDiscovery} once providers are registered. */
    @Bean(destroyMethod = "close")
    public ProviderHealthMonitor providerHealthMonitor(ProviderRegistry registry, RouterProperties props) {
        return new ProviderHealthMonitor(registry, props.getRegistry().getHealthCheckInterval());
    }

    @Bean
    public ProviderRouter providerRouter(RouterProperties props) {
        RouterProperties.Routing r = props.getRouting();
        RoutingSettings settings = new RoutingSettings(r.getStrategy(), r.isDynamic(), r.getRoundRobinHealthFloor(),
                                                       r.getBreakerErrorThreshold(), r.getBreakerMinRequests());
        Random random = r.getRandomSeed() == null ? new Random() : new Random(r.getRandomSeed());
        return new ProviderRouter(settings, random);
    }

    @Bean
    public IntelligentRoutingEngine intelligentRoutingEngine(ProviderRouter router, RouterProperties props, Clock clock) {
        RouterProperties.Intelligent i = props.getIntelligent();
        IntelligentRoutingConfig config = new IntelligentRoutingConfig(
            i.getHealthWeight(), i.getPerformanceWeight(), i.getLoadWeight(), i.getContextWeight(), i.getLearningWeight(),
            i.getDecisionCacheTtl(), i.getDecisionCacheMaxSize(), i.getHistoryWindow(), i.getPerformanceWindow(),
            i.getLearningRate(), i.getLearningBound(), i.getStrategyEwmaAlpha(),
            i.getStrategyWeightFloor(), i.getStrategyWeightCeiling(), i.getMinTotalSamples(), i.getMinStrategySamples());
        IntelligentRoutingEngine engine = new IntelligentRoutingEngine(router, config, clock);
        engine.enableIntelligentRouting(props.getRouting().getMode() == RouterProperties.Mode.INTELLIGENT);
        engine.enableAdaptiveWeights(i.isAdaptiveWeights());
        return engine;
    }

    @Bean
    public FieldMappingEngine fieldMappingEngine() {
        return new FieldMappingEngine();
    }

    @Bean
    public DataTransformer dataTransformer(FieldMappingEngine fieldMappingEngine) {
        return new DataTransformer(fieldMappingEngine);
    }

    @Bean(destroyMethod = "close")
    public ExtractTransformPipeline extractTransformPipeline(ProviderRegistry registry, IntelligentRoutingEngine engine,
                                                             DataTransformer transformer, RouterProperties props,
                                                             Clock clock) {
        RouterProperties.Pipeline p = props.getPipeline();
        PipelineSettings settings = new PipelineSettings(p.isCacheEnabled(), p.getResultCacheTtl(),
                                                         p.getResultCacheMaxSize(), p.getWorkerPoolSize());
        return new ExtractTransformPipeline(registry, engine, transformer, settings, clock);
    }
}
