package com.marketrouter.marketdata.config;

import com.marketrouter.routing.strategy.StrategyType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Everything under {@code market-router.*}. Defaults match the library defaults, so an
 * empty configuration behaves like the plain constructors.
 */
@Data
@ConfigurationProperties(prefix = "market-router")
public class RouterProperties {

    private Breaker breaker = new Breaker();
    private Routing routing = new Routing();
    private Intelligent intelligent = new Intelligent();
    private Pipeline pipeline = new Pipeline();
    private Registry registry = new Registry();

    @Data
    public static class Breaker {
        private int windowSize = 10;
        private int minimumCalls = 10;
        private int failureThreshold = 5;
        private double failureRateThreshold = 0.5;
        private Duration slowCallThreshold = Duration.ofSeconds(5);
        private double slowCallRateThreshold = 0.3;
        private Duration recoveryTimeout = Duration.ofSeconds(60);
        private int halfOpenMaxCalls = 3;
        private int successThreshold = 3;
        private boolean adaptive = false;
        private double adaptiveFactor = 0.1;
        private double criticalRate = 0.8;
        private double severeRate = 0.6;
        private double moderateRate = 0.4;
    }

    public enum Mode { INTELLIGENT, STRATEGY }

    @Data
    public static class Routing {
        private Mode mode = Mode.INTELLIGENT;
        /** Fixed strategy for STRATEGY mode; ignored when {@code dynamic} is on and a request rule applies. */
        private StrategyType strategy = StrategyType.HEALTH_BASED;
        private boolean dynamic = true;
        private double roundRobinHealthFloor = 0.5;
        private double breakerErrorThreshold = 0.5;
        private int breakerMinRequests = 10;
        private Long randomSeed;
    }

    @Data
    public static class Intelligent {
        private double healthWeight = 0.30;
        private double performanceWeight = 0.25;
        private double loadWeight = 0.20;
        private double contextWeight = 0.15;
        private double learningWeight = 0.10;
        private Duration decisionCacheTtl = Duration.ofMinutes(5);
        private int decisionCacheMaxSize = 1000;
        private int historyWindow = 100;
        private int performanceWindow = 20;
        private double learningRate = 0.1;
        private double learningBound = 0.2;
        private double strategyEwmaAlpha = 0.1;
        private double strategyWeightFloor = 0.05;
        private double strategyWeightCeiling = 0.6;
        private int minTotalSamples = 100;
        private int minStrategySamples = 10;
        private boolean adaptiveWeights = true;
    }

    @Data
    public static class Pipeline {
        private boolean cacheEnabled = true;
        private Duration resultCacheTtl = Duration.ofMinutes(5);
        private int resultCacheMaxSize = 1000;
        private int workerPoolSize = 10;
    }

    @Data
    public static class Registry {
        private boolean healthCheckEnabled = true;
        private Duration healthCheckInterval = Duration.ofSeconds(60);
        private Duration healthGracePeriod = Duration.ofSeconds(300);
        private double ewmaAlpha = 0.1;
        private double responseTimeBaselineMs = 10_000;
    }
}
