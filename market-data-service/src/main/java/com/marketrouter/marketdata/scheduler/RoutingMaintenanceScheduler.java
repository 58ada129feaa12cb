package com.marketrouter.marketdata.scheduler;

import com.marketrouter.marketdata.pipeline.ExtractTransformPipeline;
import com.marketrouter.routing.intelligent.IntelligentRoutingEngine;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodic housekeeping for the routing core:
 * <pre>
 *   delay(interval) → optimise strategy weights → purge expired decisions → purge expired results → repeat
 * </pre>
 *
 * <p>Each cycle is a fresh {@link Mono} whose terminal subscribe schedules the next one.
 * A failed cycle is logged and the loop goes on with the same interval.
 */
@Component
public class RoutingMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(RoutingMaintenanceScheduler.class);

    private final IntelligentRoutingEngine routingEngine;
    private final ExtractTransformPipeline pipeline;

    @Value("${market-router.maintenance.interval:60s}")
    private Duration interval;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<Disposable> pending = new AtomicReference<>();

    public RoutingMaintenanceScheduler(IntelligentRoutingEngine routingEngine, ExtractTransformPipeline pipeline) {
        this.routingEngine = routingEngine;
        this.pipeline      = pipeline;
    }

    @PostConstruct
    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info("MAINTENANCE_STARTED intervalSeconds={}", interval.toSeconds());
            scheduleNextCycle();
        }
    }

    @PreDestroy
    public void stop() {
        running.set(false);
        Disposable d = pending.getAndSet(null);
        if (d != null) {
            d.dispose();
        }
    }

    /** One maintenance pass, run inline. */
    public void runOnce() {
        boolean optimized = routingEngine.optimizeRoutingParameters();
        int decisions = routingEngine.purgeExpiredDecisions();
        int results   = pipeline.purgeExpiredResults();
        log.info("MAINTENANCE_CYCLE weightsOptimized={} expiredDecisions={} expiredResults={}",
                 optimized, decisions, results);
    }

    private void scheduleNextCycle() {
        if (!running.get()) {
            return;
        }
        Disposable d = Mono.delay(interval)
            .then(Mono.fromRunnable(this::runOnce))
            .subscribe(
                ignored -> { },
                err -> {
                    log.error("MAINTENANCE_CYCLE_FAILED, rescheduling intervalSeconds={}", interval.toSeconds(), err);
                    scheduleNextCycle();
                },
                this::scheduleNextCycle);
        pending.set(d);
    }
}
