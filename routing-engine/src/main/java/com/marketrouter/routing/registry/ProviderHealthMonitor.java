package com.marketrouter.routing.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Background health-check loop for one {@link ProviderRegistry}.
 *
 * <pre>
 *   delay(interval) → performHealthCheck() on the probe scheduler → repeat
 * </pre>
 *
 * Each cycle is a fresh {@link Mono}; the terminal subscribe schedules the next one.
 * A failed cycle is logged and the loop continues. {@link #stop()} disposes the pending
 * cycle and prevents rescheduling.
 */
public class ProviderHealthMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProviderHealthMonitor.class);

    private final ProviderRegistry registry;
    private final Duration interval;
    private final Scheduler probeScheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<Disposable> pending = new AtomicReference<>();

    public ProviderHealthMonitor(ProviderRegistry registry, Duration interval) {
        this(registry, interval, Schedulers.boundedElastic());
    }

    public ProviderHealthMonitor(ProviderRegistry registry, Duration interval, Scheduler probeScheduler) {
        this.registry       = registry;
        this.interval       = interval;
        this.probeScheduler = probeScheduler;
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info("HEALTH_MONITOR_STARTED intervalSeconds={}", interval.toSeconds());
            scheduleNextCycle(interval);
        }
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            Disposable d = pending.getAndSet(null);
            if (d != null) {
                d.dispose();
            }
            log.info("HEALTH_MONITOR_STOPPED");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        stop();
    }

    // ── loop ──────────────────────────────────────────────────────────────────

    private void scheduleNextCycle(Duration delay) {
        if (!running.get()) {
            return;
        }
        Disposable d = Mono.delay(delay)
            .then(Mono.fromCallable(registry::performHealthCheck).subscribeOn(probeScheduler))
            .subscribe(
                results -> {
                    log.debug("HEALTH_MONITOR_CYCLE providers={}", results.size());
                    scheduleNextCycle(interval);
                },
                err -> {
                    log.error("HEALTH_MONITOR_CYCLE_FAILED rescheduling intervalSeconds={}", interval.toSeconds(), err);
                    scheduleNextCycle(interval);
                }
            );
        pending.set(d);
    }
}
