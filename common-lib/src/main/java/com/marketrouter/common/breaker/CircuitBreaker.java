package com.marketrouter.common.breaker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-provider three-state circuit breaker.
 *
 * <h3>State machine</h3>
 * <pre>
 *   CLOSED    → OPEN       window holds >= effectiveMinimumCalls samples AND
 *                          (failures >= failureThreshold OR failureRate >= failureRateThreshold
 *                           OR slowCallRate >= slowCallRateThreshold)
 *   OPEN      → HALF_OPEN  first canExecute() after recoveryTimeout has elapsed since opening
 *   HALF_OPEN → CLOSED     successThreshold probe successes
 *   HALF_OPEN → OPEN       any probe failure
 * </pre>
 *
 * <p>In HALF_OPEN, {@link #canExecute()} hands out at most {@code halfOpenMaxCalls}
 * permits; further calls are rejected until a transition occurs. Only outcomes recorded
 * while CLOSED enter the sliding window, and the window is cleared on closing.
 *
 * <h3>Adaptive mode</h3>
 * When enabled, after every CLOSED-state outcome with a full minimum sample, the failure
 * threshold and recovery timeout are scaled by {@code 1 ± adaptiveFactor}:
 * <pre>
 *   windowSuccessRate > 0.9  → widen   (capped at 1.5 × configured value)
 *   windowSuccessRate < 0.7  → narrow  (floored at 0.5 × configured value)
 * </pre>
 *
 * <p>All transitions are check-then-act under one {@link ReentrantLock}. Listeners are
 * notified after the lock is released.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    static final int MAX_FAILURE_HISTORY = 100;
    static final int REPORTED_FAILURES   = 5;
    static final double RESPONSE_TIME_ALPHA = 0.1;
    static final double WIDEN_ABOVE  = 0.9;
    static final double NARROW_BELOW = 0.7;
    static final double MAX_SCALE = 1.5;
    static final double MIN_SCALE = 0.5;

    private record Outcome(boolean success, boolean slow) {}

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<CircuitBreakerListener> listeners = new CopyOnWriteArrayList<>();

    private final Deque<Outcome> window = new ArrayDeque<>();
    private int windowFailures;
    private int windowSlowCalls;

    private CircuitState state = CircuitState.CLOSED;
    private DegradationLevel degradation = DegradationLevel.NONE;
    private Instant openedAt;
    private Instant stateChangedAt;
    private Instant lastFailureTime;
    private int halfOpenCallCount;
    private int halfOpenSuccessCount;

    private long totalCalls;
    private long totalSuccesses;
    private long totalFailures;
    private long totalRejected;
    private long totalSlowCalls;
    private double averageResponseTimeMs;

    private double currentFailureThreshold;
    private Duration currentRecoveryTimeout;

    private final Deque<FailureRecord> failureHistory = new ArrayDeque<>();
    private final Map<FailureType, Long> failuresByType = new EnumMap<>(FailureType.class);

    public CircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC());
    }

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        this.name                    = name;
        this.config                  = config;
        this.clock                   = clock;
        this.currentFailureThreshold = config.failureThreshold();
        this.currentRecoveryTimeout  = config.recoveryTimeout();
        this.stateChangedAt          = clock.instant();
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    public void addListener(CircuitBreakerListener listener) {
        listeners.add(listener);
    }

    // ── call admission ────────────────────────────────────────────────────────

    /**
     * Asks for permission to make one call.
     *
     * <p>When OPEN and the recovery timeout has elapsed this moves the breaker to
     * HALF_OPEN and the returned permit is the first probe. In HALF_OPEN every
     * {@code true} consumes one of the {@code halfOpenMaxCalls} probe permits.
     */
    public boolean canExecute() {
        Transition transition = null;
        boolean permitted;
        lock.lock();
        try {
            switch (state) {
                case CLOSED -> permitted = true;
                case OPEN -> {
                    if (recoveryElapsed()) {
                        transition = transitionTo(CircuitState.HALF_OPEN, "recovery timeout elapsed");
                        halfOpenCallCount = 1;
                        permitted = true;
                    } else {
                        totalRejected++;
                        permitted = false;
                    }
                }
                case HALF_OPEN -> {
                    if (halfOpenCallCount < config.halfOpenMaxCalls()) {
                        halfOpenCallCount++;
                        permitted = true;
                    } else {
                        totalRejected++;
                        permitted = false;
                    }
                }
                default -> permitted = false;
            }
        } finally {
            lock.unlock();
        }
        notifyListeners(transition);
        return permitted;
    }

    /**
     * Whether {@link #canExecute()} would currently grant a permit, without consuming
     * one or changing state. Used by routing to filter candidates.
     */
    public boolean isCallPermitted() {
        lock.lock();
        try {
            return switch (state) {
                case CLOSED -> true;
                case OPEN -> recoveryElapsed();
                case HALF_OPEN -> halfOpenCallCount < config.halfOpenMaxCalls();
            };
        } finally {
            lock.unlock();
        }
    }

    // ── outcome recording ─────────────────────────────────────────────────────

    public void recordSuccess(Duration responseTime) {
        long ms = toMillis(responseTime);
        Transition transition = null;
        lock.lock();
        try {
            totalCalls++;
            totalSuccesses++;
            boolean slow = isSlow(ms);
            if (slow) {
                totalSlowCalls++;
            }
            updateAverage(ms);

            if (state == CircuitState.HALF_OPEN) {
                halfOpenSuccessCount++;
                if (halfOpenSuccessCount >= config.successThreshold()) {
                    transition = transitionTo(CircuitState.CLOSED,
                                              "probe successes=" + halfOpenSuccessCount);
                }
            } else if (state == CircuitState.CLOSED) {
                addToWindow(new Outcome(true, slow));
                adapt();
                transition = evaluateTrip();
            }
        } finally {
            lock.unlock();
        }
        notifyListeners(transition);
    }

    public void recordFailure(Throwable error, Duration responseTime) {
        String message = error == null ? "unknown error"
                         : FailureClassifier.unwrap(error).getClass().getSimpleName() + ": "
                           + FailureClassifier.unwrap(error).getMessage();
        recordFailure(FailureClassifier.classify(error), message, responseTime);
    }

    public void recordFailure(FailureType type, String message, Duration responseTime) {
        long ms = toMillis(responseTime);
        FailureType failureType = type == null ? FailureType.UNKNOWN : type;
        Transition transition = null;
        lock.lock();
        try {
            Instant now = clock.instant();
            totalCalls++;
            totalFailures++;
            boolean slow = isSlow(ms);
            if (slow) {
                totalSlowCalls++;
            }
            updateAverage(ms);
            lastFailureTime = now;
            failuresByType.merge(failureType, 1L, Long::sum);
            failureHistory.addLast(FailureRecord.of(now, failureType, message, ms));
            while (failureHistory.size() > MAX_FAILURE_HISTORY) {
                failureHistory.removeFirst();
            }

            if (state == CircuitState.HALF_OPEN) {
                transition = transitionTo(CircuitState.OPEN, "probe failed type=" + failureType);
            } else if (state == CircuitState.CLOSED) {
                addToWindow(new Outcome(false, slow));
                adapt();
                transition = evaluateTrip();
            }
        } finally {
            lock.unlock();
        }
        log.debug("CIRCUIT_FAILURE_RECORDED name={} type={} responseTimeMs={} message={}",
                  name, failureType, ms, message);
        notifyListeners(transition);
    }

    // ── manual control ────────────────────────────────────────────────────────

    public void forceOpen(String reason) {
        Transition transition;
        lock.lock();
        try {
            transition = state == CircuitState.OPEN ? null : transitionTo(CircuitState.OPEN, "forced: " + reason);
            openedAt = clock.instant();
        } finally {
            lock.unlock();
        }
        notifyListeners(transition);
    }

    /**
     * Manual override: closes the breaker immediately regardless of its current state.
     *
     * <p>From OPEN this goes straight to CLOSED without a HALF_OPEN trial phase, so it is the
     * one transition that bypasses the normal OPEN → HALF_OPEN → CLOSED ordering. Listeners
     * see a single OPEN → CLOSED change. Window statistics are kept; use {@link #reset()} to
     * clear them as well.
     */
    public void forceClose() {
        Transition transition;
        lock.lock();
        try {
            transition = state == CircuitState.CLOSED ? null : transitionTo(CircuitState.CLOSED, "forced");
        } finally {
            lock.unlock();
        }
        notifyListeners(transition);
    }

    /** Returns the breaker to a fresh CLOSED state and clears all statistics. */
    public void reset() {
        Transition transition;
        lock.lock();
        try {
            transition = state == CircuitState.CLOSED ? null : transitionTo(CircuitState.CLOSED, "reset");
            totalCalls = 0;
            totalSuccesses = 0;
            totalFailures = 0;
            totalRejected = 0;
            totalSlowCalls = 0;
            averageResponseTimeMs = 0.0;
            lastFailureTime = null;
            failureHistory.clear();
            failuresByType.clear();
            currentFailureThreshold = config.failureThreshold();
            currentRecoveryTimeout  = config.recoveryTimeout();
            clearWindow();
        } finally {
            lock.unlock();
        }
        log.info("CIRCUIT_RESET name={}", name);
        notifyListeners(transition);
    }

    // ── read accessors ────────────────────────────────────────────────────────

    /** Current state as last transitioned; does not itself trigger OPEN → HALF_OPEN. */
    public CircuitState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public DegradationLevel getDegradationLevel() {
        lock.lock();
        try {
            return degradation;
        } finally {
            lock.unlock();
        }
    }

    public long getTotalFailures() {
        lock.lock();
        try {
            return totalFailures;
        } finally {
            lock.unlock();
        }
    }

    public long getTotalSuccesses() {
        lock.lock();
        try {
            return totalSuccesses;
        } finally {
            lock.unlock();
        }
    }

    /** Failure rate over the current sliding window; 0 when the window is empty. */
    public double getFailureRate() {
        lock.lock();
        try {
            return window.isEmpty() ? 0.0 : (double) windowFailures / window.size();
        } finally {
            lock.unlock();
        }
    }

    public int getWindowCalls() {
        lock.lock();
        try {
            return window.size();
        } finally {
            lock.unlock();
        }
    }

    public int getEffectiveFailureThreshold() {
        lock.lock();
        try {
            return effectiveThreshold();
        } finally {
            lock.unlock();
        }
    }

    public Duration getEffectiveRecoveryTimeout() {
        lock.lock();
        try {
            return currentRecoveryTimeout;
        } finally {
            lock.unlock();
        }
    }

    public CircuitBreakerReport report() {
        lock.lock();
        try {
            List<FailureRecord> recent = new ArrayList<>(failureHistory);
            int from = Math.max(0, recent.size() - REPORTED_FAILURES);
            int n = window.size();
            return new CircuitBreakerReport(
                name, state, degradation, n, windowFailures,
                n == 0 ? 0.0 : (double) windowFailures / n,
                n == 0 ? 0.0 : (double) windowSlowCalls / n,
                totalCalls, totalSuccesses, totalFailures, totalRejected, totalSlowCalls,
                averageResponseTimeMs, effectiveThreshold(), currentRecoveryTimeout.toMillis(),
                halfOpenCallCount, Map.copyOf(failuresByType),
                List.copyOf(recent.subList(from, recent.size())),
                stateChangedAt, lastFailureTime);
        } finally {
            lock.unlock();
        }
    }

    // ── internals (caller holds lock) ─────────────────────────────────────────

    private record Transition(CircuitState from, CircuitState to, DegradationLevel level) {}

    private Transition transitionTo(CircuitState target, String reason) {
        CircuitState from = state;
        Instant now = clock.instant();
        state = target;
        stateChangedAt = now;
        switch (target) {
            case OPEN -> {
                openedAt = now;
                double rate = window.isEmpty() ? 0.0 : (double) windowFailures / window.size();
                degradation = config.degradationFor(rate);
                halfOpenCallCount = 0;
                halfOpenSuccessCount = 0;
                log.warn("CIRCUIT_OPENED name={} from={} failureRate={} degradation={} reason={}",
                         name, from, String.format("%.2f", rate), degradation, reason);
            }
            case HALF_OPEN -> {
                halfOpenCallCount = 0;
                halfOpenSuccessCount = 0;
                degradation = degradation.relaxed();
                log.info("CIRCUIT_HALF_OPEN name={} degradation={} reason={}", name, degradation, reason);
            }
            case CLOSED -> {
                halfOpenCallCount = 0;
                halfOpenSuccessCount = 0;
                degradation = DegradationLevel.NONE;
                openedAt = null;
                clearWindow();
                log.info("CIRCUIT_CLOSED name={} from={} reason={}", name, from, reason);
            }
        }
        return new Transition(from, target, degradation);
    }

    private Transition evaluateTrip() {
        int n = window.size();
        if (n < config.effectiveMinimumCalls()) {
            return null;
        }
        double failureRate  = (double) windowFailures / n;
        double slowCallRate = (double) windowSlowCalls / n;
        if (windowFailures >= effectiveThreshold()) {
            return transitionTo(CircuitState.OPEN, "failures=" + windowFailures + " threshold=" + effectiveThreshold());
        }
        if (windowFailures > 0 && failureRate >= config.failureRateThreshold()) {
            return transitionTo(CircuitState.OPEN, "failureRate=" + String.format("%.2f", failureRate));
        }
        if (windowSlowCalls > 0 && slowCallRate >= config.slowCallRateThreshold()) {
            return transitionTo(CircuitState.OPEN, "slowCallRate=" + String.format("%.2f", slowCallRate));
        }
        return null;
    }

    private void adapt() {
        if (!config.adaptive() || window.size() < config.effectiveMinimumCalls()) {
            return;
        }
        double successRate = 1.0 - (double) windowFailures / window.size();
        double base = config.failureThreshold();
        long baseTimeout = config.recoveryTimeout().toMillis();
        long currentTimeout = currentRecoveryTimeout.toMillis();
        double f = config.adaptiveFactor();

        if (successRate > WIDEN_ABOVE) {
            currentFailureThreshold = Math.min(base * MAX_SCALE, currentFailureThreshold * (1 + f));
            currentRecoveryTimeout  = Duration.ofMillis(
                (long) Math.min(baseTimeout * MAX_SCALE, currentTimeout * (1 + f)));
        } else if (successRate < NARROW_BELOW) {
            currentFailureThreshold = Math.max(base * MIN_SCALE, currentFailureThreshold * (1 - f));
            currentRecoveryTimeout  = Duration.ofMillis(
                (long) Math.max(baseTimeout * MIN_SCALE, currentTimeout * (1 - f)));
        }
    }

    private int effectiveThreshold() {
        return Math.max(1, (int) Math.round(currentFailureThreshold));
    }

    private boolean recoveryElapsed() {
        return openedAt != null
            && !clock.instant().isBefore(openedAt.plus(currentRecoveryTimeout));
    }

    private void addToWindow(Outcome outcome) {
        window.addLast(outcome);
        if (!outcome.success()) windowFailures++;
        if (outcome.slow()) windowSlowCalls++;
        while (window.size() > config.windowSize()) {
            Outcome evicted = window.removeFirst();
            if (!evicted.success()) windowFailures--;
            if (evicted.slow()) windowSlowCalls--;
        }
    }

    private void clearWindow() {
        window.clear();
        windowFailures = 0;
        windowSlowCalls = 0;
    }

    private boolean isSlow(long ms) {
        return ms >= config.slowCallThreshold().toMillis();
    }

    private void updateAverage(long ms) {
        averageResponseTimeMs = totalCalls <= 1
            ? ms
            : RESPONSE_TIME_ALPHA * ms + (1 - RESPONSE_TIME_ALPHA) * averageResponseTimeMs;
    }

    private static long toMillis(Duration d) {
        return d == null ? 0L : Math.max(0L, d.toMillis());
    }

    private void notifyListeners(Transition transition) {
        if (transition == null) {
            return;
        }
        for (CircuitBreakerListener listener : listeners) {
            try {
                listener.onStateChange(name, transition.from(), transition.to(), transition.level());
            } catch (RuntimeException e) {
                log.warn("CIRCUIT_LISTENER_FAILED name={} listener={}", name, listener, e);
            }
        }
    }
}
