package com.marketrouter.common.breaker;

import com.marketrouter.common.exception.ProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * State machine, admission and reporting behaviour of {@link CircuitBreaker}.
 */
class CircuitBreakerTest {

    private static final Duration FAST = Duration.ofMillis(20);

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-02T09:30:00Z"));
    }

    private CircuitBreaker breaker(CircuitBreakerConfig config) {
        return new CircuitBreaker("provider-a", config, clock);
    }

    private static void fail(CircuitBreaker b, int times) {
        for (int i = 0; i < times; i++) {
            b.recordFailure(new RuntimeException("boom"), FAST);
        }
    }

    private static void succeed(CircuitBreaker b, int times) {
        for (int i = 0; i < times; i++) {
            b.recordSuccess(FAST);
        }
    }

    // ── tripping ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("CLOSED → OPEN")
    class Tripping {

        @Test
        @DisplayName("10 consecutive failures with threshold 5 / window 10 open the breaker")
        void tenFailuresOpen() {
            CircuitBreaker b = breaker(CircuitBreakerConfig.builder()
                .failureThreshold(5).windowSize(10).build());

            fail(b, 10);

            assertEquals(CircuitState.OPEN, b.getState());
            assertFalse(b.canExecute());
        }

        @Test
        @DisplayName("does not trip before the minimum sample count is reached")
        void respectsMinimumCalls() {
            CircuitBreaker b = breaker(CircuitBreakerConfig.builder()
                .failureThreshold(5).windowSize(10).minimumCalls(10).build());

            fail(b, 9);

            assertEquals(CircuitState.CLOSED, b.getState());
            assertTrue(b.canExecute());
        }

        @Test
        @DisplayName("failure rate at threshold trips even below the absolute threshold")
        void failureRateTrips() {
            CircuitBreaker b = breaker(CircuitBreakerConfig.builder()
                .failureThreshold(100).failureRateThreshold(0.5).windowSize(10).minimumCalls(10).build());

            succeed(b, 5);
            fail(b, 5);

            assertEquals(CircuitState.OPEN, b.getState());
        }

        @Test
        @DisplayName("slow successes trip on slow-call rate")
        void slowCallsTrip() {
            CircuitBreaker b = breaker(CircuitBreakerConfig.builder()
                .windowSize(10).minimumCalls(10).slowCallThreshold(Duration.ofSeconds(1))
                .slowCallRateThreshold(0.3).build());

            succeed(b, 7);
            for (int i = 0; i < 3; i++) {
                b.recordSuccess(Duration.ofSeconds(2));
            }

            assertEquals(CircuitState.OPEN, b.getState());
        }

        @Test
        @DisplayName("window never exceeds its configured size")
        void windowBounded() {
            CircuitBreaker b = breaker(CircuitBreakerConfig.builder()
                .windowSize(10).failureThreshold(50).failureRateThreshold(1.0).build());

            succeed(b, 25);

            assertEquals(10, b.getWindowCalls());
        }

        @Test
        @DisplayName("degradation follows the failure rate when opening")
        void degradationFromRate() {
            CircuitBreaker b = breaker(CircuitBreakerConfig.builder().windowSize(10).build());

            fail(b, 10);

            assertEquals(DegradationLevel.CRITICAL, b.getDegradationLevel());
        }
    }

    // ── recovery ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("OPEN → HALF_OPEN → CLOSED / OPEN")
    class Recovery {

        private CircuitBreaker opened;

        @BeforeEach
        void open() {
            opened = breaker(CircuitBreakerConfig.builder()
                .windowSize(10).failureThreshold(5).recoveryTimeout(Duration.ofSeconds(60))
                .halfOpenMaxCalls(3).successThreshold(2).build());
            fail(opened, 10);
            assertEquals(CircuitState.OPEN, opened.getState());
        }

        @Test
        @DisplayName("stays closed to calls until the recovery timeout elapses")
        void rejectsUntilTimeout() {
            clock.advance(Duration.ofSeconds(59));
            assertFalse(opened.canExecute());
            assertFalse(opened.isCallPermitted());

            clock.advance(Duration.ofSeconds(1));
            assertTrue(opened.isCallPermitted());
            assertTrue(opened.canExecute());
            assertEquals(CircuitState.HALF_OPEN, opened.getState());
        }

        @Test
        @DisplayName("half-open hands out at most halfOpenMaxCalls permits")
        void halfOpenBound() {
            clock.advance(Duration.ofSeconds(60));

            int permitted = 0;
            for (int i = 0; i < 10; i++) {
                if (opened.canExecute()) {
                    permitted++;
                }
            }

            assertEquals(3, permitted);
            assertEquals(CircuitState.HALF_OPEN, opened.getState());
        }

        @Test
        @DisplayName("successThreshold probe successes close the breaker")
        void probesClose() {
            clock.advance(Duration.ofSeconds(60));
            assertTrue(opened.canExecute());
            opened.recordSuccess(FAST);
            assertEquals(CircuitState.HALF_OPEN, opened.getState());
            assertTrue(opened.canExecute());
            opened.recordSuccess(FAST);

            assertEquals(CircuitState.CLOSED, opened.getState());
            assertEquals(DegradationLevel.NONE, opened.getDegradationLevel());
            assertEquals(0, opened.getWindowCalls());
        }

        @Test
        @DisplayName("any probe failure reopens immediately")
        void probeFailureReopens() {
            clock.advance(Duration.ofSeconds(60));
            assertTrue(opened.canExecute());
            opened.recordFailure(new TimeoutException("slow"), FAST);

            assertEquals(CircuitState.OPEN, opened.getState());
            assertFalse(opened.canExecute());
        }

        @Test
        @DisplayName("OPEN never reaches CLOSED without passing HALF_OPEN")
        void transitionsPassThroughHalfOpen() {
            List<CircuitState[]> transitions = new ArrayList<>();
            opened.addListener((name, from, to, level) -> transitions.add(new CircuitState[] {from, to}));

            clock.advance(Duration.ofSeconds(60));
            opened.canExecute();
            opened.recordSuccess(FAST);
            opened.canExecute();
            opened.recordSuccess(FAST);

            assertEquals(2, transitions.size());
            assertArrayEquals(new CircuitState[] {CircuitState.OPEN, CircuitState.HALF_OPEN}, transitions.get(0));
            assertArrayEquals(new CircuitState[] {CircuitState.HALF_OPEN, CircuitState.CLOSED}, transitions.get(1));
        }

        @Test
        @DisplayName("entering half-open relaxes degradation by one level")
        void halfOpenRelaxesDegradation() {
            DegradationLevel before = opened.getDegradationLevel();
            clock.advance(Duration.ofSeconds(60));
            opened.canExecute();

            assertEquals(before.relaxed(), opened.getDegradationLevel());
        }
    }

    // ── adaptive mode ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("adaptive mode")
    class Adaptive {

        @Test
        @DisplayName("high success rate widens threshold, capped at 1.5x")
        void widens() {
            CircuitBreaker b = breaker(CircuitBreakerConfig.builder()
                .windowSize(10).failureThreshold(4).adaptive(true).adaptiveFactor(0.1).build());

            succeed(b, 100);

            assertEquals(6, b.getEffectiveFailureThreshold());
            assertEquals(Duration.ofSeconds(90), b.getEffectiveRecoveryTimeout());
        }

        @Test
        @DisplayName("low success rate narrows threshold, floored at 0.5x")
        void narrows() {
            CircuitBreaker b = breaker(CircuitBreakerConfig.builder()
                .windowSize(10).minimumCalls(10).failureThreshold(10).failureRateThreshold(1.0)
                .adaptive(true).adaptiveFactor(0.1).build());

            for (int i = 0; i < 40; i++) {
                b.recordSuccess(FAST);
                b.recordSuccess(FAST);
                b.recordFailure(new RuntimeException("x"), FAST);
                if (b.getState() == CircuitState.OPEN) {
                    break;
                }
            }

            assertTrue(b.getEffectiveFailureThreshold() < 10);
            assertTrue(b.getEffectiveFailureThreshold() >= 5);
        }
    }

    // ── manual control and reporting ─────────────────────────────────────────

    @Nested
    @DisplayName("manual control and report")
    class ControlAndReport {

        @Test
        @DisplayName("forceOpen rejects calls; reset restores a clean closed breaker")
        void forceOpenAndReset() {
            CircuitBreaker b = breaker(CircuitBreakerConfig.defaults());
            b.recordFailure(new ConnectException("refused"), FAST);

            b.forceOpen("maintenance");
            assertFalse(b.canExecute());

            b.reset();
            assertEquals(CircuitState.CLOSED, b.getState());
            assertEquals(0, b.getTotalFailures());
            assertTrue(b.canExecute());
        }

        @Test
        @DisplayName("forceClose skips HALF_OPEN and keeps the window statistics")
        void forceCloseBypassesHalfOpen() {
            CircuitBreaker b = breaker(CircuitBreakerConfig.defaults());
            b.recordFailure(new ConnectException("refused"), FAST);
            b.forceOpen("maintenance");
            List<CircuitState[]> transitions = new ArrayList<>();
            b.addListener((name, from, to, level) -> transitions.add(new CircuitState[] {from, to}));

            b.forceClose();

            assertEquals(1, transitions.size());
            assertArrayEquals(new CircuitState[] {CircuitState.OPEN, CircuitState.CLOSED}, transitions.get(0));
            assertEquals(DegradationLevel.NONE, b.getDegradationLevel());
            assertEquals(1, b.getTotalFailures());
            assertTrue(b.canExecute());
        }

        @Test
        @DisplayName("report counts failures by classified type and keeps the last five")
        void reportContents() {
            CircuitBreaker b = breaker(CircuitBreakerConfig.builder().failureThreshold(100)
                .failureRateThreshold(1.0).build());
            b.recordFailure(new TimeoutException("t"), FAST);
            b.recordFailure(new ConnectException("c"), FAST);
            b.recordFailure(new ProviderException("provider-a", FailureType.RATE_LIMIT, "slow down"), FAST);
            for (int i = 0; i < 4; i++) {
                b.recordFailure(new RuntimeException("HTTP 503 service unavailable"), FAST);
            }
            b.recordSuccess(FAST);

            CircuitBreakerReport report = b.report();

            assertEquals(8, report.totalCalls());
            assertEquals(7, report.totalFailures());
            assertEquals(1L, report.failuresByType().get(FailureType.TIMEOUT));
            assertEquals(1L, report.failuresByType().get(FailureType.CONNECTION));
            assertEquals(1L, report.failuresByType().get(FailureType.RATE_LIMIT));
            assertEquals(4L, report.failuresByType().get(FailureType.SERVER_ERROR));
            assertEquals(5, report.recentFailures().size());
        }
    }

    // ── classification ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("FailureClassifier")
    class Classification {

        @Test
        void byType() {
            assertEquals(FailureType.TIMEOUT, FailureClassifier.classify(new TimeoutException()));
            assertEquals(FailureType.CONNECTION, FailureClassifier.classify(new ConnectException()));
            assertEquals(FailureType.DATA_QUALITY, FailureClassifier.classify(new NumberFormatException("x")));
        }

        @Test
        void byMessage() {
            assertEquals(FailureType.RATE_LIMIT, FailureClassifier.classify(new RuntimeException("Too Many Requests")));
            assertEquals(FailureType.SERVER_ERROR, FailureClassifier.classify(new RuntimeException("bad gateway")));
            assertEquals(FailureType.DATA_QUALITY, FailureClassifier.classify(new IllegalStateException("empty reply")));
            assertEquals(FailureType.UNKNOWN, FailureClassifier.classify(new RuntimeException("weird")));
        }

        @Test
        void unwrapsExecutionWrappers() {
            assertEquals(FailureType.TIMEOUT, FailureClassifier.classify(
                new CompletionException(new TimeoutException("t"))));
            assertEquals(FailureType.CONNECTION, FailureClassifier.classify(
                new ExecutionException(new ConnectException("refused"))));
        }
    }
}
