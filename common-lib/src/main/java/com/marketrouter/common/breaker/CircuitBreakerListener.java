package com.marketrouter.common.breaker;

/**
 * Notified after every state transition, outside the breaker's lock.
 */
@FunctionalInterface
public interface CircuitBreakerListener {

    void onStateChange(String name, CircuitState from, CircuitState to, DegradationLevel level);
}
