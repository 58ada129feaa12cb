package com.marketrouter.common.breaker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Owns one {@link CircuitBreaker} per provider id, all sharing the same configuration
 * and clock. Listeners registered here are attached to every breaker it creates,
 * including breakers created before the listener was added.
 */
public class CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ConcurrentHashMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final List<CircuitBreakerListener> listeners = new CopyOnWriteArrayList<>();

    public CircuitBreakerRegistry(CircuitBreakerConfig config) {
        this(config, Clock.systemUTC());
    }

    public CircuitBreakerRegistry(CircuitBreakerConfig config, Clock clock) {
        this.config = config;
        this.clock  = clock;
    }

    public CircuitBreaker getOrCreate(String name) {
        return breakers.computeIfAbsent(name, n -> {
            CircuitBreaker breaker = new CircuitBreaker(n, config, clock);
            listeners.forEach(breaker::addListener);
            log.debug("CIRCUIT_CREATED name={}", n);
            return breaker;
        });
    }

    public Optional<CircuitBreaker> find(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    public boolean remove(String name) {
        return breakers.remove(name) != null;
    }

    public void addListener(CircuitBreakerListener listener) {
        listeners.add(listener);
        breakers.values().forEach(b -> b.addListener(listener));
    }

    /** Reports of every breaker, sorted by name. */
    public Map<String, CircuitBreakerReport> reports() {
        Map<String, CircuitBreakerReport> sorted = new TreeMap<>();
        breakers.forEach((name, breaker) -> sorted.put(name, breaker.report()));
        return new LinkedHashMap<>(sorted);
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
        log.info("CIRCUIT_RESET_ALL count={}", breakers.size());
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }
}
