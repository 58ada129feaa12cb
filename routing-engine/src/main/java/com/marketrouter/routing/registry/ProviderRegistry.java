package com.marketrouter.routing.registry;

import com.marketrouter.common.breaker.CircuitBreaker;
import com.marketrouter.common.breaker.CircuitBreakerRegistry;
import com.marketrouter.common.breaker.CircuitState;
import com.marketrouter.common.breaker.FailureClassifier;
import com.marketrouter.common.model.AssetType;
import com.marketrouter.common.model.DataType;
import com.marketrouter.common.model.HealthCheckResult;
import com.marketrouter.common.model.ProviderCapability;
import com.marketrouter.common.provider.DataSourceProvider;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns every registered provider, its capability, its health/metrics record and its
 * circuit breaker, plus the derived capability and market indexes.
 *
 * <p>All maps are guarded by one {@link ReentrantReadWriteLock}: routing reads take the
 * read lock, registration and metric updates take the write lock. Provider calls
 * (health probes, disconnect) always happen outside the lock. Routing code only ever
 * sees {@link ProviderSnapshot} copies.
 *
 * <h3>Health score</h3>
 * <pre>
 *   health = 0.5 × successRate
 *          + 0.3 × breakerScore          CLOSED 1.0, HALF_OPEN 0.5, OPEN 0.0
 *          + 0.2 × max(0, 1 − avgResponseTimeMs / responseTimeBaselineMs)
 * </pre>
 * Recomputed after every recorded outcome and every breaker transition.
 */
public class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    static final double SUCCESS_WEIGHT = 0.5;
    static final double BREAKER_WEIGHT = 0.3;
    static final double LATENCY_WEIGHT = 0.2;

    private static final Map<DataType, Double> LATENCY_BASELINE_MS = new EnumMap<>(DataType.class);

    static {
        LATENCY_BASELINE_MS.put(DataType.HISTORICAL_KLINE, 2_000.0);
        LATENCY_BASELINE_MS.put(DataType.REAL_TIME_QUOTE, 500.0);
    }

    static final double DEFAULT_BASELINE_MS = 3_000.0;

    private record IndexKey(DataType dataType, AssetType assetType) {}

    private record ProviderEntry(
        String id,
        DataSourceProvider provider,
        ProviderCapability capability,
        double weight,
        ProbeMethod probeMethod,
        Instant registeredAt
    ) {}

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, ProviderEntry> providers = new LinkedHashMap<>();
    private final Map<String, ProviderMetrics> metrics = new HashMap<>();
    private final Map<IndexKey, List<String>> capabilityIndex = new HashMap<>();
    private final Map<String, Set<String>> marketIndex = new HashMap<>();

    private final CircuitBreakerRegistry breakers;
    private final RegistrySettings settings;
    private final Clock clock;
    private Instant lastHealthCheck;

    public ProviderRegistry(CircuitBreakerRegistry breakers) {
        this(breakers, RegistrySettings.defaults(), Clock.systemUTC());
    }

    public ProviderRegistry(CircuitBreakerRegistry breakers, RegistrySettings settings, Clock clock) {
        this.breakers = breakers;
        this.settings = settings;
        this.clock    = clock;
        breakers.addListener((name, from, to, level) -> onBreakerTransition(name, to));
    }

    // ── registration ──────────────────────────────────────────────────────────

    public boolean register(String providerId, Object provider) {
        return register(providerId, provider, -1, 1.0);
    }

    /**
     * Registers {@code provider} under {@code providerId}.
     *
     * <p>Priority resolution: a non-negative {@code priority} argument wins; otherwise a
     * priority the provider declared itself; otherwise {@link CapabilityInference#autoPriority}.
     *
     * @return false when the id is blank or taken, the object is not a data source, or it
     *         has no usable extraction method
     */
    public boolean register(String providerId, Object provider, int priority, double weight) {
        if (StringUtils.isBlank(providerId) || provider == null) {
            log.warn("PROVIDER_REGISTER_REJECTED providerId={} reason=missing id or provider", providerId);
            return false;
        }
        Optional<ProbeMethod> probe = ProviderProbe.probe(provider);
        if (probe.isEmpty()) {
            log.debug("PROVIDER_REGISTER_REJECTED providerId={} reason=not a data source type={}",
                      providerId, provider.getClass().getName());
            return false;
        }

        DataSourceProvider adapted;
        if (provider instanceof DataSourceProvider direct) {
            adapted = direct;
        } else {
            Optional<ReflectiveProviderAdapter> reflective = ReflectiveProviderAdapter.adapt(providerId, provider);
            if (reflective.isEmpty()) {
                log.warn("PROVIDER_REGISTER_REJECTED providerId={} reason=no extraction method probe={}",
                         providerId, probe.get());
                return false;
            }
            adapted = reflective.get();
        }

        ProviderCapability capability;
        try {
            capability = CapabilityInference.complete(
                providerId + " " + provider.getClass().getSimpleName(), adapted.getCapabilities());
        } catch (RuntimeException e) {
            log.warn("PROVIDER_REGISTER_REJECTED providerId={} reason=capability lookup failed error={}",
                     providerId, e.getMessage());
            return false;
        }
        int resolvedPriority = priority >= 0 ? priority
            : capability.priority() != ProviderCapability.DEFAULT_PRIORITY ? capability.priority()
            : CapabilityInference.autoPriority(providerId + " " + provider.getClass().getSimpleName(),
                                               capability.dataTypes());
        capability = capability.withPriority(resolvedPriority);

        ProviderEntry entry = new ProviderEntry(providerId, adapted, capability,
            weight > 0 ? weight : 1.0, probe.get(), clock.instant());

        lock.writeLock().lock();
        try {
            if (providers.containsKey(providerId)) {
                log.warn("PROVIDER_REGISTER_REJECTED providerId={} reason=already registered", providerId);
                return false;
            }
            providers.put(providerId, entry);
            metrics.put(providerId, new ProviderMetrics(capability.qualityRating()));
            rebuildIndexes();
        } finally {
            lock.writeLock().unlock();
        }
        breakers.getOrCreate(providerId);

        log.info("PROVIDER_REGISTERED providerId={} probe={} priority={} weight={} assetTypes={} dataTypes={} markets={}",
                 providerId, probe.get(), resolvedPriority, entry.weight(),
                 capability.assetTypes(), capability.dataTypes(), capability.markets());
        return true;
    }

    public boolean deregister(String providerId) {
        ProviderEntry removed;
        lock.writeLock().lock();
        try {
            removed = providers.remove(providerId);
            if (removed == null) {
                return false;
            }
            metrics.remove(providerId);
            rebuildIndexes();
        } finally {
            lock.writeLock().unlock();
        }
        breakers.remove(providerId);
        try {
            removed.provider().disconnect();
        } catch (RuntimeException e) {
            log.warn("PROVIDER_DISCONNECT_FAILED providerId={} error={}", providerId, e.getMessage());
        }
        log.info("PROVIDER_DEREGISTERED providerId={}", providerId);
        return true;
    }

    /**
     * Bulk registration. Candidates are tried in map order; each gets one outcome.
     */
    public Map<String, DiscoveryOutcome> discover(Map<String, ?> candidates) {
        Map<String, DiscoveryOutcome> outcomes = new LinkedHashMap<>();
        candidates.forEach((id, candidate) -> {
            if (ProviderProbe.probe(candidate).isEmpty()) {
                outcomes.put(id, DiscoveryOutcome.SKIPPED_NOT_DATA_SOURCE);
            } else {
                outcomes.put(id, register(id, candidate) ? DiscoveryOutcome.REGISTERED : DiscoveryOutcome.FAILED);
            }
        });
        log.info("PROVIDER_DISCOVERY_COMPLETE candidates={} registered={}", candidates.size(),
                 outcomes.values().stream().filter(o -> o == DiscoveryOutcome.REGISTERED).count());
        return outcomes;
    }

    // caller holds the write lock
    private void rebuildIndexes() {
        capabilityIndex.clear();
        marketIndex.clear();
        Comparator<ProviderEntry> order = Comparator
            .comparingInt((ProviderEntry e) -> e.capability().priority())
            .thenComparing(ProviderEntry::id);
        List<ProviderEntry> sorted = new ArrayList<>(providers.values());
        sorted.sort(order);
        for (ProviderEntry e : sorted) {
            for (DataType dt : e.capability().dataTypes()) {
                for (AssetType at : e.capability().assetTypes()) {
                    List<String> bucket = capabilityIndex.computeIfAbsent(new IndexKey(dt, at), k -> new ArrayList<>());
                    if (!bucket.contains(e.id())) {
                        bucket.add(e.id());
                    }
                }
            }
            for (String market : e.capability().markets()) {
                marketIndex.computeIfAbsent(market, k -> new LinkedHashSet<>()).add(e.id());
            }
        }
    }

    // ── lookup ────────────────────────────────────────────────────────────────

    /**
     * Eligible provider ids in index order (priority ascending, then id).
     *
     * <p>Excluded: DISABLED providers, ERROR providers whose last probe is younger than the
     * health grace period, and providers whose breaker currently rejects calls. The market
     * filter applies only when some provider declares that market.
     */
    public List<String> getAvailable(DataType dataType, AssetType assetType, String market) {
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            List<String> bucket = capabilityIndex.getOrDefault(new IndexKey(dataType, assetType), List.of());
            boolean filterMarket = market != null && marketIndex.containsKey(market);
            List<String> out = new ArrayList<>(bucket.size());
            for (String id : bucket) {
                ProviderEntry entry = providers.get(id);
                if (filterMarket && !entry.capability().supportsMarket(market)) {
                    continue;
                }
                if (!statusAllows(metrics.get(id), now)) {
                    continue;
                }
                if (!breakers.getOrCreate(id).isCallPermitted()) {
                    continue;
                }
                out.add(id);
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    private boolean statusAllows(ProviderMetrics m, Instant now) {
        return switch (m.status) {
            case DISABLED, INACTIVE -> false;
            case ERROR -> m.lastHealthCheck == null
                || Duration.between(m.lastHealthCheck, now).compareTo(settings.healthGracePeriod()) >= 0;
            default -> true;
        };
    }

    public boolean isRegistered(String providerId) {
        lock.readLock().lock();
        try {
            return providers.containsKey(providerId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<DataSourceProvider> getProvider(String providerId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(providers.get(providerId)).map(ProviderEntry::provider);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<ProviderCapability> getCapability(String providerId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(providers.get(providerId)).map(ProviderEntry::capability);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<ProbeMethod> getProbeMethod(String providerId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(providers.get(providerId)).map(ProviderEntry::probeMethod);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> providerIds() {
        lock.readLock().lock();
        try {
            return List.copyOf(providers.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Breaker of a registered provider. Never creates one; empty after deregistration. */
    public Optional<CircuitBreaker> circuitBreaker(String providerId) {
        return breakers.find(providerId);
    }

    public CircuitBreakerRegistry getCircuitBreakers() {
        return breakers;
    }

    // ── outcomes ──────────────────────────────────────────────────────────────

    /**
     * Updates the metrics record only. A negative or NaN {@code qualityScore} means
     * "no quality sample" and leaves the quality EWMA untouched.
     */
    public void recordOutcome(String providerId, boolean success, long latencyMs, double qualityScore) {
        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            ProviderMetrics m = metrics.get(providerId);
            if (m == null) {
                log.debug("OUTCOME_IGNORED providerId={} reason=not registered", providerId);
                return;
            }
            m.record(success, latencyMs, Double.isNaN(qualityScore) ? -1 : qualityScore, settings.ewmaAlpha(), now);
            if (success && (m.status == ProviderStatus.UNKNOWN || m.status == ProviderStatus.ERROR)) {
                m.status = ProviderStatus.ACTIVE;
            }
            refreshHealth(providerId, m);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Records a successful call against both the breaker and the metrics record. Outcomes for
     * providers that are no longer registered are dropped.
     */
    public void recordSuccess(String providerId, Duration latency, double qualityScore) {
        breakers.find(providerId).ifPresent(b -> b.recordSuccess(latency));
        recordOutcome(providerId, true, latency.toMillis(), qualityScore);
    }

    /** Records a failed call against both the breaker and the metrics record. */
    public void recordFailure(String providerId, Throwable error, Duration latency) {
        breakers.find(providerId).ifPresent(b -> b.recordFailure(error, latency));
        recordOutcome(providerId, false, latency.toMillis(), -1);
        log.debug("PROVIDER_FAILURE_RECORDED providerId={} type={}", providerId, FailureClassifier.classify(error));
    }

    /** Increments the in-flight counter. Lock-free. */
    public void acquire(String providerId) {
        ProviderMetrics m = metricsUnlocked(providerId);
        if (m != null) {
            m.load.incrementAndGet();
        }
    }

    public void release(String providerId) {
        ProviderMetrics m = metricsUnlocked(providerId);
        if (m != null) {
            m.load.updateAndGet(v -> Math.max(0, v - 1));
        }
    }

    private ProviderMetrics metricsUnlocked(String providerId) {
        lock.readLock().lock();
        try {
            return metrics.get(providerId);
        } finally {
            lock.readLock().unlock();
        }
    }

    private void onBreakerTransition(String providerId, CircuitState to) {
        lock.writeLock().lock();
        try {
            ProviderMetrics m = metrics.get(providerId);
            if (m != null) {
                refreshHealth(providerId, m);
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("PROVIDER_CIRCUIT_TRANSITION providerId={} state={}", providerId, to);
    }

    // caller holds the write lock
    private void refreshHealth(String providerId, ProviderMetrics m) {
        CircuitState state = breakers.getOrCreate(providerId).getState();
        double breakerScore = switch (state) {
            case CLOSED -> 1.0;
            case HALF_OPEN -> 0.5;
            case OPEN -> 0.0;
        };
        double latencyScore = Math.max(0.0, 1.0 - m.avgResponseTimeMs / settings.responseTimeBaselineMs());
        m.healthScore = SUCCESS_WEIGHT * m.successRate() + BREAKER_WEIGHT * breakerScore + LATENCY_WEIGHT * latencyScore;
    }

    // ── status ────────────────────────────────────────────────────────────────

    public boolean enable(String providerId) {
        return setStatus(providerId, ProviderStatus.ACTIVE);
    }

    public boolean disable(String providerId) {
        return setStatus(providerId, ProviderStatus.DISABLED);
    }

    private boolean setStatus(String providerId, ProviderStatus status) {
        lock.writeLock().lock();
        try {
            ProviderMetrics m = metrics.get(providerId);
            if (m == null) {
                return false;
            }
            m.status = status;
        } finally {
            lock.writeLock().unlock();
        }
        log.info("PROVIDER_STATUS_CHANGED providerId={} status={}", providerId, status);
        return true;
    }

    // ── health checks ─────────────────────────────────────────────────────────

    /**
     * Probes every provider sequentially, outside the lock. A probe that throws counts as
     * unhealthy. DISABLED providers are probed but keep their status.
     */
    public Map<String, HealthCheckResult> performHealthCheck() {
        Map<String, HealthCheckResult> results = new LinkedHashMap<>();
        for (String id : providerIds()) {
            performHealthCheck(id).ifPresent(r -> results.put(id, r));
        }
        lock.writeLock().lock();
        try {
            lastHealthCheck = clock.instant();
        } finally {
            lock.writeLock().unlock();
        }
        long healthy = results.values().stream().filter(HealthCheckResult::healthy).count();
        log.info("HEALTH_CHECK_COMPLETE providers={} healthy={}", results.size(), healthy);
        return results;
    }

    public Optional<HealthCheckResult> performHealthCheck(String providerId) {
        Optional<DataSourceProvider> provider = getProvider(providerId);
        if (provider.isEmpty()) {
            return Optional.empty();
        }
        long start = System.nanoTime();
        HealthCheckResult result;
        try {
            result = provider.get().healthCheck();
            if (result == null) {
                result = HealthCheckResult.unhealthy("health check returned nothing", elapsedMs(start));
            }
        } catch (RuntimeException e) {
            result = HealthCheckResult.unhealthy(e.getMessage(), elapsedMs(start));
        }

        lock.writeLock().lock();
        try {
            ProviderMetrics m = metrics.get(providerId);
            if (m == null) {
                return Optional.of(result);
            }
            m.lastHealthCheck = clock.instant();
            m.lastHealthMessage = result.message();
            if (m.status != ProviderStatus.DISABLED) {
                m.status = result.healthy() ? ProviderStatus.ACTIVE : ProviderStatus.ERROR;
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (!result.healthy()) {
            log.warn("PROVIDER_UNHEALTHY providerId={} message={}", providerId, result.message());
        }
        return Optional.of(result);
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    // ── snapshots & reports ───────────────────────────────────────────────────

    public Optional<ProviderSnapshot> snapshot(String providerId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(providers.get(providerId)).map(this::toSnapshot);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Snapshots for the given ids, in the given order; unknown ids are skipped. */
    public Map<String, ProviderSnapshot> snapshots(Collection<String> providerIds) {
        lock.readLock().lock();
        try {
            Map<String, ProviderSnapshot> out = new LinkedHashMap<>();
            for (String id : providerIds) {
                ProviderEntry e = providers.get(id);
                if (e != null) {
                    out.put(id, toSnapshot(e));
                }
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, ProviderSnapshot> allSnapshots() {
        return snapshots(providerIds());
    }

    // caller holds a lock
    private ProviderSnapshot toSnapshot(ProviderEntry e) {
        ProviderMetrics m = metrics.get(e.id());
        return new ProviderSnapshot(
            e.id(), e.capability(), m.status, e.weight(),
            m.totalRequests, m.successRequests, m.failedRequests,
            m.avgResponseTimeMs, m.qualityScore, m.availabilityScore,
            m.load.get(), m.healthScore, breakers.getOrCreate(e.id()).getState(),
            m.recentErrorRate(), m.recentCalls(),
            m.lastSuccess, m.lastFailure, m.lastHealthCheck, m.lastHealthMessage);
    }

    public Optional<ProviderPerformanceReport> performanceReport(String providerId) {
        return snapshot(providerId).map(s -> {
            double baseline = s.capability().dataTypes().stream()
                .mapToDouble(dt -> LATENCY_BASELINE_MS.getOrDefault(dt, DEFAULT_BASELINE_MS))
                .min().orElse(DEFAULT_BASELINE_MS);
            double latencyScore = s.avgResponseTimeMs() <= baseline ? 1.0 : baseline / s.avgResponseTimeMs();
            double score = 0.4 * s.successRate() + 0.3 * latencyScore + 0.3 * s.qualityScore();

            List<String> recommendations = new ArrayList<>();
            if (s.successRate() < 0.9) {
                recommendations.add("success rate below 90%, check provider errors");
            }
            if (s.avgResponseTimeMs() > baseline) {
                recommendations.add("average response time above " + (long) baseline + "ms baseline");
            }
            if (s.qualityScore() < 0.7) {
                recommendations.add("data quality below 0.7, review field mappings");
            }
            if (s.circuitState() != CircuitState.CLOSED) {
                recommendations.add("circuit breaker is " + s.circuitState());
            }
            return new ProviderPerformanceReport(
                providerId, ProviderPerformanceReport.grade(score), score, s.successRate(),
                s.avgResponseTimeMs(), baseline, s.qualityScore(), s.availabilityScore(),
                s.healthScore(), s.totalRequests(), s.circuitState(), List.copyOf(recommendations));
        });
    }

    public RegistryStatistics statistics() {
        lock.readLock().lock();
        try {
            int active = 0, error = 0, disabled = 0, unknown = 0;
            long total = 0, success = 0;
            for (ProviderMetrics m : metrics.values()) {
                switch (m.status) {
                    case ACTIVE -> active++;
                    case ERROR -> error++;
                    case DISABLED -> disabled++;
                    case UNKNOWN -> unknown++;
                    default -> { }
                }
                total += m.totalRequests;
                success += m.successRequests;
            }
            return new RegistryStatistics(
                providers.size(), active, error, disabled, unknown, total,
                total == 0 ? 1.0 : (double) success / total,
                capabilityIndex.size(), marketIndex.size(), lastHealthCheck);
        } finally {
            lock.readLock().unlock();
        }
    }

    // ── lifecycle ─────────────────────────────────────────────────────────────

    /** Disconnects every provider. Registrations stay in place. */
    public void disconnectAll() {
        for (String id : providerIds()) {
            getProvider(id).ifPresent(p -> {
                try {
                    p.disconnect();
                } catch (RuntimeException e) {
                    log.warn("PROVIDER_DISCONNECT_FAILED providerId={} error={}", id, e.getMessage());
                }
            });
        }
    }
}
