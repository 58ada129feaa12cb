package com.marketrouter.marketdata.pipeline;

import com.marketrouter.common.breaker.CircuitBreaker;
import com.marketrouter.common.breaker.FailureClassifier;
import com.marketrouter.common.breaker.FailureType;
import com.marketrouter.common.exception.CircuitOpenException;
import com.marketrouter.common.exception.ConfigurationException;
import com.marketrouter.common.exception.ProviderException;
import com.marketrouter.common.exception.ProvidersExhaustedException;
import com.marketrouter.common.model.DataTable;
import com.marketrouter.common.model.FailoverResult;
import com.marketrouter.common.model.HealthCheckResult;
import com.marketrouter.common.model.RoutingRequest;
import com.marketrouter.common.model.SourceInfo;
import com.marketrouter.common.model.StandardQuery;
import com.marketrouter.common.model.StandardResult;
import com.marketrouter.common.provider.DataSourceProvider;
import com.marketrouter.common.trace.TraceContextUtil;
import com.marketrouter.marketdata.transform.DataTransformer;
import com.marketrouter.marketdata.transform.TransformedData;
import com.marketrouter.routing.intelligent.IntelligentRoutingEngine;
import com.marketrouter.routing.intelligent.RoutingDecision;
import com.marketrouter.routing.registry.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Query in, validated and scored result out.
 *
 * <h3>Stages</h3>
 * <pre>
 *   1 transform query     StandardQuery → RoutingRequest (timeout, retry budget, priority, extras, trace id)
 *   2 resolve candidates  explicit provider alone (unknown → ConfigurationException), else registry lookup
 *   3 extract + failover  ranked order, one provider at a time, each guarded by its breaker
 *   4 transform data      field mapping, type coercion, null cleaning, quality score
 *   5 cache + return      successful results cached by query signature
 * </pre>
 *
 * <h3>Failover rules</h3>
 * <ul>
 *   <li>At most {@code retryCount + 1} providers are invoked; only one when the query
 *       disables fallback.</li>
 *   <li>A provider whose breaker rejects the call is skipped and not counted as an attempt.</li>
 *   <li>The query timeout is one budget shared by every attempt. Once it is spent the
 *       remaining candidates are skipped.</li>
 *   <li>An empty reply, or a reply in which no required field survives mapping, is a
 *       DATA_QUALITY failure of that provider.</li>
 * </ul>
 * Every attempt's outcome is recorded on the registry (breaker and metrics) and on the
 * routing engine. Total exhaustion yields a failed result, never an exception;
 * configuration errors are thrown.
 *
 * <p>The pipeline owns its references to the registry and the routing engine; neither
 * calls back into it.
 */
public class ExtractTransformPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExtractTransformPipeline.class);

    static final String EXPLICIT_STRATEGY = "EXPLICIT";

    private record Attempted(FailoverResult failover, TransformedData transformed) {}

    private final ProviderRegistry registry;
    private final IntelligentRoutingEngine routingEngine;
    private final DataTransformer transformer;
    private final QueryResultCache resultCache;
    private final PipelineSettings settings;
    private final Scheduler workers;
    private final Clock clock;

    private final AtomicLong totalRequests      = new AtomicLong();
    private final AtomicLong successfulRequests = new AtomicLong();
    private final AtomicLong failedRequests     = new AtomicLong();
    private final AtomicLong cacheHits          = new AtomicLong();
    private final AtomicLong failovers          = new AtomicLong();
    private final AtomicLong exhausted          = new AtomicLong();
    private final AtomicLong totalProcessingMs  = new AtomicLong();

    public ExtractTransformPipeline(ProviderRegistry registry, IntelligentRoutingEngine routingEngine,
                                    DataTransformer transformer, PipelineSettings settings, Clock clock) {
        this(registry, routingEngine, transformer, settings,
             Schedulers.newBoundedElastic(settings.workerPoolSize(), Integer.MAX_VALUE, "extract"), clock);
    }

    public ExtractTransformPipeline(ProviderRegistry registry, IntelligentRoutingEngine routingEngine,
                                    DataTransformer transformer, PipelineSettings settings,
                                    Scheduler workers, Clock clock) {
        this.registry      = registry;
        this.routingEngine = routingEngine;
        this.transformer   = transformer;
        this.settings      = settings;
        this.resultCache   = new QueryResultCache(settings.resultCacheTtl(), settings.resultCacheMaxSize(), clock);
        this.workers       = workers;
        this.clock         = clock;
    }

    // ── entry points ──────────────────────────────────────────────────────────

    /**
     * Runs the full pipeline on the calling thread.
     *
     * @throws ConfigurationException when the query names an unknown provider
     */
    public StandardResult process(StandardQuery query) {
        return process(query, TraceContextUtil.newTraceId());
    }

    /**
     * Same semantics as {@link #process(StandardQuery)} off the caller's thread. A trace id
     * already in the Reactor context is reused.
     */
    public Mono<StandardResult> processAsync(StandardQuery query) {
        return Mono.deferContextual(ctx -> {
                String traceId = ctx.hasKey(TraceContextUtil.TRACE_ID_KEY)
                    ? TraceContextUtil.getTraceId(ctx)
                    : TraceContextUtil.newTraceId();
                return Mono.fromCallable(() -> process(query, traceId));
            })
            .subscribeOn(Schedulers.boundedElastic());
    }

    StandardResult process(StandardQuery query, String traceId) {
        long started = clock.millis();
        totalRequests.incrementAndGet();

        if (settings.cacheEnabled()) {
            StandardResult cached = resultCache.get(query.signature());
            if (cached != null) {
                cacheHits.incrementAndGet();
                successfulRequests.incrementAndGet();
                long elapsed = clock.millis() - started;
                totalProcessingMs.addAndGet(elapsed);
                TraceContextUtil.withMdc(traceId, () ->
                    log.info("RESULT_CACHE_HIT symbol={} dataType={} traceId={}", query.symbol(), query.dataType(), traceId));
                return cached.asCached(elapsed);
            }
        }

        RoutingRequest request = toRoutingRequest(query, traceId);
        List<String> candidates = resolveCandidates(query);
        if (candidates.isEmpty()) {
            return fail(query, started, traceId, null,
                        "no provider available for " + query.assetType() + "/" + query.dataType()
                        + (query.market() == null ? "" : " market=" + query.market()), Map.of());
        }

        List<String> ranking;
        String strategy;
        RoutingDecision decision = null;
        if (query.provider() != null) {
            ranking  = candidates;
            strategy = EXPLICIT_STRATEGY;
        } else {
            decision = routingEngine.route(candidates, request, registry.snapshots(candidates));
            ranking  = decision.ranking();
            strategy = decision.strategy().name();
        }

        Attempted attempted;
        try {
            attempted = extractWithFailover(ranking, request, query);
        } catch (ProvidersExhaustedException e) {
            exhausted.incrementAndGet();
            FailoverResult failover = e.getFailoverResult();
            countFailover(failover);
            recordStrategy(decision, ranking, null);
            TraceContextUtil.withMdc(traceId, () ->
                log.warn("PROVIDERS_EXHAUSTED symbol={} dataType={} attempts={} errors={} traceId={}",
                         query.symbol(), query.dataType(), failover.attempts(), failover.errorMessages(), traceId));
            return fail(query, started, traceId, SourceInfo.from(failover, strategy), e.getMessage(),
                        Map.of("failover", failover));
        }

        FailoverResult failover = attempted.failover();
        TransformedData transformed = attempted.transformed();
        countFailover(failover);
        recordStrategy(decision, ranking, failover.successfulProvider());

        long elapsed = clock.millis() - started;
        StandardResult result = new StandardResult(
            true,
            transformed.data(),
            transformed.mapping().fieldMappings(),
            transformed.mapping().confidences(),
            SourceInfo.from(failover, strategy),
            transformed.qualityScore(),
            null,
            query,
            elapsed,
            successMetadata(query, traceId, strategy, decision, failover, transformed));

        if (settings.cacheEnabled()) {
            resultCache.put(query.signature(), result);
        }
        successfulRequests.incrementAndGet();
        totalProcessingMs.addAndGet(elapsed);
        TraceContextUtil.withMdc(traceId, () ->
            log.info("QUERY_COMPLETED symbol={} dataType={} provider={} attempts={} rows={} quality={} elapsedMs={}",
                     query.symbol(), query.dataType(), failover.successfulProvider(), failover.attempts(),
                     transformed.data().rowCount(), transformed.qualityScore(), elapsed));
        return result;
    }

    // ── stage 1: query transform ──────────────────────────────────────────────

    static RoutingRequest toRoutingRequest(StandardQuery query, String traceId) {
        return new RoutingRequest(query.symbol(), query.assetType(), query.dataType(), query.market(),
                                  query.startDate(), query.endDate(), query.period(), query.priority(),
                                  query.timeout(), query.retryCount(), query.qualityRequirement(),
                                  query.extraParams(), traceId);
    }

    // ── stage 2: candidates ───────────────────────────────────────────────────

    List<String> resolveCandidates(StandardQuery query) {
        if (query.provider() != null) {
            if (!registry.isRegistered(query.provider())) {
                throw new ConfigurationException(query.provider(), "unknown provider requested by query");
            }
            return List.of(query.provider());
        }
        return registry.getAvailable(query.dataType(), query.assetType(), query.market());
    }

    // ── stage 3 + 4: extraction with failover, transform per successful reply ─

    private Attempted extractWithFailover(List<String> ranking, RoutingRequest request, StandardQuery query) {
        int maxAttempts = query.fallbackEnabled() ? query.retryCount() + 1 : 1;
        long started  = clock.millis();
        long deadline = started + query.timeout().toMillis();

        int attempts = 0;
        List<String> failed  = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        Map<String, String> errors = new LinkedHashMap<>();

        for (int i = 0; i < ranking.size() && attempts < maxAttempts; i++) {
            String providerId = ranking.get(i);
            long remaining = deadline - clock.millis();
            if (remaining <= 0) {
                for (String rest : ranking.subList(i, ranking.size())) {
                    skipped.add(rest);
                    errors.put(rest, "skipped: timeout budget exhausted");
                }
                break;
            }

            DataSourceProvider provider = registry.getProvider(providerId).orElse(null);
            CircuitBreaker breaker = registry.circuitBreaker(providerId).orElse(null);
            if (provider == null || breaker == null) {
                skipped.add(providerId);
                errors.put(providerId, "skipped: provider no longer registered");
                continue;
            }
            if (!breaker.canExecute()) {
                CircuitOpenException rejected = new CircuitOpenException(providerId, breaker.getDegradationLevel());
                skipped.add(providerId);
                errors.put(providerId, rejected.getMessage());
                log.debug("PROVIDER_SKIPPED providerId={} reason=circuit open degradation={}",
                          providerId, breaker.getDegradationLevel());
                continue;
            }

            attempts++;
            long attemptStart = clock.millis();
            registry.acquire(providerId);
            boolean settled = false;
            try {
                DataTable raw = invoke(providerId, provider, request, Duration.ofMillis(remaining));
                if (raw == null || raw.isEmpty()) {
                    throw new ProviderException(providerId, FailureType.DATA_QUALITY, "empty reply");
                }
                TransformedData transformed = transformer.transform(raw, query.dataType());
                if (DataTransformer.requiredFieldsAbsent(transformed, query.dataType())) {
                    throw new ProviderException(providerId, FailureType.DATA_QUALITY,
                        "reply carries none of the required fields " + transformed.missingRequired());
                }
                Duration latency = Duration.ofMillis(clock.millis() - attemptStart);
                settled = true;
                registry.recordSuccess(providerId, latency, transformed.qualityScore());
                routingEngine.recordOutcome(providerId, true, latency.toMillis());

                FailoverResult failover = new FailoverResult(true, transformed.data(), attempts, failed, skipped,
                    providerId, errors, latency.toMillis(), clock.millis() - started);
                return new Attempted(failover, transformed);
            } catch (RuntimeException e) {
                settled = true;
                Throwable cause = FailureClassifier.unwrap(e);
                Duration latency = Duration.ofMillis(clock.millis() - attemptStart);
                registry.recordFailure(providerId, cause, latency);
                routingEngine.recordOutcome(providerId, false, latency.toMillis());
                failed.add(providerId);
                errors.put(providerId, FailureClassifier.classify(cause) + ": " + cause.getMessage());
                log.warn("PROVIDER_ATTEMPT_FAILED providerId={} attempt={} type={} latencyMs={} error={}",
                         providerId, attempts, FailureClassifier.classify(cause), latency.toMillis(), cause.getMessage());
            } finally {
                if (!settled) {
                    // an Error escaped the attempt; the breaker still has to see it
                    Duration latency = Duration.ofMillis(clock.millis() - attemptStart);
                    registry.recordFailure(providerId,
                        new ProviderException(providerId, FailureType.UNKNOWN, "attempt aborted by an error"), latency);
                    routingEngine.recordOutcome(providerId, false, latency.toMillis());
                    log.error("PROVIDER_ATTEMPT_ABORTED providerId={} attempt={} latencyMs={}",
                              providerId, attempts, latency.toMillis());
                }
                registry.release(providerId);
            }
        }

        FailoverResult failover = new FailoverResult(false, DataTable.empty(), attempts, failed, skipped,
            null, errors, 0L, clock.millis() - started);
        throw new ProvidersExhaustedException(
            "all providers failed for " + query.symbol() + " " + query.dataType(), failover);
    }

    /** Connects lazily, then extracts on a worker thread under the remaining time budget. */
    private DataTable invoke(String providerId, DataSourceProvider provider, RoutingRequest request, Duration budget) {
        return Mono.fromCallable(() -> {
                if (!provider.isConnected() && !provider.connect()) {
                    throw new ProviderException(providerId, FailureType.CONNECTION, "connect failed");
                }
                return provider.extract(request);
            })
            .subscribeOn(workers)
            .timeout(budget)
            .onErrorMap(TimeoutException.class, e -> new ProviderException(providerId, FailureType.TIMEOUT,
                "no reply within " + budget.toMillis() + "ms", e))
            .block();
    }

    // ── bookkeeping ───────────────────────────────────────────────────────────

    private void recordStrategy(RoutingDecision decision, List<String> ranking, String successfulProvider) {
        if (decision == null || ranking.size() < 2) {
            return;
        }
        routingEngine.recordStrategyOutcome(decision.strategy(), ranking.get(0).equals(successfulProvider));
    }

    private void countFailover(FailoverResult failover) {
        if (failover.attempts() > 1 || !failover.skippedProviders().isEmpty()) {
            failovers.incrementAndGet();
        }
    }

    private StandardResult fail(StandardQuery query, long started, String traceId, SourceInfo sourceInfo,
                                String reason, Map<String, Object> extra) {
        failedRequests.incrementAndGet();
        long elapsed = clock.millis() - started;
        totalProcessingMs.addAndGet(elapsed);
        Map<String, Object> metadata = baseMetadata(query, traceId);
        metadata.putAll(extra);
        return StandardResult.failure(query, reason, sourceInfo, elapsed, metadata);
    }

    private Map<String, Object> successMetadata(StandardQuery query, String traceId, String strategy,
                                                RoutingDecision decision, FailoverResult failover,
                                                TransformedData transformed) {
        Map<String, Object> metadata = baseMetadata(query, traceId);
        metadata.put("strategy", strategy);
        metadata.put("routingCached", decision != null && decision.cached());
        metadata.put("rowCount", transformed.data().rowCount());
        metadata.put("droppedRows", transformed.droppedRows());
        metadata.put("mappingMethods", transformed.mapping().methodCounts());
        metadata.put("fallbackMapping", transformed.fallbackMapping());
        metadata.put("missingRequired", transformed.missingRequired());
        metadata.put("failover", failover);
        return metadata;
    }

    private Map<String, Object> baseMetadata(StandardQuery query, String traceId) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("queryTime", clock.instant());
        metadata.put("assetType", query.assetType());
        metadata.put("dataType", query.dataType());
        metadata.put("period", query.period());
        metadata.put("traceId", traceId);
        return metadata;
    }

    // ── maintenance & observability ───────────────────────────────────────────

    public Map<String, HealthCheckResult> healthCheckAll() {
        return registry.performHealthCheck();
    }

    public int purgeExpiredResults() {
        return resultCache.purgeExpired();
    }

    public void clearResultCache() {
        resultCache.clear();
        log.info("RESULT_CACHE_CLEARED");
    }

    public PipelineStatistics statistics() {
        long total = totalRequests.get();
        long hits  = cacheHits.get();
        long done  = successfulRequests.get() + failedRequests.get();
        return new PipelineStatistics(
            total,
            successfulRequests.get(),
            failedRequests.get(),
            hits,
            total == 0 ? 0.0 : (double) hits / total,
            failovers.get(),
            exhausted.get(),
            done == 0 ? 0.0 : (double) totalProcessingMs.get() / done,
            resultCache.size());
    }

    /** Disconnects every provider and releases the extraction workers. */
    @Override
    public void close() {
        registry.disconnectAll();
        workers.dispose();
        log.info("PIPELINE_CLOSED");
    }
}
