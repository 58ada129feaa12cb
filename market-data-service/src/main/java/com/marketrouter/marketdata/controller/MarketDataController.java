package com.marketrouter.marketdata.controller;

import com.marketrouter.common.breaker.CircuitBreakerReport;
import com.marketrouter.common.exception.ConfigurationException;
import com.marketrouter.common.model.HealthCheckResult;
import com.marketrouter.common.model.StandardQuery;
import com.marketrouter.common.model.StandardResult;
import com.marketrouter.marketdata.pipeline.ExtractTransformPipeline;
import com.marketrouter.marketdata.pipeline.PipelineStatistics;
import com.marketrouter.routing.intelligent.IntelligentRoutingEngine;
import com.marketrouter.routing.intelligent.RoutingStatistics;
import com.marketrouter.routing.registry.ProviderPerformanceReport;
import com.marketrouter.routing.registry.ProviderRegistry;
import com.marketrouter.routing.registry.ProviderSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

/**
 * Query entry point plus read-only views of the routing core.
 *
 * <ul>
 *   <li>POST /query: runs the pipeline; a failed result is still a 200 with {@code success=false}</li>
 *   <li>GET  /providers, /providers/{id}/report: health and metrics snapshots</li>
 *   <li>POST /providers/health-check: probes every provider now</li>
 *   <li>GET  /circuit-breakers, /routing/statistics, /pipeline/statistics</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/v1/market-data")
public class MarketDataController {

    private static final Logger log = LoggerFactory.getLogger(MarketDataController.class);

    private final ExtractTransformPipeline pipeline;
    private final ProviderRegistry registry;
    private final IntelligentRoutingEngine routingEngine;

    public MarketDataController(ExtractTransformPipeline pipeline, ProviderRegistry registry,
                                IntelligentRoutingEngine routingEngine) {
        this.pipeline      = pipeline;
        this.registry      = registry;
        this.routingEngine = routingEngine;
    }

    @PostMapping("/query")
    public Mono<ResponseEntity<StandardResult>> query(@RequestBody StandardQuery query) {
        return pipeline.processAsync(query)
            .map(ResponseEntity::ok)
            .onErrorResume(ConfigurationException.class, e -> {
                log.warn("QUERY_REJECTED symbol={} reason={}", query.symbol(), e.getMessage());
                return Mono.just(ResponseEntity.badRequest()
                    .body(StandardResult.failure(query, e.getMessage(), null, 0L, Map.of())));
            });
    }

    @GetMapping("/providers")
    public ResponseEntity<Map<String, ProviderSnapshot>> providers() {
        return ResponseEntity.ok(registry.allSnapshots());
    }

    @GetMapping("/providers/{providerId}/report")
    public ResponseEntity<ProviderPerformanceReport> report(@PathVariable String providerId) {
        return registry.performanceReport(providerId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/providers/health-check")
    public Mono<ResponseEntity<Map<String, HealthCheckResult>>> healthCheck() {
        return Mono.fromCallable(pipeline::healthCheckAll)
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/circuit-breakers")
    public ResponseEntity<Map<String, CircuitBreakerReport>> circuitBreakers() {
        return ResponseEntity.ok(registry.getCircuitBreakers().reports());
    }

    @GetMapping("/routing/statistics")
    public ResponseEntity<RoutingStatistics> routingStatistics() {
        return ResponseEntity.ok(routingEngine.statistics());
    }

    @GetMapping("/pipeline/statistics")
    public ResponseEntity<PipelineStatistics> pipelineStatistics() {
        return ResponseEntity.ok(pipeline.statistics());
    }
}
