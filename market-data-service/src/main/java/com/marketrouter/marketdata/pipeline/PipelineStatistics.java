package com.marketrouter.marketdata.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param failovers  requests that needed more than one provider attempt, or skipped a
 *                   provider whose breaker was open
 * @param exhausted  requests that ended with every candidate failed or rejected
 */
public record PipelineStatistics(
    @JsonProperty("totalRequests")        long totalRequests,
    @JsonProperty("successfulRequests")   long successfulRequests,
    @JsonProperty("failedRequests")       long failedRequests,
    @JsonProperty("cacheHits")            long cacheHits,
    @JsonProperty("cacheHitRate")         double cacheHitRate,
    @JsonProperty("failovers")            long failovers,
    @JsonProperty("exhausted")            long exhausted,
    @JsonProperty("avgProcessingTimeMs")  double avgProcessingTimeMs,
    @JsonProperty("resultCacheSize")      int resultCacheSize
) {}
