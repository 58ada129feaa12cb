package com.marketrouter.marketdata.pipeline;

import java.time.Duration;

/**
 * @param cacheEnabled        serve repeated queries from {@link QueryResultCache}
 * @param resultCacheTtl      lifetime of a cached result
 * @param resultCacheMaxSize  entries kept before the oldest is evicted
 * @param workerPoolSize      threads available to concurrent extraction attempts
 */
public record PipelineSettings(
    boolean cacheEnabled,
    Duration resultCacheTtl,
    int resultCacheMaxSize,
    int workerPoolSize
) {
    public PipelineSettings {
        resultCacheTtl     = resultCacheTtl == null ? Duration.ofMinutes(5) : resultCacheTtl;
        resultCacheMaxSize = Math.max(1, resultCacheMaxSize);
        workerPoolSize     = Math.max(1, workerPoolSize);
    }

    public static PipelineSettings defaults() {
        return new PipelineSettings(true, Duration.ofMinutes(5), 1000, 10);
    }
}
