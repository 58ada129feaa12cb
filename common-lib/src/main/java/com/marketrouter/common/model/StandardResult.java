package com.marketrouter.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Final, immutable outcome of one pipeline request.
 *
 * <p>{@code success} is always explicit. On success {@code qualityScore} lets callers
 * apply their own acceptance threshold; it is clamped to [0, 1] on construction. On
 * failure {@code failureReason} explains why and {@code data} is empty.
 */
public record StandardResult(
    @JsonProperty("success")           boolean success,
    @JsonProperty("data")              DataTable data,
    @JsonProperty("fieldMappings")     Map<String, String> fieldMappings,
    @JsonProperty("mappingConfidence") Map<String, Double> mappingConfidence,
    @JsonProperty("sourceInfo")        SourceInfo sourceInfo,
    @JsonProperty("qualityScore")      double qualityScore,
    @JsonProperty("failureReason")     String failureReason,
    @JsonProperty("query")             StandardQuery query,
    @JsonProperty("processingTimeMs")  long processingTimeMs,
    @JsonProperty("metadata")          Map<String, Object> metadata
) {
    public StandardResult {
        data              = data == null ? DataTable.empty() : data;
        fieldMappings     = fieldMappings == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fieldMappings));
        mappingConfidence = mappingConfidence == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(mappingConfidence));
        metadata          = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        qualityScore      = Double.isNaN(qualityScore) ? 0.0 : Math.max(0.0, Math.min(1.0, qualityScore));
    }

    public static StandardResult failure(StandardQuery query, String reason, SourceInfo sourceInfo,
                                         long processingTimeMs, Map<String, Object> metadata) {
        return new StandardResult(false, DataTable.empty(), Map.of(), Map.of(), sourceInfo, 0.0,
                                  reason, query, processingTimeMs, metadata);
    }

    /** Same result re-labelled as served from the result cache. */
    public StandardResult asCached(long processingTimeMs) {
        SourceInfo cachedInfo = sourceInfo == null ? null : sourceInfo.asCached();
        return new StandardResult(success, data, fieldMappings, mappingConfidence, cachedInfo, qualityScore,
                                  failureReason, query, processingTimeMs, metadata);
    }
}
