package com.marketrouter.common.breaker;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record FailureRecord(
    @JsonProperty("timestamp")      Instant timestamp,
    @JsonProperty("failureType")    FailureType failureType,
    @JsonProperty("message")        String message,
    @JsonProperty("responseTimeMs") long responseTimeMs,
    @JsonProperty("severity")       FailureType.Severity severity
) {
    public static FailureRecord of(Instant timestamp, FailureType type, String message, long responseTimeMs) {
        return new FailureRecord(timestamp, type, message, responseTimeMs, type.severity());
    }
}
