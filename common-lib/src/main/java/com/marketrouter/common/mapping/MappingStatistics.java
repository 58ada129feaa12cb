package com.marketrouter.common.mapping;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MappingStatistics(
    @JsonProperty("totalMappings")    long totalMappings,
    @JsonProperty("exactMatches")     long exactMatches,
    @JsonProperty("customMatches")    long customMatches,
    @JsonProperty("fuzzyMatches")     long fuzzyMatches,
    @JsonProperty("inferredMatches")  long inferredMatches,
    @JsonProperty("unmapped")         long unmapped,
    @JsonProperty("cacheHits")        long cacheHits,
    @JsonProperty("cacheSize")        int cacheSize
) {
    /** Share of columns resolved by any method other than {@link MatchMethod#UNMAPPED}. */
    @JsonProperty("successRate")
    public double successRate() {
        return totalMappings == 0 ? 0.0 : (double) (totalMappings - unmapped) / totalMappings;
    }
}
