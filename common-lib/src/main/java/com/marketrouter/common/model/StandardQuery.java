package com.marketrouter.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketrouter.common.exception.ConfigurationException;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable, provider-agnostic market data query. One per request.
 *
 * <p>Validation happens in the canonical constructor, so a query that exists is always
 * complete: a missing symbol, asset type or data type raises {@link ConfigurationException}.
 * Unset optional fields are defaulted:
 * <pre>
 *   period           "D"
 *   timeout          5s    (total budget shared by every failover attempt)
 *   retryCount       3     (additional attempts after the first)
 *   fallbackEnabled  true
 * </pre>
 */
public record StandardQuery(
    @JsonProperty("symbol")             String symbol,
    @JsonProperty("assetType")          AssetType assetType,
    @JsonProperty("dataType")           DataType dataType,
    @JsonProperty("startDate")          LocalDate startDate,
    @JsonProperty("endDate")            LocalDate endDate,
    @JsonProperty("period")             String period,
    @JsonProperty("market")             String market,
    @JsonProperty("provider")           String provider,
    @JsonProperty("priority")           int priority,
    @JsonProperty("timeout")            Duration timeout,
    @JsonProperty("retryCount")         Integer retryCount,
    @JsonProperty("fallbackEnabled")    Boolean fallbackEnabled,
    @JsonProperty("qualityRequirement") double qualityRequirement,
    @JsonProperty("extraParams")        Map<String, Object> extraParams
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
    public static final int DEFAULT_RETRY_COUNT  = 3;
    public static final String DEFAULT_PERIOD    = "D";

    public StandardQuery {
        if (symbol == null || symbol.isBlank()) {
            throw new ConfigurationException("query is missing required field 'symbol'");
        }
        if (assetType == null) {
            throw new ConfigurationException("query is missing required field 'assetType'");
        }
        if (dataType == null) {
            throw new ConfigurationException("query is missing required field 'dataType'");
        }
        if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
            throw new ConfigurationException("query startDate " + startDate + " is after endDate " + endDate);
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new ConfigurationException("query timeout must be positive, got " + timeout);
        }
        symbol             = symbol.trim();
        period             = (period == null || period.isBlank()) ? DEFAULT_PERIOD : period;
        provider           = (provider == null || provider.isBlank()) ? null : provider.trim();
        market             = (market == null || market.isBlank()) ? null : market.trim();
        priority           = Math.max(0, Math.min(100, priority));
        timeout            = timeout == null ? DEFAULT_TIMEOUT : timeout;
        retryCount         = retryCount == null ? DEFAULT_RETRY_COUNT : Math.max(0, retryCount);
        fallbackEnabled    = fallbackEnabled == null ? Boolean.TRUE : fallbackEnabled;
        qualityRequirement = Math.max(0.0, Math.min(1.0, qualityRequirement));
        extraParams        = extraParams == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(extraParams));
    }

    public static Builder builder(String symbol, AssetType assetType, DataType dataType) {
        return new Builder(symbol, assetType, dataType);
    }

    /**
     * Stable identity of the query for result caching. Extra parameters are
     * included in key order so two equal maps always yield the same signature.
     */
    public String signature() {
        return String.join("|",
            symbol,
            assetType.name(),
            dataType.name(),
            period,
            String.valueOf(startDate),
            String.valueOf(endDate),
            String.valueOf(market),
            String.valueOf(provider),
            new TreeMap<>(extraParams).toString());
    }

    public Builder toBuilder() {
        return new Builder(symbol, assetType, dataType)
            .startDate(startDate).endDate(endDate).period(period).market(market)
            .provider(provider).priority(priority).timeout(timeout).retryCount(retryCount)
            .fallbackEnabled(fallbackEnabled).qualityRequirement(qualityRequirement)
            .extraParams(extraParams);
    }

    public static final class Builder {
        private final String symbol;
        private final AssetType assetType;
        private final DataType dataType;
        private LocalDate startDate;
        private LocalDate endDate;
        private String period;
        private String market;
        private String provider;
        private int priority;
        private Duration timeout;
        private Integer retryCount;
        private Boolean fallbackEnabled;
        private double qualityRequirement;
        private Map<String, Object> extraParams = new LinkedHashMap<>();

        private Builder(String symbol, AssetType assetType, DataType dataType) {
            this.symbol    = symbol;
            this.assetType = assetType;
            this.dataType  = dataType;
        }

        public Builder startDate(LocalDate v)          { this.startDate = v; return this; }
        public Builder endDate(LocalDate v)            { this.endDate = v; return this; }
        public Builder period(String v)                { this.period = v; return this; }
        public Builder market(String v)                { this.market = v; return this; }
        public Builder provider(String v)              { this.provider = v; return this; }
        public Builder priority(int v)                 { this.priority = v; return this; }
        public Builder timeout(Duration v)             { this.timeout = v; return this; }
        public Builder retryCount(int v)               { this.retryCount = v; return this; }
        public Builder fallbackEnabled(boolean v)      { this.fallbackEnabled = v; return this; }
        public Builder qualityRequirement(double v)    { this.qualityRequirement = v; return this; }

        public Builder extraParam(String key, Object value) {
            this.extraParams.put(key, value);
            return this;
        }

        public Builder extraParams(Map<String, Object> params) {
            this.extraParams = params == null ? new LinkedHashMap<>() : new LinkedHashMap<>(params);
            return this;
        }

        public StandardQuery build() {
            return new StandardQuery(symbol, assetType, dataType, startDate, endDate, period, market,
                                     provider, priority, timeout, retryCount, fallbackEnabled,
                                     qualityRequirement, extraParams);
        }
    }
}
