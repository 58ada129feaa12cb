package com.marketrouter.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Set;

/**
 * What a provider declares it can serve, plus its static ranking attributes.
 *
 * <p>An empty {@code markets} set means the provider does not restrict by market.
 * Lower {@code priority} values rank first.
 */
public record ProviderCapability(
    @JsonProperty("assetTypes")        Set<AssetType> assetTypes,
    @JsonProperty("dataTypes")         Set<DataType> dataTypes,
    @JsonProperty("markets")           Set<String> markets,
    @JsonProperty("priority")          int priority,
    @JsonProperty("qualityRating")     double qualityRating,
    @JsonProperty("reliabilityRating") double reliabilityRating
) {
    public static final int DEFAULT_PRIORITY = 50;

    public ProviderCapability {
        assetTypes        = assetTypes == null ? Set.of() : Set.copyOf(assetTypes);
        dataTypes         = dataTypes == null ? Set.of() : Set.copyOf(dataTypes);
        markets           = markets == null ? Set.of() : Set.copyOf(markets);
        qualityRating     = Math.max(0.0, Math.min(1.0, qualityRating));
        reliabilityRating = Math.max(0.0, Math.min(1.0, reliabilityRating));
    }

    public static ProviderCapability of(Set<AssetType> assetTypes, Set<DataType> dataTypes, Set<String> markets) {
        return new ProviderCapability(assetTypes, dataTypes, markets, DEFAULT_PRIORITY, 0.8, 0.8);
    }

    public boolean supports(DataType dataType, AssetType assetType) {
        return dataTypes.contains(dataType) && assetTypes.contains(assetType);
    }

    public boolean supportsMarket(String market) {
        return market == null || markets.isEmpty() || markets.contains(market);
    }

    public ProviderCapability withPriority(int newPriority) {
        return new ProviderCapability(assetTypes, dataTypes, markets, newPriority, qualityRating, reliabilityRating);
    }
}
