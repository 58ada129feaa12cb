package com.marketrouter.common.model;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Asset classes a provider can serve.
 */
public enum AssetType {
    STOCK,
    INDEX,
    FUND,
    BOND,
    FUTURES,
    OPTION,
    CRYPTO,
    FOREX,
    MACRO;

    private static final Map<String, AssetType> ALIASES = Map.ofEntries(
        Map.entry("stock",       STOCK),
        Map.entry("stocks",      STOCK),
        Map.entry("equity",      STOCK),
        Map.entry("a_share",     STOCK),
        Map.entry("index",       INDEX),
        Map.entry("fund",        FUND),
        Map.entry("etf",         FUND),
        Map.entry("bond",        BOND),
        Map.entry("future",      FUTURES),
        Map.entry("futures",     FUTURES),
        Map.entry("option",      OPTION),
        Map.entry("options",     OPTION),
        Map.entry("crypto",      CRYPTO),
        Map.entry("cryptocurrency", CRYPTO),
        Map.entry("forex",       FOREX),
        Map.entry("fx",          FOREX),
        Map.entry("macro",       MACRO),
        Map.entry("macro_economy", MACRO)
    );

    /**
     * Resolves an enum constant name or a common alias ("equity", "etf", "fx").
     * Returns empty for anything unrecognised.
     */
    public static Optional<AssetType> fromString(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String key = value.trim().toLowerCase(Locale.ROOT);
        AssetType alias = ALIASES.get(key);
        if (alias != null) {
            return Optional.of(alias);
        }
        try {
            return Optional.of(AssetType.valueOf(key.toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
