package com.marketrouter.common.model;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Kinds of market data a query can ask for. Each kind has its own canonical field
 * vocabulary in the field mapping tables.
 */
public enum DataType {
    HISTORICAL_KLINE,
    REAL_TIME_QUOTE,
    ASSET_LIST,
    FUNDAMENTAL,
    FINANCIAL_STATEMENT,
    MACRO_ECONOMIC,
    SECTOR_FUND_FLOW;

    private static final Map<String, DataType> ALIASES = Map.ofEntries(
        Map.entry("kline",              HISTORICAL_KLINE),
        Map.entry("historical",         HISTORICAL_KLINE),
        Map.entry("historical_kline",   HISTORICAL_KLINE),
        Map.entry("historical_data",    HISTORICAL_KLINE),
        Map.entry("stock_daily",        HISTORICAL_KLINE),
        Map.entry("daily",              HISTORICAL_KLINE),
        Map.entry("candles",            HISTORICAL_KLINE),
        Map.entry("realtime",           REAL_TIME_QUOTE),
        Map.entry("real_time",          REAL_TIME_QUOTE),
        Map.entry("real_time_quote",    REAL_TIME_QUOTE),
        Map.entry("quote",              REAL_TIME_QUOTE),
        Map.entry("stock_realtime",     REAL_TIME_QUOTE),
        Map.entry("stock_list",         ASSET_LIST),
        Map.entry("asset_list",         ASSET_LIST),
        Map.entry("symbols",            ASSET_LIST),
        Map.entry("stock_info",         FUNDAMENTAL),
        Map.entry("fundamental",        FUNDAMENTAL),
        Map.entry("fundamentals",       FUNDAMENTAL),
        Map.entry("financial",          FINANCIAL_STATEMENT),
        Map.entry("financial_statement", FINANCIAL_STATEMENT),
        Map.entry("macro",              MACRO_ECONOMIC),
        Map.entry("macro_economic",     MACRO_ECONOMIC),
        Map.entry("fund_flow",          SECTOR_FUND_FLOW),
        Map.entry("sector_fund_flow",   SECTOR_FUND_FLOW)
    );

    /**
     * Resolves an enum constant name or one of the capability aliases providers
     * commonly declare ("kline", "realtime", "stock_list", ...).
     */
    public static Optional<DataType> fromString(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String key = value.trim().toLowerCase(Locale.ROOT);
        DataType alias = ALIASES.get(key);
        if (alias != null) {
            return Optional.of(alias);
        }
        try {
            return Optional.of(DataType.valueOf(key.toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
