package com.marketrouter.common.mapping;

import com.marketrouter.common.model.DataType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Built-in synonym tables per {@link DataType}: known raw column names (English
 * abbreviations, vendor spellings, Chinese labels) to canonical field names, plus the
 * type of each canonical field and the fields a data type cannot do without.
 *
 * <p>Every canonical field also maps to itself, so already-normalised data passes
 * through as exact matches.
 */
public final class BuiltInFieldMappings {

    private record Table(Map<String, String> synonyms,
                         Map<String, String> lowerCaseSynonyms,
                         Map<String, FieldType> targetTypes,
                         Set<String> required,
                         Map<FieldType, String> defaultTargets) {}

    private static final Map<DataType, Table> TABLES = new EnumMap<>(DataType.class);

    static {
        // ── K-line ────────────────────────────────────────────────────────────
        TABLES.put(DataType.HISTORICAL_KLINE, table(
            entries(
                "open",      "o", "Open", "OPEN", "开盘价", "开盘", "opening", "open_px",
                "high",      "h", "High", "HIGH", "最高价", "最高", "highest", "high_px",
                "low",       "l", "Low", "LOW", "最低价", "最低", "lowest", "low_px",
                "close",     "c", "Close", "CLOSE", "收盘价", "收盘", "closing", "close_px",
                "volume",    "v", "Volume", "VOLUME", "成交量", "vol",
                "amount",    "Amount", "AMOUNT", "成交额", "turnover",
                "datetime",  "t", "time", "Time", "timestamp", "date", "Date", "日期", "trade_date", "时间",
                "vwap",      "VWAP", "均价",
                "adj_close", "Adj Close", "adjclose", "复权收盘价",
                "change",    "chg", "涨跌额",
                "change_percent", "pct_chg", "change_pct", "涨跌幅",
                "turnover_rate",  "换手率", "turn",
                "amplitude",      "振幅"
            ),
            types(
                "open", FieldType.PRICE, "high", FieldType.PRICE, "low", FieldType.PRICE,
                "close", FieldType.PRICE, "vwap", FieldType.PRICE, "adj_close", FieldType.PRICE,
                "change", FieldType.PRICE, "volume", FieldType.VOLUME, "amount", FieldType.CURRENCY,
                "datetime", FieldType.DATE, "change_percent", FieldType.PERCENTAGE,
                "turnover_rate", FieldType.PERCENTAGE, "amplitude", FieldType.PERCENTAGE
            ),
            Set.of("open", "high", "low", "close"),
            defaults(FieldType.VOLUME, "volume", FieldType.CURRENCY, "amount",
                     FieldType.DATE, "datetime", FieldType.PERCENTAGE, "change_percent")
        ));

        // ── real-time quote ───────────────────────────────────────────────────
        TABLES.put(DataType.REAL_TIME_QUOTE, table(
            entries(
                "current_price",  "price", "current", "last", "现价", "最新价", "last_price", "trade",
                "bid_price",      "bid", "买一价", "买一",
                "ask_price",      "ask", "卖一价", "卖一",
                "open_price",     "open", "开盘价", "今开",
                "high_price",     "high", "最高价", "最高",
                "low_price",      "low", "最低价", "最低",
                "prev_close",     "close", "昨收价", "昨收", "pre_close", "前收盘价",
                "volume",         "vol", "成交量",
                "turnover",       "amount", "成交额",
                "change",         "chg", "涨跌额",
                "change_percent", "change_pct", "pct_chg", "涨跌幅",
                "update_time",    "timestamp", "time", "更新时间", "时间",
                "symbol",         "code", "代码", "ticker",
                "name",           "名称", "简称"
            ),
            types(
                "current_price", FieldType.PRICE, "bid_price", FieldType.PRICE, "ask_price", FieldType.PRICE,
                "open_price", FieldType.PRICE, "high_price", FieldType.PRICE, "low_price", FieldType.PRICE,
                "prev_close", FieldType.PRICE, "change", FieldType.PRICE, "volume", FieldType.VOLUME,
                "turnover", FieldType.CURRENCY, "change_percent", FieldType.PERCENTAGE,
                "update_time", FieldType.DATE, "symbol", FieldType.STRING, "name", FieldType.STRING
            ),
            Set.of("current_price"),
            defaults(FieldType.VOLUME, "volume", FieldType.CURRENCY, "turnover",
                     FieldType.DATE, "update_time", FieldType.PERCENTAGE, "change_percent")
        ));

        // ── asset list ────────────────────────────────────────────────────────
        TABLES.put(DataType.ASSET_LIST, table(
            entries(
                "symbol",    "code", "代码", "证券代码", "ts_code", "ticker", "股票代码",
                "name",      "名称", "证券简称", "简称", "short_name", "股票名称",
                "market",    "exchange", "交易所", "市场",
                "list_date", "上市日期", "listing_date", "ipo_date",
                "industry",  "行业", "所属行业",
                "status",    "状态", "list_status"
            ),
            types(
                "symbol", FieldType.STRING, "name", FieldType.STRING, "market", FieldType.STRING,
                "list_date", FieldType.DATE, "industry", FieldType.STRING, "status", FieldType.STRING
            ),
            Set.of("symbol"),
            defaults(FieldType.DATE, "list_date")
        ));

        // ── fundamentals ──────────────────────────────────────────────────────
        TABLES.put(DataType.FUNDAMENTAL, table(
            entries(
                "symbol",           "code", "代码", "ts_code",
                "name",             "名称", "简称",
                "pe_ratio",         "pe", "pe_ttm", "市盈率", "市盈率-动态",
                "pb_ratio",         "pb", "市净率",
                "market_cap",       "总市值", "total_mv", "market_value",
                "float_market_cap", "流通市值", "circ_mv",
                "eps",              "每股收益", "basic_eps",
                "roe",              "净资产收益率", "return_on_equity",
                "total_shares",     "总股本", "total_share",
                "report_date",      "报告期", "end_date"
            ),
            types(
                "symbol", FieldType.STRING, "name", FieldType.STRING, "pe_ratio", FieldType.RATIO,
                "pb_ratio", FieldType.RATIO, "market_cap", FieldType.CURRENCY,
                "float_market_cap", FieldType.CURRENCY, "eps", FieldType.PRICE,
                "roe", FieldType.PERCENTAGE, "total_shares", FieldType.VOLUME,
                "report_date", FieldType.DATE
            ),
            Set.of("symbol"),
            defaults(FieldType.DATE, "report_date")
        ));

        // ── financial statements ──────────────────────────────────────────────
        TABLES.put(DataType.FINANCIAL_STATEMENT, table(
            entries(
                "symbol",              "code", "代码", "ts_code",
                "report_date",         "报告期", "end_date", "period_end", "报告日期",
                "total_assets",        "资产总计", "总资产",
                "total_liabilities",   "负债合计", "总负债",
                "total_equity",        "所有者权益合计", "股东权益合计",
                "operating_revenue",   "revenue", "营业收入", "营业总收入", "total_revenue",
                "net_profit",          "净利润", "net_income",
                "operating_cash_flow", "经营活动产生的现金流量净额", "经营现金流"
            ),
            types(
                "symbol", FieldType.STRING, "report_date", FieldType.DATE,
                "total_assets", FieldType.CURRENCY, "total_liabilities", FieldType.CURRENCY,
                "total_equity", FieldType.CURRENCY, "operating_revenue", FieldType.CURRENCY,
                "net_profit", FieldType.CURRENCY, "operating_cash_flow", FieldType.CURRENCY
            ),
            Set.of(),
            defaults(FieldType.DATE, "report_date")
        ));

        // ── macro indicators ──────────────────────────────────────────────────
        TABLES.put(DataType.MACRO_ECONOMIC, table(
            entries(
                "indicator_code", "指标代码",
                "indicator_name", "指标名称",
                "data_date",      "日期", "统计时间", "period", "date",
                "value",          "数值", "今值", "actual",
                "previous_value", "前值", "previous",
                "forecast_value", "预测值", "forecast",
                "unit",           "单位",
                "category",       "类别"
            ),
            types(
                "indicator_code", FieldType.STRING, "indicator_name", FieldType.STRING,
                "data_date", FieldType.DATE, "value", FieldType.RATIO,
                "previous_value", FieldType.RATIO, "forecast_value", FieldType.RATIO,
                "unit", FieldType.STRING, "category", FieldType.STRING
            ),
            Set.of("value"),
            defaults(FieldType.DATE, "data_date")
        ));

        // ── sector fund flow ──────────────────────────────────────────────────
        TABLES.put(DataType.SECTOR_FUND_FLOW, table(
            entries(
                "sector_name",           "板块名称", "名称", "name", "sector",
                "main_net_inflow",       "主力净流入", "主力净流入-净额", "main_inflow",
                "main_net_inflow_ratio", "主力净流入-净占比", "主力净占比",
                "change_percent",        "涨跌幅", "pct_chg",
                "datetime",              "日期", "date", "trade_date"
            ),
            types(
                "sector_name", FieldType.STRING, "main_net_inflow", FieldType.CURRENCY,
                "main_net_inflow_ratio", FieldType.PERCENTAGE, "change_percent", FieldType.PERCENTAGE,
                "datetime", FieldType.DATE
            ),
            Set.of("sector_name"),
            defaults(FieldType.DATE, "datetime", FieldType.CURRENCY, "main_net_inflow")
        ));
    }

    private BuiltInFieldMappings() {}

    /** Raw name → canonical name, in declaration order. */
    public static Map<String, String> synonyms(DataType dataType) {
        return TABLES.get(dataType).synonyms();
    }

    /** Exact lookup, falling back to a case-insensitive one. */
    public static Optional<String> lookup(DataType dataType, String column) {
        Table t = TABLES.get(dataType);
        String exact = t.synonyms().get(column);
        if (exact != null) {
            return Optional.of(exact);
        }
        return Optional.ofNullable(t.lowerCaseSynonyms().get(column.toLowerCase(Locale.ROOT)));
    }

    public static Set<String> requiredFields(DataType dataType) {
        return TABLES.get(dataType).required();
    }

    public static Set<String> canonicalFields(DataType dataType) {
        return TABLES.get(dataType).targetTypes().keySet();
    }

    public static Optional<FieldType> fieldType(DataType dataType, String canonicalField) {
        return Optional.ofNullable(TABLES.get(dataType).targetTypes().get(canonicalField));
    }

    /** Canonical field that an inferred column of the given type should land on, if any. */
    public static Optional<String> defaultTarget(DataType dataType, FieldType fieldType) {
        return Optional.ofNullable(TABLES.get(dataType).defaultTargets().get(fieldType));
    }

    // ── table builders ────────────────────────────────────────────────────────

    /** Groups of {@code canonical, synonym, synonym, ...}; see {@link #table}. */
    private static String[] entries(String... entries) {
        return entries;
    }

    private static Map<String, FieldType> types(Object... pairs) {
        Map<String, FieldType> out = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            out.put((String) pairs[i], (FieldType) pairs[i + 1]);
        }
        return out;
    }

    private static Map<FieldType, String> defaults(Object... pairs) {
        Map<FieldType, String> out = new EnumMap<>(FieldType.class);
        for (int i = 0; i < pairs.length; i += 2) {
            out.put((FieldType) pairs[i], (String) pairs[i + 1]);
        }
        return out;
    }

    /**
     * A group starts at every entry that is a canonical field (a key of
     * {@code targetTypes}) not seen before; the entries after it are its synonyms.
     */
    private static Table table(String[] entries, Map<String, FieldType> targetTypes,
                               Set<String> required, Map<FieldType, String> defaultTargets) {
        Map<String, String> synonyms = new LinkedHashMap<>();
        String current = null;
        for (String entry : entries) {
            if (targetTypes.containsKey(entry) && !synonyms.containsKey(entry)) {
                current = entry;
                synonyms.put(entry, entry);
            } else if (current != null) {
                synonyms.putIfAbsent(entry, current);
            }
        }
        Map<String, String> lower = new LinkedHashMap<>();
        synonyms.forEach((k, v) -> lower.putIfAbsent(k.toLowerCase(Locale.ROOT), v));
        return new Table(Collections.unmodifiableMap(synonyms), Collections.unmodifiableMap(lower),
                         Collections.unmodifiableMap(targetTypes), Set.copyOf(required),
                         Collections.unmodifiableMap(defaultTargets));
    }
}
