package com.marketrouter.common.mapping;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Classifies a column's semantic {@link FieldType} from its name first and, when the
 * name says nothing, from the shape of its values.
 *
 * <h3>Value-shape rules (numeric columns)</h3>
 * <pre>
 *   any value written with "%"                 → PERCENTAGE
 *   all values in [0, 1]                        → RATIO
 *   all values in [-100, 100], some negative    → PERCENTAGE
 *   all integral, max >= 1000                   → VOLUME
 *   max |value| >= 1e6                          → CURRENCY
 *   otherwise                                   → PRICE
 * </pre>
 *
 * <p>Stateless and thread-safe.
 */
public final class FieldTypeDetector {

    public static final int MAX_SAMPLE = 100;

    static final double VOLUME_FLOOR   = 1_000;
    static final double CURRENCY_FLOOR = 1_000_000;
    static final double PERCENT_BOUND  = 100;

    // Order matters: earlier types win when several patterns match a name.
    private static final Map<FieldType, Pattern> NAME_PATTERNS = new LinkedHashMap<>();

    static {
        NAME_PATTERNS.put(FieldType.BOOLEAN,    Pattern.compile("^(is|has|can|should)_.*|.*flag.*|^是否.*"));
        NAME_PATTERNS.put(FieldType.DATE,       Pattern.compile(".*(date|time|timestamp|日期|时间|报告期).*|^t$|^dt$"));
        NAME_PATTERNS.put(FieldType.PERCENTAGE, Pattern.compile(".*(pct|percent|amplitude|growth|yoy|涨跌幅|振幅|换手率|收益率|占比|%).*|.*_rate$"));
        NAME_PATTERNS.put(FieldType.RATIO,      Pattern.compile(".*(ratio|比率|市盈率|市净率).*|^(pe|pb|ps)(_.*)?$"));
        NAME_PATTERNS.put(FieldType.VOLUME,     Pattern.compile(".*(volume|成交量|shares|股本|quantity|qty).*|^vol(_.*)?$|^v$"));
        NAME_PATTERNS.put(FieldType.CURRENCY,   Pattern.compile(".*(amount|turnover|revenue|assets|liabilit|profit|income|equity|cash|market_cap|inflow|outflow|收入|资产|利润|负债|金额|成交额|市值|现金|流入|流出).*|.*_mv$"));
        NAME_PATTERNS.put(FieldType.PRICE,      Pattern.compile(".*(price|open|high|low|close|bid|ask|vwap|eps|价|开盘|收盘|最高|最低).*|^[ohlc]$"));
        NAME_PATTERNS.put(FieldType.STRING,     Pattern.compile(".*(symbol|code|name|ticker|exchange|market|industry|sector|unit|category|status|代码|名称|简称|行业|板块|单位).*"));
    }

    private FieldTypeDetector() {}

    public static FieldType detect(String column, List<?> values) {
        return detectFromName(column).orElseGet(() -> detectFromValues(values));
    }

    public static Optional<FieldType> detectFromName(String column) {
        if (column == null || column.isBlank()) {
            return Optional.empty();
        }
        String name = column.trim().toLowerCase(Locale.ROOT);
        for (Map.Entry<FieldType, Pattern> e : NAME_PATTERNS.entrySet()) {
            if (e.getValue().matcher(name).matches()) {
                return Optional.of(e.getKey());
            }
        }
        return Optional.empty();
    }

    public static FieldType detectFromValues(List<?> values) {
        List<Object> sample = sample(values);
        if (sample.isEmpty()) {
            return FieldType.STRING;
        }
        if (sample.stream().allMatch(v -> ValueParsers.parseBoolean(v).isPresent())) {
            return FieldType.BOOLEAN;
        }
        if (sample.stream().allMatch(v -> !(v instanceof Number) && ValueParsers.looksLikeDate(v))) {
            return FieldType.DATE;
        }

        List<Double> numbers = new ArrayList<>(sample.size());
        for (Object v : sample) {
            Optional<Double> d = ValueParsers.parseNumber(v);
            if (d.isEmpty()) {
                return FieldType.STRING;
            }
            numbers.add(d.get());
        }
        if (sample.stream().anyMatch(ValueParsers::isPercentString)) {
            return FieldType.PERCENTAGE;
        }
        double min = numbers.stream().mapToDouble(Double::doubleValue).min().orElse(0);
        double max = numbers.stream().mapToDouble(Double::doubleValue).max().orElse(0);
        double maxAbs = Math.max(Math.abs(min), Math.abs(max));
        boolean integral = numbers.stream().allMatch(d -> d == Math.rint(d));

        if (min >= 0 && max <= 1) {
            return FieldType.RATIO;
        }
        if (min < 0 && maxAbs <= PERCENT_BOUND) {
            return FieldType.PERCENTAGE;
        }
        if (integral && max >= VOLUME_FLOOR) {
            return FieldType.VOLUME;
        }
        if (maxAbs >= CURRENCY_FLOOR) {
            return FieldType.CURRENCY;
        }
        return FieldType.PRICE;
    }

    /** First {@value #MAX_SAMPLE} non-null values. */
    public static List<Object> sample(List<?> values) {
        List<Object> out = new ArrayList<>();
        if (values == null) {
            return out;
        }
        for (Object v : values) {
            if (!ValueParsers.isNullLike(v)) {
                out.add(v);
                if (out.size() == MAX_SAMPLE) {
                    break;
                }
            }
        }
        return out;
    }
}
