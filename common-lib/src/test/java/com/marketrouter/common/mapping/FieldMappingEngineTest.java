package com.marketrouter.common.mapping;

import com.marketrouter.common.model.DataTable;
import com.marketrouter.common.model.DataType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FieldMappingEngineTest {

    private FieldMappingEngine engine;

    @BeforeEach
    void setUp() {
        engine = new FieldMappingEngine();
    }

    /** Builds a table column by column: name, values, name, values, ... */
    private static DataTable table(Object... columnsAndValues) {
        List<String> columns = new ArrayList<>();
        List<List<?>> values = new ArrayList<>();
        for (int i = 0; i < columnsAndValues.length; i += 2) {
            columns.add((String) columnsAndValues[i]);
            values.add((List<?>) columnsAndValues[i + 1]);
        }
        int rows = values.isEmpty() ? 0 : values.get(0).size();
        List<Map<String, Object>> out = new ArrayList<>();
        for (int r = 0; r < rows; r++) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int c = 0; c < columns.size(); c++) {
                row.put(columns.get(c), values.get(c).get(r));
            }
            out.add(row);
        }
        return DataTable.of(columns, out);
    }

    private static ColumnMapping mappingOf(MappingResult result, String source) {
        return result.columns().stream()
            .filter(c -> c.sourceField().equals(source))
            .findFirst()
            .orElseThrow();
    }

    // ── exact ─────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("exact matches")
    class Exact {

        @Test
        @DisplayName("收盘价 maps to close with confidence 1.0 for K-line data")
        void chineseClose() {
            ColumnMapping m = engine.resolve("收盘价", List.of(10.5, 11.0), DataType.HISTORICAL_KLINE);

            assertEquals("close", m.targetField());
            assertEquals(1.0, m.confidence());
            assertEquals(MatchMethod.EXACT, m.method());
            assertEquals(FieldType.PRICE, m.fieldType());
        }

        @Test
        @DisplayName("canonical names map to themselves for every data type")
        void canonicalIsIdentity() {
            for (DataType type : DataType.values()) {
                for (String field : BuiltInFieldMappings.canonicalFields(type)) {
                    ColumnMapping m = engine.resolve(field, List.of(), type);
                    assertEquals(field, m.targetField(), type + "/" + field);
                    assertEquals(1.0, m.confidence());
                    assertFalse(m.renames());
                }
            }
        }

        @Test
        @DisplayName("single-letter OHLCV abbreviations are normalised")
        void abbreviations() {
            DataTable raw = table(
                "t", List.of("2024-01-02", "2024-01-03"),
                "o", List.of(10.0, 10.4), "h", List.of(10.8, 10.9),
                "l", List.of(9.9, 10.1), "c", List.of(10.5, 10.7),
                "v", List.of(120000, 98000));

            MappingResult result = engine.map(raw, DataType.HISTORICAL_KLINE);

            assertEquals(List.of("datetime", "open", "high", "low", "close", "volume"), result.data().columns());
            assertTrue(engine.validate(result).valid());
        }

        @Test
        @DisplayName("financial statement labels resolve to canonical fields")
        void financialStatement() {
            DataTable raw = table(
                "资产总计", List.of(1_000_000_000L), "净利润", List.of(100_000_000L), "revenue", List.of(5_000_000L));

            MappingResult result = engine.map(raw, DataType.FINANCIAL_STATEMENT);

            assertEquals(List.of("total_assets", "net_profit", "operating_revenue"), result.data().columns());
        }

        @Test
        @DisplayName("a column already named after the target keeps it; the synonym is left unmapped")
        void duplicateTargetClaimedOnce() {
            DataTable raw = table("c", List.of(1.0), "close", List.of(2.0));

            MappingResult result = engine.map(raw, DataType.HISTORICAL_KLINE);

            assertEquals(MatchMethod.EXACT, mappingOf(result, "close").method());
            assertEquals(MatchMethod.UNMAPPED, mappingOf(result, "c").method());
            assertEquals(List.of("c", "close"), result.data().columns());
            assertEquals(2.0, result.data().rows().get(0).get("close"));
        }
    }

    // ── custom, fuzzy, inferred ───────────────────────────────────────────────

    @Nested
    @DisplayName("fallback precedence")
    class Fallbacks {

        @Test
        @DisplayName("custom literal rules map with confidence 0.9")
        void customRules() {
            engine.addCustomMapping(DataType.HISTORICAL_KLINE, Map.of(
                "custom_open", List.of("open_custom", "custom_o"),
                "custom_close", List.of("close_custom", "custom_c")));

            MappingResult result = engine.map(
                table("open_custom", List.of(10.0, 11.0), "close_custom", List.of(10.5, 11.5)),
                DataType.HISTORICAL_KLINE);

            assertEquals(List.of("custom_open", "custom_close"), result.data().columns());
            assertEquals(0.9, mappingOf(result, "open_custom").confidence());
            assertEquals(MatchMethod.CUSTOM, mappingOf(result, "open_custom").method());
        }

        @Test
        @DisplayName("exact match wins over a custom rule for the same column")
        void exactBeatsCustom() {
            engine.addCustomRule(DataType.HISTORICAL_KLINE,
                FieldMappingRule.ofRegex("something_else", "close", FieldType.PRICE, 10));

            assertEquals("close", engine.resolve("close", List.of(1.0), DataType.HISTORICAL_KLINE).targetField());
        }

        @Test
        @DisplayName("near-miss names resolve fuzzily with similarity as confidence")
        void fuzzy() {
            ColumnMapping m = engine.resolve("close_price", List.of(10.0), DataType.HISTORICAL_KLINE);

            assertEquals("close", m.targetField());
            assertEquals(MatchMethod.FUZZY, m.method());
            assertTrue(m.confidence() >= FuzzyMatcher.SEQUENCE_CUTOFF && m.confidence() < 1.0);
        }

        @Test
        @DisplayName("unknown numeric column is inferred as volume from its values")
        void inferredVolume() {
            ColumnMapping m = engine.resolve("qqq", List.of(1_500_000, 2_000_000), DataType.HISTORICAL_KLINE);

            assertEquals("volume", m.targetField());
            assertEquals(MatchMethod.INFERRED, m.method());
            assertEquals(0.6, m.confidence());
        }

        @Test
        @DisplayName("inferred string column keeps its name")
        void inferredString() {
            ColumnMapping m = engine.resolve("symbol", List.of("AAPL", "MSFT"), DataType.HISTORICAL_KLINE);

            assertEquals("symbol", m.targetField());
            assertEquals(FieldType.STRING, m.fieldType());
        }
    }

    // ── validation, fallback, cache ───────────────────────────────────────────

    @Nested
    @DisplayName("validation and bookkeeping")
    class Validation {

        @Test
        @DisplayName("missing required K-line field fails validation")
        void missingRequired() {
            MappingResult result = engine.map(
                table("open", List.of(1.0), "high", List.of(2.0), "close", List.of(1.5)),
                DataType.HISTORICAL_KLINE);

            MappingValidation v = engine.validate(result);

            assertFalse(v.valid());
            assertEquals(List.of("low"), v.missingRequired());
        }

        @Test
        @DisplayName("mostly-null resolved column is reported inconsistent")
        void sparseColumn() {
            List<Object> sparse = new ArrayList<>();
            sparse.add(1.0);
            sparse.add(null);
            sparse.add(null);
            MappingResult result = engine.map(
                table("open", List.of(1.0, 1.1, 1.2), "high", List.of(2.0, 2.1, 2.2),
                      "low", List.of(0.5, 0.6, 0.7), "close", sparse),
                DataType.HISTORICAL_KLINE);

            MappingValidation v = engine.validate(result);

            assertFalse(v.valid());
            assertEquals(List.of("close"), v.inconsistentColumns());
        }

        @Test
        @DisplayName("direct rename applies only built-in synonyms")
        void directRename() {
            MappingResult result = engine.directRename(
                table("收盘价", List.of(1.0), "close_price", List.of(2.0)), DataType.HISTORICAL_KLINE);

            assertTrue(result.fallback());
            assertEquals(List.of("close", "close_price"), result.data().columns());
        }

        @Test
        @DisplayName("repeated mapping of the same columns is served from cache")
        void cacheHits() {
            DataTable raw = table("o", List.of(1.0), "c", List.of(1.1));
            engine.map(raw, DataType.HISTORICAL_KLINE);
            engine.map(raw, DataType.HISTORICAL_KLINE);

            MappingStatistics stats = engine.statistics();
            assertEquals(2, stats.cacheHits());
            assertEquals(4, stats.totalMappings());
            assertEquals(4, stats.exactMatches());
            assertEquals(1.0, stats.successRate());
        }
    }
}
