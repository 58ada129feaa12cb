package com.marketrouter.marketdata.transform;

import com.marketrouter.common.mapping.FieldMappingEngine;
import com.marketrouter.common.mapping.FieldMappingRule;
import com.marketrouter.common.mapping.FieldType;
import com.marketrouter.common.model.DataTable;
import com.marketrouter.common.model.DataType;
import com.marketrouter.marketdata.ScriptedProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DataTransformerTest {

    private DataTransformer transformer;

    @BeforeEach
    void setUp() {
        transformer = new DataTransformer(new FieldMappingEngine());
    }

    private static Map<String, Object> row(Object... kv) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            row.put((String) kv[i], kv[i + 1]);
        }
        return row;
    }

    @Nested
    @DisplayName("mapping and coercion")
    class Mapping {

        @Test
        @DisplayName("Chinese K-line columns map to canonical names with typed values")
        void chineseKline() {
            TransformedData out = transformer.transform(ScriptedProvider.chineseKline(), DataType.HISTORICAL_KLINE);

            assertEquals(List.of("datetime", "open", "high", "low", "close", "volume"), out.data().columns());
            Map<String, Object> first = out.data().rows().get(0);
            assertEquals(LocalDateTime.of(2024, 1, 2, 0, 0), first.get("datetime"));
            assertEquals(10.0, first.get("open"));
            assertEquals(120000.0, first.get("volume"));
            assertTrue(out.missingRequired().isEmpty());
            assertTrue(out.validation().valid());
            assertFalse(out.fallbackMapping());
            assertEquals(1.0, out.qualityScore(), 1e-9);
        }

        @Test
        @DisplayName("numeric strings with separators and percent signs become numbers")
        void numericStrings() {
            DataTable raw = DataTable.fromRows(List.of(
                row("open", "1,234.5", "high", "1,240", "low", "1,200", "close", "1,230", "pct_chg", "2.5%")));

            TransformedData out = transformer.transform(raw, DataType.HISTORICAL_KLINE);

            Map<String, Object> first = out.data().rows().get(0);
            assertEquals(1234.5, first.get("open"));
            assertEquals(2.5, first.get("change_percent"));
        }

        @Test
        @DisplayName("values that do not parse are kept and lower type consistency")
        void unparseableKept() {
            DataTable raw = DataTable.fromRows(List.of(
                row("open", 10.0, "high", 10.5, "low", 9.8, "close", 10.2),
                row("open", 10.2, "high", 10.8, "low", 10.1, "close", "abc")));

            TransformedData out = transformer.transform(raw, DataType.HISTORICAL_KLINE);

            assertEquals("abc", out.data().rows().get(1).get("close"));
            // completeness 1.0, three of four required fields consistent
            assertEquals(0.6 + 0.4 * 0.75, out.qualityScore(), 1e-9);
        }
    }

    @Nested
    @DisplayName("null handling")
    class Nulls {

        @Test
        @DisplayName("null sentinels are cleaned and all-null rows dropped")
        void sentinelsAndEmptyRows() {
            DataTable raw = DataTable.fromRows(List.of(
                row("open", 10.0, "high", 10.5, "low", 9.8, "close", 10.2),
                row("open", "--", "high", "N/A", "low", "nan", "close", "")));

            TransformedData out = transformer.transform(raw, DataType.HISTORICAL_KLINE);

            assertEquals(1, out.data().rowCount());
            assertEquals(1, out.droppedRows());
            // completeness is measured before the empty row is dropped; every column is
            // half null, so validation fails and the direct-rename result is penalised
            assertTrue(out.fallbackMapping());
            assertEquals((0.6 * 0.5 + 0.4) * 0.9, out.qualityScore(), 1e-9);
        }

        @Test
        @DisplayName("cleanRow turns sentinels into null and leaves real values alone")
        void cleanRow() {
            Map<String, Object> raw = new HashMap<>();
            raw.put("a", "N/A");
            raw.put("b", Double.NaN);
            raw.put("c", 0.0);
            raw.put("d", "x");

            Map<String, Object> cleaned = DataTransformer.cleanRow(raw);

            assertNull(cleaned.get("a"));
            assertNull(cleaned.get("b"));
            assertEquals(0.0, cleaned.get("c"));
            assertEquals("x", cleaned.get("d"));
        }
    }

    @Nested
    @DisplayName("required fields")
    class Required {

        @Test
        @DisplayName("missing required fields are reported sorted")
        void missingReported() {
            DataTable raw = DataTable.fromRows(List.of(row("close", 10.2, "open", 10.0)));

            TransformedData out = transformer.transform(raw, DataType.HISTORICAL_KLINE);

            assertEquals(List.of("high", "low"), out.missingRequired());
            assertFalse(DataTransformer.requiredFieldsAbsent(out, DataType.HISTORICAL_KLINE));
        }

        @Test
        @DisplayName("a table with no required field at all is flagged")
        void allAbsent() {
            DataTable raw = DataTable.fromRows(List.of(row("zzz", "hello")));

            TransformedData out = transformer.transform(raw, DataType.HISTORICAL_KLINE);

            assertTrue(DataTransformer.requiredFieldsAbsent(out, DataType.HISTORICAL_KLINE));
        }
    }

    @Nested
    @DisplayName("fallback mapping")
    class Fallback {

        private DataTable sparseClose() {
            List<Map<String, Object>> rows = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                rows.add(row("open", 10.0 + i, "high", 11.0 + i, "low", 9.0 + i, "close", i < 2 ? 10.5 + i : null));
            }
            return DataTable.fromRows(rows);
        }

        @Test
        @DisplayName("a column below the non-null threshold switches to direct renaming with the quality penalty")
        void inconsistentColumnFallsBack() {
            TransformedData out = transformer.transform(sparseClose(), DataType.HISTORICAL_KLINE);

            assertTrue(out.fallbackMapping());
            assertFalse(out.validation().valid());
            assertEquals(List.of("close"), out.validation().inconsistentColumns());
            assertEquals(List.of("open", "high", "low", "close"), out.data().columns());
            // completeness 32/40, all four required fields typed consistently
            assertEquals((0.6 * 0.8 + 0.4) * 0.9, out.qualityScore(), 1e-9);
        }

        @Test
        @DisplayName("missing required fields still fall back when direct renaming misses no more")
        void missingFieldsFallBack() {
            DataTable raw = DataTable.fromRows(List.of(row("close", 10.2, "open", 10.0)));

            TransformedData out = transformer.transform(raw, DataType.HISTORICAL_KLINE);

            assertTrue(out.fallbackMapping());
            assertEquals(List.of("high", "low"), out.missingRequired());
        }

        @Test
        @DisplayName("direct renaming is rejected when it loses fields the full mapping found")
        void worseDirectRenameRejected() {
            FieldMappingEngine engine = new FieldMappingEngine();
            engine.addCustomRule(DataType.HISTORICAL_KLINE, FieldMappingRule.ofNames("open", List.of("px_o"), FieldType.PRICE));
            engine.addCustomRule(DataType.HISTORICAL_KLINE, FieldMappingRule.ofNames("high", List.of("px_h"), FieldType.PRICE));
            engine.addCustomRule(DataType.HISTORICAL_KLINE, FieldMappingRule.ofNames("low", List.of("px_l"), FieldType.PRICE));
            List<Map<String, Object>> rows = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                rows.add(row("px_o", 10.0, "px_h", 11.0, "px_l", 9.0, "close", i < 2 ? 10.5 : null));
            }

            TransformedData out = new DataTransformer(engine).transform(DataTable.fromRows(rows), DataType.HISTORICAL_KLINE);

            assertFalse(out.fallbackMapping());
            assertEquals(List.of("open", "high", "low", "close"), out.data().columns());
            assertEquals(0.6 * 0.8 + 0.4, out.qualityScore(), 1e-9);
        }
    }

    @Test
    @DisplayName("coerce leaves untyped columns and nulls untouched")
    void coerceUntyped() {
        assertNull(DataTransformer.coerce(null, FieldType.PRICE));
        assertEquals("raw", DataTransformer.coerce("raw", null));
        assertEquals(Boolean.TRUE, DataTransformer.coerce("yes", FieldType.BOOLEAN));
        assertEquals("12", DataTransformer.coerce(12, FieldType.STRING));
    }
}
