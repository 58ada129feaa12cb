package com.marketrouter.marketdata.transform;

import com.marketrouter.common.mapping.BuiltInFieldMappings;
import com.marketrouter.common.mapping.FieldMappingEngine;
import com.marketrouter.common.mapping.FieldType;
import com.marketrouter.common.mapping.MappingResult;
import com.marketrouter.common.mapping.MappingValidation;
import com.marketrouter.common.mapping.ValueParsers;
import com.marketrouter.common.model.DataTable;
import com.marketrouter.common.model.DataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a provider's raw table into canonical, typed data.
 *
 * <pre>
 *   clean     null sentinels (N/A, --, nan, ...) become null
 *   map       FieldMappingEngine; when validation fails, direct renaming replaces it
 *             unless it misses more required fields
 *   coerce    numeric fields to Double, DATE to LocalDateTime, BOOLEAN to Boolean;
 *             values that do not parse are kept as they are
 *   drop      rows whose cells are all null
 *   score     {@link QualityScorer}, completeness measured before rows are dropped
 * </pre>
 * Mapping problems never throw; they lower the quality score.
 */
public class DataTransformer {

    private static final Logger log = LoggerFactory.getLogger(DataTransformer.class);

    private final FieldMappingEngine mappingEngine;

    public DataTransformer(FieldMappingEngine mappingEngine) {
        this.mappingEngine = mappingEngine;
    }

    public TransformedData transform(DataTable raw, DataType dataType) {
        DataTable cleaned = raw.mapRows(DataTransformer::cleanRow);

        MappingResult mapping = mappingEngine.map(cleaned, dataType);
        MappingValidation validation = mappingEngine.validate(mapping);
        if (!validation.valid()) {
            MappingResult direct = mappingEngine.directRename(cleaned, dataType);
            MappingValidation directValidation = mappingEngine.validate(direct);
            if (directValidation.missingRequired().size() <= validation.missingRequired().size()) {
                log.info("MAPPING_FALLBACK dataType={} missingRequired={} -> {} inconsistent={}",
                         dataType, validation.missingRequired(), directValidation.missingRequired(),
                         directValidation.inconsistentColumns());
                mapping = direct;
                validation = directValidation;
            } else {
                log.info("MAPPING_FALLBACK_REJECTED dataType={} missingRequired={} directMissing={}",
                         dataType, validation.missingRequired(), directValidation.missingRequired());
            }
        }

        Map<String, FieldType> types = mapping.targetTypes();
        DataTable typed = mapping.data().mapRows(row -> coerceRow(row, types));
        Set<String> required = BuiltInFieldMappings.requiredFields(dataType);
        double quality = QualityScorer.score(typed, types, required, mapping.fallback());

        DataTable compact = typed.dropEmptyRows();
        int dropped = typed.rowCount() - compact.rowCount();

        List<String> missing = new ArrayList<>();
        for (String field : required) {
            if (!compact.hasColumn(field)) {
                missing.add(field);
            }
        }
        missing.sort(null);

        log.debug("DATA_TRANSFORMED dataType={} rows={} dropped={} quality={} fallback={}",
                  dataType, compact.rowCount(), dropped, quality, mapping.fallback());
        return new TransformedData(compact, mapping.withData(compact), validation, quality, missing, dropped);
    }

    /**
     * True when the data type has required fields and not one of them survived mapping.
     * Such a result cannot be repaired by scoring and is treated as a data-quality failure.
     */
    public static boolean requiredFieldsAbsent(TransformedData transformed, DataType dataType) {
        Set<String> required = BuiltInFieldMappings.requiredFields(dataType);
        return !required.isEmpty() && transformed.missingRequired().size() == required.size();
    }

    // ── row helpers ───────────────────────────────────────────────────────────

    static Map<String, Object> cleanRow(Map<String, Object> row) {
        Map<String, Object> out = new LinkedHashMap<>();
        row.forEach((k, v) -> out.put(k, ValueParsers.isNullLike(v) ? null : v));
        return out;
    }

    static Map<String, Object> coerceRow(Map<String, Object> row, Map<String, FieldType> types) {
        Map<String, Object> out = new LinkedHashMap<>();
        row.forEach((column, value) -> out.put(column, coerce(value, types.get(column))));
        return out;
    }

    static Object coerce(Object value, FieldType type) {
        if (value == null || type == null) {
            return value;
        }
        Optional<?> parsed = switch (type) {
            case PRICE, VOLUME, PERCENTAGE, CURRENCY, RATIO -> ValueParsers.parseNumber(value);
            case DATE -> ValueParsers.parseDateTime(value);
            case BOOLEAN -> ValueParsers.parseBoolean(value);
            case STRING -> Optional.of(value.toString());
        };
        return parsed.isPresent() ? parsed.get() : value;
    }
}
