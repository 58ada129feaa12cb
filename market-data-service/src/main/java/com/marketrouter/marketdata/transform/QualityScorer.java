package com.marketrouter.marketdata.transform;

import com.marketrouter.common.mapping.FieldType;
import com.marketrouter.common.model.DataTable;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Scores a transformed table in [0, 1].
 *
 * <pre>
 *   completeness     non-null cells / all cells
 *   typeConsistency  fraction of scored fields whose non-null values all carry the
 *                    field's declared type (scored fields: the data type's required
 *                    fields, or every typed column when it has none)
 *   score            completeness × 0.6 + typeConsistency × 0.4
 *   fallback mapping score × 0.9
 * </pre>
 * An empty table scores 0.
 */
public final class QualityScorer {

    static final double COMPLETENESS_WEIGHT = 0.6;
    static final double CONSISTENCY_WEIGHT  = 0.4;
    static final double FALLBACK_PENALTY    = 0.9;

    private QualityScorer() {}

    public static double score(DataTable data, Map<String, FieldType> types, Collection<String> requiredFields,
                               boolean fallbackMapping) {
        double score = COMPLETENESS_WEIGHT * completeness(data)
                     + CONSISTENCY_WEIGHT * typeConsistency(data, types, requiredFields);
        if (fallbackMapping) {
            score *= FALLBACK_PENALTY;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    static double completeness(DataTable data) {
        long cells = (long) data.rowCount() * data.columnCount();
        if (cells == 0) {
            return 0.0;
        }
        long nonNull = data.rows().stream()
            .flatMap(row -> row.values().stream())
            .filter(Objects::nonNull)
            .count();
        return (double) nonNull / cells;
    }

    static double typeConsistency(DataTable data, Map<String, FieldType> types, Collection<String> requiredFields) {
        if (data.isEmpty()) {
            return 0.0;
        }
        Collection<String> scored = requiredFields.isEmpty()
            ? types.keySet().stream().filter(data::hasColumn).toList()
            : requiredFields;
        if (scored.isEmpty()) {
            return 1.0;
        }
        long consistent = scored.stream()
            .filter(field -> data.hasColumn(field) && allOfType(data.columnValues(field), types.get(field)))
            .count();
        return (double) consistent / scored.size();
    }

    private static boolean allOfType(List<Object> values, FieldType type) {
        if (type == null) {
            return true;
        }
        boolean sawValue = false;
        for (Object v : values) {
            if (v == null) {
                continue;
            }
            sawValue = true;
            if (!hasType(v, type)) {
                return false;
            }
        }
        return sawValue;
    }

    static boolean hasType(Object value, FieldType type) {
        return switch (type) {
            case PRICE, VOLUME, PERCENTAGE, CURRENCY, RATIO -> value instanceof Number;
            case DATE -> value instanceof LocalDateTime;
            case BOOLEAN -> value instanceof Boolean;
            case STRING -> true;
        };
    }
}
