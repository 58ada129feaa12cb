package com.marketrouter.common.mapping;

import com.marketrouter.common.model.DataTable;
import com.marketrouter.common.model.DataType;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mapped table plus how every column got its name.
 *
 * @param fallback true when this result came from direct-rename-only mapping after
 *                 full mapping failed validation
 */
public record MappingResult(
    DataTable data,
    DataType dataType,
    List<ColumnMapping> columns,
    boolean fallback
) {
    public MappingResult {
        columns = List.copyOf(columns);
    }

    /** Source → target for every column, including unchanged ones. */
    public Map<String, String> fieldMappings() {
        Map<String, String> out = new LinkedHashMap<>();
        columns.forEach(c -> out.put(c.sourceField(), c.targetField()));
        return out;
    }

    public Map<String, Double> confidences() {
        Map<String, Double> out = new LinkedHashMap<>();
        columns.forEach(c -> out.put(c.sourceField(), c.confidence()));
        return out;
    }

    /** Field type of each output column, keyed by target name. */
    public Map<String, FieldType> targetTypes() {
        Map<String, FieldType> out = new LinkedHashMap<>();
        columns.forEach(c -> out.put(c.targetField(), c.fieldType()));
        return out;
    }

    public Map<MatchMethod, Integer> methodCounts() {
        Map<MatchMethod, Integer> out = new EnumMap<>(MatchMethod.class);
        columns.forEach(c -> out.merge(c.method(), 1, Integer::sum));
        return out;
    }

    public MappingResult withData(DataTable newData) {
        return new MappingResult(newData, dataType, columns, fallback);
    }
}
