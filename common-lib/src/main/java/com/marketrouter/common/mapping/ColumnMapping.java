package com.marketrouter.common.mapping;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Resolution of one raw column name.
 */
public record ColumnMapping(
    @JsonProperty("sourceField") String sourceField,
    @JsonProperty("targetField") String targetField,
    @JsonProperty("confidence")  double confidence,
    @JsonProperty("method")      MatchMethod method,
    @JsonProperty("fieldType")   FieldType fieldType
) {
    public static ColumnMapping unmapped(String column, FieldType type) {
        return new ColumnMapping(column, column, 0.0, MatchMethod.UNMAPPED, type);
    }

    public boolean renames() {
        return !sourceField.equals(targetField);
    }
}
