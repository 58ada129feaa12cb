package com.marketrouter.common.mapping;

/**
 * Semantic type of a canonical field. Drives type coercion and quality scoring.
 */
public enum FieldType {
    PRICE,
    VOLUME,
    PERCENTAGE,
    CURRENCY,
    RATIO,
    DATE,
    BOOLEAN,
    STRING;

    public boolean isNumeric() {
        return this == PRICE || this == VOLUME || this == PERCENTAGE || this == CURRENCY || this == RATIO;
    }
}
