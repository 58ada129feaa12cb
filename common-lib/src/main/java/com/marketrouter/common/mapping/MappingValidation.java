package com.marketrouter.common.mapping;

import java.util.List;

public record MappingValidation(
    boolean valid,
    List<String> missingRequired,
    List<String> inconsistentColumns
) {
    public MappingValidation {
        missingRequired     = List.copyOf(missingRequired);
        inconsistentColumns = List.copyOf(inconsistentColumns);
    }
}
