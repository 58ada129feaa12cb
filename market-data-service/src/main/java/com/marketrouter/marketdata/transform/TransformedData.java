package com.marketrouter.marketdata.transform;

import com.marketrouter.common.mapping.MappingResult;
import com.marketrouter.common.mapping.MappingValidation;
import com.marketrouter.common.model.DataTable;

import java.util.List;

/**
 * Output of {@link DataTransformer}: the cleaned, renamed and typed table plus how it
 * was produced.
 *
 * @param missingRequired   required canonical fields absent after mapping
 * @param droppedRows       rows removed because every cell was null after cleaning
 */
public record TransformedData(
    DataTable data,
    MappingResult mapping,
    MappingValidation validation,
    double qualityScore,
    List<String> missingRequired,
    int droppedRows
) {
    public TransformedData {
        missingRequired = List.copyOf(missingRequired);
    }

    public boolean fallbackMapping() {
        return mapping.fallback();
    }
}
