package com.finplan.plananalysis.service;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Input of a tree analysis. Columns and start row are optional; whatever is missing
 * comes from the detected column mapping.
 */
@Value
@Builder
public class SheetAnalysisRequest {

    UUID userId;
    byte[] workbook;
    String sheetName;
    String categoryColumn;
    String valueColumn;
    Integer startRow;
    boolean includeProfiles;

    boolean hasExplicitLayout() {
        return categoryColumn != null && !categoryColumn.isBlank()
            && valueColumn != null && !valueColumn.isBlank()
            && startRow != null;
    }
}
