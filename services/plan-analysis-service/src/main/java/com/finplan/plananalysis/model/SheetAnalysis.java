package com.finplan.plananalysis.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * Quick look at one sheet, used to pick the sheet to build a plan from.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SheetAnalysis {

    private final String name;
    private final SheetType type;
    private final int rowCount;
    private final int columnCount;
    private final int formulaCount;

    @Builder.Default
    private final List<String> detectedCategories = List.of();

    @Builder.Default
    private final List<String> monthColumns = List.of();

    private final ColumnMapping detectedMapping;

    /** Leading rows as displayed, trimmed to a small window. */
    @Builder.Default
    private final List<List<String>> previewRows = List.of();

    /** Higher means more likely to be the main budget sheet. */
    private final int score;
}
