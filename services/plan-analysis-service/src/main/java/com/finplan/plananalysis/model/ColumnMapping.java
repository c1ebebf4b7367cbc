package com.finplan.plananalysis.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Suggested column layout of a budget sheet.
 */
@Getter
@Builder
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ColumnMapping {

    private final String categoryColumn;
    private final String valueColumn;

    /** First data row (1-based), right after the detected header row. */
    private final int dataStartRow;

    private final String percentageColumn;
    private final double confidence;
}
