package com.finplan.plananalysis.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Statistical features of one sheet column over the sampled rows.
 * Densities are fractions of the rows analyzed after the header guard.
 */
@Getter
@Builder
@ToString
public class ColumnProfile {

    /** 1-based column index. */
    private final int index;
    private final String letter;
    private final double numericDensity;
    private final double formulaDensity;
    private final double emptyDensity;
    private final double textDensity;
    private final double uniqueRatio;
    private final double avgTextLength;
}
