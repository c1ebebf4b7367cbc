package com.finplan.plananalysis.engine;

/**
 * Structural signals of one spreadsheet row.
 *
 * @param hasValue       value cell is non-empty and not the literal "0"
 * @param isBold         category cell is emphasized (bold)
 * @param isUppercase    trimmed category is longer than two characters and all upper case
 * @param indentation    leading spaces of the raw category text
 * @param rowPosition    row index divided by the total row count
 * @param hasFormula     value cell carries a formula
 * @param valueMagnitude parsed positive value, 0 otherwise
 */
public record RowFeatures(
    boolean hasValue,
    boolean isBold,
    boolean isUppercase,
    int indentation,
    double rowPosition,
    boolean hasFormula,
    double valueMagnitude
) {
}
