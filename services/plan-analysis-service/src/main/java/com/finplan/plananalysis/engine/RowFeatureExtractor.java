package com.finplan.plananalysis.engine;

import com.finplan.plananalysis.sheet.NumericValues;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class RowFeatureExtractor {

    /**
     * @param rawCategory category cell text exactly as read, leading spaces included
     * @param valueText   value cell text
     * @param styleId     style identifier of the category cell, 0 for the default style
     * @param hasFormula  whether the value cell carries a formula
     * @param rowIndex    1-based row index
     * @param totalRows   rows in the sheet
     */
    public RowFeatures extract(String rawCategory, String valueText, int styleId,
                               boolean hasFormula, int rowIndex, int totalRows) {
        String raw = rawCategory == null ? "" : rawCategory;
        String category = raw.trim();
        String value = valueText == null ? "" : valueText.trim();

        double magnitude = NumericValues.parse(value).orElse(0.0);

        return new RowFeatures(
            !value.isEmpty() && !"0".equals(value),
            styleId > 0,
            category.length() > 2 && category.equals(category.toUpperCase(Locale.ROOT)),
            leadingSpaces(raw),
            totalRows > 0 ? (double) rowIndex / totalRows : 0.0,
            hasFormula,
            magnitude > 0 ? magnitude : 0.0
        );
    }

    private static int leadingSpaces(String text) {
        int count = 0;
        while (count < text.length() && text.charAt(count) == ' ') {
            count++;
        }
        return count;
    }
}
