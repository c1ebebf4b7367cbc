package com.finplan.plananalysis.profile;

import com.finplan.plananalysis.config.PlanAnalysisProperties;
import com.finplan.plananalysis.model.ColumnMapping;
import com.finplan.plananalysis.model.ColumnProfile;
import com.finplan.plananalysis.sheet.NumericValues;
import com.finplan.plananalysis.sheet.SheetSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Suggests which columns hold category names, values and percentages, and where the
 * data starts. Used when a caller does not name the columns explicitly.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ColumnMappingDetector {

    static final int HEADER_SCAN_ROWS = 10;

    private static final List<String> HEADER_HINTS = List.of(
        "meses", "month", "categoria", "category", "valor", "value", "jan", "atual", "current", "%");

    private final PlanAnalysisProperties properties;

    public ColumnMapping detect(SheetSnapshot sheet, List<ColumnProfile> profiles, int maxRows) {
        ColumnProfile category = null;
        for (ColumnProfile profile : profiles) {
            if (profile.getTextDensity() > 0
                && (category == null || profile.getTextDensity() > category.getTextDensity())) {
                category = profile;
            }
        }

        ColumnProfile value = null;
        double valueSignal = 0;
        for (ColumnProfile profile : profiles) {
            double signal = profile.getNumericDensity() + 2 * profile.getFormulaDensity();
            if (profile != category && signal > valueSignal) {
                value = profile;
                valueSignal = signal;
            }
        }

        String percentageColumn = detectPercentageColumn(sheet, profiles, category, value, maxRows);

        double confidence = 0.5;
        if (category != null && category.getTextDensity() > 0.1 && valueSignal > 0.1) {
            confidence = 0.8;
        }
        if (category != null && category.getIndex() == 1 && valueSignal > 0.2) {
            confidence = 0.9;
        }
        if (category != null && value != null) {
            confidence += 0.05;
        }
        if (category == null || value == null) {
            confidence = 0.3;
        }

        ColumnMapping mapping = ColumnMapping.builder()
            .categoryColumn(category != null ? category.getLetter() : properties.getDefaultCategoryColumn().toUpperCase())
            .valueColumn(value != null ? value.getLetter() : properties.getDefaultValueColumn().toUpperCase())
            .percentageColumn(percentageColumn)
            .dataStartRow(detectDataStartRow(sheet))
            .confidence(confidence)
            .build();

        log.debug("Detected column mapping for sheet '{}': {}", sheet.getSheetName(), mapping);
        return mapping;
    }

    /**
     * Row right after the first of the top rows carrying at least two header hints, else 1.
     */
    int detectDataStartRow(SheetSnapshot sheet) {
        for (int row = 1; row <= HEADER_SCAN_ROWS && row <= sheet.getRowCount(); row++) {
            int hints = 0;
            for (String cell : sheet.getRows().get(row - 1)) {
                String text = cell.trim().toLowerCase(Locale.ROOT);
                if (!text.isEmpty() && HEADER_HINTS.stream().anyMatch(text::contains)) {
                    hints++;
                }
            }
            if (hints >= 2) {
                return row + 1;
            }
        }
        return 1;
    }

    private String detectPercentageColumn(SheetSnapshot sheet, List<ColumnProfile> profiles,
                                          ColumnProfile category, ColumnProfile value, int maxRows) {
        int sampled = ColumnProfiler.sampleBound(sheet.getRowCount(), maxRows);
        String best = null;
        double bestShare = 0.5;
        for (ColumnProfile profile : profiles) {
            if (profile == category || profile == value || profile.getNumericDensity() == 0) {
                continue;
            }
            int numeric = 0;
            int percent = 0;
            for (int row = ColumnProfiler.HEADER_GUARD_ROWS + 1; row <= sampled; row++) {
                String text = sheet.cellText(row, profile.getIndex()).trim();
                if (NumericValues.isNumeric(text)) {
                    numeric++;
                    if (text.contains("%")) {
                        percent++;
                    }
                }
            }
            double share = numeric == 0 ? 0 : (double) percent / numeric;
            if (share > bestShare) {
                best = profile.getLetter();
                bestShare = share;
            }
        }
        return best;
    }
}
