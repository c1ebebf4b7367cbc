package com.finplan.plananalysis.profile;

import com.finplan.plananalysis.config.PlanAnalysisProperties;
import com.finplan.plananalysis.model.ColumnMapping;
import com.finplan.plananalysis.model.ColumnProfile;
import com.finplan.plananalysis.model.SheetAnalysis;
import com.finplan.plananalysis.model.SheetType;
import com.finplan.plananalysis.model.WorkbookAnalysis;
import com.finplan.plananalysis.sheet.NumericValues;
import com.finplan.plananalysis.sheet.SheetSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Classifies the sheets of a workbook and scores how likely each one is the budget.
 *
 * <p>A sheet with more than {@value #LIVING_PLAN_FORMULAS} formulas in its first
 * {@value #SCAN_ROWS} rows is a living plan and scores
 * {@code 100 + formulas + 10 * categories}; anything else is a data dump scoring
 * {@code 50 + 5 * categories}. Sheet names that read like a budget add
 * {@value #NAME_BOOST}. Categories are the category-like texts of column A.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SheetAnalyzer {

    static final int SCAN_ROWS = 100;
    static final int MONTH_HEADER_ROWS = 10;
    static final int LIVING_PLAN_FORMULAS = 10;
    static final int NAME_BOOST = 50;
    static final int PREVIEW_ROWS = 5;
    static final int PREVIEW_COLUMNS = 10;

    private static final List<String> MONTH_PREFIXES = List.of(
        "jan", "feb", "mar", "apr", "may", "jun", "jul", "aug", "sep", "oct", "nov", "dec",
        "janeiro", "fevereiro", "março", "abril", "maio", "junho",
        "julho", "agosto", "setembro", "outubro", "novembro", "dezembro");

    private static final List<String> BUDGET_NAME_HINTS = List.of("budget", "orc", "orç", "plan", "despesas");

    private final ColumnProfiler columnProfiler;
    private final ColumnMappingDetector mappingDetector;
    private final PlanAnalysisProperties properties;

    /**
     * Analyzes every sheet; the suggested sheet is the first with the highest score,
     * or null for a workbook without sheets.
     */
    public WorkbookAnalysis analyzeAll(List<SheetSnapshot> sheets) {
        List<SheetAnalysis> analyses = new ArrayList<>(sheets.size());
        String suggested = null;
        int bestScore = 0;
        for (SheetSnapshot sheet : sheets) {
            SheetAnalysis analysis = analyze(sheet);
            analyses.add(analysis);
            if (analysis.getScore() > bestScore) {
                bestScore = analysis.getScore();
                suggested = analysis.getName();
            }
        }
        return WorkbookAnalysis.builder()
            .sheets(List.copyOf(analyses))
            .suggestedSheet(suggested)
            .build();
    }

    public SheetAnalysis analyze(SheetSnapshot sheet) {
        int columnCount = 0;
        for (List<String> row : sheet.getRows()) {
            columnCount = Math.max(columnCount, row.size());
        }

        int scanned = Math.min(sheet.getRowCount(), SCAN_ROWS);
        int scannedFormulas = 0;
        List<String> categories = new ArrayList<>();
        List<String> months = new ArrayList<>();
        for (int row = 1; row <= scanned; row++) {
            for (int column = 1; column <= columnCount; column++) {
                if (!sheet.formulaAt(row, column).isEmpty()) {
                    scannedFormulas++;
                }
                String text = sheet.cellText(row, column).trim();
                if (row <= MONTH_HEADER_ROWS && isMonthHeader(text)) {
                    months.add(text);
                }
            }
            String first = sheet.cellText(row, 1).trim();
            if (isCategoryLike(first)) {
                categories.add(first);
            }
        }

        int formulaCount = sheet.getFormulaCount();
        SheetType type;
        int score;
        if (scannedFormulas > LIVING_PLAN_FORMULAS) {
            type = SheetType.LIVING_PLAN;
            score = 100 + formulaCount + categories.size() * 10;
        } else {
            type = SheetType.DATA_DUMP;
            score = 50 + categories.size() * 5;
        }
        if (looksLikeBudgetName(sheet.getSheetName())) {
            score += NAME_BOOST;
        }

        int sampleRows = properties.getProfileSampleRows();
        List<ColumnProfile> profiles = columnProfiler.profile(sheet, sampleRows);
        ColumnMapping mapping = mappingDetector.detect(sheet, profiles, sampleRows);

        SheetAnalysis analysis = SheetAnalysis.builder()
            .name(sheet.getSheetName())
            .type(type)
            .rowCount(sheet.getRowCount())
            .columnCount(columnCount)
            .formulaCount(formulaCount)
            .detectedCategories(List.copyOf(categories))
            .monthColumns(List.copyOf(months))
            .detectedMapping(mapping)
            .previewRows(preview(sheet))
            .score(score)
            .build();

        log.debug("Sheet '{}': {} with {} formulas, {} categories, score {}",
            sheet.getSheetName(), type, formulaCount, categories.size(), score);
        return analysis;
    }

    static boolean isMonthHeader(String text) {
        String lower = text.trim().toLowerCase(Locale.ROOT);
        return !lower.isEmpty() && MONTH_PREFIXES.stream().anyMatch(lower::startsWith);
    }

    static boolean isCategoryLike(String text) {
        String trimmed = text.trim();
        return trimmed.length() >= 3 && trimmed.length() <= 50 && !NumericValues.isNumeric(trimmed);
    }

    private static boolean looksLikeBudgetName(String sheetName) {
        String lower = sheetName.toLowerCase(Locale.ROOT);
        return BUDGET_NAME_HINTS.stream().anyMatch(lower::contains);
    }

    private static List<List<String>> preview(SheetSnapshot sheet) {
        int rows = Math.min(sheet.getRowCount(), PREVIEW_ROWS);
        List<List<String>> preview = new ArrayList<>(rows);
        for (List<String> row : sheet.getRows().subList(0, rows)) {
            preview.add(List.copyOf(row.subList(0, Math.min(row.size(), PREVIEW_COLUMNS))));
        }
        return List.copyOf(preview);
    }
}
