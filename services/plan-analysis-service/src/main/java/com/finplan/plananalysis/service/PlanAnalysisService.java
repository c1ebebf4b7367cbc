package com.finplan.plananalysis.service;

import com.finplan.common.exception.BusinessException;
import com.finplan.plananalysis.engine.TreeBuilder;
import com.finplan.plananalysis.engine.TreeLayout;
import com.finplan.plananalysis.exception.CorrectionHydrationException;
import com.finplan.plananalysis.config.PlanAnalysisProperties;
import com.finplan.plananalysis.metrics.PlanAnalysisMetrics;
import com.finplan.plananalysis.ml.UserTagOverlay;
import com.finplan.plananalysis.model.AnalysisTreeResult;
import com.finplan.plananalysis.model.ColumnMapping;
import com.finplan.plananalysis.model.ColumnProfile;
import com.finplan.plananalysis.model.WorkbookAnalysis;
import com.finplan.plananalysis.profile.ColumnMappingDetector;
import com.finplan.plananalysis.profile.ColumnProfiler;
import com.finplan.plananalysis.profile.SheetAnalyzer;
import com.finplan.plananalysis.sheet.CellRefs;
import com.finplan.plananalysis.sheet.SheetSnapshot;
import com.finplan.plananalysis.sheet.SpreadsheetReader;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Entry point of sheet analysis: reads the sheet, loads the user's learned
 * corrections, fills in any layout the caller left out and builds the tree.
 *
 * <p>A correction store outage never fails an analysis; the tree is then built from
 * the shared predictor layers only and reported as not personalized.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlanAnalysisService {

    private final SpreadsheetReader spreadsheetReader;
    private final ColumnProfiler columnProfiler;
    private final ColumnMappingDetector mappingDetector;
    private final SheetAnalyzer sheetAnalyzer;
    private final TreeBuilder treeBuilder;
    private final CorrectionLearningService correctionLearningService;
    private final PlanAnalysisProperties properties;
    private final PlanAnalysisMetrics metrics;

    public List<String> listSheets(byte[] workbook) {
        return spreadsheetReader.listSheets(workbook);
    }

    /**
     * Classifies every sheet of the workbook and suggests the one to analyze.
     */
    public WorkbookAnalysis analyzeWorkbook(byte[] workbook) {
        WorkbookAnalysis analysis = sheetAnalyzer.analyzeAll(spreadsheetReader.readAllSheets(workbook));
        log.info("Analyzed {} sheets, suggested '{}'", analysis.getSheets().size(), analysis.getSuggestedSheet());
        return analysis;
    }

    /**
     * @param maxRows rows to sample; null uses the configured default, 0 or less means all rows
     */
    public List<ColumnProfile> buildColumnProfiles(byte[] workbook, String sheetName, Integer maxRows) {
        SheetSnapshot sheet = spreadsheetReader.readSheet(workbook, sheetName);
        return columnProfiler.profile(sheet, maxRows != null ? maxRows : properties.getProfileSampleRows());
    }

    public AnalysisTreeResult analyzeSheetTree(SheetAnalysisRequest request) {
        Timer.Sample sample = metrics.startTimer();

        // reject bad column references before touching the workbook
        Integer categoryColumn = columnOrNull(request.getCategoryColumn());
        Integer valueColumn = columnOrNull(request.getValueColumn());

        SheetSnapshot sheet;
        try {
            sheet = spreadsheetReader.readSheet(request.getWorkbook(), request.getSheetName());
        } catch (BusinessException e) {
            metrics.recordAnalysisFailure(e.getErrorCode().getCode());
            throw e;
        }

        UserTagOverlay overlay = overlayOrNull(request.getUserId());

        List<ColumnProfile> profiles = null;
        ColumnMapping mapping = null;
        if (!request.hasExplicitLayout() || request.isIncludeProfiles()) {
            profiles = columnProfiler.profile(sheet, properties.getProfileSampleRows());
            mapping = mappingDetector.detect(sheet, profiles, properties.getProfileSampleRows());
        }

        TreeLayout layout = new TreeLayout(
            categoryColumn != null ? categoryColumn : CellRefs.columnIndex(mapping.getCategoryColumn()),
            valueColumn != null ? valueColumn : CellRefs.columnIndex(mapping.getValueColumn()),
            request.getStartRow() != null ? request.getStartRow() : mapping.getDataStartRow());

        AnalysisTreeResult result = treeBuilder.build(sheet, layout, overlay).toBuilder()
            .columnProfiles(request.isIncludeProfiles() ? profiles : null)
            .detectedMapping(mapping)
            .personalized(overlay != null)
            .build();

        metrics.recordAnalysis(sample, result);
        log.info("Analyzed sheet '{}' for user {}: {} groups, {} items, {} need review, personalized={}",
            sheet.getSheetName(), request.getUserId(), result.getTotalGroups(), result.getTotalItems(),
            result.getItemsNeedingReview(), result.isPersonalized());
        return result;
    }

    private UserTagOverlay overlayOrNull(UUID userId) {
        if (userId == null) {
            return null;
        }
        try {
            return correctionLearningService.overlayFor(userId);
        } catch (CorrectionHydrationException e) {
            log.warn("Continuing without learned corrections for user {}: {}", userId, e.getMessage());
            return null;
        }
    }

    private static Integer columnOrNull(String letters) {
        return letters == null || letters.isBlank() ? null : CellRefs.columnIndex(letters);
    }
}
