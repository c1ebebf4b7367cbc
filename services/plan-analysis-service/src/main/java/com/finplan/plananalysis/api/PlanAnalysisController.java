package com.finplan.plananalysis.api;

import com.finplan.plananalysis.exception.SheetReadException;
import com.finplan.plananalysis.model.AnalysisTreeResult;
import com.finplan.plananalysis.model.ColumnProfile;
import com.finplan.plananalysis.model.WorkbookAnalysis;
import com.finplan.plananalysis.service.PlanAnalysisService;
import com.finplan.plananalysis.service.SheetAnalysisRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/plan-analysis")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Plan Analysis", description = "Budget plan inference from spreadsheets")
public class PlanAnalysisController {

    private final PlanAnalysisService planAnalysisService;

    @PostMapping(value = "/sheets", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "List sheets", description = "Lists the sheet names of an uploaded workbook")
    public ResponseEntity<List<String>> listSheets(@RequestParam("file") MultipartFile file) {
        return ResponseEntity.ok(planAnalysisService.listSheets(content(file)));
    }

    @PostMapping(value = "/sheets/analysis", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Analyze sheets",
        description = "Classifies every sheet, previews it and suggests the most likely budget sheet")
    public ResponseEntity<WorkbookAnalysis> analyzeSheets(@RequestParam("file") MultipartFile file) {
        log.info("Analyzing sheets of {}", file.getOriginalFilename());
        return ResponseEntity.ok(planAnalysisService.analyzeWorkbook(content(file)));
    }

    @PostMapping(value = "/profiles", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Profile columns", description = "Statistical profile of every column of a sheet")
    public ResponseEntity<List<ColumnProfile>> buildColumnProfiles(
            @RequestParam("file") MultipartFile file,
            @RequestParam String sheetName,
            @RequestParam(defaultValue = "100") int maxRows) {

        log.info("Profiling columns of sheet '{}' ({} rows max)", sheetName, maxRows);
        return ResponseEntity.ok(planAnalysisService.buildColumnProfiles(content(file), sheetName, maxRows));
    }

    @PostMapping(value = "/tree", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Analyze sheet tree",
        description = "Infers category groups and tagged items; missing columns are detected")
    public ResponseEntity<AnalysisTreeResult> analyzeSheetTree(
            @RequestParam("file") MultipartFile file,
            @RequestParam String sheetName,
            @RequestParam(required = false) String categoryColumn,
            @RequestParam(required = false) String valueColumn,
            @RequestParam(required = false) Integer startRow,
            @RequestParam(defaultValue = "false") boolean includeProfiles,
            @RequestHeader("X-User-Id") UUID userId) {

        log.info("Analyzing sheet '{}' for user {}", sheetName, userId);
        AnalysisTreeResult result = planAnalysisService.analyzeSheetTree(SheetAnalysisRequest.builder()
            .userId(userId)
            .workbook(content(file))
            .sheetName(sheetName)
            .categoryColumn(categoryColumn)
            .valueColumn(valueColumn)
            .startRow(startRow)
            .includeProfiles(includeProfiles)
            .build());
        return ResponseEntity.ok(result);
    }

    private static byte[] content(MultipartFile file) {
        if (file.isEmpty()) {
            throw new SheetReadException("Uploaded file is empty");
        }
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new SheetReadException("Failed to read uploaded file " + file.getOriginalFilename(), e);
        }
    }
}
