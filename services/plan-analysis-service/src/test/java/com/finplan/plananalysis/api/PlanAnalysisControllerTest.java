package com.finplan.plananalysis.api;

import com.finplan.plananalysis.exception.SheetNotFoundException;
import com.finplan.plananalysis.model.AnalysisNode;
import com.finplan.plananalysis.model.AnalysisTreeResult;
import com.finplan.plananalysis.model.ColumnMapping;
import com.finplan.plananalysis.model.ItemTag;
import com.finplan.plananalysis.model.NodeType;
import com.finplan.plananalysis.model.SheetAnalysis;
import com.finplan.plananalysis.model.SheetType;
import com.finplan.plananalysis.model.WorkbookAnalysis;
import com.finplan.plananalysis.service.PlanAnalysisService;
import com.finplan.plananalysis.service.SheetAnalysisRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PlanAnalysisController.class)
@DisplayName("PlanAnalysisController Tests")
class PlanAnalysisControllerTest {

    private static final String XLSX = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PlanAnalysisService planAnalysisService;

    private final MockMultipartFile workbook = new MockMultipartFile("file", "budget.xlsx", XLSX, new byte[]{1, 2, 3});

    @Test
    @DisplayName("Should list the sheets of an uploaded workbook")
    void shouldListSheets() throws Exception {
        when(planAnalysisService.listSheets(any(byte[].class))).thenReturn(List.of("Budget", "Notes"));

        mockMvc.perform(multipart("/api/v1/plan-analysis/sheets").file(workbook))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0]").value("Budget"))
            .andExpect(jsonPath("$[1]").value("Notes"));
    }

    @Test
    @DisplayName("Should analyze every sheet and suggest the budget sheet")
    void shouldAnalyzeSheets() throws Exception {
        // Given
        WorkbookAnalysis analysis = WorkbookAnalysis.builder()
            .sheets(List.of(
                SheetAnalysis.builder()
                    .name("Export")
                    .type(SheetType.DATA_DUMP)
                    .rowCount(4)
                    .columnCount(3)
                    .detectedCategories(List.of("Date"))
                    .previewRows(List.of(List.of("Date", "Description", "Amount")))
                    .score(55)
                    .build(),
                SheetAnalysis.builder()
                    .name("Budget")
                    .type(SheetType.LIVING_PLAN)
                    .rowCount(40)
                    .columnCount(14)
                    .formulaCount(36)
                    .monthColumns(List.of("Jan", "Feb"))
                    .detectedMapping(ColumnMapping.builder()
                        .categoryColumn("A")
                        .valueColumn("C")
                        .dataStartRow(2)
                        .confidence(0.95)
                        .build())
                    .score(286)
                    .build()))
            .suggestedSheet("Budget")
            .build();
        when(planAnalysisService.analyzeWorkbook(any(byte[].class))).thenReturn(analysis);

        // When / Then
        mockMvc.perform(multipart("/api/v1/plan-analysis/sheets/analysis").file(workbook))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.suggestedSheet").value("Budget"))
            .andExpect(jsonPath("$.sheets[0].type").value("DATA_DUMP"))
            .andExpect(jsonPath("$.sheets[0].previewRows[0][2]").value("Amount"))
            .andExpect(jsonPath("$.sheets[0].detectedMapping").doesNotExist())
            .andExpect(jsonPath("$.sheets[1].type").value("LIVING_PLAN"))
            .andExpect(jsonPath("$.sheets[1].formulaCount").value(36))
            .andExpect(jsonPath("$.sheets[1].monthColumns[1]").value("Feb"))
            .andExpect(jsonPath("$.sheets[1].detectedMapping.valueColumn").value("C"))
            .andExpect(jsonPath("$.sheets[1].score").value(286));
    }

    @Test
    @DisplayName("Should profile one hundred rows unless told otherwise")
    void shouldProfileWithDefaultRowLimit() throws Exception {
        when(planAnalysisService.buildColumnProfiles(any(byte[].class), eq("Budget"), eq(100))).thenReturn(List.of());

        mockMvc.perform(multipart("/api/v1/plan-analysis/profiles").file(workbook)
                .param("sheetName", "Budget"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isEmpty());
    }

    @Test
    @DisplayName("Should return the analysis tree with review flags")
    void shouldAnalyzeTree() throws Exception {
        // Given
        UUID userId = UUID.randomUUID();
        AnalysisNode item = AnalysisNode.builder()
            .id("0a1b2c3d")
            .name("Netflix")
            .value(12.5)
            .type(NodeType.ITEM)
            .tag(ItemTag.RECURRING)
            .confidence(0.975)
            .excelCell("A3")
            .excelRow(3)
            .build();
        AnalysisNode group = AnalysisNode.builder()
            .id("4e5f6a7b")
            .name("SUBSCRIPTIONS")
            .type(NodeType.GROUP)
            .tag(ItemTag.UNKNOWN)
            .confidence(0.5)
            .excelCell("A2")
            .excelRow(2)
            .children(List.of(item))
            .build();
        when(planAnalysisService.analyzeSheetTree(any(SheetAnalysisRequest.class))).thenReturn(
            AnalysisTreeResult.builder()
                .sheetName("Budget")
                .nodes(List.of(group))
                .totalGroups(1)
                .totalItems(1)
                .overallConfidence(0.7375)
                .autoApprovedItems(1)
                .personalized(true)
                .build());

        // When / Then
        mockMvc.perform(multipart("/api/v1/plan-analysis/tree").file(workbook)
                .param("sheetName", "Budget")
                .param("categoryColumn", "A")
                .header("X-User-Id", userId.toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.sheetName").value("Budget"))
            .andExpect(jsonPath("$.personalized").value(true))
            .andExpect(jsonPath("$.nodes[0].type").value("GROUP"))
            .andExpect(jsonPath("$.nodes[0].needsReview").value(true))
            .andExpect(jsonPath("$.nodes[0].children[0].tag").value("R"))
            .andExpect(jsonPath("$.nodes[0].children[0].isAutoApproved").value(true))
            .andExpect(jsonPath("$.nodes[0].children[0].valueMinor").value(1250));

        ArgumentCaptor<SheetAnalysisRequest> captor = ArgumentCaptor.forClass(SheetAnalysisRequest.class);
        verify(planAnalysisService).analyzeSheetTree(captor.capture());
        assertThat(captor.getValue().getUserId()).isEqualTo(userId);
        assertThat(captor.getValue().getCategoryColumn()).isEqualTo("A");
        assertThat(captor.getValue().getValueColumn()).isNull();
        assertThat(captor.getValue().getStartRow()).isNull();
        assertThat(captor.getValue().getWorkbook()).containsExactly(1, 2, 3);
    }

    @Test
    @DisplayName("Should require the user header for tree analysis")
    void shouldRequireUserHeader() throws Exception {
        mockMvc.perform(multipart("/api/v1/plan-analysis/tree").file(workbook)
                .param("sheetName", "Budget"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(planAnalysisService);
    }

    @Test
    @DisplayName("Should answer 404 with the available sheets when the sheet is missing")
    void shouldReportMissingSheet() throws Exception {
        when(planAnalysisService.analyzeSheetTree(any(SheetAnalysisRequest.class)))
            .thenThrow(new SheetNotFoundException("Plan", List.of("Budget", "Notes")));

        mockMvc.perform(multipart("/api/v1/plan-analysis/tree").file(workbook)
                .param("sheetName", "Plan")
                .header("X-User-Id", UUID.randomUUID().toString()))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("SHEET_002"))
            .andExpect(jsonPath("$.details.availableSheets[1]").value("Notes"))
            .andExpect(jsonPath("$.path").value("/api/v1/plan-analysis/tree"));
    }

    @Test
    @DisplayName("Should reject an empty upload as unreadable")
    void shouldRejectEmptyUpload() throws Exception {
        MockMultipartFile empty = new MockMultipartFile("file", "empty.xlsx", XLSX, new byte[0]);

        mockMvc.perform(multipart("/api/v1/plan-analysis/sheets").file(empty))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("SHEET_001"));

        verifyNoInteractions(planAnalysisService);
    }
}
