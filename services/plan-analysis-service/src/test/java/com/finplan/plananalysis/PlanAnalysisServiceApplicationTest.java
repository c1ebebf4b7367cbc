package com.finplan.plananalysis;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.actuate.observability.AutoConfigureObservability;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.UUID;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end run against PostgreSQL: a saved correction changes the next analysis of
 * the same user only. Skipped when Docker is not available.
 */
@SpringBootTest
@AutoConfigureMockMvc
@AutoConfigureObservability
@Testcontainers(disabledWithoutDocker = true)
@ActiveProfiles("test")
@DisplayName("Plan Analysis Service Integration Tests")
class PlanAnalysisServiceApplicationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
        .withDatabaseName("finplan_plan_analysis_test")
        .withUsername("test_user")
        .withPassword("test_password");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private MockMvc mockMvc;

    private static MockMultipartFile budgetWorkbook() throws IOException {
        try (XSSFWorkbook workbook = new XSSFWorkbook();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = workbook.createSheet("Budget");
            sheet.createRow(0).createCell(0).setCellValue("SHOPPING");
            Row item = sheet.createRow(1);
            item.createCell(0).setCellValue("  Lidl");
            item.createCell(2).setCellValue(25);
            workbook.write(out);
            return new MockMultipartFile("file", "budget.xlsx",
                "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", out.toByteArray());
        }
    }

    @Test
    @DisplayName("Should apply a saved correction to the same user's next analysis")
    void shouldLearnFromCorrection() throws Exception {
        // Given
        UUID userId = UUID.randomUUID();
        UUID otherUserId = UUID.randomUUID();
        MockMultipartFile workbook = budgetWorkbook();

        mockMvc.perform(multipart("/api/v1/plan-analysis/tree").file(workbook)
                .param("sheetName", "Budget")
                .param("categoryColumn", "A")
                .param("valueColumn", "C")
                .param("startRow", "1")
                .header("X-User-Id", userId.toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.nodes[0].children[0].tag").value(""));

        // When
        mockMvc.perform(post("/api/v1/plan-analysis/corrections")
                .header("X-User-Id", userId.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"term": "Lidl", "correctedTag": "B", "sourceFileId": "budget.xlsx"}
                    """))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.term").value("lidl"))
            .andExpect(jsonPath("$.predictedTag").value(""));

        // Then
        mockMvc.perform(multipart("/api/v1/plan-analysis/tree").file(workbook)
                .param("sheetName", "Budget")
                .param("categoryColumn", "A")
                .param("valueColumn", "C")
                .param("startRow", "1")
                .header("X-User-Id", userId.toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.personalized").value(true))
            .andExpect(jsonPath("$.nodes[0].name").value("SHOPPING"))
            .andExpect(jsonPath("$.nodes[0].children[0].name").value("Lidl"))
            .andExpect(jsonPath("$.nodes[0].children[0].tag").value("B"))
            .andExpect(jsonPath("$.nodes[0].children[0].isAutoApproved").value(true));

        mockMvc.perform(multipart("/api/v1/plan-analysis/tree").file(workbook)
                .param("sheetName", "Budget")
                .param("categoryColumn", "A")
                .param("valueColumn", "C")
                .param("startRow", "1")
                .header("X-User-Id", otherUserId.toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.nodes[0].children[0].tag").value(""));

        mockMvc.perform(get("/api/v1/plan-analysis/corrections").header("X-User-Id", userId.toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].correctedTag").value("B"));
    }

    @Test
    @DisplayName("Should expose analysis metrics in Prometheus format")
    void shouldExposePrometheusEndpoint() throws Exception {
        mockMvc.perform(multipart("/api/v1/plan-analysis/tree").file(budgetWorkbook())
                .param("sheetName", "Budget")
                .param("categoryColumn", "A")
                .param("valueColumn", "C")
                .param("startRow", "1")
                .header("X-User-Id", UUID.randomUUID().toString()))
            .andExpect(status().isOk());

        mockMvc.perform(get("/actuator/prometheus"))
            .andExpect(status().isOk())
            .andExpect(content().string(containsString("plan_analysis_completed_total")));
    }
}
