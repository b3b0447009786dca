package com.example.reports.web;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.example.reports.domain.GeneratedDocument;
import com.example.reports.domain.ReportFormat;
import com.example.reports.export.ReportRenderingException;
import com.example.reports.service.GenerateReportRequest;
import com.example.reports.service.ReportGenerationService;
import com.example.reports.service.UnsupportedReportTypeException;

@ExtendWith(MockitoExtension.class)
class ReportControllerTest {

  private static final String INCOME_STATEMENT_REQUEST =
      """
      {
        "reportType": "income_statement",
        "reportFormat": "csv",
        "parameters": {"startDate": "2025-01-01", "endDate": "2025-01-31", "currency": "USD"},
        "data": [{"section": "INCOME", "category": "Salary", "amount": 5000, "percentage": 100}]
      }
      """;

  @Mock private ReportGenerationService generationService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new ReportController(generationService))
            .setControllerAdvice(new ReportExceptionHandler())
            .build();
  }

  @Test
  void generate_returnsDocumentAsAttachment() throws Exception {
    byte[] csv = "\"Income Statement (Profit & Loss)\"\n".getBytes(StandardCharsets.UTF_8);
    when(generationService.generate(any(GenerateReportRequest.class)))
        .thenReturn(
            new GeneratedDocument(csv, ReportFormat.CSV, "income-statement-p-l-2025-01-31.csv", 1));

    mockMvc
        .perform(
            post("/api/reports/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(INCOME_STATEMENT_REQUEST))
        .andExpect(status().isOk())
        .andExpect(header().string(HttpHeaders.CONTENT_TYPE, "text/csv"))
        .andExpect(
            header()
                .string(
                    HttpHeaders.CONTENT_DISPOSITION,
                    "attachment; filename=\"income-statement-p-l-2025-01-31.csv\""))
        .andExpect(header().string(ReportController.RECORD_COUNT_HEADER, "1"))
        .andExpect(content().bytes(csv));
  }

  @Test
  void generate_missingReportTypeIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/api/reports/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reportFormat\": \"pdf\", \"parameters\": {}, \"data\": []}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("validation_failed"));

    verifyNoInteractions(generationService);
  }

  @Test
  void generate_unsupportedTypeIsBadRequest() throws Exception {
    when(generationService.generate(any(GenerateReportRequest.class)))
        .thenThrow(new UnsupportedReportTypeException("foo"));

    mockMvc
        .perform(
            post("/api/reports/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(INCOME_STATEMENT_REQUEST.replace("income_statement", "foo")))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("invalid_request"))
        .andExpect(jsonPath("$.message").value("Unsupported report type: foo"));
  }

  @Test
  void generate_malformedBodyIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/api/reports/generate").contentType(MediaType.APPLICATION_JSON).content("{oops"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("malformed_request"));

    verifyNoInteractions(generationService);
  }

  @Test
  void generate_renderingFailureIsServerError() throws Exception {
    when(generationService.generate(any(GenerateReportRequest.class)))
        .thenThrow(new ReportRenderingException("Failed to finalize PDF: broken", null));

    mockMvc
        .perform(
            post("/api/reports/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(INCOME_STATEMENT_REQUEST))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error").value("rendering_failed"));
  }

  @Test
  void types_listsAllReportTypes() throws Exception {
    mockMvc
        .perform(get("/api/reports/types"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(7))
        .andExpect(jsonPath("$[0].code").value("income_statement"))
        .andExpect(jsonPath("$[0].category").value("Financial Statements"))
        .andExpect(jsonPath("$[1].requiresDateRange").value(false))
        .andExpect(jsonPath("$[5].defaultFormat").value("xlsx"));
  }
}
