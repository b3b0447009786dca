package com.example.reports.web;

import java.util.Arrays;
import java.util.List;

import jakarta.validation.Valid;

import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.reports.domain.GeneratedDocument;
import com.example.reports.domain.ReportType;
import com.example.reports.service.GenerateReportRequest;
import com.example.reports.service.ReportGenerationService;

/**
 * Report endpoints. Generated documents are returned as attachments so browsers download them
 * directly.
 */
@RestController
@RequestMapping("/api/reports")
public class ReportController {

  static final String RECORD_COUNT_HEADER = "X-Record-Count";

  private final ReportGenerationService generationService;

  public ReportController(ReportGenerationService generationService) {
    this.generationService = generationService;
  }

  @PostMapping("/generate")
  public ResponseEntity<byte[]> generate(@Valid @RequestBody GenerateReportRequest request) {
    GeneratedDocument document = generationService.generate(request);

    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.parseMediaType(document.mimeType()));
    headers.setContentDisposition(
        ContentDisposition.attachment().filename(document.fileName()).build());
    headers.setContentLength(document.sizeBytes());
    headers.add(RECORD_COUNT_HEADER, String.valueOf(document.recordCount()));
    headers.setAccessControlExposeHeaders(List.of(HttpHeaders.CONTENT_DISPOSITION, RECORD_COUNT_HEADER));

    return ResponseEntity.ok().headers(headers).body(document.content());
  }

  @GetMapping("/types")
  public List<ReportTypeInfo> types() {
    return Arrays.stream(ReportType.values()).map(ReportTypeInfo::of).toList();
  }
}
