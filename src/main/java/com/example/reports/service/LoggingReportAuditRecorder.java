package com.example.reports.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.reports.domain.ReportGenerationAudit;
import com.example.reports.domain.ReportStatus;

/** Writes audit entries to the application log. */
@Component
public class LoggingReportAuditRecorder implements ReportAuditRecorder {

  private static final Logger log = LoggerFactory.getLogger(LoggingReportAuditRecorder.class);

  @Override
  public void record(ReportGenerationAudit audit) {
    if (audit.status() == ReportStatus.COMPLETED) {
      log.info(
          "Report {} ({}) completed: {} rows, {} bytes in {} ms as {}",
          audit.reportType(),
          audit.reportFormat(),
          audit.recordCount(),
          audit.fileSizeBytes(),
          audit.generationTimeMs(),
          audit.fileName());
    } else {
      log.warn(
          "Report {} ({}) failed after {} ms: {}",
          audit.reportType(),
          audit.reportFormat(),
          audit.generationTimeMs(),
          audit.errorMessage());
    }
  }
}
