package com.example.reports.service;

import com.example.reports.domain.ReportGenerationAudit;

/**
 * Receives one audit entry per generation attempt, successful or not. Implementations must not
 * assume the document was delivered to the caller.
 */
public interface ReportAuditRecorder {

  void record(ReportGenerationAudit audit);
}
