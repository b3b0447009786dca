package com.example.reports.domain;

import java.time.Instant;

/**
 * Outcome of one generation attempt, handed to the audit collaborator. Failed attempts carry an
 * error message and no file details.
 */
public record ReportGenerationAudit(
    String reportType,
    String reportFormat,
    String title,
    String description,
    String templateId,
    ReportStatus status,
    Instant generatedAt,
    Integer recordCount,
    Integer fileSizeBytes,
    long generationTimeMs,
    String fileName,
    String errorMessage
) {

    public static ReportGenerationAudit completed(ReportType type, ReportFormat format, String title,
                                                  String description, String templateId,
                                                  Instant generatedAt, GeneratedDocument document,
                                                  long generationTimeMs) {
        return new ReportGenerationAudit(type.getCode(), format.getCode(), title, description,
            templateId, ReportStatus.COMPLETED, generatedAt, document.recordCount(),
            document.sizeBytes(), generationTimeMs, document.fileName(), null);
    }

    public static ReportGenerationAudit failed(String reportType, String reportFormat, String title,
                                               String description, String templateId,
                                               Instant generatedAt, long generationTimeMs,
                                               String errorMessage) {
        return new ReportGenerationAudit(reportType, reportFormat, title, description, templateId,
            ReportStatus.FAILED, generatedAt, null, null, generationTimeMs, null, errorMessage);
    }
}
