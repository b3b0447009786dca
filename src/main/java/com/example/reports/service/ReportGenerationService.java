package com.example.reports.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.example.reports.config.ReportProperties;
import com.example.reports.domain.GeneratedDocument;
import com.example.reports.domain.ReportFormat;
import com.example.reports.domain.ReportGenerationAudit;
import com.example.reports.domain.ReportParameters;
import com.example.reports.domain.ReportRow;
import com.example.reports.domain.ReportType;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Entry point for report requests arriving as raw JSON. Resolves the report type and format, binds
 * the rows, hands them to the {@link ReportCompiler} and records the outcome for auditing.
 */
@Service
public class ReportGenerationService {

    private static final Logger log = LoggerFactory.getLogger(ReportGenerationService.class);

    private final ReportCompiler compiler;
    private final ReportAuditRecorder auditRecorder;
    private final ObjectMapper objectMapper;
    private final ReportProperties properties;
    private final Clock clock;

    public ReportGenerationService(ReportCompiler compiler,
                                   ReportAuditRecorder auditRecorder,
                                   ObjectMapper objectMapper,
                                   ReportProperties properties,
                                   Clock clock) {
        this.compiler = compiler;
        this.auditRecorder = auditRecorder;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Renders the requested report.
     *
     * @param request the report type, format, parameters and raw rows
     * @return the rendered document
     * @throws ReportRequestException if the type, format, parameters or rows are invalid
     */
    public GeneratedDocument generate(GenerateReportRequest request) {
        Instant startedAt = clock.instant();
        ReportType type = null;
        try {
            type = ReportType.fromCode(request.reportType());
            ReportFormat format = ReportFormat.fromCode(request.reportFormat());
            ReportParameters parameters = request.parameters();
            validateParameters(type, parameters);
            List<ReportRow> rows = bindRows(type, request.data());

            GeneratedDocument document = compiler.generateReport(type, format, rows, parameters);

            record(ReportGenerationAudit.completed(type, format, titleFor(request, type),
                request.description(), request.templateId(), startedAt, document,
                elapsedMillis(startedAt)));
            return document;
        } catch (RuntimeException e) {
            record(ReportGenerationAudit.failed(request.reportType(), request.reportFormat(),
                titleFor(request, type), request.description(), request.templateId(), startedAt,
                elapsedMillis(startedAt), e.getMessage()));
            throw e;
        }
    }

    private void validateParameters(ReportType type, ReportParameters parameters) {
        if (parameters == null) {
            throw new InvalidReportDataException("Report parameters are required");
        }
        if (type.isRequiresDateRange()) {
            if (parameters.startDate() == null || parameters.endDate() == null) {
                throw new InvalidReportDataException(
                    type.getTitle() + " requires both startDate and endDate");
            }
            if (parameters.startDate().isAfter(parameters.endDate())) {
                throw new InvalidReportDataException(
                    "startDate " + parameters.startDate() + " is after endDate " + parameters.endDate());
            }
        } else if (parameters.effectiveAsOfDate() == null) {
            throw new InvalidReportDataException(type.getTitle() + " requires asOfDate or endDate");
        }
    }

    private List<ReportRow> bindRows(ReportType type, List<Map<String, Object>> data) {
        if (data == null) {
            throw new InvalidReportDataException("Report data is required");
        }
        if (data.size() > properties.maxRows()) {
            throw new InvalidReportDataException(
                "Report data has " + data.size() + " rows; at most " + properties.maxRows() + " are allowed");
        }

        List<ReportRow> rows = new ArrayList<>(data.size());
        for (int i = 0; i < data.size(); i++) {
            Map<String, Object> raw = data.get(i);
            if (raw == null) {
                throw new InvalidReportDataException("Row " + i + " is empty");
            }
            try {
                rows.add(objectMapper.convertValue(raw, type.getRowType()));
            } catch (IllegalArgumentException e) {
                throw new InvalidReportDataException(
                    "Row " + i + " is not a valid " + type.getCode() + " row: " + e.getMessage(), e);
            }
        }
        return rows;
    }

    private void record(ReportGenerationAudit audit) {
        try {
            auditRecorder.record(audit);
        } catch (RuntimeException e) {
            // The document is still returned; only the audit entry is lost
            log.warn("Could not record audit entry for {} report", audit.reportType(), e);
        }
    }

    private long elapsedMillis(Instant startedAt) {
        return Duration.between(startedAt, clock.instant()).toMillis();
    }

    private static String titleFor(GenerateReportRequest request, ReportType type) {
        if (request.title() != null && !request.title().isBlank()) {
            return request.title();
        }
        return type != null ? type.getTitle() : request.reportType();
    }
}
