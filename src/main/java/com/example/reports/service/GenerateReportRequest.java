package com.example.reports.service;

import java.util.List;
import java.util.Map;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import com.example.reports.domain.ReportParameters;

/**
 * A request to render already-computed report rows. {@code data} holds the rows as plain JSON
 * objects; they are bound to the report type's row record before rendering.
 *
 * @param reportType   report type code, e.g. {@code income_statement}
 * @param reportFormat {@code pdf}, {@code csv} or {@code xlsx}
 * @param title        display title for the audit entry, defaults to the report type title
 */
public record GenerateReportRequest(
    @NotBlank String reportType,
    @NotBlank String reportFormat,
    @NotNull ReportParameters parameters,
    @NotNull List<Map<String, Object>> data,
    String title,
    String description,
    String templateId) {}
