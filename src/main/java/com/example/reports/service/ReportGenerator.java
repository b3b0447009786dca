package com.example.reports.service;

import java.util.List;

import com.example.reports.domain.ReportFormat;
import com.example.reports.domain.ReportParameters;
import com.example.reports.domain.ReportRow;

/**
 * Lays out one report type in each of the supported formats.
 *
 * @param <R> the row shape of the report type
 */
public interface ReportGenerator<R extends ReportRow> {

  byte[] generate(List<R> rows, ReportFormat format, ReportParameters parameters);
}
