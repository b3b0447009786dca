package com.example.reports.service;

/** Report rows or parameters that do not fit the requested report type. */
public class InvalidReportDataException extends ReportRequestException {

  public InvalidReportDataException(String message) {
    super(message);
  }

  public InvalidReportDataException(String message, Throwable cause) {
    super(message, cause);
  }
}
