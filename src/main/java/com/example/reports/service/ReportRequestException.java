package com.example.reports.service;

/**
 * A report request the compiler cannot serve because of what the caller sent. Callers map it to a
 * client error.
 */
public class ReportRequestException extends IllegalArgumentException {

  public ReportRequestException(String message) {
    super(message);
  }

  public ReportRequestException(String message, Throwable cause) {
    super(message, cause);
  }
}
