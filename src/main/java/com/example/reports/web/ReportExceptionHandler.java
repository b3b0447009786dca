package com.example.reports.web;

import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.example.reports.export.ReportRenderingException;
import com.example.reports.service.ReportRequestException;

/** Maps report failures to HTTP responses with an {@link ErrorResponse} body. */
@RestControllerAdvice
public class ReportExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ReportExceptionHandler.class);

  @ExceptionHandler(ReportRequestException.class)
  public ResponseEntity<ErrorResponse> handleBadRequest(ReportRequestException ex) {
    log.warn("Rejected report request: {}", ex.getMessage());
    return ResponseEntity.badRequest().body(new ErrorResponse("invalid_request", ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    return ResponseEntity.badRequest().body(new ErrorResponse("validation_failed", message));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    return ResponseEntity.badRequest()
        .body(new ErrorResponse("malformed_request", "Malformed request body"));
  }

  @ExceptionHandler(ReportRenderingException.class)
  public ResponseEntity<ErrorResponse> handleRendering(ReportRenderingException ex) {
    log.error("Report rendering failed", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ErrorResponse("rendering_failed", "Failed to generate report"));
  }
}
