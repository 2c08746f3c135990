package com.vigil.anomaly.controller;

import com.vigil.anomaly.model.AlertApi.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidRequestException.class)
  public ResponseEntity<ErrorResponse> invalid(InvalidRequestException e) {
    return ResponseEntity.badRequest().body(ErrorResponse.of(e.getMessage()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> unreadable(HttpMessageNotReadableException e) {
    log.debug("Unreadable request body: {}", e.getMessage());
    return ResponseEntity.badRequest().body(ErrorResponse.of("Malformed request body"));
  }

  @ExceptionHandler({MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class})
  public ResponseEntity<ErrorResponse> badParameter(Exception e) {
    return ResponseEntity.badRequest().body(ErrorResponse.of(e.getMessage()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> unexpected(Exception e, HttpServletRequest request) {
    // framework errors (unknown route, wrong method) keep their own status
    if (e instanceof org.springframework.web.ErrorResponse framework) {
      log.debug("{} {} rejected: {}", request.getMethod(), request.getRequestURI(), e.getMessage());
      return ResponseEntity.status(framework.getStatusCode()).body(ErrorResponse.of(e.getMessage()));
    }
    log.error("Unhandled error on {} {}: {}", request.getMethod(), request.getRequestURI(), e.getMessage(), e);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ErrorResponse.of("Internal error processing " + request.getRequestURI()));
  }
}
