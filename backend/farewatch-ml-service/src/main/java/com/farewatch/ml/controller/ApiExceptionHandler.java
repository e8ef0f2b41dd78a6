package com.farewatch.ml.controller;

import com.farewatch.ml.model.ErrorResponse;
import com.farewatch.ml.service.CollaboratorException;
import com.farewatch.ml.service.ModelUnavailableException;
import com.farewatch.ml.service.NotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(ModelUnavailableException.class)
  public ResponseEntity<ErrorResponse> modelUnavailable(ModelUnavailableException e, HttpServletRequest req) {
    log.warn("Model unavailable on {}: {}", req.getRequestURI(), e.getMessage());
    return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage(), req);
  }

  @ExceptionHandler(NotFoundException.class)
  public ResponseEntity<ErrorResponse> notFound(NotFoundException e, HttpServletRequest req) {
    return error(HttpStatus.NOT_FOUND, e.getMessage(), req);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> invalid(MethodArgumentNotValidException e, HttpServletRequest req) {
    String message = e.getBindingResult().getAllErrors().stream()
        .map(err -> err.getDefaultMessage() == null ? err.toString() : err.getDefaultMessage())
        .collect(Collectors.joining("; "));
    return error(HttpStatus.BAD_REQUEST, message, req);
  }

  @ExceptionHandler({HttpMessageNotReadableException.class,
      MissingServletRequestParameterException.class,
      MethodArgumentTypeMismatchException.class,
      IllegalArgumentException.class})
  public ResponseEntity<ErrorResponse> badRequest(Exception e, HttpServletRequest req) {
    return error(HttpStatus.BAD_REQUEST, e.getMessage(), req);
  }

  @ExceptionHandler({DataAccessException.class, CollaboratorException.class})
  public ResponseEntity<ErrorResponse> collaborator(RuntimeException e, HttpServletRequest req) {
    log.error("Collaborator failure on {}: {}", req.getRequestURI(), e.getMessage(), e);
    return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage(), req);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> unexpected(Exception e, HttpServletRequest req) {
    log.error("Unhandled error on {}: {}", req.getRequestURI(), e.getMessage(), e);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), req);
  }

  private static ResponseEntity<ErrorResponse> error(HttpStatus status, String message, HttpServletRequest req) {
    return ResponseEntity.status(status)
        .body(new ErrorResponse(message, status.value(), req.getRequestURI(), Instant.now()));
  }
}
