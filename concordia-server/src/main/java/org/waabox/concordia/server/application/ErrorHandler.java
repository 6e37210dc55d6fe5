package org.waabox.concordia.server.application;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import org.waabox.concordia.ConcordiaException;

/**
 * Turns configuration failures into {@code 500 {"error": message}}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@RestControllerAdvice
public class ErrorHandler {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      ErrorHandler.class);

  @ExceptionHandler(ConcordiaException.class)
  public ResponseEntity<Map<String, String>> handle(
      final ConcordiaException e) {
    log.error("Request failed: {}", e.getMessage(), e);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(Map.of("error", String.valueOf(e.getMessage())));
  }
}
