package com.siva.lookup.controller;

import com.siva.lookup.exception.LookupException;
import com.siva.lookup.exception.NotFoundException;
import com.siva.lookup.exception.StoreException;
import com.siva.lookup.exception.UnknownLookupTableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps lookup failures onto HTTP status codes with a small JSON body.
 */
@RestControllerAdvice
public class LookupExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(LookupExceptionHandler.class);

  static record ErrorResponse(String error, String message) {}

  @ExceptionHandler({NotFoundException.class, UnknownLookupTableException.class})
  public ResponseEntity<ErrorResponse> notFound(LookupException e) {
    return body(HttpStatus.NOT_FOUND, e);
  }

  @ExceptionHandler({IllegalArgumentException.class,
          MissingServletRequestParameterException.class,
          MethodArgumentTypeMismatchException.class})
  public ResponseEntity<ErrorResponse> badRequest(Exception e) {
    return body(HttpStatus.BAD_REQUEST, e);
  }

  @ExceptionHandler(StoreException.class)
  public ResponseEntity<ErrorResponse> storeUnavailable(StoreException e) {
    log.error("Lookup store failure", e);
    return body(HttpStatus.SERVICE_UNAVAILABLE, e);
  }

  private ResponseEntity<ErrorResponse> body(HttpStatus status, Exception e) {
    return ResponseEntity.status(status).body(new ErrorResponse(status.getReasonPhrase(), e.getMessage()));
  }
}
