package dev.archivist.config;

import dev.archivist.common.RetrievalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps application exceptions to RFC 9457 Problem Detail responses.
 *
 * <p>{@link IllegalArgumentException} (invalid request) becomes 400 Bad Request; an escaped {@link
 * RetrievalException} becomes 503 Service Unavailable.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  /**
   * Maps {@link IllegalArgumentException} to a 400 Bad Request Problem Detail.
   *
   * @param ex the exception thrown by validation logic
   * @return a Problem Detail with HTTP 400 status and the exception message
   */
  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  /**
   * Maps {@link RetrievalException} to a 503 Service Unavailable Problem Detail. The cause is logged
   * but not exposed.
   *
   * @param ex the retrieval failure
   * @return a Problem Detail with HTTP 503 status and a generic message
   */
  @ExceptionHandler(RetrievalException.class)
  ProblemDetail handleRetrievalFailure(RetrievalException ex) {
    log.warn("Retrieval failure surfaced to REST layer: {}", ex.getMessage());
    return ProblemDetail.forStatusAndDetail(
        HttpStatus.SERVICE_UNAVAILABLE, "Retrieval failed. Please try again.");
  }
}
