package io.kandiegang.shop.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(ShopErrorException.class)
  public ResponseEntity<ProblemDetail> handleShopError(
      ShopErrorException ex, HttpServletRequest request) {
    if (ex.getStatusCode().is5xxServerError()) {
      log.error(
          "Request failed: path={}, status={}, error={}",
          request.getRequestURI(),
          ex.getStatusCode().value(),
          ex.errorMessage(),
          ex.getCause());
    } else {
      log.warn(
          "Request rejected: path={}, status={}, error={}",
          request.getRequestURI(),
          ex.getStatusCode().value(),
          ex.errorMessage());
    }
    return ResponseEntity.status(ex.getStatusCode()).headers(ex.getHeaders()).body(ex.getBody());
  }

  @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
  public ResponseEntity<ProblemDetail> handleOptimisticLock(
      ObjectOptimisticLockingFailureException ex) {
    log.warn("Optimistic locking failure: {}", ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Concurrent modification");
    problem.setDetail("Resource was modified concurrently. Please retry.");
    problem.setProperty("error", problem.getDetail());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }

  @Override
  protected ResponseEntity<Object> handleHttpRequestMethodNotSupported(
      HttpRequestMethodNotSupportedException ex,
      HttpHeaders headers,
      HttpStatusCode status,
      WebRequest request) {
    var problem = ex.getBody();
    problem.setProperty("error", "Method not allowed");
    return handleExceptionInternal(ex, problem, headers, status, request);
  }

  /** Framework-raised errors (unreadable body, 405, ...) get the same {@code error} property. */
  @Override
  protected ResponseEntity<Object> handleExceptionInternal(
      Exception ex, Object body, HttpHeaders headers, HttpStatusCode statusCode, WebRequest request) {
    if (body instanceof ProblemDetail problem
        && (problem.getProperties() == null || !problem.getProperties().containsKey("error"))) {
      problem.setProperty(
          "error", problem.getDetail() != null ? problem.getDetail() : problem.getTitle());
    }
    return super.handleExceptionInternal(ex, body, headers, statusCode, request);
  }
}
