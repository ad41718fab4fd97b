package io.kandiegang.shop.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Base for the service's client-facing errors. The problem body carries an extra {@code error}
 * property holding the message shown to the caller, so every error response exposes {@code
 * {"error": "..."}} alongside the standard problem fields.
 */
public abstract class ShopErrorException extends ErrorResponseException {

  protected ShopErrorException(HttpStatus status, String title, String detail) {
    this(status, title, detail, null);
  }

  protected ShopErrorException(HttpStatus status, String title, String detail, Throwable cause) {
    super(status, createProblem(status, title, detail), cause);
  }

  /** Message echoed to the caller under the {@code error} key. */
  public String errorMessage() {
    return getBody().getDetail();
  }

  private static ProblemDetail createProblem(HttpStatus status, String title, String detail) {
    var problem = ProblemDetail.forStatus(status);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("error", detail);
    return problem;
  }
}
