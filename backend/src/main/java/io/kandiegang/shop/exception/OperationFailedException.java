package io.kandiegang.shop.exception;

import org.springframework.http.HttpStatus;

/** A server-side step failed after the request was accepted (provider call, profile write). */
public class OperationFailedException extends ShopErrorException {

  public OperationFailedException(String detail, Throwable cause) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, "Operation failed", detail, cause);
  }
}
