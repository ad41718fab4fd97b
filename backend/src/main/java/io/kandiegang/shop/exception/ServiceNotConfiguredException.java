package io.kandiegang.shop.exception;

import org.springframework.http.HttpStatus;

/**
 * Required configuration (gateway keys, signing secret) is absent. Reported as a 500 for the
 * affected endpoint only; the rest of the application keeps serving.
 */
public class ServiceNotConfiguredException extends ShopErrorException {

  public ServiceNotConfiguredException(String detail) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, "Not configured", detail);
  }
}
