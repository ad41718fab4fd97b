package io.kandiegang.shop.exception;

import org.springframework.http.HttpStatus;

public class UnauthorizedException extends ShopErrorException {

  public UnauthorizedException(String detail) {
    super(HttpStatus.UNAUTHORIZED, "Unauthorized", detail);
  }
}
