package io.kandiegang.shop.exception;

import org.springframework.http.HttpStatus;

/** Malformed or inconsistent caller input. Always a 400 with the message echoed back. */
public class InvalidRequestException extends ShopErrorException {

  public InvalidRequestException(String detail) {
    super(HttpStatus.BAD_REQUEST, "Invalid request", detail);
  }
}
