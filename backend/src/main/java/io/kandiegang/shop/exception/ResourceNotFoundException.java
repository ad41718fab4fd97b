package io.kandiegang.shop.exception;

import org.springframework.http.HttpStatus;

public class ResourceNotFoundException extends ShopErrorException {

  public ResourceNotFoundException(String resourceType, String detail) {
    super(HttpStatus.NOT_FOUND, resourceType + " not found", detail);
  }
}
