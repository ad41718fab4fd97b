package io.kandiegang.shop.payment;

import io.kandiegang.shop.exception.ShopErrorException;
import org.springframework.http.HttpStatus;

/** Missing or invalid webhook signature. The caller is not authenticated, so this is a 400. */
public class WebhookSignatureException extends ShopErrorException {

  public WebhookSignatureException(String detail) {
    super(HttpStatus.BAD_REQUEST, "Webhook signature rejected", detail);
  }

  public WebhookSignatureException(String detail, Throwable cause) {
    super(HttpStatus.BAD_REQUEST, "Webhook signature rejected", detail, cause);
  }
}
