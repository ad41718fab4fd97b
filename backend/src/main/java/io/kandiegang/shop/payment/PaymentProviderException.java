package io.kandiegang.shop.payment;

/**
 * The payment gateway rejected or failed a call. {@link #getMessage()} is safe to show to a
 * caller: provider detail is only included for invalid-request failures.
 */
public class PaymentProviderException extends RuntimeException {

  private final PaymentErrorClass errorClass;

  public PaymentProviderException(PaymentErrorClass errorClass, String message, Throwable cause) {
    super(message, cause);
    this.errorClass = errorClass;
  }

  public PaymentErrorClass errorClass() {
    return errorClass;
  }
}
