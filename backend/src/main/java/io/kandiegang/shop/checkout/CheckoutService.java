package io.kandiegang.shop.checkout;

import io.kandiegang.shop.exception.InvalidRequestException;
import io.kandiegang.shop.exception.OperationFailedException;
import io.kandiegang.shop.payment.PaymentGateway;
import io.kandiegang.shop.payment.PaymentProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Basket to hosted checkout session: validate, resolve the billing mode, price shipping, build the
 * session and hand it to the payment gateway.
 */
@Service
public class CheckoutService {

  private static final Logger log = LoggerFactory.getLogger(CheckoutService.class);

  private final BasketValidator basketValidator;
  private final CheckoutSessionBuilder sessionBuilder;
  private final PaymentGateway paymentGateway;

  public CheckoutService(
      BasketValidator basketValidator,
      CheckoutSessionBuilder sessionBuilder,
      PaymentGateway paymentGateway) {
    this.basketValidator = basketValidator;
    this.sessionBuilder = sessionBuilder;
    this.paymentGateway = paymentGateway;
  }

  public CheckoutResponse createSession(CheckoutRequest request, String baseUrl) {
    var basket = basketValidator.toBasket(request);
    var option = resolveShippingOption(request.shippingOption());
    ShippingSelection shipping = null;
    if (request.subtotal() != null) {
      if (request.subtotal().signum() < 0) {
        throw new InvalidRequestException("subtotal must not be negative");
      }
      shipping = new ShippingSelection(option, request.subtotal());
    }

    try {
      var mode = basketValidator.resolveMode(basket);
      var sessionRequest =
          sessionBuilder.build(
              basket,
              mode,
              option,
              shipping,
              new BuyerIdentity(request.userId(), request.userEmail()),
              baseUrl);
      var result = paymentGateway.createCheckoutSession(sessionRequest);
      log.info(
          "Checkout session {} created for {} line item(s), mode={}",
          result.sessionId(),
          basket.items().size(),
          mode);
      return new CheckoutResponse(result.sessionId(), result.redirectUrl());
    } catch (PaymentProviderException e) {
      throw new OperationFailedException("Checkout failed: " + e.getMessage(), e);
    }
  }

  private static ShippingOption resolveShippingOption(String value) {
    if (value == null || value.isBlank()) {
      return ShippingOption.DOMESTIC;
    }
    return ShippingOption.fromValue(value)
        .orElseThrow(
            () ->
                new InvalidRequestException(
                    "Invalid shippingOption: expected domestic, regional or pickup"));
  }
}
