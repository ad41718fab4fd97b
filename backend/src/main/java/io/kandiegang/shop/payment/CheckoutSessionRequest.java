package io.kandiegang.shop.payment;

import java.util.List;
import java.util.Map;

/**
 * Value object for creating a hosted checkout session. {@code metadata} is the only channel that
 * correlates the later completion webhook back to the basket and buyer.
 */
public record CheckoutSessionRequest(
    List<SessionLineItem> lineItems,
    BillingMode mode,
    String successUrl,
    String cancelUrl,
    String customerEmail,
    Map<String, String> metadata,
    boolean allowPromotionCodes) {

  public CheckoutSessionRequest {
    lineItems = List.copyOf(lineItems);
    metadata = (metadata == null) ? Map.of() : Map.copyOf(metadata);
  }
}
