package io.kandiegang.shop.payment;

import java.util.Map;

/**
 * Checkout session as carried by a completion event. {@code payerEmail} prefers the email the
 * buyer entered at checkout over the one prefilled by the shop; {@code customerRef} is the
 * gateway's customer id when one was created.
 */
public record CompletedCheckout(
    String sessionId, Map<String, String> metadata, String payerEmail, String customerRef) {

  public CompletedCheckout {
    metadata = (metadata == null) ? Map.of() : Map.copyOf(metadata);
  }
}
