package io.kandiegang.shop.payment;

/**
 * Authenticated gateway event. Only produced after signature verification succeeded, so callers
 * can act on it without further checks. {@code checkout} is null unless the event carries a
 * completed checkout session.
 */
public record WebhookEvent(String eventId, String eventType, CompletedCheckout checkout) {

  public static final String CHECKOUT_COMPLETED = "checkout.session.completed";

  public boolean isCheckoutCompleted() {
    return CHECKOUT_COMPLETED.equals(eventType) && checkout != null;
  }
}
