package io.kandiegang.shop.payment;

/**
 * Port to the hosted-checkout payment provider. Implementations throw {@link
 * PaymentProviderException} for provider failures and {@link
 * io.kandiegang.shop.exception.ServiceNotConfiguredException} when credentials are absent.
 */
public interface PaymentGateway {

  /** Unique provider identifier (e.g., "stripe"). */
  String providerId();

  /** Looks up whether a price is charged once or recurs. */
  BillingMode resolveBillingMode(String priceRef);

  /** Creates a hosted checkout session and returns where to send the buyer. */
  CreateSessionResult createCheckoutSession(CheckoutSessionRequest request);

  /**
   * Authenticates a webhook delivery against the exact raw payload and parses it.
   *
   * @throws WebhookSignatureException if the signature header is absent or does not match
   */
  WebhookEvent verifyWebhook(String payload, String signatureHeader);

  /** Creates a self-service billing portal session for a stored customer and returns its URL. */
  String createPortalSession(String customerRef, String returnUrl);
}
