package io.kandiegang.shop.payment;

import com.stripe.exception.AuthenticationException;
import com.stripe.exception.EventDataObjectDeserializationException;
import com.stripe.exception.InvalidRequestException;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.exception.StripeException;
import com.stripe.model.Event;
import com.stripe.model.Price;
import com.stripe.model.StripeObject;
import com.stripe.model.checkout.Session;
import com.stripe.net.RequestOptions;
import com.stripe.net.Webhook;
import com.stripe.param.checkout.SessionCreateParams;
import io.kandiegang.shop.exception.ServiceNotConfiguredException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stripe payment gateway adapter. Uses per-request {@link RequestOptions} carrying the API key and
 * timeouts. Never sets global Stripe.apiKey.
 */
@Component
public class StripePaymentGateway implements PaymentGateway {

  private static final Logger log = LoggerFactory.getLogger(StripePaymentGateway.class);

  static final String NOT_CONFIGURED = "Stripe is not configured. Set STRIPE_SECRET_KEY.";
  static final String WEBHOOK_NOT_CONFIGURED = "Webhook not configured";
  static final String AUTHENTICATION_MESSAGE =
      "Payment provider configuration error. Check the Stripe secret key.";
  static final String PROVIDER_MESSAGE = "Payment provider unavailable. Please try again later.";

  private final StripeProperties properties;

  public StripePaymentGateway(StripeProperties properties) {
    this.properties = properties;
  }

  @Override
  public String providerId() {
    return "stripe";
  }

  @Override
  public BillingMode resolveBillingMode(String priceRef) {
    var options = requestOptions();
    try {
      var price = Price.retrieve(priceRef, options);
      return "recurring".equals(price.getType()) ? BillingMode.RECURRING : BillingMode.ONE_TIME;
    } catch (StripeException e) {
      throw classify("price lookup", e);
    }
  }

  @Override
  public CreateSessionResult createCheckoutSession(CheckoutSessionRequest request) {
    var options = requestOptions();
    var params =
        SessionCreateParams.builder()
            .setMode(
                request.mode() == BillingMode.RECURRING
                    ? SessionCreateParams.Mode.SUBSCRIPTION
                    : SessionCreateParams.Mode.PAYMENT)
            .addPaymentMethodType(SessionCreateParams.PaymentMethodType.CARD)
            .setSuccessUrl(request.successUrl())
            .setCancelUrl(request.cancelUrl())
            .setAllowPromotionCodes(request.allowPromotionCodes())
            .putAllMetadata(request.metadata());
    if (request.customerEmail() != null && !request.customerEmail().isBlank()) {
      params.setCustomerEmail(request.customerEmail());
    }
    for (var item : request.lineItems()) {
      params.addLineItem(toStripeLineItem(item));
    }

    try {
      var session = Session.create(params.build(), options);
      log.info("Created Stripe checkout session {} (mode={})", session.getId(), request.mode());
      return new CreateSessionResult(session.getId(), session.getUrl());
    } catch (StripeException e) {
      throw classify("checkout session creation", e);
    }
  }

  @Override
  public WebhookEvent verifyWebhook(String payload, String signatureHeader) {
    if (signatureHeader == null || signatureHeader.isBlank()) {
      throw new WebhookSignatureException("Missing Stripe-Signature header");
    }
    if (!properties.hasWebhookSecret() || !properties.hasSecretKey()) {
      throw new ServiceNotConfiguredException(WEBHOOK_NOT_CONFIGURED);
    }

    Event event;
    try {
      event = Webhook.constructEvent(payload, signatureHeader, properties.webhookSecret());
    } catch (SignatureVerificationException e) {
      log.warn("Stripe webhook signature verification failed: {}", e.getMessage());
      throw new WebhookSignatureException("Webhook signature verification failed", e);
    } catch (RuntimeException e) {
      // signature matched but the body is not a parseable event
      log.warn("Stripe webhook payload could not be parsed: {}", e.getMessage());
      throw new WebhookSignatureException("Invalid webhook payload", e);
    }

    if (!WebhookEvent.CHECKOUT_COMPLETED.equals(event.getType())) {
      return new WebhookEvent(event.getId(), event.getType(), null);
    }
    var session = deserializeSession(event);
    if (session == null) {
      log.warn("Stripe webhook {}: could not deserialize checkout session", event.getId());
      return new WebhookEvent(event.getId(), event.getType(), null);
    }
    return new WebhookEvent(event.getId(), event.getType(), toCompletedCheckout(session));
  }

  @Override
  public String createPortalSession(String customerRef, String returnUrl) {
    var options = requestOptions();
    var params =
        com.stripe.param.billingportal.SessionCreateParams.builder()
            .setCustomer(customerRef)
            .setReturnUrl(returnUrl)
            .build();
    try {
      return com.stripe.model.billingportal.Session.create(params, options).getUrl();
    } catch (StripeException e) {
      throw classify("billing portal session creation", e);
    }
  }

  private RequestOptions requestOptions() {
    if (!properties.hasSecretKey()) {
      throw new ServiceNotConfiguredException(NOT_CONFIGURED);
    }
    return RequestOptions.builder()
        .setApiKey(properties.secretKey())
        .setConnectTimeout(Math.toIntExact(properties.connectTimeout().toMillis()))
        .setReadTimeout(Math.toIntExact(properties.readTimeout().toMillis()))
        .build();
  }

  private static SessionCreateParams.LineItem toStripeLineItem(SessionLineItem item) {
    if (!item.isAdHoc()) {
      return SessionCreateParams.LineItem.builder()
          .setPrice(item.priceRef())
          .setQuantity(item.quantity())
          .build();
    }
    return SessionCreateParams.LineItem.builder()
        .setQuantity(item.quantity())
        .setPriceData(
            SessionCreateParams.LineItem.PriceData.builder()
                .setCurrency(item.currency())
                .setUnitAmount(toMinorUnits(item.unitAmount()))
                .setProductData(
                    SessionCreateParams.LineItem.PriceData.ProductData.builder()
                        .setName(item.name())
                        .build())
                .build())
        .build();
  }

  /** EUR only, so always two decimals. */
  static long toMinorUnits(BigDecimal amount) {
    return amount.movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValueExact();
  }

  private static Session deserializeSession(Event event) {
    var deserializer = event.getDataObjectDeserializer();
    StripeObject object = deserializer.getObject().orElse(null);
    if (object == null) {
      // API version mismatch between the event and the SDK; the session fields we read are stable
      try {
        object = deserializer.deserializeUnsafe();
      } catch (EventDataObjectDeserializationException e) {
        log.warn("Unsafe deserialization of event {} failed: {}", event.getId(), e.getMessage());
        return null;
      }
    }
    return object instanceof Session session ? session : null;
  }

  private static CompletedCheckout toCompletedCheckout(Session session) {
    String payerEmail = null;
    if (session.getCustomerDetails() != null) {
      payerEmail = session.getCustomerDetails().getEmail();
    }
    if (payerEmail == null || payerEmail.isBlank()) {
      payerEmail = session.getCustomerEmail();
    }
    Map<String, String> metadata = session.getMetadata() != null ? session.getMetadata() : Map.of();
    return new CompletedCheckout(session.getId(), metadata, payerEmail, session.getCustomer());
  }

  static PaymentProviderException classify(String operation, StripeException e) {
    if (e instanceof InvalidRequestException) {
      log.warn("Stripe rejected {}: {}", operation, e.getMessage());
      var stripeError = e.getStripeError();
      var message =
          stripeError != null && stripeError.getMessage() != null
              ? stripeError.getMessage()
              : "Invalid request to payment provider (e.g. invalid price or product).";
      return new PaymentProviderException(PaymentErrorClass.INVALID_REQUEST, message, e);
    }
    if (e instanceof AuthenticationException) {
      log.error("Stripe authentication failed during {}", operation);
      return new PaymentProviderException(
          PaymentErrorClass.AUTHENTICATION, AUTHENTICATION_MESSAGE, e);
    }
    log.error("Stripe {} failed: {}", operation, e.getMessage(), e);
    return new PaymentProviderException(PaymentErrorClass.PROVIDER, PROVIDER_MESSAGE, e);
  }
}
