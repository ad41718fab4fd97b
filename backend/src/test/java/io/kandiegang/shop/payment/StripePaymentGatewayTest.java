package io.kandiegang.shop.payment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockStatic;
import static org.mockito.Mockito.when;

import com.stripe.exception.ApiConnectionException;
import com.stripe.exception.AuthenticationException;
import com.stripe.exception.InvalidRequestException;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.model.Event;
import com.stripe.model.EventDataObjectDeserializer;
import com.stripe.model.Price;
import com.stripe.model.StripeError;
import com.stripe.model.checkout.Session;
import com.stripe.net.RequestOptions;
import com.stripe.net.Webhook;
import com.stripe.param.checkout.SessionCreateParams;
import io.kandiegang.shop.exception.ServiceNotConfiguredException;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.mockito.MockedStatic;

class StripePaymentGatewayTest {

  private final StripePaymentGateway gateway =
      new StripePaymentGateway(
          new StripeProperties(
              "sk_test_123", "whsec_test", Duration.ofSeconds(5), Duration.ofSeconds(10)));

  // --- Price lookup ---

  @Test
  void resolveBillingMode_maps_recurring_price_to_subscription() {
    try (MockedStatic<Price> priceMock = mockStatic(Price.class)) {
      var price = mock(Price.class);
      when(price.getType()).thenReturn("recurring");
      priceMock
          .when(() -> Price.retrieve(eq("price_membership"), any(RequestOptions.class)))
          .thenReturn(price);

      assertThat(gateway.resolveBillingMode("price_membership")).isEqualTo(BillingMode.RECURRING);
    }
  }

  @Test
  void resolveBillingMode_without_secret_key_is_not_configured() {
    var unconfigured =
        new StripePaymentGateway(
            new StripeProperties("", "", Duration.ofSeconds(5), Duration.ofSeconds(10)));

    assertThatThrownBy(() -> unconfigured.resolveBillingMode("price_1"))
        .isInstanceOf(ServiceNotConfiguredException.class);
  }

  // --- Session creation ---

  @Test
  void createCheckoutSession_builds_price_and_shipping_lines() {
    var request =
        new CheckoutSessionRequest(
            List.of(
                SessionLineItem.ofPrice("price_jersey", 2),
                SessionLineItem.adHoc(
                    "Shipping (Standard – Germany)", new BigDecimal("5.90"), "eur")),
            BillingMode.ONE_TIME,
            "https://kandiegang.example/checkout/success?session_id={CHECKOUT_SESSION_ID}",
            "https://kandiegang.example/shop",
            "rider@example.com",
            Map.of("productSlugs", "jersey", "userId", "guest"),
            true);

    try (MockedStatic<Session> sessionMock = mockStatic(Session.class)) {
      var mockSession = mock(Session.class);
      when(mockSession.getId()).thenReturn("cs_test_abc");
      when(mockSession.getUrl()).thenReturn("https://checkout.stripe.com/pay/cs_test_abc");
      sessionMock
          .when(() -> Session.create(any(SessionCreateParams.class), any(RequestOptions.class)))
          .thenAnswer(
              invocation -> {
                SessionCreateParams params = invocation.getArgument(0);
                assertThat(params.getMode()).isEqualTo(SessionCreateParams.Mode.PAYMENT);
                assertThat(params.getAllowPromotionCodes()).isTrue();
                assertThat(params.getCustomerEmail()).isEqualTo("rider@example.com");
                assertThat(params.getMetadata()).containsEntry("productSlugs", "jersey");
                assertThat(params.getLineItems()).hasSize(2);
                assertThat(params.getLineItems().get(0).getPrice()).isEqualTo("price_jersey");
                assertThat(params.getLineItems().get(0).getQuantity()).isEqualTo(2L);
                var shipping = params.getLineItems().get(1).getPriceData();
                assertThat(shipping.getUnitAmount()).isEqualTo(590L);
                assertThat(shipping.getCurrency()).isEqualTo("eur");
                assertThat(shipping.getProductData().getName())
                    .isEqualTo("Shipping (Standard – Germany)");
                RequestOptions options = invocation.getArgument(1);
                assertThat(options.getApiKey()).isEqualTo("sk_test_123");
                return mockSession;
              });

      var result = gateway.createCheckoutSession(request);

      assertThat(result.sessionId()).isEqualTo("cs_test_abc");
      assertThat(result.redirectUrl()).isEqualTo("https://checkout.stripe.com/pay/cs_test_abc");
    }
  }

  @Test
  void createCheckoutSession_recurring_mode_is_subscription() {
    var request =
        new CheckoutSessionRequest(
            List.of(SessionLineItem.ofPrice("price_membership", 1)),
            BillingMode.RECURRING,
            "https://s",
            "https://c",
            null,
            Map.of(),
            true);

    try (MockedStatic<Session> sessionMock = mockStatic(Session.class)) {
      var mockSession = mock(Session.class);
      sessionMock
          .when(() -> Session.create(any(SessionCreateParams.class), any(RequestOptions.class)))
          .thenAnswer(
              invocation -> {
                SessionCreateParams params = invocation.getArgument(0);
                assertThat(params.getMode()).isEqualTo(SessionCreateParams.Mode.SUBSCRIPTION);
                assertThat(params.getCustomerEmail()).isNull();
                return mockSession;
              });

      gateway.createCheckoutSession(request);
    }
  }

  // --- Error classification ---

  @Test
  void classify_invalid_request_surfaces_provider_message() {
    var error = mock(StripeError.class);
    when(error.getMessage()).thenReturn("No such price: 'price_x'");
    var exception = mock(InvalidRequestException.class);
    when(exception.getStripeError()).thenReturn(error);

    var classified = StripePaymentGateway.classify("price lookup", exception);

    assertThat(classified.errorClass()).isEqualTo(PaymentErrorClass.INVALID_REQUEST);
    assertThat(classified.getMessage()).isEqualTo("No such price: 'price_x'");
  }

  @Test
  void classify_authentication_hides_provider_detail() {
    var classified =
        StripePaymentGateway.classify("price lookup", mock(AuthenticationException.class));

    assertThat(classified.errorClass()).isEqualTo(PaymentErrorClass.AUTHENTICATION);
    assertThat(classified.getMessage()).isEqualTo(StripePaymentGateway.AUTHENTICATION_MESSAGE);
  }

  @Test
  void classify_other_failures_as_generic_provider_error() {
    var classified =
        StripePaymentGateway.classify("checkout", new ApiConnectionException("Read timed out"));

    assertThat(classified.errorClass()).isEqualTo(PaymentErrorClass.PROVIDER);
    assertThat(classified.getMessage()).isEqualTo(StripePaymentGateway.PROVIDER_MESSAGE);
  }

  @Test
  void toMinorUnits_rounds_to_cents() {
    assertThat(StripePaymentGateway.toMinorUnits(new BigDecimal("9.90"))).isEqualTo(990L);
    assertThat(StripePaymentGateway.toMinorUnits(BigDecimal.ZERO)).isZero();
  }

  // --- Webhook verification ---

  @Test
  void verifyWebhook_missing_signature_is_rejected() {
    assertThatThrownBy(() -> gateway.verifyWebhook("{}", null))
        .isInstanceOfSatisfying(
            WebhookSignatureException.class,
            e -> assertThat(e.errorMessage()).isEqualTo("Missing Stripe-Signature header"));
  }

  @Test
  void verifyWebhook_without_secret_is_not_configured() {
    var unconfigured =
        new StripePaymentGateway(
            new StripeProperties(
                "sk_test_123", null, Duration.ofSeconds(5), Duration.ofSeconds(10)));

    assertThatThrownBy(() -> unconfigured.verifyWebhook("{}", "t=1,v1=abc"))
        .isInstanceOfSatisfying(
            ServiceNotConfiguredException.class,
            e -> assertThat(e.errorMessage()).isEqualTo("Webhook not configured"));
  }

  @Test
  void verifyWebhook_without_secret_key_is_not_configured() {
    var unconfigured =
        new StripePaymentGateway(
            new StripeProperties(null, "whsec_x", Duration.ofSeconds(5), Duration.ofSeconds(10)));

    try (MockedStatic<Webhook> webhookMock = mockStatic(Webhook.class)) {
      assertThatThrownBy(() -> unconfigured.verifyWebhook("{}", "t=1,v1=abc"))
          .isInstanceOfSatisfying(
              ServiceNotConfiguredException.class,
              e -> assertThat(e.errorMessage()).isEqualTo("Webhook not configured"));
      webhookMock.verifyNoInteractions();
    }
  }

  @Test
  void verifyWebhook_bad_signature_is_rejected() {
    try (MockedStatic<Webhook> webhookMock = mockStatic(Webhook.class)) {
      webhookMock
          .when(() -> Webhook.constructEvent(anyString(), anyString(), anyString()))
          .thenThrow(new SignatureVerificationException("No signatures found", "t=1,v1=bad"));

      assertThatThrownBy(() -> gateway.verifyWebhook("{}", "t=1,v1=bad"))
          .isInstanceOfSatisfying(
              WebhookSignatureException.class,
              e -> assertThat(e.errorMessage()).isEqualTo("Webhook signature verification failed"));
    }
  }

  @Test
  void verifyWebhook_completed_session_prefers_customer_details_email() {
    try (MockedStatic<Webhook> webhookMock = mockStatic(Webhook.class)) {
      var session = mock(Session.class);
      var details = mock(Session.CustomerDetails.class);
      when(details.getEmail()).thenReturn("payer@example.com");
      when(session.getId()).thenReturn("cs_test_done");
      when(session.getCustomerDetails()).thenReturn(details);
      when(session.getCustomer()).thenReturn("cus_123");
      when(session.getMetadata()).thenReturn(Map.of("productSlugs", "socks"));

      var deserializer = mock(EventDataObjectDeserializer.class);
      when(deserializer.getObject()).thenReturn(Optional.of(session));
      var event = mock(Event.class);
      when(event.getId()).thenReturn("evt_1");
      when(event.getType()).thenReturn("checkout.session.completed");
      when(event.getDataObjectDeserializer()).thenReturn(deserializer);
      webhookMock
          .when(() -> Webhook.constructEvent("{}", "t=1,v1=ok", "whsec_test"))
          .thenReturn(event);

      var result = gateway.verifyWebhook("{}", "t=1,v1=ok");

      assertThat(result.isCheckoutCompleted()).isTrue();
      assertThat(result.eventId()).isEqualTo("evt_1");
      assertThat(result.checkout().sessionId()).isEqualTo("cs_test_done");
      assertThat(result.checkout().payerEmail()).isEqualTo("payer@example.com");
      assertThat(result.checkout().customerRef()).isEqualTo("cus_123");
      assertThat(result.checkout().metadata()).containsEntry("productSlugs", "socks");
    }
  }

  @Test
  void verifyWebhook_other_event_types_carry_no_checkout() {
    try (MockedStatic<Webhook> webhookMock = mockStatic(Webhook.class)) {
      var event = mock(Event.class);
      when(event.getId()).thenReturn("evt_2");
      when(event.getType()).thenReturn("invoice.paid");
      webhookMock
          .when(() -> Webhook.constructEvent(anyString(), anyString(), anyString()))
          .thenReturn(event);

      var result = gateway.verifyWebhook("{}", "t=1,v1=ok");

      assertThat(result.isCheckoutCompleted()).isFalse();
      assertThat(result.eventType()).isEqualTo("invoice.paid");
    }
  }

  // --- Billing portal ---

  @Test
  void createPortalSession_returns_portal_url() {
    try (MockedStatic<com.stripe.model.billingportal.Session> portalMock =
        mockStatic(com.stripe.model.billingportal.Session.class)) {
      var portalSession = mock(com.stripe.model.billingportal.Session.class);
      when(portalSession.getUrl()).thenReturn("https://billing.stripe.com/p/session_1");
      portalMock
          .when(
              () ->
                  com.stripe.model.billingportal.Session.create(
                      any(com.stripe.param.billingportal.SessionCreateParams.class),
                      any(RequestOptions.class)))
          .thenReturn(portalSession);

      assertThat(gateway.createPortalSession("cus_123", "https://kandiegang.example/members"))
          .isEqualTo("https://billing.stripe.com/p/session_1");
    }
  }
}
