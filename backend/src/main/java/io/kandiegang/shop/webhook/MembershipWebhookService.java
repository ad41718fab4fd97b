package io.kandiegang.shop.webhook;

import io.kandiegang.shop.checkout.CheckoutMetadata;
import io.kandiegang.shop.membership.GrantRequest;
import io.kandiegang.shop.membership.MembershipGrantService;
import io.kandiegang.shop.membership.MembershipProperties;
import io.kandiegang.shop.payment.PaymentGateway;
import io.kandiegang.shop.payment.WebhookEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Turns a Stripe delivery into a membership grant: verify, filter to completed membership
 * checkouts, resolve the profile and merge. Nothing touches the profile store before the
 * signature has been verified.
 */
@Service
public class MembershipWebhookService {

  private static final Logger log = LoggerFactory.getLogger(MembershipWebhookService.class);

  private final PaymentGateway paymentGateway;
  private final MembershipGrantService grantService;
  private final StripeEventLedger eventLedger;
  private final MembershipProperties membershipProperties;

  public MembershipWebhookService(
      PaymentGateway paymentGateway,
      MembershipGrantService grantService,
      StripeEventLedger eventLedger,
      MembershipProperties membershipProperties) {
    this.paymentGateway = paymentGateway;
    this.grantService = grantService;
    this.eventLedger = eventLedger;
    this.membershipProperties = membershipProperties;
  }

  public WebhookOutcome handle(String payload, String signatureHeader) {
    WebhookEvent event = paymentGateway.verifyWebhook(payload, signatureHeader);

    if (!event.isCheckoutCompleted()) {
      log.debug("Ignoring Stripe event {} of type {}", event.eventId(), event.eventType());
      return WebhookOutcome.IGNORED_EVENT_TYPE;
    }
    var checkout = event.checkout();
    var metadata = CheckoutMetadata.fromMap(checkout.metadata());
    if (!metadata.containsSlug(membershipProperties.productSlug())) {
      log.debug("Checkout session {} has no membership item", checkout.sessionId());
      return WebhookOutcome.NOT_MEMBERSHIP;
    }
    if (eventLedger.hasGranted(event.eventId())) {
      log.info("Stripe event {} already granted, acknowledging", event.eventId());
      return WebhookOutcome.DUPLICATE;
    }

    var granted =
        grantService.grant(
            new GrantRequest(
                metadata.userUuid().orElse(null), checkout.payerEmail(), checkout.customerRef()));
    if (granted.isEmpty()) {
      log.warn(
          "No profile found for session {} (userId={}, email present={})",
          checkout.sessionId(),
          metadata.userId(),
          checkout.payerEmail() != null);
      return WebhookOutcome.PROFILE_NOT_FOUND;
    }

    try {
      eventLedger.recordGrant(event);
    } catch (DataAccessException e) {
      // the grant is committed; a redelivery re-merges to the same state
      log.warn("Could not record Stripe event {}: {}", event.eventId(), e.getMessage());
    }
    return WebhookOutcome.GRANTED;
  }
}
