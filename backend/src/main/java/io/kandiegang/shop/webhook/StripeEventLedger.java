package io.kandiegang.shop.webhook;

import io.kandiegang.shop.payment.WebhookEvent;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

/**
 * Stripe events that already granted a membership. Stripe redelivers an event until it gets a 2xx,
 * so the same event id can arrive again after a slow or failed acknowledgement.
 */
@Component
public class StripeEventLedger {

  private static final Logger log = LoggerFactory.getLogger(StripeEventLedger.class);

  private final ProcessedWebhookRepository repository;
  private final Clock clock;

  public StripeEventLedger(ProcessedWebhookRepository repository, Clock clock) {
    this.repository = repository;
    this.clock = clock;
  }

  public boolean hasGranted(String eventId) {
    return eventId != null && repository.existsById(eventId);
  }

  /**
   * Records the event after its grant committed.
   *
   * @return false when the event was already recorded, including by a concurrent delivery
   */
  public boolean recordGrant(WebhookEvent event) {
    if (event.eventId() == null || repository.existsById(event.eventId())) {
      return false;
    }
    var sessionId = event.checkout() != null ? event.checkout().sessionId() : null;
    try {
      repository.saveAndFlush(
          new ProcessedWebhook(event.eventId(), event.eventType(), sessionId, clock.instant()));
    } catch (DataIntegrityViolationException e) {
      log.info("Stripe event {} was recorded by a concurrent delivery", event.eventId());
      return false;
    }
    log.info("Recorded Stripe event {} for checkout session {}", event.eventId(), sessionId);
    return true;
  }
}
