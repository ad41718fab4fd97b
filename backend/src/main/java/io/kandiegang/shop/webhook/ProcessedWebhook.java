package io.kandiegang.shop.webhook;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

/** Stripe event ({@code evt_...}) whose checkout session already led to a membership grant. */
@Entity
@Table(name = "processed_webhooks")
public class ProcessedWebhook {

  @Id
  @Column(name = "event_id")
  private String eventId;

  @Column(name = "event_type", nullable = false)
  private String eventType;

  @Column(name = "checkout_session_id")
  private String checkoutSessionId;

  @Column(name = "processed_at", nullable = false)
  private Instant processedAt;

  protected ProcessedWebhook() {}

  public ProcessedWebhook(
      String eventId, String eventType, String checkoutSessionId, Instant processedAt) {
    this.eventId = eventId;
    this.eventType = eventType;
    this.checkoutSessionId = checkoutSessionId;
    this.processedAt = processedAt;
  }

  public String getEventId() {
    return eventId;
  }

  public String getEventType() {
    return eventType;
  }

  public String getCheckoutSessionId() {
    return checkoutSessionId;
  }

  public Instant getProcessedAt() {
    return processedAt;
  }
}
