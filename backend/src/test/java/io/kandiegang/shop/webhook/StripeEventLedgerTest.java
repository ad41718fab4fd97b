package io.kandiegang.shop.webhook;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.kandiegang.shop.payment.CompletedCheckout;
import io.kandiegang.shop.payment.WebhookEvent;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
class StripeEventLedgerTest {

  private static final Instant NOW = Instant.parse("2026-03-15T10:00:00Z");
  private static final WebhookEvent COMPLETED =
      new WebhookEvent(
          "evt_1",
          WebhookEvent.CHECKOUT_COMPLETED,
          new CompletedCheckout("cs_test_1", Map.of(), "rider@example.com", "cus_1"));

  @Mock private ProcessedWebhookRepository repository;

  private StripeEventLedger ledger;

  @BeforeEach
  void setUp() {
    ledger = new StripeEventLedger(repository, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void recordGrant_stores_event_with_checkout_session() {
    when(repository.existsById("evt_1")).thenReturn(false);

    assertThat(ledger.recordGrant(COMPLETED)).isTrue();

    var captor = ArgumentCaptor.forClass(ProcessedWebhook.class);
    verify(repository).saveAndFlush(captor.capture());
    assertThat(captor.getValue().getEventId()).isEqualTo("evt_1");
    assertThat(captor.getValue().getEventType()).isEqualTo(WebhookEvent.CHECKOUT_COMPLETED);
    assertThat(captor.getValue().getCheckoutSessionId()).isEqualTo("cs_test_1");
    assertThat(captor.getValue().getProcessedAt()).isEqualTo(NOW);
  }

  @Test
  void recordGrant_of_known_event_writes_nothing() {
    when(repository.existsById("evt_1")).thenReturn(true);

    assertThat(ledger.recordGrant(COMPLETED)).isFalse();
    verify(repository, never()).saveAndFlush(any());
  }

  @Test
  void recordGrant_losing_insert_race_reports_already_recorded() {
    when(repository.existsById("evt_1")).thenReturn(false);
    when(repository.saveAndFlush(any()))
        .thenThrow(new DataIntegrityViolationException("duplicate key value"));

    assertThat(ledger.recordGrant(COMPLETED)).isFalse();
  }

  @Test
  void hasGranted_without_event_id_is_false() {
    assertThat(ledger.hasGranted(null)).isFalse();
    verify(repository, never()).existsById(any());
  }
}
