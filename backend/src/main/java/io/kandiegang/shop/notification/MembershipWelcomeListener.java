package io.kandiegang.shop.notification;

import io.kandiegang.shop.membership.MembershipGrantedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Sends the welcome email once the grant has committed. Runs off the webhook thread; a failure is
 * logged and never reaches the webhook response.
 */
@Component
public class MembershipWelcomeListener {

  private static final Logger log = LoggerFactory.getLogger(MembershipWelcomeListener.class);

  private final WelcomeEmailService welcomeEmailService;

  public MembershipWelcomeListener(WelcomeEmailService welcomeEmailService) {
    this.welcomeEmailService = welcomeEmailService;
  }

  @Async
  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onMembershipGranted(MembershipGrantedEvent event) {
    if (event.recipientEmail() == null || event.recipientEmail().isBlank()) {
      log.warn("No email address for profile {}, skipping welcome email", event.profileId());
      return;
    }
    try {
      var result = welcomeEmailService.sendWelcome(event);
      if (!result.success()) {
        log.error(
            "Welcome email failed for profile {}: {}", event.profileId(), result.errorMessage());
      }
    } catch (Exception e) {
      log.error("Failed to send welcome email for profile {}", event.profileId(), e);
    }
  }
}
