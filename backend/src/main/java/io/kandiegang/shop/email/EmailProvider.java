package io.kandiegang.shop.email;

/**
 * Port for sending emails via an external provider. Several adapters may be active; the one with
 * the highest precedence ({@link org.springframework.core.annotation.Order}) is used.
 */
public interface EmailProvider {

  /** Provider identifier (e.g., "smtp", "sendgrid", "noop"). */
  String providerId();

  /** Send an email message. Failures are reported in the result, never thrown. */
  SendResult sendEmail(EmailMessage message);
}
