package io.kandiegang.shop.email;

import java.util.Objects;

/** Provider-agnostic email payload with an HTML body and its plain-text fallback. */
public record EmailMessage(String to, String subject, String htmlBody, String plainTextBody) {

  public EmailMessage {
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(subject, "subject");
    if (htmlBody == null && plainTextBody == null) {
      throw new IllegalArgumentException(
          "Email must have at least one of htmlBody or plainTextBody");
    }
  }
}
