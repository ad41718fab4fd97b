package io.kandiegang.shop.email;

/** Output of template rendering, ready to be passed to an EmailProvider. */
public record RenderedEmail(String subject, String htmlBody, String plainTextBody) {

  public EmailMessage to(String recipient) {
    return new EmailMessage(recipient, subject, htmlBody, plainTextBody);
  }
}
