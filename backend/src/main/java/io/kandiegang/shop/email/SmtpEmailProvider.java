package io.kandiegang.shop.email;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import java.io.UnsupportedEncodingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

/**
 * SMTP email provider backed by {@link JavaMailSender}. Only active when {@code spring.mail.host}
 * is configured.
 */
@Component
@Order(2)
@ConditionalOnProperty(name = "spring.mail.host")
public class SmtpEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(SmtpEmailProvider.class);

  private final JavaMailSender mailSender;
  private final EmailProperties properties;

  public SmtpEmailProvider(JavaMailSender mailSender, EmailProperties properties) {
    this.mailSender = mailSender;
    this.properties = properties;
  }

  @Override
  public String providerId() {
    return "smtp";
  }

  @Override
  public SendResult sendEmail(EmailMessage message) {
    try {
      MimeMessage mimeMessage = mailSender.createMimeMessage();
      MimeMessageHelper helper = new MimeMessageHelper(mimeMessage, true, "UTF-8");
      helper.setFrom(properties.senderAddress(), properties.senderName());
      helper.setTo(message.to());
      helper.setSubject(message.subject());
      if (message.htmlBody() != null && message.plainTextBody() != null) {
        helper.setText(message.plainTextBody(), message.htmlBody());
      } else if (message.htmlBody() != null) {
        helper.setText(message.htmlBody(), true);
      } else {
        helper.setText(message.plainTextBody(), false);
      }
      mailSender.send(mimeMessage);
      String messageId = mimeMessage.getMessageID();
      log.debug("SMTP email sent to {} with Message-ID: {}", message.to(), messageId);
      return new SendResult(true, messageId, null);
    } catch (MailException | MessagingException | UnsupportedEncodingException e) {
      log.error("Failed to send SMTP email to {}: {}", message.to(), e.getMessage());
      return new SendResult(false, null, e.getMessage());
    }
  }
}
