package io.kandiegang.shop.email;

import com.sendgrid.Method;
import com.sendgrid.Request;
import com.sendgrid.Response;
import com.sendgrid.SendGrid;
import com.sendgrid.helpers.mail.Mail;
import com.sendgrid.helpers.mail.objects.Content;
import com.sendgrid.helpers.mail.objects.Email;
import com.sendgrid.helpers.mail.objects.Personalization;
import java.io.IOException;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** SendGrid email provider. Active when {@code shop.email.sendgrid.api-key} is non-empty. */
@Component
@Order(1)
@ConditionalOnExpression("'${shop.email.sendgrid.api-key:}' != ''")
public class SendGridEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(SendGridEmailProvider.class);

  private final EmailProperties properties;
  private final Function<String, SendGrid> sendGridFactory;

  @Autowired
  public SendGridEmailProvider(EmailProperties properties) {
    this(properties, SendGrid::new);
  }

  SendGridEmailProvider(EmailProperties properties, Function<String, SendGrid> sendGridFactory) {
    this.properties = properties;
    this.sendGridFactory = sendGridFactory;
  }

  @Override
  public String providerId() {
    return "sendgrid";
  }

  @Override
  public SendResult sendEmail(EmailMessage message) {
    try {
      SendGrid sg = sendGridFactory.apply(properties.sendgrid().apiKey());
      Request request = new Request();
      request.setMethod(Method.POST);
      request.setEndpoint("mail/send");
      request.setBody(buildMail(message).build());

      Response response = sg.api(request);
      int status = response.getStatusCode();
      if (status >= 200 && status < 300) {
        String sgMessageId = response.getHeaders().get("X-Message-Id");
        log.debug("SendGrid email sent, sg_message_id: {}", sgMessageId);
        return new SendResult(true, sgMessageId, null);
      }
      log.error("SendGrid API returned {}: {}", status, response.getBody());
      return new SendResult(false, null, "SendGrid API error " + status + ": " + response.getBody());
    } catch (IOException e) {
      log.error("Failed to send SendGrid email to {}: {}", message.to(), e.getMessage());
      return new SendResult(false, null, e.getMessage());
    }
  }

  Mail buildMail(EmailMessage message) {
    Personalization personalization = new Personalization();
    personalization.addTo(new Email(message.to()));

    Mail mail = new Mail();
    mail.setFrom(new Email(properties.senderAddress(), properties.senderName()));
    mail.setSubject(message.subject());
    mail.addPersonalization(personalization);
    // SendGrid requires text/plain before text/html
    if (message.plainTextBody() != null) {
      mail.addContent(new Content("text/plain", message.plainTextBody()));
    }
    if (message.htmlBody() != null) {
      mail.addContent(new Content("text/html", message.htmlBody()));
    }
    return mail;
  }
}
