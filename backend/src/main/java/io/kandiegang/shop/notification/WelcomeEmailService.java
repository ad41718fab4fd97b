package io.kandiegang.shop.notification;

import io.kandiegang.shop.config.SiteUrlResolver;
import io.kandiegang.shop.email.EmailProperties;
import io.kandiegang.shop.email.EmailProvider;
import io.kandiegang.shop.email.EmailTemplateRenderer;
import io.kandiegang.shop.email.SendResult;
import io.kandiegang.shop.membership.MembershipGrantedEvent;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Renders and sends the new-member welcome email through the preferred email provider. */
@Service
public class WelcomeEmailService {

  private static final Logger log = LoggerFactory.getLogger(WelcomeEmailService.class);

  static final String TEMPLATE = "member-welcome";
  static final String FALLBACK_BASE_URL = "https://kandiegang.com";

  private final EmailProvider emailProvider;
  private final EmailTemplateRenderer renderer;
  private final EmailProperties emailProperties;
  private final SiteUrlResolver siteUrlResolver;

  /** Providers arrive sorted by {@code @Order}; the first one is used. */
  public WelcomeEmailService(
      List<EmailProvider> emailProviders,
      EmailTemplateRenderer renderer,
      EmailProperties emailProperties,
      SiteUrlResolver siteUrlResolver) {
    this.emailProvider = emailProviders.get(0);
    this.renderer = renderer;
    this.emailProperties = emailProperties;
    this.siteUrlResolver = siteUrlResolver;
    log.info("Welcome emails are sent via the '{}' provider", emailProvider.providerId());
  }

  public SendResult sendWelcome(MembershipGrantedEvent event) {
    var membersUrl = siteUrlResolver.configuredOr(FALLBACK_BASE_URL) + "/members";
    var rendered =
        renderer.render(
            TEMPLATE,
            "Welcome to the " + emailProperties.clubName(),
            Map.of(
                "clubName", emailProperties.clubName(),
                "memberSince", event.memberSince().toString(),
                "membershipExpiration", event.expiration().toString(),
                "membersUrl", membersUrl));
    var result = emailProvider.sendEmail(rendered.to(event.recipientEmail()));
    if (result.success()) {
      log.info(
          "Welcome email sent for profile {} via {} ({})",
          event.profileId(),
          emailProvider.providerId(),
          result.messageId());
    }
    return result;
  }
}
