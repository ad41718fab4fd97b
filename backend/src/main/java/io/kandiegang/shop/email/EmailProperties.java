package io.kandiegang.shop.email;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "shop.email")
public record EmailProperties(
    @DefaultValue("hello@kandiegang.com") String senderAddress,
    @DefaultValue("Kandie Gang") String senderName,
    @DefaultValue("Kandie Gang Cycling Club") String clubName,
    @DefaultValue Sendgrid sendgrid) {

  public record Sendgrid(String apiKey) {}
}
