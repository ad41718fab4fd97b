package io.kandiegang.shop.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** Public storefront address used for redirect and email links. Blank means derive per request. */
@ConfigurationProperties(prefix = "shop.site")
public record SiteProperties(String baseUrl) {

  public boolean hasBaseUrl() {
    return baseUrl != null && !baseUrl.isBlank();
  }
}
