package io.kandiegang.shop.config;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

/**
 * Resolves the storefront base URL (no trailing slash). The configured {@code shop.site.base-url}
 * wins; otherwise it is rebuilt from the proxy forwarding headers.
 */
@Component
public class SiteUrlResolver {

  static final String DEFAULT_PROTO = "https";
  static final String DEFAULT_HOST = "localhost:3000";

  private final SiteProperties properties;

  public SiteUrlResolver(SiteProperties properties) {
    this.properties = properties;
  }

  public String resolve(HttpServletRequest request) {
    if (properties.hasBaseUrl()) {
      return stripTrailingSlash(properties.baseUrl().trim());
    }
    var proto = firstNonBlank(request.getHeader("X-Forwarded-Proto"), DEFAULT_PROTO);
    var host =
        firstNonBlank(
            request.getHeader("X-Forwarded-Host"),
            firstNonBlank(request.getHeader("Host"), DEFAULT_HOST));
    return proto + "://" + host;
  }

  /** Configured base URL only, for work done outside a request (e.g. emails). */
  public String configuredOr(String fallback) {
    return properties.hasBaseUrl() ? stripTrailingSlash(properties.baseUrl().trim()) : fallback;
  }

  private static String firstNonBlank(String value, String fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    // proxies may append: "https, http"
    var comma = value.indexOf(',');
    return (comma >= 0 ? value.substring(0, comma) : value).trim();
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
