package io.kandiegang.shop.ratelimit;

import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Per-route limits, keyed by route name (which also prefixes the limiter key). */
@ConfigurationProperties(prefix = "shop.rate-limit")
public record RateLimitProperties(Map<String, Route> routes) {

  public RateLimitProperties {
    routes = routes == null ? Map.of() : Map.copyOf(routes);
  }

  public record Route(String pathPattern, int maxRequests, Duration window) {}
}
