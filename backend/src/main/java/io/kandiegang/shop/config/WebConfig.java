package io.kandiegang.shop.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.kandiegang.shop.ratelimit.FixedWindowRateLimiter;
import io.kandiegang.shop.ratelimit.RateLimitInterceptor;
import io.kandiegang.shop.ratelimit.RateLimitProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  private static final Logger log = LoggerFactory.getLogger(WebConfig.class);

  private final RateLimitProperties rateLimitProperties;
  private final ObjectMapper objectMapper;

  public WebConfig(RateLimitProperties rateLimitProperties, ObjectMapper objectMapper) {
    this.rateLimitProperties = rateLimitProperties;
    this.objectMapper = objectMapper;
  }

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    rateLimitProperties
        .routes()
        .forEach(
            (name, route) -> {
              var limiter = new FixedWindowRateLimiter(route.maxRequests(), route.window());
              registry
                  .addInterceptor(new RateLimitInterceptor(name, limiter, objectMapper))
                  .addPathPatterns(route.pathPattern());
              log.info(
                  "Rate limit '{}': {} requests per {} on {}",
                  name,
                  route.maxRequests(),
                  route.window(),
                  route.pathPattern());
            });
  }
}
