package io.kandiegang.shop.ratelimit;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.kandiegang.shop.security.ClientIpResolver;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.HandlerInterceptor;

/** Rejects requests over the route's limit with 429. Keys are {@code route:clientIp}. */
public class RateLimitInterceptor implements HandlerInterceptor {

  private static final Logger log = LoggerFactory.getLogger(RateLimitInterceptor.class);

  static final String TOO_MANY_REQUESTS = "Too many requests. Please try again later.";

  private final String routeKey;
  private final RateLimiter rateLimiter;
  private final ObjectMapper objectMapper;

  public RateLimitInterceptor(String routeKey, RateLimiter rateLimiter, ObjectMapper objectMapper) {
    this.routeKey = routeKey;
    this.rateLimiter = rateLimiter;
    this.objectMapper = objectMapper;
  }

  @Override
  public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
      throws IOException {
    if (HttpMethod.OPTIONS.matches(request.getMethod())) {
      return true;
    }
    var clientIp = ClientIpResolver.resolve(request);
    if (rateLimiter.allow(routeKey + ":" + clientIp)) {
      return true;
    }
    log.warn("Rate limit exceeded: route={}, ip={}", routeKey, clientIp);
    response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding("UTF-8");
    objectMapper.writeValue(response.getWriter(), Map.of("error", TOO_MANY_REQUESTS));
    return false;
  }
}
