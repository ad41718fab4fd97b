package io.kandiegang.shop.security;

import jakarta.servlet.http.HttpServletRequest;

/** Resolves the client IP address from a servlet request, handling reverse proxy headers. */
public final class ClientIpResolver {

  static final String UNKNOWN = "unknown";

  private ClientIpResolver() {}

  /**
   * Checks X-Forwarded-For (first entry), then X-Real-IP, then falls back to {@code
   * request.getRemoteAddr()}.
   */
  public static String resolve(HttpServletRequest request) {
    String forwardedFor = request.getHeader("X-Forwarded-For");
    if (forwardedFor != null && !forwardedFor.isBlank()) {
      var first = forwardedFor.split(",")[0].trim();
      if (!first.isEmpty()) {
        return first;
      }
    }
    String realIp = request.getHeader("X-Real-IP");
    if (realIp != null && !realIp.isBlank()) {
      return realIp.trim();
    }
    var remote = request.getRemoteAddr();
    return remote != null ? remote : UNKNOWN;
  }
}
