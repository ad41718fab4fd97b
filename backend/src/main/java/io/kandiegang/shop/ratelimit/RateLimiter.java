package io.kandiegang.shop.ratelimit;

/**
 * Admission check for one request under a key. Implementations must be safe for concurrent use;
 * the in-process {@link FixedWindowRateLimiter} can be replaced by one backed by a shared store
 * when the service runs on several nodes.
 */
public interface RateLimiter {

  /** Counts the request and returns whether it is within the limit. */
  boolean allow(String key);
}
