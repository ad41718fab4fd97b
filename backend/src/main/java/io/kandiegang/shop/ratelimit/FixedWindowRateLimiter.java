package io.kandiegang.shop.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fixed-window counter per key. A window opens with the first request after the previous one has
 * elapsed; rejected requests are not counted.
 */
public class FixedWindowRateLimiter implements RateLimiter {

  private final int maxRequests;
  private final long windowNanos;
  private final Ticker ticker;
  private final Cache<String, Bucket> buckets;

  public FixedWindowRateLimiter(int maxRequests, Duration window) {
    this(maxRequests, window, Ticker.systemTicker());
  }

  FixedWindowRateLimiter(int maxRequests, Duration window, Ticker ticker) {
    if (maxRequests < 1) {
      throw new IllegalArgumentException("maxRequests must be at least 1");
    }
    this.maxRequests = maxRequests;
    this.windowNanos = window.toNanos();
    this.ticker = ticker;
    this.buckets =
        Caffeine.newBuilder().expireAfterWrite(window).maximumSize(100_000).ticker(ticker).build();
  }

  @Override
  public boolean allow(String key) {
    var allowed = new AtomicBoolean();
    buckets
        .asMap()
        .compute(
            key,
            (k, bucket) -> {
              long now = ticker.read();
              if (bucket == null || now - bucket.resetAtNanos() >= 0) {
                allowed.set(true);
                return new Bucket(1, now + windowNanos);
              }
              if (bucket.count() >= maxRequests) {
                allowed.set(false);
                return bucket;
              }
              allowed.set(true);
              return new Bucket(bucket.count() + 1, bucket.resetAtNanos());
            });
    return allowed.get();
  }

  private record Bucket(int count, long resetAtNanos) {}
}
