package com.polycopy.polymarket.http;

import java.time.Clock;

public final class TokenBucketRateLimiter implements RequestRateLimiter {

  private final double tokensPerMilli;
  private final double capacity;
  private final Clock clock;

  private double tokens;
  private long lastRefillMillis;

  public TokenBucketRateLimiter(double requestsPerSecond, int burst, Clock clock) {
    if (requestsPerSecond <= 0 || burst <= 0) {
      throw new IllegalArgumentException("requestsPerSecond and burst must be positive");
    }
    this.tokensPerMilli = requestsPerSecond / 1000.0;
    this.capacity = burst;
    this.clock = clock;
    this.tokens = burst;
    this.lastRefillMillis = clock.millis();
  }

  @Override
  public void acquire() {
    while (true) {
      long waitMillis;
      synchronized (this) {
        refill();
        if (tokens >= 1.0) {
          tokens -= 1.0;
          return;
        }
        waitMillis = (long) Math.ceil((1.0 - tokens) / tokensPerMilli);
      }
      try {
        Thread.sleep(Math.max(1, waitMillis));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("Interrupted while waiting for rate limiter", e);
      }
    }
  }

  private void refill() {
    long now = clock.millis();
    long elapsed = now - lastRefillMillis;
    if (elapsed > 0) {
      tokens = Math.min(capacity, tokens + elapsed * tokensPerMilli);
      lastRefillMillis = now;
    }
  }
}
