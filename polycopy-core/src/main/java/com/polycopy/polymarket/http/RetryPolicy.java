package com.polycopy.polymarket.http;

public record RetryPolicy(
    boolean enabled,
    int maxAttempts,
    long initialBackoffMillis,
    long maxBackoffMillis
) {

  public static RetryPolicy none() {
    return new RetryPolicy(false, 1, 0, 0);
  }

  public int attempts() {
    return enabled ? Math.max(1, maxAttempts) : 1;
  }

  /**
   * Backoff before retry number {@code attempt} (1-based), doubling and capped at {@code maxBackoffMillis}.
   */
  public long backoffMillis(int attempt) {
    if (initialBackoffMillis <= 0) {
      return 0;
    }
    long backoff = initialBackoffMillis << Math.min(20, Math.max(0, attempt - 1));
    return maxBackoffMillis > 0 ? Math.min(backoff, maxBackoffMillis) : backoff;
  }
}
