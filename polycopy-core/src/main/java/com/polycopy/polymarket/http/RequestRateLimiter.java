package com.polycopy.polymarket.http;

/**
 * Blocks the calling thread until the next outbound request is allowed.
 */
public interface RequestRateLimiter {

  void acquire();

  static RequestRateLimiter noop() {
    return () -> {
    };
  }
}
