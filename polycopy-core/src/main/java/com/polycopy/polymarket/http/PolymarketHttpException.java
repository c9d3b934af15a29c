package com.polycopy.polymarket.http;

import lombok.Getter;

/**
 * Raised when a call to an external HTTP collaborator fails for good: a non-retryable status, or a
 * retryable failure that outlived the retry policy.
 */
@Getter
public class PolymarketHttpException extends RuntimeException {

  /**
   * HTTP status, or -1 when no response was received.
   */
  private final int statusCode;
  private final boolean retryable;
  /**
   * Body of a non-2xx response, or null.
   */
  private final String responseBody;

  public PolymarketHttpException(String message, int statusCode, boolean retryable) {
    this(message, statusCode, retryable, null);
  }

  public PolymarketHttpException(String message, int statusCode, boolean retryable, String responseBody) {
    super(message);
    this.statusCode = statusCode;
    this.retryable = retryable;
    this.responseBody = responseBody;
  }

  public PolymarketHttpException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = -1;
    this.retryable = true;
    this.responseBody = null;
  }

  public boolean isClientError() {
    return statusCode >= 400 && statusCode < 500;
  }
}
