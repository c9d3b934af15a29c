package com.polycopy.polymarket.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;

/**
 * Sends JSON requests with rate limiting and retries.
 *
 * Timeouts, IO errors, 429 and 5xx are retried with capped exponential backoff. Any other non-2xx
 * status fails immediately. Requests with side effects must go through {@link #sendJsonOnce}.
 */
@Slf4j
public class PolymarketHttpTransport {

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final RequestRateLimiter rateLimiter;
  private final RetryPolicy retryPolicy;

  public PolymarketHttpTransport(
      HttpClient httpClient,
      ObjectMapper objectMapper,
      RequestRateLimiter rateLimiter,
      RetryPolicy retryPolicy
  ) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.rateLimiter = rateLimiter == null ? RequestRateLimiter.noop() : rateLimiter;
    this.retryPolicy = retryPolicy == null ? RetryPolicy.none() : retryPolicy;
  }

  public <T> T sendJson(HttpRequest request, Class<T> type) {
    int attempts = retryPolicy.attempts();
    PolymarketHttpException last = null;
    for (int attempt = 1; attempt <= attempts; attempt++) {
      try {
        return execute(request, type);
      } catch (PolymarketHttpException e) {
        if (!e.isRetryable()) {
          throw e;
        }
        last = e;
        if (attempt < attempts) {
          long backoff = retryPolicy.backoffMillis(attempt);
          log.debug("retrying {} {} after {}ms (attempt {}/{}): {}",
              request.method(), request.uri(), backoff, attempt, attempts, e.getMessage());
          sleep(backoff);
        }
      }
    }
    throw last;
  }

  public <T> T sendJsonOnce(HttpRequest request, Class<T> type) {
    return execute(request, type);
  }

  private <T> T execute(HttpRequest request, Class<T> type) {
    rateLimiter.acquire();
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new PolymarketHttpException("%s %s failed: %s".formatted(request.method(), request.uri(), e), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PolymarketHttpException("%s %s interrupted".formatted(request.method(), request.uri()), -1, false);
    }

    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      boolean retryable = status == 429 || status >= 500;
      throw new PolymarketHttpException(
          "%s %s returned HTTP %d: %s".formatted(request.method(), request.uri(), status, abbreviate(response.body())),
          status,
          retryable,
          response.body()
      );
    }

    String body = response.body();
    if (body == null || body.isBlank()) {
      body = "null";
    }
    try {
      return objectMapper.readValue(body, type);
    } catch (IOException e) {
      throw new PolymarketHttpException(
          "Failed parsing response of %s %s".formatted(request.method(), request.uri()), status, false);
    }
  }

  private static void sleep(long millis) {
    if (millis <= 0) {
      return;
    }
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PolymarketHttpException("Interrupted during retry backoff", -1, false);
    }
  }

  private static String abbreviate(String body) {
    if (body == null) {
      return "";
    }
    return body.length() <= 300 ? body : body.substring(0, 300) + "...";
  }
}
