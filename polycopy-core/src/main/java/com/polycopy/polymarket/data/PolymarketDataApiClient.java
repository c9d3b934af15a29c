package com.polycopy.polymarket.data;

import com.fasterxml.jackson.databind.JsonNode;
import com.polycopy.polymarket.http.HttpRequestFactory;
import com.polycopy.polymarket.http.PolymarketHttpTransport;
import lombok.NonNull;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only client for the Polymarket Data API.
 */
public class PolymarketDataApiClient {

  private final HttpRequestFactory requestFactory;
  private final PolymarketHttpTransport transport;
  private final Duration timeout;

  public PolymarketDataApiClient(@NonNull URI baseUri, @NonNull PolymarketHttpTransport transport, @NonNull Duration timeout) {
    this.requestFactory = new HttpRequestFactory(Objects.requireNonNull(baseUri, "baseUri"));
    this.transport = Objects.requireNonNull(transport, "transport");
    this.timeout = timeout;
  }

  /**
   * Recent trades of one proxy wallet, newest first.
   *
   * Some API versions wrap the array as {@code {"data": [...]}}; callers get the array either way.
   */
  public JsonNode getTrades(String userAddress, int limit, int offset) {
    if (userAddress == null || userAddress.isBlank()) {
      throw new IllegalArgumentException("userAddress must not be blank");
    }
    Map<String, String> query = new LinkedHashMap<>();
    query.put("user", userAddress.toLowerCase(Locale.ROOT));
    query.put("limit", Integer.toString(Math.max(1, limit)));
    query.put("offset", Integer.toString(Math.max(0, offset)));
    JsonNode body = getJson("/trades", query);
    if (body != null && body.isObject() && body.path("data").isArray()) {
      return body.get("data");
    }
    return body;
  }

  private JsonNode getJson(String path, Map<String, String> query) {
    HttpRequest request = requestFactory.request(path, query)
        .GET()
        .timeout(timeout)
        .header("Accept", "application/json")
        .build();
    return transport.sendJson(request, JsonNode.class);
  }
}
