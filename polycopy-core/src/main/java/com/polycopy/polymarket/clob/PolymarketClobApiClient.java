package com.polycopy.polymarket.clob;

import com.fasterxml.jackson.databind.JsonNode;
import com.polycopy.polymarket.http.HttpRequestFactory;
import com.polycopy.polymarket.http.PolymarketHttpTransport;
import lombok.NonNull;

import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Quote side of the CLOB: order books and best prices.
 */
public class PolymarketClobApiClient {

  private final HttpRequestFactory requestFactory;
  private final PolymarketHttpTransport transport;
  private final Duration timeout;

  public PolymarketClobApiClient(@NonNull URI baseUri, @NonNull PolymarketHttpTransport transport, @NonNull Duration timeout) {
    this.requestFactory = new HttpRequestFactory(Objects.requireNonNull(baseUri, "baseUri"));
    this.transport = Objects.requireNonNull(transport, "transport");
    this.timeout = timeout;
  }

  public JsonNode getOrderBook(String tokenId) {
    if (tokenId == null || tokenId.isBlank()) {
      throw new IllegalArgumentException("tokenId must not be blank");
    }
    HttpRequest request = requestFactory.request("/book", Map.of("token_id", tokenId))
        .GET()
        .timeout(timeout)
        .header("Accept", "application/json")
        .build();
    return transport.sendJson(request, JsonNode.class);
  }

  /**
   * Highest bid. Book levels are not assumed to be sorted.
   */
  public static Optional<BigDecimal> bestBid(JsonNode book) {
    return bestLevel(book, "bids", true);
  }

  /**
   * Lowest ask. Book levels are not assumed to be sorted.
   */
  public static Optional<BigDecimal> bestAsk(JsonNode book) {
    return bestLevel(book, "asks", false);
  }

  private static Optional<BigDecimal> bestLevel(JsonNode book, String side, boolean highest) {
    if (book == null || book.isMissingNode() || book.isNull()) {
      return Optional.empty();
    }
    JsonNode levels = book.path(side);
    if (!levels.isArray()) {
      return Optional.empty();
    }
    BigDecimal best = null;
    for (JsonNode level : levels) {
      BigDecimal price = decimal(level.path("price"));
      BigDecimal size = decimal(level.path("size"));
      if (price == null || size == null || price.signum() <= 0 || size.signum() <= 0) {
        continue;
      }
      if (best == null || (highest ? price.compareTo(best) > 0 : price.compareTo(best) < 0)) {
        best = price;
      }
    }
    return Optional.ofNullable(best);
  }

  private static BigDecimal decimal(JsonNode node) {
    if (node == null || node.isMissingNode() || node.isNull()) {
      return null;
    }
    try {
      return new BigDecimal(node.asText().trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
