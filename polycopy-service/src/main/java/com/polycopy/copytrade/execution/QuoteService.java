package com.polycopy.copytrade.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.polycopy.copytrade.model.TradeSide;
import com.polycopy.polymarket.clob.PolymarketClobApiClient;
import com.polycopy.polymarket.http.PolymarketHttpException;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Price a mirrored order would execute at right now: the best ask for a buy, the best bid for a sell.
 */
@Component
@RequiredArgsConstructor
public class QuoteService {

  private final @NonNull PolymarketClobApiClient clobApi;

  /**
   * @return empty when the book has no level on the taking side, or no book exists for the token
   * @throws PolymarketHttpException if the book could not be fetched
   */
  public Optional<BigDecimal> bestPrice(String assetId, TradeSide side) {
    JsonNode book;
    try {
      book = clobApi.getOrderBook(assetId);
    } catch (PolymarketHttpException e) {
      if (e.getStatusCode() == 404) {
        return Optional.empty();
      }
      throw e;
    }
    return side == TradeSide.BUY
        ? PolymarketClobApiClient.bestAsk(book)
        : PolymarketClobApiClient.bestBid(book);
  }
}
