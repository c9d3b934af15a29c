package com.polycopy.copytrade.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.polycopy.copytrade.model.TradeEvent;
import com.polycopy.copytrade.model.TradeSide;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps one Data API {@code /trades} record to a {@link TradeEvent}. Records without a tx hash, with an
 * unknown side, or with a non-positive size or price are rejected.
 */
final class DataApiTradeParser {

  private static final long EPOCH_MILLIS_THRESHOLD = 1_000_000_000_000L;

  private DataApiTradeParser() {
  }

  static Optional<TradeEvent> parse(JsonNode trade, String sourceWallet) {
    if (trade == null || !trade.isObject()) {
      return Optional.empty();
    }
    String txHash = text(trade, "transactionHash");
    if (txHash == null) {
      return Optional.empty();
    }
    TradeSide side = TradeSide.parse(text(trade, "side"));
    BigDecimal size = decimal(trade.path("size"));
    BigDecimal price = decimal(trade.path("price"));
    if (side == null || size == null || price == null || size.signum() <= 0 || price.signum() <= 0) {
      return Optional.empty();
    }
    long rawTs = trade.path("timestamp").asLong(0);
    if (rawTs <= 0) {
      return Optional.empty();
    }
    Instant ts = rawTs > EPOCH_MILLIS_THRESHOLD ? Instant.ofEpochMilli(rawTs) : Instant.ofEpochSecond(rawTs);

    return Optional.of(new TradeEvent(
        sourceWallet.toLowerCase(Locale.ROOT),
        text(trade, "conditionId"),
        text(trade, "asset"),
        text(trade, "title"),
        text(trade, "outcome"),
        side,
        size,
        price,
        txHash,
        ts
    ));
  }

  private static String text(JsonNode node, String field) {
    JsonNode v = node.path(field);
    if (v.isMissingNode() || v.isNull()) {
      return null;
    }
    String s = v.asText("").trim();
    return s.isEmpty() ? null : s;
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
