package com.polycopy.copytrade.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;

/**
 * A trade observed on a tracked wallet.
 *
 * @param marketId condition id of the market
 * @param assetId outcome token id; quotes and mirrored orders are placed on it
 * @param size shares traded
 * @param timestamp time the trade was executed on-chain
 */
public record TradeEvent(
    String sourceWallet,
    String marketId,
    String assetId,
    String marketTitle,
    String outcome,
    TradeSide side,
    BigDecimal size,
    BigDecimal price,
    String txHash,
    Instant timestamp
) {

  /**
   * Emission order: oldest first, ties broken by tx hash then wallet so it is total and deterministic.
   */
  public static final Comparator<TradeEvent> EMISSION_ORDER = Comparator
      .comparing(TradeEvent::timestamp)
      .thenComparing(e -> e.key().txHash())
      .thenComparing(e -> e.key().sourceWallet());

  public TradeKey key() {
    return new TradeKey(sourceWallet, txHash);
  }

  /**
   * USDC notional of the trade.
   */
  public BigDecimal volume() {
    return size.multiply(price);
  }
}
