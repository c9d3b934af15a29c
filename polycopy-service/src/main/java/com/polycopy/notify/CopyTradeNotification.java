package com.polycopy.notify;

import com.polycopy.copytrade.model.MirrorOrder;
import com.polycopy.copytrade.model.TradeEvent;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;

/**
 * Structured outcome handed to the notification collaborator. Formatting and delivery are the
 * collaborator's concern.
 */
public record CopyTradeNotification(
    Kind kind,
    String userId,
    String sourceWallet,
    String txHash,
    String marketId,
    String marketTitle,
    String side,
    BigDecimal size,
    BigDecimal price,
    BigDecimal points,
    String detail,
    Instant at
) {

  public enum Kind {
    TRADE_MIRRORED,
    MIRROR_KILLED,
    MIRROR_SKIPPED,
    MIRROR_ERROR,
    POINTS_GRANTED;

    public String eventType() {
      return "copytrade." + name().toLowerCase(Locale.ROOT);
    }
  }

  public static CopyTradeNotification mirror(Kind kind, MirrorOrder order, TradeEvent event, Instant at) {
    return new CopyTradeNotification(
        kind,
        order.userId(),
        order.sourceWallet(),
        order.txHash(),
        order.marketId(),
        event.marketTitle(),
        order.side() == null ? null : order.side().name(),
        order.requestedSize(),
        order.priceBasis(),
        null,
        order.errorDetail(),
        at
    );
  }

  public static CopyTradeNotification pointsGranted(String userId, TradeEvent event, BigDecimal points,
                                                    String detail, Instant at) {
    return new CopyTradeNotification(
        Kind.POINTS_GRANTED,
        userId,
        event.sourceWallet(),
        event.txHash(),
        event.marketId(),
        event.marketTitle(),
        event.side().name(),
        null,
        null,
        points,
        detail,
        at
    );
  }

  /**
   * Partition key: notifications for one user stay in order.
   */
  public String key() {
    return userId;
  }
}
