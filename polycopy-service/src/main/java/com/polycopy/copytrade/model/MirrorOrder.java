package com.polycopy.copytrade.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Record of one attempt to mirror one trade for one user. At most one exists per (user, trade).
 */
public record MirrorOrder(
    long id,
    String userId,
    String sourceWallet,
    String txHash,
    String marketId,
    String assetId,
    TradeSide side,
    BigDecimal requestedSize,
    BigDecimal priceBasis,
    String orderType,
    MirrorOutcome outcome,
    String exchangeOrderId,
    String errorDetail,
    Instant submittedAt,
    Instant finalizedAt
) {
}
