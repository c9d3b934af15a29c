package com.polycopy.copytrade.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A user following a source wallet. Mirrored notionals are the source volume times {@code scaleFactor}.
 */
public record CopySubscription(
    long id,
    String userId,
    String sourceWallet,
    String label,
    BigDecimal scaleFactor,
    boolean enabled,
    Instant createdAt
) {
}
