package com.polycopy.ledger;

import java.math.BigDecimal;
import java.time.Instant;

public record ReferredUser(
    String userId,
    String displayName,
    BigDecimal totalPoints,
    BigDecimal totalVolume,
    Instant joinedAt
) {
}
