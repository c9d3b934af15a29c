package com.polycopy.ledger;

import java.math.BigDecimal;
import java.time.Instant;

public record PointsHistoryEntry(
    long id,
    String userId,
    BigDecimal pointsEarned,
    PointsType type,
    String grantKey,
    BigDecimal volume,
    String marketId,
    String marketTitle,
    String referredUserId,
    String description,
    Instant createdAt
) {
}
