package com.polycopy.ledger;

import java.math.BigDecimal;

/**
 * @param referralPoints points earned from {@code referral_trade} and {@code referral_signup} grants
 */
public record PointsSummary(
    String userId,
    String handle,
    String referralCode,
    String referredBy,
    BigDecimal totalPoints,
    BigDecimal totalVolume,
    long referralCount,
    BigDecimal referralPoints
) {
}
