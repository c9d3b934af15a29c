package com.polycopy.points;

import com.polycopy.ledger.PointsGrant;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Point formulas. One point per dollar of own volume, a tenth of that to the direct referrer, and a flat
 * bonus to the referrer when a referred user signs up.
 */
public final class PointsRules {

  public static final BigDecimal TRADE_POINTS_PER_USD = BigDecimal.ONE;
  public static final BigDecimal REFERRAL_TRADE_RATE = new BigDecimal("0.10");
  public static final BigDecimal REFERRAL_SIGNUP_BONUS = new BigDecimal("100");

  private PointsRules() {
  }

  /**
   * Volume a follower is credited with for a mirrored trade.
   */
  public static BigDecimal creditedVolume(BigDecimal sourceVolume, BigDecimal scaleFactor) {
    return round(sourceVolume.multiply(scaleFactor));
  }

  public static BigDecimal tradePoints(BigDecimal volume) {
    return round(volume.multiply(TRADE_POINTS_PER_USD));
  }

  public static BigDecimal referralTradePoints(BigDecimal volume) {
    return round(volume.multiply(REFERRAL_TRADE_RATE));
  }

  public static BigDecimal round(BigDecimal value) {
    return value.setScale(PointsGrant.SCALE, RoundingMode.HALF_UP);
  }
}
