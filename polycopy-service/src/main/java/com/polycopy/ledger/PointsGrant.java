package com.polycopy.ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * One point grant to apply. {@code grantKey} identifies the triggering event; the ledger applies a given
 * (user, type, key) at most once.
 *
 * @param volume source volume recorded with the entry; added to the wallet's total volume only for
 *               {@link PointsType#TRADE}
 */
public record PointsGrant(
    String userId,
    PointsType type,
    String grantKey,
    BigDecimal points,
    BigDecimal volume,
    String marketId,
    String marketTitle,
    String referredUserId,
    String description
) {

  /**
   * Points and volumes are stored with two decimals.
   */
  public static final int SCALE = 2;

  public PointsGrant {
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(grantKey, "grantKey");
    Objects.requireNonNull(points, "points");
    if (points.signum() < 0) {
      throw new IllegalArgumentException("points must be >= 0: " + points);
    }
    points = points.setScale(SCALE, RoundingMode.HALF_UP);
    volume = volume == null ? null : volume.setScale(SCALE, RoundingMode.HALF_UP);
  }

  public static PointsGrant trade(String userId, String tradeKey, BigDecimal points, BigDecimal volume,
                                  String marketId, String marketTitle) {
    return new PointsGrant(userId, PointsType.TRADE, tradeKey, points, volume, marketId, marketTitle, null,
        "Trade volume $" + volume.toPlainString());
  }

  public static PointsGrant referralTrade(String referrerUserId, String tradeKey, String referredUserId,
                                          BigDecimal points, BigDecimal volume, String marketId,
                                          String marketTitle) {
    return new PointsGrant(referrerUserId, PointsType.REFERRAL_TRADE, tradeKey + ":" + referredUserId, points,
        volume, marketId, marketTitle, referredUserId, "Referral trade by " + referredUserId);
  }

  public static PointsGrant referralSignup(String referrerUserId, String newUserId, BigDecimal points) {
    return new PointsGrant(referrerUserId, PointsType.REFERRAL_SIGNUP, newUserId, points, null, null, null,
        newUserId, "Referral signup bonus");
  }

  /**
   * Volume credited to the wallet's running total.
   */
  public BigDecimal walletVolumeIncrement() {
    if (type != PointsType.TRADE || volume == null) {
      return BigDecimal.ZERO;
    }
    return volume;
  }
}
