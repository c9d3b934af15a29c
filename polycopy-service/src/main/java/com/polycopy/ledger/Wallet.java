package com.polycopy.ledger;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * A bot user's account. {@code credentialRef} points at the encrypted signing key held by the executor;
 * the key itself never enters this service.
 */
public record Wallet(
    String userId,
    String handle,
    String address,
    String credentialRef,
    Map<String, String> settings,
    String referralCode,
    String referredBy,
    BigDecimal totalPoints,
    BigDecimal totalVolume,
    Instant createdAt
) {

  public Wallet {
    settings = settings == null ? Map.of() : Map.copyOf(settings);
    totalPoints = totalPoints == null ? BigDecimal.ZERO : totalPoints;
    totalVolume = totalVolume == null ? BigDecimal.ZERO : totalVolume;
  }

  public static Wallet create(String userId, String handle, String address, String credentialRef,
                              Map<String, String> settings, String referralCode, Instant createdAt) {
    return new Wallet(userId, handle, address, credentialRef, settings, referralCode, null,
        BigDecimal.ZERO, BigDecimal.ZERO, createdAt);
  }

  public boolean isReferred() {
    return referredBy != null;
  }
}
