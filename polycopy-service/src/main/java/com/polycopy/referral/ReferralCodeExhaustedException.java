package com.polycopy.referral;

import lombok.Getter;

/**
 * Every generated referral code collided with an existing one.
 */
@Getter
public class ReferralCodeExhaustedException extends RuntimeException {

  private final String userId;
  private final int attempts;

  public ReferralCodeExhaustedException(String userId, int attempts) {
    super("Could not generate a unique referral code for " + userId + " after " + attempts + " attempts");
    this.userId = userId;
    this.attempts = attempts;
  }
}
