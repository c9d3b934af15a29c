package com.polycopy.referral;

import lombok.Getter;

/**
 * A referral operation refused for a business reason. Nothing was written.
 */
@Getter
public class ReferralException extends RuntimeException {

  public enum Reason {
    INVALID_CODE,
    UNKNOWN_CODE,
    CODE_TAKEN,
    SELF_REFERRAL,
    ALREADY_REFERRED,
    REFERRAL_CYCLE
  }

  private final Reason reason;

  public ReferralException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }
}
