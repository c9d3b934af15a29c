package com.polycopy.ledger;

import java.util.Arrays;

public enum PointsType {
  TRADE("trade"),
  REFERRAL_TRADE("referral_trade"),
  REFERRAL_SIGNUP("referral_signup");

  private final String dbValue;

  PointsType(String dbValue) {
    this.dbValue = dbValue;
  }

  public String dbValue() {
    return dbValue;
  }

  public static PointsType fromDb(String value) {
    return Arrays.stream(values())
        .filter(t -> t.dbValue.equals(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown points type: " + value));
  }
}
