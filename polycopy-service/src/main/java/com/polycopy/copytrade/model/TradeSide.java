package com.polycopy.copytrade.model;

import java.util.Locale;

public enum TradeSide {
  BUY,
  SELL;

  /**
   * Parses the Data API {@code side} field. Returns {@code null} for anything other than BUY/SELL.
   */
  public static TradeSide parse(String raw) {
    if (raw == null) {
      return null;
    }
    return switch (raw.trim().toUpperCase(Locale.ROOT)) {
      case "BUY" -> BUY;
      case "SELL" -> SELL;
      default -> null;
    };
  }
}
