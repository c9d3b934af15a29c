package com.polycopy.copytrade.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Identity of an observed trade: the same (wallet, tx) pair is one trade no matter how often it is fetched.
 */
public record TradeKey(String sourceWallet, String txHash) {

  public TradeKey {
    Objects.requireNonNull(sourceWallet, "sourceWallet");
    Objects.requireNonNull(txHash, "txHash");
    sourceWallet = sourceWallet.trim().toLowerCase(Locale.ROOT);
    txHash = txHash.trim().toLowerCase(Locale.ROOT);
  }

  /**
   * {@code wallet:tx}, used as message key and as the own-trade grant key.
   */
  public String asString() {
    return sourceWallet + ":" + txHash;
  }
}
