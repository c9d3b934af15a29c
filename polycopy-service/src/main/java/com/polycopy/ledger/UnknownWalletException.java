package com.polycopy.ledger;

public class UnknownWalletException extends RuntimeException {

  private final String userId;

  public UnknownWalletException(String userId) {
    super("No wallet for user " + userId);
    this.userId = userId;
  }

  public String getUserId() {
    return userId;
  }
}
