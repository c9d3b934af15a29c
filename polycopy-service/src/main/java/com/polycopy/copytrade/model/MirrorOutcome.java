package com.polycopy.copytrade.model;

public enum MirrorOutcome {
  PENDING,
  FILLED,
  KILLED,
  ERROR,
  SKIPPED;

  public boolean isTerminal() {
    return this != PENDING;
  }
}
