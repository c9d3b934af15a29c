package com.polycopy.referral;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Random upper-case alphanumeric codes.
 */
public class ReferralCodeGenerator {

  private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

  private final Random random;
  private final int length;

  public ReferralCodeGenerator(int length) {
    this(new SecureRandom(), length);
  }

  public ReferralCodeGenerator(Random random, int length) {
    if (length < ReferralService.MIN_CODE_LENGTH || length > ReferralService.MAX_CODE_LENGTH) {
      throw new IllegalArgumentException("code length must be between "
          + ReferralService.MIN_CODE_LENGTH + " and " + ReferralService.MAX_CODE_LENGTH);
    }
    this.random = random;
    this.length = length;
  }

  public String generate() {
    StringBuilder sb = new StringBuilder(length);
    for (int i = 0; i < length; i++) {
      sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
    }
    return sb.toString();
  }
}
