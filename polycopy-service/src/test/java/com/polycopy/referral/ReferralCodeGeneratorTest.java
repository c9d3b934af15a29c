package com.polycopy.referral;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReferralCodeGeneratorTest {

  @Test
  void generatesValidCodesOfConfiguredLength() {
    ReferralCodeGenerator generator = new ReferralCodeGenerator(new Random(42), 7);

    for (int i = 0; i < 100; i++) {
      String code = generator.generate();
      assertThat(code).hasSize(7).matches("[A-Z0-9]+");
      assertThat(ReferralService.isValidCode(code)).isTrue();
    }
  }

  @Test
  void rejectsLengthsOutsideCodeBounds() {
    assertThatThrownBy(() -> new ReferralCodeGenerator(2)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new ReferralCodeGenerator(8)).isInstanceOf(IllegalArgumentException.class);
  }
}
