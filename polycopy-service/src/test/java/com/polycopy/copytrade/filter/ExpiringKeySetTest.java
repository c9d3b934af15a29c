package com.polycopy.copytrade.filter;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpiringKeySetTest {

  private static final Instant T0 = Instant.parse("2024-01-15T10:00:00Z");

  @Test
  void addReportsWhetherKeyWasNew() {
    ExpiringKeySet<String> set = new ExpiringKeySet<>(10);

    assertThat(set.add("a", T0)).isTrue();
    assertThat(set.add("a", T0.plusSeconds(5))).isFalse();
    assertThat(set.contains("a")).isTrue();
    assertThat(set.size()).isEqualTo(1);
  }

  @Test
  void evictsKeysStampedBeforeCutoff() {
    ExpiringKeySet<String> set = new ExpiringKeySet<>(10);
    set.add("old", T0);
    set.add("edge", T0.plusSeconds(60));
    set.add("new", T0.plusSeconds(120));

    int evicted = set.evictOlderThan(T0.plusSeconds(60));

    assertThat(evicted).isEqualTo(1);
    assertThat(set.contains("old")).isFalse();
    assertThat(set.contains("edge")).isTrue();
    assertThat(set.contains("new")).isTrue();
  }

  @Test
  void overCapacityDropsOldestFirst() {
    ExpiringKeySet<String> set = new ExpiringKeySet<>(2);
    set.add("b", T0.plusSeconds(2));
    set.add("a", T0.plusSeconds(1));

    set.add("c", T0.plusSeconds(3));

    assertThat(set.size()).isEqualTo(2);
    assertThat(set.contains("a")).isFalse();
    assertThat(set.contains("b")).isTrue();
    assertThat(set.contains("c")).isTrue();
    assertThat(set.capacityWatermark()).contains(T0.plusSeconds(1));
    assertThat(set.capacityEvictions()).isEqualTo(1);
  }

  @Test
  void horizonEvictionLeavesWatermarkUnset() {
    ExpiringKeySet<String> set = new ExpiringKeySet<>(10);
    set.add("old", T0);

    set.evictOlderThan(T0.plusSeconds(1));

    assertThat(set.capacityWatermark()).isEmpty();
    assertThat(set.capacityEvictions()).isZero();
  }

  @Test
  void rejectsNonPositiveCapacity() {
    assertThatThrownBy(() -> new ExpiringKeySet<String>(0)).isInstanceOf(IllegalArgumentException.class);
  }
}
