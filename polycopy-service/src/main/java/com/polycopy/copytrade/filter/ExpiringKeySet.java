package com.polycopy.copytrade.filter;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Set of keys, each stamped with the time of the event it stands for. Keys are dropped once their
 * timestamp falls behind a cutoff, and the oldest keys go first when the set is over capacity.
 *
 * A key dropped for capacity is no longer remembered, so callers must stop admitting events stamped at or
 * before {@link #capacityWatermark()}.
 */
public class ExpiringKeySet<K> {

  private final int capacity;
  private final Map<K, Instant> entries = new HashMap<>();
  private final PriorityQueue<Entry<K>> byAge = new PriorityQueue<>(Comparator.comparing(Entry::timestamp));
  private Instant capacityWatermark;
  private long capacityEvictions;

  public ExpiringKeySet(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    this.capacity = capacity;
  }

  /**
   * @return true if the key was not present
   */
  public synchronized boolean add(K key, Instant timestamp) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(timestamp, "timestamp");
    if (entries.containsKey(key)) {
      return false;
    }
    entries.put(key, timestamp);
    byAge.add(new Entry<>(key, timestamp));
    while (entries.size() > capacity) {
      Entry<K> oldest = byAge.poll();
      entries.remove(oldest.key());
      capacityEvictions++;
      if (capacityWatermark == null || oldest.timestamp().isAfter(capacityWatermark)) {
        capacityWatermark = oldest.timestamp();
      }
    }
    return true;
  }

  /**
   * Newest timestamp of a key dropped because the set was full, if any.
   */
  public synchronized Optional<Instant> capacityWatermark() {
    return Optional.ofNullable(capacityWatermark);
  }

  public synchronized long capacityEvictions() {
    return capacityEvictions;
  }

  public synchronized boolean contains(K key) {
    return entries.containsKey(key);
  }

  /**
   * Removes every key stamped strictly before {@code cutoff}.
   *
   * @return number of keys removed
   */
  public synchronized int evictOlderThan(Instant cutoff) {
    int evicted = 0;
    while (!byAge.isEmpty() && byAge.peek().timestamp().isBefore(cutoff)) {
      entries.remove(byAge.poll().key());
      evicted++;
    }
    return evicted;
  }

  public synchronized int size() {
    return entries.size();
  }

  private record Entry<K>(K key, Instant timestamp) {
  }
}
