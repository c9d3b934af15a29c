package com.polycopy.copytrade.filter;

import com.polycopy.copytrade.model.TradeEvent;
import com.polycopy.copytrade.model.TradeKey;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns the candidates of one poll tick into an ordered stream of new trades.
 *
 * Candidates are sorted by (timestamp, tx hash, wallet), keys already seen are dropped, the rest are marked
 * seen and then handed to every subscriber in that order. Candidates older than the horizon are never
 * admitted, because their keys may already have been evicted. The same holds for candidates stamped at or
 * before the newest key the seen set had to drop for capacity.
 */
@Slf4j
public class TradeOrderingFilter {

  private final ExpiringKeySet<TradeKey> seen;
  private final Duration horizon;
  private final List<TradeEventSubscriber> subscribers = new CopyOnWriteArrayList<>();

  private final AtomicLong emitted = new AtomicLong();
  private final AtomicLong duplicates = new AtomicLong();
  private final AtomicLong stale = new AtomicLong();

  public TradeOrderingFilter(ExpiringKeySet<TradeKey> seen, Duration horizon) {
    this.seen = Objects.requireNonNull(seen, "seen");
    this.horizon = Objects.requireNonNull(horizon, "horizon");
  }

  public void subscribe(TradeEventSubscriber subscriber) {
    subscribers.add(Objects.requireNonNull(subscriber, "subscriber"));
  }

  /**
   * @return the events emitted by this call, in emission order
   */
  public synchronized List<TradeEvent> process(Collection<TradeEvent> candidates, Instant now) {
    Instant cutoff = now.minus(horizon);
    int evicted = seen.evictOlderThan(cutoff);
    if (evicted > 0) {
      log.debug("Evicted {} trade keys older than {}", evicted, cutoff);
    }

    Instant watermark = seen.capacityWatermark().orElse(null);
    List<TradeEvent> sorted = new ArrayList<>(candidates.size());
    for (TradeEvent candidate : candidates) {
      if (candidate.timestamp().isBefore(cutoff)
          || (watermark != null && !candidate.timestamp().isAfter(watermark))) {
        stale.incrementAndGet();
        continue;
      }
      sorted.add(candidate);
    }
    sorted.sort(TradeEvent.EMISSION_ORDER);

    long capacityEvictionsBefore = seen.capacityEvictions();
    List<TradeEvent> fresh = new ArrayList<>();
    for (TradeEvent event : sorted) {
      if (seen.add(event.key(), event.timestamp())) {
        fresh.add(event);
      } else {
        duplicates.incrementAndGet();
      }
    }
    long droppedForCapacity = seen.capacityEvictions() - capacityEvictionsBefore;
    if (droppedForCapacity > 0) {
      log.warn("Seen-key set full: dropped {} keys inside the horizon, admitting only trades after {}",
          droppedForCapacity, seen.capacityWatermark().orElse(cutoff));
    }

    for (TradeEvent event : fresh) {
      emitted.incrementAndGet();
      for (TradeEventSubscriber subscriber : subscribers) {
        try {
          subscriber.onTrade(event);
        } catch (Exception e) {
          log.warn("Subscriber {} failed on {}: {}",
              subscriber.getClass().getSimpleName(), event.key().asString(), e.toString());
        }
      }
    }
    return fresh;
  }

  public long emitted() {
    return emitted.get();
  }

  public long duplicates() {
    return duplicates.get();
  }

  public long stale() {
    return stale.get();
  }

  public int seenSize() {
    return seen.size();
  }
}
