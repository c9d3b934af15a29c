package com.polycopy.copytrade.session;

import com.polycopy.copytrade.feed.TradeFeedPoller;
import com.polycopy.copytrade.filter.TradeOrderingFilter;
import com.polycopy.copytrade.model.TradeEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * One copy-trading session: a fixed-delay tick that polls the tracked wallets and pushes the candidates
 * through the ordering filter.
 *
 * Ticks run on a single scheduler thread and a tick that finds another one in flight does nothing, so the
 * filter's seen set is never mutated concurrently. Trades executed before {@link #start()} are never emitted.
 */
@Slf4j
public class PollerSession {

  public enum State {
    NEW,
    RUNNING,
    STOPPED
  }

  private final TradeFeedPoller poller;
  private final Supplier<Set<String>> trackedWallets;
  private final TradeOrderingFilter filter;
  private final Duration interval;
  private final Duration initialDelay;
  private final Duration horizon;
  private final Clock clock;

  private final AtomicBoolean pollingNow = new AtomicBoolean(false);
  private final AtomicLong ticks = new AtomicLong();
  private final AtomicLong overlappingTicks = new AtomicLong();
  private final AtomicLong failures = new AtomicLong();
  private final AtomicLong candidates = new AtomicLong();

  private final Counter emittedCounter;
  private final Timer tickTimer;

  private volatile State state = State.NEW;
  private volatile Instant startedAt;
  private volatile Instant lastTickAt;
  private ScheduledExecutorService scheduler;
  private ScheduledFuture<?> tickFuture;

  public PollerSession(
      TradeFeedPoller poller,
      Supplier<Set<String>> trackedWallets,
      TradeOrderingFilter filter,
      Duration interval,
      Duration initialDelay,
      Duration horizon,
      Clock clock,
      MeterRegistry meterRegistry
  ) {
    this.poller = Objects.requireNonNull(poller, "poller");
    this.trackedWallets = Objects.requireNonNull(trackedWallets, "trackedWallets");
    this.filter = Objects.requireNonNull(filter, "filter");
    this.interval = Objects.requireNonNull(interval, "interval");
    this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
    this.horizon = Objects.requireNonNull(horizon, "horizon");
    this.clock = Objects.requireNonNull(clock, "clock");

    this.emittedCounter = Counter.builder("copytrade.trades.emitted")
        .description("Trades emitted by the ordering filter")
        .register(meterRegistry);
    this.tickTimer = Timer.builder("copytrade.poll.duration")
        .description("Duration of one poll tick")
        .register(meterRegistry);
    Gauge.builder("copytrade.seen.keys", filter, TradeOrderingFilter::seenSize)
        .description("Trade keys held for deduplication")
        .register(meterRegistry);
  }

  public synchronized void start() {
    if (state != State.NEW) {
      throw new IllegalStateException("Session already " + state);
    }
    startedAt = clock.instant();
    scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "copytrade-poller");
      t.setDaemon(true);
      return t;
    });
    state = State.RUNNING;
    tickFuture = scheduler.scheduleWithFixedDelay(
        this::tick, initialDelay.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    log.info("Copy-trade session started at {} (interval={}ms, horizon={}s)",
        startedAt, interval.toMillis(), horizon.toSeconds());
  }

  /**
   * Cancels scheduling and waits up to {@code timeout} for an in-flight tick.
   */
  public synchronized void stop(Duration timeout) {
    if (state != State.RUNNING) {
      state = State.STOPPED;
      return;
    }
    state = State.STOPPED;
    tickFuture.cancel(false);
    scheduler.shutdown();
    try {
      if (!scheduler.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Poll tick still running after {}ms, interrupting", timeout.toMillis());
        scheduler.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      scheduler.shutdownNow();
    }
    log.info("Copy-trade session stopped: ticks={} emitted={} failures={}", ticks.get(), filter.emitted(), failures.get());
  }

  public void stop() {
    stop(Duration.ofSeconds(10));
  }

  /**
   * Runs one poll cycle. Does nothing unless the session is running or while another tick is in flight.
   */
  public void tick() {
    if (state != State.RUNNING) {
      return;
    }
    if (!pollingNow.compareAndSet(false, true)) {
      overlappingTicks.incrementAndGet();
      return;
    }
    try {
      tickTimer.record(this::runTick);
    } catch (Exception e) {
      failures.incrementAndGet();
      log.warn("Poll tick failed: {}", e.toString());
    } finally {
      pollingNow.set(false);
    }
  }

  private void runTick() {
    ticks.incrementAndGet();
    Instant now = clock.instant();
    lastTickAt = now;
    Set<String> wallets = trackedWallets.get();
    if (wallets.isEmpty()) {
      return;
    }
    Instant windowStart = now.minus(horizon);
    Instant since = startedAt.isAfter(windowStart) ? startedAt : windowStart;

    List<TradeEvent> fetched = poller.poll(wallets, since);
    candidates.addAndGet(fetched.size());
    List<TradeEvent> emitted = filter.process(fetched, now);
    emittedCounter.increment(emitted.size());
    if (!emitted.isEmpty()) {
      log.info("Poll tick: wallets={} fetched={} emitted={} seen={}",
          wallets.size(), fetched.size(), emitted.size(), filter.seenSize());
    }
  }

  public State state() {
    return state;
  }

  public Instant startedAt() {
    return startedAt;
  }

  public Instant lastTickAt() {
    return lastTickAt;
  }

  public long ticks() {
    return ticks.get();
  }

  public long overlappingTicks() {
    return overlappingTicks.get();
  }

  public long failures() {
    return failures.get();
  }

  public long candidates() {
    return candidates.get();
  }

  public long emitted() {
    return filter.emitted();
  }

  public long duplicates() {
    return filter.duplicates();
  }

  public int seenSize() {
    return filter.seenSize();
  }
}
