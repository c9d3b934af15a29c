package com.polycopy.copytrade.session;

import com.polycopy.copytrade.feed.TradeFeedPoller;
import com.polycopy.copytrade.filter.ExpiringKeySet;
import com.polycopy.copytrade.filter.TradeOrderingFilter;
import com.polycopy.copytrade.model.TradeEvent;
import com.polycopy.support.MutableClock;
import com.polycopy.support.Trades;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PollerSessionTest {

  private static final Instant START = Instant.parse("2024-01-15T10:00:00Z");
  private static final Duration HORIZON = Duration.ofMinutes(15);
  private static final String WALLET = "0xaaaa";

  @Mock
  private TradeFeedPoller poller;

  private MutableClock clock;
  private TradeOrderingFilter filter;
  private List<TradeEvent> received;
  private SimpleMeterRegistry meterRegistry;
  private PollerSession session;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    filter = new TradeOrderingFilter(new ExpiringKeySet<>(1_000), HORIZON);
    received = new ArrayList<>();
    filter.subscribe(received::add);
    meterRegistry = new SimpleMeterRegistry();
    // initial delay keeps the scheduler out of the way; ticks are driven by hand
    session = new PollerSession(poller, () -> Set.of(WALLET), filter, Duration.ofSeconds(2), Duration.ofHours(1),
        HORIZON, clock, meterRegistry);
  }

  @AfterEach
  void tearDown() {
    session.stop(Duration.ofSeconds(1));
  }

  @Test
  void tickBeforeStartDoesNothing() {
    session.tick();

    assertThat(session.state()).isEqualTo(PollerSession.State.NEW);
    assertThat(session.ticks()).isZero();
    verify(poller, never()).poll(anyCollection(), any());
  }

  @Test
  void pollsFromSessionStartThenFromHorizon() {
    when(poller.poll(anyCollection(), any())).thenReturn(List.of());
    session.start();

    clock.advance(Duration.ofSeconds(2));
    session.tick();
    verify(poller).poll(Set.of(WALLET), START);

    clock.advance(Duration.ofMinutes(20));
    session.tick();
    verify(poller).poll(Set.of(WALLET), clock.instant().minus(HORIZON));
  }

  @Test
  void emitsNewTradesOnceAcrossTicks() {
    TradeEvent trade = Trades.buy(WALLET, "0x01", "10", "0.5", START.plusSeconds(1));
    when(poller.poll(anyCollection(), eq(START))).thenReturn(List.of(trade));
    session.start();
    clock.advance(Duration.ofSeconds(2));

    session.tick();
    session.tick();

    assertThat(received).containsExactly(trade);
    assertThat(session.ticks()).isEqualTo(2);
    assertThat(session.candidates()).isEqualTo(2);
    assertThat(session.emitted()).isEqualTo(1);
    assertThat(session.duplicates()).isEqualTo(1);
    assertThat(meterRegistry.get("copytrade.trades.emitted").counter().count()).isEqualTo(1.0);
    assertThat(meterRegistry.get("copytrade.seen.keys").gauge().value()).isEqualTo(1.0);
  }

  @Test
  void overlappingTickIsSkipped() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    when(poller.poll(anyCollection(), any())).thenAnswer(inv -> {
      entered.countDown();
      release.await(5, TimeUnit.SECONDS);
      return List.of();
    });
    session.start();

    Thread first = new Thread(session::tick);
    first.start();
    assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

    session.tick();
    release.countDown();
    first.join(5_000);

    assertThat(session.overlappingTicks()).isEqualTo(1);
    assertThat(session.ticks()).isEqualTo(1);
  }

  @Test
  void failingTickIsCountedAndNextTickRuns() {
    when(poller.poll(anyCollection(), any()))
        .thenThrow(new IllegalStateException("boom"))
        .thenReturn(List.of());
    session.start();

    session.tick();
    session.tick();

    assertThat(session.failures()).isEqualTo(1);
    assertThat(session.ticks()).isEqualTo(2);
  }

  @Test
  void stoppedSessionIgnoresTicksAndCannotRestart() {
    session.start();
    session.stop(Duration.ofSeconds(1));

    session.tick();

    assertThat(session.state()).isEqualTo(PollerSession.State.STOPPED);
    assertThat(session.ticks()).isZero();
    assertThatThrownBy(session::start).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void noTrackedWalletsSkipsPolling() {
    PollerSession idle = new PollerSession(poller, () -> Set.of(), filter, Duration.ofSeconds(2), Duration.ofHours(1),
        HORIZON, clock, new SimpleMeterRegistry());
    idle.start();
    try {
      idle.tick();
      assertThat(idle.ticks()).isEqualTo(1);
      verify(poller, never()).poll(anyCollection(), any());
    } finally {
      idle.stop(Duration.ofSeconds(1));
    }
  }
}
