package com.polycopy.web;

import com.polycopy.config.CopyTradeProperties;
import com.polycopy.copytrade.execution.MirrorOrderRepository;
import com.polycopy.copytrade.model.MirrorOutcome;
import com.polycopy.copytrade.session.PollerSession;
import com.polycopy.copytrade.subscription.SubscriptionRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CopyTradeStatusControllerTest {

  @Mock
  private PollerSession session;

  @Mock
  private SubscriptionRegistry subscriptions;

  @Mock
  private MirrorOrderRepository mirrorOrders;

  @Test
  void reportsSessionCountersAndOrderOutcomes() {
    Instant started = Instant.parse("2024-01-15T10:00:00Z");
    when(session.state()).thenReturn(PollerSession.State.RUNNING);
    when(session.startedAt()).thenReturn(started);
    when(session.ticks()).thenReturn(42L);
    when(session.emitted()).thenReturn(7L);
    when(session.seenSize()).thenReturn(7);
    when(subscriptions.trackedWallets()).thenReturn(Set.of("0xa", "0xb"));
    when(mirrorOrders.countByOutcome()).thenReturn(Map.of(MirrorOutcome.FILLED, 5L, MirrorOutcome.KILLED, 2L));
    CopyTradeProperties properties = new CopyTradeProperties(null, null, null, null, null, null, null);

    CopyTradeStatusController.CopyTradeStatusResponse body =
        new CopyTradeStatusController(properties, session, subscriptions, mirrorOrders).status().getBody();

    assertThat(body).isNotNull();
    assertThat(body.state()).isEqualTo("RUNNING");
    assertThat(body.startedAt()).isEqualTo(started);
    assertThat(body.trackedWallets()).isEqualTo(2);
    assertThat(body.ticks()).isEqualTo(42);
    assertThat(body.emitted()).isEqualTo(7);
    assertThat(body.seenKeys()).isEqualTo(7);
    assertThat(body.intervalMillis()).isEqualTo(2_000);
    assertThat(body.horizonSeconds()).isEqualTo(900);
    assertThat(body.mirrorOrders()).containsEntry(MirrorOutcome.FILLED, 5L);
  }
}
