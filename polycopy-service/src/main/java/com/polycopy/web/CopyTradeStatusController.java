package com.polycopy.web;

import com.polycopy.config.CopyTradeProperties;
import com.polycopy.copytrade.execution.MirrorOrderRepository;
import com.polycopy.copytrade.model.MirrorOutcome;
import com.polycopy.copytrade.session.PollerSession;
import com.polycopy.copytrade.subscription.SubscriptionRegistry;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

@RestController
@RequestMapping("/api/copytrade")
@RequiredArgsConstructor
public class CopyTradeStatusController {

  private final @NonNull CopyTradeProperties properties;
  private final @NonNull PollerSession session;
  private final @NonNull SubscriptionRegistry subscriptions;
  private final @NonNull MirrorOrderRepository mirrorOrders;

  @GetMapping("/status")
  public ResponseEntity<CopyTradeStatusResponse> status() {
    return ResponseEntity.ok(new CopyTradeStatusResponse(
        session.state().name(),
        session.startedAt(),
        session.lastTickAt(),
        properties.poller().intervalMillis(),
        properties.poller().horizonSeconds(),
        subscriptions.trackedWallets().size(),
        session.ticks(),
        session.overlappingTicks(),
        session.failures(),
        session.candidates(),
        session.emitted(),
        session.duplicates(),
        session.seenSize(),
        properties.mirror().enabled(),
        properties.points().enabled(),
        mirrorOrders.countByOutcome()
    ));
  }

  public record CopyTradeStatusResponse(
      String state,
      Instant startedAt,
      Instant lastTickAt,
      long intervalMillis,
      long horizonSeconds,
      int trackedWallets,
      long ticks,
      long overlappingTicks,
      long tickFailures,
      long candidates,
      long emitted,
      long duplicates,
      int seenKeys,
      boolean mirrorEnabled,
      boolean pointsEnabled,
      Map<MirrorOutcome, Long> mirrorOrders
  ) {
  }
}
