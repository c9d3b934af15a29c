package com.polycopy.copytrade.execution;

import com.polycopy.common.concurrent.KeyedSerialExecutor;
import com.polycopy.copytrade.filter.TradeEventSubscriber;
import com.polycopy.copytrade.model.CopySubscription;
import com.polycopy.copytrade.model.MirrorOrder;
import com.polycopy.copytrade.model.MirrorOutcome;
import com.polycopy.copytrade.model.TradeEvent;
import com.polycopy.copytrade.model.TradeSide;
import com.polycopy.copytrade.subscription.SubscriptionRegistry;
import com.polycopy.executor.FokOrderRequest;
import com.polycopy.executor.OrderSigningGateway;
import com.polycopy.executor.OrderSubmissionResult;
import com.polycopy.notify.CopyTradeNotification;
import com.polycopy.notify.NotificationSink;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mirrors every emitted trade onto the accounts of the users following its wallet.
 *
 * Work runs on one serial lane per user, so a user's orders follow emission order while a slow submission
 * for one user never holds up another. Each order is fill-or-kill at the current best price and is submitted
 * at most once; a killed order is a normal outcome and is not retried.
 */
@Slf4j
public class MirrorExecutionEngine implements TradeEventSubscriber {

  static final int SIZE_SCALE = 4;

  private final SubscriptionRegistry subscriptions;
  private final QuoteService quotes;
  private final OrderSigningGateway gateway;
  private final MirrorOrderRepository orders;
  private final NotificationSink notifications;
  private final KeyedSerialExecutor lanes;
  private final BigDecimal minNotionalUsd;
  private final Clock clock;

  private final Map<MirrorOutcome, Counter> outcomeCounters = new EnumMap<>(MirrorOutcome.class);
  private final Counter alreadyMirroredCounter;

  public MirrorExecutionEngine(
      SubscriptionRegistry subscriptions,
      QuoteService quotes,
      OrderSigningGateway gateway,
      MirrorOrderRepository orders,
      NotificationSink notifications,
      KeyedSerialExecutor lanes,
      BigDecimal minNotionalUsd,
      Clock clock,
      MeterRegistry meterRegistry
  ) {
    this.subscriptions = Objects.requireNonNull(subscriptions, "subscriptions");
    this.quotes = Objects.requireNonNull(quotes, "quotes");
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.orders = Objects.requireNonNull(orders, "orders");
    this.notifications = Objects.requireNonNull(notifications, "notifications");
    this.lanes = Objects.requireNonNull(lanes, "lanes");
    this.minNotionalUsd = Objects.requireNonNull(minNotionalUsd, "minNotionalUsd");
    this.clock = Objects.requireNonNull(clock, "clock");

    for (MirrorOutcome outcome : MirrorOutcome.values()) {
      if (outcome.isTerminal()) {
        outcomeCounters.put(outcome, Counter.builder("copytrade.mirror.orders")
            .description("Mirrored orders by terminal outcome")
            .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
            .register(meterRegistry));
      }
    }
    this.alreadyMirroredCounter = Counter.builder("copytrade.mirror.already_mirrored")
        .description("Trades skipped because a mirror order already exists for the user")
        .register(meterRegistry);
  }

  @Override
  public void onTrade(TradeEvent event) {
    for (CopySubscription subscription : subscriptions.activeFor(event.sourceWallet())) {
      lanes.submit(subscription.userId(), () -> mirror(subscription, event));
    }
  }

  /**
   * Mirrors one trade for one follower on the calling thread.
   *
   * @return the terminal outcome, or empty if the trade had already been mirrored for this user
   */
  public Optional<MirrorOutcome> mirror(CopySubscription subscription, TradeEvent event) {
    String userId = subscription.userId();
    BigDecimal notional = event.volume().multiply(subscription.scaleFactor());

    if (notional.compareTo(minNotionalUsd) < 0) {
      String detail = "Notional $%s below minimum $%s".formatted(
          notional.setScale(2, RoundingMode.HALF_UP).toPlainString(), minNotionalUsd.toPlainString());
      Instant now = clock.instant();
      Optional<Long> id = orders.reserve(userId, event, FokOrderRequest.ORDER_TYPE_FOK, MirrorOutcome.SKIPPED, detail, now);
      if (id.isEmpty()) {
        alreadyMirrored(userId, event);
        return Optional.empty();
      }
      log.debug("Skipping mirror of {} for {}: {}", event.key().asString(), userId, detail);
      return Optional.of(report(id.get(), event, MirrorOutcome.SKIPPED, detail));
    }

    Optional<Long> reserved = orders.reserve(
        userId, event, FokOrderRequest.ORDER_TYPE_FOK, MirrorOutcome.PENDING, null, clock.instant());
    if (reserved.isEmpty()) {
      alreadyMirrored(userId, event);
      return Optional.empty();
    }
    long id = reserved.get();

    BigDecimal price;
    try {
      Optional<BigDecimal> best = quotes.bestPrice(event.assetId(), event.side());
      if (best.isEmpty()) {
        return Optional.of(complete(id, event, MirrorOutcome.KILLED, null, null, null,
            "No liquidity on the " + (event.side() == TradeSide.BUY ? "ask" : "bid") + " side"));
      }
      price = best.get();
    } catch (Exception e) {
      log.warn("Quote for {} failed while mirroring {} for {}: {}",
          event.assetId(), event.key().asString(), userId, e.toString());
      return Optional.of(complete(id, event, MirrorOutcome.ERROR, null, null, null, "Quote failed: " + e.getMessage()));
    }

    BigDecimal size = notional.divide(price, SIZE_SCALE, RoundingMode.DOWN);
    if (size.signum() <= 0) {
      return Optional.of(complete(id, event, MirrorOutcome.SKIPPED, size, price, null, "Order size rounds to zero"));
    }

    FokOrderRequest request = FokOrderRequest.of(
        userId, event.assetId(), event.side().name(), size, price, event.key().asString());
    log.info("Mirroring {} {} shares of {} at {} for {} (source {} tx {})",
        request.side(), size, event.marketTitle() == null ? event.assetId() : event.marketTitle(), price, userId,
        event.sourceWallet(), event.txHash());

    OrderSubmissionResult result;
    try {
      result = gateway.signAndSubmit(request);
    } catch (Exception e) {
      log.warn("Order submission for {} failed: {}", userId, e.toString());
      return Optional.of(complete(id, event, MirrorOutcome.ERROR, size, price, null, "Submission failed: " + e.getMessage()));
    }

    return switch (result.status()) {
      case FILLED -> Optional.of(complete(id, event, MirrorOutcome.FILLED, size, price, result.orderId(), null));
      case KILLED -> Optional.of(complete(id, event, MirrorOutcome.KILLED, size, price, emptyToNull(result.orderId()),
          result.errorMessage().isEmpty() ? "Not filled at " + price.toPlainString() : result.errorMessage()));
      case REJECTED -> Optional.of(complete(id, event, MirrorOutcome.ERROR, size, price, emptyToNull(result.orderId()),
          result.errorMessage().isEmpty() ? "Order rejected" : result.errorMessage()));
    };
  }

  private MirrorOutcome complete(long id, TradeEvent event, MirrorOutcome outcome, BigDecimal size, BigDecimal price,
                                 String exchangeOrderId, String detail) {
    if (!orders.finish(id, outcome, size, price, exchangeOrderId, detail, clock.instant())) {
      log.warn("Mirror order {} was already finalized, keeping its first outcome", id);
    }
    return report(id, event, outcome, detail);
  }

  private MirrorOutcome report(long id, TradeEvent event, MirrorOutcome outcome, String detail) {
    outcomeCounters.get(outcome).increment();

    MirrorOrder order = orders.findById(id).orElse(null);
    if (order == null) {
      log.warn("Mirror order {} vanished before notification", id);
      return outcome;
    }
    notifications.publish(CopyTradeNotification.mirror(kindOf(outcome), order, event, clock.instant()));
    if (outcome == MirrorOutcome.KILLED) {
      log.info("Mirror of {} for {} killed: {}", event.key().asString(), order.userId(), detail);
    } else if (outcome == MirrorOutcome.ERROR) {
      log.warn("Mirror of {} for {} failed: {}", event.key().asString(), order.userId(), detail);
    }
    return outcome;
  }

  private void alreadyMirrored(String userId, TradeEvent event) {
    alreadyMirroredCounter.increment();
    log.info("Trade {} already mirrored for {}, not submitting again", event.key().asString(), userId);
  }

  private static CopyTradeNotification.Kind kindOf(MirrorOutcome outcome) {
    return switch (outcome) {
      case FILLED -> CopyTradeNotification.Kind.TRADE_MIRRORED;
      case KILLED -> CopyTradeNotification.Kind.MIRROR_KILLED;
      case SKIPPED -> CopyTradeNotification.Kind.MIRROR_SKIPPED;
      case ERROR, PENDING -> CopyTradeNotification.Kind.MIRROR_ERROR;
    };
  }

  private static String emptyToNull(String s) {
    return s == null || s.isEmpty() ? null : s;
  }
}
