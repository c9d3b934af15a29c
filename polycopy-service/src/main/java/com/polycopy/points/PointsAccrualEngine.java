package com.polycopy.points;

import com.polycopy.common.concurrent.KeyedSerialExecutor;
import com.polycopy.copytrade.filter.TradeEventSubscriber;
import com.polycopy.copytrade.model.CopySubscription;
import com.polycopy.copytrade.model.TradeEvent;
import com.polycopy.copytrade.subscription.SubscriptionRegistry;
import com.polycopy.ledger.PointsGrant;
import com.polycopy.ledger.PointsLedger;
import com.polycopy.ledger.Wallet;
import com.polycopy.ledger.WalletRepository;
import com.polycopy.notify.CopyTradeNotification;
import com.polycopy.notify.NotificationSink;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Credits followers for every emitted trade, whether or not the mirrored order fills, and credits their
 * direct referrer with the referral share. Grants are keyed by the trade identity, so replaying a trade
 * never grants twice.
 */
@Slf4j
public class PointsAccrualEngine implements TradeEventSubscriber {

  private final SubscriptionRegistry subscriptions;
  private final WalletRepository wallets;
  private final PointsLedger ledger;
  private final NotificationSink notifications;
  private final KeyedSerialExecutor lanes;
  private final Clock clock;

  public PointsAccrualEngine(
      SubscriptionRegistry subscriptions,
      WalletRepository wallets,
      PointsLedger ledger,
      NotificationSink notifications,
      KeyedSerialExecutor lanes,
      Clock clock
  ) {
    this.subscriptions = Objects.requireNonNull(subscriptions, "subscriptions");
    this.wallets = Objects.requireNonNull(wallets, "wallets");
    this.ledger = Objects.requireNonNull(ledger, "ledger");
    this.notifications = Objects.requireNonNull(notifications, "notifications");
    this.lanes = Objects.requireNonNull(lanes, "lanes");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void onTrade(TradeEvent event) {
    for (CopySubscription subscription : subscriptions.activeFor(event.sourceWallet())) {
      lanes.submit(subscription.userId(), () -> accrue(subscription, event));
    }
  }

  /**
   * Applies the trade grant for the follower and the referral grant for the follower's referrer.
   */
  public void accrue(CopySubscription subscription, TradeEvent event) {
    String userId = subscription.userId();
    BigDecimal volume = PointsRules.creditedVolume(event.volume(), subscription.scaleFactor());
    if (volume.signum() <= 0) {
      return;
    }
    String tradeKey = event.key().asString();

    BigDecimal points = PointsRules.tradePoints(volume);
    if (ledger.grant(PointsGrant.trade(userId, tradeKey, points, volume, event.marketId(), event.marketTitle()))) {
      notifications.publish(CopyTradeNotification.pointsGranted(
          userId, event, points, "Trade volume $" + volume.toPlainString(), clock.instant()));
    }

    Optional<Wallet> wallet = wallets.findByUserId(userId);
    if (wallet.isEmpty() || !wallet.get().isReferred()) {
      return;
    }
    Optional<Wallet> referrer = wallets.findByReferralCode(wallet.get().referredBy());
    if (referrer.isEmpty()) {
      log.warn("Referrer code {} of user {} resolves to no wallet", wallet.get().referredBy(), userId);
      return;
    }

    String referrerId = referrer.get().userId();
    BigDecimal referralPoints = PointsRules.referralTradePoints(volume);
    if (referralPoints.signum() == 0) {
      return;
    }
    PointsGrant referralGrant = PointsGrant.referralTrade(
        referrerId, tradeKey, userId, referralPoints, volume, event.marketId(), event.marketTitle());
    if (ledger.grant(referralGrant)) {
      notifications.publish(CopyTradeNotification.pointsGranted(
          referrerId, event, referralPoints, "Referral trade by " + userId, clock.instant()));
    }
  }
}
