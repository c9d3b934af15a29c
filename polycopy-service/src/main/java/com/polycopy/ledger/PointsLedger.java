package com.polycopy.ledger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Applies point grants. Recording the history entry and incrementing the wallet totals happen in one
 * transaction, so {@code wallets.total_points} always equals the sum of the user's history.
 */
@Component
@Slf4j
public class PointsLedger {

  private final WalletRepository walletRepository;
  private final PointsHistoryRepository historyRepository;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  private final Map<PointsType, Counter> appliedCounters = new EnumMap<>(PointsType.class);
  private final Counter duplicateCounter;

  public PointsLedger(
      WalletRepository walletRepository,
      PointsHistoryRepository historyRepository,
      TransactionTemplate transactionTemplate,
      Clock clock,
      MeterRegistry meterRegistry
  ) {
    this.walletRepository = Objects.requireNonNull(walletRepository, "walletRepository");
    this.historyRepository = Objects.requireNonNull(historyRepository, "historyRepository");
    this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate");
    this.clock = Objects.requireNonNull(clock, "clock");

    for (PointsType type : PointsType.values()) {
      appliedCounters.put(type, Counter.builder("points.grants.applied")
          .description("Point grants written to the ledger")
          .tag("type", type.dbValue())
          .register(meterRegistry));
    }
    this.duplicateCounter = Counter.builder("points.grants.duplicate")
        .description("Point grants rejected because their grant key was already applied")
        .register(meterRegistry);
  }

  /**
   * Applies the grant in its own transaction.
   *
   * @return false if the same grant was applied before; nothing is written in that case
   * @throws UnknownWalletException if the recipient has no wallet
   */
  public boolean grant(PointsGrant grant) {
    try {
      transactionTemplate.executeWithoutResult(status -> applyGrant(grant));
    } catch (DuplicateKeyException e) {
      duplicateCounter.increment();
      log.warn("Rejected duplicate {} grant for user {} (key {})",
          grant.type().dbValue(), grant.userId(), grant.grantKey());
      return false;
    }
    appliedCounters.get(grant.type()).increment();
    log.debug("Granted {} {} points to {} (key {})",
        grant.points(), grant.type().dbValue(), grant.userId(), grant.grantKey());
    return true;
  }

  /**
   * Writes the grant without opening a transaction. Callers must already be inside one.
   *
   * @throws DuplicateKeyException if the grant was applied before
   */
  public void applyGrant(PointsGrant grant) {
    int updated = walletRepository.incrementTotals(grant.userId(), grant.points(), grant.walletVolumeIncrement());
    if (updated == 0) {
      throw new UnknownWalletException(grant.userId());
    }
    historyRepository.insert(grant, clock.instant());
  }

  public PointsSummary summary(String userId) {
    Wallet wallet = walletRepository.findByUserId(userId)
        .orElseThrow(() -> new UnknownWalletException(userId));
    return new PointsSummary(
        wallet.userId(),
        wallet.handle(),
        wallet.referralCode(),
        wallet.referredBy(),
        wallet.totalPoints(),
        wallet.totalVolume(),
        walletRepository.countReferrals(wallet.referralCode()),
        historyRepository.sumReferralPoints(userId)
    );
  }

  public List<ReferredUser> referrals(String userId, int limit) {
    Wallet wallet = walletRepository.findByUserId(userId)
        .orElseThrow(() -> new UnknownWalletException(userId));
    return walletRepository.findReferredUsers(wallet.referralCode(), limit);
  }

  public List<PointsHistoryEntry> history(String userId, int limit, int offset) {
    if (walletRepository.findByUserId(userId).isEmpty()) {
      throw new UnknownWalletException(userId);
    }
    return historyRepository.findByUserId(userId, limit, offset);
  }
}
