package com.polycopy.copytrade.subscription;

import com.polycopy.copytrade.model.CopySubscription;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Who follows which wallet. Active subscriptions are read on every poll tick and every emitted trade, so
 * they are cached for a short TTL; every write drops the cache. A snapshot loaded before the latest write is
 * never served from the cache.
 */
@Component
@Slf4j
public class SubscriptionRegistry {

  static final long CACHE_TTL_MS = 5_000;

  private final SubscriptionRepository repository;
  private final Clock clock;

  private final AtomicLong generation = new AtomicLong();
  private volatile CachedSubscriptions cache;

  public SubscriptionRegistry(SubscriptionRepository repository, Clock clock) {
    this.repository = Objects.requireNonNull(repository, "repository");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * @throws org.springframework.dao.DuplicateKeyException if the user already follows the wallet
   */
  public CopySubscription subscribe(String userId, String sourceWallet, String label, BigDecimal scaleFactor) {
    String wallet = normalizeWallet(sourceWallet);
    BigDecimal scale = scaleFactor == null ? BigDecimal.ONE : scaleFactor;
    if (scale.signum() <= 0) {
      throw new IllegalArgumentException("scaleFactor must be > 0");
    }
    repository.insert(userId, wallet, label, scale, clock.instant());
    invalidate();
    log.info("User {} now follows {} (scale {})", userId, wallet, scale);
    return repository.find(userId, wallet)
        .orElseThrow(() -> new IllegalStateException("Subscription vanished after insert: " + userId + "/" + wallet));
  }

  public boolean unsubscribe(String userId, String sourceWallet) {
    boolean removed = repository.delete(userId, normalizeWallet(sourceWallet));
    invalidate();
    return removed;
  }

  public boolean setEnabled(String userId, String sourceWallet, boolean enabled) {
    boolean updated = repository.setEnabled(userId, normalizeWallet(sourceWallet), enabled);
    invalidate();
    return updated;
  }

  public boolean setScaleFactor(String userId, String sourceWallet, BigDecimal scaleFactor) {
    if (scaleFactor == null || scaleFactor.signum() <= 0) {
      throw new IllegalArgumentException("scaleFactor must be > 0");
    }
    boolean updated = repository.setScaleFactor(userId, normalizeWallet(sourceWallet), scaleFactor);
    invalidate();
    return updated;
  }

  public Optional<CopySubscription> find(String userId, String sourceWallet) {
    return repository.find(userId, normalizeWallet(sourceWallet));
  }

  public List<CopySubscription> listForUser(String userId) {
    return repository.findByUserId(userId);
  }

  /**
   * Enabled subscriptions following {@code sourceWallet}.
   */
  public List<CopySubscription> activeFor(String sourceWallet) {
    return active().bySource().getOrDefault(normalizeWallet(sourceWallet), List.of());
  }

  /**
   * Distinct wallets with at least one enabled follower.
   */
  public Set<String> trackedWallets() {
    return active().wallets();
  }

  public void invalidate() {
    generation.incrementAndGet();
    cache = null;
  }

  public static String normalizeWallet(String wallet) {
    if (wallet == null || wallet.isBlank()) {
      throw new IllegalArgumentException("wallet must not be blank");
    }
    return wallet.trim().toLowerCase(Locale.ROOT);
  }

  private CachedSubscriptions active() {
    CachedSubscriptions cached = cache;
    long now = clock.millis();
    long currentGeneration = generation.get();
    if (cached != null && cached.generation() == currentGeneration && now - cached.loadedAt() <= CACHE_TTL_MS) {
      return cached;
    }
    Map<String, List<CopySubscription>> bySource = new LinkedHashMap<>();
    for (CopySubscription subscription : repository.findAllEnabled()) {
      bySource.computeIfAbsent(subscription.sourceWallet(), k -> new ArrayList<>()).add(subscription);
    }
    Map<String, List<CopySubscription>> frozen = new LinkedHashMap<>();
    bySource.forEach((wallet, subs) -> frozen.put(wallet, List.copyOf(subs)));
    CachedSubscriptions loaded = new CachedSubscriptions(
        Collections.unmodifiableMap(frozen),
        Collections.unmodifiableSet(new TreeSet<>(frozen.keySet())),
        now,
        currentGeneration);
    cache = loaded;
    log.debug("Loaded {} active subscriptions across {} source wallets", loaded.count(), frozen.size());
    return loaded;
  }

  private record CachedSubscriptions(
      Map<String, List<CopySubscription>> bySource,
      Set<String> wallets,
      long loadedAt,
      long generation
  ) {
    int count() {
      return bySource.values().stream().mapToInt(List::size).sum();
    }
  }
}
