package com.polycopy.copytrade.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.polycopy.copytrade.model.TradeEvent;
import com.polycopy.polymarket.data.PolymarketDataApiClient;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fetches recent trades of every tracked wallet. Requests run concurrently on the fetch pool and are all
 * joined before {@link #poll} returns. A wallet whose request fails or times out contributes nothing this
 * tick and is simply asked again on the next one.
 */
@Slf4j
public class TradeFeedPoller {

  private final PolymarketDataApiClient dataApi;
  private final ExecutorService fetchPool;
  private final int tradesPerWallet;
  private final Duration fetchTimeout;

  private final AtomicLong requests = new AtomicLong();
  private final AtomicLong failedRequests = new AtomicLong();

  public TradeFeedPoller(PolymarketDataApiClient dataApi, ExecutorService fetchPool, int tradesPerWallet,
                         Duration fetchTimeout) {
    this.dataApi = Objects.requireNonNull(dataApi, "dataApi");
    this.fetchPool = Objects.requireNonNull(fetchPool, "fetchPool");
    this.tradesPerWallet = Math.max(1, tradesPerWallet);
    this.fetchTimeout = Objects.requireNonNull(fetchTimeout, "fetchTimeout");
  }

  /**
   * @return trades of the given wallets executed at or after {@code since}, in no particular order
   */
  public List<TradeEvent> poll(Collection<String> sourceWallets, Instant since) {
    if (sourceWallets == null || sourceWallets.isEmpty()) {
      return List.of();
    }
    Map<String, CompletableFuture<List<TradeEvent>>> futures = new LinkedHashMap<>();
    for (String wallet : sourceWallets) {
      requests.incrementAndGet();
      futures.put(wallet, CompletableFuture
          .supplyAsync(() -> fetch(wallet, since), fetchPool)
          .exceptionally(e -> {
            failedRequests.incrementAndGet();
            log.warn("Trade fetch for {} failed: {}", wallet, unwrap(e).toString());
            return List.of();
          }));
    }

    try {
      CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0]))
          .get(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      log.warn("Trade fetch for {} wallets did not complete within {}ms", futures.size(), fetchTimeout.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Trade fetch interrupted");
    } catch (ExecutionException e) {
      log.warn("Trade fetch failed: {}", unwrap(e).toString());
    }

    List<TradeEvent> candidates = new ArrayList<>();
    futures.forEach((wallet, future) -> {
      if (future.isDone() && !future.isCompletedExceptionally()) {
        candidates.addAll(future.join());
      } else {
        future.cancel(true);
        failedRequests.incrementAndGet();
        log.warn("Trade fetch for {} abandoned for this tick", wallet);
      }
    });
    return candidates;
  }

  public long requests() {
    return requests.get();
  }

  public long failedRequests() {
    return failedRequests.get();
  }

  private List<TradeEvent> fetch(String wallet, Instant since) {
    JsonNode trades = dataApi.getTrades(wallet, tradesPerWallet, 0);
    if (trades == null || !trades.isArray()) {
      log.debug("Unexpected /trades payload for {}: {}", wallet, trades == null ? "null" : trades.getNodeType());
      return List.of();
    }
    List<TradeEvent> events = new ArrayList<>(trades.size());
    for (JsonNode trade : trades) {
      DataApiTradeParser.parse(trade, wallet)
          .filter(e -> !e.timestamp().isBefore(since))
          .ifPresent(events::add);
    }
    return events;
  }

  private static Throwable unwrap(Throwable e) {
    Throwable t = e;
    while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
      t = t.getCause();
    }
    return t;
  }
}
