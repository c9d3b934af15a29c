package com.polycopy.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polycopy.common.concurrent.KeyedSerialExecutor;
import com.polycopy.copytrade.execution.MirrorExecutionEngine;
import com.polycopy.copytrade.execution.MirrorOrderRepository;
import com.polycopy.copytrade.execution.QuoteService;
import com.polycopy.copytrade.feed.TradeFeedPoller;
import com.polycopy.copytrade.filter.ExpiringKeySet;
import com.polycopy.copytrade.filter.TradeOrderingFilter;
import com.polycopy.copytrade.model.TradeKey;
import com.polycopy.copytrade.session.PollerSession;
import com.polycopy.copytrade.session.PollerSessionStarter;
import com.polycopy.copytrade.subscription.SubscriptionRegistry;
import com.polycopy.executor.ExecutorApiClient;
import com.polycopy.executor.OrderSigningGateway;
import com.polycopy.ledger.PointsLedger;
import com.polycopy.ledger.WalletRepository;
import com.polycopy.notify.KafkaNotificationSink;
import com.polycopy.notify.LoggingNotificationSink;
import com.polycopy.notify.NotificationSink;
import com.polycopy.points.PointsAccrualEngine;
import com.polycopy.polymarket.clob.PolymarketClobApiClient;
import com.polycopy.polymarket.data.PolymarketDataApiClient;
import com.polycopy.polymarket.http.PolymarketHttpTransport;
import com.polycopy.polymarket.http.RequestRateLimiter;
import com.polycopy.polymarket.http.RetryPolicy;
import com.polycopy.polymarket.http.TokenBucketRateLimiter;
import com.polycopy.referral.ReferralCodeGenerator;
import com.polycopy.referral.ReferralService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the copy-trading pipeline: poller → ordering filter → {mirror engine, points engine} → ledger and
 * notifications.
 */
@Slf4j
@Configuration
public class CopyTradeConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public HttpClient httpClient() {
    return HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(5))
        .build();
  }

  @Bean
  public PolymarketHttpTransport polymarketHttpTransport(
      CopyTradeProperties properties,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      Clock clock
  ) {
    CopyTradeProperties.Rest rest = properties.polymarket().rest();
    return new PolymarketHttpTransport(
        httpClient, objectMapper, buildRateLimiter(rest.rateLimit(), clock), buildRetryPolicy(rest.retry()));
  }

  @Bean
  public PolymarketDataApiClient polymarketDataApiClient(
      CopyTradeProperties properties,
      @Qualifier("polymarketHttpTransport") PolymarketHttpTransport transport
  ) {
    CopyTradeProperties.Polymarket polymarket = properties.polymarket();
    return new PolymarketDataApiClient(
        URI.create(polymarket.dataApiUrl()), transport, Duration.ofMillis(polymarket.requestTimeoutMillis()));
  }

  @Bean
  public PolymarketClobApiClient polymarketClobApiClient(
      CopyTradeProperties properties,
      @Qualifier("polymarketHttpTransport") PolymarketHttpTransport transport
  ) {
    CopyTradeProperties.Polymarket polymarket = properties.polymarket();
    return new PolymarketClobApiClient(
        URI.create(polymarket.clobRestUrl()), transport, Duration.ofMillis(polymarket.requestTimeoutMillis()));
  }

  @Bean
  @ConditionalOnMissingBean(OrderSigningGateway.class)
  public ExecutorApiClient executorApiClient(CopyTradeProperties properties, HttpClient httpClient,
                                             ObjectMapper objectMapper) {
    CopyTradeProperties.Executor executor = properties.executor();
    // dedicated transport without retries
    PolymarketHttpTransport transport =
        new PolymarketHttpTransport(httpClient, objectMapper, RequestRateLimiter.noop(), RetryPolicy.none());
    log.info("Executor client configured for {}", executor.baseUrl());
    return new ExecutorApiClient(
        URI.create(executor.baseUrl()), transport, objectMapper, Duration.ofMillis(executor.requestTimeoutMillis()));
  }

  @Bean
  public ReferralService referralService(
      CopyTradeProperties properties,
      WalletRepository walletRepository,
      PointsLedger pointsLedger,
      TransactionTemplate transactionTemplate,
      Clock clock
  ) {
    CopyTradeProperties.Referral referral = properties.referral();
    return new ReferralService(
        walletRepository,
        pointsLedger,
        transactionTemplate,
        new ReferralCodeGenerator(referral.codeLength()),
        referral.maxCodeAttempts(),
        clock
    );
  }

  @Bean
  @ConditionalOnProperty(prefix = "copytrade.notifications", name = "kafka-enabled", havingValue = "true")
  public NotificationSink kafkaNotificationSink(
      CopyTradeProperties properties,
      KafkaTemplate<String, String> kafkaTemplate,
      ObjectMapper objectMapper,
      Clock clock
  ) {
    log.info("Publishing copy-trade notifications to Kafka topic {}", properties.notifications().topic());
    return new KafkaNotificationSink(kafkaTemplate, objectMapper, properties.notifications().topic(), clock);
  }

  @Bean
  @ConditionalOnMissingBean(NotificationSink.class)
  public NotificationSink loggingNotificationSink() {
    return new LoggingNotificationSink();
  }

  @Bean(destroyMethod = "close")
  public KeyedSerialExecutor mirrorLanes(CopyTradeProperties properties) {
    return new KeyedSerialExecutor("mirror", properties.mirror().workerThreads());
  }

  @Bean(destroyMethod = "close")
  public KeyedSerialExecutor pointsLanes(CopyTradeProperties properties) {
    return new KeyedSerialExecutor("points", properties.points().workerThreads());
  }

  @Bean
  public MirrorExecutionEngine mirrorExecutionEngine(
      CopyTradeProperties properties,
      SubscriptionRegistry subscriptionRegistry,
      QuoteService quoteService,
      OrderSigningGateway orderSigningGateway,
      MirrorOrderRepository mirrorOrderRepository,
      NotificationSink notificationSink,
      @Qualifier("mirrorLanes") KeyedSerialExecutor mirrorLanes,
      Clock clock,
      MeterRegistry meterRegistry
  ) {
    return new MirrorExecutionEngine(
        subscriptionRegistry,
        quoteService,
        orderSigningGateway,
        mirrorOrderRepository,
        notificationSink,
        mirrorLanes,
        properties.mirror().minNotionalUsd(),
        clock,
        meterRegistry
    );
  }

  @Bean
  public PointsAccrualEngine pointsAccrualEngine(
      SubscriptionRegistry subscriptionRegistry,
      WalletRepository walletRepository,
      PointsLedger pointsLedger,
      NotificationSink notificationSink,
      @Qualifier("pointsLanes") KeyedSerialExecutor pointsLanes,
      Clock clock
  ) {
    return new PointsAccrualEngine(
        subscriptionRegistry, walletRepository, pointsLedger, notificationSink, pointsLanes, clock);
  }

  @Bean
  public TradeOrderingFilter tradeOrderingFilter(
      CopyTradeProperties properties,
      MirrorExecutionEngine mirrorExecutionEngine,
      PointsAccrualEngine pointsAccrualEngine
  ) {
    CopyTradeProperties.Poller poller = properties.poller();
    TradeOrderingFilter filter = new TradeOrderingFilter(
        new ExpiringKeySet<TradeKey>(poller.maxSeenKeys()), Duration.ofSeconds(poller.horizonSeconds()));
    if (properties.mirror().enabled()) {
      filter.subscribe(mirrorExecutionEngine);
    }
    if (properties.points().enabled()) {
      filter.subscribe(pointsAccrualEngine);
    }
    log.info("Trade filter: horizon={}s maxSeenKeys={} mirror={} points={}",
        poller.horizonSeconds(), poller.maxSeenKeys(), properties.mirror().enabled(), properties.points().enabled());
    return filter;
  }

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService tradeFetchPool(CopyTradeProperties properties) {
    AtomicInteger seq = new AtomicInteger();
    return Executors.newFixedThreadPool(Math.max(1, properties.poller().fetchParallelism()), r -> {
      Thread t = new Thread(r, "copytrade-fetch-" + seq.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
  }

  @Bean
  public TradeFeedPoller tradeFeedPoller(
      CopyTradeProperties properties,
      PolymarketDataApiClient dataApiClient,
      @Qualifier("tradeFetchPool") ExecutorService tradeFetchPool
  ) {
    CopyTradeProperties.Poller poller = properties.poller();
    return new TradeFeedPoller(
        dataApiClient, tradeFetchPool, poller.tradesPerWallet(), Duration.ofMillis(poller.fetchTimeoutMillis()));
  }

  @Bean
  public PollerSession pollerSession(
      CopyTradeProperties properties,
      TradeFeedPoller tradeFeedPoller,
      SubscriptionRegistry subscriptionRegistry,
      TradeOrderingFilter tradeOrderingFilter,
      Clock clock,
      MeterRegistry meterRegistry
  ) {
    CopyTradeProperties.Poller poller = properties.poller();
    return new PollerSession(
        tradeFeedPoller,
        subscriptionRegistry::trackedWallets,
        tradeOrderingFilter,
        Duration.ofMillis(poller.intervalMillis()),
        Duration.ofMillis(poller.initialDelayMillis()),
        Duration.ofSeconds(poller.horizonSeconds()),
        clock,
        meterRegistry
    );
  }

  @Bean(destroyMethod = "shutdown")
  public PollerSessionStarter pollerSessionStarter(CopyTradeProperties properties, PollerSession pollerSession) {
    return new PollerSessionStarter(pollerSession, properties.poller().enabled());
  }

  private static RequestRateLimiter buildRateLimiter(CopyTradeProperties.RateLimit cfg, Clock clock) {
    if (cfg == null || !cfg.enabled()) {
      return RequestRateLimiter.noop();
    }
    if (cfg.requestsPerSecond() <= 0 || cfg.burst() <= 0) {
      return RequestRateLimiter.noop();
    }
    return new TokenBucketRateLimiter(cfg.requestsPerSecond(), cfg.burst(), clock);
  }

  private static RetryPolicy buildRetryPolicy(CopyTradeProperties.Retry cfg) {
    if (cfg == null) {
      return RetryPolicy.none();
    }
    return new RetryPolicy(
        cfg.enabled(),
        Math.max(1, cfg.maxAttempts()),
        Math.max(0, cfg.initialBackoffMillis()),
        Math.max(0, cfg.maxBackoffMillis())
    );
  }
}
