package com.polycopy.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Validated
@ConfigurationProperties(prefix="copytrade")
public record CopyTradeProperties(
    @Valid Polymarket polymarket,
    @Valid Executor executor,
    @Valid Poller poller,
    @Valid Mirror mirror,
    @Valid Points points,
    @Valid Referral referral,
    @Valid Notifications notifications
) {

  public CopyTradeProperties {
    if (polymarket == null) {
      polymarket = new Polymarket(null, null, null, null);
    }
    if (executor == null) {
      executor = new Executor(null, null);
    }
    if (poller == null) {
      poller = new Poller(null, null, null, null, null, null, null, null);
    }
    if (mirror == null) {
      mirror = new Mirror(null, null, null);
    }
    if (points == null) {
      points = new Points(null, null);
    }
    if (referral == null) {
      referral = new Referral(null, null);
    }
    if (notifications == null) {
      notifications = new Notifications(null, null);
    }
  }

  public record Polymarket(
      String dataApiUrl,
      String clobRestUrl,
      /**
       * Per-request timeout for every call to the Data API and the CLOB.
       */
      @NotNull @Min(100) Long requestTimeoutMillis,
      @Valid Rest rest
  ) {
    public Polymarket {
      if (dataApiUrl == null || dataApiUrl.isBlank()) {
        dataApiUrl = "https://data-api.polymarket.com";
      }
      if (clobRestUrl == null || clobRestUrl.isBlank()) {
        clobRestUrl = "https://clob.polymarket.com";
      }
      if (requestTimeoutMillis == null) {
        requestTimeoutMillis = 10_000L;
      }
      if (rest == null) {
        rest = new Rest(null, null);
      }
    }
  }

  public record Rest(@Valid RateLimit rateLimit, @Valid Retry retry) {
    public Rest {
      if (rateLimit == null) {
        rateLimit = new RateLimit(null, null, null);
      }
      if (retry == null) {
        retry = new Retry(null, null, null, null);
      }
    }
  }

  public record RateLimit(
      @NotNull Boolean enabled,
      @NotNull @PositiveOrZero Double requestsPerSecond,
      @NotNull @PositiveOrZero Integer burst
  ) {
    public RateLimit {
      if (enabled == null) {
        enabled = true;
      }
      if (requestsPerSecond == null) {
        requestsPerSecond = 10.0;
      }
      if (burst == null) {
        burst = 20;
      }
    }
  }

  public record Retry(
      @NotNull Boolean enabled,
      @NotNull @Min(1) Integer maxAttempts,
      @NotNull @PositiveOrZero Long initialBackoffMillis,
      @NotNull @PositiveOrZero Long maxBackoffMillis
  ) {
    public Retry {
      if (enabled == null) {
        enabled = true;
      }
      if (maxAttempts == null) {
        maxAttempts = 3;
      }
      if (initialBackoffMillis == null) {
        initialBackoffMillis = 200L;
      }
      if (maxBackoffMillis == null) {
        maxBackoffMillis = 2_000L;
      }
    }
  }

  /**
   * Sign-and-submit collaborator. It holds the users' signing keys; this service only ever sends it
   * unsigned order intents.
   */
  public record Executor(
      String baseUrl,
      @NotNull @Min(100) Long requestTimeoutMillis
  ) {
    public Executor {
      if (baseUrl == null || baseUrl.isBlank()) {
        baseUrl = "http://localhost:8080";
      }
      if (requestTimeoutMillis == null) {
        requestTimeoutMillis = 15_000L;
      }
    }
  }

  public record Poller(
      @NotNull Boolean enabled,
      @NotNull @Min(100) Long intervalMillis,
      @NotNull @PositiveOrZero Long initialDelayMillis,
      /**
       * Page size of the per-wallet {@code /trades} request.
       */
      @NotNull @Min(1) Integer tradesPerWallet,
      /**
       * Rolling window: candidates older than this are ignored and dedup keys older than this are evicted.
       */
      @NotNull @Min(1) Long horizonSeconds,
      @NotNull @Min(1) Integer maxSeenKeys,
      @NotNull @Min(1) Integer fetchParallelism,
      /**
       * Upper bound for joining all per-wallet fetches of a tick.
       */
      @NotNull @Min(100) Long fetchTimeoutMillis
  ) {
    public Poller {
      if (enabled == null) {
        enabled = false;
      }
      if (intervalMillis == null) {
        intervalMillis = 2_000L;
      }
      if (initialDelayMillis == null) {
        initialDelayMillis = 1_000L;
      }
      if (tradesPerWallet == null) {
        tradesPerWallet = 50;
      }
      if (horizonSeconds == null) {
        horizonSeconds = 900L;
      }
      if (maxSeenKeys == null) {
        maxSeenKeys = 500_000;
      }
      if (fetchParallelism == null) {
        fetchParallelism = 4;
      }
      if (fetchTimeoutMillis == null) {
        fetchTimeoutMillis = 30_000L;
      }
    }
  }

  public record Mirror(
      @NotNull Boolean enabled,
      /**
       * Mirrored notionals below this are recorded as SKIPPED and never submitted.
       */
      @NotNull @PositiveOrZero BigDecimal minNotionalUsd,
      @NotNull @Min(1) Integer workerThreads
  ) {
    public Mirror {
      if (enabled == null) {
        enabled = true;
      }
      if (minNotionalUsd == null) {
        minNotionalUsd = BigDecimal.ONE;
      }
      if (workerThreads == null) {
        workerThreads = 4;
      }
    }
  }

  public record Points(
      @NotNull Boolean enabled,
      @NotNull @Min(1) Integer workerThreads
  ) {
    public Points {
      if (enabled == null) {
        enabled = true;
      }
      if (workerThreads == null) {
        workerThreads = 2;
      }
    }
  }

  public record Referral(
      @NotNull @Min(3) Integer codeLength,
      @NotNull @Positive Integer maxCodeAttempts
  ) {
    public Referral {
      if (codeLength == null) {
        codeLength = 7;
      }
      if (maxCodeAttempts == null) {
        maxCodeAttempts = 10;
      }
    }
  }

  public record Notifications(
      @NotNull Boolean kafkaEnabled,
      String topic
  ) {
    public Notifications {
      if (kafkaEnabled == null) {
        kafkaEnabled = false;
      }
      if (topic == null || topic.isBlank()) {
        topic = "copytrade.events";
      }
    }
  }
}
