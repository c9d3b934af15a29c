package com.polycopy.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class CopyTradePropertiesBindingTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(TestConfig.class);

  @Test
  void bindsNestedRecordsFromRelaxedProperties() {
    runner.withPropertyValues(
            "copytrade.poller.enabled=true",
            "copytrade.poller.interval-millis=1500",
            "copytrade.poller.horizon-seconds=120",
            "copytrade.mirror.min-notional-usd=2.5",
            "copytrade.executor.base-url=http://executor:8080",
            "copytrade.polymarket.rest.retry.max-attempts=5",
            "copytrade.notifications.kafka-enabled=true"
        )
        .run(context -> {
          CopyTradeProperties properties = context.getBean(CopyTradeProperties.class);

          assertThat(properties.poller().enabled()).isTrue();
          assertThat(properties.poller().intervalMillis()).isEqualTo(1500L);
          assertThat(properties.poller().horizonSeconds()).isEqualTo(120L);
          assertThat(properties.poller().tradesPerWallet()).isEqualTo(50);
          assertThat(properties.mirror().minNotionalUsd()).isEqualByComparingTo(new BigDecimal("2.5"));
          assertThat(properties.executor().baseUrl()).isEqualTo("http://executor:8080");
          assertThat(properties.polymarket().rest().retry().maxAttempts()).isEqualTo(5);
          assertThat(properties.notifications().kafkaEnabled()).isTrue();
          assertThat(properties.notifications().topic()).isEqualTo("copytrade.events");
        });
  }

  @Test
  void appliesDefaultsWhenNothingIsConfigured() {
    runner.run(context -> {
      CopyTradeProperties properties = context.getBean(CopyTradeProperties.class);

      assertThat(properties.poller().enabled()).isFalse();
      assertThat(properties.polymarket().dataApiUrl()).isEqualTo("https://data-api.polymarket.com");
      assertThat(properties.polymarket().clobRestUrl()).isEqualTo("https://clob.polymarket.com");
      assertThat(properties.referral().codeLength()).isEqualTo(7);
      assertThat(properties.referral().maxCodeAttempts()).isEqualTo(10);
      assertThat(properties.mirror().minNotionalUsd()).isEqualByComparingTo(BigDecimal.ONE);
    });
  }

  @Configuration(proxyBeanMethods=false)
  @EnableConfigurationProperties(CopyTradeProperties.class)
  static class TestConfig {
  }
}
