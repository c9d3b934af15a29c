package com.polycopy.copytrade.subscription;

import com.polycopy.copytrade.model.CopySubscription;
import com.polycopy.ledger.WalletRepository;
import com.polycopy.support.MutableClock;
import com.polycopy.support.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubscriptionRegistryTest {

  private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

  private EmbeddedDatabase db;
  private JdbcTemplate jdbc;
  private MutableClock clock;
  private SubscriptionRegistry registry;

  @BeforeEach
  void setUp() {
    db = TestDatabase.create();
    jdbc = new JdbcTemplate(db);
    clock = new MutableClock(NOW);
    registry = new SubscriptionRegistry(new SubscriptionRepository(jdbc), clock);
    WalletRepository wallets = new WalletRepository(jdbc, TestDatabase.objectMapper());
    TestDatabase.wallet(wallets, "bob", "BOB0001", NOW);
    TestDatabase.wallet(wallets, "carol", "CAROL01", NOW);
  }

  @AfterEach
  void tearDown() {
    db.shutdown();
  }

  @Test
  void subscribeNormalizesWalletAndDefaultsScale() {
    CopySubscription sub = registry.subscribe("bob", "  0xABCDEF ", "whale", null);

    assertThat(sub.sourceWallet()).isEqualTo("0xabcdef");
    assertThat(sub.scaleFactor()).isEqualByComparingTo("1");
    assertThat(sub.enabled()).isTrue();
    assertThat(sub.label()).isEqualTo("whale");
    assertThat(registry.find("bob", "0xAbCdEf")).contains(sub);
  }

  @Test
  void followingTheSameWalletTwiceIsRejected() {
    registry.subscribe("bob", "0xabc", null, null);

    assertThatThrownBy(() -> registry.subscribe("bob", "0xABC", null, null))
        .isInstanceOf(DuplicateKeyException.class);
  }

  @Test
  void nonPositiveScaleIsRejected() {
    assertThatThrownBy(() -> registry.subscribe("bob", "0xabc", null, BigDecimal.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
    registry.subscribe("bob", "0xabc", null, null);
    assertThatThrownBy(() -> registry.setScaleFactor("bob", "0xabc", new BigDecimal("-1")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void activeForOnlyReturnsEnabledFollowers() {
    registry.subscribe("bob", "0xabc", null, null);
    registry.subscribe("carol", "0xabc", null, new BigDecimal("2"));
    registry.subscribe("carol", "0xdef", null, null);
    registry.setEnabled("bob", "0xabc", false);

    assertThat(registry.activeFor("0xABC")).extracting(CopySubscription::userId).containsExactly("carol");
    assertThat(registry.trackedWallets()).containsExactly("0xabc", "0xdef");
    assertThat(registry.listForUser("carol")).hasSize(2);
  }

  @Test
  void unsubscribeRemovesWalletFromTracking() {
    registry.subscribe("bob", "0xabc", null, null);

    assertThat(registry.unsubscribe("bob", "0xabc")).isTrue();
    assertThat(registry.unsubscribe("bob", "0xabc")).isFalse();
    assertThat(registry.trackedWallets()).isEmpty();
  }

  @Test
  void activeSubscriptionsAreCachedUntilTtlExpires() {
    registry.subscribe("bob", "0xabc", null, null);
    assertThat(registry.trackedWallets()).containsExactly("0xabc");

    // written behind the registry's back
    jdbc.update("INSERT INTO copy_subscriptions (user_id, source_wallet, scale_factor, enabled, created_at) "
        + "VALUES (?, ?, ?, ?, ?)", "carol", "0xdef", BigDecimal.ONE, true, Timestamp.from(NOW));

    clock.advance(Duration.ofMillis(SubscriptionRegistry.CACHE_TTL_MS));
    assertThat(registry.trackedWallets()).containsExactly("0xabc");

    clock.advance(Duration.ofMillis(1));
    assertThat(registry.trackedWallets()).containsExactly("0xabc", "0xdef");
  }

  @Test
  void snapshotLoadedBeforeAWriteIsNotCached() {
    AtomicBoolean writeDuringLoad = new AtomicBoolean(true);
    AtomicReference<SubscriptionRegistry> racing = new AtomicReference<>();
    SubscriptionRepository repository = new SubscriptionRepository(jdbc) {
      @Override
      public List<CopySubscription> findAllEnabled() {
        List<CopySubscription> snapshot = super.findAllEnabled();
        if (writeDuringLoad.getAndSet(false)) {
          racing.get().subscribe("carol", "0xdef", null, null);
        }
        return snapshot;
      }
    };
    racing.set(new SubscriptionRegistry(repository, clock));
    racing.get().subscribe("bob", "0xabc", null, null);

    assertThat(racing.get().trackedWallets()).containsExactly("0xabc");
    assertThat(racing.get().trackedWallets()).containsExactly("0xabc", "0xdef");
  }

  @Test
  void blankWalletIsRejected() {
    assertThatThrownBy(() -> registry.subscribe("bob", " ", null, null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
