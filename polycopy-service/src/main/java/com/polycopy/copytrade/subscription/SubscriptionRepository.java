package com.polycopy.copytrade.subscription;

import com.polycopy.copytrade.model.CopySubscription;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class SubscriptionRepository {

  private static final String SELECT_COLUMNS = """
      SELECT id, user_id, source_wallet, label, scale_factor, enabled, created_at
      FROM copy_subscriptions
      """;

  private static final RowMapper<CopySubscription> MAPPER = (rs, rowNum) -> new CopySubscription(
      rs.getLong("id"),
      rs.getString("user_id"),
      rs.getString("source_wallet"),
      rs.getString("label"),
      rs.getBigDecimal("scale_factor"),
      rs.getBoolean("enabled"),
      rs.getTimestamp("created_at").toInstant()
  );

  private final @NonNull JdbcTemplate jdbcTemplate;

  /**
   * @throws org.springframework.dao.DuplicateKeyException if the user already follows the wallet
   */
  public void insert(String userId, String sourceWallet, String label, BigDecimal scaleFactor, Instant createdAt) {
    jdbcTemplate.update("""
            INSERT INTO copy_subscriptions (user_id, source_wallet, label, scale_factor, enabled, created_at)
            VALUES (?, ?, ?, ?, TRUE, ?)
            """,
        userId, sourceWallet, label, scaleFactor, Timestamp.from(createdAt));
  }

  public Optional<CopySubscription> find(String userId, String sourceWallet) {
    return jdbcTemplate.query(SELECT_COLUMNS + " WHERE user_id = ? AND source_wallet = ?", MAPPER, userId, sourceWallet)
        .stream()
        .findFirst();
  }

  public List<CopySubscription> findByUserId(String userId) {
    return jdbcTemplate.query(SELECT_COLUMNS + " WHERE user_id = ? ORDER BY created_at, id", MAPPER, userId);
  }

  public List<CopySubscription> findAllEnabled() {
    return jdbcTemplate.query(SELECT_COLUMNS + " WHERE enabled = TRUE ORDER BY source_wallet, user_id", MAPPER);
  }

  public boolean delete(String userId, String sourceWallet) {
    return jdbcTemplate.update(
        "DELETE FROM copy_subscriptions WHERE user_id = ? AND source_wallet = ?", userId, sourceWallet) == 1;
  }

  public boolean setEnabled(String userId, String sourceWallet, boolean enabled) {
    return jdbcTemplate.update(
        "UPDATE copy_subscriptions SET enabled = ? WHERE user_id = ? AND source_wallet = ?",
        enabled, userId, sourceWallet) == 1;
  }

  public boolean setScaleFactor(String userId, String sourceWallet, BigDecimal scaleFactor) {
    return jdbcTemplate.update(
        "UPDATE copy_subscriptions SET scale_factor = ? WHERE user_id = ? AND source_wallet = ?",
        scaleFactor, userId, sourceWallet) == 1;
  }
}
