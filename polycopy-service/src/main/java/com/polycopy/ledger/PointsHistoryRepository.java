package com.polycopy.ledger;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * Append-only access to {@code points_history}.
 */
@Component
@RequiredArgsConstructor
public class PointsHistoryRepository {

  private final @NonNull JdbcTemplate jdbcTemplate;

  /**
   * @throws org.springframework.dao.DuplicateKeyException if (user, type, grant key) was recorded before
   */
  public void insert(PointsGrant grant, Instant createdAt) {
    jdbcTemplate.update("""
            INSERT INTO points_history (user_id, points_earned, points_type, grant_key, volume, market_id,
                                        market_title, referred_user_id, description, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
        grant.userId(),
        grant.points(),
        grant.type().dbValue(),
        grant.grantKey(),
        grant.volume(),
        grant.marketId(),
        grant.marketTitle(),
        grant.referredUserId(),
        grant.description(),
        Timestamp.from(createdAt)
    );
  }

  /**
   * Newest first.
   */
  public List<PointsHistoryEntry> findByUserId(String userId, int limit, int offset) {
    return jdbcTemplate.query("""
            SELECT id, user_id, points_earned, points_type, grant_key, volume, market_id, market_title,
                   referred_user_id, description, created_at
            FROM points_history
            WHERE user_id = ?
            ORDER BY created_at DESC, id DESC
            LIMIT ? OFFSET ?
            """,
        (rs, rowNum) -> new PointsHistoryEntry(
            rs.getLong("id"),
            rs.getString("user_id"),
            rs.getBigDecimal("points_earned"),
            PointsType.fromDb(rs.getString("points_type")),
            rs.getString("grant_key"),
            rs.getBigDecimal("volume"),
            rs.getString("market_id"),
            rs.getString("market_title"),
            rs.getString("referred_user_id"),
            rs.getString("description"),
            rs.getTimestamp("created_at").toInstant()
        ),
        userId, Math.max(1, limit), Math.max(0, offset));
  }

  public BigDecimal sumPoints(String userId) {
    BigDecimal sum = jdbcTemplate.queryForObject(
        "SELECT COALESCE(SUM(points_earned), 0) FROM points_history WHERE user_id = ?", BigDecimal.class, userId);
    return sum == null ? BigDecimal.ZERO : sum;
  }

  public BigDecimal sumReferralPoints(String userId) {
    BigDecimal sum = jdbcTemplate.queryForObject("""
            SELECT COALESCE(SUM(points_earned), 0)
            FROM points_history
            WHERE user_id = ? AND points_type IN ('referral_trade', 'referral_signup')
            """,
        BigDecimal.class, userId);
    return sum == null ? BigDecimal.ZERO : sum;
  }

  public long countByUserAndType(String userId, PointsType type) {
    Long count = jdbcTemplate.queryForObject(
        "SELECT COUNT(*) FROM points_history WHERE user_id = ? AND points_type = ?",
        Long.class, userId, type.dbValue());
    return count == null ? 0L : count;
  }
}
