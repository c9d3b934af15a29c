package com.polycopy.copytrade.execution;

import com.polycopy.copytrade.model.MirrorOrder;
import com.polycopy.copytrade.model.MirrorOutcome;
import com.polycopy.copytrade.model.TradeEvent;
import com.polycopy.copytrade.model.TradeSide;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@code mirror_orders}: one row per (user, source wallet, tx hash). Reserving the row before submitting is
 * what keeps a trade from being mirrored twice for a user, across restarts included.
 */
@Component
@RequiredArgsConstructor
public class MirrorOrderRepository {

  private static final String SELECT_COLUMNS = """
      SELECT id, user_id, source_wallet, tx_hash, market_id, asset_id, side, requested_size, price_basis,
             order_type, outcome, exchange_order_id, error_detail, submitted_at, finalized_at
      FROM mirror_orders
      """;

  private static final RowMapper<MirrorOrder> MAPPER = (rs, rowNum) -> {
    Timestamp finalizedAt = rs.getTimestamp("finalized_at");
    return new MirrorOrder(
        rs.getLong("id"),
        rs.getString("user_id"),
        rs.getString("source_wallet"),
        rs.getString("tx_hash"),
        rs.getString("market_id"),
        rs.getString("asset_id"),
        TradeSide.valueOf(rs.getString("side")),
        rs.getBigDecimal("requested_size"),
        rs.getBigDecimal("price_basis"),
        rs.getString("order_type"),
        MirrorOutcome.valueOf(rs.getString("outcome")),
        rs.getString("exchange_order_id"),
        rs.getString("error_detail"),
        rs.getTimestamp("submitted_at").toInstant(),
        finalizedAt == null ? null : finalizedAt.toInstant()
    );
  };

  private final @NonNull JdbcTemplate jdbcTemplate;

  /**
   * Inserts the row for (user, trade). A terminal {@code outcome} records the row as already finalized.
   *
   * @return the row id, or empty if a row for this user and trade exists already
   */
  public Optional<Long> reserve(String userId, TradeEvent event, String orderType, MirrorOutcome outcome,
                                String detail, Instant at) {
    Timestamp ts = Timestamp.from(at);
    try {
      jdbcTemplate.update("""
              INSERT INTO mirror_orders (user_id, source_wallet, tx_hash, market_id, asset_id, side, order_type,
                                         outcome, error_detail, submitted_at, finalized_at)
              VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
              """,
          userId,
          event.key().sourceWallet(),
          event.key().txHash(),
          event.marketId(),
          event.assetId(),
          event.side().name(),
          orderType,
          outcome.name(),
          truncate(detail),
          ts,
          outcome.isTerminal() ? ts : null
      );
    } catch (DuplicateKeyException e) {
      return Optional.empty();
    }
    return jdbcTemplate.query(
            "SELECT id FROM mirror_orders WHERE user_id = ? AND source_wallet = ? AND tx_hash = ?",
            (rs, rowNum) -> rs.getLong("id"),
            userId, event.key().sourceWallet(), event.key().txHash())
        .stream()
        .findFirst();
  }

  /**
   * Moves a PENDING row to its terminal outcome. Finalized rows are never touched again.
   *
   * @return false if the row was not PENDING
   */
  public boolean finish(long id, MirrorOutcome outcome, BigDecimal requestedSize, BigDecimal priceBasis,
                        String exchangeOrderId, String detail, Instant at) {
    if (!outcome.isTerminal()) {
      throw new IllegalArgumentException("Not a terminal outcome: " + outcome);
    }
    return jdbcTemplate.update("""
            UPDATE mirror_orders
            SET outcome = ?, requested_size = ?, price_basis = ?, exchange_order_id = ?, error_detail = ?,
                finalized_at = ?
            WHERE id = ? AND outcome = 'PENDING'
            """,
        outcome.name(), requestedSize, priceBasis, exchangeOrderId, truncate(detail), Timestamp.from(at), id) == 1;
  }

  public Optional<MirrorOrder> find(String userId, String sourceWallet, String txHash) {
    return jdbcTemplate.query(SELECT_COLUMNS + " WHERE user_id = ? AND source_wallet = ? AND tx_hash = ?",
            MAPPER, userId, sourceWallet, txHash)
        .stream()
        .findFirst();
  }

  public Optional<MirrorOrder> findById(long id) {
    return jdbcTemplate.query(SELECT_COLUMNS + " WHERE id = ?", MAPPER, id).stream().findFirst();
  }

  /**
   * Newest first.
   */
  public List<MirrorOrder> findByUserId(String userId, int limit) {
    return jdbcTemplate.query(SELECT_COLUMNS + " WHERE user_id = ? ORDER BY submitted_at DESC, id DESC LIMIT ?",
        MAPPER, userId, Math.max(1, limit));
  }

  public Map<MirrorOutcome, Long> countByOutcome() {
    Map<MirrorOutcome, Long> counts = new EnumMap<>(MirrorOutcome.class);
    jdbcTemplate.query("SELECT outcome, COUNT(*) AS n FROM mirror_orders GROUP BY outcome",
        rs -> {
          counts.put(MirrorOutcome.valueOf(rs.getString("outcome")), rs.getLong("n"));
        });
    return counts;
  }

  private static String truncate(String detail) {
    if (detail == null || detail.length() <= 1024) {
      return detail;
    }
    return detail.substring(0, 1024);
  }
}
