package com.polycopy.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC access to {@code wallets}. Referral codes are stored upper case; lookups normalize their input.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class WalletRepository {

  private static final TypeReference<Map<String, String>> SETTINGS_TYPE = new TypeReference<>() {
  };

  private static final String SELECT_COLUMNS = """
      SELECT user_id, handle, address, credential_ref, settings, referral_code, referred_by,
             total_points, total_volume, created_at
      FROM wallets
      """;

  private final @NonNull JdbcTemplate jdbcTemplate;
  private final @NonNull ObjectMapper objectMapper;

  /**
   * @throws org.springframework.dao.DuplicateKeyException if the user id or the referral code is taken
   */
  public void insert(Wallet wallet) {
    jdbcTemplate.update("""
            INSERT INTO wallets (user_id, handle, address, credential_ref, settings, referral_code, referred_by,
                                 total_points, total_volume, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
        wallet.userId(),
        wallet.handle(),
        wallet.address(),
        wallet.credentialRef(),
        writeSettings(wallet.settings()),
        normalizeCode(wallet.referralCode()),
        normalizeCode(wallet.referredBy()),
        wallet.totalPoints(),
        wallet.totalVolume(),
        Timestamp.from(wallet.createdAt())
    );
  }

  public Optional<Wallet> findByUserId(String userId) {
    List<Wallet> rows = jdbcTemplate.query(SELECT_COLUMNS + " WHERE user_id = ?", walletMapper(), userId);
    return rows.stream().findFirst();
  }

  public Optional<Wallet> findByReferralCode(String code) {
    String normalized = normalizeCode(code);
    if (normalized == null) {
      return Optional.empty();
    }
    List<Wallet> rows = jdbcTemplate.query(SELECT_COLUMNS + " WHERE referral_code = ?", walletMapper(), normalized);
    return rows.stream().findFirst();
  }

  public boolean existsByReferralCode(String code) {
    Integer count = jdbcTemplate.queryForObject(
        "SELECT COUNT(*) FROM wallets WHERE referral_code = ?", Integer.class, normalizeCode(code));
    return count != null && count > 0;
  }

  /**
   * Sets the code only if the wallet has none yet.
   *
   * @return false if the wallet already had a code or does not exist
   * @throws org.springframework.dao.DuplicateKeyException if another wallet holds the code
   */
  public boolean assignReferralCode(String userId, String code) {
    return jdbcTemplate.update(
        "UPDATE wallets SET referral_code = ? WHERE user_id = ? AND referral_code IS NULL",
        normalizeCode(code), userId) == 1;
  }

  /**
   * Replaces the wallet's code. Wallets referred under the old code follow through the cascading FK.
   */
  public boolean updateReferralCode(String userId, String code) {
    return jdbcTemplate.update(
        "UPDATE wallets SET referral_code = ? WHERE user_id = ?", normalizeCode(code), userId) == 1;
  }

  /**
   * Row-locks the given wallets until the surrounding transaction ends. Rows are locked in user id order.
   */
  public void lockForUpdate(List<String> userIds) {
    userIds.stream()
        .distinct()
        .sorted()
        .forEach(userId -> jdbcTemplate.queryForList(
            "SELECT user_id FROM wallets WHERE user_id = ? FOR UPDATE", String.class, userId));
  }

  /**
   * Links a wallet to its referrer. A wallet is referred at most once.
   *
   * @return false if the wallet was already referred
   */
  public boolean setReferredBy(String userId, String referrerCode) {
    return jdbcTemplate.update(
        "UPDATE wallets SET referred_by = ? WHERE user_id = ? AND referred_by IS NULL",
        normalizeCode(referrerCode), userId) == 1;
  }

  /**
   * @return rows updated; 0 means the wallet does not exist
   */
  public int incrementTotals(String userId, BigDecimal points, BigDecimal volume) {
    return jdbcTemplate.update(
        "UPDATE wallets SET total_points = total_points + ?, total_volume = total_volume + ? WHERE user_id = ?",
        points, volume, userId);
  }

  public long countReferrals(String referralCode) {
    if (referralCode == null) {
      return 0L;
    }
    Long count = jdbcTemplate.queryForObject(
        "SELECT COUNT(*) FROM wallets WHERE referred_by = ?", Long.class, normalizeCode(referralCode));
    return count == null ? 0L : count;
  }

  /**
   * Wallets referred under {@code referralCode}, newest first.
   */
  public List<ReferredUser> findReferredUsers(String referralCode, int limit) {
    if (referralCode == null) {
      return List.of();
    }
    return jdbcTemplate.query("""
            SELECT user_id, handle, total_points, total_volume, created_at
            FROM wallets
            WHERE referred_by = ?
            ORDER BY created_at DESC, id DESC
            LIMIT ?
            """,
        (rs, rowNum) -> {
          String handle = rs.getString("handle");
          return new ReferredUser(
              rs.getString("user_id"),
              handle == null || handle.isBlank() ? "Anonymous" : handle,
              rs.getBigDecimal("total_points"),
              rs.getBigDecimal("total_volume"),
              rs.getTimestamp("created_at").toInstant()
          );
        },
        normalizeCode(referralCode), Math.max(1, limit));
  }

  static String normalizeCode(String code) {
    if (code == null || code.isBlank()) {
      return null;
    }
    return code.trim().toUpperCase(Locale.ROOT);
  }

  private RowMapper<Wallet> walletMapper() {
    return (rs, rowNum) -> new Wallet(
        rs.getString("user_id"),
        rs.getString("handle"),
        rs.getString("address"),
        rs.getString("credential_ref"),
        readSettings(rs.getString("user_id"), rs.getString("settings")),
        rs.getString("referral_code"),
        rs.getString("referred_by"),
        rs.getBigDecimal("total_points"),
        rs.getBigDecimal("total_volume"),
        rs.getTimestamp("created_at").toInstant()
    );
  }

  private String writeSettings(Map<String, String> settings) {
    try {
      return objectMapper.writeValueAsString(settings == null ? Map.of() : settings);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Unserializable wallet settings", e);
    }
  }

  private Map<String, String> readSettings(String userId, String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      return objectMapper.readValue(json, SETTINGS_TYPE);
    } catch (JsonProcessingException e) {
      log.warn("Unreadable settings for wallet {}: {}", userId, e.toString());
      return Map.of();
    }
  }
}
