package com.polycopy.referral;

import com.polycopy.ledger.PointsGrant;
import com.polycopy.ledger.PointsLedger;
import com.polycopy.ledger.UnknownWalletException;
import com.polycopy.ledger.Wallet;
import com.polycopy.ledger.WalletRepository;
import com.polycopy.points.PointsRules;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Wallet onboarding and the referral graph: code assignment, custom codes, and linking a new user to the
 * user who referred them.
 */
@Slf4j
public class ReferralService {

  public static final int MIN_CODE_LENGTH = 3;
  public static final int MAX_CODE_LENGTH = 7;

  private static final Pattern CODE_PATTERN = Pattern.compile("^[A-Za-z0-9]{3,7}$");

  private final WalletRepository wallets;
  private final PointsLedger ledger;
  private final TransactionTemplate transactionTemplate;
  private final ReferralCodeGenerator codeGenerator;
  private final int maxCodeAttempts;
  private final Clock clock;

  public ReferralService(
      WalletRepository wallets,
      PointsLedger ledger,
      TransactionTemplate transactionTemplate,
      ReferralCodeGenerator codeGenerator,
      int maxCodeAttempts,
      Clock clock
  ) {
    this.wallets = Objects.requireNonNull(wallets, "wallets");
    this.ledger = Objects.requireNonNull(ledger, "ledger");
    this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate");
    this.codeGenerator = Objects.requireNonNull(codeGenerator, "codeGenerator");
    this.maxCodeAttempts = Math.max(1, maxCodeAttempts);
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public static boolean isValidCode(String code) {
    return code != null && CODE_PATTERN.matcher(code.trim()).matches();
  }

  /**
   * Creates the user's wallet with a fresh referral code. Onboarding an existing user returns their wallet
   * unchanged.
   *
   * @throws ReferralCodeExhaustedException if every generated code was taken
   */
  public Wallet onboard(String userId, String handle, String address, String credentialRef,
                        Map<String, String> settings) {
    if (userId == null || userId.isBlank()) {
      throw new IllegalArgumentException("userId must not be blank");
    }
    var existing = wallets.findByUserId(userId);
    if (existing.isPresent()) {
      return existing.get();
    }
    for (int attempt = 1; attempt <= maxCodeAttempts; attempt++) {
      String code = codeGenerator.generate();
      try {
        wallets.insert(Wallet.create(userId, handle, address, credentialRef, settings, code, clock.instant()));
        log.info("Onboarded user {} with referral code {}", userId, code);
        return wallets.findByUserId(userId).orElseThrow(() -> new UnknownWalletException(userId));
      } catch (DuplicateKeyException e) {
        var raced = wallets.findByUserId(userId);
        if (raced.isPresent()) {
          return raced.get();
        }
        log.warn("Referral code collision for {} on attempt {}/{}", userId, attempt, maxCodeAttempts);
      }
    }
    throw new ReferralCodeExhaustedException(userId, maxCodeAttempts);
  }

  /**
   * @throws UnknownWalletException if the user has no wallet
   * @throws ReferralCodeExhaustedException if every generated code was taken
   */
  public String getOrCreateReferralCode(String userId) {
    Wallet wallet = wallets.findByUserId(userId).orElseThrow(() -> new UnknownWalletException(userId));
    if (wallet.referralCode() != null) {
      return wallet.referralCode();
    }
    for (int attempt = 1; attempt <= maxCodeAttempts; attempt++) {
      String code = codeGenerator.generate();
      try {
        if (wallets.assignReferralCode(userId, code)) {
          log.info("Assigned referral code {} to {}", code, userId);
          return code;
        }
        // assigned concurrently
        return wallets.findByUserId(userId)
            .map(Wallet::referralCode)
            .orElseThrow(() -> new UnknownWalletException(userId));
      } catch (DuplicateKeyException e) {
        log.warn("Referral code collision for {} on attempt {}/{}", userId, attempt, maxCodeAttempts);
      }
    }
    throw new ReferralCodeExhaustedException(userId, maxCodeAttempts);
  }

  /**
   * Replaces the user's code with a chosen one. Users already referred under the old code stay linked.
   */
  public Wallet customizeCode(String userId, String requestedCode) {
    if (!isValidCode(requestedCode)) {
      throw new ReferralException(ReferralException.Reason.INVALID_CODE,
          "Referral code must be 3 to 7 letters or digits");
    }
    String code = requestedCode.trim().toUpperCase(Locale.ROOT);
    Wallet wallet = wallets.findByUserId(userId).orElseThrow(() -> new UnknownWalletException(userId));
    if (code.equals(wallet.referralCode())) {
      return wallet;
    }
    if (wallets.existsByReferralCode(code)) {
      throw new ReferralException(ReferralException.Reason.CODE_TAKEN, "Referral code " + code + " is taken");
    }
    try {
      wallets.updateReferralCode(userId, code);
    } catch (DuplicateKeyException e) {
      throw new ReferralException(ReferralException.Reason.CODE_TAKEN, "Referral code " + code + " is taken");
    }
    log.info("User {} changed referral code {} -> {}", userId, wallet.referralCode(), code);
    return wallets.findByUserId(userId).orElseThrow(() -> new UnknownWalletException(userId));
  }

  /**
   * Links {@code newUserId} to the owner of {@code code} and grants the owner the signup bonus, atomically.
   * Codes match case-insensitively.
   */
  public Wallet registerReferral(String newUserId, String code) {
    if (wallets.findByUserId(newUserId).isEmpty()) {
      throw new UnknownWalletException(newUserId);
    }
    Wallet referrer = wallets.findByReferralCode(code)
        .orElseThrow(() -> new ReferralException(ReferralException.Reason.UNKNOWN_CODE,
            "Unknown referral code " + code));
    if (referrer.userId().equals(newUserId)) {
      throw new ReferralException(ReferralException.Reason.SELF_REFERRAL, "Users cannot refer themselves");
    }

    Wallet linkedTo;
    try {
      linkedTo = transactionTemplate.execute(status -> {
        // held until commit
        wallets.lockForUpdate(List.of(newUserId, referrer.userId()));
        Wallet newWallet = wallets.findByUserId(newUserId).orElseThrow(() -> new UnknownWalletException(newUserId));
        Wallet lockedReferrer = wallets.findByUserId(referrer.userId())
            .orElseThrow(() -> new UnknownWalletException(referrer.userId()));
        if (newWallet.isReferred()) {
          throw new ReferralException(ReferralException.Reason.ALREADY_REFERRED,
              "User " + newUserId + " was already referred");
        }
        if (newWallet.referralCode() != null && newWallet.referralCode().equals(lockedReferrer.referredBy())) {
          throw new ReferralException(ReferralException.Reason.REFERRAL_CYCLE,
              "User " + lockedReferrer.userId() + " was referred by " + newUserId);
        }
        if (!wallets.setReferredBy(newUserId, lockedReferrer.referralCode())) {
          throw new ReferralException(ReferralException.Reason.ALREADY_REFERRED,
              "User " + newUserId + " was already referred");
        }
        ledger.applyGrant(PointsGrant.referralSignup(
            lockedReferrer.userId(), newUserId, PointsRules.REFERRAL_SIGNUP_BONUS));
        return lockedReferrer;
      });
    } catch (DuplicateKeyException e) {
      log.warn("Signup bonus for {} already granted to {}", newUserId, referrer.userId());
      throw new ReferralException(ReferralException.Reason.ALREADY_REFERRED,
          "User " + newUserId + " was already referred");
    }
    log.info("User {} registered with referral code {} of {}", newUserId, linkedTo.referralCode(), linkedTo.userId());
    return wallets.findByUserId(newUserId).orElseThrow(() -> new UnknownWalletException(newUserId));
  }
}
