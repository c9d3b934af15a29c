package com.polycopy.web;

import com.polycopy.ledger.PointsHistoryEntry;
import com.polycopy.ledger.PointsLedger;
import com.polycopy.ledger.PointsSummary;
import com.polycopy.ledger.ReferredUser;
import com.polycopy.ledger.Wallet;
import com.polycopy.referral.ReferralService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Onboarding, points and referrals. Bot front ends call these on behalf of their users.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class WalletController {

  private static final int MAX_PAGE = 100;

  private final @NonNull ReferralService referralService;
  private final @NonNull PointsLedger pointsLedger;

  @PostMapping("/wallets")
  public ResponseEntity<WalletResponse> onboard(@Valid @RequestBody OnboardRequest request) {
    Wallet wallet = referralService.onboard(
        request.userId(), request.handle(), request.address(), request.credentialRef(), request.settings());
    if (request.referralCode() != null && !request.referralCode().isBlank() && !wallet.isReferred()) {
      wallet = referralService.registerReferral(wallet.userId(), request.referralCode());
    }
    return ResponseEntity.status(HttpStatus.CREATED).body(WalletResponse.from(wallet));
  }

  @GetMapping("/wallets/{userId}/points")
  public PointsSummary points(@PathVariable String userId) {
    return pointsLedger.summary(userId);
  }

  @GetMapping("/wallets/{userId}/points/history")
  public List<PointsHistoryEntry> history(
      @PathVariable String userId,
      @RequestParam(defaultValue = "20") int limit,
      @RequestParam(defaultValue = "0") int offset
  ) {
    return pointsLedger.history(userId, Math.min(limit, MAX_PAGE), offset);
  }

  @GetMapping("/wallets/{userId}/referrals")
  public List<ReferredUser> referrals(@PathVariable String userId, @RequestParam(defaultValue = "10") int limit) {
    return pointsLedger.referrals(userId, Math.min(limit, MAX_PAGE));
  }

  @GetMapping("/wallets/{userId}/referral-code")
  public Map<String, String> referralCode(@PathVariable String userId) {
    return Map.of("referralCode", referralService.getOrCreateReferralCode(userId));
  }

  @PutMapping("/wallets/{userId}/referral-code")
  public WalletResponse customizeCode(@PathVariable String userId, @Valid @RequestBody CodeRequest request) {
    return WalletResponse.from(referralService.customizeCode(userId, request.code()));
  }

  @PostMapping("/referrals")
  public WalletResponse registerReferral(@Valid @RequestBody ReferralRequest request) {
    return WalletResponse.from(referralService.registerReferral(request.userId(), request.code()));
  }

  public record OnboardRequest(
      @NotBlank String userId,
      String handle,
      String address,
      String credentialRef,
      Map<String, String> settings,
      String referralCode
  ) {
  }

  public record CodeRequest(@NotBlank String code) {
  }

  public record ReferralRequest(@NotBlank String userId, @NotBlank String code) {
  }

  /**
   * Wallet view without the credential reference.
   */
  public record WalletResponse(
      String userId,
      String handle,
      String address,
      Map<String, String> settings,
      String referralCode,
      String referredBy,
      BigDecimal totalPoints,
      BigDecimal totalVolume,
      Instant createdAt
  ) {
    static WalletResponse from(Wallet w) {
      return new WalletResponse(w.userId(), w.handle(), w.address(), w.settings(), w.referralCode(), w.referredBy(),
          w.totalPoints(), w.totalVolume(), w.createdAt());
    }
  }
}
