package com.polycopy.web;

import com.polycopy.ledger.UnknownWalletException;
import com.polycopy.polymarket.http.PolymarketHttpException;
import com.polycopy.referral.ReferralCodeExhaustedException;
import com.polycopy.referral.ReferralException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

  @ExceptionHandler(ReferralException.class)
  public ResponseEntity<ApiError> handleReferral(ReferralException ex) {
    log.warn("Referral rejected: [{}] {}", ex.getReason(), ex.getMessage());
    HttpStatus status = switch (ex.getReason()) {
      case UNKNOWN_CODE -> HttpStatus.NOT_FOUND;
      case INVALID_CODE, SELF_REFERRAL -> HttpStatus.BAD_REQUEST;
      case CODE_TAKEN, ALREADY_REFERRED, REFERRAL_CYCLE -> HttpStatus.CONFLICT;
    };
    return error(status, "REFERRAL_" + ex.getReason().name(), ex.getMessage());
  }

  @ExceptionHandler(UnknownWalletException.class)
  public ResponseEntity<ApiError> handleUnknownWallet(UnknownWalletException ex) {
    return error(HttpStatus.NOT_FOUND, "WALLET_NOT_FOUND", ex.getMessage());
  }

  @ExceptionHandler(ReferralCodeExhaustedException.class)
  public ResponseEntity<ApiError> handleCodeExhausted(ReferralCodeExhaustedException ex) {
    log.error("Referral code space exhausted for {} after {} attempts", ex.getUserId(), ex.getAttempts());
    return error(HttpStatus.SERVICE_UNAVAILABLE, "REFERRAL_CODE_EXHAUSTED", ex.getMessage());
  }

  @ExceptionHandler(DuplicateKeyException.class)
  public ResponseEntity<ApiError> handleDuplicate(DuplicateKeyException ex) {
    log.warn("Duplicate write rejected: {}", ex.getMostSpecificCause().getMessage());
    return error(HttpStatus.CONFLICT, "DUPLICATE", "Resource already exists");
  }

  @ExceptionHandler(DataIntegrityViolationException.class)
  public ResponseEntity<ApiError> handleIntegrity(DataIntegrityViolationException ex) {
    log.warn("Integrity violation: {}", ex.getMostSpecificCause().getMessage());
    return error(HttpStatus.CONFLICT, "INTEGRITY_VIOLATION", "Request conflicts with existing data");
  }

  @ExceptionHandler({IllegalArgumentException.class, MethodArgumentNotValidException.class})
  public ResponseEntity<ApiError> handleBadRequest(Exception ex) {
    log.warn("Invalid request: {}", ex.getMessage());
    return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", ex.getMessage());
  }

  @ExceptionHandler(PolymarketHttpException.class)
  public ResponseEntity<ApiError> handleUpstream(PolymarketHttpException ex) {
    log.warn("Upstream call failed: {}", ex.getMessage());
    return error(HttpStatus.BAD_GATEWAY, "UPSTREAM_ERROR", ex.getMessage());
  }

  private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message) {
    return ResponseEntity.status(status).body(new ApiError(code, message, Instant.now()));
  }

  public record ApiError(String code, String message, Instant timestamp) {
  }
}
