package com.polycopy.web;

import com.polycopy.copytrade.model.CopySubscription;
import com.polycopy.copytrade.subscription.SubscriptionRegistry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;

@RestController
@RequestMapping("/api/wallets/{userId}/subscriptions")
@RequiredArgsConstructor
public class SubscriptionController {

  private final @NonNull SubscriptionRegistry subscriptions;

  @GetMapping
  public List<CopySubscription> list(@PathVariable String userId) {
    return subscriptions.listForUser(userId);
  }

  @PostMapping
  public ResponseEntity<CopySubscription> subscribe(@PathVariable String userId,
                                                    @Valid @RequestBody SubscribeRequest request) {
    CopySubscription created = subscriptions.subscribe(userId, request.wallet(), request.label(), request.scaleFactor());
    return ResponseEntity.status(HttpStatus.CREATED).body(created);
  }

  @DeleteMapping("/{wallet}")
  public ResponseEntity<Void> unsubscribe(@PathVariable String userId, @PathVariable String wallet) {
    return subscriptions.unsubscribe(userId, wallet)
        ? ResponseEntity.noContent().build()
        : ResponseEntity.notFound().build();
  }

  @PatchMapping("/{wallet}")
  public ResponseEntity<CopySubscription> update(@PathVariable String userId, @PathVariable String wallet,
                                                 @Valid @RequestBody UpdateRequest request) {
    boolean found = subscriptions.find(userId, wallet).isPresent();
    if (!found) {
      return ResponseEntity.notFound().build();
    }
    if (request.enabled() != null) {
      subscriptions.setEnabled(userId, wallet, request.enabled());
    }
    if (request.scaleFactor() != null) {
      subscriptions.setScaleFactor(userId, wallet, request.scaleFactor());
    }
    return ResponseEntity.of(subscriptions.find(userId, wallet));
  }

  public record SubscribeRequest(@NotBlank String wallet, String label, @Positive BigDecimal scaleFactor) {
  }

  public record UpdateRequest(Boolean enabled, @Positive BigDecimal scaleFactor) {
  }
}
