package com.polycopy.web;

import com.polycopy.copytrade.execution.MirrorOrderRepository;
import com.polycopy.copytrade.model.MirrorOrder;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
public class MirrorOrderController {

  private static final int MAX_LIMIT = 500;

  private final @NonNull MirrorOrderRepository mirrorOrders;

  @GetMapping("/api/wallets/{userId}/mirror-orders")
  public List<MirrorOrder> list(@PathVariable String userId,
                                @RequestParam(defaultValue = "50") int limit) {
    return mirrorOrders.findByUserId(userId, Math.min(limit, MAX_LIMIT));
  }
}
