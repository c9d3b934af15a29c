package com.polycopy.executor;

import java.math.BigDecimal;

/**
 * Unsigned fill-or-kill order intent for one bot user. The executor signs it with the user's key.
 *
 * @param size shares to buy or sell
 * @param price limit price; the order executes in full at this price or better, or not at all
 */
public record FokOrderRequest(
    String userId,
    String tokenId,
    String side,
    BigDecimal size,
    BigDecimal price,
    String orderType,
    String clientOrderId
) {

  public static final String ORDER_TYPE_FOK = "FOK";

  public static FokOrderRequest of(String userId, String tokenId, String side, BigDecimal size, BigDecimal price,
                                   String clientOrderId) {
    return new FokOrderRequest(userId, tokenId, side, size, price, ORDER_TYPE_FOK, clientOrderId);
  }
}
