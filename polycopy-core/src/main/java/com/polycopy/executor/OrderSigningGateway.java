package com.polycopy.executor;

/**
 * Opaque "sign and submit order O for user U" operation. Implementations own the signing keys; callers
 * never see them. A call is made at most once per order intent and is never retried.
 */
public interface OrderSigningGateway {

  OrderSubmissionResult signAndSubmit(FokOrderRequest request);
}
