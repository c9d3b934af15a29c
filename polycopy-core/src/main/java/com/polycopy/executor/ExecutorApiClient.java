package com.polycopy.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polycopy.polymarket.http.HttpRequestFactory;
import com.polycopy.polymarket.http.PolymarketHttpException;
import com.polycopy.polymarket.http.PolymarketHttpTransport;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * HTTP client for the executor service, which keeps the KMS-encrypted keys and signs orders.
 */
@Slf4j
public class ExecutorApiClient implements OrderSigningGateway {

  private final HttpRequestFactory requestFactory;
  private final PolymarketHttpTransport transport;
  private final ObjectMapper objectMapper;
  private final Duration timeout;

  public ExecutorApiClient(URI baseUri, PolymarketHttpTransport transport, ObjectMapper objectMapper, Duration timeout) {
    this.requestFactory = new HttpRequestFactory(Objects.requireNonNull(baseUri, "baseUri"));
    this.transport = Objects.requireNonNull(transport, "transport");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  @Override
  public OrderSubmissionResult signAndSubmit(FokOrderRequest request) {
    String body;
    try {
      body = objectMapper.writeValueAsString(request);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Unserializable order request for user " + request.userId(), e);
    }
    HttpRequest httpRequest = requestFactory.request("/api/polymarket/orders", Map.of())
        .POST(HttpRequest.BodyPublishers.ofString(body))
        .timeout(timeout)
        .header("Content-Type", "application/json")
        .header("Accept", "application/json")
        .build();
    log.debug("submitting {} {} {} @ {} for user {}", request.orderType(), request.side(), request.size(),
        request.price(), request.userId());
    // never retried
    try {
      JsonNode response = transport.sendJsonOnce(httpRequest, JsonNode.class);
      return new OrderSubmissionResult(response);
    } catch (PolymarketHttpException e) {
      JsonNode relayed = relayedClobError(e);
      if (relayed == null) {
        throw e;
      }
      log.debug("executor relayed HTTP {} for user {}: {}", e.getStatusCode(), request.userId(), relayed);
      return new OrderSubmissionResult(relayed);
    }
  }

  /**
   * The CLOB answers an unfillable or invalid order with a 4xx JSON body, which the executor passes through.
   */
  private JsonNode relayedClobError(PolymarketHttpException e) {
    String body = e.getResponseBody();
    if (!e.isClientError() || body == null || body.isBlank()) {
      return null;
    }
    try {
      JsonNode node = objectMapper.readTree(body);
      return node != null && node.isObject() ? node : null;
    } catch (JsonProcessingException parseError) {
      log.debug("executor HTTP {} body is not JSON: {}", e.getStatusCode(), parseError.getOriginalMessage());
      return null;
    }
  }
}
