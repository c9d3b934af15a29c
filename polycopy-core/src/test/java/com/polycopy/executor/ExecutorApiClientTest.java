package com.polycopy.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polycopy.polymarket.http.PolymarketHttpException;
import com.polycopy.polymarket.http.PolymarketHttpTransport;
import com.polycopy.polymarket.http.RequestRateLimiter;
import com.polycopy.polymarket.http.RetryPolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExecutorApiClientTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Mock
  private PolymarketHttpTransport transport;

  @Mock
  private HttpClient httpClient;

  @Mock
  private HttpResponse<String> response;

  private final FokOrderRequest order = FokOrderRequest.of(
      "bob", "7132", "BUY", new BigDecimal("18.1818"), new BigDecimal("0.55"), "0xwallet:0xtx");

  @Test
  void submitsOnceAndClassifiesResponse() throws Exception {
    when(transport.sendJsonOnce(any(HttpRequest.class), eq(JsonNode.class)))
        .thenReturn(mapper.readTree("{\"success\":true,\"orderID\":\"0xabc\",\"status\":\"matched\"}"));
    ExecutorApiClient client = new ExecutorApiClient(
        URI.create("http://executor:8080"), transport, mapper, Duration.ofSeconds(5));

    OrderSubmissionResult result = client.signAndSubmit(FokOrderRequest.of(
        "bob", "7132", "BUY", new BigDecimal("18.1818"), new BigDecimal("0.55"), "0xwallet:0xtx"));

    assertThat(result.status()).isEqualTo(OrderSubmissionResult.Status.FILLED);
    assertThat(result.orderId()).isEqualTo("0xabc");
    ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
    verify(transport).sendJsonOnce(request.capture(), eq(JsonNode.class));
    verify(transport, never()).sendJson(any(), any());
    assertThat(request.getValue().method()).isEqualTo("POST");
    assertThat(request.getValue().uri().toString()).isEqualTo("http://executor:8080/api/polymarket/orders");
    assertThat(request.getValue().timeout()).contains(Duration.ofSeconds(5));
  }

  @Test
  void unfilledOrderRelayedAsBadRequestIsKilled() throws Exception {
    when(response.statusCode()).thenReturn(400);
    when(response.body()).thenReturn(
        "{\"errorMsg\":\"order couldn't be fully filled. FOK orders are fully filled or killed.\"}");
    doReturn(response).when(httpClient).send(any(), any());
    PolymarketHttpTransport realTransport = new PolymarketHttpTransport(
        httpClient, mapper, RequestRateLimiter.noop(), new RetryPolicy(true, 3, 0, 0));
    ExecutorApiClient client = new ExecutorApiClient(
        URI.create("http://executor:8080"), realTransport, mapper, Duration.ofSeconds(5));

    OrderSubmissionResult result = client.signAndSubmit(order);

    assertThat(result.status()).isEqualTo(OrderSubmissionResult.Status.KILLED);
    assertThat(result.errorMessage()).contains("fully filled or killed");
    verify(httpClient, times(1)).send(any(), any());
  }

  @Test
  void badRequestWithErrorBodyIsRejected() {
    when(transport.sendJsonOnce(any(HttpRequest.class), eq(JsonNode.class)))
        .thenThrow(new PolymarketHttpException("HTTP 400", 400, false, "{\"errorMsg\":\"invalid tick size\"}"));
    ExecutorApiClient client = new ExecutorApiClient(
        URI.create("http://executor:8080"), transport, mapper, Duration.ofSeconds(5));

    OrderSubmissionResult result = client.signAndSubmit(order);

    assertThat(result.status()).isEqualTo(OrderSubmissionResult.Status.REJECTED);
    assertThat(result.errorMessage()).isEqualTo("invalid tick size");
  }

  @Test
  void serverErrorsAndUnreadableBodiesPropagate() {
    when(transport.sendJsonOnce(any(HttpRequest.class), eq(JsonNode.class)))
        .thenThrow(new PolymarketHttpException("HTTP 503", 503, true, "{\"errorMsg\":\"down\"}"))
        .thenThrow(new PolymarketHttpException("HTTP 400", 400, false, "<html>bad request</html>"));
    ExecutorApiClient client = new ExecutorApiClient(
        URI.create("http://executor:8080"), transport, mapper, Duration.ofSeconds(5));

    assertThatThrownBy(() -> client.signAndSubmit(order))
        .isInstanceOf(PolymarketHttpException.class)
        .hasMessage("HTTP 503");
    assertThatThrownBy(() -> client.signAndSubmit(order))
        .isInstanceOf(PolymarketHttpException.class)
        .hasMessage("HTTP 400");
  }
}
