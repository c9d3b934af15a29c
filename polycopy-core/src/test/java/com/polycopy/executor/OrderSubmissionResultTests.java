package com.polycopy.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class OrderSubmissionResultTests {

  private final ObjectMapper objectMapper = new ObjectMapper();

  private OrderSubmissionResult result(String json) throws Exception {
    return new OrderSubmissionResult(objectMapper.readTree(json));
  }

  @Test
  void matchedOrderIsFilled() throws Exception {
    OrderSubmissionResult r = result("{\"success\":true,\"orderID\":\"0xabc\",\"status\":\"matched\"}");

    assertThat(r.status()).isEqualTo(OrderSubmissionResult.Status.FILLED);
    assertThat(r.orderId()).isEqualTo("0xabc");
  }

  @Test
  void cancelledOrderIsKilled() throws Exception {
    assertThat(result("{\"orderID\":\"0xabc\",\"status\":\"cancelled\"}").status())
        .isEqualTo(OrderSubmissionResult.Status.KILLED);
  }

  @Test
  void fokErrorMessageIsKilled() throws Exception {
    OrderSubmissionResult r = result(
        "{\"success\":false,\"errorMsg\":\"order couldn't be fully filled. FOK orders are fully filled or killed.\"}");

    assertThat(r.status()).isEqualTo(OrderSubmissionResult.Status.KILLED);
  }

  @Test
  void otherErrorsAreRejected() throws Exception {
    assertThat(result("{\"success\":false,\"errorMsg\":\"not enough balance / allowance\"}").status())
        .isEqualTo(OrderSubmissionResult.Status.REJECTED);
    assertThat(result("{}").status()).isEqualTo(OrderSubmissionResult.Status.REJECTED);
    assertThat(new OrderSubmissionResult(null).status()).isEqualTo(OrderSubmissionResult.Status.REJECTED);
  }
}
