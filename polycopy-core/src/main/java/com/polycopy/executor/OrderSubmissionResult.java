package com.polycopy.executor;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;
import java.util.Set;

/**
 * Raw CLOB response relayed by the executor, with the fill-or-kill classification applied to it.
 */
public record OrderSubmissionResult(JsonNode clobResponse) {

  public enum Status {
    FILLED,
    KILLED,
    REJECTED
  }

  private static final Set<String> KILLED_STATUSES = Set.of("cancelled", "canceled", "unmatched", "killed");
  private static final Set<String> FILLED_STATUSES = Set.of("matched", "filled", "mined", "confirmed");

  public Status status() {
    if (clobResponse == null || clobResponse.isNull() || clobResponse.isMissingNode()) {
      return Status.REJECTED;
    }
    String status = text("status").toLowerCase(Locale.ROOT);
    if (KILLED_STATUSES.contains(status)) {
      return Status.KILLED;
    }
    String error = errorMessage().toLowerCase(Locale.ROOT);
    if (error.contains("fully filled or killed") || error.contains("fok") || error.contains("no match")) {
      return Status.KILLED;
    }
    if (FILLED_STATUSES.contains(status)) {
      return Status.FILLED;
    }
    if (!error.isEmpty()) {
      return Status.REJECTED;
    }
    if (clobResponse.path("success").asBoolean(false) || !orderId().isEmpty()) {
      return Status.FILLED;
    }
    return Status.REJECTED;
  }

  public String orderId() {
    String id = text("orderID");
    return id.isEmpty() ? text("order_id") : id;
  }

  public String errorMessage() {
    String msg = text("errorMsg");
    return msg.isEmpty() ? text("error") : msg;
  }

  private String text(String field) {
    if (clobResponse == null) {
      return "";
    }
    JsonNode node = clobResponse.path(field);
    return node.isMissingNode() || node.isNull() ? "" : node.asText("").trim();
  }
}
