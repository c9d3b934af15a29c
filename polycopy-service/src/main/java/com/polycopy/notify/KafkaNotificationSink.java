package com.polycopy.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Publishes notifications as JSON envelopes keyed by user id.
 */
@Slf4j
@RequiredArgsConstructor
public class KafkaNotificationSink implements NotificationSink {

  private static final String SOURCE = "polycopy";

  private final @NonNull KafkaTemplate<String, String> kafkaTemplate;
  private final @NonNull ObjectMapper objectMapper;
  private final @NonNull String topic;
  private final @NonNull Clock clock;

  private final AtomicLong published = new AtomicLong();
  private final AtomicLong failures = new AtomicLong();

  @Override
  public void publish(CopyTradeNotification notification) {
    try {
      Map<String, Object> envelope = new LinkedHashMap<>();
      envelope.put("ts", clock.instant().toString());
      envelope.put("source", SOURCE);
      envelope.put("type", notification.kind().eventType());
      envelope.put("key", notification.key());
      envelope.put("data", notification);

      String json = objectMapper.writeValueAsString(envelope);
      kafkaTemplate.send(topic, notification.key(), json).whenComplete((result, error) -> {
        if (error != null) {
          failures.incrementAndGet();
          log.warn("Failed to publish {} for {}: {}", notification.kind(), notification.userId(), error.toString());
        } else {
          published.incrementAndGet();
        }
      });
    } catch (Exception e) {
      failures.incrementAndGet();
      log.warn("Failed to publish {} for {}: {}", notification.kind(), notification.userId(), e.toString());
    }
  }

  public long published() {
    return published.get();
  }

  public long failures() {
    return failures.get();
  }
}
