package com.polycopy.notify;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test sink that keeps every notification.
 */
public class RecordingNotificationSink implements NotificationSink {

  private final List<CopyTradeNotification> published = new CopyOnWriteArrayList<>();

  @Override
  public void publish(CopyTradeNotification notification) {
    published.add(notification);
  }

  public List<CopyTradeNotification> published() {
    return published;
  }

  public List<CopyTradeNotification> ofKind(CopyTradeNotification.Kind kind) {
    return published.stream().filter(n -> n.kind() == kind).toList();
  }
}
