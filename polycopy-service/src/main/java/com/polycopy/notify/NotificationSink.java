package com.polycopy.notify;

/**
 * Outbound channel for copy-trade outcomes. Implementations must not throw; a lost notification never
 * affects execution or accrual.
 */
public interface NotificationSink {

  void publish(CopyTradeNotification notification);
}
