package com.polycopy.copytrade.session;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Starts the session once the application is ready and stops it on shutdown.
 */
@Slf4j
@RequiredArgsConstructor
public class PollerSessionStarter {

  private final @NonNull PollerSession session;
  private final boolean enabled;

  private final AtomicBoolean initOnce = new AtomicBoolean(false);

  @EventListener(ApplicationReadyEvent.class)
  public void onReady() {
    if (!initOnce.compareAndSet(false, true)) {
      return;
    }
    if (!enabled) {
      log.info("Copy-trade poller disabled (copytrade.poller.enabled=false)");
      return;
    }
    session.start();
  }

  public void shutdown() {
    session.stop(Duration.ofSeconds(10));
  }
}
