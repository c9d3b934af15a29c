package com.polycopy.common.concurrent;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs tasks on a shared pool while keeping tasks with the same key strictly sequential, in submission order.
 * Different keys proceed in parallel. A failing task is logged and does not stop its lane.
 */
@Slf4j
public class KeyedSerialExecutor implements AutoCloseable {

  private final String name;
  private final ExecutorService pool;
  private final Map<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

  private volatile boolean closed;

  public KeyedSerialExecutor(String name, int threads) {
    this.name = Objects.requireNonNull(name, "name");
    this.pool = Executors.newFixedThreadPool(Math.max(1, threads), namedDaemonFactory(name));
  }

  public CompletableFuture<Void> submit(String key, Runnable task) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(task, "task");
    if (closed) {
      throw new RejectedExecutionException(name + " executor is shut down");
    }
    AtomicReference<CompletableFuture<Void>> next = new AtomicReference<>();
    tails.compute(key, (k, tail) -> {
      CompletableFuture<Void> previous = tail == null ? CompletableFuture.completedFuture(null) : tail;
      next.set(previous.thenRunAsync(() -> runSafely(key, task), pool));
      return next.get();
    });
    CompletableFuture<Void> submitted = next.get();
    submitted.whenComplete((ignored, error) -> tails.remove(key, submitted));
    return submitted;
  }

  public int activeLanes() {
    return tails.size();
  }

  /**
   * Stops accepting work, waits up to {@code timeoutMillis} for every lane to drain, then stops the pool.
   */
  public void shutdown(long timeoutMillis) {
    closed = true;
    long deadline = System.currentTimeMillis() + timeoutMillis;
    CompletableFuture<?>[] pending = tails.values().toArray(new CompletableFuture[0]);
    try {
      CompletableFuture.allOf(pending).get(timeoutMillis, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      log.warn("{} executor did not drain within {}ms, {} lanes still queued", name, timeoutMillis, tails.size());
    } catch (ExecutionException e) {
      log.warn("{} executor lane ended abnormally: {}", name, e.getCause().toString());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    pool.shutdown();
    try {
      long remaining = Math.max(0, deadline - System.currentTimeMillis());
      if (!pool.awaitTermination(remaining, TimeUnit.MILLISECONDS)) {
        pool.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      pool.shutdownNow();
    }
  }

  @Override
  public void close() {
    shutdown(5_000);
  }

  private void runSafely(String key, Runnable task) {
    try {
      task.run();
    } catch (Exception e) {
      log.warn("{} task for {} failed: {}", name, key, e.toString());
    }
  }

  private static ThreadFactory namedDaemonFactory(String name) {
    AtomicInteger seq = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, name + "-" + seq.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
