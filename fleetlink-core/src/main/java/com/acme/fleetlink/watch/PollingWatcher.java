package com.acme.fleetlink.watch;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a poll task at a fixed delay on its own thread and reports liveness to the
 * {@link WatcherRegistry}. The entry is touched only after a successful attempt, so a poller that
 * keeps failing turns stale.
 */
public class PollingWatcher implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(PollingWatcher.class);

  private final String name;
  private final Runnable task;
  private final Duration interval;
  private final WatcherRegistry registry;
  private ScheduledExecutorService scheduler;

  public PollingWatcher(String name, Runnable task, Duration interval, WatcherRegistry registry) {
    this.name = name;
    this.task = task;
    this.interval = interval;
    this.registry = registry;
  }

  /**
   * Register the watcher and schedule the first attempt immediately.
   *
   * @throws DuplicateWatcherException if a watcher with the same name is registered
   */
  public synchronized void start() {
    if (scheduler != null) {
      throw new IllegalStateException("Watcher already started: " + name);
    }
    registry.register(name);
    scheduler =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r, "watcher-" + name);
              t.setDaemon(true);
              return t;
            });
    scheduler.scheduleWithFixedDelay(
        this::pollOnce, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
    log.info("Started watcher {} with interval {}", name, interval);
  }

  /** One poll attempt. Failures are logged and leave the last attempt untouched. */
  void pollOnce() {
    try {
      task.run();
      registry.touch(name);
    } catch (Exception e) {
      log.error("Watcher {} poll failed", name, e);
    }
  }

  public String getName() {
    return name;
  }

  @Override
  public synchronized void close() {
    if (scheduler == null) {
      return;
    }
    scheduler.shutdownNow();
    try {
      if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Watcher {} did not stop within 5 seconds", name);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    log.info("Stopped watcher {}", name);
  }
}
