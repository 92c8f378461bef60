package com.acme.fleetlink.watch;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last-attempt timestamps of named background watchers. A watcher registers once, then touches its
 * entry after every poll attempt. Pure POJO - no framework dependencies; one instance per process.
 *
 * <p>Operations on different names never block each other. A touch never moves a timestamp
 * backwards, even when two touches for the same name race.
 */
public class WatcherRegistry {
  private static final Logger log = LoggerFactory.getLogger(WatcherRegistry.class);

  private final Map<String, Instant> lastAttempts = new ConcurrentHashMap<>();
  private final Clock clock;

  public WatcherRegistry(Clock clock) {
    this.clock = clock;
  }

  /**
   * Register a watcher with the current time as its last attempt.
   *
   * @throws DuplicateWatcherException if the name is already registered
   */
  public void register(String name) {
    Instant now = clock.instant();
    if (lastAttempts.putIfAbsent(name, now) != null) {
      throw new DuplicateWatcherException(name);
    }
    log.info("Registered watcher {}", name);
  }

  /**
   * Record an attempt of a registered watcher at the current time.
   *
   * @throws WatcherNotRegisteredException if the name was never registered
   */
  public void touch(String name) {
    Instant now = clock.instant();
    Instant updated =
        lastAttempts.computeIfPresent(
            name, (key, previous) -> now.isAfter(previous) ? now : previous);
    if (updated == null) {
      throw new WatcherNotRegisteredException(name);
    }
    log.trace("Touched watcher {} at {}", name, updated);
  }

  public Optional<Instant> lastAttempt(String name) {
    return Optional.ofNullable(lastAttempts.get(name));
  }

  public boolean isRegistered(String name) {
    return lastAttempts.containsKey(name);
  }

  /** Entries sorted by name. Each entry is consistent; the list as a whole is not atomic. */
  public List<WatcherEntry> snapshot() {
    return lastAttempts.entrySet().stream()
        .map(e -> new WatcherEntry(e.getKey(), e.getValue()))
        .sorted(Comparator.comparing(WatcherEntry::name))
        .collect(Collectors.toList());
  }

  /** Drop every entry. Only for test isolation and full restarts. */
  public void clear() {
    lastAttempts.clear();
  }
}
