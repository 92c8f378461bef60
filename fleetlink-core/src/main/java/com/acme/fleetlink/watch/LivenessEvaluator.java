package com.acme.fleetlink.watch;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aggregate health verdict over every registered watcher. A watcher is stale when its last attempt
 * is strictly older than {@code now - threshold}; an attempt exactly at the boundary is healthy.
 * With no registered watchers the verdict is healthy.
 */
public class LivenessEvaluator {
  private static final Logger log = LoggerFactory.getLogger(LivenessEvaluator.class);

  private final WatcherRegistry registry;
  private final Clock clock;
  private final Duration defaultThreshold;

  public LivenessEvaluator(WatcherRegistry registry, Clock clock, Duration defaultThreshold) {
    this.registry = registry;
    this.clock = clock;
    this.defaultThreshold = requireValid(defaultThreshold);
  }

  private static Duration requireValid(Duration threshold) {
    if (threshold == null || threshold.isNegative()) {
      throw new IllegalArgumentException("Staleness threshold must be non-negative: " + threshold);
    }
    return threshold;
  }

  public boolean allHealthy() {
    return allHealthy(defaultThreshold);
  }

  public boolean allHealthy(Duration threshold) {
    List<WatcherEntry> stale = staleWatchers(threshold);
    if (stale.isEmpty()) {
      return true;
    }
    for (WatcherEntry entry : stale) {
      log.warn(
          "Watcher {} is stale: last attempt at {}, threshold {}",
          entry.name(),
          entry.lastAttempt(),
          threshold);
    }
    return false;
  }

  /**
   * Watchers whose last attempt is older than {@code threshold}.
   *
   * @throws IllegalArgumentException if the threshold is null or negative
   */
  public List<WatcherEntry> staleWatchers(Duration threshold) {
    Instant cutoff = clock.instant().minus(requireValid(threshold));
    return registry.snapshot().stream()
        .filter(entry -> entry.lastAttempt().isBefore(cutoff))
        .collect(Collectors.toList());
  }

  public Duration getDefaultThreshold() {
    return defaultThreshold;
  }
}
