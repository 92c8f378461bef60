package com.acme.fleetlink.config;

import java.time.Duration;

/**
 * Staleness threshold and polling intervals for watched background tasks. Pure POJO - no
 * framework dependencies.
 *
 * <p>Every interval must stay well below the staleness threshold, otherwise a healthy watcher is
 * reported as stale between two attempts.
 */
public class LivenessConfig {

  public static final Duration DEFAULT_STALENESS_THRESHOLD = Duration.ofMinutes(5);

  private Duration stalenessThreshold = DEFAULT_STALENESS_THRESHOLD;
  private Duration heartbeatInterval = Duration.ofSeconds(30);
  private Duration inventoryPollInterval = Duration.ofSeconds(60);

  public Duration getStalenessThreshold() {
    return stalenessThreshold;
  }

  public void setStalenessThreshold(Duration stalenessThreshold) {
    this.stalenessThreshold = stalenessThreshold;
  }

  public Duration getHeartbeatInterval() {
    return heartbeatInterval;
  }

  public void setHeartbeatInterval(Duration heartbeatInterval) {
    this.heartbeatInterval = heartbeatInterval;
  }

  public Duration getInventoryPollInterval() {
    return inventoryPollInterval;
  }

  public void setInventoryPollInterval(Duration inventoryPollInterval) {
    this.inventoryPollInterval = inventoryPollInterval;
  }
}
