package com.acme.fleetlink.api.config;

import java.time.Duration;

/** Settings for reporting cluster status. Pure POJO - no framework dependencies. */
public class ClusterStatusConfig {

  private Duration heartbeatTimeout = Duration.ofMinutes(5);

  /** A cluster whose last heartbeat is older than this is reported as stale. */
  public Duration getHeartbeatTimeout() {
    return heartbeatTimeout;
  }

  public void setHeartbeatTimeout(Duration heartbeatTimeout) {
    this.heartbeatTimeout = heartbeatTimeout;
  }
}
