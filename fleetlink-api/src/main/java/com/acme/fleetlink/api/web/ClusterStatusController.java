package com.acme.fleetlink.api.web;

import com.acme.fleetlink.api.clusters.ClusterStatus;
import com.acme.fleetlink.api.clusters.ClusterStatusStore;
import com.acme.fleetlink.api.config.ClusterStatusConfig;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.PathVariable;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/** Read-only view of the state reported by each cluster. */
@Controller("/v1/clusters")
public class ClusterStatusController {

  private final ClusterStatusStore store;
  private final ClusterStatusConfig config;
  private final Clock clock;

  public ClusterStatusController(
      ClusterStatusStore store, ClusterStatusConfig config, Clock clock) {
    this.store = store;
    this.config = config;
    this.clock = clock;
  }

  @Get("/{clusterId}")
  public HttpResponse<?> getCluster(@PathVariable String clusterId) {
    Optional<ClusterStatus> status = store.find(clusterId);
    if (status.isEmpty()) {
      return HttpResponse.notFound(
          new ErrorResponse("Unknown cluster: " + clusterId, HttpStatus.NOT_FOUND.getCode()));
    }
    return HttpResponse.ok(ClusterStatusResponse.from(status.get(), isStale(status.get())));
  }

  /** A cluster that never sent a heartbeat counts as stale. */
  boolean isStale(ClusterStatus status) {
    Instant last = status.lastHeartbeatAt();
    if (last == null) {
      return true;
    }
    return last.isBefore(clock.instant().minus(config.getHeartbeatTimeout()));
  }
}
