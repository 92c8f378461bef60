package com.acme.fleetlink.api.clusters;

import com.acme.fleetlink.message.ClusterNode;
import jakarta.inject.Singleton;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory cluster state. Updates are applied with {@link Map#compute} so concurrent reports for
 * the same cluster never interleave. Out-of-order reports never move a timestamp backwards.
 */
@Slf4j
@Singleton
public class ClusterStatusStore {

  private final Map<String, ClusterStatus> clusters = new ConcurrentHashMap<>();

  public ClusterStatus recordHeartbeat(
      String clusterId, String organizationName, String clusterName, Instant heartbeatAt) {
    return clusters.compute(
        clusterId,
        (id, current) -> {
          ClusterStatus status = current != null ? current : ClusterStatus.empty(id);
          if (status.lastHeartbeatAt() != null && heartbeatAt.isBefore(status.lastHeartbeatAt())) {
            log.debug("Ignoring out-of-order heartbeat from {} at {}", id, heartbeatAt);
            return status;
          }
          return status.withHeartbeat(organizationName, clusterName, heartbeatAt);
        });
  }

  /**
   * Replace the inventory of a cluster unless the stored one is at least as recent.
   *
   * @return true if the inventory was replaced
   */
  public boolean replaceNodes(String clusterId, List<ClusterNode> nodes, Instant updatedAt) {
    boolean[] replaced = {false};
    clusters.compute(
        clusterId,
        (id, current) -> {
          ClusterStatus status = current != null ? current : ClusterStatus.empty(id);
          if (status.nodesUpdatedAt() != null && !updatedAt.isAfter(status.nodesUpdatedAt())) {
            return status;
          }
          replaced[0] = true;
          return status.withNodes(nodes, updatedAt);
        });
    if (!replaced[0]) {
      log.debug("Ignoring stale inventory from {} updated at {}", clusterId, updatedAt);
    }
    return replaced[0];
  }

  public Optional<ClusterStatus> find(String clusterId) {
    return Optional.ofNullable(clusters.get(clusterId));
  }

  public Collection<ClusterStatus> all() {
    return List.copyOf(clusters.values());
  }
}
