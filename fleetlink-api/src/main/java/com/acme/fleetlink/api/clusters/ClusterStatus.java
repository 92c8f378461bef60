package com.acme.fleetlink.api.clusters;

import com.acme.fleetlink.message.ClusterNode;
import java.time.Instant;
import java.util.List;

/**
 * Last reported state of one managed cluster, keyed by the broker-authenticated sender id.
 * Heartbeat fields are null until the first heartbeat arrives; inventory fields until the first
 * inventory report.
 */
public record ClusterStatus(
    String clusterId,
    String organizationName,
    String clusterName,
    Instant lastHeartbeatAt,
    List<ClusterNode> nodes,
    Instant nodesUpdatedAt) {

  public ClusterStatus {
    nodes = nodes == null ? List.of() : List.copyOf(nodes);
  }

  static ClusterStatus empty(String clusterId) {
    return new ClusterStatus(clusterId, null, null, null, List.of(), null);
  }

  ClusterStatus withHeartbeat(String organizationName, String clusterName, Instant at) {
    return new ClusterStatus(clusterId, organizationName, clusterName, at, nodes, nodesUpdatedAt);
  }

  ClusterStatus withNodes(List<ClusterNode> newNodes, Instant updatedAt) {
    return new ClusterStatus(
        clusterId, organizationName, clusterName, lastHeartbeatAt, newNodes, updatedAt);
  }
}
