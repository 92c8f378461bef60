package com.acme.fleetlink.api.web;

import com.acme.fleetlink.api.clusters.ClusterStatus;
import com.acme.fleetlink.message.ClusterNode;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

/** Cluster status as served over HTTP. */
public record ClusterStatusResponse(
    @JsonProperty("cluster_id") String clusterId,
    @JsonProperty("organization_name") String organizationName,
    @JsonProperty("cluster_name") String clusterName,
    @JsonProperty("last_heartbeat_at") Instant lastHeartbeatAt,
    @JsonProperty("stale") boolean stale,
    @JsonProperty("cluster_nodes") List<ClusterNode> clusterNodes,
    @JsonProperty("nodes_updated_at") Instant nodesUpdatedAt) {

  static ClusterStatusResponse from(ClusterStatus status, boolean stale) {
    return new ClusterStatusResponse(
        status.clusterId(),
        status.organizationName(),
        status.clusterName(),
        status.lastHeartbeatAt(),
        stale,
        status.nodes(),
        status.nodesUpdatedAt());
  }
}
