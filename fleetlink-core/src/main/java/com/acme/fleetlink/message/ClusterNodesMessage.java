package com.acme.fleetlink.message;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/** Full node inventory of one cluster at {@code updatedAt}. An empty list is a valid report. */
public record ClusterNodesMessage(
    @JsonProperty("message_type") String messageType,
    @JsonProperty("cluster_nodes") List<ClusterNode> clusterNodes,
    @JsonProperty("updated_at") Instant updatedAt)
    implements ClusterMessage {

  public ClusterNodesMessage {
    if (!MessageTypes.CLUSTER_NODES.equals(messageType)) {
      throw new IllegalArgumentException(
          "Unexpected message_type for cluster nodes: " + messageType);
    }
    Objects.requireNonNull(clusterNodes, "cluster_nodes");
    Objects.requireNonNull(updatedAt, "updated_at");
    clusterNodes = List.copyOf(clusterNodes);
  }

  public static ClusterNodesMessage of(List<ClusterNode> clusterNodes, Instant updatedAt) {
    return new ClusterNodesMessage(MessageTypes.CLUSTER_NODES, clusterNodes, updatedAt);
  }
}
