package com.acme.fleetlink.message;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Objects;
import java.util.regex.Pattern;

/** Periodic announcement that a cluster's dispatcher is alive. */
public record HeartbeatMessage(
    @JsonProperty("message_type") String messageType,
    @JsonProperty("last_heartbeat_at") Instant lastHeartbeatAt,
    @JsonProperty("cluster_name") String clusterName,
    @JsonProperty("organization_name") String organizationName)
    implements ClusterMessage {

  private static final Pattern CLUSTER_NAME = Pattern.compile("^[0-9A-Za-z-_]+$");

  public HeartbeatMessage {
    if (!MessageTypes.HEARTBEAT.equals(messageType)) {
      throw new IllegalArgumentException("Unexpected message_type for heartbeat: " + messageType);
    }
    Objects.requireNonNull(lastHeartbeatAt, "last_heartbeat_at");
    Objects.requireNonNull(organizationName, "organization_name");
    if (clusterName == null || !CLUSTER_NAME.matcher(clusterName).matches()) {
      throw new IllegalArgumentException("Invalid cluster_name: " + clusterName);
    }
  }

  public static HeartbeatMessage of(
      Instant lastHeartbeatAt, String clusterName, String organizationName) {
    return new HeartbeatMessage(
        MessageTypes.HEARTBEAT, lastHeartbeatAt, clusterName, organizationName);
  }
}
