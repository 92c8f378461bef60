package com.acme.fleetlink.message;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A message exchanged between a cluster dispatcher and the central service. The concrete type is
 * selected by the {@code message_type} field of the JSON body.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.EXISTING_PROPERTY,
    property = "message_type",
    visible = true)
@JsonSubTypes({
  @JsonSubTypes.Type(value = HeartbeatMessage.class, name = MessageTypes.HEARTBEAT),
  @JsonSubTypes.Type(value = ClusterNodesMessage.class, name = MessageTypes.CLUSTER_NODES)
})
public interface ClusterMessage {

  @JsonProperty("message_type")
  String messageType();
}
