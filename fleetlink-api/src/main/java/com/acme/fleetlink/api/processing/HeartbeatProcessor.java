package com.acme.fleetlink.api.processing;

import com.acme.fleetlink.api.clusters.ClusterStatusStore;
import com.acme.fleetlink.handler.MessageContext;
import com.acme.fleetlink.handler.MessageProcessor;
import com.acme.fleetlink.message.HeartbeatMessage;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/** Records the heartbeat of the sending cluster. */
@Slf4j
@Singleton
public class HeartbeatProcessor implements MessageProcessor<HeartbeatMessage> {

  private final ClusterStatusStore store;

  public HeartbeatProcessor(ClusterStatusStore store) {
    this.store = store;
  }

  @Override
  public Class<HeartbeatMessage> messageType() {
    return HeartbeatMessage.class;
  }

  @Override
  public void process(HeartbeatMessage message, MessageContext context) {
    String clusterId = context.requireSenderId();
    store.recordHeartbeat(
        clusterId,
        message.organizationName(),
        message.clusterName(),
        message.lastHeartbeatAt());
    log.debug(
        "Heartbeat from {} ({}/{}) at {}",
        clusterId,
        message.organizationName(),
        message.clusterName(),
        message.lastHeartbeatAt());
  }
}
