package com.acme.fleetlink.api.processing;

import com.acme.fleetlink.api.clusters.ClusterStatusStore;
import com.acme.fleetlink.handler.MessageContext;
import com.acme.fleetlink.handler.MessageProcessor;
import com.acme.fleetlink.message.ClusterNodesMessage;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/** Replaces the node inventory of the sending cluster when the report is newer. */
@Slf4j
@Singleton
public class ClusterNodesProcessor implements MessageProcessor<ClusterNodesMessage> {

  private final ClusterStatusStore store;

  public ClusterNodesProcessor(ClusterStatusStore store) {
    this.store = store;
  }

  @Override
  public Class<ClusterNodesMessage> messageType() {
    return ClusterNodesMessage.class;
  }

  @Override
  public void process(ClusterNodesMessage message, MessageContext context) {
    String clusterId = context.requireSenderId();
    if (store.replaceNodes(clusterId, message.clusterNodes(), message.updatedAt())) {
      log.info("Inventory of {} updated: {} node(s)", clusterId, message.clusterNodes().size());
    }
  }
}
