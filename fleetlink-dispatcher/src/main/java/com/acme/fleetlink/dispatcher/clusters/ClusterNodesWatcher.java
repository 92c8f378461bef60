package com.acme.fleetlink.dispatcher.clusters;

import com.acme.fleetlink.config.LivenessConfig;
import com.acme.fleetlink.config.MessagingConfig;
import com.acme.fleetlink.core.Jsons;
import com.acme.fleetlink.message.ClusterNode;
import com.acme.fleetlink.message.ClusterNodesMessage;
import com.acme.fleetlink.spi.ClusterInventoryProvider;
import com.acme.fleetlink.spi.MessagePublisher;
import com.acme.fleetlink.watch.PollingWatcher;
import com.acme.fleetlink.watch.WatcherRegistry;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.runtime.server.event.ServerStartupEvent;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Polls the node inventory and reports it to the central service. Runs only when a {@link
 * ClusterInventoryProvider} is available. A poll that fails leaves the watcher untouched, so a
 * broken inventory source eventually fails the liveness probe.
 */
@Slf4j
@Singleton
@Requires(beans = {ClusterInventoryProvider.class, MessagePublisher.class})
public class ClusterNodesWatcher implements ApplicationEventListener<ServerStartupEvent> {

  public static final String WATCHER_NAME = "cluster_nodes_watcher";

  private final ClusterInventoryProvider inventory;
  private final MessagePublisher publisher;
  private final String queueName;
  private final Clock clock;
  private final PollingWatcher watcher;

  public ClusterNodesWatcher(
      ClusterInventoryProvider inventory,
      MessagePublisher publisher,
      WatcherRegistry registry,
      MessagingConfig messagingConfig,
      LivenessConfig livenessConfig,
      Clock clock) {
    this.inventory = inventory;
    this.publisher = publisher;
    this.queueName = messagingConfig.getCommonFeedbackQueue();
    this.clock = clock;
    this.watcher =
        new PollingWatcher(
            WATCHER_NAME,
            this::publishInventory,
            livenessConfig.getInventoryPollInterval(),
            registry);
  }

  @Override
  public void onApplicationEvent(ServerStartupEvent event) {
    watcher.start();
  }

  void publishInventory() {
    List<ClusterNode> nodes = inventory.listNodes();
    publisher.publish(queueName, Jsons.toJson(ClusterNodesMessage.of(nodes, clock.instant())));
    log.debug("Published inventory of {} node(s)", nodes.size());
  }

  @PreDestroy
  public void close() {
    watcher.close();
  }
}
