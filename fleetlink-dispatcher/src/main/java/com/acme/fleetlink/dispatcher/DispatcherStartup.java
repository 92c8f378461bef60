package com.acme.fleetlink.dispatcher;

import com.acme.fleetlink.config.MessagingConfig;
import com.acme.fleetlink.dispatcher.heartbeat.HeartbeatService;
import com.acme.fleetlink.mq.QueueTopologyInitializer;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.runtime.server.event.ServerStartupEvent;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/**
 * Startup sequence: make sure the common feedback queue exists with the expected arguments, then
 * announce this cluster with a first heartbeat. A dispatcher that cannot do either is useless, so
 * any failure stops the process with exit status 1.
 */
@Slf4j
@Singleton
@Requires(beans = QueueTopologyInitializer.class)
public class DispatcherStartup implements ApplicationEventListener<ServerStartupEvent> {

  private final QueueTopologyInitializer topology;
  private final HeartbeatService heartbeatService;
  private final MessagingConfig messagingConfig;

  public DispatcherStartup(
      QueueTopologyInitializer topology,
      HeartbeatService heartbeatService,
      MessagingConfig messagingConfig) {
    this.topology = topology;
    this.heartbeatService = heartbeatService;
    this.messagingConfig = messagingConfig;
  }

  @Override
  public void onApplicationEvent(ServerStartupEvent event) {
    try {
      if (messagingConfig.isDeclareTopology()) {
        topology.ensureTopology(messagingConfig.getCommonFeedbackQueue());
      }
      heartbeatService.publishHeartbeat();
      log.info("Dispatcher started, initial heartbeat published");
    } catch (RuntimeException e) {
      log.error("Dispatcher startup failed: {}", e.getMessage(), e);
      exitApplication(1);
    }
  }

  /** Exit the JVM. Overridden in tests. */
  protected void exitApplication(int status) {
    System.exit(status);
  }
}
