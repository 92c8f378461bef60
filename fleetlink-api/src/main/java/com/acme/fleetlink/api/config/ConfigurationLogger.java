package com.acme.fleetlink.api.config;

import com.acme.fleetlink.config.BrokerConfig;
import com.acme.fleetlink.config.MessagingConfig;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.runtime.server.event.ServerStartupEvent;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/** Logs the effective configuration once the server is up. Credentials are never logged. */
@Slf4j
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<ServerStartupEvent> {

  private final BrokerConfig brokerConfig;
  private final MessagingConfig messagingConfig;
  private final ClusterStatusConfig clusterStatusConfig;

  public ConfigurationLogger(
      BrokerConfig brokerConfig,
      MessagingConfig messagingConfig,
      ClusterStatusConfig clusterStatusConfig) {
    this.brokerConfig = brokerConfig;
    this.messagingConfig = messagingConfig;
    this.clusterStatusConfig = clusterStatusConfig;
  }

  @Override
  public void onApplicationEvent(ServerStartupEvent event) {
    log.info("━━━ API Configuration ━━━");
    log.info("  Broker:             {}", brokerConfig.describeEndpoint());
    log.info("  Feedback Queue:     {}", messagingConfig.getCommonFeedbackQueue());
    log.info("  Declare Topology:   {}", messagingConfig.isDeclareTopology());
    log.info("  Restart Delay:      {}", messagingConfig.getConsumerRestartDelay());
    log.info("  Heartbeat Timeout:  {}", clusterStatusConfig.getHeartbeatTimeout());
  }
}
