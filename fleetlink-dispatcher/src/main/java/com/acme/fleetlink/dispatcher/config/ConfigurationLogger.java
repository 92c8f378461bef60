package com.acme.fleetlink.dispatcher.config;

import com.acme.fleetlink.config.BrokerConfig;
import com.acme.fleetlink.config.LivenessConfig;
import com.acme.fleetlink.config.MessagingConfig;
import com.acme.fleetlink.spi.ClusterIdentityProvider;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.runtime.server.event.ServerStartupEvent;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/**
 * Logs effective configuration on application startup. Credentials are never logged. Disabled in
 * test environment.
 */
@Slf4j
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<ServerStartupEvent> {

  private final BrokerConfig brokerConfig;
  private final MessagingConfig messagingConfig;
  private final LivenessConfig livenessConfig;
  private final ClusterIdentityProvider identity;

  public ConfigurationLogger(
      BrokerConfig brokerConfig,
      MessagingConfig messagingConfig,
      LivenessConfig livenessConfig,
      ClusterIdentityProvider identity) {
    this.brokerConfig = brokerConfig;
    this.messagingConfig = messagingConfig;
    this.livenessConfig = livenessConfig;
    this.identity = identity;
  }

  @Override
  public void onApplicationEvent(ServerStartupEvent event) {
    log.info("━━━ Dispatcher Configuration ━━━");
    log.info("  Organization:       {}", identity.organizationName());
    log.info("  Cluster:            {}", identity.clusterName());
    log.info("  Broker:             {}", brokerConfig.describeEndpoint());
    log.info(
        "  Publisher Identity: {} (AMQP user-id of every message)",
        brokerConfig.getPublisherIdentity());
    log.info("  Confirm Timeout:    {}", brokerConfig.getConfirmTimeout());
    log.info("  Feedback Queue:     {}", messagingConfig.getCommonFeedbackQueue());
    log.info("  Declare Topology:   {}", messagingConfig.isDeclareTopology());
    log.info("  Heartbeat Interval: {}", livenessConfig.getHeartbeatInterval());
    log.info("  Inventory Poll:     {}", livenessConfig.getInventoryPollInterval());
    log.info(
        "  Staleness:          {} (watchers older than this fail /v1/health)",
        livenessConfig.getStalenessThreshold());
  }
}
