package com.acme.fleetlink.dispatcher.heartbeat;

import com.acme.fleetlink.config.MessagingConfig;
import com.acme.fleetlink.core.Jsons;
import com.acme.fleetlink.message.HeartbeatMessage;
import com.acme.fleetlink.spi.ClusterIdentityProvider;
import com.acme.fleetlink.spi.MessagePublisher;
import com.acme.fleetlink.watch.WatcherRegistry;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;

/**
 * Publishes this cluster's heartbeat to the common feedback queue. The {@value #WATCHER_NAME}
 * watcher is touched after every attempt, successful or not: it tracks that the heartbeat driver is
 * alive, while broker trouble shows up in the logs and as missing heartbeats centrally.
 */
@Slf4j
@Singleton
public class HeartbeatService {

  public static final String WATCHER_NAME = "heartbeat_publisher";

  private final ClusterIdentityProvider identity;
  private final MessagePublisher publisher;
  private final WatcherRegistry registry;
  private final String queueName;
  private final Clock clock;

  public HeartbeatService(
      ClusterIdentityProvider identity,
      MessagePublisher publisher,
      WatcherRegistry registry,
      MessagingConfig messagingConfig,
      Clock clock) {
    this.identity = identity;
    this.publisher = publisher;
    this.registry = registry;
    this.queueName = messagingConfig.getCommonFeedbackQueue();
    this.clock = clock;
    registry.register(WATCHER_NAME);
  }

  public HeartbeatMessage buildHeartbeat() {
    return HeartbeatMessage.of(
        clock.instant(), identity.clusterName(), identity.organizationName());
  }

  /**
   * Build and publish one heartbeat.
   *
   * @return the heartbeat the broker confirmed
   */
  public HeartbeatMessage publishHeartbeat() {
    try {
      HeartbeatMessage heartbeat = buildHeartbeat();
      publisher.publish(queueName, Jsons.toJson(heartbeat));
      log.debug(
          "Published heartbeat for {}/{}", heartbeat.organizationName(), heartbeat.clusterName());
      return heartbeat;
    } finally {
      registry.touch(WATCHER_NAME);
    }
  }

  @Scheduled(
      fixedDelay = "${liveness.heartbeat-interval:30s}",
      initialDelay = "${liveness.heartbeat-interval:30s}")
  public void tick() {
    try {
      publishHeartbeat();
    } catch (Exception e) {
      log.error("Error in heartbeat tick: {}", e.getMessage(), e);
    }
  }
}
