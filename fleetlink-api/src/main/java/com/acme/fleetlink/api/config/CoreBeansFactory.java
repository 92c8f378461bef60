package com.acme.fleetlink.api.config;

import com.acme.fleetlink.config.MessagingConfig;
import com.acme.fleetlink.handler.MessageProcessor;
import com.acme.fleetlink.handler.MessageProcessorRegistry;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.List;

/** Factory for creating core beans with framework-specific configuration. */
@Factory
public class CoreBeansFactory {

  /** Creates MessagingConfig bean populated from application.yml messaging.* properties */
  @Singleton
  @ConfigurationProperties("messaging")
  public MessagingConfig messagingConfig() {
    return new MessagingConfig();
  }

  /** Creates ClusterStatusConfig bean populated from application.yml clusters.* properties */
  @Singleton
  @ConfigurationProperties("clusters")
  public ClusterStatusConfig clusterStatusConfig() {
    return new ClusterStatusConfig();
  }

  @Singleton
  public Clock clock() {
    return Clock.systemUTC();
  }

  /**
   * Every {@link MessageProcessor} bean, keyed by the message type it handles. Two processors for
   * the same type fail context startup.
   */
  @Singleton
  public MessageProcessorRegistry messageProcessorRegistry(List<MessageProcessor<?>> processors) {
    return new MessageProcessorRegistry(processors);
  }
}
