package com.acme.fleetlink.dispatcher.config;

import com.acme.fleetlink.config.ClusterIdentityConfig;
import com.acme.fleetlink.config.LivenessConfig;
import com.acme.fleetlink.config.MessagingConfig;
import com.acme.fleetlink.watch.LivenessEvaluator;
import com.acme.fleetlink.watch.WatcherRegistry;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;
import java.time.Clock;

/**
 * Factory for creating core beans with framework-specific configuration.
 *
 * <p>The core module stays free of framework dependencies; this module does the DI wiring. The
 * watcher registry is created exactly once per application context.
 */
@Factory
public class CoreBeansFactory {

  /** Creates MessagingConfig bean populated from application.yml messaging.* properties */
  @Singleton
  @ConfigurationProperties("messaging")
  public MessagingConfig messagingConfig() {
    return new MessagingConfig();
  }

  /** Creates LivenessConfig bean populated from application.yml liveness.* properties */
  @Singleton
  @ConfigurationProperties("liveness")
  public LivenessConfig livenessConfig() {
    return new LivenessConfig();
  }

  /** Creates ClusterIdentityConfig bean populated from application.yml cluster.* properties */
  @Singleton
  @ConfigurationProperties("cluster")
  public ClusterIdentityConfig clusterIdentityConfig() {
    return new ClusterIdentityConfig();
  }

  @Singleton
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Singleton
  public WatcherRegistry watcherRegistry(Clock clock) {
    return new WatcherRegistry(clock);
  }

  @Singleton
  public LivenessEvaluator livenessEvaluator(
      WatcherRegistry registry, Clock clock, LivenessConfig livenessConfig) {
    return new LivenessEvaluator(registry, clock, livenessConfig.getStalenessThreshold());
  }
}
