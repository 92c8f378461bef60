package com.acme.fleetlink.mq;

import com.acme.fleetlink.config.BrokerConfig;
import com.rabbitmq.client.ConnectionFactory;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Broker wiring. The connection factory is not created in the {@code test} environment, so tests
 * supply their own or run without a broker.
 */
@Factory
public class RabbitMqFactoryProvider {
  private static final Logger log = LoggerFactory.getLogger(RabbitMqFactoryProvider.class);

  /** Creates BrokerConfig bean populated from application.yml broker.* properties */
  @Singleton
  @ConfigurationProperties("broker")
  public BrokerConfig brokerConfig() {
    return new BrokerConfig();
  }

  @Singleton
  @Requires(notEnv = "test")
  public ConnectionFactory rabbitConnectionFactory(BrokerConfig config) {
    ConnectionFactory cf = new ConnectionFactory();
    cf.setHost(config.getHost());
    cf.setPort(config.getPort());
    cf.setVirtualHost(config.getVirtualHost());
    cf.setUsername(config.getUsername());
    cf.setPassword(config.getPassword());
    cf.setConnectionTimeout(config.getConnectionTimeoutMillis());
    // Consumer loops and the publisher reconnect themselves
    cf.setAutomaticRecoveryEnabled(false);
    log.info(
        "RabbitMQ connection factory for {} as {}",
        config.describeEndpoint(),
        config.getUsername());
    return cf;
  }

  @Singleton
  public RabbitMqPublisher rabbitMqPublisher(BrokerConfig config) {
    return new RabbitMqPublisher(config.getConfirmTimeout());
  }
}
