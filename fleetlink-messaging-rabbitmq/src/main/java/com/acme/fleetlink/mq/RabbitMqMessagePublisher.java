package com.acme.fleetlink.mq;

import com.acme.fleetlink.config.BrokerConfig;
import com.acme.fleetlink.spi.MessagePublisher;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import io.micronaut.context.annotation.Requires;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * {@link MessagePublisher} over one shared connection, opened on first use and reopened after the
 * broker drops it. Each publish runs on its own short-lived channel under the configured publisher
 * identity.
 */
@Singleton
@Requires(beans = ConnectionFactory.class)
public class RabbitMqMessagePublisher implements MessagePublisher, AutoCloseable {

  private final ConnectionFactory connectionFactory;
  private final RabbitMqPublisher publisher;
  private final String publisherIdentity;
  private Connection connection;

  public RabbitMqMessagePublisher(
      ConnectionFactory connectionFactory, RabbitMqPublisher publisher, BrokerConfig config) {
    this.connectionFactory = connectionFactory;
    this.publisher = publisher;
    this.publisherIdentity = config.getPublisherIdentity();
  }

  @Override
  public void publish(String queue, String payload) {
    publisher.publish(connection(), queue, payload, publisherIdentity);
  }

  private synchronized Connection connection() {
    if (connection == null || !connection.isOpen()) {
      try {
        connection = connectionFactory.newConnection("fleetlink-publisher");
      } catch (IOException | TimeoutException e) {
        throw BrokerErrors.connectivityFailure("Could not connect to broker", e);
      }
    }
    return connection;
  }

  @PreDestroy
  @Override
  public synchronized void close() {
    Channels.closeQuietly(connection);
    connection = null;
  }
}
