package com.acme.fleetlink.mq;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Declares queue topology on a connection opened for the purpose. Used at application startup. */
@Singleton
@Requires(beans = ConnectionFactory.class)
public class QueueTopologyInitializer {
  private static final Logger log = LoggerFactory.getLogger(QueueTopologyInitializer.class);

  private final ConnectionFactory connectionFactory;

  public QueueTopologyInitializer(ConnectionFactory connectionFactory) {
    this.connectionFactory = connectionFactory;
  }

  public void ensureTopology(String... queueNames) {
    Connection connection;
    try {
      connection = connectionFactory.newConnection("fleetlink-topology");
    } catch (IOException | TimeoutException e) {
      throw BrokerErrors.connectivityFailure("Could not connect to broker", e);
    }
    try {
      for (String queueName : queueNames) {
        QueueTopology.ensureTopology(connection, queueName);
      }
      log.info("Queue topology ready for {} queue(s)", queueNames.length);
    } finally {
      Channels.closeQuietly(connection);
    }
  }
}
