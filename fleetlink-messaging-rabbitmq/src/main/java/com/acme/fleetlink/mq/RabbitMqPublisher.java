package com.acme.fleetlink.mq;

import com.acme.fleetlink.core.BrokerConnectivityException;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownSignalException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes persistent messages through the default exchange, using the queue name as routing
 * key. The claimed identity travels in the AMQP {@code user-id} property, which the broker checks
 * against the authenticated user before accepting the message.
 *
 * <p>Channels are put into confirm mode and {@code publish} returns only once the broker has
 * confirmed the message, or fails.
 */
public class RabbitMqPublisher {
  private static final Logger log = LoggerFactory.getLogger(RabbitMqPublisher.class);

  static final String DEFAULT_EXCHANGE = "";
  static final int PERSISTENT_DELIVERY_MODE = 2;

  private final Duration confirmTimeout;

  public RabbitMqPublisher(Duration confirmTimeout) {
    this.confirmTimeout = confirmTimeout;
  }

  /** Publish on a channel opened for this call and closed afterwards. */
  public void publish(
      Connection connection, String queueName, String body, String claimedIdentity) {
    Channel channel;
    try {
      channel = connection.createChannel();
    } catch (IOException | ShutdownSignalException e) {
      throw BrokerErrors.connectivityFailure("Could not open channel", e);
    }
    try {
      publish(channel, queueName, body, claimedIdentity);
    } finally {
      Channels.closeQuietly(channel);
    }
  }

  /**
   * Publish on a caller-owned channel. After a successful publish the channel stays open. After a
   * nack or a confirm timeout the client closes the channel itself, and a broker error closes it
   * too, so after any {@link com.acme.fleetlink.core.PermanentException} or {@link
   * BrokerConnectivityException} the caller must open a new channel.
   */
  public void publish(Channel channel, String queueName, String body, String claimedIdentity) {
    AMQP.BasicProperties properties =
        new AMQP.BasicProperties.Builder()
            .deliveryMode(PERSISTENT_DELIVERY_MODE)
            .userId(claimedIdentity)
            .build();
    try {
      channel.confirmSelect();
      channel.basicPublish(
          DEFAULT_EXCHANGE, queueName, properties, body.getBytes(StandardCharsets.UTF_8));
      channel.waitForConfirmsOrDie(confirmTimeout.toMillis());
    } catch (IOException | ShutdownSignalException e) {
      throw BrokerErrors.publishFailure(queueName, claimedIdentity, e);
    } catch (TimeoutException e) {
      throw new BrokerConnectivityException(
          "Broker did not confirm publish to " + queueName + " within " + confirmTimeout, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BrokerConnectivityException(
          "Interrupted while waiting for publish confirm on " + queueName, e);
    }
    log.debug("Published message to {} as {}", queueName, claimedIdentity);
  }

  public Duration getConfirmTimeout() {
    return confirmTimeout;
  }
}
