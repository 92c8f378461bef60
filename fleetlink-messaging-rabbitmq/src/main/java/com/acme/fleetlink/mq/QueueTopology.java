package com.acme.fleetlink.mq;

import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownSignalException;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Declares the dead-letter topology and application queues. Every application queue is a durable
 * quorum queue that dead-letters to {@value #DLX_EXCHANGE} under {@value #DLX_ROUTING_KEY}.
 *
 * <p>Declarations are idempotent. A queue that already exists with different arguments makes the
 * broker close the channel with 406, which surfaces as a {@link
 * com.acme.fleetlink.core.QueueTopologyException}; existing queues are never modified or deleted.
 */
public final class QueueTopology {
  private static final Logger log = LoggerFactory.getLogger(QueueTopology.class);

  public static final String DLX_EXCHANGE = "dlx_exchange";
  public static final String DLX_QUEUE = "dlx_queue";
  public static final String DLX_ROUTING_KEY = "dlx_key";

  public static final String QUEUE_TYPE_ARG = "x-queue-type";
  public static final String DEAD_LETTER_EXCHANGE_ARG = "x-dead-letter-exchange";
  public static final String DEAD_LETTER_ROUTING_KEY_ARG = "x-dead-letter-routing-key";

  private QueueTopology() {}

  /** Arguments every application queue is declared with. */
  public static Map<String, Object> queueArguments() {
    return Map.of(
        QUEUE_TYPE_ARG, "quorum",
        DEAD_LETTER_EXCHANGE_ARG, DLX_EXCHANGE,
        DEAD_LETTER_ROUTING_KEY_ARG, DLX_ROUTING_KEY);
  }

  public static void ensureTopology(Channel channel, String queueName) {
    try {
      channel.exchangeDeclare(DLX_EXCHANGE, BuiltinExchangeType.DIRECT, true);
      channel.queueDeclare(DLX_QUEUE, true, false, false, null);
      channel.queueBind(DLX_QUEUE, DLX_EXCHANGE, DLX_ROUTING_KEY);
      channel.queueDeclare(queueName, true, false, false, queueArguments());
    } catch (IOException | ShutdownSignalException e) {
      throw BrokerErrors.topologyFailure(queueName, e);
    }
    log.info("Ensured topology for queue {}", queueName);
  }

  /** Same as {@link #ensureTopology(Channel, String)} on a channel opened for this call. */
  public static void ensureTopology(Connection connection, String queueName) {
    Channel channel;
    try {
      channel = connection.createChannel();
    } catch (IOException | ShutdownSignalException e) {
      throw BrokerErrors.connectivityFailure("Could not open channel", e);
    }
    try {
      ensureTopology(channel, queueName);
    } finally {
      Channels.closeQuietly(channel);
    }
  }
}
