package com.acme.fleetlink.mq;

import com.acme.fleetlink.core.Jsons;
import com.acme.fleetlink.core.PermanentException;
import com.acme.fleetlink.handler.MessageContext;
import com.acme.fleetlink.handler.MessageProcessorRegistry;
import com.acme.fleetlink.message.ClusterMessage;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Delivery;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes deliveries into {@link ClusterMessage}s and routes them through the {@link
 * MessageProcessorRegistry}.
 *
 * <p>Settlement: ack on success; reject without requeue (dead-letter) on permanent failures such as
 * malformed JSON, unknown message types or a missing sender; requeue on anything else. The quorum
 * queue's delivery limit eventually dead-letters a message that keeps failing.
 */
public class MessageDispatchingHandler implements DeliveryHandler {
  private static final Logger log = LoggerFactory.getLogger(MessageDispatchingHandler.class);

  private final String queueName;
  private final MessageProcessorRegistry registry;

  public MessageDispatchingHandler(String queueName, MessageProcessorRegistry registry) {
    this.queueName = queueName;
    this.registry = registry;
  }

  @Override
  public void handle(Channel channel, Delivery delivery) throws IOException {
    long deliveryTag = delivery.getEnvelope().getDeliveryTag();
    AMQP.BasicProperties properties = delivery.getProperties();
    String senderId = properties != null ? properties.getUserId() : null;
    MessageContext context = new MessageContext(senderId, queueName);

    try {
      String body = new String(delivery.getBody(), StandardCharsets.UTF_8);
      ClusterMessage message = Jsons.fromJson(body, ClusterMessage.class);
      registry.process(message, context);
      channel.basicAck(deliveryTag, false);
      log.debug("Processed {} from {} on {}", message.messageType(), senderId, queueName);
    } catch (PermanentException e) {
      log.error(
          "Rejecting delivery {} from {} on {}: {}",
          deliveryTag,
          senderId,
          queueName,
          e.getMessage());
      channel.basicReject(deliveryTag, false);
    } catch (RuntimeException e) {
      log.warn(
          "Processing delivery {} from {} on {} failed, requeueing",
          deliveryTag,
          senderId,
          queueName,
          e);
      channel.basicReject(deliveryTag, true);
    }
  }
}
