package com.acme.fleetlink.mq;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Delivery;
import java.io.IOException;

/**
 * Processes one delivery and settles it on {@code channel} with ack, reject or nack. Invocations on
 * one consumer are sequential.
 */
@FunctionalInterface
public interface DeliveryHandler {
  void handle(Channel channel, Delivery delivery) throws IOException;
}
