package com.acme.fleetlink.handler;

import com.acme.fleetlink.core.MessageFormatException;

/**
 * Delivery metadata handed to a {@link MessageProcessor}.
 *
 * @param senderId identity the broker authenticated for the publisher (AMQP {@code user-id}), may
 *     be null when the publisher did not set it
 * @param queueName queue the message was consumed from
 */
public record MessageContext(String senderId, String queueName) {

  /**
   * The sender id, for processors that attribute state to the publishing cluster.
   *
   * @throws MessageFormatException if the message carried no sender id
   */
  public String requireSenderId() {
    if (senderId == null || senderId.isBlank()) {
      throw new MessageFormatException("Message on " + queueName + " has no sender id", null);
    }
    return senderId;
  }
}
