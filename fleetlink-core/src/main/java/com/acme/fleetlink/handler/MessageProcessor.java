package com.acme.fleetlink.handler;

import com.acme.fleetlink.message.ClusterMessage;

/** Applies one type of inbound cluster message. */
public interface MessageProcessor<T extends ClusterMessage> {

  Class<T> messageType();

  void process(T message, MessageContext context);
}
