package com.acme.fleetlink.spi;

/**
 * Publishes a UTF-8 JSON payload to a named queue. Returns only once the broker has accepted the
 * message.
 */
public interface MessagePublisher {
  void publish(String queue, String payload);
}
