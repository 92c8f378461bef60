package com.acme.fleetlink.mq;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownSignalException;
import java.io.IOException;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Release helpers. A channel or connection the broker already closed needs no release. */
final class Channels {
  private static final Logger log = LoggerFactory.getLogger(Channels.class);

  private Channels() {}

  static void closeQuietly(Channel channel) {
    if (channel == null || !channel.isOpen()) {
      return;
    }
    try {
      channel.close();
    } catch (IOException | TimeoutException | ShutdownSignalException e) {
      log.warn("Failed to close channel {}: {}", channel.getChannelNumber(), e.getMessage());
    }
  }

  static void closeQuietly(Connection connection) {
    if (connection == null || !connection.isOpen()) {
      return;
    }
    try {
      connection.close();
    } catch (IOException | ShutdownSignalException e) {
      log.warn("Failed to close connection: {}", e.getMessage());
    }
  }
}
