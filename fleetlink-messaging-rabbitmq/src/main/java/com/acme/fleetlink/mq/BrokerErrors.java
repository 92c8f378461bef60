package com.acme.fleetlink.mq;

import com.acme.fleetlink.core.BrokerConnectivityException;
import com.acme.fleetlink.core.PublisherIdentityMismatchException;
import com.acme.fleetlink.core.QueueTopologyException;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.ShutdownSignalException;
import java.util.Optional;

/**
 * Maps RabbitMQ client failures onto the fleetlink exception taxonomy. Channel-level errors reach
 * the client as a {@link ShutdownSignalException} somewhere in the cause chain, carrying the
 * broker's {@code channel.close} reply code and text.
 */
final class BrokerErrors {

  private BrokerErrors() {}

  /** The broker's channel close frame behind {@code failure}, if any. */
  static Optional<AMQP.Channel.Close> channelClose(Throwable failure) {
    for (Throwable t = failure; t != null; t = t.getCause()) {
      if (t instanceof ShutdownSignalException) {
        Method reason = ((ShutdownSignalException) t).getReason();
        if (reason instanceof AMQP.Channel.Close) {
          return Optional.of((AMQP.Channel.Close) reason);
        }
      }
    }
    return Optional.empty();
  }

  static boolean isIdentityMismatch(Throwable failure) {
    return channelClose(failure)
        .filter(close -> close.getReplyCode() == AMQP.PRECONDITION_FAILED)
        .filter(close -> close.getReplyText() != null && close.getReplyText().contains("user_id"))
        .isPresent();
  }

  static boolean isTopologyMismatch(Throwable failure) {
    return channelClose(failure)
        .filter(
            close ->
                close.getReplyCode() == AMQP.PRECONDITION_FAILED
                    || close.getReplyCode() == AMQP.NOT_FOUND)
        .isPresent();
  }

  /** Failure while declaring or resolving {@code queueName}. */
  static RuntimeException topologyFailure(String queueName, Throwable failure) {
    if (isTopologyMismatch(failure)) {
      return new QueueTopologyException(queueName, describe(failure), failure);
    }
    return connectivityFailure("Broker unavailable while preparing queue " + queueName, failure);
  }

  /** Failure while publishing to {@code queueName} as {@code claimedIdentity}. */
  static RuntimeException publishFailure(
      String queueName, String claimedIdentity, Throwable failure) {
    if (isIdentityMismatch(failure)) {
      return new PublisherIdentityMismatchException(
          queueName, claimedIdentity, describe(failure), failure);
    }
    return connectivityFailure("Publish to " + queueName + " failed", failure);
  }

  static BrokerConnectivityException connectivityFailure(String context, Throwable failure) {
    return new BrokerConnectivityException(context + ": " + describe(failure), failure);
  }

  static String describe(Throwable failure) {
    return channelClose(failure)
        .map(close -> close.getReplyCode() + " " + close.getReplyText())
        .orElseGet(
            () ->
                failure.getMessage() != null
                    ? failure.getMessage()
                    : failure.getClass().getSimpleName());
  }
}
