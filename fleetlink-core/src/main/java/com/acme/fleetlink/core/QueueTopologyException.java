package com.acme.fleetlink.core;

/**
 * The broker refused a queue or exchange declaration because the existing object has different
 * arguments, or a queue expected to exist is missing. Requires operator action.
 */
public class QueueTopologyException extends PermanentException {
  private final String queueName;

  public QueueTopologyException(String queueName, String message, Throwable e) {
    super(message, e);
    this.queueName = queueName;
  }

  public String getQueueName() {
    return queueName;
  }
}
