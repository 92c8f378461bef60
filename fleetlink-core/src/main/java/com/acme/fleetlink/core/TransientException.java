package com.acme.fleetlink.core;

/** Failure that may succeed when retried, typically after reconnecting. */
public class TransientException extends RuntimeException {
  public TransientException(String message) {
    super(message);
  }

  public TransientException(String message, Throwable e) {
    super(message, e);
  }
}
