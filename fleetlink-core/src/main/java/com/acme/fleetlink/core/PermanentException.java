package com.acme.fleetlink.core;

/** Failure that will not go away by retrying the same operation. */
public class PermanentException extends RuntimeException {
  public PermanentException(String message) {
    super(message);
  }

  public PermanentException(String message, Throwable e) {
    super(message, e);
  }
}
