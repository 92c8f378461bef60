package com.acme.fleetlink.core;

/** A payload could not be encoded or decoded as a known message. */
public class MessageFormatException extends PermanentException {
  public MessageFormatException(String message, Throwable e) {
    super(message, e);
  }
}
