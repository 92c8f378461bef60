package com.acme.fleetlink.core;

/** A decoded message cannot be processed here, for example because no processor accepts it. */
public class UnsupportedMessageException extends PermanentException {
  public UnsupportedMessageException(String message) {
    super(message);
  }
}
