package com.acme.fleetlink.core;

/**
 * The broker could not be reached, dropped the connection, or did not confirm a publish in time.
 * Owners of long-running consumers restart from scratch when they see this.
 */
public class BrokerConnectivityException extends TransientException {
  public BrokerConnectivityException(String message) {
    super(message);
  }

  public BrokerConnectivityException(String message, Throwable e) {
    super(message, e);
  }
}
