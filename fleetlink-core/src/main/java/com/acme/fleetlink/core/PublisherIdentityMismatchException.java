package com.acme.fleetlink.core;

/**
 * The broker rejected a publish because the claimed {@code user-id} differs from the user the
 * connection authenticated as. This is a misconfiguration, never a network failure.
 */
public class PublisherIdentityMismatchException extends PermanentException {
  private final String queueName;
  private final String claimedIdentity;

  public PublisherIdentityMismatchException(
      String queueName, String claimedIdentity, String brokerReason, Throwable e) {
    super(
        String.format(
            "Broker rejected publish to %s with claimed identity '%s': %s",
            queueName, claimedIdentity, brokerReason),
        e);
    this.queueName = queueName;
    this.claimedIdentity = claimedIdentity;
  }

  public String getQueueName() {
    return queueName;
  }

  public String getClaimedIdentity() {
    return claimedIdentity;
  }
}
