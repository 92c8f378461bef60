package com.acme.fleetlink.message;

/**
 * Values of the {@code message_type} discriminator. Dispatchers and the central service must agree
 * on them byte-for-byte.
 */
public final class MessageTypes {

  public static final String HEARTBEAT = "heartbeat";
  public static final String CLUSTER_NODES = "cluster_nodes";

  private MessageTypes() {}
}
