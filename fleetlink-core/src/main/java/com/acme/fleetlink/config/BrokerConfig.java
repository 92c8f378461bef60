package com.acme.fleetlink.config;

import java.time.Duration;

/**
 * Connection settings for the RabbitMQ broker. Pure POJO - no framework dependencies.
 *
 * <p>The publisher identity is the value placed in the AMQP {@code user-id} property of every
 * published message. The broker rejects a publish whose identity differs from the user the
 * connection authenticated as, so it defaults to {@link #getUsername()}.
 */
public class BrokerConfig {

  private String host = "localhost";
  private int port = 5672;
  private String virtualHost = "/";
  private String username = "guest";
  private String password = "guest";
  private String publisherIdentity;
  private Duration connectionTimeout = Duration.ofSeconds(10);
  private Duration confirmTimeout = Duration.ofSeconds(5);

  public String getHost() {
    return host;
  }

  public void setHost(String host) {
    this.host = host;
  }

  public int getPort() {
    return port;
  }

  public void setPort(int port) {
    this.port = port;
  }

  public String getVirtualHost() {
    return virtualHost;
  }

  public void setVirtualHost(String virtualHost) {
    this.virtualHost = virtualHost;
  }

  public String getUsername() {
    return username;
  }

  public void setUsername(String username) {
    this.username = username;
  }

  public String getPassword() {
    return password;
  }

  public void setPassword(String password) {
    this.password = password;
  }

  public String getPublisherIdentity() {
    if (publisherIdentity == null || publisherIdentity.isBlank()) {
      return username;
    }
    return publisherIdentity;
  }

  public void setPublisherIdentity(String publisherIdentity) {
    this.publisherIdentity = publisherIdentity;
  }

  public Duration getConnectionTimeout() {
    return connectionTimeout;
  }

  public void setConnectionTimeout(Duration connectionTimeout) {
    this.connectionTimeout = connectionTimeout;
  }

  public int getConnectionTimeoutMillis() {
    return Math.toIntExact(connectionTimeout.toMillis());
  }

  public Duration getConfirmTimeout() {
    return confirmTimeout;
  }

  public void setConfirmTimeout(Duration confirmTimeout) {
    this.confirmTimeout = confirmTimeout;
  }

  /** Host, port and virtual host for log output. Never includes credentials. */
  public String describeEndpoint() {
    String vhostPath = virtualHost.startsWith("/") ? virtualHost : "/" + virtualHost;
    return String.format("amqp://%s:%d%s", host, port, vhostPath);
  }
}
