package com.acme.fleetlink.dispatcher.config;

import com.acme.fleetlink.config.ClusterIdentityConfig;
import com.acme.fleetlink.spi.ClusterIdentityProvider;
import jakarta.inject.Singleton;

/** Cluster identity from the {@code cluster.*} configuration. Both names are mandatory. */
@Singleton
public class ConfiguredClusterIdentityProvider implements ClusterIdentityProvider {

  private final String organizationName;
  private final String clusterName;

  public ConfiguredClusterIdentityProvider(ClusterIdentityConfig config) {
    this.organizationName = require(config.getOrganizationName(), "cluster.organization-name");
    this.clusterName = require(config.getClusterName(), "cluster.cluster-name");
  }

  private static String require(String value, String property) {
    if (value == null || value.isBlank()) {
      throw new IllegalStateException(property + " must be set");
    }
    return value.trim();
  }

  @Override
  public String organizationName() {
    return organizationName;
  }

  @Override
  public String clusterName() {
    return clusterName;
  }
}
