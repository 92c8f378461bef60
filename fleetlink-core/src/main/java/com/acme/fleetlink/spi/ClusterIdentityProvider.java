package com.acme.fleetlink.spi;

public interface ClusterIdentityProvider {
  String organizationName();

  String clusterName();
}
