package com.acme.fleetlink.config;

/** Organization and cluster names this dispatcher reports under. */
public class ClusterIdentityConfig {

  private String organizationName;
  private String clusterName;

  public String getOrganizationName() {
    return organizationName;
  }

  public void setOrganizationName(String organizationName) {
    this.organizationName = organizationName;
  }

  public String getClusterName() {
    return clusterName;
  }

  public void setClusterName(String clusterName) {
    this.clusterName = clusterName;
  }
}
