package com.acme.fleetlink.api;

import io.micronaut.runtime.Micronaut;

/**
 * API Application - central service. Consumes the common feedback queue and serves the last
 * reported state of every cluster. Does NOT publish to clusters.
 */
public class ApiApplication {
  public static void main(String[] args) {
    Micronaut.run(ApiApplication.class, args);
  }
}
