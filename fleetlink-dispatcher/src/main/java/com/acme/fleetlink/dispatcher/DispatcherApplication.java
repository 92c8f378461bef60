package com.acme.fleetlink.dispatcher;

import io.micronaut.runtime.Micronaut;

/**
 * Dispatcher Application - runs inside each managed cluster. Publishes heartbeats and node
 * inventory to the common feedback queue and reports the liveness of its watchers on /v1/health.
 */
public class DispatcherApplication {
  public static void main(String[] args) {
    Micronaut.run(DispatcherApplication.class, args);
  }
}
