package com.acme.fleetlink.dispatcher.web;

import static org.assertj.core.api.Assertions.*;

import com.acme.fleetlink.watch.LivenessEvaluator;
import com.acme.fleetlink.watch.WatcherRegistry;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for HealthController */
class HealthControllerTest {

  private static final Instant T0 = Instant.parse("2025-03-01T12:00:00Z");

  private HealthController controllerAt(WatcherRegistry registry, Instant now) {
    Clock clock = Clock.fixed(now, ZoneOffset.UTC);
    return new HealthController(new LivenessEvaluator(registry, clock, Duration.ofMinutes(5)));
  }

  @Test
  @DisplayName("GET /v1/health - should report OK with no watchers")
  void testNoWatchers() {
    HttpResponse<?> response =
        controllerAt(new WatcherRegistry(Clock.fixed(T0, ZoneOffset.UTC)), T0).health();

    assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.OK);
    assertThat(response.body()).isEqualTo("{\"status\":\"OK\"}");
  }

  @Test
  @DisplayName("GET /v1/health - should report OK while every watcher is fresh")
  void testFreshWatchers() {
    WatcherRegistry registry = new WatcherRegistry(Clock.fixed(T0, ZoneOffset.UTC));
    registry.register("heartbeat_publisher");

    HttpResponse<?> response = controllerAt(registry, T0.plus(Duration.ofMinutes(4))).health();

    assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.OK);
  }

  @Test
  @DisplayName("GET /v1/health - should report 500 when a watcher is stale")
  void testStaleWatcher() {
    WatcherRegistry registry = new WatcherRegistry(Clock.fixed(T0, ZoneOffset.UTC));
    registry.register("heartbeat_publisher");

    HttpResponse<?> response = controllerAt(registry, T0.plus(Duration.ofMinutes(6))).health();

    assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.body())
        .isEqualTo(new ErrorResponse("One or more watchers are unhealthy", 500));
  }
}
