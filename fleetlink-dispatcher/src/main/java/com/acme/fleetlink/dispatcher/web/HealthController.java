package com.acme.fleetlink.dispatcher.web;

import com.acme.fleetlink.watch.LivenessEvaluator;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;

/** Liveness probe: healthy while every registered watcher attempted recently. */
@Controller("/v1")
public class HealthController {

  static final String UNHEALTHY_MESSAGE = "One or more watchers are unhealthy";

  private final LivenessEvaluator livenessEvaluator;

  public HealthController(LivenessEvaluator livenessEvaluator) {
    this.livenessEvaluator = livenessEvaluator;
  }

  @Get("/health")
  public HttpResponse<?> health() {
    if (livenessEvaluator.allHealthy()) {
      return HttpResponse.ok("{\"status\":\"OK\"}");
    }
    return HttpResponse.serverError(
        new ErrorResponse(UNHEALTHY_MESSAGE, HttpStatus.INTERNAL_SERVER_ERROR.getCode()));
  }
}
