package com.acme.fleetlink.dispatcher.web;

import com.acme.fleetlink.core.TransientException;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;

/** Broker outages map to 503 so callers know a retry may succeed. */
@Produces
@Singleton
public class TransientExceptionHandler
    implements ExceptionHandler<TransientException, HttpResponse<ErrorResponse>> {

  @Override
  public HttpResponse<ErrorResponse> handle(HttpRequest request, TransientException exception) {
    return HttpResponse.<ErrorResponse>status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(
            new ErrorResponse(
                exception.getMessage() != null ? exception.getMessage() : "Broker unavailable",
                HttpStatus.SERVICE_UNAVAILABLE.getCode()));
  }
}
