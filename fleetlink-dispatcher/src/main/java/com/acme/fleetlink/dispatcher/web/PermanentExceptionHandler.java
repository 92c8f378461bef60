package com.acme.fleetlink.dispatcher.web;

import com.acme.fleetlink.core.PermanentException;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/**
 * Misconfiguration such as a publisher identity mismatch or topology drift. Retrying will not help,
 * so the failure is logged and reported as 500.
 */
@Slf4j
@Produces
@Singleton
public class PermanentExceptionHandler
    implements ExceptionHandler<PermanentException, HttpResponse<ErrorResponse>> {

  @Override
  public HttpResponse<ErrorResponse> handle(HttpRequest request, PermanentException exception) {
    log.error("{} {} failed permanently", request.getMethod(), request.getPath(), exception);
    return HttpResponse.serverError(
        new ErrorResponse(exception.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR.getCode()));
  }
}
