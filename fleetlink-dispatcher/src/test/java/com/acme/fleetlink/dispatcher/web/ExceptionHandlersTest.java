package com.acme.fleetlink.dispatcher.web;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.acme.fleetlink.core.BrokerConnectivityException;
import com.acme.fleetlink.core.PublisherIdentityMismatchException;
import io.micronaut.http.HttpMethod;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExceptionHandlersTest {

  @Test
  @DisplayName("transient failures should map to 503")
  void testTransient() {
    HttpResponse<ErrorResponse> response =
        new TransientExceptionHandler()
            .handle(mock(HttpRequest.class), new BrokerConnectivityException("Connection refused"));

    assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    assertThat(response.body()).isEqualTo(new ErrorResponse("Connection refused", 503));
  }

  @Test
  @DisplayName("permanent failures should map to 500 with the cause message")
  void testPermanent() {
    HttpRequest<?> request = mock(HttpRequest.class);
    when(request.getMethod()).thenReturn(HttpMethod.POST);
    when(request.getPath()).thenReturn("/v1/heartbeats");

    HttpResponse<ErrorResponse> response =
        new PermanentExceptionHandler()
            .handle(
                request,
                new PublisherIdentityMismatchException(
                    "common_feedback", "cluster-b", "user_id mismatch", null));

    assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.body().message()).contains("cluster-b");
    assertThat(response.body().statusCode()).isEqualTo(500);
  }
}
