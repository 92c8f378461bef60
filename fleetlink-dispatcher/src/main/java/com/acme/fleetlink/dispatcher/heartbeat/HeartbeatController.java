package com.acme.fleetlink.dispatcher.heartbeat;

import com.acme.fleetlink.message.HeartbeatMessage;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Post;

@Controller("/v1/heartbeats")
public class HeartbeatController {

  private final HeartbeatService heartbeatService;

  public HeartbeatController(HeartbeatService heartbeatService) {
    this.heartbeatService = heartbeatService;
  }

  /** Publish a heartbeat now instead of waiting for the next scheduled one. */
  @Post
  public HttpResponse<HeartbeatMessage> sendHeartbeat() {
    return HttpResponse.ok(heartbeatService.publishHeartbeat());
  }
}
