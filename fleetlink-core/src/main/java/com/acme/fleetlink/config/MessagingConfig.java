package com.acme.fleetlink.config;

import java.time.Duration;

/**
 * Configuration for queue names and consumer behaviour. Pure POJO - no framework dependencies.
 */
public class MessagingConfig {

  private String commonFeedbackQueue = "common_feedback";
  private boolean declareTopology = true;
  private Duration consumerRestartDelay = Duration.ofSeconds(5);

  /** Queue every dispatcher reports to and the central service consumes from. */
  public String getCommonFeedbackQueue() {
    return commonFeedbackQueue;
  }

  public void setCommonFeedbackQueue(String commonFeedbackQueue) {
    this.commonFeedbackQueue = commonFeedbackQueue;
  }

  /** Whether the process declares its queue topology on startup. */
  public boolean isDeclareTopology() {
    return declareTopology;
  }

  public void setDeclareTopology(boolean declareTopology) {
    this.declareTopology = declareTopology;
  }

  public Duration getConsumerRestartDelay() {
    return consumerRestartDelay;
  }

  public void setConsumerRestartDelay(Duration consumerRestartDelay) {
    this.consumerRestartDelay = consumerRestartDelay;
  }
}
