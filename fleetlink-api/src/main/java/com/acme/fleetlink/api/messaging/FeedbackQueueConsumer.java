package com.acme.fleetlink.api.messaging;

import com.acme.fleetlink.config.MessagingConfig;
import com.acme.fleetlink.core.PermanentException;
import com.acme.fleetlink.handler.MessageProcessorRegistry;
import com.acme.fleetlink.mq.ConsumerSupervisor;
import com.acme.fleetlink.mq.MessageDispatchingHandler;
import com.acme.fleetlink.mq.QueueConsumerLoop;
import com.acme.fleetlink.mq.QueueTopologyInitializer;
import com.rabbitmq.client.ConnectionFactory;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.runtime.server.event.ServerStartupEvent;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Consumes the common feedback queue for the lifetime of the application. Connectivity failures
 * restart the consumer; topology drift or a missing queue stops the process with exit status 1.
 */
@Slf4j
@Singleton
@Requires(beans = ConnectionFactory.class)
public class FeedbackQueueConsumer implements ApplicationEventListener<ServerStartupEvent> {

  private final ConnectionFactory connectionFactory;
  private final QueueTopologyInitializer topology;
  private final MessageProcessorRegistry registry;
  private final MessagingConfig messagingConfig;
  private ConsumerSupervisor supervisor;

  public FeedbackQueueConsumer(
      ConnectionFactory connectionFactory,
      QueueTopologyInitializer topology,
      MessageProcessorRegistry registry,
      MessagingConfig messagingConfig) {
    this.connectionFactory = connectionFactory;
    this.topology = topology;
    this.registry = registry;
    this.messagingConfig = messagingConfig;
  }

  @Override
  public synchronized void onApplicationEvent(ServerStartupEvent event) {
    String queueName = messagingConfig.getCommonFeedbackQueue();
    try {
      if (messagingConfig.isDeclareTopology()) {
        topology.ensureTopology(queueName);
      }
    } catch (RuntimeException e) {
      log.error("Cannot prepare feedback queue {}: {}", queueName, e.getMessage(), e);
      exitApplication(1);
      return;
    }
    MessageDispatchingHandler handler = new MessageDispatchingHandler(queueName, registry);
    supervisor =
        newSupervisor(
            queueName, () -> new QueueConsumerLoop(connectionFactory, queueName, handler));
    supervisor.start();
  }

  ConsumerSupervisor newSupervisor(String queueName, Supplier<QueueConsumerLoop> loops) {
    return new ConsumerSupervisor(
        queueName, loops, messagingConfig.getConsumerRestartDelay(), this::onFatal);
  }

  void onFatal(PermanentException e) {
    log.error("Feedback consumer stopped permanently: {}", e.getMessage());
    exitApplication(1);
  }

  @PreDestroy
  public synchronized void close() {
    if (supervisor != null) {
      supervisor.close();
      supervisor = null;
    }
  }

  /** Exit the JVM. Overridden in tests. */
  protected void exitApplication(int status) {
    System.exit(status);
  }
}
