package com.acme.fleetlink.api.messaging;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.acme.fleetlink.config.MessagingConfig;
import com.acme.fleetlink.core.QueueTopologyException;
import com.acme.fleetlink.handler.MessageProcessorRegistry;
import com.acme.fleetlink.mq.ConsumerSupervisor;
import com.acme.fleetlink.mq.QueueConsumerLoop;
import com.acme.fleetlink.mq.QueueTopologyInitializer;
import com.rabbitmq.client.ConnectionFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("FeedbackQueueConsumer - startup and shutdown")
class FeedbackQueueConsumerTest {

  @Mock private ConnectionFactory connectionFactory;
  @Mock private QueueTopologyInitializer topology;
  @Mock private ConsumerSupervisor supervisor;

  private MessagingConfig messagingConfig;
  private TestFeedbackQueueConsumer consumer;

  @BeforeEach
  void setUp() {
    messagingConfig = new MessagingConfig();
    consumer =
        new TestFeedbackQueueConsumer(
            connectionFactory, topology, new MessageProcessorRegistry(), messagingConfig);
  }

  @Test
  @DisplayName("should ensure topology before consuming")
  void testStartup() {
    consumer.onApplicationEvent(null);

    InOrder inOrder = inOrder(topology, supervisor);
    inOrder.verify(topology).ensureTopology("common_feedback");
    inOrder.verify(supervisor).start();
    assertThat(consumer.supervisedQueue).isEqualTo("common_feedback");
    assertThat(consumer.exitStatuses).isEmpty();
  }

  @Test
  @DisplayName("loops should consume the configured queue")
  void testLoopFactory() {
    messagingConfig.setCommonFeedbackQueue("feedback_eu");

    consumer.onApplicationEvent(null);

    QueueConsumerLoop loop = consumer.loops.get();
    assertThat(loop.getQueueName()).isEqualTo("feedback_eu");
    assertThat(consumer.loops.get()).isNotSameAs(loop);
  }

  @Test
  @DisplayName("should skip topology when declaration is disabled")
  void testSkipTopology() {
    messagingConfig.setDeclareTopology(false);

    consumer.onApplicationEvent(null);

    verifyNoInteractions(topology);
    verify(supervisor).start();
  }

  @Test
  @DisplayName("topology drift should exit with status 1 without consuming")
  void testTopologyFailure() {
    doThrow(new QueueTopologyException("common_feedback", "inequivalent arg", null))
        .when(topology)
        .ensureTopology(anyString());

    consumer.onApplicationEvent(null);

    assertThat(consumer.exitStatuses).containsExactly(1);
    verifyNoInteractions(supervisor);
  }

  @Test
  @DisplayName("a permanent consumer failure should exit with status 1")
  void testFatalConsumerFailure() {
    consumer.onFatal(new QueueTopologyException("common_feedback", "queue deleted", null));

    assertThat(consumer.exitStatuses).containsExactly(1);
  }

  @Test
  @DisplayName("close should stop the supervisor once")
  void testClose() {
    consumer.onApplicationEvent(null);

    consumer.close();
    consumer.close();

    verify(supervisor, times(1)).close();
  }

  @Test
  @DisplayName("close before startup should do nothing")
  void testCloseBeforeStartup() {
    consumer.close();

    verifyNoInteractions(supervisor);
  }

  class TestFeedbackQueueConsumer extends FeedbackQueueConsumer {
    final List<Integer> exitStatuses = new ArrayList<>();
    String supervisedQueue;
    Supplier<QueueConsumerLoop> loops;

    TestFeedbackQueueConsumer(
        ConnectionFactory connectionFactory,
        QueueTopologyInitializer topology,
        MessageProcessorRegistry registry,
        MessagingConfig messagingConfig) {
      super(connectionFactory, topology, registry, messagingConfig);
    }

    @Override
    ConsumerSupervisor newSupervisor(String queueName, Supplier<QueueConsumerLoop> loopFactory) {
      this.supervisedQueue = queueName;
      this.loops = loopFactory;
      return supervisor;
    }

    @Override
    protected void exitApplication(int status) {
      exitStatuses.add(status);
    }
  }
}
