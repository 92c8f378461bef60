package com.acme.fleetlink.mq;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.acme.fleetlink.core.BrokerConnectivityException;
import com.acme.fleetlink.handler.MessageContext;
import com.acme.fleetlink.handler.MessageProcessor;
import com.acme.fleetlink.handler.MessageProcessorRegistry;
import com.acme.fleetlink.message.HeartbeatMessage;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.Envelope;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("MessageDispatchingHandler - decode, route and settle deliveries")
class MessageDispatchingHandlerTest {

  private static final String QUEUE = "common_feedback";
  private static final String HEARTBEAT_JSON =
      "{\"message_type\":\"heartbeat\",\"last_heartbeat_at\":\"2025-03-01T12:00:00Z\","
          + "\"cluster_name\":\"c1\",\"organization_name\":\"acme\"}";

  @Mock private Channel channel;

  private final List<HeartbeatMessage> processed = new ArrayList<>();
  private final List<MessageContext> contexts = new ArrayList<>();
  private BiConsumer<HeartbeatMessage, MessageContext> behaviour;
  private MessageDispatchingHandler handler;

  @BeforeEach
  void setUp() {
    behaviour =
        (message, context) -> {
          processed.add(message);
          contexts.add(context);
        };
    MessageProcessorRegistry registry = new MessageProcessorRegistry();
    registry.register(
        new MessageProcessor<HeartbeatMessage>() {
          @Override
          public Class<HeartbeatMessage> messageType() {
            return HeartbeatMessage.class;
          }

          @Override
          public void process(HeartbeatMessage message, MessageContext context) {
            behaviour.accept(message, context);
          }
        });
    handler = new MessageDispatchingHandler(QUEUE, registry);
  }

  private static Delivery delivery(long tag, String userId, String body) {
    AMQP.BasicProperties props = new AMQP.BasicProperties.Builder().userId(userId).build();
    return new Delivery(
        new Envelope(tag, false, "", QUEUE), props, body.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  @DisplayName("should ack after the processor succeeds and pass the sender id")
  void testAckOnSuccess() throws Exception {
    handler.handle(channel, delivery(1L, "cluster-a", HEARTBEAT_JSON));

    verify(channel).basicAck(1L, false);
    verify(channel, never()).basicReject(anyLong(), anyBoolean());
    assertThat(processed).hasSize(1);
    assertThat(processed.get(0).lastHeartbeatAt()).isEqualTo(Instant.parse("2025-03-01T12:00:00Z"));
    assertThat(contexts).containsExactly(new MessageContext("cluster-a", QUEUE));
  }

  @Test
  @DisplayName("should dead-letter malformed JSON")
  void testMalformed() throws Exception {
    handler.handle(channel, delivery(2L, "cluster-a", "{oops"));

    verify(channel).basicReject(2L, false);
    verify(channel, never()).basicAck(anyLong(), anyBoolean());
  }

  @Test
  @DisplayName("should dead-letter a body that is the JSON null literal")
  void testNullDocument() throws Exception {
    handler.handle(channel, delivery(6L, "cluster-a", "null"));

    verify(channel).basicReject(6L, false);
    verify(channel, never()).basicReject(6L, true);
    verify(channel, never()).basicAck(anyLong(), anyBoolean());
  }

  @Test
  @DisplayName("should dead-letter an inventory report without a node list")
  void testMissingNodeList() throws Exception {
    handler.handle(
        channel,
        delivery(
            7L,
            "cluster-a",
            "{\"message_type\":\"cluster_nodes\",\"updated_at\":\"2025-03-01T12:00:00Z\"}"));

    verify(channel).basicReject(7L, false);
  }

  @Test
  @DisplayName("should dead-letter a message type without processor")
  void testUnsupportedType() throws Exception {
    String nodes = "{\"message_type\":\"cluster_nodes\",\"cluster_nodes\":[],"
        + "\"updated_at\":\"2025-03-01T12:00:00Z\"}";

    handler.handle(channel, delivery(3L, "cluster-a", nodes));

    verify(channel).basicReject(3L, false);
  }

  @Test
  @DisplayName("should dead-letter when the processor needs a sender and none is present")
  void testMissingSender() throws Exception {
    behaviour = (message, context) -> context.requireSenderId();

    handler.handle(channel, delivery(4L, null, HEARTBEAT_JSON));

    verify(channel).basicReject(4L, false);
  }

  @Test
  @DisplayName("should requeue on transient processor failures")
  void testRequeueOnTransientFailure() throws Exception {
    behaviour =
        (message, context) -> {
          throw new BrokerConnectivityException("downstream unavailable");
        };

    handler.handle(channel, delivery(5L, "cluster-a", HEARTBEAT_JSON));

    verify(channel).basicReject(5L, true);
    verify(channel, never()).basicAck(anyLong(), anyBoolean());
  }
}
