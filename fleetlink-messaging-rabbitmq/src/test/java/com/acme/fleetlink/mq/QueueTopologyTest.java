package com.acme.fleetlink.mq;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.acme.fleetlink.core.BrokerConnectivityException;
import com.acme.fleetlink.core.QueueTopologyException;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import java.io.IOException;
import java.net.SocketException;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("QueueTopology - dead-letter and quorum queue declarations")
class QueueTopologyTest {

  @Mock private Channel channel;
  @Mock private Connection connection;

  @Test
  @DisplayName("ensureTopology - should declare dead-letter topology before the queue")
  void testDeclarations() throws IOException {
    QueueTopology.ensureTopology(channel, "common_feedback");

    InOrder inOrder = inOrder(channel);
    inOrder.verify(channel).exchangeDeclare("dlx_exchange", BuiltinExchangeType.DIRECT, true);
    inOrder.verify(channel).queueDeclare("dlx_queue", true, false, false, null);
    inOrder.verify(channel).queueBind("dlx_queue", "dlx_exchange", "dlx_key");
    inOrder
        .verify(channel)
        .queueDeclare(
            "common_feedback",
            true,
            false,
            false,
            Map.of(
                "x-queue-type", "quorum",
                "x-dead-letter-exchange", "dlx_exchange",
                "x-dead-letter-routing-key", "dlx_key"));
  }

  @Test
  @DisplayName("ensureTopology - should be safe to repeat")
  void testIdempotentCalls() throws IOException {
    QueueTopology.ensureTopology(channel, "common_feedback");
    QueueTopology.ensureTopology(channel, "common_feedback");

    verify(channel, times(2))
        .queueDeclare(eq("common_feedback"), eq(true), eq(false), eq(false), anyMap());
  }

  @Test
  @DisplayName("ensureTopology - should report argument drift as a topology failure")
  void testArgumentDrift() throws IOException {
    lenient().when(channel.queueDeclare(eq("legacy"), anyBoolean(), anyBoolean(), anyBoolean(), anyMap()))
        .thenThrow(
            new IOException(
                BrokerSignals.channelClosed(
                    406,
                    "PRECONDITION_FAILED - inequivalent arg 'x-queue-type' for queue 'legacy'")));

    assertThatThrownBy(() -> QueueTopology.ensureTopology(channel, "legacy"))
        .isInstanceOf(QueueTopologyException.class)
        .hasMessageContaining("inequivalent arg");
  }

  @Test
  @DisplayName("ensureTopology - should report socket errors as connectivity failures")
  void testSocketError() throws IOException {
    when(channel.exchangeDeclare("dlx_exchange", BuiltinExchangeType.DIRECT, true))
        .thenThrow(new SocketException("Connection reset"));

    assertThatThrownBy(() -> QueueTopology.ensureTopology(channel, "q"))
        .isInstanceOf(BrokerConnectivityException.class);
  }

  @Test
  @DisplayName("ensureTopology(connection) - should release the channel it opened")
  void testConnectionVariantReleasesChannel() throws Exception {
    when(connection.createChannel()).thenReturn(channel);
    when(channel.isOpen()).thenReturn(true);

    QueueTopology.ensureTopology(connection, "common_feedback");

    verify(channel).close();
    verify(connection, never()).close();
  }

  @Test
  @DisplayName("ensureTopology(connection) - should release the channel on failure")
  void testConnectionVariantReleasesOnFailure() throws Exception {
    when(connection.createChannel()).thenReturn(channel);
    when(channel.isOpen()).thenReturn(true);
    when(channel.exchangeDeclare("dlx_exchange", BuiltinExchangeType.DIRECT, true))
        .thenThrow(new SocketException("Connection reset"));

    assertThatThrownBy(() -> QueueTopology.ensureTopology(connection, "q"))
        .isInstanceOf(BrokerConnectivityException.class);

    verify(channel).close();
  }
}
