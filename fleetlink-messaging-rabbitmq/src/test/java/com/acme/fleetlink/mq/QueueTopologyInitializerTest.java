package com.acme.fleetlink.mq;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.acme.fleetlink.core.BrokerConnectivityException;
import com.acme.fleetlink.core.QueueTopologyException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import java.io.IOException;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class QueueTopologyInitializerTest {

  @Mock private ConnectionFactory connectionFactory;
  @Mock private Connection connection;
  @Mock private Channel channel;

  @Test
  @DisplayName("ensureTopology - should declare every queue and close the connection")
  void testEnsureTopology() throws Exception {
    when(connectionFactory.newConnection("fleetlink-topology")).thenReturn(connection);
    when(connection.createChannel()).thenReturn(channel);
    when(connection.isOpen()).thenReturn(true);

    new QueueTopologyInitializer(connectionFactory).ensureTopology("common_feedback", "cluster_a");

    verify(channel).queueDeclare(eq("common_feedback"), eq(true), eq(false), eq(false), anyMap());
    verify(channel).queueDeclare(eq("cluster_a"), eq(true), eq(false), eq(false), anyMap());
    verify(connection).close();
  }

  @Test
  @DisplayName("ensureTopology - should close the connection on topology drift")
  void testDriftClosesConnection() throws Exception {
    when(connectionFactory.newConnection("fleetlink-topology")).thenReturn(connection);
    when(connection.createChannel()).thenReturn(channel);
    when(connection.isOpen()).thenReturn(true);
    lenient().when(channel.queueDeclare(eq("common_feedback"), eq(true), eq(false), eq(false), anyMap()))
        .thenThrow(new IOException(BrokerSignals.channelClosed(406, "PRECONDITION_FAILED")));

    assertThatThrownBy(
            () -> new QueueTopologyInitializer(connectionFactory).ensureTopology("common_feedback"))
        .isInstanceOf(QueueTopologyException.class);
    verify(connection).close();
  }

  @Test
  @DisplayName("ensureTopology - should report a connect timeout as a connectivity failure")
  void testConnectTimeout() throws Exception {
    when(connectionFactory.newConnection("fleetlink-topology")).thenThrow(new TimeoutException());

    assertThatThrownBy(
            () -> new QueueTopologyInitializer(connectionFactory).ensureTopology("common_feedback"))
        .isInstanceOf(BrokerConnectivityException.class);
  }
}
