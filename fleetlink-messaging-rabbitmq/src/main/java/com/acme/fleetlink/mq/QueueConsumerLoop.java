package com.acme.fleetlink.mq;

import com.acme.fleetlink.core.BrokerConnectivityException;
import com.acme.fleetlink.core.QueueTopologyException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.ShutdownSignalException;
import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blocking consumer of a single, already declared queue with prefetch 1 and manual
 * acknowledgement.
 *
 * <p>{@link #run()} blocks until {@link #cancel()} is called, the calling thread is interrupted, or
 * the broker side goes away. Channel and connection are released on every exit path, channel
 * first. A loop runs once; restarting means building a new loop.
 */
public class QueueConsumerLoop {
  private static final Logger log = LoggerFactory.getLogger(QueueConsumerLoop.class);

  private final ConnectionFactory connectionFactory;
  private final String queueName;
  private final DeliveryHandler handler;

  private final CountDownLatch stopped = new CountDownLatch(1);
  private final AtomicBoolean started = new AtomicBoolean();
  private volatile boolean cancelRequested;
  private volatile ShutdownSignalException brokerShutdown;
  private volatile boolean cancelledByBroker;

  public QueueConsumerLoop(
      ConnectionFactory connectionFactory, String queueName, DeliveryHandler handler) {
    this.connectionFactory = connectionFactory;
    this.queueName = queueName;
    this.handler = handler;
  }

  /**
   * Consume until stopped.
   *
   * @throws BrokerConnectivityException if the broker is unreachable or the connection drops
   * @throws QueueTopologyException if the queue does not exist or is deleted while consuming
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public void run() throws InterruptedException {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Consumer loop for " + queueName + " already ran");
    }
    Connection connection = null;
    Channel channel = null;
    try {
      connection = connectionFactory.newConnection("fleetlink-consumer-" + queueName);
      connection.addShutdownListener(this::onShutdown);
      channel = connection.createChannel();
      channel.addShutdownListener(this::onShutdown);
      channel.basicQos(1);
      channel.queueDeclarePassive(queueName);

      Channel consumerChannel = channel;
      String consumerTag =
          channel.basicConsume(
              queueName,
              false,
              (tag, delivery) -> dispatch(consumerChannel, delivery),
              this::onBrokerCancel);
      log.info("Consuming from {} with consumer tag {}", queueName, consumerTag);

      stopped.await();
      failIfBrokerStopped();
      log.info("Consumer for {} cancelled", queueName);
    } catch (IOException | ShutdownSignalException e) {
      throw BrokerErrors.topologyFailure(queueName, e);
    } catch (TimeoutException e) {
      throw BrokerErrors.connectivityFailure("Timed out connecting to broker", e);
    } finally {
      Channels.closeQuietly(channel);
      Channels.closeQuietly(connection);
    }
  }

  /** Stop consuming. {@link #run()} releases its resources and returns normally. */
  public void cancel() {
    cancelRequested = true;
    stopped.countDown();
  }

  public String getQueueName() {
    return queueName;
  }

  void dispatch(Channel channel, Delivery delivery) {
    long deliveryTag = delivery.getEnvelope().getDeliveryTag();
    try {
      handler.handle(channel, delivery);
    } catch (Exception e) {
      log.error(
          "Handler failed for delivery {} on {}, dead-lettering it", deliveryTag, queueName, e);
      try {
        channel.basicReject(deliveryTag, false);
      } catch (IOException | ShutdownSignalException rejectFailure) {
        log.warn(
            "Could not reject delivery {} on {}: {}",
            deliveryTag,
            queueName,
            rejectFailure.getMessage());
      }
    }
  }

  private void onShutdown(ShutdownSignalException cause) {
    if (!cause.isInitiatedByApplication() && brokerShutdown == null) {
      brokerShutdown = cause;
    }
    stopped.countDown();
  }

  private void onBrokerCancel(String consumerTag) {
    log.warn("Broker cancelled consumer {} on {}", consumerTag, queueName);
    cancelledByBroker = true;
    stopped.countDown();
  }

  private void failIfBrokerStopped() {
    if (cancelRequested) {
      return;
    }
    if (cancelledByBroker) {
      throw new QueueTopologyException(
          queueName, "Consumer cancelled by broker, queue " + queueName + " is gone", null);
    }
    if (brokerShutdown != null) {
      throw BrokerErrors.connectivityFailure(
          "Lost broker connection on " + queueName, brokerShutdown);
    }
  }
}
