package com.acme.fleetlink.mq;

import com.acme.fleetlink.core.PermanentException;
import com.acme.fleetlink.core.TransientException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps a {@link QueueConsumerLoop} running on a dedicated thread. Connectivity failures restart a
 * fresh loop after {@code restartDelay}; permanent failures stop supervision and are handed to the
 * fatal handler.
 */
public class ConsumerSupervisor implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ConsumerSupervisor.class);

  private final String name;
  private final Supplier<QueueConsumerLoop> loopFactory;
  private final Duration restartDelay;
  private final Consumer<PermanentException> onFatal;

  private volatile boolean running;
  private volatile QueueConsumerLoop current;
  private Thread thread;

  public ConsumerSupervisor(
      String name,
      Supplier<QueueConsumerLoop> loopFactory,
      Duration restartDelay,
      Consumer<PermanentException> onFatal) {
    this.name = name;
    this.loopFactory = loopFactory;
    this.restartDelay = restartDelay;
    this.onFatal = onFatal;
  }

  public synchronized void start() {
    if (thread != null) {
      throw new IllegalStateException("Supervisor " + name + " already started");
    }
    running = true;
    thread = new Thread(this::supervise, "consumer-" + name);
    thread.start();
    log.info("Started consumer supervisor {}", name);
  }

  void supervise() {
    int attempt = 0;
    while (running) {
      QueueConsumerLoop loop = loopFactory.get();
      current = loop;
      attempt++;
      try {
        loop.run();
        if (!running) {
          break;
        }
        log.warn("Consumer {} stopped without a failure, restarting", name);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      } catch (PermanentException e) {
        log.error("Consumer {} failed permanently, giving up", name, e);
        running = false;
        onFatal.accept(e);
        break;
      } catch (TransientException e) {
        log.warn(
            "Consumer {} attempt {} failed: {}, restarting in {}",
            name,
            attempt,
            e.getMessage(),
            restartDelay);
      } catch (RuntimeException e) {
        log.error(
            "Consumer {} attempt {} failed unexpectedly, restarting in {}",
            name,
            attempt,
            restartDelay,
            e);
      }
      if (!pause()) {
        break;
      }
    }
    current = null;
    log.info("Consumer supervisor {} stopped", name);
  }

  private boolean pause() {
    try {
      TimeUnit.MILLISECONDS.sleep(restartDelay.toMillis());
      return running;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  public boolean isRunning() {
    return running;
  }

  @Override
  public void close() {
    running = false;
    QueueConsumerLoop loop = current;
    if (loop != null) {
      loop.cancel();
    }
    Thread t;
    synchronized (this) {
      t = thread;
    }
    if (t == null) {
      return;
    }
    if (t == Thread.currentThread()) {
      // called from the fatal handler; the thread exits once it returns
      log.info("Closed consumer supervisor {} from its own thread", name);
      return;
    }
    t.interrupt();
    try {
      t.join(TimeUnit.SECONDS.toMillis(10));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    log.info("Closed consumer supervisor {}", name);
  }
}
