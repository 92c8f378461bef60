package com.acme.fleetlink.handler;

import com.acme.fleetlink.core.UnsupportedMessageException;
import com.acme.fleetlink.message.ClusterMessage;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes decoded cluster messages to the processor registered for their class. Pure POJO - no
 * framework dependencies.
 */
public class MessageProcessorRegistry {
  private static final Logger log = LoggerFactory.getLogger(MessageProcessorRegistry.class);

  private final Map<Class<?>, MessageProcessor<?>> processors = new ConcurrentHashMap<>();

  public MessageProcessorRegistry() {}

  public MessageProcessorRegistry(Collection<? extends MessageProcessor<?>> initial) {
    initial.forEach(this::register);
  }

  /**
   * Register a processor for its message type
   *
   * @throws IllegalStateException if a processor is already registered for this message type
   */
  public void register(MessageProcessor<?> processor) {
    Class<?> type = processor.messageType();
    if (processors.putIfAbsent(type, processor) != null) {
      String error = "Processor already registered for message type: " + type.getSimpleName();
      log.error(error);
      throw new IllegalStateException(error);
    }
    log.info("Registering processor for message type: {}", type.getSimpleName());
  }

  /**
   * Process a message with the processor registered for its type.
   *
   * @throws UnsupportedMessageException if no processor is registered for the message type
   */
  public void process(ClusterMessage message, MessageContext context) {
    MessageProcessor<?> processor = processors.get(message.getClass());
    if (processor == null) {
      throw new UnsupportedMessageException(
          "No processor registered for message type: " + message.messageType());
    }
    log.debug(
        "Processing {} from sender={} queue={}",
        message.messageType(),
        context.senderId(),
        context.queueName());
    dispatch(processor, message, context);
  }

  public boolean supports(Class<? extends ClusterMessage> type) {
    return processors.containsKey(type);
  }

  @SuppressWarnings("unchecked")
  private static <T extends ClusterMessage> void dispatch(
      MessageProcessor<T> processor, ClusterMessage message, MessageContext context) {
    processor.process((T) message, context);
  }
}
