package org.waabox.vigia.channel.kafka;

import java.util.Collections;
import java.util.Objects;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.vigia.ChangeEvent;
import org.waabox.vigia.EventFilter;
import org.waabox.vigia.channel.ChangeChannel;
import org.waabox.vigia.channel.ChannelException;
import org.waabox.vigia.channel.ChannelHandle;
import org.waabox.vigia.channel.ChannelListener;
import org.waabox.vigia.channel.ChannelStatus;

/** Kafka-based implementation of {@link ChangeChannel}.
 *
 * <p>Each opened channel owns a consumer with a unique consumer group
 * (broadcast pattern) and a daemon thread running its poll loop. Messages
 * are keyed by resource name and carry a JSON change event encoded with
 * {@link ChangeEventCodec}; messages for other resources are skipped.
 *
 * <p>The channel reports {@code CONNECTING} when opened and {@code LIVE}
 * after its first successful poll. A consumer failure is reported through
 * {@link ChannelListener#onError(Throwable)} followed by
 * {@code CHANNEL_ERROR}, and ends the poll loop.
 *
 * <p>Typical usage:
 * <pre>
 *   KafkaChannelConfig config = KafkaChannelConfig.create("localhost:9092");
 *   Vigia vigia = Vigia.builder()
 *       .changeChannel(new KafkaChangeChannel(config))
 *       .build();
 * </pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class KafkaChangeChannel implements ChangeChannel {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      KafkaChangeChannel.class);

  /** How long closing a channel waits for its poll thread. */
  private static final long JOIN_TIMEOUT_MILLIS = 5_000;

  /** The Kafka configuration, never null. */
  private final KafkaChannelConfig config;

  /** Creates a consumer for a given consumer group id, never null. */
  private final Function<String, Consumer<String, String>> consumerFactory;

  /** Creates a new KafkaChangeChannel with the given configuration.
   *
   * @param theConfig the Kafka channel configuration, never null
   */
  public KafkaChangeChannel(final KafkaChannelConfig theConfig) {
    this(theConfig, groupId -> createConsumer(theConfig, groupId));
  }

  /** Creates a new KafkaChangeChannel with a custom consumer factory.
   *
   * <p>Package-private for testability.
   *
   * @param theConfig the Kafka channel configuration, never null
   * @param theConsumerFactory creates a consumer for a group id, never null
   */
  KafkaChangeChannel(final KafkaChannelConfig theConfig,
      final Function<String, Consumer<String, String>> theConsumerFactory) {
    config = Objects.requireNonNull(theConfig, "config must not be null");
    consumerFactory = Objects.requireNonNull(theConsumerFactory,
        "consumerFactory must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public ChannelHandle open(final String resource, final EventFilter filter,
      final ChannelListener listener) {
    Objects.requireNonNull(resource, "resource must not be null");
    Objects.requireNonNull(filter, "filter must not be null");
    Objects.requireNonNull(listener, "listener must not be null");

    final String groupId = config.consumerGroupPrefix() + UUID.randomUUID();
    final Consumer<String, String> consumer;
    try {
      consumer = consumerFactory.apply(groupId);
      consumer.subscribe(Collections.singletonList(config.topic()));
    } catch (final KafkaException e) {
      throw new ChannelException("Cannot open Kafka channel for resource '"
          + resource + "' on topic '" + config.topic() + "'", e);
    }

    final OpenChannel channel = new OpenChannel(resource, filter, listener,
        consumer);
    listener.onStatus(ChannelStatus.CONNECTING);
    channel.start();

    log.info("Opened Kafka channel for resource '{}' on topic '{}' with "
        + "group '{}'", resource, config.topic(), groupId);
    return channel;
  }

  /** Decodes a consumed record and hands it to the listener when it
   * belongs to the resource and matches the filter.
   *
   * <p>Package-private for testability.
   *
   * @param record the consumed record, never null
   * @param resource the resource of the channel, never null
   * @param filter the mutations of interest, never null
   * @param listener the channel listener, never null
   *
   * @return true if the event was delivered to the listener
   */
  static boolean dispatch(final ConsumerRecord<String, String> record,
      final String resource, final EventFilter filter,
      final ChannelListener listener) {
    if (!resource.equals(record.key())) {
      return false;
    }
    if (record.value() == null) {
      log.warn("Skipping empty change message for resource '{}' at "
          + "partition {} offset {}", resource, record.partition(),
          record.offset());
      return false;
    }

    final ChangeEvent event;
    try {
      event = ChangeEventCodec.deserialize(record.value());
    } catch (final IllegalArgumentException e) {
      log.error("Skipping malformed change message for resource '{}' at "
          + "partition {} offset {}: {}", resource, record.partition(),
          record.offset(), e.getMessage(), e);
      return false;
    }

    if (!resource.equals(event.resource())) {
      log.warn("Skipping change message keyed '{}' that names resource "
          + "'{}'", resource, event.resource());
      return false;
    }
    if (!filter.matches(event.eventType())) {
      log.debug("Skipping {} event for resource '{}' filtered by {}",
          event.eventType(), resource, filter);
      return false;
    }
    listener.onEvent(event);
    return true;
  }

  /** Creates a Kafka consumer with string deserializers that starts from
   * the latest offset of the topic.
   *
   * @param config the channel configuration, never null
   * @param groupId the unique consumer group, never null
   *
   * @return the Kafka consumer, never null
   */
  private static Consumer<String, String> createConsumer(
      final KafkaChannelConfig config, final String groupId) {
    final Properties props = new Properties();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG,
        config.bootstrapServers());
    props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG,
        StringDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG,
        StringDeserializer.class.getName());
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");
    return new KafkaConsumer<>(props);
  }

  /** A channel backed by one consumer and its poll thread. */
  private final class OpenChannel implements ChannelHandle {

    /** The resource of the channel, never null. */
    private final String resource;

    /** The mutations of interest, never null. */
    private final EventFilter filter;

    /** The channel callbacks, never null. */
    private final ChannelListener listener;

    /** The consumer, only touched by the poll thread except wakeup. */
    private final Consumer<String, String> consumer;

    /** Whether the poll loop should keep running. */
    private final AtomicBoolean running = new AtomicBoolean(true);

    /** The daemon thread running the poll loop. */
    private final Thread pollThread;

    private OpenChannel(final String theResource, final EventFilter theFilter,
        final ChannelListener theListener,
        final Consumer<String, String> theConsumer) {
      resource = theResource;
      filter = theFilter;
      listener = theListener;
      consumer = theConsumer;
      pollThread = new Thread(this::pollLoop,
          "vigia-kafka-" + theResource);
      pollThread.setDaemon(true);
    }

    private void start() {
      pollThread.start();
    }

    /** {@inheritDoc} */
    @Override
    public void close() {
      if (!running.getAndSet(false)) {
        return;
      }
      log.info("Closing Kafka channel for resource '{}'", resource);
      consumer.wakeup();

      if (Thread.currentThread() != pollThread) {
        try {
          pollThread.join(JOIN_TIMEOUT_MILLIS);
        } catch (final InterruptedException e) {
          Thread.currentThread().interrupt();
          log.warn("Interrupted while waiting for the poll thread of '{}'",
              resource);
        }
      }
    }

    /** Polls until closed or until the consumer fails. */
    private void pollLoop() {
      boolean live = false;
      try {
        while (running.get()) {
          final ConsumerRecords<String, String> records =
              consumer.poll(config.pollTimeout());
          if (!running.get()) {
            break;
          }
          if (!live) {
            live = true;
            listener.onStatus(ChannelStatus.LIVE);
          }
          for (final ConsumerRecord<String, String> record : records) {
            if (!running.get()) {
              break;
            }
            dispatch(record, resource, filter, listener);
          }
        }
      } catch (final WakeupException e) {
        if (running.get()) {
          fail(e);
        }
      } catch (final KafkaException e) {
        fail(e);
      } catch (final RuntimeException e) {
        fail(e);
      } finally {
        closeQuietly();
      }
    }

    /** Reports a failure of the poll loop unless the channel is being
     * closed.
     *
     * @param cause the consumer or dispatch failure, never null
     */
    private void fail(final RuntimeException cause) {
      if (!running.getAndSet(false)) {
        return;
      }
      log.error("Kafka channel for resource '{}' failed: {}", resource,
          cause.getMessage(), cause);
      listener.onError(cause);
      listener.onStatus(ChannelStatus.CHANNEL_ERROR);
    }

    private void closeQuietly() {
      try {
        consumer.close();
      } catch (final Exception e) {
        log.warn("Error closing consumer of '{}': {}", resource,
            e.getMessage(), e);
      }
    }
  }
}
