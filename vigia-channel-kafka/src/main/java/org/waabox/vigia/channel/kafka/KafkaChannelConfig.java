package org.waabox.vigia.channel.kafka;

import java.time.Duration;
import java.util.Objects;

/** Configuration holder for the Kafka change channel.
 *
 * <p>Every opened channel gets its own consumer group, formed by
 * {@code consumerGroupPrefix + UUID}, so each subscription receives every
 * change published on the topic.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class KafkaChannelConfig {

  /** Default Kafka topic for change events. */
  private static final String DEFAULT_TOPIC = "vigia-changes";

  /** Default consumer group prefix. */
  private static final String DEFAULT_CONSUMER_GROUP_PREFIX = "vigia-";

  /** Default timeout of each consumer poll. */
  private static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMillis(500);

  /** The Kafka bootstrap servers connection string, never null. */
  private final String bootstrapServers;

  /** The topic where change events are published, never null. */
  private final String topic;

  /** The prefix for generating unique consumer groups, never null. */
  private final String consumerGroupPrefix;

  /** The timeout of each consumer poll, never null. */
  private final Duration pollTimeout;

  private KafkaChannelConfig(final String theBootstrapServers,
      final String theTopic, final String theConsumerGroupPrefix,
      final Duration thePollTimeout) {
    bootstrapServers = Objects.requireNonNull(theBootstrapServers,
        "bootstrapServers must not be null");
    topic = Objects.requireNonNull(theTopic, "topic must not be null");
    consumerGroupPrefix = Objects.requireNonNull(theConsumerGroupPrefix,
        "consumerGroupPrefix must not be null");
    pollTimeout = Objects.requireNonNull(thePollTimeout,
        "pollTimeout must not be null");
    if (pollTimeout.isNegative() || pollTimeout.isZero()) {
      throw new IllegalArgumentException(
          "pollTimeout must be positive, got: " + pollTimeout);
    }
  }

  /** Creates a configuration with the default topic and group prefix.
   *
   * @param bootstrapServers the Kafka bootstrap servers (e.g.
   *        "localhost:9092"), never null
   *
   * @return a new KafkaChannelConfig, never null
   */
  public static KafkaChannelConfig create(final String bootstrapServers) {
    return new KafkaChannelConfig(bootstrapServers, DEFAULT_TOPIC,
        DEFAULT_CONSUMER_GROUP_PREFIX, DEFAULT_POLL_TIMEOUT);
  }

  /** Creates a configuration with a custom topic and group prefix.
   *
   * @param bootstrapServers the Kafka bootstrap servers, never null
   * @param topic the topic change events are published on, never null
   * @param consumerGroupPrefix the prefix of each channel's consumer
   *        group, never null
   *
   * @return a new KafkaChannelConfig, never null
   */
  public static KafkaChannelConfig create(final String bootstrapServers,
      final String topic, final String consumerGroupPrefix) {
    return new KafkaChannelConfig(bootstrapServers, topic,
        consumerGroupPrefix, DEFAULT_POLL_TIMEOUT);
  }

  /** Returns a copy of this configuration with another poll timeout.
   *
   * @param thePollTimeout the consumer poll timeout, must be positive
   *
   * @return a new KafkaChannelConfig, never null
   */
  public KafkaChannelConfig withPollTimeout(final Duration thePollTimeout) {
    return new KafkaChannelConfig(bootstrapServers, topic,
        consumerGroupPrefix, thePollTimeout);
  }

  /** Returns the Kafka bootstrap servers connection string.
   *
   * @return the bootstrap servers, never null
   */
  public String bootstrapServers() {
    return bootstrapServers;
  }

  /** Returns the topic change events are consumed from.
   *
   * @return the topic name, never null
   */
  public String topic() {
    return topic;
  }

  /** Returns the prefix used to generate unique consumer group ids.
   *
   * @return the consumer group prefix, never null
   */
  public String consumerGroupPrefix() {
    return consumerGroupPrefix;
  }

  /** Returns the timeout of each consumer poll.
   *
   * @return the poll timeout, never null
   */
  public Duration pollTimeout() {
    return pollTimeout;
  }
}
