package io.github.wphillipmoore.dynamiq.client.queue;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Queue settings sent by {@code configureQueue}.
 *
 * <p>Every attribute is optional; only the ones that are set appear in the request body, so the
 * server keeps its current value for the rest.
 *
 * @param visibilityTimeout seconds before a received but unacknowledged message is served again
 * @param minPartitions the minimum number of partitions the queue serves messages from
 * @param maxPartitions the maximum number of partitions the queue serves messages from
 */
public record QueueConfig(
    @Nullable Integer visibilityTimeout,
    @Nullable Integer minPartitions,
    @Nullable Integer maxPartitions)
    implements Serializable {

  static final String VISIBILITY_TIMEOUT = "visibility_timeout";
  static final String MIN_PARTITIONS = "min_partitions";
  static final String MAX_PARTITIONS = "max_partitions";

  /**
   * Creates a queue configuration.
   *
   * @throws IllegalArgumentException if a set value is not positive, or if {@code minPartitions}
   *     exceeds {@code maxPartitions}
   */
  public QueueConfig {
    requirePositive(visibilityTimeout, "visibilityTimeout");
    requirePositive(minPartitions, "minPartitions");
    requirePositive(maxPartitions, "maxPartitions");
    if (minPartitions != null && maxPartitions != null && minPartitions > maxPartitions) {
      throw new IllegalArgumentException("minPartitions must be <= maxPartitions");
    }
  }

  /** Returns a builder with no attributes set. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns {@code true} when no attribute is set. */
  public boolean isEmpty() {
    return visibilityTimeout == null && minPartitions == null && maxPartitions == null;
  }

  /**
   * Returns the JSON payload for this configuration, keyed by the server's attribute names.
   *
   * @return a mutable map containing only the set attributes
   */
  public Map<String, Object> toPayload() {
    Map<String, Object> payload = new LinkedHashMap<>();
    if (visibilityTimeout != null) {
      payload.put(VISIBILITY_TIMEOUT, visibilityTimeout);
    }
    if (minPartitions != null) {
      payload.put(MIN_PARTITIONS, minPartitions);
    }
    if (maxPartitions != null) {
      payload.put(MAX_PARTITIONS, maxPartitions);
    }
    return payload;
  }

  private static void requirePositive(@Nullable Integer value, String name) {
    if (value != null && value <= 0) {
      throw new IllegalArgumentException(name + " must be > 0");
    }
  }

  /** Builder for {@link QueueConfig}. */
  public static final class Builder {

    private @Nullable Integer visibilityTimeout;
    private @Nullable Integer minPartitions;
    private @Nullable Integer maxPartitions;

    private Builder() {}

    /** Sets the visibility timeout in seconds. */
    public Builder visibilityTimeout(int seconds) {
      this.visibilityTimeout = seconds;
      return this;
    }

    /** Sets the minimum number of partitions. */
    public Builder minPartitions(int minPartitions) {
      this.minPartitions = minPartitions;
      return this;
    }

    /** Sets the maximum number of partitions. */
    public Builder maxPartitions(int maxPartitions) {
      this.maxPartitions = maxPartitions;
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return the configuration
     * @throws IllegalArgumentException if the values are inconsistent
     */
    public QueueConfig build() {
      return new QueueConfig(visibilityTimeout, minPartitions, maxPartitions);
    }
  }
}
