package io.arrowsource.formats;

/**
 * Per-message attributes supplied by a queue source.
 *
 * <p>When {@code enabled}, the values are materialized into the {@code topic}, {@code partition}
 * and {@code offset} columns of the target schema for every row decoded from the message.
 *
 * @param enabled whether the metadata should be written
 * @param offset the message offset within its partition
 * @param partition the partition the message was read from
 * @param topic the topic the message was read from
 */
public record QueueMetadata(boolean enabled, long offset, int partition, String topic) {

  private static final QueueMetadata DISABLED = new QueueMetadata(false, 0, 0, "");

  public QueueMetadata {
    if (enabled && topic == null) {
      throw new IllegalArgumentException("topic must be set when metadata is enabled");
    }
  }

  /** Returns metadata that writes nothing. */
  public static QueueMetadata disabled() {
    return DISABLED;
  }

  /** Returns enabled metadata for a message. */
  public static QueueMetadata of(String topic, int partition, long offset) {
    return new QueueMetadata(true, offset, partition, topic);
  }
}
