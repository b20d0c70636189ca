package io.arrowsource.formats.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Thresholds that decide when buffered rows should be flushed into a batch. Whichever threshold is
 * reached first triggers the flush.
 *
 * <p>Options can also be read from a raw string map:
 *
 * <pre>{@code
 * BufferingOptions options = BufferingOptions.fromStringMap(Map.of(
 *     "source.batch_size", "1024",
 *     "source.batch_linger_ms", "250"));
 * }</pre>
 *
 * @param batchSize number of buffered rows after which a flush is due (default 512)
 * @param batchLinger maximum time rows may stay buffered (default 100ms)
 */
public record BufferingOptions(int batchSize, Duration batchLinger) {

  public static final String BATCH_SIZE_KEY = "source.batch_size";
  public static final String BATCH_LINGER_MS_KEY = "source.batch_linger_ms";

  static final int DEFAULT_BATCH_SIZE = 512;
  static final Duration DEFAULT_BATCH_LINGER = Duration.ofMillis(100);

  public BufferingOptions {
    Objects.requireNonNull(batchLinger, "batchLinger");
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
    }
    if (batchLinger.isNegative()) {
      throw new IllegalArgumentException("batchLinger must not be negative: " + batchLinger);
    }
  }

  /** Returns the default options. */
  public static BufferingOptions defaults() {
    return builder().build();
  }

  /** Returns a new builder. */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates options from a raw string map. Unknown keys are ignored; missing keys use defaults.
   *
   * @param options the configuration options map
   * @return the parsed options
   * @throws IllegalArgumentException if a value cannot be parsed
   */
  public static BufferingOptions fromStringMap(Map<String, String> options) {
    Builder builder = builder();
    String batchSize = options.get(BATCH_SIZE_KEY);
    if (batchSize != null) {
      builder.batchSize(parseInt(BATCH_SIZE_KEY, batchSize));
    }
    String linger = options.get(BATCH_LINGER_MS_KEY);
    if (linger != null) {
      builder.batchLinger(Duration.ofMillis(parseInt(BATCH_LINGER_MS_KEY, linger)));
    }
    return builder.build();
  }

  /** Returns these options as dotted keys, the inverse of {@link #fromStringMap(Map)}. */
  public Map<String, String> toOptionsMap() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put(BATCH_SIZE_KEY, Integer.toString(batchSize));
    map.put(BATCH_LINGER_MS_KEY, Long.toString(batchLinger.toMillis()));
    return map;
  }

  private static int parseInt(String key, String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
    }
  }

  /** Builder for BufferingOptions. */
  public static final class Builder {
    private int batchSize = DEFAULT_BATCH_SIZE;
    private Duration batchLinger = DEFAULT_BATCH_LINGER;

    private Builder() {}

    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public Builder batchLinger(Duration batchLinger) {
      this.batchLinger = batchLinger;
      return this;
    }

    public BufferingOptions build() {
      return new BufferingOptions(batchSize, batchLinger);
    }
  }
}
