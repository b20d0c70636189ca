package io.arrowsource.formats.config;

/**
 * How a single payload is split into logical records. A deserializer without framing treats each
 * payload as one record.
 */
public sealed interface Framing {

  /** Returns newline framing without a line length limit. */
  static Framing newline() {
    return new Newline(null);
  }

  /** Returns newline framing that truncates each line to {@code maxLineLength} bytes. */
  static Framing newline(long maxLineLength) {
    return new Newline(maxLineLength);
  }

  /**
   * Records are separated by {@code '\n'}. A trailing delimiter does not produce an empty record.
   *
   * @param maxLineLength maximum bytes emitted per record, or null for no limit. Bytes past the
   *     limit are discarded up to the next delimiter.
   */
  record Newline(Long maxLineLength) implements Framing {
    public Newline {
      if (maxLineLength != null && maxLineLength < 0) {
        throw new IllegalArgumentException("maxLineLength must not be negative: " + maxLineLength);
      }
    }
  }
}
