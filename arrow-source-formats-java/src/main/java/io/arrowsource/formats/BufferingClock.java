package io.arrowsource.formats;

import io.arrowsource.formats.config.BufferingOptions;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/** Counts rows decoded since the last flush and decides when the next flush is due. */
final class BufferingClock {
  private final BufferingOptions options;
  private final Clock clock;
  private int count;
  private Instant since;

  BufferingClock(BufferingOptions options, Clock clock) {
    this.options = options;
    this.clock = clock;
    this.since = clock.instant();
  }

  void add(int rows) {
    count += rows;
  }

  int count() {
    return count;
  }

  Instant since() {
    return since;
  }

  /** True when rows are pending and either the size or the linger threshold has been reached. */
  boolean shouldFlush() {
    if (count == 0) {
      return false;
    }
    return count >= options.batchSize()
        || Duration.between(since, clock.instant()).compareTo(options.batchLinger()) >= 0;
  }

  void reset() {
    count = 0;
    since = clock.instant();
  }
}
