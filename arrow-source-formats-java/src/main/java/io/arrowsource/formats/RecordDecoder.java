package io.arrowsource.formats;

import java.nio.ByteBuffer;
import java.time.Instant;

/** Decodes one framed record of a particular format. */
@FunctionalInterface
interface RecordDecoder {

  /**
   * Decodes a record, either appending it to {@code builders} directly or buffering it.
   *
   * @return the number of rows produced
   * @throws SourceException with a bad-data error if the record cannot be decoded
   */
  int decode(ColumnBuilders builders, ByteBuffer record, Instant arrival, QueueMetadata metadata);
}
