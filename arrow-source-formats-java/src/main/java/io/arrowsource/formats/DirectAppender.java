package io.arrowsource.formats;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.OptionalInt;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;

/**
 * Writes one row straight into the caller's builders: a {@code value} column, the arrival time and,
 * when enabled, the queue metadata columns.
 *
 * <p>The {@code value} column is located and type checked when the appender is created.
 */
final class DirectAppender {
  static final String VALUE_FIELD = "value";

  private final TargetSchema schema;
  private final int valueIndex;

  private DirectAppender(TargetSchema schema, int valueIndex) {
    this.schema = schema;
    this.valueIndex = valueIndex;
  }

  /**
   * Creates an appender writing text into a Utf8 {@code value} column.
   *
   * @throws SchemaContractException if the column is missing or not Utf8
   */
  static DirectAppender forText(TargetSchema schema) {
    return new DirectAppender(schema, requireValue(schema, ArrowType.Utf8.class, "Utf8"));
  }

  /**
   * Creates an appender writing bytes into a Binary {@code value} column.
   *
   * @throws SchemaContractException if the column is missing or not Binary
   */
  static DirectAppender forBytes(TargetSchema schema) {
    return new DirectAppender(schema, requireValue(schema, ArrowType.Binary.class, "Binary"));
  }

  /** Appends the record decoded as UTF-8, replacing malformed sequences. */
  void appendText(ColumnBuilders builders, ByteBuffer record, Instant arrival, QueueMetadata md) {
    appendText(builders, decodeLossy(record), arrival, md);
  }

  void appendText(ColumnBuilders builders, String text, Instant arrival, QueueMetadata md) {
    int[] metadata = metadataIndices(md);
    builders.utf8(valueIndex).append(text);
    appendTimestampAndMetadata(builders, arrival, md, metadata);
  }

  void appendBytes(ColumnBuilders builders, ByteBuffer record, Instant arrival, QueueMetadata md) {
    int[] metadata = metadataIndices(md);
    builders.binary(valueIndex).append(record);
    appendTimestampAndMetadata(builders, arrival, md, metadata);
  }

  // resolved and type checked before the first append so a contract error leaves no partial row
  private int[] metadataIndices(QueueMetadata md) {
    if (!md.enabled()) {
      return null;
    }
    return new int[] {
      requireMetadata(TargetSchema.TOPIC_FIELD, new ArrowType.Utf8()),
      requireMetadata(TargetSchema.PARTITION_FIELD, new ArrowType.Int(32, true)),
      requireMetadata(TargetSchema.OFFSET_FIELD, new ArrowType.Int(64, true))
    };
  }

  private void appendTimestampAndMetadata(
      ColumnBuilders builders, Instant arrival, QueueMetadata md, int[] metadata) {
    builders.timestamp(schema.timestampIndex()).append(arrival);
    if (metadata != null) {
      builders.utf8(metadata[0]).append(md.topic());
      builders.int32(metadata[1]).append(md.partition());
      builders.int64(metadata[2]).append(md.offset());
    }
  }

  private int requireMetadata(String name, ArrowType expected) {
    OptionalInt index = schema.columnIndex(name);
    if (index.isEmpty()) {
      throw new SchemaContractException(
          name, "queue metadata is enabled but the column is missing");
    }
    ArrowType declared = schema.fields().get(index.getAsInt()).getType();
    if (!expected.equals(declared)) {
      throw new SchemaContractException(
          name, "expected " + expected + " but column is declared as " + declared);
    }
    return index.getAsInt();
  }

  private static int requireValue(
      TargetSchema schema, Class<? extends ArrowType> type, String expected) {
    OptionalInt index = schema.columnIndex(VALUE_FIELD);
    if (index.isEmpty()) {
      throw new SchemaContractException(VALUE_FIELD, "no such column in " + schema.schema());
    }
    Field field = schema.fields().get(index.getAsInt());
    if (!type.isInstance(field.getType())) {
      throw new SchemaContractException(
          VALUE_FIELD, "expected " + expected + " but column is declared as " + field.getType());
    }
    return index.getAsInt();
  }

  static String decodeLossy(ByteBuffer bytes) {
    if (bytes.hasArray()) {
      return new String(
          bytes.array(),
          bytes.arrayOffset() + bytes.position(),
          bytes.remaining(),
          StandardCharsets.UTF_8);
    }
    return StandardCharsets.UTF_8.decode(bytes.duplicate()).toString();
  }
}
