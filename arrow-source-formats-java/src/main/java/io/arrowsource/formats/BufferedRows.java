package io.arrowsource.formats;

import com.fasterxml.jackson.databind.JsonNode;
import io.arrowsource.formats.config.BadData;
import io.arrowsource.formats.config.TimestampFormat;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.apache.arrow.vector.types.pojo.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rows decoded through the incremental JSON buffer, together with the columns that never appear in
 * payloads: the arrival timestamp and the queue metadata.
 *
 * <p>Those side channels receive one entry per buffered row, in lock-step with the JSON buffer. On
 * flush, the timestamp column is inserted at its schema position and, if metadata was supplied
 * during the cycle, the metadata columns decoded from JSON are replaced by the side channels. Under
 * {@link BadData#DROP} the side channels are filtered by the same mask as the decoded rows.
 */
final class BufferedRows implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(BufferedRows.class);

  private static final List<String> METADATA_FIELDS =
      List.of(TargetSchema.TOPIC_FIELD, TargetSchema.PARTITION_FIELD, TargetSchema.OFFSET_FIELD);

  private final TargetSchema schema;
  private final BadData badData;
  private final BufferAllocator allocator;
  private final JsonRowBuffer json;
  private final ColumnBuilder.TimestampNanos timestamps;
  // topic, partition, offset; created on first use
  private ColumnBuilder[] metadata;
  private boolean metadataStaged;

  BufferedRows(
      TargetSchema schema,
      BadData badData,
      TimestampFormat timestampFormat,
      BufferAllocator allocator) {
    this.schema = schema;
    this.badData = badData;
    this.allocator = allocator;
    this.json = new JsonRowBuffer(decodedSchema(schema), timestampFormat, allocator);
    this.timestamps =
        (ColumnBuilder.TimestampNanos)
            ColumnBuilder.create(schema.fields().get(schema.timestampIndex()), allocator);
  }

  /**
   * The shape of rows decoded from payloads: the target schema without its timestamp, with the
   * metadata columns made nullable since payloads rarely carry them.
   */
  static Schema decodedSchema(TargetSchema schema) {
    List<Field> fields = new ArrayList<>();
    for (Field field : schema.schemaWithoutTimestamp().getFields()) {
      fields.add(METADATA_FIELDS.contains(field.getName()) ? nullable(field) : field);
    }
    return new Schema(fields);
  }

  int bufferedRows() {
    return json.bufferedRows();
  }

  /**
   * Buffers the JSON objects in {@code record} and stages one side-channel entry per object.
   *
   * @return the number of rows buffered
   * @throws SourceException with a bad-data error if the record is not well-formed JSON
   * @throws SchemaContractException if metadata is enabled but a metadata column is missing
   */
  int decode(ByteBuffer record, Instant arrival, QueueMetadata md) {
    prepareMetadata(md);
    int rows;
    try {
      rows = json.decode(record);
    } catch (IOException e) {
      throw SourceException.badData("invalid JSON: " + e.getMessage(), e);
    }
    stage(rows, arrival, md);
    return rows;
  }

  /** Buffers an already parsed JSON object as one row. */
  void decode(JsonNode row, Instant arrival, QueueMetadata md) {
    if (!row.isObject()) {
      throw SourceException.badData("expected a JSON object, found " + row.getNodeType());
    }
    prepareMetadata(md);
    json.decode(row);
    stage(1, arrival, md);
  }

  private void prepareMetadata(QueueMetadata md) {
    if (md.enabled() && metadata == null) {
      metadata = createMetadataBuilders();
    }
  }

  private void stage(int rows, Instant arrival, QueueMetadata md) {
    for (int i = 0; i < rows; i++) {
      timestamps.append(arrival);
      if (metadata != null) {
        appendMetadata(md);
      }
    }
    metadataStaged |= md.enabled() && rows > 0;
  }

  private void appendMetadata(QueueMetadata md) {
    if (!md.enabled()) {
      for (ColumnBuilder builder : metadata) {
        builder.appendNull();
      }
      return;
    }
    ((ColumnBuilder.Utf8) metadata[0]).append(md.topic());
    ((ColumnBuilder.Int32) metadata[1]).append(md.partition());
    ((ColumnBuilder.Int64) metadata[2]).append(md.offset());
  }

  private ColumnBuilder[] createMetadataBuilders() {
    ColumnBuilder[] builders = new ColumnBuilder[METADATA_FIELDS.size()];
    List<Class<? extends ColumnBuilder>> types =
        List.of(ColumnBuilder.Utf8.class, ColumnBuilder.Int32.class, ColumnBuilder.Int64.class);
    int pending = timestamps.length();
    for (int i = 0; i < builders.length; i++) {
      OptionalInt index = schema.columnIndex(METADATA_FIELDS.get(i));
      if (index.isEmpty()) {
        closeAll(builders);
        throw new SchemaContractException(
            METADATA_FIELDS.get(i), "queue metadata is enabled but the column is missing");
      }
      Field target = schema.fields().get(index.getAsInt());
      ColumnBuilder builder = ColumnBuilder.create(nullable(target), allocator);
      if (!types.get(i).isInstance(builder)) {
        builder.close();
        closeAll(builders);
        throw new SchemaContractException(
            target.getName(), "queue metadata column is declared as " + target.getType());
      }
      // rows buffered earlier in this cycle carried no metadata
      for (int r = 0; r < pending; r++) {
        builder.appendNull();
      }
      builders[i] = builder;
    }
    return builders;
  }

  /**
   * Drains the buffer into a batch of the target schema.
   *
   * @return the batch, or empty if no rows were buffered or every buffered row was dropped
   * @throws SourceException with a bad-data error when {@link BadData#FAIL} is in effect and a row
   *     does not conform to the schema. All buffered rows are discarded in that case.
   */
  Optional<VectorSchemaRoot> flush() {
    if (json.bufferedRows() == 0) {
      return Optional.empty();
    }
    boolean replaceMetadata = metadataStaged;
    metadataStaged = false;
    JsonRowBuffer.Flushed flushed;
    try {
      flushed = badData == BadData.FAIL ? json.flushStrict() : json.flushLenient();
    } catch (JsonValueConverter.ConversionException e) {
      clearSideChannels();
      throw SourceException.badData("JSON does not match schema: " + e.getMessage(), e);
    } catch (RuntimeException e) {
      clearSideChannels();
      throw e;
    }

    List<FieldVector> columns = new ArrayList<>(flushed.columns());
    try {
      stitch(columns, flushed, replaceMetadata);
    } catch (RuntimeException e) {
      columns.forEach(FieldVector::close);
      clearSideChannels();
      throw e;
    }

    if (flushed.droppedCount() > 0) {
      logger.warn(
          "Dropped {} of {} buffered rows that do not match the schema; first error: {}",
          flushed.droppedCount(),
          flushed.kept().length,
          flushed.dropReasons().get(0));
      if (logger.isDebugEnabled()) {
        for (String reason : flushed.dropReasons()) {
          logger.debug("Dropped row: {}", reason);
        }
      }
    }
    logger.debug("Flushed {} buffered rows", flushed.rowCount());
    if (flushed.rowCount() == 0) {
      columns.forEach(FieldVector::close);
      return Optional.empty();
    }
    return Optional.of(new VectorSchemaRoot(batchFields(columns), columns, flushed.rowCount()));
  }

  private void stitch(
      List<FieldVector> columns, JsonRowBuffer.Flushed flushed, boolean replaceMetadata) {
    boolean filter = flushed.droppedCount() > 0;
    columns.add(
        schema.timestampIndex(), filter ? timestamps.finish(flushed.kept()) : timestamps.finish());
    if (metadata != null) {
      for (int i = 0; i < metadata.length; i++) {
        ColumnBuilder builder = metadata[i];
        FieldVector staged = filter ? builder.finish(flushed.kept()) : builder.finish();
        if (replaceMetadata) {
          int index = schema.columnIndex(METADATA_FIELDS.get(i)).getAsInt();
          columns.set(index, staged).close();
        } else {
          staged.close();
        }
      }
    }
  }

  /**
   * The target fields, except that a non-nullable metadata column holding nulls is declared
   * nullable. That happens when payloads lack the column and no metadata replaced it.
   */
  private List<Field> batchFields(List<FieldVector> columns) {
    List<Field> fields = new ArrayList<>(schema.fields());
    for (int i = 0; i < fields.size(); i++) {
      Field field = fields.get(i);
      if (!field.isNullable() && columns.get(i).getNullCount() > 0) {
        fields.set(i, nullable(field));
      }
    }
    return fields;
  }

  private void clearSideChannels() {
    timestamps.clear();
    if (metadata != null) {
      for (ColumnBuilder builder : metadata) {
        builder.clear();
      }
    }
  }

  private static Field nullable(Field field) {
    FieldType type = field.getFieldType();
    return new Field(
        field.getName(),
        new FieldType(true, type.getType(), type.getDictionary(), type.getMetadata()),
        field.getChildren());
  }

  private static void closeAll(ColumnBuilder[] builders) {
    for (ColumnBuilder builder : builders) {
      if (builder != null) {
        builder.close();
      }
    }
  }

  @Override
  public void close() {
    json.close();
    timestamps.close();
    if (metadata != null) {
      closeAll(metadata);
    }
  }
}
