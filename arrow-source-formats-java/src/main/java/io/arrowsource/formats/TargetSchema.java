package io.arrowsource.formats;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import org.apache.arrow.vector.types.TimeUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.apache.arrow.vector.types.pojo.Schema;

/**
 * The output schema of a deserializer: an Arrow schema with one column distinguished as the event
 * timestamp and, optionally, a set of key columns.
 *
 * <p>The timestamp column must be a nanosecond timestamp. It is never present in source payloads;
 * decoders fill it with the arrival time supplied by the caller.
 */
public final class TargetSchema {
  /** Name of the event timestamp column used by {@link #unkeyed(Schema)}. */
  public static final String TIMESTAMP_FIELD = "_timestamp";

  public static final String TOPIC_FIELD = "topic";
  public static final String PARTITION_FIELD = "partition";
  public static final String OFFSET_FIELD = "offset";

  private final Schema schema;
  private final int timestampIndex;
  private final List<Integer> keyIndices;

  private TargetSchema(Schema schema, int timestampIndex, List<Integer> keyIndices) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.timestampIndex = timestampIndex;
    this.keyIndices = List.copyOf(keyIndices);
    ArrowType type = schema.getFields().get(timestampIndex).getType();
    if (!(type instanceof ArrowType.Timestamp ts) || ts.getUnit() != TimeUnit.NANOSECOND) {
      throw new SchemaContractException(
          schema.getFields().get(timestampIndex).getName(),
          "timestamp column must be Timestamp(NANOSECOND), found " + type);
    }
  }

  /**
   * Creates a target schema without key columns, locating the timestamp by {@value
   * #TIMESTAMP_FIELD}.
   *
   * @throws SchemaContractException if the schema has no timestamp column
   */
  public static TargetSchema unkeyed(Schema schema) {
    return new TargetSchema(schema, requireIndex(schema, TIMESTAMP_FIELD), List.of());
  }

  /**
   * Creates a target schema whose rows are keyed by the named columns.
   *
   * @throws SchemaContractException if the timestamp or a key column is missing
   */
  public static TargetSchema keyed(Schema schema, List<String> keyColumns) {
    List<Integer> keys = new ArrayList<>(keyColumns.size());
    for (String key : keyColumns) {
      keys.add(requireIndex(schema, key));
    }
    return new TargetSchema(schema, requireIndex(schema, TIMESTAMP_FIELD), keys);
  }

  /** Creates a target schema with an explicit timestamp column index. */
  public static TargetSchema of(Schema schema, int timestampIndex, List<Integer> keyIndices) {
    if (timestampIndex < 0 || timestampIndex >= schema.getFields().size()) {
      throw new IllegalArgumentException("timestamp index out of range: " + timestampIndex);
    }
    return new TargetSchema(schema, timestampIndex, keyIndices);
  }

  /** Returns the nanosecond timestamp field used for event time columns. */
  public static Field timestampField() {
    return new Field(
        TIMESTAMP_FIELD,
        FieldType.notNullable(new ArrowType.Timestamp(TimeUnit.NANOSECOND, null)),
        null);
  }

  public Schema schema() {
    return schema;
  }

  public List<Field> fields() {
    return schema.getFields();
  }

  public int timestampIndex() {
    return timestampIndex;
  }

  public List<Integer> keyIndices() {
    return keyIndices;
  }

  /** Returns the position of the named column, if present. */
  public OptionalInt columnIndex(String name) {
    List<Field> fields = schema.getFields();
    for (int i = 0; i < fields.size(); i++) {
      if (fields.get(i).getName().equals(name)) {
        return OptionalInt.of(i);
      }
    }
    return OptionalInt.empty();
  }

  /**
   * Returns the schema with the timestamp column removed. This is the shape of rows that are
   * decoded from payloads.
   */
  public Schema schemaWithoutTimestamp() {
    List<Field> fields = new ArrayList<>(schema.getFields());
    fields.remove(timestampIndex);
    return new Schema(fields, schema.getCustomMetadata());
  }

  private static int requireIndex(Schema schema, String name) {
    List<Field> fields = schema.getFields();
    for (int i = 0; i < fields.size(); i++) {
      if (fields.get(i).getName().equals(name)) {
        return i;
      }
    }
    throw new SchemaContractException(name, "no such column in schema " + schema);
  }

  @Override
  public String toString() {
    return "TargetSchema{schema="
        + schema
        + ", timestampIndex="
        + timestampIndex
        + ", keyIndices="
        + keyIndices
        + "}";
  }
}
