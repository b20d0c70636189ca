package io.arrowsource.formats;

import java.util.ArrayList;
import java.util.List;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;

/**
 * One {@link ColumnBuilder} per column of a schema, positionally aligned with it.
 *
 * <p>Typed accessors such as {@link #utf8(int)} check the builder's type and throw {@link
 * SchemaContractException} on a mismatch; deserializers call them when they are constructed so that
 * later appends cannot fail on type.
 */
public final class ColumnBuilders implements AutoCloseable {
  private final Schema schema;
  private final List<ColumnBuilder> builders;

  private ColumnBuilders(Schema schema, List<ColumnBuilder> builders) {
    this.schema = schema;
    this.builders = builders;
  }

  /**
   * Creates an empty builder for every field of the schema.
   *
   * @throws SchemaContractException if a column has a type whose values cannot be written
   */
  public static ColumnBuilders create(Schema schema, BufferAllocator allocator) {
    return new ColumnBuilders(schema, createAll(schema, allocator));
  }

  static List<ColumnBuilder> createAll(Schema schema, BufferAllocator allocator) {
    List<ColumnBuilder> builders = new ArrayList<>(schema.getFields().size());
    try {
      for (Field field : schema.getFields()) {
        builders.add(ColumnBuilder.create(field, allocator));
      }
    } catch (RuntimeException e) {
      builders.forEach(ColumnBuilder::close);
      throw e;
    }
    return builders;
  }

  public Schema schema() {
    return schema;
  }

  public int size() {
    return builders.size();
  }

  public ColumnBuilder get(int index) {
    return builders.get(index);
  }

  public ColumnBuilder.Utf8 utf8(int index) {
    return typed(index, ColumnBuilder.Utf8.class, "Utf8");
  }

  public ColumnBuilder.Binary binary(int index) {
    return typed(index, ColumnBuilder.Binary.class, "Binary");
  }

  public ColumnBuilder.Int32 int32(int index) {
    return typed(index, ColumnBuilder.Int32.class, "Int(32, signed)");
  }

  public ColumnBuilder.Int64 int64(int index) {
    return typed(index, ColumnBuilder.Int64.class, "Int(64, signed)");
  }

  public ColumnBuilder.TimestampNanos timestamp(int index) {
    return typed(index, ColumnBuilder.TimestampNanos.class, "Timestamp(NANOSECOND)");
  }

  /** Returns the number of rows appended so far, or throws if the columns disagree. */
  public int rowCount() {
    int rows = builders.isEmpty() ? 0 : builders.get(0).length();
    for (ColumnBuilder builder : builders) {
      if (builder.length() != rows) {
        throw new IllegalStateException(
            "column " + builder.field().getName() + " has " + builder.length() + " rows, expected "
                + rows);
      }
    }
    return rows;
  }

  /**
   * Finishes every builder and assembles the columns into a batch owned by the caller.
   *
   * @throws IllegalStateException if the builders hold different numbers of values
   */
  public VectorSchemaRoot finishBatch() {
    int rows = rowCount();
    List<FieldVector> vectors = new ArrayList<>(builders.size());
    for (ColumnBuilder builder : builders) {
      vectors.add(builder.finish());
    }
    return new VectorSchemaRoot(schema.getFields(), vectors, rows);
  }

  @Override
  public void close() {
    for (ColumnBuilder builder : builders) {
      builder.close();
    }
  }

  private <T extends ColumnBuilder> T typed(int index, Class<T> type, String expected) {
    ColumnBuilder builder = builders.get(index);
    if (!type.isInstance(builder)) {
      throw new SchemaContractException(
          builder.field().getName(),
          "expected " + expected + " but column is declared as " + builder.field().getType());
    }
    return type.cast(builder);
  }
}
