package io.arrowsource.formats;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.TimeStampVector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.types.TimeUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;

/**
 * An append-only builder for one output column, backed by an Arrow {@link FieldVector}.
 *
 * <p>The concrete builder is picked once from the column's declared type by {@link #create(Field,
 * BufferAllocator)}, so callers holding a typed handle such as {@link Utf8} can only append values
 * of the right type. {@link #finish()} hands the filled vector to the caller and starts a new empty
 * one for the next buffering cycle.
 */
public abstract class ColumnBuilder implements AutoCloseable {
  private final Field field;
  private final BufferAllocator allocator;
  FieldVector vector;
  int length;

  ColumnBuilder(Field field, BufferAllocator allocator) {
    this.field = Objects.requireNonNull(field, "field");
    this.allocator = Objects.requireNonNull(allocator, "allocator");
    this.vector = field.createVector(allocator);
  }

  /**
   * Creates the builder matching the field's type.
   *
   * @param field the output column
   * @param allocator allocator that owns the builder's buffers
   * @return a typed builder, or a generic one for types without a dedicated handle
   * @throws SchemaContractException if values of the field's type cannot be written
   */
  public static ColumnBuilder create(Field field, BufferAllocator allocator) {
    VectorWriter.checkWritable(field);
    ArrowType type = field.getType();
    if (type instanceof ArrowType.Utf8) {
      return new Utf8(field, allocator);
    } else if (type instanceof ArrowType.Binary) {
      return new Binary(field, allocator);
    } else if (type instanceof ArrowType.Int intType && intType.getIsSigned()) {
      if (intType.getBitWidth() == 32) {
        return new Int32(field, allocator);
      } else if (intType.getBitWidth() == 64) {
        return new Int64(field, allocator);
      }
    } else if (type instanceof ArrowType.Timestamp ts && ts.getUnit() == TimeUnit.NANOSECOND) {
      return new TimestampNanos(field, allocator);
    }
    return new Generic(field, allocator);
  }

  /** Returns the column this builder fills. */
  public Field field() {
    return field;
  }

  /** Returns the number of values appended since the last {@link #finish()}. */
  public int length() {
    return length;
  }

  /** Appends a null value. */
  public void appendNull() {
    VectorWriter.writeNull(vector, length);
    length++;
  }

  /**
   * Appends a converted value. See {@link VectorWriter} for the accepted Java representations.
   *
   * @throws ClassCastException if the value does not have the representation of this column
   */
  public void appendValue(Object value) {
    VectorWriter.write(vector, length, value);
    length++;
  }

  /**
   * Returns the appended values as a vector and resets this builder. The returned vector is owned
   * by the caller.
   */
  public FieldVector finish() {
    FieldVector done = vector;
    done.setValueCount(length);
    vector = field.createVector(allocator);
    length = 0;
    return done;
  }

  /**
   * Like {@link #finish()}, keeping only the positions for which {@code keep} is true.
   *
   * @throws IllegalStateException if the mask length differs from the number of appended values
   */
  public FieldVector finish(boolean[] keep) {
    if (keep.length != length) {
      throw new IllegalStateException(
          "mask covers " + keep.length + " rows but column " + field.getName() + " has " + length);
    }
    try (FieldVector all = finish()) {
      FieldVector kept = field.createVector(allocator);
      int out = 0;
      for (int i = 0; i < keep.length; i++) {
        if (keep[i]) {
          kept.copyFromSafe(i, out++, all);
        }
      }
      kept.setValueCount(out);
      return kept;
    }
  }

  /** Discards appended values without producing a vector. */
  public void clear() {
    vector.close();
    vector = field.createVector(allocator);
    length = 0;
  }

  @Override
  public void close() {
    vector.close();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{" + field.getName() + ", length=" + length + "}";
  }

  /** Builder for {@code Utf8} columns. */
  public static final class Utf8 extends ColumnBuilder {
    Utf8(Field field, BufferAllocator allocator) {
      super(field, allocator);
    }

    public void append(String value) {
      ((VarCharVector) vector).setSafe(length, value.getBytes(StandardCharsets.UTF_8));
      length++;
    }
  }

  /** Builder for {@code Binary} columns. */
  public static final class Binary extends ColumnBuilder {
    Binary(Field field, BufferAllocator allocator) {
      super(field, allocator);
    }

    public void append(byte[] value) {
      ((VarBinaryVector) vector).setSafe(length, value);
      length++;
    }

    public void append(ByteBuffer value) {
      ((VarBinaryVector) vector).setSafe(length, value, value.position(), value.remaining());
      length++;
    }
  }

  /** Builder for signed 32-bit integer columns. */
  public static final class Int32 extends ColumnBuilder {
    Int32(Field field, BufferAllocator allocator) {
      super(field, allocator);
    }

    public void append(int value) {
      ((IntVector) vector).setSafe(length, value);
      length++;
    }
  }

  /** Builder for signed 64-bit integer columns. */
  public static final class Int64 extends ColumnBuilder {
    Int64(Field field, BufferAllocator allocator) {
      super(field, allocator);
    }

    public void append(long value) {
      ((BigIntVector) vector).setSafe(length, value);
      length++;
    }
  }

  /** Builder for nanosecond timestamp columns, with or without a time zone. */
  public static final class TimestampNanos extends ColumnBuilder {
    TimestampNanos(Field field, BufferAllocator allocator) {
      super(field, allocator);
    }

    public void append(Instant value) {
      appendNanos(toNanos(value));
    }

    public void appendNanos(long nanos) {
      ((TimeStampVector) vector).setSafe(length, nanos);
      length++;
    }

    static long toNanos(Instant instant) {
      return Math.addExact(
          Math.multiplyExact(instant.getEpochSecond(), 1_000_000_000L), instant.getNano());
    }
  }

  /** Builder for every other type, appended through converted values only. */
  static final class Generic extends ColumnBuilder {
    Generic(Field field, BufferAllocator allocator) {
      super(field, allocator);
    }
  }
}
