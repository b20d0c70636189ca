package io.arrowsource.formats;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.apache.arrow.vector.BaseFixedWidthVector;
import org.apache.arrow.vector.BaseLargeVariableWidthVector;
import org.apache.arrow.vector.BaseVariableWidthVector;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.DateMilliVector;
import org.apache.arrow.vector.Decimal256Vector;
import org.apache.arrow.vector.DecimalVector;
import org.apache.arrow.vector.DurationVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.FixedSizeBinaryVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.LargeVarBinaryVector;
import org.apache.arrow.vector.LargeVarCharVector;
import org.apache.arrow.vector.NullVector;
import org.apache.arrow.vector.SmallIntVector;
import org.apache.arrow.vector.TimeMicroVector;
import org.apache.arrow.vector.TimeMilliVector;
import org.apache.arrow.vector.TimeNanoVector;
import org.apache.arrow.vector.TimeSecVector;
import org.apache.arrow.vector.TimeStampVector;
import org.apache.arrow.vector.TinyIntVector;
import org.apache.arrow.vector.UInt1Vector;
import org.apache.arrow.vector.UInt2Vector;
import org.apache.arrow.vector.UInt4Vector;
import org.apache.arrow.vector.UInt8Vector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.complex.FixedSizeListVector;
import org.apache.arrow.vector.complex.LargeListVector;
import org.apache.arrow.vector.complex.ListVector;
import org.apache.arrow.vector.complex.StructVector;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;

/**
 * Writes converted values into Arrow vectors.
 *
 * <p>Values must already have the Java representation produced by {@link JsonValueConverter} for
 * the vector's field: {@code Long} for integers, timestamps, times of day and durations, {@code
 * Double} for floating point, {@code Integer} for day dates, {@code byte[]} for binary, {@code
 * Object[]} for structs (one entry per child) and {@code List} for lists. A map is a {@code List}
 * of two-element {@code Object[]} entries.
 */
final class VectorWriter {
  private VectorWriter() {}

  /**
   * Checks that values of the column, and of every nested child, can be written.
   *
   * @throws SchemaContractException naming the column otherwise
   */
  static void checkWritable(Field column) {
    String unsupported = unsupportedType(column);
    if (unsupported != null) {
      throw new SchemaContractException(
          column.getName(), "cannot write values of type " + unsupported);
    }
  }

  private static String unsupportedType(Field field) {
    ArrowType type = field.getType();
    if (field.getDictionary() != null) {
      return "dictionary-encoded " + type;
    }
    boolean writable =
        switch (type.getTypeID()) {
          case Null, Struct, List, LargeList, FixedSizeList, Map, Int, Utf8, LargeUtf8, Binary,
              LargeBinary, FixedSizeBinary, Bool, Decimal, Date, Time, Timestamp, Duration -> true;
          case FloatingPoint -> ((ArrowType.FloatingPoint) type).getPrecision()
              != FloatingPointPrecision.HALF;
          default -> false;
        };
    if (!writable) {
      return type.toString();
    }
    for (Field child : field.getChildren()) {
      String unsupported = unsupportedType(child);
      if (unsupported != null) {
        return unsupported;
      }
    }
    return null;
  }

  static void write(FieldVector vector, int index, Object value) {
    if (value == null) {
      writeNull(vector, index);
      return;
    }
    if (vector instanceof BigIntVector v) {
      v.setSafe(index, (Long) value);
    } else if (vector instanceof IntVector v) {
      v.setSafe(index, ((Long) value).intValue());
    } else if (vector instanceof SmallIntVector v) {
      v.setSafe(index, ((Long) value).intValue());
    } else if (vector instanceof TinyIntVector v) {
      v.setSafe(index, ((Long) value).intValue());
    } else if (vector instanceof UInt1Vector v) {
      v.setSafe(index, ((Long) value).intValue());
    } else if (vector instanceof UInt2Vector v) {
      v.setSafe(index, ((Long) value).intValue());
    } else if (vector instanceof UInt4Vector v) {
      v.setSafe(index, ((Long) value).intValue());
    } else if (vector instanceof UInt8Vector v) {
      v.setSafe(index, (Long) value);
    } else if (vector instanceof Float8Vector v) {
      v.setSafe(index, (Double) value);
    } else if (vector instanceof Float4Vector v) {
      v.setSafe(index, ((Double) value).floatValue());
    } else if (vector instanceof BitVector v) {
      v.setSafe(index, ((Boolean) value) ? 1 : 0);
    } else if (vector instanceof VarCharVector v) {
      v.setSafe(index, ((String) value).getBytes(StandardCharsets.UTF_8));
    } else if (vector instanceof LargeVarCharVector v) {
      v.setSafe(index, ((String) value).getBytes(StandardCharsets.UTF_8));
    } else if (vector instanceof VarBinaryVector v) {
      v.setSafe(index, (byte[]) value);
    } else if (vector instanceof LargeVarBinaryVector v) {
      v.setSafe(index, (byte[]) value);
    } else if (vector instanceof FixedSizeBinaryVector v) {
      v.setSafe(index, (byte[]) value);
    } else if (vector instanceof TimeStampVector v) {
      v.setSafe(index, (Long) value);
    } else if (vector instanceof DateDayVector v) {
      v.setSafe(index, (Integer) value);
    } else if (vector instanceof DateMilliVector v) {
      v.setSafe(index, (Long) value);
    } else if (vector instanceof TimeSecVector v) {
      v.setSafe(index, ((Long) value).intValue());
    } else if (vector instanceof TimeMilliVector v) {
      v.setSafe(index, ((Long) value).intValue());
    } else if (vector instanceof TimeMicroVector v) {
      v.setSafe(index, (Long) value);
    } else if (vector instanceof TimeNanoVector v) {
      v.setSafe(index, (Long) value);
    } else if (vector instanceof DurationVector v) {
      v.setSafe(index, (Long) value);
    } else if (vector instanceof DecimalVector v) {
      v.setSafe(index, (BigDecimal) value);
    } else if (vector instanceof Decimal256Vector v) {
      v.setSafe(index, (BigDecimal) value);
    } else if (vector instanceof StructVector v) {
      writeStruct(v, index, (Object[]) value);
    } else if (vector instanceof ListVector v) {
      // includes maps, whose entries are structs
      writeList(v, index, (List<?>) value);
    } else if (vector instanceof LargeListVector v) {
      writeLargeList(v, index, (List<?>) value);
    } else if (vector instanceof FixedSizeListVector v) {
      writeFixedSizeList(v, index, (List<?>) value);
    } else {
      throw new IllegalStateException(
          "no writer for vector " + vector.getClass().getSimpleName() + " of " + vector.getField());
    }
  }

  static void writeNull(FieldVector vector, int index) {
    if (vector instanceof BaseFixedWidthVector v) {
      v.setNull(index);
    } else if (vector instanceof BaseVariableWidthVector v) {
      v.setNull(index);
    } else if (vector instanceof BaseLargeVariableWidthVector v) {
      v.setNull(index);
    } else if (vector instanceof StructVector v) {
      v.setNull(index);
      // children stay aligned with the parent
      for (FieldVector child : v.getChildrenFromFields()) {
        writeNull(child, index);
      }
    } else if (vector instanceof ListVector v) {
      v.setNull(index);
    } else if (vector instanceof LargeListVector v) {
      v.setNull(index);
    } else if (vector instanceof FixedSizeListVector v) {
      v.setNull(index);
    } else if (vector instanceof NullVector v) {
      v.setNull(index);
    } else {
      throw new IllegalStateException(
          "no writer for vector " + vector.getClass().getSimpleName() + " of " + vector.getField());
    }
  }

  private static void writeStruct(StructVector vector, int index, Object[] values) {
    List<FieldVector> children = vector.getChildrenFromFields();
    if (children.size() != values.length) {
      throw new IllegalStateException(
          "struct " + vector.getName() + " has " + children.size() + " children, got "
              + values.length);
    }
    vector.setIndexDefined(index);
    for (int i = 0; i < values.length; i++) {
      write(children.get(i), index, values[i]);
    }
  }

  private static void writeList(ListVector vector, int index, List<?> values) {
    FieldVector data = (FieldVector) vector.getDataVector();
    int offset = vector.startNewValue(index);
    for (int i = 0; i < values.size(); i++) {
      write(data, offset + i, values.get(i));
    }
    vector.endValue(index, values.size());
  }

  private static void writeLargeList(LargeListVector vector, int index, List<?> values) {
    FieldVector data = (FieldVector) vector.getDataVector();
    long offset = vector.startNewValue(index);
    for (int i = 0; i < values.size(); i++) {
      write(data, Math.toIntExact(offset + i), values.get(i));
    }
    vector.endValue(index, values.size());
  }

  private static void writeFixedSizeList(FixedSizeListVector vector, int index, List<?> values) {
    if (values.size() != vector.getListSize()) {
      throw new IllegalStateException(
          "list " + vector.getName() + " holds " + vector.getListSize() + " values, got "
              + values.size());
    }
    FieldVector data = (FieldVector) vector.getDataVector();
    int offset = vector.startNewValue(index);
    for (int i = 0; i < values.size(); i++) {
      write(data, offset + i, values.get(i));
    }
  }
}
