package io.arrowsource.formats;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.arrowsource.formats.config.TimestampFormat;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.apache.arrow.vector.types.DateUnit;
import org.apache.arrow.vector.types.TimeUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;

/**
 * Converts parsed JSON values into the Java representation {@link VectorWriter} expects for a
 * field.
 *
 * <p>Conversion is lenient in the same places as common JSON readers: integers and floats may be
 * given as numeric strings, binary values as base64 strings, and timestamps either as ISO-8601
 * strings or as numbers. Times of day and durations are numbers in the column's unit, or ISO-8601
 * local times and durations. Maps are JSON objects. Anything else that does not fit the field's
 * type is a {@link ConversionException}.
 */
final class JsonValueConverter {
  private final TimestampFormat timestampFormat;

  JsonValueConverter(TimestampFormat timestampFormat) {
    this.timestampFormat = timestampFormat;
  }

  /** Thrown when a JSON value does not conform to the field it is decoded into. */
  static final class ConversionException extends Exception {
    ConversionException(String path, String message) {
      super(path + ": " + message);
    }
  }

  /**
   * Converts a JSON object into one value per field. Unknown members are ignored; absent members
   * are null.
   */
  Object[] convertRow(List<Field> fields, JsonNode row) throws ConversionException {
    Object[] values = new Object[fields.size()];
    for (int i = 0; i < fields.size(); i++) {
      Field field = fields.get(i);
      values[i] = convert(field, row.get(field.getName()), field.getName());
    }
    return values;
  }

  Object convert(Field field, JsonNode node, String path) throws ConversionException {
    if (node == null || node.isNull()) {
      if (!field.isNullable()) {
        throw new ConversionException(path, "missing value for non-nullable field");
      }
      return null;
    }
    ArrowType type = field.getType();
    if (type instanceof ArrowType.Int intType) {
      return toInteger(intType, node, path);
    } else if (type instanceof ArrowType.FloatingPoint) {
      return toDouble(node, path);
    } else if (type instanceof ArrowType.Bool) {
      if (!node.isBoolean()) {
        throw mismatch(path, "boolean", node);
      }
      return node.booleanValue();
    } else if (type instanceof ArrowType.Utf8 || type instanceof ArrowType.LargeUtf8) {
      if (!node.isTextual()) {
        throw mismatch(path, "string", node);
      }
      return node.textValue();
    } else if (type instanceof ArrowType.Binary || type instanceof ArrowType.LargeBinary) {
      return toBytes(node, path);
    } else if (type instanceof ArrowType.FixedSizeBinary fixed) {
      byte[] bytes = toBytes(node, path);
      if (bytes.length != fixed.getByteWidth()) {
        throw new ConversionException(
            path, "expected " + fixed.getByteWidth() + " bytes, got " + bytes.length);
      }
      return bytes;
    } else if (type instanceof ArrowType.Timestamp ts) {
      return toTimestamp(ts.getUnit(), node, path);
    } else if (type instanceof ArrowType.Date date) {
      return toDate(date.getUnit(), node, path);
    } else if (type instanceof ArrowType.Decimal decimal) {
      return toDecimal(decimal, node, path);
    } else if (type instanceof ArrowType.Struct) {
      if (!node.isObject()) {
        throw mismatch(path, "object", node);
      }
      List<Field> children = field.getChildren();
      Object[] values = new Object[children.size()];
      for (int i = 0; i < children.size(); i++) {
        Field child = children.get(i);
        values[i] = convert(child, node.get(child.getName()), path + "." + child.getName());
      }
      return values;
    } else if (type instanceof ArrowType.Time time) {
      return toTimeOfDay(time.getUnit(), node, path);
    } else if (type instanceof ArrowType.Duration duration) {
      return toDuration(duration.getUnit(), node, path);
    } else if (type instanceof ArrowType.List || type instanceof ArrowType.LargeList) {
      return toList(field, node, path);
    } else if (type instanceof ArrowType.FixedSizeList fixed) {
      List<Object> values = toList(field, node, path);
      if (values.size() != fixed.getListSize()) {
        throw new ConversionException(
            path, "expected " + fixed.getListSize() + " values, got " + values.size());
      }
      return values;
    } else if (type instanceof ArrowType.Map) {
      return toMap(field, node, path);
    } else if (type instanceof ArrowType.Null) {
      return null;
    }
    throw new ConversionException(path, "unsupported column type " + type);
  }

  private List<Object> toList(Field field, JsonNode node, String path)
      throws ConversionException {
    if (!node.isArray()) {
      throw mismatch(path, "array", node);
    }
    Field item = field.getChildren().get(0);
    List<Object> values = new ArrayList<>(node.size());
    for (int i = 0; i < node.size(); i++) {
      values.add(convert(item, node.get(i), path + "[" + i + "]"));
    }
    return values;
  }

  // keys arrive as member names and are converted like string values of the key type
  private List<Object> toMap(Field field, JsonNode node, String path) throws ConversionException {
    if (!node.isObject()) {
      throw mismatch(path, "object", node);
    }
    Field entries = field.getChildren().get(0);
    Field key = entries.getChildren().get(0);
    Field value = entries.getChildren().get(1);
    List<Object> values = new ArrayList<>(node.size());
    Iterator<Map.Entry<String, JsonNode>> members = node.fields();
    while (members.hasNext()) {
      Map.Entry<String, JsonNode> member = members.next();
      String entryPath = path + "." + member.getKey();
      values.add(
          new Object[] {
            convert(key, TextNode.valueOf(member.getKey()), entryPath),
            convert(value, member.getValue(), entryPath)
          });
    }
    return values;
  }

  private static Long toTimeOfDay(TimeUnit unit, JsonNode node, String path)
      throws ConversionException {
    long value;
    if (node.isIntegralNumber() && node.canConvertToLong()) {
      value = node.longValue();
    } else if (node.isTextual()) {
      try {
        value = LocalTime.parse(node.textValue().trim()).toNanoOfDay() / nanosPerUnit(unit);
      } catch (DateTimeParseException e) {
        throw new ConversionException(path, "invalid time of day '" + node.textValue() + "'");
      }
    } else {
      throw mismatch(path, "time of day", node);
    }
    long perDay = 86_400_000_000_000L / nanosPerUnit(unit);
    if (value < 0 || value >= perDay) {
      throw new ConversionException(path, value + " is not a time of day in unit " + unit);
    }
    return value;
  }

  private static Long toDuration(TimeUnit unit, JsonNode node, String path)
      throws ConversionException {
    if (node.isIntegralNumber() && node.canConvertToLong()) {
      return node.longValue();
    }
    if (!node.isTextual()) {
      throw mismatch(path, "duration", node);
    }
    String text = node.textValue().trim();
    if (!text.startsWith("P") && !text.startsWith("-P")) {
      try {
        return Long.parseLong(text);
      } catch (NumberFormatException e) {
        throw mismatch(path, "duration", node);
      }
    }
    Duration duration;
    try {
      duration = Duration.parse(text);
    } catch (DateTimeParseException e) {
      throw new ConversionException(path, "invalid duration '" + text + "'");
    }
    try {
      long perSecond = 1_000_000_000L / nanosPerUnit(unit);
      return Math.addExact(
          Math.multiplyExact(duration.getSeconds(), perSecond),
          duration.getNano() / nanosPerUnit(unit));
    } catch (ArithmeticException e) {
      throw new ConversionException(path, text + " is out of range for unit " + unit);
    }
  }

  private static long nanosPerUnit(TimeUnit unit) {
    return switch (unit) {
      case SECOND -> 1_000_000_000L;
      case MILLISECOND -> 1_000_000L;
      case MICROSECOND -> 1_000L;
      case NANOSECOND -> 1L;
    };
  }

  private static Long toInteger(ArrowType.Int type, JsonNode node, String path)
      throws ConversionException {
    BigInteger value;
    if (node.isIntegralNumber()) {
      value = node.bigIntegerValue();
    } else if (node.isTextual()) {
      try {
        value = new BigInteger(node.textValue().trim());
      } catch (NumberFormatException e) {
        throw mismatch(path, "integer", node);
      }
    } else {
      throw mismatch(path, "integer", node);
    }
    int bits = type.getBitWidth();
    BigInteger min =
        type.getIsSigned() ? BigInteger.ONE.shiftLeft(bits - 1).negate() : BigInteger.ZERO;
    BigInteger max =
        type.getIsSigned()
            ? BigInteger.ONE.shiftLeft(bits - 1).subtract(BigInteger.ONE)
            : BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
    if (value.compareTo(min) < 0 || value.compareTo(max) > 0) {
      throw new ConversionException(path, value + " is out of range for " + type);
    }
    // unsigned 64-bit values above Long.MAX_VALUE keep their bit pattern
    return value.longValue();
  }

  private static Double toDouble(JsonNode node, String path) throws ConversionException {
    if (node.isNumber()) {
      return node.doubleValue();
    }
    if (node.isTextual()) {
      try {
        return Double.parseDouble(node.textValue().trim());
      } catch (NumberFormatException e) {
        throw mismatch(path, "number", node);
      }
    }
    throw mismatch(path, "number", node);
  }

  private static byte[] toBytes(JsonNode node, String path) throws ConversionException {
    if (!node.isTextual()) {
      throw mismatch(path, "base64 string", node);
    }
    try {
      return Base64.getDecoder().decode(node.textValue());
    } catch (IllegalArgumentException e) {
      throw new ConversionException(path, "invalid base64: " + e.getMessage());
    }
  }

  private Long toTimestamp(TimeUnit unit, JsonNode node, String path) throws ConversionException {
    if (node.isIntegralNumber()) {
      if (timestampFormat == TimestampFormat.UNIX_MILLIS) {
        return fromInstant(unit, Instant.ofEpochMilli(node.longValue()), path);
      }
      return node.longValue();
    }
    if (!node.isTextual()) {
      throw mismatch(path, "timestamp", node);
    }
    return fromInstant(unit, parseInstant(node.textValue().trim(), path), path);
  }

  private static Instant parseInstant(String text, String path) throws ConversionException {
    try {
      TemporalAccessor parsed =
          DateTimeFormatter.ISO_DATE_TIME.parseBest(
              text.replace(' ', 'T'), OffsetDateTime::from, LocalDateTime::from);
      if (parsed instanceof OffsetDateTime offsetDateTime) {
        return offsetDateTime.toInstant();
      }
      // no offset: interpret as UTC
      return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      throw new ConversionException(path, "invalid timestamp '" + text + "'");
    }
  }

  private static Long fromInstant(TimeUnit unit, Instant instant, String path)
      throws ConversionException {
    try {
      return switch (unit) {
        case SECOND -> instant.getEpochSecond();
        case MILLISECOND -> instant.toEpochMilli();
        case MICROSECOND ->
            Math.addExact(
                Math.multiplyExact(instant.getEpochSecond(), 1_000_000L),
                instant.getNano() / 1_000L);
        case NANOSECOND -> ColumnBuilder.TimestampNanos.toNanos(instant);
      };
    } catch (ArithmeticException e) {
      throw new ConversionException(path, instant + " is out of range for unit " + unit);
    }
  }

  private static Object toDate(DateUnit unit, JsonNode node, String path)
      throws ConversionException {
    long days;
    if (node.isIntegralNumber()) {
      if (unit == DateUnit.MILLISECOND) {
        return node.longValue();
      }
      days = node.longValue();
    } else if (node.isTextual()) {
      try {
        days = LocalDate.parse(node.textValue().trim()).toEpochDay();
      } catch (DateTimeParseException e) {
        throw new ConversionException(path, "invalid date '" + node.textValue() + "'");
      }
    } else {
      throw mismatch(path, "date", node);
    }
    if (unit == DateUnit.MILLISECOND) {
      return days * 86_400_000L;
    }
    if (days < Integer.MIN_VALUE || days > Integer.MAX_VALUE) {
      throw new ConversionException(path, days + " days is out of range");
    }
    return (int) days;
  }

  private static BigDecimal toDecimal(ArrowType.Decimal type, JsonNode node, String path)
      throws ConversionException {
    BigDecimal value;
    if (node.isNumber()) {
      value = node.decimalValue();
    } else if (node.isTextual()) {
      try {
        value = new BigDecimal(node.textValue().trim());
      } catch (NumberFormatException e) {
        throw mismatch(path, "decimal", node);
      }
    } else {
      throw mismatch(path, "decimal", node);
    }
    try {
      value = value.setScale(type.getScale(), RoundingMode.UNNECESSARY);
    } catch (ArithmeticException e) {
      throw new ConversionException(path, value + " does not fit scale " + type.getScale());
    }
    if (value.precision() > type.getPrecision()) {
      throw new ConversionException(path, value + " exceeds precision " + type.getPrecision());
    }
    return value;
  }

  private static ConversionException mismatch(String path, String expected, JsonNode node) {
    String found = node.getNodeType().name().toLowerCase();
    return new ConversionException(path, "expected " + expected + ", found " + found + " " + node);
  }
}
