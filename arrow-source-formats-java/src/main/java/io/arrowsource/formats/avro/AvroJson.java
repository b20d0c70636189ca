package io.arrowsource.formats.avro;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.Collection;
import java.util.Map;
import org.apache.avro.Conversions;
import org.apache.avro.LogicalType;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericFixed;
import org.apache.avro.generic.GenericRecord;

/**
 * Converts generic Avro data into JSON trees.
 *
 * <p>Records and maps become objects, arrays become arrays and unions take the shape of the branch
 * holding the value. Enums, strings and uuids become strings; bytes and fixed become base64
 * strings. Logical types are rendered the way the JSON decoder reads them back: decimals as decimal
 * strings, dates as ISO dates, timestamps as ISO-8601 instants, local timestamps as ISO local date
 * times and times of day as plain numbers.
 */
public final class AvroJson {
  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
  private static final Conversions.DecimalConversion DECIMALS = new Conversions.DecimalConversion();

  private AvroJson() {}

  /** Converts a value read with {@code schema} by a generic datum reader. */
  public static JsonNode toJson(Object value, Schema schema) {
    if (value == null) {
      return NODES.nullNode();
    }
    LogicalType logicalType = schema.getLogicalType();
    switch (schema.getType()) {
      case RECORD:
        GenericRecord record = (GenericRecord) value;
        ObjectNode object = NODES.objectNode();
        for (Schema.Field field : schema.getFields()) {
          object.set(field.name(), toJson(record.get(field.pos()), field.schema()));
        }
        return object;
      case MAP:
        ObjectNode map = NODES.objectNode();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
          map.set(entry.getKey().toString(), toJson(entry.getValue(), schema.getValueType()));
        }
        return map;
      case ARRAY:
        ArrayNode array = NODES.arrayNode();
        for (Object element : (Collection<?>) value) {
          array.add(toJson(element, schema.getElementType()));
        }
        return array;
      case UNION:
        int branch = GenericData.get().resolveUnion(schema, value);
        return toJson(value, schema.getTypes().get(branch));
      case ENUM:
      case STRING:
        return NODES.textNode(value.toString());
      case FIXED:
        byte[] fixed = ((GenericFixed) value).bytes();
        if (logicalType instanceof LogicalTypes.Decimal) {
          return decimal(ByteBuffer.wrap(fixed), schema, logicalType);
        }
        return NODES.textNode(Base64.getEncoder().encodeToString(fixed));
      case BYTES:
        ByteBuffer bytes = ((ByteBuffer) value).duplicate();
        if (logicalType instanceof LogicalTypes.Decimal) {
          return decimal(bytes, schema, logicalType);
        }
        byte[] copy = new byte[bytes.remaining()];
        bytes.get(copy);
        return NODES.textNode(Base64.getEncoder().encodeToString(copy));
      case INT:
        int i = (Integer) value;
        if (logicalType instanceof LogicalTypes.Date) {
          return NODES.textNode(LocalDate.ofEpochDay(i).toString());
        }
        return NODES.numberNode(i);
      case LONG:
        return longValue((Long) value, logicalType);
      case FLOAT:
        return NODES.numberNode((Float) value);
      case DOUBLE:
        return NODES.numberNode((Double) value);
      case BOOLEAN:
        return NODES.booleanNode((Boolean) value);
      case NULL:
        return NODES.nullNode();
      default:
        throw new IllegalArgumentException("unsupported Avro type " + schema.getType());
    }
  }

  private static JsonNode longValue(long value, LogicalType logicalType) {
    if (logicalType instanceof LogicalTypes.TimestampMillis) {
      return NODES.textNode(Instant.ofEpochMilli(value).toString());
    } else if (logicalType instanceof LogicalTypes.TimestampMicros) {
      return NODES.textNode(micros(value).toString());
    } else if (logicalType instanceof LogicalTypes.LocalTimestampMillis) {
      return NODES.textNode(
          LocalDateTime.ofInstant(Instant.ofEpochMilli(value), ZoneOffset.UTC).toString());
    } else if (logicalType instanceof LogicalTypes.LocalTimestampMicros) {
      return NODES.textNode(LocalDateTime.ofInstant(micros(value), ZoneOffset.UTC).toString());
    }
    return NODES.numberNode(value);
  }

  private static Instant micros(long value) {
    return Instant.ofEpochSecond(
        Math.floorDiv(value, 1_000_000L), Math.floorMod(value, 1_000_000L) * 1_000L);
  }

  private static JsonNode decimal(ByteBuffer bytes, Schema schema, LogicalType logicalType) {
    BigDecimal decimal = DECIMALS.fromBytes(bytes, schema, logicalType);
    return NODES.textNode(decimal.toPlainString());
  }
}
