package io.arrowsource.formats.avro;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;
import org.apache.avro.LogicalType;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.util.Utf8;
import org.junit.jupiter.api.Test;

public class AvroJsonTest {

  private static Schema logical(LogicalType type, Schema.Type base) {
    return type.addToSchema(Schema.create(base));
  }

  @Test
  void testTemporalLogicalTypes() {
    assertEquals(
        "2024-01-01",
        AvroJson.toJson(19723, logical(LogicalTypes.date(), Schema.Type.INT)).textValue());
    assertEquals(
        "2024-05-01T12:00:00.123Z",
        AvroJson.toJson(1714564800123L, logical(LogicalTypes.timestampMillis(), Schema.Type.LONG))
            .textValue());
    assertEquals(
        "2024-05-01T12:00:00.123456Z",
        AvroJson.toJson(
                1714564800123456L, logical(LogicalTypes.timestampMicros(), Schema.Type.LONG))
            .textValue());
    assertEquals(
        "2024-05-01T12:00:00.123",
        AvroJson.toJson(
                1714564800123L, logical(LogicalTypes.localTimestampMillis(), Schema.Type.LONG))
            .textValue());
    assertEquals(
        "1969-12-31T23:59:59.999999Z",
        AvroJson.toJson(-1L, logical(LogicalTypes.timestampMicros(), Schema.Type.LONG))
            .textValue());
    // time of day stays numeric
    assertEquals(
        1000L,
        AvroJson.toJson(1000L, logical(LogicalTypes.timeMicros(), Schema.Type.LONG)).longValue());
  }

  @Test
  void testDecimals() {
    Schema bytesDecimal = logical(LogicalTypes.decimal(5, 2), Schema.Type.BYTES);
    ByteBuffer unscaled = ByteBuffer.wrap(BigInteger.valueOf(1234).toByteArray());
    assertEquals("12.34", AvroJson.toJson(unscaled, bytesDecimal).textValue());

    Schema fixedDecimal =
        LogicalTypes.decimal(9, 2).addToSchema(Schema.createFixed("amount", null, null, 4));
    GenericData.Fixed fixed =
        new GenericData.Fixed(
            fixedDecimal, new byte[] {(byte) 0xff, (byte) 0xff, (byte) 0xfb, 0x2e});
    assertEquals("-12.34", AvroJson.toJson(fixed, fixedDecimal).textValue());
  }

  @Test
  void testBinaryIsBase64() {
    JsonNode json =
        AvroJson.toJson(ByteBuffer.wrap(new byte[] {1, 2, 3}), Schema.create(Schema.Type.BYTES));
    assertEquals("AQID", json.textValue());
  }

  @Test
  void testRecordsUnionsAndCollections() {
    Schema schema =
        new Schema.Parser()
            .parse(
                "{\"type\":\"record\",\"name\":\"Order\",\"fields\":["
                    + "{\"name\":\"note\",\"type\":[\"null\",\"string\"]},"
                    + "{\"name\":\"status\",\"type\":{\"type\":\"enum\",\"name\":\"Status\","
                    + "\"symbols\":[\"OPEN\",\"CLOSED\"]}},"
                    + "{\"name\":\"tags\",\"type\":{\"type\":\"array\",\"items\":\"string\"}},"
                    + "{\"name\":\"counts\",\"type\":{\"type\":\"map\",\"values\":\"int\"}},"
                    + "{\"name\":\"price\",\"type\":\"double\"},"
                    + "{\"name\":\"paid\",\"type\":\"boolean\"}]}");
    GenericRecord order = new GenericData.Record(schema);
    order.put("note", null);
    order.put("status", new GenericData.EnumSymbol(schema.getField("status").schema(), "OPEN"));
    order.put("tags", List.of(new Utf8("a"), new Utf8("b")));
    order.put("counts", Map.of(new Utf8("x"), 2));
    order.put("price", 9.5);
    order.put("paid", true);

    JsonNode json = AvroJson.toJson(order, schema);
    assertTrue(json.get("note").isNull());
    assertEquals("OPEN", json.get("status").textValue());
    assertEquals("b", json.get("tags").get(1).textValue());
    assertEquals(2, json.get("counts").get("x").intValue());
    assertEquals(9.5, json.get("price").doubleValue());
    assertTrue(json.get("paid").booleanValue());

    order.put("note", new Utf8("rush"));
    assertEquals("rush", AvroJson.toJson(order, schema).get("note").textValue());
  }
}
