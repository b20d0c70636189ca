package io.arrowsource.formats;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.arrowsource.formats.config.TimestampFormat;
import java.math.BigDecimal;
import java.util.List;
import org.apache.arrow.vector.types.DateUnit;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.TimeUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.junit.jupiter.api.Test;

/** Tests for the conversion of JSON values into column values. */
public class JsonValueConverterTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final JsonValueConverter rfc3339 = new JsonValueConverter(TimestampFormat.RFC3339);
  private final JsonValueConverter unixMillis =
      new JsonValueConverter(TimestampFormat.UNIX_MILLIS);

  private static Field nullable(String name, ArrowType type) {
    return new Field(name, FieldType.nullable(type), null);
  }

  private static JsonNode json(String text) throws Exception {
    return MAPPER.readTree(text);
  }

  @Test
  void testIntegers() throws Exception {
    Field int32 = nullable("i", new ArrowType.Int(32, true));
    assertEquals(12L, rfc3339.convert(int32, json("12"), "i"));
    assertEquals(-3L, rfc3339.convert(int32, json("\"-3\""), "i"));
    assertThrows(
        JsonValueConverter.ConversionException.class,
        () -> rfc3339.convert(int32, json("2147483648"), "i"));
    assertThrows(
        JsonValueConverter.ConversionException.class,
        () -> rfc3339.convert(int32, json("1.5"), "i"));
    assertThrows(
        JsonValueConverter.ConversionException.class,
        () -> rfc3339.convert(int32, json("\"hello\""), "i"));

    Field uint8 = nullable("u", new ArrowType.Int(8, false));
    assertThrows(
        JsonValueConverter.ConversionException.class,
        () -> rfc3339.convert(uint8, json("-1"), "u"));
  }

  @Test
  void testFloatsStringsAndBooleans() throws Exception {
    Field dbl = nullable("d", new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE));
    assertEquals(1.5, rfc3339.convert(dbl, json("1.5"), "d"));
    assertEquals(2.0, rfc3339.convert(dbl, json("2"), "d"));
    assertEquals("x", rfc3339.convert(nullable("s", new ArrowType.Utf8()), json("\"x\""), "s"));
    assertEquals(true, rfc3339.convert(nullable("b", new ArrowType.Bool()), json("true"), "b"));
    assertThrows(
        JsonValueConverter.ConversionException.class,
        () -> rfc3339.convert(nullable("s", new ArrowType.Utf8()), json("5"), "s"));
  }

  @Test
  void testMissingValues() throws Exception {
    Field optional = nullable("o", new ArrowType.Utf8());
    Field required = new Field("r", FieldType.notNullable(new ArrowType.Utf8()), null);
    Object[] row = rfc3339.convertRow(List.of(optional), json("{\"other\": 1}"));
    assertNull(row[0]);
    JsonValueConverter.ConversionException e =
        assertThrows(
            JsonValueConverter.ConversionException.class,
            () -> rfc3339.convertRow(List.of(required), json("{\"r\": null}")));
    assertTrue(e.getMessage().startsWith("r:"));
  }

  @Test
  void testTimestamps() throws Exception {
    Field nanos = nullable("t", new ArrowType.Timestamp(TimeUnit.NANOSECOND, "UTC"));
    Field millis = nullable("t", new ArrowType.Timestamp(TimeUnit.MILLISECOND, null));
    assertEquals(
        1_714_564_800_123_456_789L,
        rfc3339.convert(nanos, json("\"2024-05-01T12:00:00.123456789Z\""), "t"));
    assertEquals(
        1_714_564_800_000L, rfc3339.convert(millis, json("\"2024-05-01 14:00:00+02:00\""), "t"));
    assertEquals(
        1_714_564_800_000L, rfc3339.convert(millis, json("\"2024-05-01T12:00:00\""), "t"));
    // numbers are in the column's unit, or milliseconds when configured
    assertEquals(5L, rfc3339.convert(nanos, json("5"), "t"));
    assertEquals(5_000_000L, unixMillis.convert(nanos, json("5"), "t"));
    assertThrows(
        JsonValueConverter.ConversionException.class,
        () -> rfc3339.convert(nanos, json("\"yesterday\""), "t"));
  }

  @Test
  void testDatesAndDecimals() throws Exception {
    Field day = nullable("d", new ArrowType.Date(DateUnit.DAY));
    assertEquals(19724, rfc3339.convert(day, json("\"2024-01-02\""), "d"));
    Field decimal = nullable("m", new ArrowType.Decimal(5, 2, 128));
    assertEquals(new BigDecimal("12.30"), rfc3339.convert(decimal, json("\"12.3\""), "m"));
    assertThrows(
        JsonValueConverter.ConversionException.class,
        () -> rfc3339.convert(decimal, json("1.234"), "m"));
    assertThrows(
        JsonValueConverter.ConversionException.class,
        () -> rfc3339.convert(decimal, json("12345.6"), "m"));
  }

  @Test
  void testBinary() throws Exception {
    Field binary = nullable("b", new ArrowType.Binary());
    assertArrayEquals(
        new byte[] {1, 2, 3}, (byte[]) rfc3339.convert(binary, json("\"AQID\""), "b"));
    assertThrows(
        JsonValueConverter.ConversionException.class,
        () -> rfc3339.convert(binary, json("\"not base64!\""), "b"));
  }

  @Test
  void testNestedValues() throws Exception {
    Field item = nullable("item", new ArrowType.Int(64, true));
    Field list = new Field("l", FieldType.nullable(new ArrowType.List()), List.of(item));
    Field struct =
        new Field(
            "s",
            FieldType.nullable(new ArrowType.Struct()),
            List.of(nullable("a", new ArrowType.Utf8()), item));

    assertEquals(List.of(1L, 2L), rfc3339.convert(list, json("[1, 2]"), "l"));
    Object[] values = (Object[]) rfc3339.convert(struct, json("{\"a\": \"x\"}"), "s");
    assertArrayEquals(new Object[] {"x", null}, values);

    JsonValueConverter.ConversionException e =
        assertThrows(
            JsonValueConverter.ConversionException.class,
            () -> rfc3339.convert(list, json("[1, \"two\"]"), "l"));
    assertTrue(e.getMessage().startsWith("l[1]:"));
  }

  @Test
  void testTimesOfDay() throws Exception {
    Field millis = nullable("t", new ArrowType.Time(TimeUnit.MILLISECOND, 32));
    Field micros = nullable("t", new ArrowType.Time(TimeUnit.MICROSECOND, 64));
    assertEquals(1000L, rfc3339.convert(millis, json("1000"), "t"));
    assertEquals(45_296_789L, rfc3339.convert(millis, json("\"12:34:56.789\""), "t"));
    assertEquals(45_296_789_000L, rfc3339.convert(micros, json("\"12:34:56.789\""), "t"));
    assertThrows(
        JsonValueConverter.ConversionException.class,
        () -> rfc3339.convert(millis, json("86400000"), "t"));
    assertThrows(
        JsonValueConverter.ConversionException.class,
        () -> rfc3339.convert(millis, json("\"noon\""), "t"));
  }

  @Test
  void testDurations() throws Exception {
    Field millis = nullable("d", new ArrowType.Duration(TimeUnit.MILLISECOND));
    assertEquals(1500L, rfc3339.convert(millis, json("1500"), "d"));
    assertEquals(1500L, rfc3339.convert(millis, json("\"1500\""), "d"));
    assertEquals(1500L, rfc3339.convert(millis, json("\"PT1.5S\""), "d"));
    assertEquals(-500L, rfc3339.convert(millis, json("\"-PT0.5S\""), "d"));
    assertThrows(
        JsonValueConverter.ConversionException.class,
        () -> rfc3339.convert(millis, json("\"an hour\""), "d"));
  }

  @Test
  void testMapsAndListVariants() throws Exception {
    Field entries =
        new Field(
            "entries",
            FieldType.notNullable(new ArrowType.Struct()),
            List.of(
                new Field("key", FieldType.notNullable(new ArrowType.Int(32, true)), null),
                nullable("value", new ArrowType.Utf8())));
    Field map = new Field("m", FieldType.nullable(new ArrowType.Map(false)), List.of(entries));
    @SuppressWarnings("unchecked")
    List<Object[]> converted =
        (List<Object[]>) rfc3339.convert(map, json("{\"1\": \"a\", \"2\": null}"), "m");
    assertEquals(2, converted.size());
    assertArrayEquals(new Object[] {1L, "a"}, converted.get(0));
    assertArrayEquals(new Object[] {2L, null}, converted.get(1));
    JsonValueConverter.ConversionException e =
        assertThrows(
            JsonValueConverter.ConversionException.class,
            () -> rfc3339.convert(map, json("{\"x\": \"a\"}"), "m"));
    assertTrue(e.getMessage().startsWith("m.x:"));

    Field item = nullable("item", new ArrowType.Int(64, true));
    Field large = new Field("l", FieldType.nullable(new ArrowType.LargeList()), List.of(item));
    assertEquals(List.of(1L, 2L), rfc3339.convert(large, json("[1, 2]"), "l"));
    Field pair =
        new Field("p", FieldType.nullable(new ArrowType.FixedSizeList(2)), List.of(item));
    assertEquals(List.of(3L, 4L), rfc3339.convert(pair, json("[3, 4]"), "p"));
    assertThrows(
        JsonValueConverter.ConversionException.class,
        () -> rfc3339.convert(pair, json("[3]"), "p"));

    Field wide = nullable("w", new ArrowType.Decimal(40, 2, 256));
    assertEquals(new BigDecimal("1.00"), rfc3339.convert(wide, json("\"1\""), "w"));
  }
}
