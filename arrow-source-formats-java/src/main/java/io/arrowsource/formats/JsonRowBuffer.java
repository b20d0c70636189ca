package io.arrowsource.formats;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.arrowsource.formats.config.TimestampFormat;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.types.pojo.Schema;

/**
 * Accumulates JSON rows for a schema across many calls and turns them into columns on flush.
 *
 * <p>{@link #decode(ByteBuffer)} only checks that its input is well-formed JSON made of objects;
 * conformance to the schema is checked when the rows are flushed. A strict flush fails as a whole
 * when any row does not conform; a lenient flush drops such rows and reports which positions
 * survived. Each row is converted completely before anything is written to the columns, so a
 * failing row never leaves the columns with different lengths.
 */
final class JsonRowBuffer implements AutoCloseable {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final Schema schema;
  private final JsonValueConverter converter;
  private final List<ColumnBuilder> columns;
  private final List<JsonNode> pending = new ArrayList<>();

  JsonRowBuffer(Schema schema, TimestampFormat timestampFormat, BufferAllocator allocator) {
    this.schema = schema;
    this.converter = new JsonValueConverter(timestampFormat);
    this.columns = ColumnBuilders.createAll(schema, allocator);
  }

  /**
   * The rows of a flush.
   *
   * @param columns one finished vector per field of the schema
   * @param rowCount number of rows in {@code columns}
   * @param kept one entry per buffered row, true where the row made it into {@code columns}
   * @param dropReasons why each dropped row was dropped, in buffer order
   */
  record Flushed(
      List<FieldVector> columns, int rowCount, boolean[] kept, List<String> dropReasons) {
    int droppedCount() {
      return kept.length - rowCount;
    }
  }

  Schema schema() {
    return schema;
  }

  /** Returns the number of rows decoded since the last flush. */
  int bufferedRows() {
    return pending.size();
  }

  /**
   * Parses one or more concatenated JSON objects and buffers them as rows.
   *
   * @return the number of rows buffered; zero for blank input
   * @throws JsonParseException if the input is not well-formed JSON, or a top-level value is
   *     not an object. Nothing is buffered in that case.
   */
  int decode(ByteBuffer json) throws IOException {
    List<JsonNode> rows = new ArrayList<>(1);
    try (JsonParser parser = createParser(json)) {
      while (parser.nextToken() != null) {
        JsonNode node = MAPPER.readTree(parser);
        if (!node.isObject()) {
          throw new JsonParseException(
              parser, "expected a JSON object, found " + node.getNodeType().name().toLowerCase());
        }
        rows.add(node);
      }
    }
    pending.addAll(rows);
    return rows.size();
  }

  /** Buffers an already parsed JSON object as one row. */
  void decode(JsonNode row) {
    if (!row.isObject()) {
      throw new IllegalArgumentException("row must be a JSON object: " + row.getNodeType());
    }
    pending.add(row);
  }

  /**
   * Converts every buffered row, failing on the first one that does not conform to the schema. The
   * buffer is empty afterwards either way.
   *
   * @return the columns, or null if nothing was buffered
   * @throws JsonValueConverter.ConversionException for the first nonconforming row
   */
  Flushed flushStrict() throws JsonValueConverter.ConversionException {
    if (pending.isEmpty()) {
      return null;
    }
    try {
      List<Object[]> rows = new ArrayList<>(pending.size());
      for (JsonNode node : pending) {
        rows.add(converter.convertRow(schema.getFields(), node));
      }
      boolean[] kept = new boolean[rows.size()];
      Arrays.fill(kept, true);
      return finish(rows, kept, List.of());
    } finally {
      pending.clear();
    }
  }

  /**
   * Converts every buffered row, skipping the ones that do not conform to the schema. The buffer is
   * empty afterwards either way.
   *
   * @return the surviving rows and a mask over all buffered rows, or null if nothing was buffered
   */
  Flushed flushLenient() {
    if (pending.isEmpty()) {
      return null;
    }
    try {
      List<Object[]> rows = new ArrayList<>(pending.size());
      List<String> dropReasons = new ArrayList<>();
      boolean[] kept = new boolean[pending.size()];
      for (int i = 0; i < pending.size(); i++) {
        try {
          rows.add(converter.convertRow(schema.getFields(), pending.get(i)));
          kept[i] = true;
        } catch (JsonValueConverter.ConversionException e) {
          dropReasons.add(e.getMessage());
        }
      }
      return finish(rows, kept, dropReasons);
    } finally {
      pending.clear();
    }
  }

  // a failed write leaves every column empty
  private Flushed finish(List<Object[]> rows, boolean[] kept, List<String> dropReasons) {
    List<FieldVector> vectors = new ArrayList<>(columns.size());
    try {
      for (Object[] row : rows) {
        for (int c = 0; c < columns.size(); c++) {
          columns.get(c).appendValue(row[c]);
        }
      }
      for (ColumnBuilder column : columns) {
        vectors.add(column.finish());
      }
    } catch (RuntimeException e) {
      vectors.forEach(FieldVector::close);
      columns.forEach(ColumnBuilder::clear);
      throw e;
    }
    return new Flushed(vectors, rows.size(), kept, dropReasons);
  }

  private static JsonParser createParser(ByteBuffer json) throws IOException {
    if (json.hasArray()) {
      return MAPPER.createParser(
          json.array(), json.arrayOffset() + json.position(), json.remaining());
    }
    byte[] copy = new byte[json.remaining()];
    json.duplicate().get(copy);
    return MAPPER.createParser(copy);
  }

  @Override
  public void close() {
    pending.clear();
    for (ColumnBuilder column : columns) {
      column.close();
    }
  }
}
