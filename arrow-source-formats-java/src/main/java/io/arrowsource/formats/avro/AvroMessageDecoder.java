package io.arrowsource.formats.avro;

import com.fasterxml.jackson.databind.JsonNode;
import io.arrowsource.formats.config.Format;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.apache.avro.AvroRuntimeException;
import org.apache.avro.Schema;
import org.apache.avro.file.DataFileStream;
import org.apache.avro.generic.GenericDatumReader;
import org.apache.avro.io.BinaryDecoder;
import org.apache.avro.io.DecoderFactory;

/**
 * Splits an Avro payload into records and converts each of them to JSON.
 *
 * <p>Three payload layouts are understood, chosen by the format:
 *
 * <ul>
 *   <li>Confluent schema registry: magic byte {@code 0}, big-endian 4-byte schema id, one datum.
 *   <li>Raw datums: one datum written with the schema registered under id 0.
 *   <li>Object container file: a header with the writer schema followed by any number of records.
 * </ul>
 *
 * <p>When the format names a reader schema, datums are resolved from the writer schema to it.
 * Decoding the whole message happens before the returned future completes, so callers see either
 * every record of the message or an error for the message as a whole.
 */
public final class AvroMessageDecoder {
  private static final byte MAGIC_BYTE = 0;
  static final int RAW_DATUM_SCHEMA_ID = 0;

  private final Format.Avro format;
  private final AvroSchemaCache cache;
  private final Schema readerSchema;

  public AvroMessageDecoder(Format.Avro format, AvroSchemaCache cache) {
    this.format = format;
    this.cache = cache;
    this.readerSchema =
        format.readerSchema() == null ? null : new Schema.Parser().parse(format.readerSchema());
  }

  /**
   * Returns the resolver implied by a format when the caller supplies none. Without a registry, a
   * configured reader schema is the writer schema of raw datums; with a registry, lookups fail
   * until a registry client is supplied.
   */
  public static SchemaResolver defaultResolver(Format.Avro format) {
    if (format.readerSchema() != null && !format.confluentSchemaRegistry()) {
      return new FixedSchemaResolver(RAW_DATUM_SCHEMA_ID, format.readerSchema());
    }
    return new FailingSchemaResolver();
  }

  /** One decoded record, or the reason it could not be decoded. */
  public record DecodedRecord(JsonNode json, String error) {
    static DecodedRecord of(JsonNode json) {
      return new DecodedRecord(json, null);
    }

    static DecodedRecord failed(String error) {
      return new DecodedRecord(null, error);
    }

    public boolean isError() {
      return error != null;
    }
  }

  /**
   * Decodes a message.
   *
   * @return a future of the message's records in order. It completes exceptionally with {@link
   *     SchemaResolutionException} if the writer schema cannot be resolved, or {@link
   *     AvroDecodeException} if the envelope or container header is malformed.
   */
  public CompletableFuture<List<DecodedRecord>> decode(byte[] payload) {
    if (format.confluentSchemaRegistry()) {
      if (payload.length < 5) {
        return CompletableFuture.failedFuture(
            new AvroDecodeException(
                "payload of " + payload.length + " bytes is too short for the registry envelope"));
      }
      if (payload[0] != MAGIC_BYTE) {
        return CompletableFuture.failedFuture(
            new AvroDecodeException("unknown magic byte " + payload[0]));
      }
      int id = ByteBuffer.wrap(payload, 1, 4).getInt();
      return cache.get(id).thenApply(writer -> List.of(decodeDatum(writer, payload, 5)));
    }
    if (format.rawDatums()) {
      return cache
          .get(RAW_DATUM_SCHEMA_ID)
          .thenApply(writer -> List.of(decodeDatum(writer, payload, 0)));
    }
    try {
      return CompletableFuture.completedFuture(decodeContainer(payload));
    } catch (AvroDecodeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  private DecodedRecord decodeDatum(Schema writer, byte[] payload, int offset) {
    Schema reader = readerSchema == null ? writer : readerSchema;
    GenericDatumReader<Object> datumReader = new GenericDatumReader<>(writer, reader);
    BinaryDecoder decoder =
        DecoderFactory.get().binaryDecoder(payload, offset, payload.length - offset, null);
    try {
      Object datum = datumReader.read(null, decoder);
      return DecodedRecord.of(AvroJson.toJson(datum, reader));
    } catch (IOException | AvroRuntimeException | ClassCastException e) {
      return DecodedRecord.failed("failed to deserialize from avro: " + e);
    }
  }

  private List<DecodedRecord> decodeContainer(byte[] payload) {
    List<DecodedRecord> records = new ArrayList<>();
    try (DataFileStream<Object> stream = openContainer(payload)) {
      Schema reader = readerSchema == null ? stream.getSchema() : readerSchema;
      while (true) {
        Object datum;
        try {
          if (!stream.hasNext()) {
            break;
          }
          datum = stream.next();
        } catch (AvroRuntimeException e) {
          // the stream cannot be resumed after a corrupt block
          records.add(DecodedRecord.failed("failed to deserialize from avro: " + e.getMessage()));
          break;
        }
        records.add(DecodedRecord.of(AvroJson.toJson(datum, reader)));
      }
    } catch (IOException e) {
      records.add(DecodedRecord.failed("failed to read Avro container: " + e.getMessage()));
    }
    return records;
  }

  private DataFileStream<Object> openContainer(byte[] payload) {
    GenericDatumReader<Object> datumReader =
        readerSchema == null
            ? new GenericDatumReader<>()
            : new GenericDatumReader<>(null, readerSchema);
    try {
      return new DataFileStream<>(new ByteArrayInputStream(payload), datumReader);
    } catch (IOException | AvroRuntimeException e) {
      throw new AvroDecodeException("invalid Avro container: " + e.getMessage(), e);
    }
  }
}
