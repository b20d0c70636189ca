package io.arrowsource.formats;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.protobuf.InvalidProtocolBufferException;
import io.arrowsource.formats.avro.AvroMessageDecoder;
import io.arrowsource.formats.avro.AvroSchemaCache;
import io.arrowsource.formats.avro.SchemaResolver;
import io.arrowsource.formats.config.BadData;
import io.arrowsource.formats.config.BufferingOptions;
import io.arrowsource.formats.config.Format;
import io.arrowsource.formats.config.Framing;
import io.arrowsource.formats.config.TimestampFormat;
import io.arrowsource.formats.proto.ProtoDecoder;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes source payloads into Arrow columns of a {@link TargetSchema}.
 *
 * <p>Raw formats, and formats configured to produce unstructured JSON, append each record directly
 * to the caller's {@link ColumnBuilders}. Structured JSON, Protobuf and Avro records are buffered
 * as JSON rows and come out of {@link #flushBuffer()} as complete batches. Callers poll {@link
 * #shouldFlush()} to bound latency:
 *
 * <pre>{@code
 * try (BufferAllocator allocator = new RootAllocator();
 *     ColumnBuilders builders = ColumnBuilders.create(schema.schema(), allocator);
 *     ArrowDeserializer deserializer =
 *         ArrowDeserializer.builder(Format.Json.builder().build(), schema, allocator)
 *             .badData(BadData.DROP)
 *             .build()) {
 *   List<SourceError> errors =
 *       deserializer.deserializeSlice(builders, payload, Instant.now(), QueueMetadata.disabled())
 *           .join();
 *   if (deserializer.shouldFlush()) {
 *     deserializer.flushBuffer().ifPresent(batch -> emit(batch));
 *   }
 * }
 * }</pre>
 *
 * <p>An instance is owned by a single task. Only Avro decoding may complete asynchronously, when a
 * schema id has to be resolved; callers must wait for the returned future before the next call.
 */
public final class ArrowDeserializer implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(ArrowDeserializer.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final int CONFLUENT_JSON_HEADER = 5;

  private final Format format;
  private final Framing framing;
  private final TargetSchema schema;
  private final BadData badData;
  private final BufferingClock bufferingClock;
  private final BufferedRows buffered;
  private final DirectAppender direct;
  private final RecordDecoder decoder;
  private final AvroMessageDecoder avro;

  private ArrowDeserializer(Builder builder) {
    this.format = builder.format;
    this.framing = builder.framing;
    this.schema = builder.schema;
    this.badData = builder.badData;
    this.bufferingClock = new BufferingClock(builder.bufferingOptions, builder.clock);

    boolean buffering = format.usesJsonBuffer();
    this.direct = buffering ? null : directAppender(format, schema);
    if (format instanceof Format.Avro avroFormat) {
      SchemaResolver resolver =
          builder.schemaResolver != null
              ? builder.schemaResolver
              : AvroMessageDecoder.defaultResolver(avroFormat);
      this.avro = new AvroMessageDecoder(avroFormat, new AvroSchemaCache(resolver));
    } else {
      this.avro = null;
    }
    this.decoder = recordDecoder(format);
    this.buffered =
        buffering
            ? new BufferedRows(schema, badData, timestampFormat(format), builder.allocator)
            : null;
  }

  /** Creates a deserializer without framing that fails on bad data. */
  public ArrowDeserializer(Format format, TargetSchema schema, BufferAllocator allocator) {
    this(builder(format, schema, allocator));
  }

  /** Returns a builder for the given format and output schema. */
  public static Builder builder(Format format, TargetSchema schema, BufferAllocator allocator) {
    return new Builder(format, schema, allocator);
  }

  /**
   * Decodes one message.
   *
   * <p>Avro messages are decoded as a whole, resolving their schema first; every other format is
   * split according to the framing and decoded record by record. A record that fails to decode
   * produces an error without affecting its siblings.
   *
   * @param builders the builders receiving directly appended rows; must match the target schema
   * @param payload the message
   * @param arrival the arrival time written to the timestamp column
   * @param metadata queue metadata written to the metadata columns when enabled
   * @return a future of the errors of this message, empty when every record decoded. It is already
   *     complete unless an Avro schema has to be resolved. Cancelling it before it completes leaves
   *     the builders untouched.
   * @throws UnsupportedFormatException if the format cannot be decoded
   * @throws SchemaContractException if metadata is enabled but the schema lacks its columns
   */
  public CompletableFuture<List<SourceError>> deserializeSlice(
      ColumnBuilders builders, byte[] payload, Instant arrival, QueueMetadata metadata) {
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(arrival, "arrival");
    Objects.requireNonNull(metadata, "metadata");
    if (builders.size() != schema.fields().size()) {
      throw new IllegalArgumentException(
          "builders have "
              + builders.size()
              + " columns but the target schema has "
              + schema.fields().size());
    }
    if (avro != null) {
      return deserializeAvro(builders, payload, arrival, metadata);
    }

    List<SourceError> errors = new ArrayList<>();
    FramingIterator records = new FramingIterator(framing, payload);
    while (records.hasNext()) {
      ByteBuffer record = records.next();
      try {
        bufferingClock.add(decoder.decode(builders, record, arrival, metadata));
      } catch (SourceException e) {
        errors.add(e.getError());
      }
    }
    return CompletableFuture.completedFuture(errors);
  }

  private CompletableFuture<List<SourceError>> deserializeAvro(
      ColumnBuilders builders, byte[] payload, Instant arrival, QueueMetadata metadata) {
    // the continuation does not run once the returned future is cancelled
    return avro.decode(payload)
        .handle(
            (records, failure) -> {
              if (failure != null) {
                return List.of(SourceError.badData(unwrap(failure).getMessage()));
              }
              List<SourceError> errors = new ArrayList<>();
              for (AvroMessageDecoder.DecodedRecord record : records) {
                if (record.isError()) {
                  errors.add(SourceError.badData(record.error()));
                  continue;
                }
                try {
                  appendJson(builders, record.json(), arrival, metadata);
                  bufferingClock.add(1);
                } catch (SourceException e) {
                  errors.add(e.getError());
                }
              }
              return errors;
            });
  }

  private void appendJson(
      ColumnBuilders builders, JsonNode json, Instant arrival, QueueMetadata metadata) {
    if (buffered != null) {
      buffered.decode(json, arrival, metadata);
    } else {
      direct.appendText(builders, json.toString(), arrival, metadata);
    }
  }

  /**
   * Returns true once rows are pending and either the configured batch size has been reached or
   * the batch linger has elapsed since the last flush.
   */
  public boolean shouldFlush() {
    return bufferingClock.shouldFlush();
  }

  /**
   * Drains the buffered rows into a batch and restarts the buffering clock.
   *
   * <p>Rows appended directly to the caller's builders are counted by {@link #shouldFlush()} as
   * well, and the caller finishes those builders itself when this method is called.
   *
   * @return the batch, owned by the caller; empty if the format does not buffer rows or nothing is
   *     buffered
   * @throws SourceException under {@link BadData#FAIL} when a buffered row does not match the
   *     schema. Every row buffered since the last flush is discarded.
   */
  public Optional<VectorSchemaRoot> flushBuffer() {
    bufferingClock.reset();
    if (buffered == null) {
      return Optional.empty();
    }
    return buffered.flush();
  }

  /** Returns the configured bad data policy. */
  public BadData badData() {
    return badData;
  }

  /** Returns the number of rows decoded since the last flush. */
  public int bufferedCount() {
    return bufferingClock.count();
  }

  public Format format() {
    return format;
  }

  public TargetSchema schema() {
    return schema;
  }

  @Override
  public void close() {
    if (buffered != null) {
      buffered.close();
    }
    logger.debug("Closed deserializer for {}", format.getClass().getSimpleName());
  }

  private RecordDecoder recordDecoder(Format format) {
    if (format instanceof Format.RawString) {
      return (builders, record, arrival, md) -> {
        direct.appendText(builders, record, arrival, md);
        return 1;
      };
    } else if (format instanceof Format.RawBytes) {
      return (builders, record, arrival, md) -> {
        direct.appendBytes(builders, record, arrival, md);
        return 1;
      };
    } else if (format instanceof Format.Json json) {
      return jsonDecoder(json);
    } else if (format instanceof Format.Protobuf proto) {
      return protobufDecoder(new ProtoDecoder(proto));
    } else if (format instanceof Format.Avro) {
      return (builders, record, arrival, md) -> {
        throw new IllegalStateException("Avro messages are decoded as a whole");
      };
    }
    return (builders, record, arrival, md) -> {
      throw new UnsupportedFormatException(format);
    };
  }

  private RecordDecoder jsonDecoder(Format.Json json) {
    return (builders, record, arrival, md) -> {
      ByteBuffer body = record;
      if (json.confluentSchemaRegistry()) {
        if (record.remaining() < CONFLUENT_JSON_HEADER) {
          throw SourceException.badData(
              "payload of "
                  + record.remaining()
                  + " bytes is too short for the schema registry envelope");
        }
        body = record.duplicate();
        body.position(body.position() + CONFLUENT_JSON_HEADER);
      }
      if (json.unstructured()) {
        direct.appendText(builders, body, arrival, md);
        return 1;
      }
      return buffered.decode(body, arrival, md);
    };
  }

  private RecordDecoder protobufDecoder(ProtoDecoder proto) {
    return (builders, record, arrival, md) -> {
      String json;
      try {
        json = proto.decodeToJson(record);
      } catch (InvalidProtocolBufferException e) {
        throw SourceException.badData("invalid protobuf message: " + e.getMessage(), e);
      }
      if (direct != null) {
        direct.appendText(builders, json, arrival, md);
        return 1;
      }
      JsonNode row;
      try {
        row = MAPPER.readTree(json);
      } catch (IOException e) {
        throw SourceException.badData("invalid JSON: " + e.getMessage(), e);
      }
      buffered.decode(row, arrival, md);
      return 1;
    };
  }

  private static DirectAppender directAppender(Format format, TargetSchema schema) {
    if (format instanceof Format.RawBytes) {
      return DirectAppender.forBytes(schema);
    } else if (format instanceof Format.Parquet) {
      return null;
    }
    return DirectAppender.forText(schema);
  }

  private static TimestampFormat timestampFormat(Format format) {
    if (format instanceof Format.Json json) {
      return json.timestampFormat();
    }
    return TimestampFormat.RFC3339;
  }

  private static Throwable unwrap(Throwable failure) {
    Throwable cause = failure;
    while (cause instanceof CompletionException && cause.getCause() != null) {
      cause = cause.getCause();
    }
    return cause;
  }

  /** Builder for {@link ArrowDeserializer}. */
  public static final class Builder {
    private final Format format;
    private final TargetSchema schema;
    private final BufferAllocator allocator;
    private Framing framing;
    private BadData badData = BadData.FAIL;
    private SchemaResolver schemaResolver;
    private BufferingOptions bufferingOptions = BufferingOptions.defaults();
    private Clock clock = Clock.systemUTC();

    private Builder(Format format, TargetSchema schema, BufferAllocator allocator) {
      this.format = Objects.requireNonNull(format, "format");
      this.schema = Objects.requireNonNull(schema, "schema");
      this.allocator = Objects.requireNonNull(allocator, "allocator");
    }

    /** Splits payloads into records; null treats each payload as one record. */
    public Builder framing(Framing framing) {
      this.framing = framing;
      return this;
    }

    public Builder badData(BadData badData) {
      this.badData = Objects.requireNonNull(badData, "badData");
      return this;
    }

    /** Resolves Avro schema ids. Defaults to a resolver derived from the Avro format. */
    public Builder schemaResolver(SchemaResolver schemaResolver) {
      this.schemaResolver = schemaResolver;
      return this;
    }

    public Builder bufferingOptions(BufferingOptions bufferingOptions) {
      this.bufferingOptions = Objects.requireNonNull(bufferingOptions, "bufferingOptions");
      return this;
    }

    /** The clock measuring how long rows have been buffered. */
    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    /**
     * Builds the deserializer.
     *
     * @throws SchemaContractException if the format writes to a column the schema lacks or
     *     declares with another type
     */
    public ArrowDeserializer build() {
      return new ArrowDeserializer(this);
    }
  }
}
