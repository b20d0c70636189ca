package io.arrowsource.formats.config;

import java.util.Arrays;
import java.util.Objects;

/**
 * The wire format of the payloads handed to a deserializer.
 *
 * <p>Each variant is a record holding the options of that format. A format is chosen once per
 * deserializer and never changes. {@link Parquet} is accepted here so that configurations naming it
 * fail loudly when decoding is attempted, rather than being rejected silently upstream.
 */
public sealed interface Format {

  /**
   * Returns true if records of this format are decoded through the shared incremental JSON buffer
   * rather than appended directly to the caller's builders.
   */
  boolean usesJsonBuffer();

  /** Each record is written as lossily decoded UTF-8 text into a {@code value} column. */
  record RawString() implements Format {
    @Override
    public boolean usesJsonBuffer() {
      return false;
    }
  }

  /** Each record is written as raw bytes into a binary {@code value} column. */
  record RawBytes() implements Format {
    @Override
    public boolean usesJsonBuffer() {
      return false;
    }
  }

  /**
   * JSON records.
   *
   * @param confluentSchemaRegistry whether payloads carry the 5-byte Confluent envelope
   * @param schemaId registry schema id, if known; informational for decoding
   * @param includeSchema whether the payload embeds a schema (used by writers)
   * @param debezium whether records are Debezium change envelopes
   * @param unstructured write the JSON text to a {@code value} column instead of decoding fields
   * @param timestampFormat how numeric timestamps are interpreted
   */
  record Json(
      boolean confluentSchemaRegistry,
      Integer schemaId,
      boolean includeSchema,
      boolean debezium,
      boolean unstructured,
      TimestampFormat timestampFormat)
      implements Format {

    public Json {
      Objects.requireNonNull(timestampFormat, "timestampFormat");
    }

    /** Returns a new builder with all options off and RFC 3339 timestamps. */
    public static Builder builder() {
      return new Builder();
    }

    @Override
    public boolean usesJsonBuffer() {
      return !unstructured;
    }

    /** Builder for {@link Json}. */
    public static final class Builder {
      private boolean confluentSchemaRegistry;
      private Integer schemaId;
      private boolean includeSchema;
      private boolean debezium;
      private boolean unstructured;
      private TimestampFormat timestampFormat = TimestampFormat.RFC3339;

      private Builder() {}

      public Builder confluentSchemaRegistry(boolean value) {
        this.confluentSchemaRegistry = value;
        return this;
      }

      public Builder schemaId(Integer value) {
        this.schemaId = value;
        return this;
      }

      public Builder includeSchema(boolean value) {
        this.includeSchema = value;
        return this;
      }

      public Builder debezium(boolean value) {
        this.debezium = value;
        return this;
      }

      public Builder unstructured(boolean value) {
        this.unstructured = value;
        return this;
      }

      public Builder timestampFormat(TimestampFormat value) {
        this.timestampFormat = value;
        return this;
      }

      public Json build() {
        return new Json(
            confluentSchemaRegistry,
            schemaId,
            includeSchema,
            debezium,
            unstructured,
            timestampFormat);
      }
    }
  }

  /**
   * Avro records.
   *
   * <p>With {@code confluentSchemaRegistry} each payload is a single datum prefixed by a magic byte
   * and a 4-byte schema id. With {@code rawDatums} each payload is a single datum written with the
   * reader schema. Otherwise the payload is an Avro object container file that may hold many
   * records.
   *
   * @param confluentSchemaRegistry whether payloads use the Confluent wire format
   * @param rawDatums whether payloads are bare binary datums
   * @param intoUnstructuredJson write each record as JSON text to a {@code value} column
   * @param readerSchema schema text used to read datums, or null
   * @param schemaId registry schema id, if known; informational for decoding
   */
  record Avro(
      boolean confluentSchemaRegistry,
      boolean rawDatums,
      boolean intoUnstructuredJson,
      String readerSchema,
      Integer schemaId)
      implements Format {

    /** Returns a new builder with all options off. */
    public static Builder builder() {
      return new Builder();
    }

    @Override
    public boolean usesJsonBuffer() {
      return !intoUnstructuredJson;
    }

    /** Builder for {@link Avro}. */
    public static final class Builder {
      private boolean confluentSchemaRegistry;
      private boolean rawDatums;
      private boolean intoUnstructuredJson;
      private String readerSchema;
      private Integer schemaId;

      private Builder() {}

      public Builder confluentSchemaRegistry(boolean value) {
        this.confluentSchemaRegistry = value;
        return this;
      }

      public Builder rawDatums(boolean value) {
        this.rawDatums = value;
        return this;
      }

      public Builder intoUnstructuredJson(boolean value) {
        this.intoUnstructuredJson = value;
        return this;
      }

      public Builder readerSchema(String value) {
        this.readerSchema = value;
        return this;
      }

      public Builder schemaId(Integer value) {
        this.schemaId = value;
        return this;
      }

      public Avro build() {
        return new Avro(
            confluentSchemaRegistry, rawDatums, intoUnstructuredJson, readerSchema, schemaId);
      }
    }
  }

  /**
   * Protobuf records decoded against a compiled descriptor set.
   *
   * @param intoUnstructuredJson write each record as JSON text to a {@code value} column
   * @param messageName fully qualified name of the message type to decode
   * @param compiledSchema serialized {@code FileDescriptorSet}, or null
   * @param confluentSchemaRegistry whether payloads carry the Confluent protobuf envelope
   * @param lengthDelimited whether each payload is prefixed with its varint length
   */
  record Protobuf(
      boolean intoUnstructuredJson,
      String messageName,
      byte[] compiledSchema,
      boolean confluentSchemaRegistry,
      boolean lengthDelimited)
      implements Format {

    public Protobuf {
      compiledSchema = compiledSchema == null ? null : compiledSchema.clone();
    }

    /** Returns a copy of the serialized descriptor set, or null. */
    @Override
    public byte[] compiledSchema() {
      return compiledSchema == null ? null : compiledSchema.clone();
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Protobuf other)) {
        return false;
      }
      return intoUnstructuredJson == other.intoUnstructuredJson
          && confluentSchemaRegistry == other.confluentSchemaRegistry
          && lengthDelimited == other.lengthDelimited
          && Objects.equals(messageName, other.messageName)
          && Arrays.equals(compiledSchema, other.compiledSchema);
    }

    @Override
    public int hashCode() {
      int result =
          Objects.hash(messageName, intoUnstructuredJson, confluentSchemaRegistry, lengthDelimited);
      return 31 * result + Arrays.hashCode(compiledSchema);
    }

    @Override
    public String toString() {
      return "Protobuf[messageName="
          + messageName
          + ", intoUnstructuredJson="
          + intoUnstructuredJson
          + ", compiledSchema="
          + (compiledSchema == null ? "null" : compiledSchema.length + " bytes")
          + ", confluentSchemaRegistry="
          + confluentSchemaRegistry
          + ", lengthDelimited="
          + lengthDelimited
          + "]";
    }

    /** Returns a new builder for the given message type. */
    public static Builder builder(String messageName) {
      return new Builder(messageName);
    }

    @Override
    public boolean usesJsonBuffer() {
      return !intoUnstructuredJson;
    }

    /** Builder for {@link Protobuf}. */
    public static final class Builder {
      private final String messageName;
      private boolean intoUnstructuredJson;
      private byte[] compiledSchema;
      private boolean confluentSchemaRegistry;
      private boolean lengthDelimited;

      private Builder(String messageName) {
        this.messageName = Objects.requireNonNull(messageName, "messageName");
      }

      public Builder intoUnstructuredJson(boolean value) {
        this.intoUnstructuredJson = value;
        return this;
      }

      public Builder compiledSchema(byte[] value) {
        this.compiledSchema = value;
        return this;
      }

      public Builder confluentSchemaRegistry(boolean value) {
        this.confluentSchemaRegistry = value;
        return this;
      }

      public Builder lengthDelimited(boolean value) {
        this.lengthDelimited = value;
        return this;
      }

      public Protobuf build() {
        return new Protobuf(
            intoUnstructuredJson,
            messageName,
            compiledSchema,
            confluentSchemaRegistry,
            lengthDelimited);
      }
    }
  }

  /** Parquet is only supported as an output format. */
  record Parquet() implements Format {
    @Override
    public boolean usesJsonBuffer() {
      return false;
    }
  }
}
