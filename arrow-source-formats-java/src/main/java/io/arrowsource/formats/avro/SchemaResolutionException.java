package io.arrowsource.formats.avro;

import io.arrowsource.formats.DeserializerException;

/** Thrown when a schema id cannot be resolved to a usable schema. */
public class SchemaResolutionException extends DeserializerException {
  private final int schemaId;

  public SchemaResolutionException(int schemaId, String message) {
    super("failed to resolve schema " + schemaId + ": " + message);
    this.schemaId = schemaId;
  }

  public SchemaResolutionException(int schemaId, String message, Throwable cause) {
    super("failed to resolve schema " + schemaId + ": " + message, cause);
    this.schemaId = schemaId;
  }

  public int getSchemaId() {
    return schemaId;
  }
}
