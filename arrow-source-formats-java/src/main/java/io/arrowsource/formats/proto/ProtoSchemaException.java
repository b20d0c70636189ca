package io.arrowsource.formats.proto;

import io.arrowsource.formats.DeserializerException;

/** Thrown when a compiled protobuf schema cannot be loaded. */
public class ProtoSchemaException extends DeserializerException {
  public ProtoSchemaException(String message) {
    super(message);
  }

  public ProtoSchemaException(String message, Throwable cause) {
    super(message, cause);
  }
}
