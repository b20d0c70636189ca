package io.arrowsource.formats.avro;

import io.arrowsource.formats.DeserializerException;

/** Thrown when an Avro message is malformed as a whole, before any record can be read. */
public class AvroDecodeException extends DeserializerException {
  public AvroDecodeException(String message) {
    super(message);
  }

  public AvroDecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
