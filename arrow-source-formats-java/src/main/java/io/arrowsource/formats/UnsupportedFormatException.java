package io.arrowsource.formats;

import io.arrowsource.formats.config.Format;

/** Thrown when a format is configured that cannot be used to decode source payloads. */
public class UnsupportedFormatException extends DeserializerException {
  private final Format format;

  public UnsupportedFormatException(Format format) {
    super(format.getClass().getSimpleName().toLowerCase() + " is not supported as an input format");
    this.format = format;
  }

  /** Returns the rejected format. */
  public Format getFormat() {
    return format;
  }
}
