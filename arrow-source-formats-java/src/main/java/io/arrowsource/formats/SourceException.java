package io.arrowsource.formats;

import java.util.Objects;

/** Carries a {@link SourceError} across a call that cannot return it as a value. */
public class SourceException extends DeserializerException {
  private final SourceError error;

  public SourceException(SourceError error) {
    super(Objects.requireNonNull(error, "error").toString());
    this.error = error;
  }

  public SourceException(SourceError error, Throwable cause) {
    super(Objects.requireNonNull(error, "error").toString(), cause);
    this.error = error;
  }

  /** Convenience for a bad-data error with the given details. */
  static SourceException badData(String details) {
    return new SourceException(SourceError.badData(details));
  }

  static SourceException badData(String details, Throwable cause) {
    return new SourceException(SourceError.badData(details), cause);
  }

  /** Returns the error carried by this exception. */
  public SourceError getError() {
    return error;
  }
}
