package io.arrowsource.formats;

import java.util.Objects;

/**
 * An error produced while decoding source data.
 *
 * <p>Errors are returned as values so that one failing record does not discard the records decoded
 * alongside it. Callers decide from {@link ArrowDeserializer#badData()} whether to fail the task or
 * count and skip.
 *
 * @param kind the error classification
 * @param name a short name for the failing operation
 * @param details a human-readable description
 */
public record SourceError(Kind kind, String name, String details) {

  /** Error classification. */
  public enum Kind {
    /** The record could not be decoded or does not match the schema. */
    BAD_DATA,
    /** Any other failure. */
    OTHER
  }

  public SourceError {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(details, "details");
  }

  /** Creates a bad-data error. */
  public static SourceError badData(String details) {
    return new SourceError(Kind.BAD_DATA, "bad data", details);
  }

  /** Creates an error of kind {@link Kind#OTHER}. */
  public static SourceError other(String name, String details) {
    return new SourceError(Kind.OTHER, name, details);
  }

  /** Returns true if this is a bad-data error. */
  public boolean isBadData() {
    return kind == Kind.BAD_DATA;
  }

  @Override
  public String toString() {
    return name + ": " + details;
  }
}
