package io.arrowsource.formats.config;

/** How JSON numbers are interpreted when decoded into timestamp columns. */
public enum TimestampFormat {
  /**
   * Strings are parsed as RFC 3339 / ISO-8601 instants; numbers are taken in the column's own time
   * unit.
   */
  RFC3339,
  /** Numbers are milliseconds since the epoch, whatever the column's time unit. */
  UNIX_MILLIS
}
