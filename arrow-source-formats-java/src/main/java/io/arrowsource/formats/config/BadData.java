package io.arrowsource.formats.config;

/** What to do with records that cannot be decoded or do not match the target schema. */
public enum BadData {
  /** A nonconforming row fails the whole pending flush. */
  FAIL,
  /** Nonconforming rows are excluded from the flushed batch. */
  DROP
}
