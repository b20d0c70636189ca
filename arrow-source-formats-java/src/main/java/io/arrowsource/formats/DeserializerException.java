package io.arrowsource.formats;

/**
 * Base exception class for deserializer errors.
 *
 * <p>Subclasses that signal configuration defects are never caused by the data being decoded and
 * should not be retried.
 */
public class DeserializerException extends RuntimeException {
  public DeserializerException(String message) {
    super(message);
  }

  public DeserializerException(String message, Throwable cause) {
    super(message, cause);
  }
}
