package io.arrowsource.formats;

/**
 * Thrown when the target schema does not provide a column the configured format writes to, or
 * declares it with an incompatible type.
 */
public class SchemaContractException extends DeserializerException {
  private final String column;

  public SchemaContractException(String column, String message) {
    super("column '" + column + "': " + message);
    this.column = column;
  }

  /** Returns the name of the offending column. */
  public String getColumn() {
    return column;
  }
}
