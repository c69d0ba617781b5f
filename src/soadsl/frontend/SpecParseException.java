package soadsl.frontend;

/**
 * A document that is not valid YAML, or a field that is missing or has the wrong shape.
 */
public class SpecParseException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String fieldPath;

  public SpecParseException(String fieldPath, String message) {
    super(fieldPath.isEmpty() ? message : fieldPath + ": " + message);
    this.fieldPath = fieldPath;
  }

  public SpecParseException(String fieldPath, String message, Throwable cause) {
    super(fieldPath.isEmpty() ? message : fieldPath + ": " + message, cause);
    this.fieldPath = fieldPath;
  }

  /** Path of the offending field, e.g. {@code monitors[1].model_name}; empty for document-level errors. */
  public String getFieldPath() { return fieldPath; }
}
