package soadsl.convert;

/**
 * A rule that cannot be lowered: unknown device, no matching monitor kind, unsupported limit formula or too many branches.
 */
public class ConversionException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String ruleName;

  public ConversionException(String ruleName, String message) {
    super(message);
    this.ruleName = ruleName;
  }

  public ConversionException(String ruleName, String message, Throwable cause) {
    super(message, cause);
    this.ruleName = ruleName;
  }

  public String getRuleName() { return ruleName; }
}
