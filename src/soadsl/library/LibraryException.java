package soadsl.library;

/** A device or monitor library that cannot be read or has the wrong shape. */
public class LibraryException extends Exception {
  private static final long serialVersionUID = 1L;

  public LibraryException(String message) { super(message); }

  public LibraryException(String message, Throwable cause) { super(message, cause); }
}
