package io.recurra;

import java.util.Optional;

/** Exception thrown when a rule cannot be read or a generation run cannot be set up. */
public final class RecurraException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The original input, when the error came from decoding. */
  private final String input;

  private RecurraException(ErrorKind kind, String message, String input, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.input = input;
  }

  /**
   * Creates a new decode error.
   *
   * @param message the error message
   * @param input the input that failed to decode
   * @param cause the underlying parser failure, may be null
   * @return a new RecurraException for a decode error
   */
  public static RecurraException decode(String message, String input, Throwable cause) {
    return new RecurraException(ErrorKind.DECODE, message, input, cause);
  }

  /**
   * Creates a new rule error.
   *
   * @param message the error message
   * @param input the input describing the invalid rule, may be null
   * @return a new RecurraException for a rule error
   */
  public static RecurraException rule(String message, String input) {
    return new RecurraException(ErrorKind.RULE, message, input, null);
  }

  /**
   * Creates a new bounds error.
   *
   * @param message the error message
   * @param cause the validation failure
   * @return a new RecurraException for a bounds error
   */
  public static RecurraException bounds(String message, Throwable cause) {
    return new RecurraException(ErrorKind.BOUNDS, message, null, cause);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the original input, if available.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }

  /**
   * Formats the error for a validation message shown to the caller.
   *
   * @return a formatted error message
   */
  public String displayRich() {
    if (input != null && !input.isEmpty()) {
      return kind + " error: " + getMessage() + "\n  " + input;
    }
    return kind + " error: " + getMessage();
  }
}
