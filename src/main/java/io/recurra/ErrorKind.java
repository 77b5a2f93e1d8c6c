package io.recurra;

/** The type of error raised while reading rules or preparing a generation run. */
public enum ErrorKind {
  /** Decode error - the input is not readable JSON of the expected shape. */
  DECODE("decode"),
  /** Rule error - the input describes a rule with missing or out-of-range values. */
  RULE("rule"),
  /** Bounds error - the start, end, count or horizon of a run are inconsistent. */
  BOUNDS("bounds");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
