package io.recurra.model;

import java.util.Optional;

/** How often a series recurs. */
public enum Frequency {
  /** Every week. */
  WEEKLY("weekly", 1),
  /** Every other week. */
  BIWEEKLY("biweekly", 2),
  /** Once per calendar month. */
  MONTHLY("monthly", 0);

  private final String value;
  private final int weekStep;

  Frequency(String value, int weekStep) {
    this.value = value;
    this.weekStep = weekStep;
  }

  /**
   * Returns the lowercase wire name.
   *
   * @return the wire name
   */
  public String value() {
    return value;
  }

  /**
   * Returns the number of weeks between recurring periods, or 0 for monthly.
   *
   * @return the week step
   */
  public int weekStep() {
    return weekStep;
  }

  /**
   * Returns whether this frequency is expressed in weeks.
   *
   * @return true for weekly and biweekly
   */
  public boolean isWeekly() {
    return weekStep > 0;
  }

  /**
   * Parses a wire name (case insensitive).
   *
   * @param s the string to parse
   * @return the frequency if valid
   */
  public static Optional<Frequency> parse(String s) {
    for (Frequency f : values()) {
      if (f.value.equalsIgnoreCase(s)) {
        return Optional.of(f);
      }
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return value;
  }
}
