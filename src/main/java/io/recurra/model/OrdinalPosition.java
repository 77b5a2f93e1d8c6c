package io.recurra.model;

import java.util.Optional;

/** Which occurrence of a weekday within a month (1st through 5th, or last). */
public enum OrdinalPosition {
  FIRST(1, "1st"),
  SECOND(2, "2nd"),
  THIRD(3, "3rd"),
  FOURTH(4, "4th"),
  FIFTH(5, "5th"),
  LAST(-1, "Last");

  private final int number;
  private final String label;

  OrdinalPosition(int number, String label) {
    this.number = number;
    this.label = label;
  }

  /**
   * Returns the ordinal as stored in rules (1-5, or -1 for last).
   *
   * @return the ordinal number
   */
  public int toN() {
    return number;
  }

  @Override
  public String toString() {
    return label;
  }

  /**
   * Returns the position for a stored ordinal number.
   *
   * @param n 1-5, or -1 for last
   * @return the position if valid
   */
  public static Optional<OrdinalPosition> fromN(int n) {
    for (OrdinalPosition p : values()) {
      if (p.number == n) {
        return Optional.of(p);
      }
    }
    return Optional.empty();
  }
}
