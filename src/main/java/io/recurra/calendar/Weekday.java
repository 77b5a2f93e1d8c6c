package io.recurra.calendar;

import java.time.DayOfWeek;
import java.util.Optional;

/** Represents a day of the week, indexed Sunday=0 through Saturday=6. */
public enum Weekday {
  SUNDAY(0, "Sunday"),
  MONDAY(1, "Monday"),
  TUESDAY(2, "Tuesday"),
  WEDNESDAY(3, "Wednesday"),
  THURSDAY(4, "Thursday"),
  FRIDAY(5, "Friday"),
  SATURDAY(6, "Saturday");

  private final int index;
  private final String displayName;

  Weekday(int index, String displayName) {
    this.index = index;
    this.displayName = displayName;
  }

  /**
   * Returns the weekday index used by stored rules (Sunday=0, Saturday=6).
   *
   * @return the weekday index
   */
  public int index() {
    return index;
  }

  @Override
  public String toString() {
    return displayName;
  }

  /**
   * Returns a Weekday from its index.
   *
   * @param index the weekday index (0-6, Sunday first)
   * @return the weekday if valid
   */
  public static Optional<Weekday> fromIndex(int index) {
    if (index < 0 || index > 6) {
      return Optional.empty();
    }
    return Optional.of(values()[index]);
  }

  /**
   * Returns a Weekday from a java.time.DayOfWeek.
   *
   * @param dow the DayOfWeek
   * @return the corresponding Weekday
   */
  public static Weekday fromDayOfWeek(DayOfWeek dow) {
    return values()[dow.getValue() % 7];
  }
}
