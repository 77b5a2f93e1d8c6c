package io.recurra.model;

import io.recurra.calendar.Weekday;
import java.util.Objects;

/**
 * Which day within each month a monthly series falls on.
 *
 * @param kind the type of pattern
 * @param dayOfMonth the day of month (only used when kind is DAY_OF_MONTH)
 * @param weekday the weekday (only used when kind is WEEKDAY_OF_MONTH)
 * @param occurrence the occurrence of the weekday (only used when kind is WEEKDAY_OF_MONTH)
 */
public record MonthlyPattern(
    Kind kind, int dayOfMonth, Weekday weekday, OrdinalPosition occurrence) {

  /** The type of monthly pattern. */
  public enum Kind {
    /** A fixed day of month, e.g. the 15th; clamped in shorter months. */
    DAY_OF_MONTH("dayOfMonth"),
    /** An ordinal weekday of the month, e.g. the 2nd Tuesday or the last Friday. */
    WEEKDAY_OF_MONTH("weekdayOfMonth");

    private final String value;

    Kind(String value) {
      this.value = value;
    }

    /**
     * Returns the wire name.
     *
     * @return the wire name
     */
    public String value() {
      return value;
    }
  }

  /** Validates the fields the kind uses. */
  public MonthlyPattern {
    Objects.requireNonNull(kind, "kind");
    switch (kind) {
      case DAY_OF_MONTH -> {
        if (dayOfMonth < 1 || dayOfMonth > 31) {
          throw new IllegalArgumentException("day of month out of range: " + dayOfMonth);
        }
        weekday = null;
        occurrence = null;
      }
      case WEEKDAY_OF_MONTH -> {
        Objects.requireNonNull(weekday, "weekday");
        Objects.requireNonNull(occurrence, "occurrence");
        dayOfMonth = 0;
      }
    }
  }

  /**
   * Creates a fixed day-of-month pattern.
   *
   * @param day the day (1-31)
   * @return a new day-of-month pattern
   */
  public static MonthlyPattern dayOfMonth(int day) {
    return new MonthlyPattern(Kind.DAY_OF_MONTH, day, null, null);
  }

  /**
   * Creates an ordinal weekday pattern.
   *
   * @param occurrence which occurrence in the month
   * @param weekday the weekday
   * @return a new weekday-of-month pattern
   */
  public static MonthlyPattern weekdayOfMonth(OrdinalPosition occurrence, Weekday weekday) {
    return new MonthlyPattern(Kind.WEEKDAY_OF_MONTH, 0, weekday, occurrence);
  }
}
