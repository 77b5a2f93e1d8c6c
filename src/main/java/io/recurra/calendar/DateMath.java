package io.recurra.calendar;

import java.util.Optional;

/**
 * Calendar arithmetic on {@code (year, month, day)} triples and canonical {@code YYYY-MM-DD}
 * strings.
 *
 * <p>Nothing here reads the clock or a timezone. Weekdays come from epoch-day arithmetic on
 * {@link java.time.LocalDate}, which has no zone.
 */
public final class DateMath {
  private DateMath() {}

  /**
   * Returns the number of days in a month.
   *
   * @param year the year
   * @param month the month (1-12)
   * @return 28 to 31
   */
  public static int daysInMonth(int year, int month) {
    return switch (month) {
      case 2 -> isLeapYear(year) ? 29 : 28;
      case 4, 6, 9, 11 -> 30;
      case 1, 3, 5, 7, 8, 10, 12 -> 31;
      default -> throw new IllegalArgumentException("month out of range: " + month);
    };
  }

  /**
   * Returns whether a year is a Gregorian leap year.
   *
   * @param year the year
   * @return true for leap years
   */
  public static boolean isLeapYear(int year) {
    return (year % 4 == 0 && year % 100 != 0) || year % 400 == 0;
  }

  /**
   * Returns the weekday index of a date (Sunday=0, Saturday=6).
   *
   * @param year the year
   * @param month the month (1-12)
   * @param day the day of month
   * @return the weekday index
   */
  public static int weekdayOf(int year, int month, int day) {
    return CalendarDate.of(year, month, day).weekday().index();
  }

  /**
   * Adds days to a canonical date string.
   *
   * @param date the date (YYYY-MM-DD)
   * @param days the days to add, may be negative
   * @return the resulting date string
   */
  public static String addDays(String date, long days) {
    return CalendarDate.parse(date).plusDays(days).toString();
  }

  /**
   * Adds weeks to a canonical date string.
   *
   * @param date the date (YYYY-MM-DD)
   * @param weeks the weeks to add, may be negative
   * @return the resulting date string
   */
  public static String addWeeks(String date, long weeks) {
    return CalendarDate.parse(date).plusWeeks(weeks).toString();
  }

  /**
   * Adds months to a canonical date string, clamping the day to the target month's length.
   *
   * @param date the date (YYYY-MM-DD)
   * @param months the months to add, may be negative
   * @return the resulting date string
   */
  public static String addMonths(String date, long months) {
    return CalendarDate.parse(date).plusMonths(months).toString();
  }

  /**
   * Compares two canonical date strings.
   *
   * @param a the first date
   * @param b the second date
   * @return -1, 0 or 1
   */
  public static int compare(String a, String b) {
    return Integer.signum(CalendarDate.parse(a).compareTo(CalendarDate.parse(b)));
  }

  /**
   * Finds the Nth occurrence of a weekday in a month.
   *
   * @param year the year
   * @param month the month (1-12)
   * @param weekday the weekday
   * @param occurrence 1-5 for first through fifth, or -1 for last
   * @return the date, or empty if the month has no such occurrence
   */
  public static Optional<CalendarDate> nthWeekdayOfMonth(
      int year, int month, Weekday weekday, int occurrence) {
    if (occurrence == -1) {
      CalendarDate last = CalendarDate.of(year, month, daysInMonth(year, month));
      int back = (last.weekday().index() - weekday.index() + 7) % 7;
      return Optional.of(last.plusDays(-back));
    }
    if (occurrence < 1) {
      return Optional.empty();
    }
    CalendarDate first = CalendarDate.of(year, month, 1);
    int offset = (weekday.index() - first.weekday().index() + 7) % 7;
    int day = 1 + offset + (occurrence - 1) * 7;
    if (day > daysInMonth(year, month)) {
      return Optional.empty();
    }
    return Optional.of(CalendarDate.of(year, month, day));
  }
}
