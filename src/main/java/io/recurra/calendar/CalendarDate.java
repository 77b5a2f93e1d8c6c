package io.recurra.calendar;

import java.time.LocalDate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A calendar date with no time-of-day and no timezone.
 *
 * <p>The canonical string form is the zero-padded {@code YYYY-MM-DD}, so the natural ordering of
 * dates and the lexical ordering of their canonical strings agree. Years are restricted to
 * 1..9999 to keep that form four digits wide.
 *
 * @param year the year (1-9999)
 * @param month the month (1-12)
 * @param day the day of month (1 to the month's length)
 */
public record CalendarDate(int year, int month, int day) implements Comparable<CalendarDate> {
  private static final Pattern ISO_DATE = Pattern.compile("(\\d{4})-(\\d{2})-(\\d{2})");

  /** Validates the triple. */
  public CalendarDate {
    if (year < 1 || year > 9999) {
      throw new IllegalArgumentException("year out of range: " + year);
    }
    if (month < 1 || month > 12) {
      throw new IllegalArgumentException("month out of range: " + month);
    }
    int length = DateMath.daysInMonth(year, month);
    if (day < 1 || day > length) {
      throw new IllegalArgumentException(
          String.format("day out of range for %04d-%02d: %d", year, month, day));
    }
  }

  /**
   * Creates a date from its components.
   *
   * @param year the year
   * @param month the month (1-12)
   * @param day the day of month
   * @return the date
   * @throws IllegalArgumentException if the triple is not a real calendar date
   */
  public static CalendarDate of(int year, int month, int day) {
    return new CalendarDate(year, month, day);
  }

  /**
   * Parses a canonical {@code YYYY-MM-DD} string.
   *
   * @param text the date string
   * @return the date
   * @throws IllegalArgumentException if the string is not a canonical, existing date
   */
  public static CalendarDate parse(String text) {
    if (text == null) {
      throw new IllegalArgumentException("date must not be null");
    }
    Matcher m = ISO_DATE.matcher(text);
    if (!m.matches()) {
      throw new IllegalArgumentException("expected YYYY-MM-DD, got: \"" + text + "\"");
    }
    return new CalendarDate(
        Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
  }

  /**
   * Converts a java.time.LocalDate.
   *
   * @param date the local date
   * @return the calendar date
   */
  public static CalendarDate fromLocalDate(LocalDate date) {
    return new CalendarDate(date.getYear(), date.getMonthValue(), date.getDayOfMonth());
  }

  /**
   * Converts to a java.time.LocalDate.
   *
   * @return the local date
   */
  public LocalDate toLocalDate() {
    return LocalDate.of(year, month, day);
  }

  /**
   * Returns the weekday of this date.
   *
   * @return the weekday
   */
  public Weekday weekday() {
    return Weekday.fromDayOfWeek(toLocalDate().getDayOfWeek());
  }

  /**
   * Returns the number of days in this date's month.
   *
   * @return the month length
   */
  public int lengthOfMonth() {
    return DateMath.daysInMonth(year, month);
  }

  /**
   * Returns this date moved by a number of days.
   *
   * @param days the days to add, may be negative
   * @return the shifted date
   */
  public CalendarDate plusDays(long days) {
    return fromLocalDate(toLocalDate().plusDays(days));
  }

  /**
   * Returns this date moved by a number of weeks.
   *
   * @param weeks the weeks to add, may be negative
   * @return the shifted date
   */
  public CalendarDate plusWeeks(long weeks) {
    return fromLocalDate(toLocalDate().plusWeeks(weeks));
  }

  /**
   * Returns this date moved by a number of months. The day of month is clamped to the length of
   * the target month, so Jan 31 plus one month is Feb 28 (or 29).
   *
   * @param months the months to add, may be negative
   * @return the shifted date
   */
  public CalendarDate plusMonths(long months) {
    return fromLocalDate(toLocalDate().plusMonths(months));
  }

  /**
   * Returns a date in this month with the given day, clamped to the month's length.
   *
   * @param dayOfMonth the requested day (1-31)
   * @return the clamped date
   */
  public CalendarDate withDayClamped(int dayOfMonth) {
    return new CalendarDate(year, month, Math.min(dayOfMonth, lengthOfMonth()));
  }

  public boolean isBefore(CalendarDate other) {
    return compareTo(other) < 0;
  }

  public boolean isAfter(CalendarDate other) {
    return compareTo(other) > 0;
  }

  @Override
  public int compareTo(CalendarDate other) {
    if (year != other.year) {
      return Integer.compare(year, other.year);
    }
    if (month != other.month) {
      return Integer.compare(month, other.month);
    }
    return Integer.compare(day, other.day);
  }

  /**
   * Returns the canonical {@code YYYY-MM-DD} form.
   *
   * @return the canonical string
   */
  @Override
  public String toString() {
    return String.format("%04d-%02d-%02d", year, month, day);
  }
}
