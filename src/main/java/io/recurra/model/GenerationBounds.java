package io.recurra.model;

import io.recurra.calendar.CalendarDate;
import java.util.Objects;
import java.util.Optional;

/**
 * The window a generation run covers.
 *
 * <p>The series' own end condition is at most one of {@code endDate} and {@code maxOccurrences}.
 * The horizon {@code generateUntil} is always present and caps how far ahead this run reaches,
 * independent of the series' end.
 *
 * @param startDate the first date that may be produced (inclusive)
 * @param endDate the last date that may be produced (inclusive, may be null)
 * @param maxOccurrences the maximum number of dates to produce (may be null)
 * @param generateUntil the horizon (inclusive)
 */
public record GenerationBounds(
    CalendarDate startDate,
    CalendarDate endDate,
    Integer maxOccurrences,
    CalendarDate generateUntil) {

  /** Validates the end conditions. */
  public GenerationBounds {
    Objects.requireNonNull(startDate, "startDate");
    Objects.requireNonNull(generateUntil, "generateUntil");
    if (endDate != null && maxOccurrences != null) {
      throw new IllegalArgumentException("endDate and maxOccurrences are mutually exclusive");
    }
    if (maxOccurrences != null && maxOccurrences < 1) {
      throw new IllegalArgumentException("maxOccurrences must be positive, got " + maxOccurrences);
    }
  }

  /**
   * Creates bounds with no end condition other than the horizon.
   *
   * @param startDate the start date
   * @param generateUntil the horizon
   * @return new bounds
   */
  public static GenerationBounds until(CalendarDate startDate, CalendarDate generateUntil) {
    return new GenerationBounds(startDate, null, null, generateUntil);
  }

  /**
   * Returns a copy ending on the given date.
   *
   * @param endDate the end date (inclusive)
   * @return new bounds
   */
  public GenerationBounds withEndDate(CalendarDate endDate) {
    return new GenerationBounds(startDate, endDate, null, generateUntil);
  }

  /**
   * Returns a copy limited to a number of occurrences.
   *
   * @param maxOccurrences the occurrence limit
   * @return new bounds
   */
  public GenerationBounds withMaxOccurrences(int maxOccurrences) {
    return new GenerationBounds(startDate, null, maxOccurrences, generateUntil);
  }

  /**
   * Returns the earlier of the end date and the horizon: no produced date is after it.
   *
   * @return the last admissible date
   */
  public CalendarDate lastAdmissible() {
    if (endDate != null && endDate.isBefore(generateUntil)) {
      return endDate;
    }
    return generateUntil;
  }

  /**
   * Returns the occurrence limit, if any.
   *
   * @return the limit
   */
  public Optional<Integer> limit() {
    return Optional.ofNullable(maxOccurrences);
  }
}
