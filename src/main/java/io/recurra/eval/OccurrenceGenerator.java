package io.recurra.eval;

import io.recurra.calendar.CalendarDate;
import io.recurra.calendar.DateMath;
import io.recurra.model.GenerationBounds;
import io.recurra.model.MonthlyPattern;
import io.recurra.model.MonthlyRule;
import io.recurra.model.RecurrenceRule;
import io.recurra.model.WeeklyRule;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Walks a recurrence rule forward from a start date and produces its dates.
 *
 * <h2>Ordering</h2>
 *
 * <p>Candidates are produced period by period (a week, two weeks, or a month), and within a
 * period in ascending weekday order, so the output is strictly ascending and free of duplicates
 * whatever order the rule's days were supplied in.
 *
 * <h2>Termination</h2>
 *
 * <p>Output stops at the first candidate after the end date or the horizon, or once the count
 * reaches the occurrence limit. The candidate that crosses a boundary is never emitted.
 *
 * <h2>Iteration Safety Limits</h2>
 *
 * <ul>
 *   <li>Week-based rules: {@value #MAX_WEEK_PERIODS} week periods
 *   <li>Month-based rules: {@value #MAX_MONTH_PERIODS} months (10 calendar years)
 * </ul>
 *
 * <p>The limits apply whatever the stated bounds; reaching one truncates the output.
 *
 * <h2>Week Alignment</h2>
 *
 * <p>A week rule with explicit days is anchored to the Sunday that starts the week of the start
 * date. Every other week is counted from that week, so a biweekly series keeps its parity for as
 * long as its start date does not change. Days of the first week that fall before the start date
 * are skipped.
 */
public final class OccurrenceGenerator {
  /** Maximum week periods walked for weekly and biweekly rules. */
  public static final int MAX_WEEK_PERIODS = 520;

  /** Maximum months walked for monthly rules. */
  public static final int MAX_MONTH_PERIODS = 120;

  private OccurrenceGenerator() {}

  /**
   * Generates the dates of a rule within bounds.
   *
   * @param rule the recurrence rule
   * @param bounds the start, end condition and horizon
   * @return the dates as canonical strings, ascending
   */
  public static List<String> generate(RecurrenceRule rule, GenerationBounds bounds) {
    return occurrences(rule, bounds).map(CalendarDate::toString).collect(Collectors.toList());
  }

  /**
   * Generates the dates of a rule from string-form bounds.
   *
   * @param rule the recurrence rule
   * @param startDate the first admissible date (YYYY-MM-DD)
   * @param endDate the last admissible date (may be null)
   * @param maxOccurrences the occurrence limit (may be null)
   * @param generateUntil the horizon (YYYY-MM-DD)
   * @return the dates as canonical strings, ascending
   * @throws IllegalArgumentException if a date is malformed or the end conditions conflict
   */
  public static List<String> generateOccurrences(
      RecurrenceRule rule,
      String startDate,
      String endDate,
      Integer maxOccurrences,
      String generateUntil) {
    GenerationBounds bounds =
        new GenerationBounds(
            CalendarDate.parse(startDate),
            endDate == null ? null : CalendarDate.parse(endDate),
            maxOccurrences,
            CalendarDate.parse(generateUntil));
    return generate(rule, bounds);
  }

  /**
   * Generates the dates of a rule within bounds.
   *
   * @param rule the recurrence rule
   * @param bounds the start, end condition and horizon
   * @return the dates, ascending
   */
  public static List<CalendarDate> dates(RecurrenceRule rule, GenerationBounds bounds) {
    return occurrences(rule, bounds).collect(Collectors.toList());
  }

  /**
   * Returns a lazy stream of the dates of a rule within bounds.
   *
   * @param rule the recurrence rule
   * @param bounds the start, end condition and horizon
   * @return a stream of dates, ascending
   */
  public static Stream<CalendarDate> occurrences(RecurrenceRule rule, GenerationBounds bounds) {
    Stream<CalendarDate> dates = candidates(rule, bounds.startDate(), bounds.lastAdmissible());
    if (bounds.maxOccurrences() != null) {
      dates = dates.limit(bounds.maxOccurrences());
    }
    return dates;
  }

  /**
   * Ascending dates between first and last inclusive, bounded by the iteration limits.
   *
   * <p>Candidates are walked as {@link LocalDate} and only converted once inside the bounds, so a
   * walk that steps past year 9999 or back before year 1 ends instead of failing.
   */
  private static Stream<CalendarDate> candidates(
      RecurrenceRule rule, CalendarDate first, CalendarDate last) {
    LocalDate start = first.toLocalDate();
    LocalDate end = last.toLocalDate();
    if (rule instanceof WeeklyRule wr) {
      long step = wr.frequency().weekStep();
      if (wr.followsStartDate()) {
        return within(
            IntStream.range(0, MAX_WEEK_PERIODS).mapToObj(k -> start.plusWeeks(k * step)),
            start,
            end);
      }
      LocalDate weekStart = start.minusDays(first.weekday().index());
      return within(
          IntStream.range(0, MAX_WEEK_PERIODS)
              .mapToObj(k -> weekStart.plusWeeks(k * step))
              .flatMap(sunday -> wr.daysOfWeek().stream().map(d -> sunday.plusDays(d.index()))),
          start,
          end);
    }
    MonthlyRule mr = (MonthlyRule) rule;
    LocalDate firstMonth = start.withDayOfMonth(1);
    return within(
        IntStream.range(0, MAX_MONTH_PERIODS)
            .mapToObj(firstMonth::plusMonths)
            .takeWhile(month -> !month.isAfter(end))
            .map(month -> dateInMonth(CalendarDate.fromLocalDate(month), mr.pattern()))
            .flatMap(Optional::stream)
            .map(CalendarDate::toLocalDate),
        start,
        end);
  }

  private static Stream<CalendarDate> within(
      Stream<LocalDate> days, LocalDate start, LocalDate end) {
    return days.takeWhile(d -> !d.isAfter(end))
        .filter(d -> !d.isBefore(start))
        .map(CalendarDate::fromLocalDate);
  }

  /**
   * Resolves a monthly pattern within one month.
   *
   * @param month any date in the month
   * @param pattern the monthly pattern
   * @return the date, or empty if the month has no such day (e.g. no 5th Friday)
   */
  static Optional<CalendarDate> dateInMonth(CalendarDate month, MonthlyPattern pattern) {
    return switch (pattern.kind()) {
      case DAY_OF_MONTH -> Optional.of(month.withDayClamped(pattern.dayOfMonth()));
      case WEEKDAY_OF_MONTH ->
          DateMath.nthWeekdayOfMonth(
              month.year(), month.month(), pattern.weekday(), pattern.occurrence().toN());
    };
  }
}
