package io.recurra.model;

import io.recurra.calendar.CalendarDate;
import io.recurra.calendar.Weekday;
import java.util.Arrays;
import java.util.List;

/**
 * Sealed interface for recurrence rules.
 *
 * <ul>
 *   <li>{@link WeeklyRule} - "every Tuesday and Thursday", "every other Monday"
 *   <li>{@link MonthlyRule} - "monthly on the 15th", "monthly on the last Friday"
 * </ul>
 *
 * <p>Rules are validated on construction; an instance that exists is always generatable.
 */
public sealed interface RecurrenceRule permits WeeklyRule, MonthlyRule {

  /**
   * Returns the frequency of this rule.
   *
   * @return the frequency
   */
  Frequency frequency();

  /**
   * Creates a weekly rule.
   *
   * @param days the weekdays; none means the start date's weekday
   * @return a new rule
   */
  static RecurrenceRule weekly(Weekday... days) {
    return new WeeklyRule(Frequency.WEEKLY, Arrays.asList(days));
  }

  /**
   * Creates an every-other-week rule.
   *
   * @param days the weekdays; none means the start date's weekday
   * @return a new rule
   */
  static RecurrenceRule biweekly(Weekday... days) {
    return new WeeklyRule(Frequency.BIWEEKLY, Arrays.asList(days));
  }

  /**
   * Creates a monthly rule on a fixed day of month.
   *
   * @param day the day (1-31)
   * @return a new rule
   */
  static RecurrenceRule monthlyOnDay(int day) {
    return new MonthlyRule(MonthlyPattern.dayOfMonth(day));
  }

  /**
   * Creates a monthly rule on an ordinal weekday.
   *
   * @param occurrence which occurrence in the month
   * @param weekday the weekday
   * @return a new rule
   */
  static RecurrenceRule monthlyOn(OrdinalPosition occurrence, Weekday weekday) {
    return new MonthlyRule(MonthlyPattern.weekdayOfMonth(occurrence, weekday));
  }

  /**
   * Returns the default weekly rule for a series starting on a date: weekly on that weekday.
   *
   * @param startDate the series start date
   * @return a new rule
   */
  static RecurrenceRule defaultWeekly(CalendarDate startDate) {
    return new WeeklyRule(Frequency.WEEKLY, List.of(startDate.weekday()));
  }

  /**
   * Returns the default monthly rule for a series starting on a date: the same ordinal weekday
   * each month, e.g. a start on the 2nd Tuesday gives "monthly on the 2nd Tuesday".
   *
   * @param startDate the series start date
   * @return a new rule
   */
  static RecurrenceRule defaultMonthly(CalendarDate startDate) {
    int n = (startDate.day() + 6) / 7;
    OrdinalPosition occurrence =
        OrdinalPosition.fromN(n).orElseThrow(() -> new IllegalStateException("ordinal " + n));
    return new MonthlyRule(MonthlyPattern.weekdayOfMonth(occurrence, startDate.weekday()));
  }
}
