package io.recurra.model;

import io.recurra.calendar.Weekday;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * A week-based rule like "every other Tuesday and Thursday".
 *
 * @param frequency WEEKLY or BIWEEKLY
 * @param daysOfWeek the weekdays, distinct and ascending from Sunday; empty means the start
 *     date's weekday
 */
public record WeeklyRule(Frequency frequency, List<Weekday> daysOfWeek) implements RecurrenceRule {
  /** Validates the frequency and normalizes the day list. */
  public WeeklyRule {
    Objects.requireNonNull(frequency, "frequency");
    if (!frequency.isWeekly()) {
      throw new IllegalArgumentException("weekly rule needs a weekly frequency, got " + frequency);
    }
    daysOfWeek = daysOfWeek == null ? List.of() : List.copyOf(new TreeSet<>(daysOfWeek));
  }

  /**
   * Returns whether the rule names no explicit days and follows the start date's weekday.
   *
   * @return true if no days are listed
   */
  public boolean followsStartDate() {
    return daysOfWeek.isEmpty();
  }
}
