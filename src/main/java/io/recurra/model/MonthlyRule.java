package io.recurra.model;

import java.util.Objects;

/**
 * A month-based rule like "monthly on the 2nd Tuesday".
 *
 * @param pattern the day within each month
 */
public record MonthlyRule(MonthlyPattern pattern) implements RecurrenceRule {
  /** Requires a pattern. */
  public MonthlyRule {
    Objects.requireNonNull(pattern, "monthly rule needs a monthly pattern");
  }

  @Override
  public Frequency frequency() {
    return Frequency.MONTHLY;
  }
}
