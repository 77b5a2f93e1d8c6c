package io.recurra.reconcile;

import io.recurra.calendar.CalendarDate;
import io.recurra.model.GenerationBounds;
import io.recurra.model.RecurrenceRule;
import java.util.Objects;

/**
 * The stored definition a series' instances are generated from. Read-only to the reconciler.
 *
 * @param id the series id
 * @param name the series name, used to build instance slugs
 * @param rule the recurrence rule
 * @param startDate the first date of the series
 * @param endDate the last date of the series (may be null)
 * @param maxOccurrences the number of occurrences in the series (may be null)
 * @param status the lifecycle state
 */
public record SeriesTemplate(
    String id,
    String name,
    RecurrenceRule rule,
    CalendarDate startDate,
    CalendarDate endDate,
    Integer maxOccurrences,
    SeriesStatus status) {

  /** Validates required fields and the end condition. */
  public SeriesTemplate {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(rule, "rule");
    Objects.requireNonNull(startDate, "startDate");
    Objects.requireNonNull(status, "status");
    if (endDate != null && maxOccurrences != null) {
      throw new IllegalArgumentException("endDate and maxOccurrences are mutually exclusive");
    }
    if (maxOccurrences != null && maxOccurrences < 1) {
      throw new IllegalArgumentException("maxOccurrences must be positive, got " + maxOccurrences);
    }
  }

  /**
   * Creates an active, open-ended template.
   *
   * @param id the series id
   * @param name the series name
   * @param rule the recurrence rule
   * @param startDate the first date of the series
   * @return a new template
   */
  public static SeriesTemplate of(
      String id, String name, RecurrenceRule rule, CalendarDate startDate) {
    return new SeriesTemplate(id, name, rule, startDate, null, null, SeriesStatus.ACTIVE);
  }

  /**
   * Returns a copy ending on the given date.
   *
   * @param endDate the end date
   * @return a new template
   */
  public SeriesTemplate withEndDate(CalendarDate endDate) {
    return new SeriesTemplate(id, name, rule, startDate, endDate, null, status);
  }

  /**
   * Returns a copy limited to a number of occurrences.
   *
   * @param maxOccurrences the occurrence limit
   * @return a new template
   */
  public SeriesTemplate withMaxOccurrences(int maxOccurrences) {
    return new SeriesTemplate(id, name, rule, startDate, null, maxOccurrences, status);
  }

  /**
   * Returns a copy with a different rule.
   *
   * @param rule the rule
   * @return a new template
   */
  public SeriesTemplate withRule(RecurrenceRule rule) {
    return new SeriesTemplate(id, name, rule, startDate, endDate, maxOccurrences, status);
  }

  /**
   * Returns a copy with a different status.
   *
   * @param status the status
   * @return a new template
   */
  public SeriesTemplate withStatus(SeriesStatus status) {
    return new SeriesTemplate(id, name, rule, startDate, endDate, maxOccurrences, status);
  }

  /**
   * Returns whether new instances may be generated.
   *
   * @return true when active
   */
  public boolean isActive() {
    return status == SeriesStatus.ACTIVE;
  }

  /**
   * Builds generation bounds carrying this template's end condition.
   *
   * @param from the first admissible date
   * @param horizon the horizon
   * @param limit the occurrence limit for this run (may be null)
   * @return new bounds
   */
  GenerationBounds bounds(CalendarDate from, CalendarDate horizon, Integer limit) {
    return new GenerationBounds(from, endDate, limit, horizon);
  }
}
