package io.recurra;

import io.recurra.calendar.CalendarDate;
import io.recurra.codec.RuleCodec;
import io.recurra.display.Describer;
import io.recurra.eval.OccurrenceGenerator;
import io.recurra.model.GenerationBounds;
import io.recurra.model.RecurrenceRule;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * The main entry point for reading, generating and describing recurrence rules.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Recurrence r = Recurrence.parse("{\"frequency\":\"weekly\",\"daysOfWeek\":[2,4]}");
 * List<String> dates = r.generate("2026-01-06", null, 4, "2026-12-31");
 * // [2026-01-06, 2026-01-08, 2026-01-13, 2026-01-15]
 * System.out.println(r.describe()); // Every Tuesday, Thursday
 * }</pre>
 */
public final class Recurrence {
  private final RecurrenceRule rule;

  private Recurrence(RecurrenceRule rule) {
    this.rule = rule;
  }

  /**
   * Parses a stored JSON rule into a Recurrence.
   *
   * @param json the stored rule
   * @return the recurrence
   * @throws RecurraException if the input is not a valid rule
   */
  public static Recurrence parse(String json) throws RecurraException {
    return new Recurrence(RuleCodec.decode(json));
  }

  /**
   * Wraps an already-built rule.
   *
   * @param rule the rule
   * @return the recurrence
   */
  public static Recurrence of(RecurrenceRule rule) {
    return new Recurrence(Objects.requireNonNull(rule, "rule"));
  }

  /**
   * Validates a stored JSON rule without throwing.
   *
   * @param json the stored rule
   * @return true if the rule is valid
   */
  public static boolean validate(String json) {
    try {
      RuleCodec.decode(json);
      return true;
    } catch (RecurraException e) {
      return false;
    }
  }

  /**
   * Generates the dates of this rule from string-form bounds.
   *
   * @param startDate the first admissible date (YYYY-MM-DD)
   * @param endDate the last admissible date (may be null)
   * @param maxOccurrences the occurrence limit (may be null)
   * @param generateUntil the horizon (YYYY-MM-DD)
   * @return the dates, ascending
   * @throws RecurraException if a date is malformed or the end conditions conflict
   */
  public List<String> generate(
      String startDate, String endDate, Integer maxOccurrences, String generateUntil)
      throws RecurraException {
    try {
      return OccurrenceGenerator.generateOccurrences(
          rule, startDate, endDate, maxOccurrences, generateUntil);
    } catch (IllegalArgumentException e) {
      throw RecurraException.bounds(e.getMessage(), e);
    }
  }

  /**
   * Generates the dates of this rule within bounds.
   *
   * @param bounds the start, end condition and horizon
   * @return the dates, ascending
   */
  public List<CalendarDate> dates(GenerationBounds bounds) {
    return OccurrenceGenerator.dates(rule, bounds);
  }

  /**
   * Returns a lazy stream of the dates of this rule within bounds.
   *
   * @param bounds the start, end condition and horizon
   * @return a stream of dates
   */
  public Stream<CalendarDate> occurrences(GenerationBounds bounds) {
    return OccurrenceGenerator.occurrences(rule, bounds);
  }

  /**
   * Returns the display description, e.g. "Monthly on the Last Friday".
   *
   * @return the description
   */
  public String describe() {
    return Describer.describe(rule);
  }

  /**
   * Returns the stored JSON form.
   *
   * @return the JSON text
   */
  public String toJson() {
    return RuleCodec.encode(rule);
  }

  /**
   * Returns the underlying rule.
   *
   * @return the rule
   */
  public RecurrenceRule rule() {
    return rule;
  }

  /**
   * Returns the display description.
   *
   * @return the description
   */
  @Override
  public String toString() {
    return describe();
  }
}
