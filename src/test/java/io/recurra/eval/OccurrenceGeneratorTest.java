package io.recurra.eval;

import static org.junit.jupiter.api.Assertions.*;

import io.recurra.calendar.CalendarDate;
import io.recurra.calendar.Weekday;
import io.recurra.model.GenerationBounds;
import io.recurra.model.OrdinalPosition;
import io.recurra.model.RecurrenceRule;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

/** Unit tests for occurrence generation. */
public class OccurrenceGeneratorTest {

  private static CalendarDate d(String s) {
    return CalendarDate.parse(s);
  }

  // =========================================================================
  // Weekly
  // =========================================================================

  @Test
  void testWeeklyTuesdayThursdayWithLimit() {
    List<String> dates =
        OccurrenceGenerator.generateOccurrences(
            RecurrenceRule.weekly(Weekday.TUESDAY, Weekday.THURSDAY),
            "2026-01-06",
            null,
            4,
            "2026-12-31");
    assertEquals(List.of("2026-01-06", "2026-01-08", "2026-01-13", "2026-01-15"), dates);
  }

  @Test
  void testDayOrderDoesNotMatter() {
    GenerationBounds bounds = GenerationBounds.until(d("2026-01-06"), d("2026-01-31"));
    assertEquals(
        OccurrenceGenerator.generate(
            RecurrenceRule.weekly(Weekday.TUESDAY, Weekday.THURSDAY), bounds),
        OccurrenceGenerator.generate(
            RecurrenceRule.weekly(Weekday.THURSDAY, Weekday.TUESDAY), bounds));
  }

  @Test
  void testWeeklySkipsDaysBeforeStartInFirstWeek() {
    // 2026-01-01 is a Thursday; Saturday 01-03 is the first date, Sunday 01-04 starts a new week
    List<String> dates =
        OccurrenceGenerator.generateOccurrences(
            RecurrenceRule.weekly(Weekday.SATURDAY, Weekday.SUNDAY),
            "2026-01-01",
            "2026-01-18",
            null,
            "2026-12-31");
    assertEquals(
        List.of(
            "2026-01-03", "2026-01-04", "2026-01-10", "2026-01-11", "2026-01-17", "2026-01-18"),
        dates);
  }

  @Test
  void testBiweeklyAnchorsToWeekOfStart() {
    // 2026-01-07 is a Wednesday; Monday 01-05 precedes it and is skipped
    List<String> dates =
        OccurrenceGenerator.generateOccurrences(
            RecurrenceRule.biweekly(Weekday.MONDAY, Weekday.WEDNESDAY),
            "2026-01-07",
            null,
            null,
            "2026-02-15");
    assertEquals(
        List.of("2026-01-07", "2026-01-19", "2026-01-21", "2026-02-02", "2026-02-04"), dates);
  }

  @Test
  void testWeeklyWithoutDaysUsesStartWeekday() {
    List<String> dates =
        OccurrenceGenerator.generateOccurrences(
            RecurrenceRule.biweekly(), "2026-01-07", null, null, "2026-03-01");
    assertEquals(List.of("2026-01-07", "2026-01-21", "2026-02-04", "2026-02-18"), dates);
  }

  @Test
  void testWeeklyCeiling() {
    List<CalendarDate> dates =
        OccurrenceGenerator.dates(
            RecurrenceRule.weekly(),
            GenerationBounds.until(d("2026-01-01"), d("2036-12-31")));
    assertEquals(OccurrenceGenerator.MAX_WEEK_PERIODS, dates.size());
    assertEquals(d("2035-12-13"), dates.get(dates.size() - 1));
  }

  // =========================================================================
  // Monthly
  // =========================================================================

  @Test
  void testMonthlyLastFriday() {
    List<String> dates =
        OccurrenceGenerator.generateOccurrences(
            RecurrenceRule.monthlyOn(OrdinalPosition.LAST, Weekday.FRIDAY),
            "2026-01-01",
            null,
            null,
            "2026-04-30");
    assertEquals(List.of("2026-01-30", "2026-02-27", "2026-03-27", "2026-04-24"), dates);
  }

  @Test
  void testMonthlyFifthFridaySkipsShortMonths() {
    List<String> dates =
        OccurrenceGenerator.generateOccurrences(
            RecurrenceRule.monthlyOn(OrdinalPosition.FIFTH, Weekday.FRIDAY),
            "2026-01-01",
            null,
            null,
            "2026-12-31");
    assertTrue(dates.size() < 12);
    assertEquals(List.of("2026-01-30", "2026-05-29", "2026-07-31", "2026-10-30"), dates);
  }

  @Test
  void testSkippedMonthsDoNotCountTowardLimit() {
    List<String> dates =
        OccurrenceGenerator.generateOccurrences(
            RecurrenceRule.monthlyOn(OrdinalPosition.FIFTH, Weekday.FRIDAY),
            "2026-01-01",
            null,
            3,
            "2027-12-31");
    assertEquals(List.of("2026-01-30", "2026-05-29", "2026-07-31"), dates);
  }

  @Test
  void testMonthlyDayOfMonthClamps() {
    List<String> dates =
        OccurrenceGenerator.generateOccurrences(
            RecurrenceRule.monthlyOnDay(31), "2026-01-15", null, null, "2026-06-30");
    assertEquals(
        List.of(
            "2026-01-31", "2026-02-28", "2026-03-31", "2026-04-30", "2026-05-31", "2026-06-30"),
        dates);
  }

  @Test
  void testMonthlySkipsStartMonthWhenDayHasPassed() {
    List<String> dates =
        OccurrenceGenerator.generateOccurrences(
            RecurrenceRule.monthlyOnDay(15), "2026-01-20", "2026-05-15", null, "2026-12-31");
    assertEquals(List.of("2026-02-15", "2026-03-15", "2026-04-15", "2026-05-15"), dates);
  }

  @Test
  void testSecondTuesdayWithLimit() {
    List<String> dates =
        OccurrenceGenerator.generateOccurrences(
            RecurrenceRule.monthlyOn(OrdinalPosition.SECOND, Weekday.TUESDAY),
            "2026-01-01",
            null,
            3,
            "2027-12-31");
    assertEquals(List.of("2026-01-13", "2026-02-10", "2026-03-10"), dates);
  }

  @Test
  void testMonthlyCeiling() {
    List<CalendarDate> dates =
        OccurrenceGenerator.dates(
            RecurrenceRule.monthlyOnDay(1),
            GenerationBounds.until(d("2026-01-01"), d("2040-12-31")));
    assertEquals(OccurrenceGenerator.MAX_MONTH_PERIODS, dates.size());
    assertEquals(d("2035-12-01"), dates.get(dates.size() - 1));
  }

  // =========================================================================
  // Bounds
  // =========================================================================

  @Test
  void testHorizonIsInclusive() {
    List<String> dates =
        OccurrenceGenerator.generateOccurrences(
            RecurrenceRule.weekly(Weekday.TUESDAY), "2026-01-06", null, null, "2026-01-20");
    assertEquals(List.of("2026-01-06", "2026-01-13", "2026-01-20"), dates);
  }

  @Test
  void testEndDateBeforeStartYieldsNothing() {
    List<String> dates =
        OccurrenceGenerator.generateOccurrences(
            RecurrenceRule.weekly(Weekday.TUESDAY), "2026-01-06", "2026-01-05", null, "2026-12-31");
    assertTrue(dates.isEmpty());
  }

  @Test
  void testHorizonBeforeStartYieldsNothing() {
    List<String> dates =
        OccurrenceGenerator.generateOccurrences(
            RecurrenceRule.monthlyOnDay(10), "2026-03-01", null, null, "2026-02-01");
    assertTrue(dates.isEmpty());
  }

  @Test
  void testRunEndingAtLastSupportedYear() {
    assertEquals(
        List.of("9999-12-06", "9999-12-13", "9999-12-20", "9999-12-27"),
        OccurrenceGenerator.generateOccurrences(
            RecurrenceRule.weekly(Weekday.MONDAY), "9999-12-01", null, null, "9999-12-31"));
    assertEquals(
        List.of("9999-12-01", "9999-12-15", "9999-12-29"),
        OccurrenceGenerator.generateOccurrences(
            RecurrenceRule.biweekly(), "9999-12-01", null, null, "9999-12-31"));
    assertEquals(
        List.of("9999-11-15", "9999-12-15"),
        OccurrenceGenerator.generateOccurrences(
            RecurrenceRule.monthlyOnDay(15), "9999-11-01", null, null, "9999-12-31"));
    assertEquals(
        List.of("9999-12-31"),
        OccurrenceGenerator.generateOccurrences(
            RecurrenceRule.monthlyOn(OrdinalPosition.LAST, Weekday.FRIDAY),
            "9999-12-01",
            null,
            null,
            "9999-12-31"));
  }

  @Test
  void testRunStartingInFirstWeekOfYearOne() {
    // 0001-01-01 is a Monday; its week starts on a Sunday before year 1
    assertEquals(
        List.of("0001-01-01", "0001-01-07", "0001-01-08", "0001-01-14", "0001-01-15"),
        OccurrenceGenerator.generateOccurrences(
            RecurrenceRule.weekly(Weekday.SUNDAY, Weekday.MONDAY),
            "0001-01-01",
            null,
            null,
            "0001-01-15"));
  }

  @Test
  void testBoundariesAndOrderingHold() {
    List<RecurrenceRule> rules =
        List.of(
            RecurrenceRule.weekly(Weekday.SATURDAY, Weekday.MONDAY, Weekday.WEDNESDAY),
            RecurrenceRule.biweekly(Weekday.FRIDAY, Weekday.SUNDAY),
            RecurrenceRule.weekly(),
            RecurrenceRule.monthlyOnDay(29),
            RecurrenceRule.monthlyOn(OrdinalPosition.FOURTH, Weekday.THURSDAY),
            RecurrenceRule.monthlyOn(OrdinalPosition.LAST, Weekday.MONDAY));
    CalendarDate start = d("2026-02-11");
    CalendarDate end = d("2026-11-03");
    CalendarDate horizon = d("2026-09-30");
    for (RecurrenceRule rule : rules) {
      List<CalendarDate> dates =
          OccurrenceGenerator.dates(rule, new GenerationBounds(start, end, null, horizon));
      assertFalse(dates.isEmpty(), rule.toString());
      for (int i = 0; i < dates.size(); i++) {
        CalendarDate date = dates.get(i);
        assertFalse(date.isBefore(start), rule + " " + date);
        assertFalse(date.isAfter(horizon), rule + " " + date);
        if (i > 0) {
          assertTrue(dates.get(i - 1).isBefore(date), rule + " not ascending at " + date);
        }
      }
      List<CalendarDate> limited =
          OccurrenceGenerator.dates(
              rule, GenerationBounds.until(start, horizon).withMaxOccurrences(5));
      assertEquals(dates.subList(0, 5), limited, rule.toString());
    }
  }

  @Test
  void testOccurrencesIsLazy() {
    // the stream is cut short long before the horizon is reached
    List<CalendarDate> first =
        OccurrenceGenerator.occurrences(
                RecurrenceRule.weekly(Weekday.MONDAY),
                GenerationBounds.until(d("2026-01-01"), d("2030-01-01")))
            .limit(2)
            .collect(Collectors.toList());
    assertEquals(List.of(d("2026-01-05"), d("2026-01-12")), first);
  }

  @Test
  void testMalformedStringBoundsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            OccurrenceGenerator.generateOccurrences(
                RecurrenceRule.weekly(), "2026/01/01", null, null, "2026-12-31"));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            OccurrenceGenerator.generateOccurrences(
                RecurrenceRule.weekly(), "2026-01-01", "2026-02-01", 3, "2026-12-31"));
  }
}
