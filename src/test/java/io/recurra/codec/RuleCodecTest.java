package io.recurra.codec;

import static org.junit.jupiter.api.Assertions.*;

import io.recurra.ErrorKind;
import io.recurra.RecurraException;
import io.recurra.calendar.Weekday;
import io.recurra.model.Frequency;
import io.recurra.model.MonthlyPattern;
import io.recurra.model.MonthlyRule;
import io.recurra.model.OrdinalPosition;
import io.recurra.model.RecurrenceRule;
import io.recurra.model.WeeklyRule;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Unit tests for reading and writing stored rules. */
public class RuleCodecTest {

  @Test
  void testDecodeWeekly() throws RecurraException {
    RecurrenceRule rule = RuleCodec.decode("{\"frequency\":\"weekly\",\"daysOfWeek\":[4,2]}");
    WeeklyRule wr = assertInstanceOf(WeeklyRule.class, rule);
    assertEquals(Frequency.WEEKLY, wr.frequency());
    assertEquals(List.of(Weekday.TUESDAY, Weekday.THURSDAY), wr.daysOfWeek());
  }

  @Test
  void testDecodeBiweeklyWithoutDays() throws RecurraException {
    WeeklyRule wr =
        assertInstanceOf(WeeklyRule.class, RuleCodec.decode("{\"frequency\":\"biweekly\"}"));
    assertTrue(wr.followsStartDate());
  }

  @Test
  void testDecodeMonthlyDayOfMonth() throws RecurraException {
    MonthlyRule mr =
        assertInstanceOf(
            MonthlyRule.class,
            RuleCodec.decode(
                "{\"frequency\":\"monthly\",\"monthlyPattern\":{\"type\":\"dayOfMonth\",\"day\":15}}"));
    assertEquals(MonthlyPattern.dayOfMonth(15), mr.pattern());
  }

  @Test
  void testDecodeMonthlyLastFriday() throws RecurraException {
    RecurrenceRule rule =
        RuleCodec.decode(
            "{\"frequency\":\"monthly\",\"monthlyPattern\":"
                + "{\"type\":\"weekdayOfMonth\",\"weekday\":5,\"occurrence\":-1}}");
    assertEquals(RecurrenceRule.monthlyOn(OrdinalPosition.LAST, Weekday.FRIDAY), rule);
  }

  @Test
  void testIgnoresFieldsOfOtherFrequency() throws RecurraException {
    RecurrenceRule rule =
        RuleCodec.decode(
            "{\"frequency\":\"weekly\",\"daysOfWeek\":[1],"
                + "\"monthlyPattern\":{\"type\":\"dayOfMonth\",\"day\":99}}");
    assertEquals(RecurrenceRule.weekly(Weekday.MONDAY), rule);
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "{\"frequency\":\"weekly\"",
        "[1,2]",
        "\"weekly\"",
        "   "
      })
  void testDecodeErrors(String input) {
    RecurraException e = assertThrows(RecurraException.class, () -> RuleCodec.decode(input));
    assertEquals(ErrorKind.DECODE, e.kind());
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "{}",
        "{\"frequency\":\"daily\"}",
        "{\"frequency\":\"weekly\",\"daysOfWeek\":[7]}",
        "{\"frequency\":\"weekly\",\"daysOfWeek\":[\"mon\"]}",
        "{\"frequency\":\"weekly\",\"daysOfWeek\":2}",
        "{\"frequency\":\"monthly\"}",
        "{\"frequency\":\"monthly\",\"monthlyPattern\":{\"type\":\"dayOfMonth\"}}",
        "{\"frequency\":\"monthly\",\"monthlyPattern\":{\"type\":\"dayOfMonth\",\"day\":32}}",
        "{\"frequency\":\"monthly\",\"monthlyPattern\":{\"type\":\"weekdayOfMonth\",\"weekday\":5}}",
        "{\"frequency\":\"monthly\",\"monthlyPattern\":"
            + "{\"type\":\"weekdayOfMonth\",\"weekday\":5,\"occurrence\":0}}",
        "{\"frequency\":\"monthly\",\"monthlyPattern\":{\"type\":\"yearly\"}}"
      })
  void testRuleErrors(String input) {
    RecurraException e = assertThrows(RecurraException.class, () -> RuleCodec.decode(input));
    assertEquals(ErrorKind.RULE, e.kind());
    assertEquals(input, e.input().orElseThrow());
  }

  @Test
  void testEncode() {
    assertEquals(
        "{\"frequency\":\"biweekly\",\"daysOfWeek\":[2,4]}",
        RuleCodec.encode(RecurrenceRule.biweekly(Weekday.THURSDAY, Weekday.TUESDAY)));
    assertEquals(
        "{\"frequency\":\"monthly\",\"monthlyPattern\":{\"type\":\"dayOfMonth\",\"day\":15}}",
        RuleCodec.encode(RecurrenceRule.monthlyOnDay(15)));
    assertEquals(
        "{\"frequency\":\"monthly\",\"monthlyPattern\":"
            + "{\"type\":\"weekdayOfMonth\",\"weekday\":2,\"occurrence\":2}}",
        RuleCodec.encode(RecurrenceRule.monthlyOn(OrdinalPosition.SECOND, Weekday.TUESDAY)));
  }

  @Test
  void testEncodedFormDecodesToSameRule() throws RecurraException {
    RecurrenceRule rule = RecurrenceRule.monthlyOn(OrdinalPosition.LAST, Weekday.SUNDAY);
    assertEquals(rule, RuleCodec.decode(RuleCodec.encode(rule)));
  }
}
