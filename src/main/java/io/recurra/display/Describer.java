package io.recurra.display;

import io.recurra.calendar.Weekday;
import io.recurra.model.MonthlyPattern;
import io.recurra.model.MonthlyRule;
import io.recurra.model.RecurrenceRule;
import io.recurra.model.WeeklyRule;
import java.util.List;
import java.util.stream.Collectors;

/** Renders recurrence rules as display strings. Output is for people and is never parsed. */
public final class Describer {
  private Describer() {}

  /**
   * Describes a rule, e.g. "Every Monday, Wednesday" or "Monthly on the 2nd Tuesday".
   *
   * @param rule the rule to describe
   * @return the display string
   */
  public static String describe(RecurrenceRule rule) {
    if (rule instanceof WeeklyRule wr) {
      return describeWeekly(wr);
    }
    return describeMonthly((MonthlyRule) rule);
  }

  private static String describeWeekly(WeeklyRule wr) {
    String prefix = wr.frequency().weekStep() == 1 ? "Every" : "Every other";
    if (wr.followsStartDate()) {
      return prefix + " week";
    }
    return prefix + " " + formatDayList(wr.daysOfWeek());
  }

  private static String describeMonthly(MonthlyRule mr) {
    MonthlyPattern p = mr.pattern();
    return switch (p.kind()) {
      case DAY_OF_MONTH -> "Monthly on the " + ordinalNumber(p.dayOfMonth());
      case WEEKDAY_OF_MONTH -> String.format("Monthly on the %s %s", p.occurrence(), p.weekday());
    };
  }

  private static String formatDayList(List<Weekday> days) {
    return days.stream().map(Weekday::toString).collect(Collectors.joining(", "));
  }

  private static String ordinalNumber(int n) {
    return n + ordinalSuffix(n);
  }

  private static String ordinalSuffix(int n) {
    int mod100 = n % 100;
    if (mod100 >= 11 && mod100 <= 13) {
      return "th";
    }
    return switch (n % 10) {
      case 1 -> "st";
      case 2 -> "nd";
      case 3 -> "rd";
      default -> "th";
    };
  }
}
