package io.recurra.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.recurra.RecurraException;
import io.recurra.calendar.Weekday;
import io.recurra.model.Frequency;
import io.recurra.model.MonthlyPattern;
import io.recurra.model.MonthlyRule;
import io.recurra.model.OrdinalPosition;
import io.recurra.model.RecurrenceRule;
import io.recurra.model.WeeklyRule;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes recurrence rules in their stored JSON form.
 *
 * <pre>
 * {"frequency":"weekly","daysOfWeek":[2,4]}
 * {"frequency":"monthly","monthlyPattern":{"type":"dayOfMonth","day":15}}
 * {"frequency":"monthly","monthlyPattern":{"type":"weekdayOfMonth","weekday":5,"occurrence":-1}}
 * </pre>
 *
 * <p>Decoding validates everything once, so a decoded rule never needs re-checking downstream.
 * Fields that do not belong to the rule's frequency are ignored.
 */
public final class RuleCodec {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private RuleCodec() {}

  /**
   * Decodes a rule from its JSON text.
   *
   * @param json the stored rule
   * @return the validated rule
   * @throws RecurraException if the text is not JSON or does not describe a valid rule
   */
  public static RecurrenceRule decode(String json) throws RecurraException {
    if (json == null || json.isBlank()) {
      throw RecurraException.decode("empty rule", json, null);
    }
    JsonNode root;
    try {
      root = MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw RecurraException.decode("malformed rule JSON: " + e.getOriginalMessage(), json, e);
    }
    return decode(root, json);
  }

  /**
   * Decodes a rule from an already-parsed JSON tree.
   *
   * @param node the rule object
   * @return the validated rule
   * @throws RecurraException if the tree does not describe a valid rule
   */
  public static RecurrenceRule decode(JsonNode node) throws RecurraException {
    return decode(node, node == null ? null : node.toString());
  }

  private static RecurrenceRule decode(JsonNode root, String input) throws RecurraException {
    if (root == null || !root.isObject()) {
      throw RecurraException.decode("rule must be a JSON object", input, null);
    }
    JsonNode freqNode = root.get("frequency");
    if (freqNode == null || !freqNode.isTextual()) {
      throw RecurraException.rule("missing frequency", input);
    }
    Frequency frequency =
        Frequency.parse(freqNode.asText())
            .orElseThrow(
                () -> RecurraException.rule("unknown frequency: " + freqNode.asText(), input));

    try {
      if (frequency.isWeekly()) {
        return new WeeklyRule(frequency, decodeDays(root.get("daysOfWeek"), input));
      }
      return new MonthlyRule(decodePattern(root.get("monthlyPattern"), input));
    } catch (IllegalArgumentException e) {
      throw RecurraException.rule(e.getMessage(), input);
    }
  }

  private static List<Weekday> decodeDays(JsonNode node, String input) throws RecurraException {
    List<Weekday> days = new ArrayList<>();
    if (node == null || node.isNull()) {
      return days;
    }
    if (!node.isArray()) {
      throw RecurraException.rule("daysOfWeek must be an array", input);
    }
    for (JsonNode d : node) {
      days.add(weekday(d, "daysOfWeek", input));
    }
    return days;
  }

  private static MonthlyPattern decodePattern(JsonNode node, String input)
      throws RecurraException {
    if (node == null || !node.isObject()) {
      throw RecurraException.rule("monthly rule needs a monthlyPattern", input);
    }
    String type = node.path("type").asText("");
    if (type.equals(MonthlyPattern.Kind.DAY_OF_MONTH.value())) {
      JsonNode day = node.get("day");
      if (day == null || !day.isInt()) {
        throw RecurraException.rule("dayOfMonth pattern needs an integer day", input);
      }
      return MonthlyPattern.dayOfMonth(day.intValue());
    }
    if (type.equals(MonthlyPattern.Kind.WEEKDAY_OF_MONTH.value())) {
      Weekday weekday = weekday(node.get("weekday"), "weekday", input);
      JsonNode occ = node.get("occurrence");
      if (occ == null || !occ.isInt()) {
        throw RecurraException.rule("weekdayOfMonth pattern needs an integer occurrence", input);
      }
      OrdinalPosition occurrence =
          OrdinalPosition.fromN(occ.intValue())
              .orElseThrow(
                  () ->
                      RecurraException.rule(
                          "occurrence must be 1-5 or -1, got " + occ.intValue(), input));
      return MonthlyPattern.weekdayOfMonth(occurrence, weekday);
    }
    throw RecurraException.rule("unknown monthlyPattern type: \"" + type + "\"", input);
  }

  private static Weekday weekday(JsonNode node, String field, String input)
      throws RecurraException {
    if (node == null || !node.isInt()) {
      throw RecurraException.rule(field + " must hold integer weekdays (0-6)", input);
    }
    int index = node.intValue();
    return Weekday.fromIndex(index)
        .orElseThrow(
            () -> RecurraException.rule(field + " weekday out of range (0-6): " + index, input));
  }

  /**
   * Encodes a rule as its stored JSON text.
   *
   * @param rule the rule
   * @return the JSON text
   */
  public static String encode(RecurrenceRule rule) {
    return toTree(rule).toString();
  }

  /**
   * Encodes a rule as a JSON tree.
   *
   * @param rule the rule
   * @return the JSON object
   */
  public static ObjectNode toTree(RecurrenceRule rule) {
    ObjectNode root = MAPPER.createObjectNode();
    root.put("frequency", rule.frequency().value());
    if (rule instanceof WeeklyRule wr) {
      ArrayNode days = root.putArray("daysOfWeek");
      for (Weekday d : wr.daysOfWeek()) {
        days.add(d.index());
      }
    } else if (rule instanceof MonthlyRule mr) {
      MonthlyPattern p = mr.pattern();
      ObjectNode pattern = root.putObject("monthlyPattern");
      pattern.put("type", p.kind().value());
      switch (p.kind()) {
        case DAY_OF_MONTH -> pattern.put("day", p.dayOfMonth());
        case WEEKDAY_OF_MONTH -> {
          pattern.put("weekday", p.weekday().index());
          pattern.put("occurrence", p.occurrence().toN());
        }
      }
    }
    return root;
  }
}
