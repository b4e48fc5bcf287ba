package io.recall.scoring.judge;

import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a numeric score out of a model reply: the whole trimmed reply as a number first,
 * then the first numeric token anywhere in it. The value is not clamped here.
 */
public final class ScoreParser {
  private static final Pattern EXACT = Pattern.compile("[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)");
  private static final Pattern FIRST_NUMBER = Pattern.compile("\\d+(?:\\.\\d+)?");

  private ScoreParser() {}

  public static OptionalDouble parse(String reply) {
    if (reply == null) {
      return OptionalDouble.empty();
    }
    String text = reply.trim();
    if (EXACT.matcher(text).matches()) {
      return OptionalDouble.of(Double.parseDouble(text));
    }
    Matcher matcher = FIRST_NUMBER.matcher(text);
    if (matcher.find()) {
      return OptionalDouble.of(Double.parseDouble(matcher.group()));
    }
    return OptionalDouble.empty();
  }
}
