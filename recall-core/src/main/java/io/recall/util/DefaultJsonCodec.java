package io.recall.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dependency-free {@link JsonCodec}. Supports one level of object nesting only; arrays and
 * nested objects are rejected.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, ?> fields) {
    if (fields == null || fields.isEmpty()) {
      return "{}";
    }
    StringBuilder sb = new StringBuilder();
    sb.append('{');
    boolean first = true;
    for (Map.Entry<String, ?> entry : fields.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("payload cannot contain null keys");
      }
      if (!first) {
        sb.append(',');
      }
      first = false;
      sb.append('"').append(escape(entry.getKey())).append("\":");
      Object value = entry.getValue();
      if (value == null) {
        sb.append("null");
      } else if (value instanceof Number number) {
        sb.append(formatNumber(number));
      } else if (value instanceof Boolean bool) {
        sb.append(bool.booleanValue());
      } else {
        sb.append('"').append(escape(value.toString())).append('"');
      }
    }
    sb.append('}');
    return sb.toString();
  }

  @Override
  public Map<String, String> parseObject(String json) {
    if (json == null) {
      return Collections.emptyMap();
    }
    String input = json.trim();
    if (input.isEmpty() || "null".equals(input)) {
      return Collections.emptyMap();
    }
    int len = input.length();
    int idx = skipWhitespace(input, 0);
    if (input.charAt(idx) != '{') {
      throw new IllegalArgumentException("Expected JSON object");
    }
    idx++;
    Map<String, String> result = new LinkedHashMap<>();
    while (true) {
      idx = skipWhitespace(input, idx);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      char ch = input.charAt(idx);
      if (ch == '}' && result.isEmpty()) {
        return result;
      }
      if (ch != '"') {
        throw new IllegalArgumentException("Expected string key at " + idx);
      }
      Token key = readString(input, idx + 1);
      idx = skipWhitespace(input, key.next);
      if (idx >= len || input.charAt(idx) != ':') {
        throw new IllegalArgumentException("Expected ':' after key " + key.value);
      }
      idx = skipWhitespace(input, idx + 1);
      if (idx >= len) {
        throw new IllegalArgumentException("Missing value for key " + key.value);
      }
      Token value = input.charAt(idx) == '"'
          ? readString(input, idx + 1)
          : readScalar(input, idx);
      if (value.value != null) {
        result.put(key.value, value.value);
      }
      idx = skipWhitespace(input, value.next);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      char next = input.charAt(idx);
      if (next == ',') {
        idx++;
      } else if (next == '}') {
        return result;
      } else {
        throw new IllegalArgumentException("Expected ',' or '}' at " + idx);
      }
    }
  }

  private static Token readScalar(String input, int start) {
    int i = start;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c == ',' || c == '}' || c == ' ' || c == '\t' || c == '\n' || c == '\r') {
        break;
      }
      i++;
    }
    String literal = input.substring(start, i);
    if ("null".equals(literal)) {
      return new Token(null, i);
    }
    if ("true".equals(literal) || "false".equals(literal)) {
      return new Token(literal, i);
    }
    if (literal.isEmpty() || literal.charAt(0) == '{' || literal.charAt(0) == '[') {
      throw new IllegalArgumentException("Only flat scalar values are supported, got: " + literal);
    }
    try {
      Double.parseDouble(literal);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid JSON literal: " + literal, e);
    }
    return new Token(literal, i);
  }

  private static Token readString(String input, int start) {
    StringBuilder sb = new StringBuilder();
    int i = start;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c == '"') {
        return new Token(sb.toString(), i + 1);
      }
      if (c != '\\') {
        sb.append(c);
        i++;
        continue;
      }
      if (i + 1 >= input.length()) {
        throw new IllegalArgumentException("Invalid escape sequence");
      }
      char esc = input.charAt(i + 1);
      switch (esc) {
        case '"', '\\', '/' -> sb.append(esc);
        case 'b' -> sb.append('\b');
        case 'f' -> sb.append('\f');
        case 'n' -> sb.append('\n');
        case 'r' -> sb.append('\r');
        case 't' -> sb.append('\t');
        case 'u' -> {
          if (i + 5 >= input.length()) {
            throw new IllegalArgumentException("Invalid unicode escape");
          }
          try {
            sb.append((char) Integer.parseInt(input.substring(i + 2, i + 6), 16));
          } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid unicode escape", e);
          }
          i += 4;
        }
        default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + esc);
      }
      i += 2;
    }
    throw new IllegalArgumentException("Unterminated string");
  }

  private static int skipWhitespace(String input, int index) {
    int i = index;
    while (i < input.length() && Character.isWhitespace(input.charAt(i))) {
      i++;
    }
    return i;
  }

  private static String formatNumber(Number number) {
    if (number instanceof Double || number instanceof Float) {
      double d = number.doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        throw new IllegalArgumentException("Non-finite number in payload: " + d);
      }
      return Double.toString(d);
    }
    return number.toString();
  }

  private static String escape(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 8);
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\b' -> sb.append("\\b");
        case '\f' -> sb.append("\\f");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> {
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    return sb.toString();
  }

  private record Token(String value, int next) {}
}
