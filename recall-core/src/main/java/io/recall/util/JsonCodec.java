package io.recall.util;

import java.util.Map;

/**
 * Codec for outbox payloads: flat JSON objects whose values are strings, numbers,
 * booleans or {@code null}.
 *
 * <p>Decoded values are always returned as strings (numbers and booleans keep their JSON
 * text) so handlers can read every field the same way. Applications that already carry a
 * JSON library can implement this interface on top of it.
 *
 * @see DefaultJsonCodec
 */
public interface JsonCodec {

  static JsonCodec getDefault() {
    return DefaultJsonCodec.INSTANCE;
  }

  /**
   * Encodes a flat map. {@code Number} and {@code Boolean} values are written unquoted,
   * everything else via {@code toString()} as a JSON string. Returns {@code "{}"} for an
   * empty or {@code null} map.
   */
  String toJson(Map<String, ?> fields);

  /**
   * Parses a flat JSON object. Returns an empty map for {@code null}, blank or
   * {@code "null"} input; {@code null} values are dropped.
   *
   * @throws IllegalArgumentException if the input is not a flat JSON object
   */
  Map<String, String> parseObject(String json);
}
