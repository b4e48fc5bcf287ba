package io.recall.scoring;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Stable fingerprint of response text, used as the score cache key: lowercase hex
 * SHA-256 of the UTF-8 bytes. The text is hashed exactly as given.
 */
public final class ContentHasher {
  private static final HexFormat HEX = HexFormat.of();

  private ContentHasher() {}

  public static String fingerprint(String content) {
    Objects.requireNonNull(content, "content");
    return HEX.formatHex(digest().digest(content.getBytes(StandardCharsets.UTF_8)));
  }

  private static MessageDigest digest() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      // every JDK ships SHA-256
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
