package io.recall.scoring.feedback;

import java.util.Locale;

/**
 * Explicit reactions a user can give to an assistant message, with their default
 * human feedback score.
 */
public enum FeedbackType {
  GREAT_RESPONSE("great_response", 9.0),
  THAT_WORKED("that_worked", 10.0),
  COPIED("copied", 7.0),
  LIKE("like", 8.0),
  NOT_HELPFUL("not_helpful", 2.0),
  DISLIKE("dislike", 2.0);

  private final String code;
  private final double defaultScore;

  FeedbackType(String code, double defaultScore) {
    this.code = code;
    this.defaultScore = defaultScore;
  }

  public String code() {
    return code;
  }

  public double defaultScore() {
    return defaultScore;
  }

  /**
   * @throws IllegalArgumentException for unknown codes
   */
  public static FeedbackType fromCode(String code) {
    if (code != null) {
      String normalized = code.trim().toLowerCase(Locale.ROOT).replace('-', '_');
      for (FeedbackType type : values()) {
        if (type.code.equals(normalized)) {
          return type;
        }
      }
    }
    throw new IllegalArgumentException("Unknown feedback type: " + code);
  }
}
