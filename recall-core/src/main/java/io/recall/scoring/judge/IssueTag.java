package io.recall.scoring.judge;

import java.util.Locale;

/**
 * Reason a user may be unhappy with a response, as classified by the judge model.
 */
public enum IssueTag {
  INACCURACY("inaccuracy"),
  UNCLEAR("unclear"),
  INSUFFICIENT_DETAIL("insufficient-detail"),
  OFF_TOPIC("off-topic"),
  TONE("tone"),
  OTHER("other");

  private final String code;

  IssueTag(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /**
   * Finds the first tag mentioned in a free-form model reply. Spaces and underscores are
   * accepted in place of hyphens. Replies naming no tag map to {@link #OTHER}.
   */
  public static IssueTag fromReply(String reply) {
    if (reply == null) {
      return OTHER;
    }
    String normalized = reply.trim().toLowerCase(Locale.ROOT).replace('_', '-').replace(' ', '-');
    IssueTag best = OTHER;
    int bestIndex = Integer.MAX_VALUE;
    for (IssueTag tag : values()) {
      int index = normalized.indexOf(tag.code);
      if (index >= 0 && index < bestIndex) {
        best = tag;
        bestIndex = index;
      }
    }
    return best;
  }
}
