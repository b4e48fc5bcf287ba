package io.recall.scoring.judge;

import java.util.Objects;

/**
 * Asks the judge model why a user replied negatively to a response. Used best-effort:
 * callers run it off the scoring path and ignore its failures.
 */
public final class IssueClassifier {
  static final String SYSTEM_PROMPT =
      "You are a post-hoc evaluator. Given an AI response and the user's follow-up reply, "
          + "output a single short reason tag for why the user might be unhappy. Choose only "
          + "one from: inaccuracy, unclear, insufficient detail, off-topic, tone, other. "
          + "Respond with just the tag.";

  private final ScoreJudge judge;

  public IssueClassifier(ScoreJudge judge) {
    this.judge = Objects.requireNonNull(judge, "judge");
  }

  /**
   * @throws RuntimeException if the model call fails after retries
   */
  public IssueTag classify(String response, String userReply) {
    String prompt = "AI response:\n" + response + "\n\nUser reply:\n" + userReply + "\n\nReason tag:";
    return IssueTag.fromReply(judge.call(SYSTEM_PROMPT, prompt));
  }
}
