package io.recall.scoring.feedback;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based reading of the user's reply to an assistant message.
 *
 * <table>
 *   <caption>Cues and their effect</caption>
 *   <tr><th>cue</th><th>sentiment</th><th>delta</th></tr>
 *   <tr><td>positive acknowledgement</td><td>+1</td><td>+0.7</td></tr>
 *   <tr><td>negative keyword</td><td>-1</td><td>-0.7</td></tr>
 *   <tr><td>30% or more of the words in capitals</td><td>-1</td><td>-1.0 (instead of -0.7)</td></tr>
 *   <tr><td>follow-up question</td><td>0</td><td>-0.2</td></tr>
 *   <tr><td>bare "ok" / "k"</td><td>0</td><td>-0.2</td></tr>
 * </table>
 *
 * <p>Cues are matched as lowercase substrings, so "thanks" also fires "thank". The summed
 * delta is clamped to [-2.0, +1.5] and the sentiment to [-1, +1].
 */
public final class FeedbackHeuristic {
  static final double MIN_DELTA = -2.0;
  static final double MAX_DELTA = 1.5;
  static final double CAPS_THRESHOLD = 0.3;

  private static final Pattern WORD = Pattern.compile("[A-Za-z]+");

  private static final List<String> POSITIVE_CUES = List.of(
      "thank", "thanks", "great", "awesome", "helpful", "perfect", "works",
      "good job", "nice", "that fixed it", "this solved it");
  private static final List<String> NEGATIVE_CUES = List.of(
      "not helpful", "wrong", "bad", "useless", "frustrat", "angry", "annoy", "broken",
      "doesn't work", "doesnt work", "fail", "didn't work", "didnt work");
  private static final List<String> QUESTION_CUES = List.of(
      "?", "how do i", "why", "what about", "does this", "can you");
  private static final Set<String> SHORT_ACKS = Set.of("ok", "k");

  public FeedbackAnalysis analyze(String reply) {
    if (reply == null || reply.isBlank()) {
      return FeedbackAnalysis.NEUTRAL;
    }
    String text = reply.trim();
    String lower = text.toLowerCase(Locale.ROOT);
    double capsRatio = capsRatio(text);
    boolean capsFrustration = capsRatio >= CAPS_THRESHOLD;

    Set<FeedbackSignal> signals = EnumSet.noneOf(FeedbackSignal.class);
    int sentiment = 0;
    double delta = 0.0;

    if (containsAny(lower, POSITIVE_CUES)) {
      signals.add(FeedbackSignal.POSITIVE_ACK);
      sentiment += 1;
      delta += 0.7;
    }
    boolean negativeKeyword = containsAny(lower, NEGATIVE_CUES);
    if (negativeKeyword || capsFrustration) {
      signals.add(capsFrustration ? FeedbackSignal.CAPS_FRUSTRATION : FeedbackSignal.NEGATIVE_FEEDBACK);
      if (negativeKeyword && capsFrustration) {
        signals.add(FeedbackSignal.NEGATIVE_FEEDBACK);
      }
      sentiment -= 1;
      delta -= capsFrustration ? 1.0 : 0.7;
    }
    if (containsAny(lower, QUESTION_CUES)) {
      signals.add(FeedbackSignal.FOLLOWUP_QUESTION);
      delta -= 0.2;
    }
    if (text.length() <= 3 && SHORT_ACKS.contains(lower)) {
      signals.add(FeedbackSignal.SHORT_ACK);
      delta -= 0.2;
    }

    return new FeedbackAnalysis(
        Math.max(-1, Math.min(1, sentiment)),
        capsRatio,
        signals,
        Math.max(MIN_DELTA, Math.min(MAX_DELTA, delta)));
  }

  /** Share of alphabetic words of two or more letters that are entirely upper case. */
  static double capsRatio(String text) {
    Matcher matcher = WORD.matcher(text);
    int words = 0;
    int caps = 0;
    while (matcher.find()) {
      words++;
      String word = matcher.group();
      if (word.length() >= 2 && word.equals(word.toUpperCase(Locale.ROOT))) {
        caps++;
      }
    }
    return words == 0 ? 0.0 : (double) caps / words;
  }

  private static boolean containsAny(String text, List<String> cues) {
    for (String cue : cues) {
      if (text.contains(cue)) {
        return true;
      }
    }
    return false;
  }
}
