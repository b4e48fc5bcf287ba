package io.recall.spi;

/**
 * A chat-completion endpoint used as the quality judge.
 *
 * <p>Implementations throw {@link io.recall.scoring.judge.JudgeException} (or any
 * exception {@link io.recall.ErrorKind#classify} understands) on failure; the caller
 * decides whether to retry based on the error kind.
 *
 * @see io.recall.langchain4j.ChatModelJudge
 */
public interface JudgeModel {

  /**
   * Sends one system plus one user message and returns the reply text.
   */
  String complete(String systemPrompt, String userPrompt);

  /** Identifier recorded as the evaluation model. */
  String modelId();
}
