package io.recall.langchain4j;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import io.recall.scoring.judge.JudgeException;
import io.recall.spi.JudgeModel;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * {@link JudgeModel} backed by a LangChain4j {@link ChatModel}.
 *
 * <p>Every failure of the underlying model is reported as a transient
 * {@link JudgeException}; {@link io.recall.scoring.judge.ScoreJudge} owns the retry loop, so
 * the client built by {@link #openAiCompatible} does not retry on its own.
 */
public final class ChatModelJudge implements JudgeModel {
  private final ChatModel chatModel;
  private final String modelId;

  public ChatModelJudge(ChatModel chatModel, String modelId) {
    this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
    this.modelId = Objects.requireNonNull(modelId, "modelId");
  }

  /**
   * Judge talking to an OpenAI-compatible chat-completions endpoint such as OpenRouter.
   *
   * @param baseUrl   endpoint base, e.g. {@code https://openrouter.ai/api/v1}
   * @param apiKey    bearer token
   * @param modelName model to request, also recorded as the evaluation model
   * @param timeout   per-request timeout
   */
  public static ChatModelJudge openAiCompatible(String baseUrl, String apiKey, String modelName, Duration timeout) {
    Objects.requireNonNull(apiKey, "apiKey");
    ChatModel model = OpenAiChatModel.builder()
        .baseUrl(Objects.requireNonNull(baseUrl, "baseUrl"))
        .apiKey(apiKey)
        .modelName(Objects.requireNonNull(modelName, "modelName"))
        .timeout(Objects.requireNonNull(timeout, "timeout"))
        .maxRetries(0)
        .build();
    return new ChatModelJudge(model, modelName);
  }

  @Override
  public String complete(String systemPrompt, String userPrompt) {
    ChatResponse response;
    try {
      response = chatModel.chat(List.of(SystemMessage.from(systemPrompt), UserMessage.from(userPrompt)));
    } catch (RuntimeException e) {
      throw JudgeException.transientFailure("Judge call to " + modelId + " failed: " + e.getMessage(), e);
    }
    AiMessage message = response == null ? null : response.aiMessage();
    String text = message == null ? null : message.text();
    return text == null ? "" : text;
  }

  @Override
  public String modelId() {
    return modelId;
  }
}
