package io.recall.spring.boot;

import io.recall.langchain4j.ChatModelJudge;
import io.recall.spi.JudgeModel;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Configures an OpenAI-compatible judge model when {@code recall.judge.api-key} is set.
 */
@AutoConfiguration(before = RecallAutoConfiguration.class)
@ConditionalOnClass(ChatModelJudge.class)
@ConditionalOnProperty(prefix = "recall.judge", name = "api-key")
@EnableConfigurationProperties(RecallProperties.class)
public class RecallJudgeAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(JudgeModel.class)
  public ChatModelJudge recallJudgeModel(RecallProperties properties) {
    RecallProperties.Judge judge = properties.getJudge();
    return ChatModelJudge.openAiCompatible(
        judge.getBaseUrl(), judge.getApiKey(), judge.getModel(), judge.getTimeout());
  }
}
