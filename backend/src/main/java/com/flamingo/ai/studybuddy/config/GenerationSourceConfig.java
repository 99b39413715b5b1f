package com.flamingo.ai.studybuddy.config;

import com.flamingo.ai.studybuddy.engine.resource.FileSystemModelResourceCheck;
import com.flamingo.ai.studybuddy.engine.resource.ModelResourceCheck;
import com.flamingo.ai.studybuddy.engine.source.GenerationSource;
import com.flamingo.ai.studybuddy.engine.source.ScriptedGenerationSource;
import com.flamingo.ai.studybuddy.engine.source.StreamingChatModelGenerationSource;
import dev.langchain4j.model.chat.StreamingChatModel;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Selects the generation source and the model resource check engines are built with. */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class GenerationSourceConfig {

  private final EngineConfig engineConfig;

  @Bean
  @ConditionalOnProperty(
      name = "engine.source.type",
      havingValue = "scripted",
      matchIfMissing = true)
  public GenerationSource scriptedGenerationSource() {
    EngineConfig.Scripted scripted = engineConfig.getScripted();
    log.info(
        "Using scripted generation source (chunk size {}, delay {} ms)",
        scripted.getChunkSize(),
        scripted.getFragmentDelayMs());
    return new ScriptedGenerationSource(
        scripted.getChunkSize(), Duration.ofMillis(scripted.getFragmentDelayMs()));
  }

  @Bean
  @ConditionalOnProperty(name = "engine.source.type", havingValue = "langchain4j")
  public GenerationSource streamingChatModelGenerationSource(
      StreamingChatModel streamingChatModel, LangChain4jConfig langChain4jConfig) {
    log.info("Using LangChain4j generation source ({})", langChain4jConfig.getChatModelName());
    return new StreamingChatModelGenerationSource(
        streamingChatModel,
        langChain4jConfig.getChatModelName(),
        engineConfig.getSource().getSystemPrompt());
  }

  @Bean
  public ModelResourceCheck modelResourceCheck() {
    return new FileSystemModelResourceCheck(engineConfig.getModel().getRequiredFiles());
  }
}
