package com.flamingo.ai.studybuddy.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** Web MVC configuration for async request handling (SSE token streams). */
@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final EngineConfig engineConfig;

  /**
   * Serves SSE responses from a bounded pool instead of the default SimpleAsyncTaskExecutor.
   *
   * <p>The request timeout defaults to the blocking generate timeout so a slow stream is not cut
   * off earlier over SSE than over the plain chat endpoint.
   */
  @Override
  public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
    configurer.setTaskExecutor(asyncTaskExecutor());
    configurer.setDefaultTimeout(engineConfig.getSse().getTimeoutMs());
  }

  @Bean(name = "asyncTaskExecutor")
  public AsyncTaskExecutor asyncTaskExecutor() {
    EngineConfig.Sse sse = engineConfig.getSse();
    return AsyncConfig.buildExecutor(sse.getExecutor(), sse.getAwaitTerminationSeconds());
  }
}
