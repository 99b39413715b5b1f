package com.flamingo.ai.studybuddy.config;

import com.flamingo.ai.studybuddy.engine.GenerationParameters;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for inference engines. */
@Configuration
@ConfigurationProperties(prefix = "engine")
@Getter
@Setter
public class EngineConfig {

  private Defaults defaults = new Defaults();
  private Model model = new Model();
  private Source source = new Source();
  private Scripted scripted = new Scripted();
  private Executor worker = new Executor(2, 8, 0, "gen-worker-");
  private Executor delivery = new Executor(2, 8, 0, "token-delivery-");
  private Sse sse = new Sse();

  /** How long shutdown waits for worker and delivery tasks to exit. */
  private long shutdownTimeoutMs = 5000;

  /** Upper bound for the blocking generate call. */
  private long generateTimeoutMs = 120000;

  @Getter
  @Setter
  public static class Defaults {
    private float temperature = GenerationParameters.DEFAULT_TEMPERATURE;
    private float topP = GenerationParameters.DEFAULT_TOP_P;
    private int maxGenLen = GenerationParameters.DEFAULT_MAX_GEN_LEN;
    private float repetitionPenalty = GenerationParameters.DEFAULT_REPETITION_PENALTY;

    public GenerationParameters toParameters() {
      return new GenerationParameters(temperature, topP, maxGenLen, repetitionPenalty);
    }
  }

  @Getter
  @Setter
  public static class Model {
    /** A model directory counts as present if it holds any of these files. */
    private List<String> requiredFiles =
        new ArrayList<>(List.of("mlc-chat-config.json", "config.json"));

    /** Used when an initialize request names no model path. */
    private String defaultPath;
  }

  @Getter
  @Setter
  public static class Source {
    /** {@code scripted} or {@code langchain4j}. */
    private String type = "scripted";

    private String systemPrompt =
        "You are a patient study assistant. Explain concepts clearly and concisely.";
  }

  @Getter
  @Setter
  public static class Scripted {
    private int chunkSize = 5;
    private long fragmentDelayMs = 30;
  }

  @Getter
  @Setter
  public static class Sse {
    /** Async request timeout for SSE token streams. */
    private long timeoutMs = 120000;

    private int awaitTerminationSeconds = 30;
    private Executor executor = new Executor(4, 16, 50, "async-sse-");
  }

  /**
   * Thread pool settings. Generation tasks run for the whole generation, so the engine pools use
   * a queue capacity of 0: a task either gets a thread at once or is rejected.
   */
  @Getter
  @Setter
  public static class Executor {
    private int corePoolSize;
    private int maxPoolSize;
    private int queueCapacity;
    private String threadNamePrefix;

    public Executor() {}

    Executor(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
      this.corePoolSize = corePoolSize;
      this.maxPoolSize = maxPoolSize;
      this.queueCapacity = queueCapacity;
      this.threadNamePrefix = threadNamePrefix;
    }
  }
}
