package com.flamingo.ai.studybuddy.engine.source;

import com.flamingo.ai.studybuddy.engine.CancellationToken;
import com.flamingo.ai.studybuddy.engine.GenerationParameters;
import com.flamingo.ai.studybuddy.engine.channel.Fragment;
import com.flamingo.ai.studybuddy.engine.channel.TokenChannel;
import com.flamingo.ai.studybuddy.exception.GenerationSourceException;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.UUID;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import lombok.extern.slf4j.Slf4j;

/**
 * Generation source backed by a LangChain4j {@link StreamingChatModel}.
 *
 * <p>The model pushes partial responses on its own threads. They are buffered in a {@link
 * TokenChannel} and pulled by the engine's worker through the returned stream. Cancellation
 * finishes the buffer, which ends the stream; the upstream HTTP call is left to run out.
 */
@Slf4j
public class StreamingChatModelGenerationSource implements GenerationSource {

  private final StreamingChatModel streamingChatModel;
  private final String modelName;
  private final String systemPrompt;

  public StreamingChatModelGenerationSource(
      StreamingChatModel streamingChatModel, String modelName, String systemPrompt) {
    this.streamingChatModel = streamingChatModel;
    this.modelName = modelName;
    this.systemPrompt = systemPrompt;
  }

  @Override
  public Stream<String> startGeneration(
      String prompt, GenerationParameters parameters, CancellationToken cancellationToken) {
    TokenChannel buffer = new TokenChannel(UUID.randomUUID());
    cancellationToken.onCancel(buffer::finish);

    ChatRequest request =
        ChatRequest.builder()
            .messages(List.of(SystemMessage.from(systemPrompt), UserMessage.from(prompt)))
            .temperature((double) parameters.temperature())
            .topP((double) parameters.topP())
            .maxOutputTokens(parameters.maxGenLen())
            .build();

    streamingChatModel.chat(
        request,
        new StreamingChatResponseHandler() {
          @Override
          public void onPartialResponse(String partialResponse) {
            if (!buffer.push(Fragment.text(partialResponse))) {
              log.trace("Dropping partial response after the stream was closed");
            }
          }

          @Override
          public void onCompleteResponse(ChatResponse completeResponse) {
            log.debug(
                "Model stream complete, finish reason: {}",
                completeResponse.metadata() != null
                    ? completeResponse.metadata().finishReason()
                    : null);
            buffer.push(Fragment.endOfStream());
            buffer.finish();
          }

          @Override
          public void onError(Throwable error) {
            log.warn("Model stream failed: {}", error.getMessage());
            buffer.push(
                Fragment.error(
                    error.getMessage() != null
                        ? error.getMessage()
                        : error.getClass().getSimpleName()));
            buffer.finish();
          }
        });

    Iterator<String> fragments = new BufferIterator(buffer);
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(fragments, Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  @Override
  public String describe() {
    return "langchain4j:" + modelName;
  }

  private static final class BufferIterator implements Iterator<String> {

    private final TokenChannel buffer;
    private String pending;
    private boolean exhausted;

    private BufferIterator(TokenChannel buffer) {
      this.buffer = buffer;
    }

    @Override
    public boolean hasNext() {
      if (pending != null) {
        return true;
      }
      if (exhausted) {
        return false;
      }
      Optional<Fragment> next = take();
      if (next.isEmpty() || next.get() instanceof Fragment.EndOfStream) {
        exhausted = true;
        return false;
      }
      if (next.get() instanceof Fragment.Error error) {
        exhausted = true;
        throw new GenerationSourceException("Model stream failed: " + error.message(), null);
      }
      pending = ((Fragment.Text) next.get()).text();
      return true;
    }

    @Override
    public String next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      String fragment = pending;
      pending = null;
      return fragment;
    }

    private Optional<Fragment> take() {
      try {
        return buffer.pop();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new GenerationSourceException("Interrupted while waiting for the model", e);
      }
    }
  }
}
