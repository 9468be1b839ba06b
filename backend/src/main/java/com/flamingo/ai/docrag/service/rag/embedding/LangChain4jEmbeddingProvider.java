package com.flamingo.ai.docrag.service.rag.embedding;

import com.flamingo.ai.docrag.exception.ProviderException;
import com.flamingo.ai.docrag.exception.ProviderFailureReason;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.TimeoutException;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** {@link EmbeddingProvider} backed by a LangChain4j {@link EmbeddingModel}. */
@Component
@RequiredArgsConstructor
@Slf4j
public class LangChain4jEmbeddingProvider implements EmbeddingProvider {

  private final EmbeddingModel embeddingModel;

  @Override
  public List<float[]> embed(List<String> texts) {
    List<TextSegment> segments = texts.stream().map(TextSegment::from).toList();
    Response<List<Embedding>> response;
    try {
      response = embeddingModel.embedAll(segments);
    } catch (RateLimitException e) {
      throw new ProviderException(
          ProviderFailureReason.RATE_LIMITED, "Embedding provider rate limited", e);
    } catch (TimeoutException e) {
      throw new ProviderException(
          ProviderFailureReason.TIMEOUT, "Embedding provider timed out", e);
    } catch (RuntimeException e) {
      throw new ProviderException(
          ProviderFailureReason.FAILURE, "Embedding provider failed: " + e.getMessage(), e);
    }

    if (response == null || response.content() == null) {
      throw new ProviderException(
          ProviderFailureReason.FAILURE, "Embedding provider returned no content");
    }
    return response.content().stream().map(Embedding::vector).toList();
  }
}
