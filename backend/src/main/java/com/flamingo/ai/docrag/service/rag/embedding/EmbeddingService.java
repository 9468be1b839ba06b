package com.flamingo.ai.docrag.service.rag.embedding;

import com.flamingo.ai.docrag.config.RagConfig;
import com.flamingo.ai.docrag.exception.ProviderException;
import com.flamingo.ai.docrag.exception.ValidationException;
import com.flamingo.ai.docrag.service.rag.retry.ProviderRetryPolicy;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Embeds document passages and queries through the configured {@link EmbeddingProvider}.
 *
 * <p>Each call is a single provider request wrapped in the provider retry policy. A result with
 * the wrong number of vectors or a vector of the wrong dimensionality is a validation failure.
 * Vectors are never padded or truncated.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  private final EmbeddingProvider embeddingProvider;
  private final ProviderRetryPolicy providerRetryPolicy;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds all passages of a document in one batched call.
   *
   * @param passages the chunk texts, in order
   * @return one vector per passage, in the same order
   */
  @Timed(value = "embedding.embedPassages", description = "Time to embed a document's passages")
  public List<float[]> embedPassages(List<String> passages) {
    if (passages.isEmpty()) {
      return List.of();
    }
    log.debug("Embedding {} passages in one batch", passages.size());
    List<float[]> vectors = callProvider(passages, "passage");
    meterRegistry.counter("embedding.passages").increment(passages.size());
    return vectors;
  }

  /**
   * Embeds a single query.
   *
   * @param query the question text
   * @return the query vector
   */
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  public float[] embedQuery(String query) {
    if (query == null || query.isBlank()) {
      throw new ValidationException("Query text is required");
    }
    return callProvider(List.of(query), "query").get(0);
  }

  private List<float[]> callProvider(List<String> texts, String type) {
    List<float[]> vectors;
    try {
      vectors = providerRetryPolicy.execute(() -> embeddingProvider.embed(texts));
    } catch (ProviderException e) {
      meterRegistry
          .counter("embedding.requests.failure", "type", type, "reason", e.getReason().name())
          .increment();
      log.error("Embedding {} request failed: {}", type, e.getMessage());
      throw e;
    }

    if (vectors.size() != texts.size()) {
      throw new ValidationException(
          String.format(
              "Embedding count mismatch: expected %d, got %d", texts.size(), vectors.size()));
    }
    int expected = ragConfig.getEmbedding().getDimensions();
    for (int i = 0; i < vectors.size(); i++) {
      float[] vector = vectors.get(i);
      if (vector == null || vector.length != expected) {
        throw new ValidationException(
            String.format(
                "Embedding %d has %d dimensions, expected %d",
                i, vector == null ? 0 : vector.length, expected));
      }
    }
    meterRegistry.counter("embedding.requests.success", "type", type).increment();
    return vectors;
  }
}
