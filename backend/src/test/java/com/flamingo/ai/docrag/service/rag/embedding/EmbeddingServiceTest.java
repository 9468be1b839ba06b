package com.flamingo.ai.docrag.service.rag.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.docrag.config.RagConfig;
import com.flamingo.ai.docrag.exception.ProviderException;
import com.flamingo.ai.docrag.exception.ProviderFailureReason;
import com.flamingo.ai.docrag.exception.ValidationException;
import com.flamingo.ai.docrag.service.rag.retry.ProviderRetryPolicy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingService")
class EmbeddingServiceTest {

  @Mock private EmbeddingProvider embeddingProvider;

  private SimpleMeterRegistry meterRegistry;
  private EmbeddingService embeddingService;

  @BeforeEach
  void setUp() {
    RagConfig ragConfig = new RagConfig();
    ragConfig.getEmbedding().setDimensions(2);
    meterRegistry = new SimpleMeterRegistry();
    ProviderRetryPolicy retryPolicy =
        new ProviderRetryPolicy(
            "embedding",
            3,
            1,
            1.5,
            EnumSet.of(ProviderFailureReason.RATE_LIMITED, ProviderFailureReason.TIMEOUT),
            meterRegistry);
    embeddingService =
        new EmbeddingService(embeddingProvider, retryPolicy, ragConfig, meterRegistry);
  }

  @Test
  @DisplayName("should embed all passages in a single provider call")
  void shouldEmbedPassagesInOneBatch() {
    // Given
    List<String> passages = List.of("one", "two", "three");
    when(embeddingProvider.embed(passages))
        .thenReturn(List.of(new float[] {1f, 0f}, new float[] {0f, 1f}, new float[] {1f, 1f}));

    // When
    List<float[]> vectors = embeddingService.embedPassages(passages);

    // Then
    assertThat(vectors).hasSize(3);
    verify(embeddingProvider, times(1)).embed(anyList());
    assertThat(meterRegistry.counter("embedding.passages").count()).isEqualTo(3.0);
  }

  @Test
  void shouldNotCallProvider_whenNoPassages() {
    assertThat(embeddingService.embedPassages(List.of())).isEmpty();
    verify(embeddingProvider, never()).embed(anyList());
  }

  @Test
  void shouldRetryRateLimitedEmbedding() {
    when(embeddingProvider.embed(List.of("question")))
        .thenThrow(new ProviderException(ProviderFailureReason.RATE_LIMITED, "429"))
        .thenReturn(List.of(new float[] {0.6f, 0.8f}));

    float[] vector = embeddingService.embedQuery("question");

    assertThat(vector).containsExactly(0.6f, 0.8f);
    verify(embeddingProvider, times(2)).embed(anyList());
  }

  @Test
  @DisplayName("should surface provider failure after exhausting attempts")
  void shouldThrowProviderException_whenRetriesExhausted() {
    when(embeddingProvider.embed(anyList()))
        .thenThrow(new ProviderException(ProviderFailureReason.TIMEOUT, "timeout"));

    assertThatThrownBy(() -> embeddingService.embedQuery("question"))
        .isInstanceOf(ProviderException.class);
    verify(embeddingProvider, times(3)).embed(anyList());
    assertThat(
            meterRegistry
                .counter("embedding.requests.failure", "type", "query", "reason", "TIMEOUT")
                .count())
        .isEqualTo(1.0);
  }

  @Test
  void shouldRejectResponse_whenCountDoesNotMatch() {
    when(embeddingProvider.embed(anyList())).thenReturn(List.of(new float[] {1f, 0f}));

    assertThatThrownBy(() -> embeddingService.embedPassages(List.of("a", "b")))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("expected 2, got 1");
  }

  @Test
  void shouldRejectResponse_whenDimensionsWrong() {
    when(embeddingProvider.embed(anyList())).thenReturn(List.of(new float[] {1f, 0f, 0f}));

    assertThatThrownBy(() -> embeddingService.embedQuery("question"))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("3 dimensions");
  }

  @Test
  void shouldRejectBlankQuery() {
    assertThatThrownBy(() -> embeddingService.embedQuery("  "))
        .isInstanceOf(ValidationException.class);
    verify(embeddingProvider, never()).embed(anyList());
  }
}
