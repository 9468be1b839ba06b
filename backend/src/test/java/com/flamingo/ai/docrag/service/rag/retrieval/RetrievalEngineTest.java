package com.flamingo.ai.docrag.service.rag.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.docrag.domain.entity.Document;
import com.flamingo.ai.docrag.domain.enums.DocumentStatus;
import com.flamingo.ai.docrag.domain.repository.DocumentRepository;
import com.flamingo.ai.docrag.exception.DocumentNotFoundException;
import com.flamingo.ai.docrag.exception.DocumentNotReadyException;
import com.flamingo.ai.docrag.exception.ErrorKind;
import com.flamingo.ai.docrag.exception.ValidationException;
import com.flamingo.ai.docrag.exception.VectorIndexException;
import com.flamingo.ai.docrag.index.IndexMatch;
import com.flamingo.ai.docrag.index.VectorIndex;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("RetrievalEngine")
class RetrievalEngineTest {

  private static final String FILE_ID = "file_1";
  private static final float[] QUERY = {1f, 0f, 0f};

  @Mock private DocumentRepository documentRepository;
  @Mock private VectorIndex vectorIndex;
  @Mock private MeterRegistry meterRegistry;
  @Mock private Counter counter;

  private RetrievalEngine engine;

  @BeforeEach
  void setUp() {
    engine = new RetrievalEngine(documentRepository, vectorIndex, meterRegistry);
    lenient().when(meterRegistry.counter(anyString())).thenReturn(counter);
    lenient().when(vectorIndex.getDimensions()).thenReturn(3);
  }

  @Test
  void shouldThrowNotFound_whenDocumentUnknown() {
    when(documentRepository.findById(FILE_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> engine.retrieve(FILE_ID, QUERY, 5, false))
        .isInstanceOf(DocumentNotFoundException.class);
    verify(vectorIndex, never()).search(any(), anyInt(), anyString(), anyBoolean());
  }

  @Test
  @DisplayName("processing and failed documents are reported as not ready")
  void shouldThrowNotReady_whenDocumentProcessingOrFailed() {
    when(documentRepository.findById(FILE_ID))
        .thenReturn(Optional.of(document(DocumentStatus.PROCESSING)))
        .thenReturn(Optional.of(document(DocumentStatus.FAILED)));

    assertThatThrownBy(() -> engine.retrieve(FILE_ID, QUERY, 5, false))
        .isInstanceOf(DocumentNotReadyException.class)
        .satisfies(
            e ->
                assertThat(((DocumentNotReadyException) e).getKind())
                    .isEqualTo(ErrorKind.NOT_READY));
    assertThatThrownBy(() -> engine.retrieve(FILE_ID, QUERY, 5, false))
        .isInstanceOf(DocumentNotReadyException.class);
  }

  @Test
  void shouldRankByDistanceThenSequenceIndex() {
    // Given
    when(documentRepository.findById(FILE_ID))
        .thenReturn(Optional.of(document(DocumentStatus.READY)));
    when(vectorIndex.search(QUERY, 3, FILE_ID, false))
        .thenReturn(
            List.of(
                match("c5", 5, 0.4, null),
                match("c2", 2, 0.4, null),
                match("c9", 9, 0.1, null)));

    // When
    List<RankedChunk> ranked = engine.retrieve(FILE_ID, QUERY, 3, false);

    // Then
    assertThat(ranked).extracting(RankedChunk::chunkId).containsExactly("c9", "c2", "c5");
    assertThat(ranked).extracting(RankedChunk::rank).containsExactly(1, 2, 3);
    assertThat(ranked).allMatch(chunk -> chunk.similarity() == null);
  }

  @Test
  @DisplayName("ready document with fewer chunks than topK returns all of them")
  void shouldReturnAllChunks_whenFewerThanTopK() {
    when(documentRepository.findById(FILE_ID))
        .thenReturn(Optional.of(document(DocumentStatus.READY)));
    when(vectorIndex.search(QUERY, 10, FILE_ID, false))
        .thenReturn(List.of(match("c0", 0, 0.2, null)));

    assertThat(engine.retrieve(FILE_ID, QUERY, 10, false)).hasSize(1);
  }

  @Test
  void shouldComputeCosineFromStoredVector_whenSimilarityRequested() {
    when(documentRepository.findById(FILE_ID))
        .thenReturn(Optional.of(document(DocumentStatus.READY)));
    when(vectorIndex.search(QUERY, 2, FILE_ID, true))
        .thenReturn(
            List.of(
                match("c0", 0, 0.0, new float[] {2f, 0f, 0f}),
                match("c1", 1, 1.0, new float[] {0f, 0f, 0f})));

    List<RankedChunk> ranked = engine.retrieve(FILE_ID, QUERY, 2, true);

    assertThat(ranked.get(0).similarity()).isCloseTo(1.0, within(1e-6));
    assertThat(ranked.get(0).degenerateVector()).isFalse();
    assertThat(ranked.get(1).similarity()).isZero();
    assertThat(ranked.get(1).degenerateVector()).isTrue();
    verify(meterRegistry).counter("retrieval.degenerate_vectors");
  }

  @Test
  void shouldSkipChunksOfOtherDocuments() {
    when(documentRepository.findById(FILE_ID))
        .thenReturn(Optional.of(document(DocumentStatus.READY)));
    IndexMatch foreign = new IndexMatch("x_0", "other", 0, "foreign", 0.0, null);
    when(vectorIndex.search(QUERY, 5, FILE_ID, false))
        .thenReturn(List.of(foreign, match("c1", 1, 0.3, null)));

    List<RankedChunk> ranked = engine.retrieve(FILE_ID, QUERY, 5, false);

    assertThat(ranked).extracting(RankedChunk::documentId).containsOnly(FILE_ID);
  }

  @Test
  @DisplayName("unexpected index failures surface as index errors")
  void shouldWrapIndexFailure_asVectorIndexException() {
    when(documentRepository.findById(FILE_ID))
        .thenReturn(Optional.of(document(DocumentStatus.READY)));
    when(vectorIndex.search(any(), eq(5), eq(FILE_ID), eq(false)))
        .thenThrow(new IllegalStateException("connection refused"));

    assertThatThrownBy(() -> engine.retrieve(FILE_ID, QUERY, 5, false))
        .isInstanceOf(VectorIndexException.class)
        .hasCauseInstanceOf(IllegalStateException.class);
  }

  @Test
  void shouldRejectInvalidArguments() {
    assertThatThrownBy(() -> engine.retrieve(FILE_ID, QUERY, 0, false))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> engine.retrieve(FILE_ID, new float[] {1f}, 5, false))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> engine.retrieve("", QUERY, 5, false))
        .isInstanceOf(ValidationException.class);
  }

  private static Document document(DocumentStatus status) {
    return Document.builder().fileId(FILE_ID).fileName("a.txt").status(status).build();
  }

  private static IndexMatch match(String id, int sequence, double distance, float[] vector) {
    return new IndexMatch(id, FILE_ID, sequence, "text " + id, distance, vector);
  }
}
