package com.flamingo.ai.docrag.service.rag.ingestion;

import com.flamingo.ai.docrag.domain.entity.Document;
import com.flamingo.ai.docrag.domain.enums.DocumentStatus;
import com.flamingo.ai.docrag.domain.repository.DocumentRepository;
import com.flamingo.ai.docrag.exception.DocRagException;
import com.flamingo.ai.docrag.exception.DocumentNotFoundException;
import com.flamingo.ai.docrag.exception.ErrorKind;
import com.flamingo.ai.docrag.exception.ValidationException;
import com.flamingo.ai.docrag.exception.VectorIndexException;
import com.flamingo.ai.docrag.index.VectorIndex;
import com.flamingo.ai.docrag.index.VectorRecord;
import com.flamingo.ai.docrag.service.rag.chunking.Chunk;
import com.flamingo.ai.docrag.service.rag.chunking.TextChunker;
import com.flamingo.ai.docrag.service.rag.embedding.EmbeddingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Ingests a registered document: chunk, embed in one batch, index, then flip status.
 *
 * <p>All or nothing: a failure at any step removes whatever reached the index and marks the
 * document FAILED, so a document is either READY with every chunk indexed or has no vectors at
 * all.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentIngestionService {

  static final String INGEST_TIMER = "document.ingest";

  private final DocumentRepository documentRepository;
  private final TextChunker textChunker;
  private final EmbeddingService embeddingService;
  private final VectorIndex vectorIndex;
  private final DocumentStatusUpdater statusUpdater;
  private final MeterRegistry meterRegistry;

  /** Runs {@link #ingest} on the document processing executor. */
  @Async("documentProcessingExecutor")
  public CompletableFuture<IngestionOutcome> ingestAsync(String fileId, String text) {
    return CompletableFuture.completedFuture(ingest(fileId, text));
  }

  /**
   * Ingests the text of a {@code PROCESSING} document.
   *
   * @param fileId the registered document
   * @param text the extracted, normalized text
   * @return the outcome; failures are reported, not thrown
   * @throws DocumentNotFoundException if the document is not registered
   * @throws IllegalStateException if the document already left {@code PROCESSING}
   */
  public IngestionOutcome ingest(String fileId, String text) {
    // Timed explicitly: ingestAsync calls this method directly, bypassing the proxy
    Timer.Sample sample = Timer.start(meterRegistry);
    String result = "error";
    try {
      IngestionOutcome outcome = doIngest(fileId, text);
      result = outcome instanceof IngestionOutcome.Indexed ? "indexed" : "failed";
      return outcome;
    } finally {
      sample.stop(meterRegistry.timer(INGEST_TIMER, "outcome", result));
    }
  }

  private IngestionOutcome doIngest(String fileId, String text) {
    Document document =
        documentRepository
            .findById(fileId)
            .orElseThrow(() -> new DocumentNotFoundException(fileId));
    if (document.getStatus() != DocumentStatus.PROCESSING) {
      throw new IllegalStateException(
          "Document " + fileId + " is " + document.getStatus() + ", expected PROCESSING");
    }

    boolean indexTouched = false;
    try {
      List<Chunk> chunks = textChunker.chunk(fileId, text);
      log.info("Document {} split into {} chunks", fileId, chunks.size());

      List<String> passages = chunks.stream().map(Chunk::text).toList();
      List<float[]> vectors = embeddingService.embedPassages(passages);
      if (vectors.size() != chunks.size()) {
        throw new ValidationException(
            String.format(
                "Embedding generation failed: expected %d embeddings, got %d",
                chunks.size(), vectors.size()));
      }

      List<VectorRecord> records = new ArrayList<>(chunks.size());
      for (int i = 0; i < chunks.size(); i++) {
        Chunk chunk = chunks.get(i);
        records.add(
            new VectorRecord(
                chunk.chunkId(),
                chunk.documentId(),
                chunk.sequenceIndex(),
                chunk.text(),
                vectors.get(i)));
      }

      indexTouched = true;
      insert(records);
      log.debug("Indexed {} vectors for document {}", records.size(), fileId);

      statusUpdater.markReady(fileId, chunks.size(), records.size());
      meterRegistry.counter("document.processing.success").increment();
      log.info("Successfully ingested document {}: {} chunks", fileId, chunks.size());
      return new IngestionOutcome.Indexed(fileId, chunks.size(), records.size());

    } catch (DocRagException e) {
      return fail(fileId, e.getKind(), e.getMessage(), indexTouched);
    } catch (RuntimeException e) {
      log.error("Unexpected error while ingesting document {}", fileId, e);
      return fail(fileId, ErrorKind.INTERNAL, e.getMessage(), indexTouched);
    }
  }

  private void insert(List<VectorRecord> records) {
    try {
      vectorIndex.insert(records);
    } catch (DocRagException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new VectorIndexException("Vector index unavailable: " + e.getMessage(), e);
    }
  }

  private IngestionOutcome fail(
      String fileId, ErrorKind kind, String message, boolean indexTouched) {
    log.error("Failed to ingest document {} ({}): {}", fileId, kind, message);
    meterRegistry.counter("document.processing.failure", "kind", kind.name()).increment();

    if (indexTouched) {
      try {
        vectorIndex.deleteByDocument(fileId);
      } catch (RuntimeException cleanupEx) {
        log.error(
            "Cleanup of vectors for failed document {} failed: {}",
            fileId,
            cleanupEx.getMessage());
      }
    }
    try {
      statusUpdater.markFailed(fileId, kind, message);
    } catch (RuntimeException statusEx) {
      log.error("Failed to mark document {} as failed: {}", fileId, statusEx.getMessage());
    }
    return new IngestionOutcome.Failed(fileId, kind, message);
  }
}
