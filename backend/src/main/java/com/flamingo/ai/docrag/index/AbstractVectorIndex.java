package com.flamingo.ai.docrag.index;

import com.flamingo.ai.docrag.config.RagConfig;
import com.flamingo.ai.docrag.exception.ValidationException;
import com.flamingo.ai.docrag.exception.VectorIndexException;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Base class for vector index implementations.
 *
 * <p>Owns the connection state and the record and query checks every implementation applies
 * before touching storage. Subclasses implement the storage operations.
 */
public abstract class AbstractVectorIndex implements VectorIndex {

  protected final RagConfig ragConfig;
  protected final MeterRegistry meterRegistry;

  private volatile boolean ready;

  protected AbstractVectorIndex(RagConfig ragConfig, MeterRegistry meterRegistry) {
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Returns the metric prefix for this index (e.g., "vector_index.elasticsearch").
   *
   * @return the metric prefix
   */
  protected abstract String getMetricPrefix();

  /** Creates or validates storage; throws {@link VectorIndexException} on failure. */
  protected abstract void doConnect();

  @Override
  public synchronized void connect() {
    if (ready) {
      return;
    }
    doConnect();
    ready = true;
  }

  @Override
  public boolean isReady() {
    return ready;
  }

  @Override
  public int getDimensions() {
    return ragConfig.getEmbedding().getDimensions();
  }

  /** Connects lazily if startup initialization did not succeed. */
  protected void ensureReady() {
    if (!ready) {
      connect();
    }
  }

  protected void validateRecords(List<VectorRecord> records) {
    int maxTextLength = ragConfig.getIndex().getMaxChunkTextLength();
    Set<String> seenIds = new HashSet<>();
    for (VectorRecord record : records) {
      if (record.chunkId() == null || record.chunkId().isBlank()) {
        throw new ValidationException("Chunk id is required");
      }
      if (!seenIds.add(record.chunkId())) {
        throw new ValidationException("Duplicate chunk id in batch: " + record.chunkId());
      }
      requireDocumentId(record.documentId());
      if (record.text() == null || record.text().length() > maxTextLength) {
        throw new ValidationException(
            "Chunk text of " + record.chunkId() + " exceeds " + maxTextLength + " characters");
      }
      requireDimensions(record.vector(), "Vector of " + record.chunkId());
    }
  }

  protected void validateQuery(float[] queryVector, int topK, String documentId) {
    requireDocumentId(documentId);
    if (topK <= 0) {
      throw new ValidationException("topK must be positive, got " + topK);
    }
    requireDimensions(queryVector, "Query vector");
  }

  protected void requireDocumentId(String documentId) {
    if (documentId == null || documentId.isBlank()) {
      throw new ValidationException("Document id is required");
    }
  }

  private void requireDimensions(float[] vector, String label) {
    int expected = getDimensions();
    if (vector == null || vector.length != expected) {
      throw new ValidationException(
          String.format(
              "%s has %d dimensions, expected %d",
              label, vector == null ? 0 : vector.length, expected));
    }
  }
}
