package com.flamingo.ai.docrag.service.rag.retrieval;

import com.flamingo.ai.docrag.domain.entity.Document;
import com.flamingo.ai.docrag.domain.repository.DocumentRepository;
import com.flamingo.ai.docrag.exception.DocRagException;
import com.flamingo.ai.docrag.exception.DocumentNotFoundException;
import com.flamingo.ai.docrag.exception.DocumentNotReadyException;
import com.flamingo.ai.docrag.exception.ValidationException;
import com.flamingo.ai.docrag.exception.VectorIndexException;
import com.flamingo.ai.docrag.index.IndexMatch;
import com.flamingo.ai.docrag.index.VectorIndex;
import com.flamingo.ai.docrag.index.VectorMath;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Retrieves the chunks of one document nearest to a query vector.
 *
 * <p>Only {@code READY} documents are searched. Results are ordered by ascending distance with
 * ties broken by ascending sequence index, so equal-distance chunks always rank in document order.
 * When requested, cosine similarity is recomputed from the stored vectors, independent of the
 * index metric.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrievalEngine {

  static final Comparator<IndexMatch> RANKING =
      Comparator.comparingDouble(IndexMatch::distance).thenComparingInt(IndexMatch::sequenceIndex);

  private final DocumentRepository documentRepository;
  private final VectorIndex vectorIndex;
  private final MeterRegistry meterRegistry;

  /**
   * Returns at most {@code topK} ranked chunks of the document.
   *
   * @param documentId the document to search
   * @param queryVector the embedded query
   * @param topK maximum number of chunks, must be positive
   * @param wantSimilarity whether to compute cosine similarity for each result
   * @throws ValidationException on a blank id, non-positive topK or wrong dimensionality
   * @throws DocumentNotFoundException if the document does not exist
   * @throws DocumentNotReadyException if the document is processing or failed
   * @throws VectorIndexException if the index is unavailable
   */
  @Timed(value = "retrieval.retrieve", description = "Time to retrieve ranked chunks")
  public List<RankedChunk> retrieve(
      String documentId, float[] queryVector, int topK, boolean wantSimilarity) {
    if (documentId == null || documentId.isBlank()) {
      throw new ValidationException("file_id is required");
    }
    if (topK <= 0) {
      throw new ValidationException("top_k must be positive, got " + topK);
    }
    if (queryVector == null || queryVector.length != vectorIndex.getDimensions()) {
      throw new ValidationException(
          String.format(
              "Query vector has %d dimensions, expected %d",
              queryVector == null ? 0 : queryVector.length, vectorIndex.getDimensions()));
    }

    requireReady(documentId);

    List<IndexMatch> matches;
    try {
      matches = vectorIndex.search(queryVector, topK, documentId, wantSimilarity);
    } catch (DocRagException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new VectorIndexException("Vector index unavailable: " + e.getMessage(), e);
    }

    List<IndexMatch> ordered = new ArrayList<>(matches);
    ordered.sort(RANKING);

    List<RankedChunk> ranked = new ArrayList<>(Math.min(topK, ordered.size()));
    for (IndexMatch match : ordered) {
      if (ranked.size() == topK) {
        break;
      }
      if (!documentId.equals(match.documentId())) {
        log.warn("Index returned chunk {} of another document, skipping", match.chunkId());
        continue;
      }
      ranked.add(toRanked(match, queryVector, wantSimilarity, ranked.size() + 1));
    }

    meterRegistry.counter("retrieval.chunks.returned").increment(ranked.size());
    log.debug(
        "Retrieved {} chunks for document {} (topK={}, similarity={})",
        ranked.size(),
        documentId,
        topK,
        wantSimilarity);
    return ranked;
  }

  /**
   * Checks that a document exists and has finished ingestion.
   *
   * @throws DocumentNotFoundException if the document does not exist
   * @throws DocumentNotReadyException if the document is processing or failed
   */
  public Document requireReady(String documentId) {
    Document document =
        documentRepository
            .findById(documentId)
            .orElseThrow(() -> new DocumentNotFoundException(documentId));
    if (!document.isReady()) {
      throw new DocumentNotReadyException(documentId, document.getStatus());
    }
    return document;
  }

  private RankedChunk toRanked(
      IndexMatch match, float[] queryVector, boolean wantSimilarity, int rank) {
    Double similarity = null;
    boolean degenerate = false;
    if (wantSimilarity) {
      if (match.hasVector()) {
        VectorMath.Cosine cosine = VectorMath.cosine(queryVector, match.vector());
        similarity = cosine.value();
        degenerate = cosine.degenerate();
        if (degenerate) {
          meterRegistry.counter("retrieval.degenerate_vectors").increment();
        }
      } else {
        similarity = VectorMath.cosineFromSquaredDistance(match.distance());
      }
    }
    return new RankedChunk(
        match.chunkId(),
        match.documentId(),
        match.sequenceIndex(),
        match.text(),
        match.distance(),
        similarity,
        degenerate,
        rank,
        match.vector());
  }
}
