package com.flamingo.ai.docrag.index;

import java.util.List;

/**
 * Stores chunk vectors keyed by chunk id and answers k-nearest-neighbour queries restricted to a
 * single document.
 *
 * <p>Distances are squared Euclidean. Implementations must never return chunks of a document other
 * than the one the search is filtered to. All failures surface as {@link
 * com.flamingo.ai.docrag.exception.VectorIndexException}, except malformed input which raises
 * {@link com.flamingo.ai.docrag.exception.ValidationException}.
 */
public interface VectorIndex {

  /** Creates or validates the underlying index. Safe to call repeatedly. */
  void connect();

  /** Whether {@link #connect()} has succeeded. */
  boolean isReady();

  /** The fixed vector dimensionality of this index. */
  int getDimensions();

  /**
   * Inserts records as one logical unit: when this method throws, none of the records remain
   * visible.
   */
  void insert(List<VectorRecord> records);

  /**
   * Returns up to {@code topK} chunks of {@code documentId} nearest to {@code queryVector}, closest
   * first.
   *
   * @param includeVectors whether matches should carry their stored vector
   */
  List<IndexMatch> search(float[] queryVector, int topK, String documentId, boolean includeVectors);

  /** Deletes every vector of a document and returns how many were removed. */
  long deleteByDocument(String documentId);

  /** Counts the vectors stored for a document. */
  long countByDocument(String documentId);

  /**
   * Lists stored chunks ordered by document then sequence index.
   *
   * @param documentId restrict to one document, or {@code null} for all
   */
  List<StoredChunk> inspect(String documentId, int limit, boolean includeVectors);
}
