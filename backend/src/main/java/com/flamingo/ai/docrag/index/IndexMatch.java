package com.flamingo.ai.docrag.index;

/**
 * A nearest-neighbour candidate returned by {@link VectorIndex#search}.
 *
 * @param distance squared Euclidean distance to the query; smaller is closer
 * @param vector the stored vector, or {@code null} when it was not requested or not returned
 */
public record IndexMatch(
    String chunkId,
    String documentId,
    int sequenceIndex,
    String text,
    double distance,
    float[] vector) {

  public boolean hasVector() {
    return vector != null && vector.length > 0;
  }
}
