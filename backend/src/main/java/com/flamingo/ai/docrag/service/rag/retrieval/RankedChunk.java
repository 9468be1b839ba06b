package com.flamingo.ai.docrag.service.rag.retrieval;

/**
 * A retrieved chunk with its scores and 1-based rank.
 *
 * @param distance squared Euclidean distance reported by the index
 * @param similarity cosine similarity in [-1, 1], or {@code null} when not requested
 * @param degenerateVector whether a zero-norm vector forced the similarity to 0
 * @param vector the stored vector when it was requested, otherwise {@code null}
 */
public record RankedChunk(
    String chunkId,
    String documentId,
    int sequenceIndex,
    String text,
    double distance,
    Double similarity,
    boolean degenerateVector,
    int rank,
    float[] vector) {}
