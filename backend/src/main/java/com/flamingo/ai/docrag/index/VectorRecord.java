package com.flamingo.ai.docrag.index;

/**
 * A chunk vector as stored in the index.
 *
 * @param chunkId primary key
 * @param documentId back-reference used for filtering and cascade deletes
 * @param sequenceIndex position of the chunk within its document
 * @param text the chunk text
 * @param vector the embedding
 */
public record VectorRecord(
    String chunkId, String documentId, int sequenceIndex, String text, float[] vector) {}
