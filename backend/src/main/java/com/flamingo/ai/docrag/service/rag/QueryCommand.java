package com.flamingo.ai.docrag.service.rag;

/**
 * A question against one document.
 *
 * @param topK number of chunks to retrieve, or {@code null} for the configured default
 * @param showSimilarity whether to report per-chunk distances and cosine similarities
 * @param showEmbedding whether to return the query vector
 */
public record QueryCommand(
    String fileId, String question, Integer topK, boolean showSimilarity, boolean showEmbedding) {}
