package com.flamingo.ai.docrag.service.rag.embedding;

import java.util.List;

/**
 * Turns texts into fixed-length vectors.
 *
 * <p>Implementations return exactly one vector per input text, in input order, and report failures
 * as {@link com.flamingo.ai.docrag.exception.ProviderException} classified as rate-limited, timeout
 * or generic failure.
 */
public interface EmbeddingProvider {

  List<float[]> embed(List<String> texts);
}
