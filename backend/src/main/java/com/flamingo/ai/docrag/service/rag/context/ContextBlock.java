package com.flamingo.ai.docrag.service.rag.context;

/** A chunk's text as placed in the assembled context; {@code truncated} marks a cut fragment. */
public record ContextBlock(String chunkId, int rank, String text, boolean truncated) {}
