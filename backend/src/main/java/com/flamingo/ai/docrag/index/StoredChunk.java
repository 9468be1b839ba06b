package com.flamingo.ai.docrag.index;

/** A stored chunk as seen by vector inspection. {@code vector} is null unless requested. */
public record StoredChunk(
    String chunkId,
    String documentId,
    int sequenceIndex,
    String text,
    int vectorDimensions,
    float[] vector) {}
