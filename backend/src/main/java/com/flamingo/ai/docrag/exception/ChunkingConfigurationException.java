package com.flamingo.ai.docrag.exception;

/** Exception thrown when chunk size and overlap do not satisfy {@code 0 < overlap < size}. */
public class ChunkingConfigurationException extends DocRagException {

  private final int chunkSize;
  private final int overlap;

  public ChunkingConfigurationException(int chunkSize, int overlap) {
    super(
        ErrorKind.CONFIGURATION,
        String.format(
            "Invalid chunking configuration: size=%d, overlap=%d (require 0 < overlap < size)",
            chunkSize, overlap),
        "Document chunking is misconfigured");
    this.chunkSize = chunkSize;
    this.overlap = overlap;
  }

  public int getChunkSize() {
    return chunkSize;
  }

  public int getOverlap() {
    return overlap;
  }
}
