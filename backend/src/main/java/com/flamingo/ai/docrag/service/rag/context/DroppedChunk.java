package com.flamingo.ai.docrag.service.rag.context;

/** A ranked chunk left out of the assembled context, and why. */
public record DroppedChunk(String chunkId, Reason reason) {

  public enum Reason {
    /** Same text as a chunk already included. */
    DUPLICATE,

    /** Did not fit in the remaining budget, even as a truncated fragment. */
    OVER_BUDGET
  }
}
