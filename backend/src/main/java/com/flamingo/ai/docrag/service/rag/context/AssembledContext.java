package com.flamingo.ai.docrag.service.rag.context;

import java.util.List;

/**
 * Context text built from ranked chunks, in rank order.
 *
 * @param blocks included chunks, rank order preserved
 * @param dropped excluded chunks with the reason for each
 * @param totalChars length of {@link #text()}, never above the budget it was assembled for
 */
public record AssembledContext(
    List<ContextBlock> blocks, List<DroppedChunk> dropped, int totalChars) {

  /** Separator placed between consecutive blocks. */
  public static final String SEPARATOR = "\n\n";

  public AssembledContext {
    blocks = List.copyOf(blocks);
    dropped = List.copyOf(dropped);
  }

  public String text() {
    StringBuilder sb = new StringBuilder(totalChars);
    for (ContextBlock block : blocks) {
      if (sb.length() > 0) {
        sb.append(SEPARATOR);
      }
      sb.append(block.text());
    }
    return sb.toString();
  }

  public List<String> droppedChunkIds() {
    return dropped.stream().map(DroppedChunk::chunkId).toList();
  }

  public boolean isEmpty() {
    return blocks.isEmpty();
  }
}
