package com.flamingo.ai.docrag.service.rag.context;

import com.flamingo.ai.docrag.config.RagConfig;
import com.flamingo.ai.docrag.exception.ValidationException;
import com.flamingo.ai.docrag.service.rag.retrieval.RankedChunk;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds the generation context from ranked chunks under a character budget.
 *
 * <p>Chunks are taken in rank order. Chunks whose text was already included are skipped. A chunk
 * that does not fit is cut back to its last sentence terminator, or failing that its last
 * whitespace, and kept only when the fragment is longer than the configured minimum. Later chunks
 * are still considered after one is dropped. The separator between blocks counts against the
 * budget.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContextAssembler {

  private final RagConfig ragConfig;

  /** Assembles with the configured {@code rag.context.max-chars}. */
  public AssembledContext assemble(List<RankedChunk> rankedChunks) {
    return assemble(rankedChunks, ragConfig.getContext().getMaxChars());
  }

  public AssembledContext assemble(List<RankedChunk> rankedChunks, int maxContextChars) {
    if (maxContextChars <= 0) {
      throw new ValidationException("maxContextChars must be positive, got " + maxContextChars);
    }
    int minFragment = ragConfig.getContext().getMinFragmentChars();
    int separatorLength = AssembledContext.SEPARATOR.length();

    List<ContextBlock> blocks = new ArrayList<>();
    List<DroppedChunk> dropped = new ArrayList<>();
    Set<HashCode> seen = new HashSet<>();
    int used = 0;

    for (RankedChunk chunk : rankedChunks) {
      String text = chunk.text() == null ? "" : chunk.text();
      HashCode contentKey = Hashing.sha256().hashString(text, StandardCharsets.UTF_8);
      if (seen.contains(contentKey)) {
        dropped.add(new DroppedChunk(chunk.chunkId(), DroppedChunk.Reason.DUPLICATE));
        continue;
      }

      int overhead = blocks.isEmpty() ? 0 : separatorLength;
      int available = maxContextChars - used - overhead;

      if (text.length() <= available) {
        blocks.add(new ContextBlock(chunk.chunkId(), chunk.rank(), text, false));
        seen.add(contentKey);
        used += overhead + text.length();
        continue;
      }

      String fragment = available > 0 ? truncateAtBoundary(text, available) : "";
      if (fragment.length() > minFragment) {
        blocks.add(new ContextBlock(chunk.chunkId(), chunk.rank(), fragment, true));
        seen.add(contentKey);
        used += overhead + fragment.length();
      } else {
        dropped.add(new DroppedChunk(chunk.chunkId(), DroppedChunk.Reason.OVER_BUDGET));
      }
    }

    log.debug(
        "Assembled context: {} blocks, {} dropped, {}/{} chars",
        blocks.size(),
        dropped.size(),
        used,
        maxContextChars);
    return new AssembledContext(blocks, dropped, used);
  }

  /**
   * Cuts {@code text} to at most {@code limit} chars, ending on a sentence or word boundary. A
   * terminator only ends a sentence when whitespace or the end of the text follows it.
   */
  static String truncateAtBoundary(String text, int limit) {
    String prefix = text.substring(0, Math.min(limit, text.length()));
    for (int i = prefix.length() - 1; i >= 0; i--) {
      char c = prefix.charAt(i);
      if ((c == '.' || c == '!' || c == '?')
          && (i + 1 == text.length() || Character.isWhitespace(text.charAt(i + 1)))) {
        return prefix.substring(0, i + 1);
      }
    }
    for (int i = prefix.length() - 1; i >= 0; i--) {
      if (Character.isWhitespace(prefix.charAt(i))) {
        return prefix.substring(0, i).stripTrailing();
      }
    }
    return "";
  }
}
