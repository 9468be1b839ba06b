package com.flamingo.ai.docrag.service.rag.chunking;

import com.flamingo.ai.docrag.config.RagConfig;
import com.flamingo.ai.docrag.exception.ChunkingConfigurationException;
import com.flamingo.ai.docrag.exception.EmptyDocumentException;
import com.flamingo.ai.docrag.exception.ValidationException;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Splits document text into overlapping chunks that end on sentence or word boundaries where
 * possible.
 *
 * <p>Each step proposes {@code end = pos + chunkSize} and looks back over at most {@code
 * boundaryLookback} characters (never before {@code pos}) for, in order of preference:
 *
 * <ol>
 *   <li>the rightmost sentence terminator ({@code . ! ?}) followed by whitespace,
 *   <li>the rightmost whitespace character,
 *   <li>otherwise a hard cut at the proposed end.
 * </ol>
 *
 * <p>The next chunk starts {@code overlap} characters before the previous end, or at the previous
 * end if that would not advance. Chunks reproduce the source exactly: {@code text ==
 * source.substring(charStart, charEnd)}.
 *
 * <p>Stateless; safe to share across concurrent ingestions.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TextChunker {

  private final RagConfig ragConfig;

  /** Chunks text using the configured size and overlap. */
  public List<Chunk> chunk(String documentId, String text) {
    RagConfig.Chunking chunking = ragConfig.getChunking();
    return chunk(documentId, text, chunking.getSize(), chunking.getOverlap());
  }

  /**
   * Chunks text with an explicit size and overlap.
   *
   * @throws ChunkingConfigurationException unless {@code 0 < overlap < chunkSize}
   * @throws EmptyDocumentException if the text is empty or whitespace-only
   */
  public List<Chunk> chunk(String documentId, String text, int chunkSize, int overlap) {
    if (overlap <= 0 || overlap >= chunkSize) {
      throw new ChunkingConfigurationException(chunkSize, overlap);
    }
    if (documentId == null || documentId.isBlank()) {
      throw new ValidationException("Document id is required for chunking");
    }
    if (text == null || text.isBlank()) {
      throw new EmptyDocumentException(documentId);
    }

    int lookback = Math.max(0, ragConfig.getChunking().getBoundaryLookback());
    int length = text.length();
    List<Chunk> chunks = new ArrayList<>();
    int sentenceBreaks = 0;
    int whitespaceBreaks = 0;
    int hardBreaks = 0;

    int pos = 0;
    while (true) {
      int end = Math.min(pos + chunkSize, length);

      if (end < length) {
        int windowStart = Math.max(pos, end - lookback);
        int sentenceEnd = findSentenceEnd(text, windowStart, end);
        if (sentenceEnd > pos) {
          end = sentenceEnd;
          sentenceBreaks++;
        } else {
          int wordEnd = findWhitespaceEnd(text, windowStart, end);
          if (wordEnd > pos) {
            end = wordEnd;
            whitespaceBreaks++;
          } else {
            hardBreaks++;
          }
        }
      }

      int sequenceIndex = chunks.size();
      chunks.add(
          new Chunk(
              Chunk.idFor(documentId, sequenceIndex),
              documentId,
              sequenceIndex,
              text.substring(pos, end),
              pos,
              end));

      if (end == length) {
        break;
      }

      int next = end - overlap;
      pos = next > pos ? next : end;
    }

    log.debug(
        "Chunked document {} ({} chars) into {} chunks: {} sentence, {} whitespace, {} hard breaks",
        documentId,
        length,
        chunks.size(),
        sentenceBreaks,
        whitespaceBreaks,
        hardBreaks);
    return chunks;
  }

  /** Returns the offset just after the rightmost terminator in [from, to) that precedes a space. */
  private static int findSentenceEnd(String text, int from, int to) {
    for (int i = to - 1; i >= from; i--) {
      char c = text.charAt(i);
      if ((c == '.' || c == '!' || c == '?')
          && i + 1 < text.length()
          && Character.isWhitespace(text.charAt(i + 1))) {
        return i + 1;
      }
    }
    return -1;
  }

  /** Returns the offset just after the rightmost whitespace in [from, to). */
  private static int findWhitespaceEnd(String text, int from, int to) {
    for (int i = to - 1; i >= from; i--) {
      if (Character.isWhitespace(text.charAt(i))) {
        return i + 1;
      }
    }
    return -1;
  }
}
