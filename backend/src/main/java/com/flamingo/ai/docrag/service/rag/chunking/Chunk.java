package com.flamingo.ai.docrag.service.rag.chunking;

/**
 * A contiguous span of a document's normalized text.
 *
 * @param chunkId stable id, {@code <documentId>_<sequenceIndex>}
 * @param documentId the owning document
 * @param sequenceIndex 0-based position within the document, strictly increasing
 * @param text exactly {@code source.substring(charStart, charEnd)}
 * @param charStart inclusive start offset in the source text
 * @param charEnd exclusive end offset in the source text
 */
public record Chunk(
    String chunkId,
    String documentId,
    int sequenceIndex,
    String text,
    int charStart,
    int charEnd) {

  public Chunk {
    if (charStart < 0 || charStart >= charEnd) {
      throw new IllegalArgumentException(
          "Chunk span must be non-empty: [" + charStart + ", " + charEnd + ")");
    }
    if (text.length() != charEnd - charStart) {
      throw new IllegalArgumentException("Chunk text length does not match its span");
    }
  }

  public static String idFor(String documentId, int sequenceIndex) {
    return documentId + "_" + sequenceIndex;
  }

  public int length() {
    return charEnd - charStart;
  }
}
