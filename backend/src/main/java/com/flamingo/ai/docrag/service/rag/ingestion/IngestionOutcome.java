package com.flamingo.ai.docrag.service.rag.ingestion;

import com.flamingo.ai.docrag.exception.ErrorKind;

/** Result of ingesting one document. */
public sealed interface IngestionOutcome
    permits IngestionOutcome.Indexed, IngestionOutcome.Failed {

  String fileId();

  /** Every chunk was embedded and indexed; the document is READY. */
  record Indexed(String fileId, int chunksCount, int vectorsCount) implements IngestionOutcome {}

  /** Ingestion stopped; the document is FAILED and none of its vectors remain indexed. */
  record Failed(String fileId, ErrorKind kind, String message) implements IngestionOutcome {}
}
