package com.flamingo.ai.docrag.domain.enums;

/** Defines the ingestion status of an uploaded document. */
public enum DocumentStatus {
  /** Document is registered and its chunks are being embedded and indexed. */
  PROCESSING,

  /** All chunks are embedded and indexed; the document can be queried. */
  READY,

  /** Ingestion failed; no chunks of the document are in the index. */
  FAILED
}
