package com.flamingo.ai.docrag.exception;

import com.flamingo.ai.docrag.domain.enums.DocumentStatus;

/** Exception thrown when a query targets a document that has not finished ingestion. */
public class DocumentNotReadyException extends DocRagException {

  private final String fileId;
  private final DocumentStatus status;

  public DocumentNotReadyException(String fileId, DocumentStatus status) {
    super(
        ErrorKind.NOT_READY,
        "Document " + fileId + " is not ready for queries (status=" + status + ")",
        status == DocumentStatus.FAILED
            ? "Document processing failed. Please upload it again."
            : "Document is still being processed. Please try again shortly.");
    this.fileId = fileId;
    this.status = status;
  }

  public String getFileId() {
    return fileId;
  }

  public DocumentStatus getStatus() {
    return status;
  }
}
