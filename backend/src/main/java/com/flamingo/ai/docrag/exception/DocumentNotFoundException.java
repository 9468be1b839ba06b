package com.flamingo.ai.docrag.exception;

/** Exception thrown when a document is not found. */
public class DocumentNotFoundException extends DocRagException {

  private final String fileId;

  public DocumentNotFoundException(String fileId) {
    super(ErrorKind.NOT_FOUND, "Document not found: " + fileId, "Document not found");
    this.fileId = fileId;
  }

  public String getFileId() {
    return fileId;
  }
}
