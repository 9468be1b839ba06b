package com.flamingo.ai.docrag.exception;

/** Exception thrown when a document yields no usable text. */
public class EmptyDocumentException extends DocRagException {

  public EmptyDocumentException(String fileId) {
    super(
        ErrorKind.DEGENERATE_INPUT,
        "No text content extracted from document " + fileId,
        "No text content could be extracted from the file");
  }
}
