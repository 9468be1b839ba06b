package com.flamingo.ai.docrag.service.document;

import com.flamingo.ai.docrag.domain.entity.Document;
import java.util.List;
import org.springframework.web.multipart.MultipartFile;

/** Service interface for document management. */
public interface DocumentService {

  /**
   * Validates a file, extracts its text and registers it for ingestion.
   *
   * @param file the uploaded file
   * @return the registered document, in {@code PROCESSING} state
   * @throws com.flamingo.ai.docrag.exception.ValidationException if the file is empty, too large
   *     or of an unsupported type
   * @throws com.flamingo.ai.docrag.exception.EmptyDocumentException if no text was extracted
   */
  Document uploadDocument(MultipartFile file);

  /**
   * Gets a document by its file id.
   *
   * @param fileId the file id
   * @return the document
   * @throws com.flamingo.ai.docrag.exception.DocumentNotFoundException if not found
   */
  Document getDocument(String fileId);

  /**
   * Lists documents, newest first.
   *
   * @param limit maximum number of documents
   * @return list of documents
   */
  List<Document> listDocuments(int limit);

  /**
   * Deletes a document and its indexed vectors.
   *
   * @param fileId the file id
   */
  void deleteDocument(String fileId);

  /**
   * Aggregates counts and sizes across all documents.
   *
   * @return the statistics
   */
  DocumentStatistics getStatistics();
}
