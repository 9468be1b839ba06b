package com.flamingo.ai.docrag.service.document;

import com.flamingo.ai.docrag.domain.entity.Document;
import com.flamingo.ai.docrag.domain.enums.DocumentStatus;
import com.flamingo.ai.docrag.domain.repository.DocumentRepository;
import com.flamingo.ai.docrag.exception.DocumentNotFoundException;
import com.flamingo.ai.docrag.exception.DocumentNotReadyException;
import com.flamingo.ai.docrag.exception.EmptyDocumentException;
import com.flamingo.ai.docrag.exception.ErrorKind;
import com.flamingo.ai.docrag.exception.ValidationException;
import com.flamingo.ai.docrag.index.VectorIndex;
import com.flamingo.ai.docrag.service.rag.ingestion.DocumentIngestionService;
import com.flamingo.ai.docrag.service.rag.ingestion.DocumentStatusUpdater;
import com.flamingo.ai.docrag.service.rag.parsing.DocumentTextExtractor;
import com.flamingo.ai.docrag.service.rag.parsing.SupportedFileType;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.web.multipart.MultipartFile;

/** Implementation of the DocumentService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentServiceImpl implements DocumentService {

  static final long MAX_FILE_SIZE_BYTES = 50L * 1024 * 1024;
  static final int MAX_LIST_LIMIT = 1000;
  static final String INGESTION_REJECTED_MESSAGE =
      "Ingestion queue is full; upload the document again later";

  private static final DateTimeFormatter FILE_ID_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  private final DocumentRepository documentRepository;
  private final DocumentTextExtractor textExtractor;
  private final VectorIndex vectorIndex;
  private final MeterRegistry meterRegistry;
  private final DocumentIngestionService ingestionService;
  private final DocumentStatusUpdater statusUpdater;

  @Override
  @Transactional
  @Timed(value = "document.upload", description = "Time to upload a document")
  public Document uploadDocument(MultipartFile file) {
    log.info("Uploading document {}", file.getOriginalFilename());

    SupportedFileType fileType = validateFile(file);
    String fileId = generateFileId();

    final String text;
    try (InputStream in = file.getInputStream()) {
      text = textExtractor.extract(in, file.getOriginalFilename());
    } catch (IOException e) {
      log.error("Failed to read upload {}: {}", file.getOriginalFilename(), e.getMessage());
      throw new ValidationException("Failed to read file content");
    }
    if (text.isBlank()) {
      meterRegistry.counter("document.rejected", "reason", "empty").increment();
      throw new EmptyDocumentException(fileId);
    }

    Document document =
        Document.builder()
            .fileId(fileId)
            .fileName(file.getOriginalFilename())
            .fileType(fileType.getLabel())
            .fileSize(file.getSize())
            .charLength(text.length())
            .build();
    Document saved = documentRepository.save(document);
    meterRegistry.counter("document.uploaded", "type", fileType.name().toLowerCase()).increment();

    // Start ingestion only once the PROCESSING row is committed and visible to the worker
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCommit() {
              log.debug("Transaction committed, starting ingestion for document: {}", fileId);
              startIngestion(fileId, text);
            }
          });
    } else {
      log.debug("No active transaction, starting ingestion directly: {}", fileId);
      startIngestion(fileId, text);
    }

    log.info(
        "Document {} registered as {} ({} chars)",
        file.getOriginalFilename(),
        fileId,
        text.length());
    return saved;
  }

  /**
   * Hands the document to the ingestion executor. A rejected task fails the document right away,
   * since nothing else would ever move it out of {@code PROCESSING}.
   */
  private void startIngestion(String fileId, String text) {
    try {
      ingestionService.ingestAsync(fileId, text);
    } catch (TaskRejectedException e) {
      log.warn("Ingestion queue full, failing document {}: {}", fileId, e.getMessage());
      meterRegistry.counter("document.rejected", "reason", "queue_full").increment();
      try {
        statusUpdater.markFailed(fileId, ErrorKind.INTERNAL, INGESTION_REJECTED_MESSAGE);
      } catch (RuntimeException statusEx) {
        log.error("Failed to mark document {} as failed: {}", fileId, statusEx.getMessage());
      }
    }
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "document.get", description = "Time to get a document")
  public Document getDocument(String fileId) {
    return documentRepository
        .findById(fileId)
        .orElseThrow(() -> new DocumentNotFoundException(fileId));
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "document.list", description = "Time to list documents")
  public List<Document> listDocuments(int limit) {
    if (limit <= 0 || limit > MAX_LIST_LIMIT) {
      throw new ValidationException("limit must be between 1 and " + MAX_LIST_LIMIT);
    }
    return documentRepository.findAllByOrderByUploadedAtDesc(PageRequest.of(0, limit));
  }

  @Override
  @Transactional
  @Timed(value = "document.delete", description = "Time to delete a document")
  public void deleteDocument(String fileId) {
    Document document = getDocument(fileId);
    if (document.getStatus() == DocumentStatus.PROCESSING) {
      throw new DocumentNotReadyException(fileId, document.getStatus());
    }

    long removed = vectorIndex.deleteByDocument(fileId);
    documentRepository.delete(document);
    meterRegistry.counter("document.deleted").increment();

    log.info("Deleted document {} and {} vectors", fileId, removed);
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "document.stats", description = "Time to compute document statistics")
  public DocumentStatistics getStatistics() {
    return DocumentStatistics.of(
        documentRepository.count(),
        documentRepository.sumChunksCount(),
        documentRepository.sumVectorsCount(),
        documentRepository.sumFileSize());
  }

  private SupportedFileType validateFile(MultipartFile file) {
    if (file.isEmpty()) {
      throw new ValidationException("File is empty. Please upload a valid file");
    }

    SupportedFileType fileType =
        SupportedFileType.fromFileName(file.getOriginalFilename())
            .orElseThrow(
                () ->
                    new ValidationException(
                        "Unsupported file type: "
                            + file.getOriginalFilename()
                            + ". Supported formats: "
                            + SupportedFileType.describeSupported()));

    if (file.getSize() > MAX_FILE_SIZE_BYTES) {
      throw new ValidationException("File too large. Maximum file size is 50MB");
    }
    return fileType;
  }

  static String generateFileId() {
    String hex = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    return "file_" + LocalDateTime.now().format(FILE_ID_TIMESTAMP) + "_" + hex;
  }
}
