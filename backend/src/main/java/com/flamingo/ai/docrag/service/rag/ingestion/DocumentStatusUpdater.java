package com.flamingo.ai.docrag.service.rag.ingestion;

import com.flamingo.ai.docrag.domain.entity.Document;
import com.flamingo.ai.docrag.domain.repository.DocumentRepository;
import com.flamingo.ai.docrag.exception.DocumentNotFoundException;
import com.flamingo.ai.docrag.exception.ErrorKind;
import java.util.function.Consumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/** Applies the terminal status transition of a document, retrying on SQLite lock contention. */
@Component
@RequiredArgsConstructor
@Slf4j
public class DocumentStatusUpdater {

  private static final int MAX_RETRIES = 3;
  private static final long RETRY_DELAY_MS = 100;

  private final DocumentRepository documentRepository;

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public Document markReady(String fileId, int chunksCount, int vectorsCount) {
    return updateWithRetry(fileId, document -> document.markReady(chunksCount, vectorsCount));
  }

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public Document markFailed(String fileId, ErrorKind kind, String message) {
    return updateWithRetry(fileId, document -> document.markFailed(kind, message));
  }

  private Document updateWithRetry(String fileId, Consumer<Document> transition) {
    for (int attempt = 1; ; attempt++) {
      try {
        Document document =
            documentRepository
                .findById(fileId)
                .orElseThrow(() -> new DocumentNotFoundException(fileId));
        transition.accept(document);
        return documentRepository.saveAndFlush(document);
      } catch (CannotAcquireLockException e) {
        if (attempt == MAX_RETRIES) {
          log.error("Failed to update document {} after {} retries", fileId, MAX_RETRIES);
          throw e;
        }
        log.warn(
            "SQLite lock contention on document {}, retry {}/{}", fileId, attempt, MAX_RETRIES);
        try {
          Thread.sleep(RETRY_DELAY_MS * attempt);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException("Interrupted during retry", ie);
        }
      }
    }
  }
}
