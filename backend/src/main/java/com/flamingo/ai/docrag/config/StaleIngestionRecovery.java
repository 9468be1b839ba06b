package com.flamingo.ai.docrag.config;

import com.flamingo.ai.docrag.domain.entity.Document;
import com.flamingo.ai.docrag.domain.enums.DocumentStatus;
import com.flamingo.ai.docrag.domain.repository.DocumentRepository;
import com.flamingo.ai.docrag.exception.ErrorKind;
import com.flamingo.ai.docrag.index.VectorIndex;
import com.flamingo.ai.docrag.service.rag.ingestion.DocumentStatusUpdater;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Fails documents left in {@code PROCESSING} by a previous run.
 *
 * <p>Ingestion runs in memory, so after a restart nothing will ever finish those documents. Any
 * partial vectors are removed and the document is marked {@code FAILED}; re-uploading is the
 * recovery path.
 */
@Component
@Order(2)
@RequiredArgsConstructor
@Slf4j
public class StaleIngestionRecovery implements CommandLineRunner {

  static final String INTERRUPTED_MESSAGE = "Ingestion interrupted by application restart";

  private final DocumentRepository documentRepository;
  private final DocumentStatusUpdater statusUpdater;
  private final VectorIndex vectorIndex;

  @Override
  public void run(String... args) {
    try {
      List<Document> stale = documentRepository.findByStatus(DocumentStatus.PROCESSING);
      if (stale.isEmpty()) {
        log.debug("No interrupted ingestions found");
        return;
      }

      log.warn("Found {} documents interrupted during ingestion", stale.size());
      int recovered = 0;
      for (Document document : stale) {
        String fileId = document.getFileId();
        try {
          vectorIndex.deleteByDocument(fileId);
        } catch (RuntimeException e) {
          log.warn("Could not remove partial vectors of {}: {}", fileId, e.getMessage());
        }
        try {
          statusUpdater.markFailed(fileId, ErrorKind.INTERNAL, INTERRUPTED_MESSAGE);
          recovered++;
        } catch (RuntimeException e) {
          log.warn("Failed to mark interrupted document {} failed: {}", fileId, e.getMessage());
        }
      }

      log.info("Interrupted ingestion recovery complete: {}/{} documents", recovered, stale.size());

    } catch (RuntimeException e) {
      log.error("Interrupted ingestion recovery failed: {}", e.getMessage(), e);
    }
  }
}
