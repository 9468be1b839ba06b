package com.flamingo.ai.docrag.service.inspection;

import com.flamingo.ai.docrag.exception.DocRagException;
import com.flamingo.ai.docrag.exception.ValidationException;
import com.flamingo.ai.docrag.exception.VectorIndexException;
import com.flamingo.ai.docrag.index.StoredChunk;
import com.flamingo.ai.docrag.index.VectorIndex;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Read-only view of what the vector index stores, for debugging retrieval. */
@Service
@RequiredArgsConstructor
@Slf4j
public class VectorInspectionService {

  static final int MAX_LIMIT = 1000;

  private final VectorIndex vectorIndex;

  /**
   * Lists stored chunks ordered by document and sequence index.
   *
   * @param fileId document to restrict to; null or blank lists all documents
   * @param limit maximum number of chunks, 1 to 1000
   * @param includeVectors whether to load the stored vectors
   * @return the stored chunks
   */
  @Timed(value = "vector.inspect", description = "Time to inspect stored vectors")
  public List<StoredChunk> inspect(String fileId, int limit, boolean includeVectors) {
    if (limit <= 0 || limit > MAX_LIMIT) {
      throw new ValidationException("limit must be between 1 and " + MAX_LIMIT);
    }
    String filter = fileId == null || fileId.isBlank() ? null : fileId.strip();

    try {
      List<StoredChunk> chunks = vectorIndex.inspect(filter, limit, includeVectors);
      log.debug("Inspected {} stored chunks (file_id={})", chunks.size(), filter);
      return chunks;
    } catch (DocRagException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new VectorIndexException("Vector index unavailable: " + e.getMessage(), e);
    }
  }
}
