package com.flamingo.ai.docrag.domain.repository;

import com.flamingo.ai.docrag.domain.entity.Document;
import com.flamingo.ai.docrag.domain.enums.DocumentStatus;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

/** Repository for Document entities. */
@Repository
public interface DocumentRepository extends JpaRepository<Document, String> {

  /** Finds documents, newest first. */
  List<Document> findAllByOrderByUploadedAtDesc(Pageable pageable);

  /** Finds documents by status. */
  List<Document> findByStatus(DocumentStatus status);

  /** Sums chunk counts across all documents. */
  @Query("SELECT COALESCE(SUM(d.chunksCount), 0) FROM Document d")
  long sumChunksCount();

  /** Sums indexed vector counts across all documents. */
  @Query("SELECT COALESCE(SUM(d.vectorsCount), 0) FROM Document d")
  long sumVectorsCount();

  /** Sums original file sizes in bytes. */
  @Query("SELECT COALESCE(SUM(d.fileSize), 0) FROM Document d")
  long sumFileSize();
}
