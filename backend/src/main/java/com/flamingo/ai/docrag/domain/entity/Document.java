package com.flamingo.ai.docrag.domain.entity;

import com.flamingo.ai.docrag.domain.enums.DocumentStatus;
import com.flamingo.ai.docrag.exception.ErrorKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * An uploaded document and its ingestion state.
 *
 * <p>A document starts in {@link DocumentStatus#PROCESSING} and transitions exactly once, to
 * {@link DocumentStatus#READY} or {@link DocumentStatus#FAILED}.
 */
@Entity
@Table(name = "documents")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Document {

  /** Public identifier, formatted {@code file_<yyyyMMdd_HHmmss>_<8 hex>}. */
  @Id
  @Column(length = 255)
  private String fileId;

  @Column(nullable = false)
  private String fileName;

  /** Human-readable type label, e.g. "PDF" or "Word Document". */
  @Column(nullable = false)
  private String fileType;

  private Long fileSize;

  /** Length of the extracted text in characters. */
  private Integer charLength;

  @Builder.Default private Integer chunksCount = 0;

  @Builder.Default private Integer vectorsCount = 0;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private DocumentStatus status = DocumentStatus.PROCESSING;

  @Enumerated(EnumType.STRING)
  private ErrorKind errorKind;

  /** Error message if ingestion failed. */
  @Column(columnDefinition = "TEXT")
  private String processingError;

  @Column(nullable = false, updatable = false)
  private LocalDateTime uploadedAt;

  private LocalDateTime processedAt;

  @PrePersist
  protected void onCreate() {
    if (uploadedAt == null) {
      uploadedAt = LocalDateTime.now();
    }
  }

  public boolean isReady() {
    return status == DocumentStatus.READY;
  }

  /** Marks the document as queryable once all of its vectors are indexed. */
  public void markReady(int chunksCount, int vectorsCount) {
    requireProcessing(DocumentStatus.READY);
    this.status = DocumentStatus.READY;
    this.chunksCount = chunksCount;
    this.vectorsCount = vectorsCount;
    this.processedAt = LocalDateTime.now();
  }

  /** Marks the document as failed; it keeps no chunks or vectors. */
  public void markFailed(ErrorKind errorKind, String errorMessage) {
    requireProcessing(DocumentStatus.FAILED);
    this.status = DocumentStatus.FAILED;
    this.errorKind = errorKind;
    this.processingError = errorMessage;
    this.chunksCount = 0;
    this.vectorsCount = 0;
    this.processedAt = LocalDateTime.now();
  }

  private void requireProcessing(DocumentStatus target) {
    if (status != DocumentStatus.PROCESSING) {
      throw new IllegalStateException(
          "Document " + fileId + " cannot move from " + status + " to " + target);
    }
  }
}
