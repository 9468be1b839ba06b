package com.flamingo.ai.docrag.api.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.ai.docrag.domain.entity.Document;
import com.flamingo.ai.docrag.domain.enums.DocumentStatus;
import com.flamingo.ai.docrag.exception.ErrorKind;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for document data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DocumentResponse {

  private String fileId;
  private String fileName;
  private String fileType;
  private Long fileSize;
  private Integer charLength;
  private DocumentStatus status;
  private int chunksCount;
  private int vectorsCount;
  private String errorCode;
  private String processingError;
  private LocalDateTime uploadedAt;
  private LocalDateTime processedAt;

  /** Creates a DocumentResponse from a Document entity. */
  public static DocumentResponse fromEntity(Document document) {
    ErrorKind errorKind = document.getErrorKind();
    return DocumentResponse.builder()
        .fileId(document.getFileId())
        .fileName(document.getFileName())
        .fileType(document.getFileType())
        .fileSize(document.getFileSize())
        .charLength(document.getCharLength())
        .status(document.getStatus())
        .chunksCount(document.getChunksCount())
        .vectorsCount(document.getVectorsCount())
        .errorCode(errorKind == null ? null : errorKind.getCode())
        .processingError(document.getProcessingError())
        .uploadedAt(document.getUploadedAt())
        .processedAt(document.getProcessedAt())
        .build();
  }
}
