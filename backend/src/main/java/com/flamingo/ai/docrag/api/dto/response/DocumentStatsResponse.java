package com.flamingo.ai.docrag.api.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.ai.docrag.service.document.DocumentStatistics;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DTO for totals across all documents. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DocumentStatsResponse {
  private long totalFiles;
  private long totalChunks;
  private long totalVectors;
  private long totalSizeBytes;
  private double totalSizeMb;

  public static DocumentStatsResponse from(DocumentStatistics stats) {
    return DocumentStatsResponse.builder()
        .totalFiles(stats.totalFiles())
        .totalChunks(stats.totalChunks())
        .totalVectors(stats.totalVectors())
        .totalSizeBytes(stats.totalSizeBytes())
        .totalSizeMb(stats.totalSizeMb())
        .build();
  }
}
