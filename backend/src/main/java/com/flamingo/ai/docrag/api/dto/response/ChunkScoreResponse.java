package com.flamingo.ai.docrag.api.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.ai.docrag.service.rag.retrieval.RankedChunk;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Similarity details of one retrieved chunk. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ChunkScoreResponse {

  private String chunkId;
  private int sequenceIndex;
  private int rank;
  private String chunkText;
  private double l2Distance;
  private double cosineSimilarity;
  private double similarityPercentage;
  private boolean degenerateVector;

  public static ChunkScoreResponse from(RankedChunk chunk) {
    double cosine = chunk.similarity() == null ? 0.0 : chunk.similarity();
    return ChunkScoreResponse.builder()
        .chunkId(chunk.chunkId())
        .sequenceIndex(chunk.sequenceIndex())
        .rank(chunk.rank())
        .chunkText(chunk.text())
        .l2Distance(chunk.distance())
        .cosineSimilarity(cosine)
        .similarityPercentage(Math.round(cosine * 10000.0) / 100.0)
        .degenerateVector(chunk.degenerateVector())
        .build();
  }
}
