package com.flamingo.ai.docrag.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.ai.docrag.service.rag.QueryOutcome;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an answered query. Similarity and embedding fields are opt-in. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryResponse {

  private String answer;
  private String fileId;
  private String query;
  private int chunksUsed;
  private int contextChars;
  private List<String> droppedChunkIds;
  private List<ChunkScoreResponse> similarityScores;
  private SimilarityExplanation similarityExplanation;
  private List<Float> queryEmbedding;

  /** Creates a QueryResponse, including scores and the query vector only when asked for. */
  public static QueryResponse from(
      QueryOutcome.Answered answered, boolean showSimilarity, boolean showEmbedding) {
    QueryResponseBuilder builder =
        QueryResponse.builder()
            .answer(answered.answer())
            .fileId(answered.fileId())
            .query(answered.question())
            .chunksUsed(answered.chunks().size())
            .contextChars(answered.contextChars())
            .droppedChunkIds(answered.droppedChunkIds());

    if (showSimilarity) {
      builder
          .similarityScores(answered.chunks().stream().map(ChunkScoreResponse::from).toList())
          .similarityExplanation(SimilarityExplanation.COSINE);
    }
    if (showEmbedding && answered.queryEmbedding() != null) {
      builder.queryEmbedding(toList(answered.queryEmbedding()));
    }
    return builder.build();
  }

  static List<Float> toList(float[] vector) {
    List<Float> values = new ArrayList<>(vector.length);
    for (float v : vector) {
      values.add(v);
    }
    return values;
  }
}
