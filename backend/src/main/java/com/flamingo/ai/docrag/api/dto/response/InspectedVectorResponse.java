package com.flamingo.ai.docrag.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.ai.docrag.index.StoredChunk;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One stored chunk as returned by vector inspection. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InspectedVectorResponse {

  static final int PREVIEW_LENGTH = 100;

  private String id;
  private String fileId;
  private int sequenceIndex;
  private int vectorDim;
  private int chunkLength;
  private String preview;
  private String fullContent;
  private List<Float> embedding;
  private Integer vectorValuesCount;

  public static InspectedVectorResponse from(
      StoredChunk chunk, boolean fullContent, boolean showVectors) {
    InspectedVectorResponseBuilder builder =
        InspectedVectorResponse.builder()
            .id(chunk.chunkId())
            .fileId(chunk.documentId())
            .sequenceIndex(chunk.sequenceIndex())
            .vectorDim(chunk.vectorDimensions())
            .chunkLength(chunk.text().length())
            .preview(preview(chunk.text()));
    if (fullContent) {
      builder.fullContent(chunk.text());
    }
    if (showVectors && chunk.vector() != null) {
      builder
          .embedding(QueryResponse.toList(chunk.vector()))
          .vectorValuesCount(chunk.vector().length);
    }
    return builder.build();
  }

  static String preview(String text) {
    return text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) + "..." : text;
  }
}
