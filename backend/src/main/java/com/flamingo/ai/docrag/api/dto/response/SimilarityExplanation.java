package com.flamingo.ai.docrag.api.dto.response;

/** Static description of the similarity scores returned with a query. */
public record SimilarityExplanation(
    String description, String formula, String range, String interpretation) {

  public static final SimilarityExplanation COSINE =
      new SimilarityExplanation(
          "Cosine similarity measures how similar the query embedding is to each chunk embedding."
              + " Ranking uses the squared Euclidean distance reported as l2_distance.",
          "cosine_similarity = (A · B) / (||A|| × ||B||)",
          "Values range from -1 (opposite) to 1 (identical), with 0 meaning orthogonal",
          "Higher values (closer to 1) indicate more similar content");
}
