package com.flamingo.ai.docrag.config;

import com.flamingo.ai.docrag.exception.ProviderFailureReason;
import java.util.EnumSet;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the RAG pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Chunking chunking = new Chunking();
  private Retrieval retrieval = new Retrieval();
  private Context context = new Context();
  private Embedding embedding = new Embedding();
  private Retry retry = new Retry();
  private Index index = new Index();

  @Getter
  @Setter
  public static class Chunking {
    private int size = 1000;
    private int overlap = 200;

    /** How far back from a proposed chunk end to look for a sentence or word boundary. */
    private int boundaryLookback = 100;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int topK = 5;
    private int maxTopK = 50;
  }

  @Getter
  @Setter
  public static class Context {
    private int maxChars = 8000;

    /** Truncated fragments at or below this length are dropped instead of included. */
    private int minFragmentChars = 50;
  }

  @Getter
  @Setter
  public static class Embedding {
    private int dimensions = 1536;
  }

  /** Retry policy applied to embedding and generation provider calls. */
  @Getter
  @Setter
  public static class Retry {
    private int maxAttempts = 3;
    private long initialBackoffMs = 500;
    private double backoffMultiplier = 2.0;
    private Set<ProviderFailureReason> retryableReasons =
        EnumSet.of(ProviderFailureReason.RATE_LIMITED, ProviderFailureReason.TIMEOUT);
  }

  @Getter
  @Setter
  public static class Index {
    /** Vector index implementation: "elasticsearch" (default) or "in-memory". */
    private String type = "elasticsearch";

    private String name = "docrag-chunks";

    /** HNSW graph degree. */
    private int hnswM = 16;

    private int hnswEfConstruction = 200;

    /** Lower bound on kNN candidates examined per search. */
    private int numCandidates = 100;

    private int maxChunkTextLength = 10000;
  }
}
