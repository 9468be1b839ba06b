package com.flamingo.ai.docrag.service.rag;

import com.flamingo.ai.docrag.exception.ErrorKind;
import com.flamingo.ai.docrag.service.rag.retrieval.RankedChunk;
import java.util.List;

/** Result of answering a question: an answer, or exactly one failure variant. */
public sealed interface QueryOutcome
    permits QueryOutcome.Answered, QueryOutcome.Failure {

  /**
   * A generated answer.
   *
   * @param chunks retrieved chunks in rank order; similarities are set only when requested
   * @param queryEmbedding the query vector when requested, otherwise {@code null}
   * @param droppedChunkIds chunks left out of the context as duplicates or over budget
   */
  record Answered(
      String fileId,
      String question,
      String answer,
      List<RankedChunk> chunks,
      float[] queryEmbedding,
      List<String> droppedChunkIds,
      int contextChars)
      implements QueryOutcome {}

  /** A failed query, tagged with its error kind. */
  sealed interface Failure extends QueryOutcome
      permits InvalidRequest,
          DocumentNotFound,
          DocumentNotReady,
          ProviderUnavailable,
          IndexUnavailable {

    ErrorKind kind();

    String message();
  }

  record InvalidRequest(String message) implements Failure {
    @Override
    public ErrorKind kind() {
      return ErrorKind.VALIDATION;
    }
  }

  record DocumentNotFound(String fileId, String message) implements Failure {
    @Override
    public ErrorKind kind() {
      return ErrorKind.NOT_FOUND;
    }
  }

  record DocumentNotReady(String fileId, String message) implements Failure {
    @Override
    public ErrorKind kind() {
      return ErrorKind.NOT_READY;
    }
  }

  record ProviderUnavailable(String message, boolean rateLimited) implements Failure {
    @Override
    public ErrorKind kind() {
      return ErrorKind.PROVIDER;
    }
  }

  record IndexUnavailable(String message) implements Failure {
    @Override
    public ErrorKind kind() {
      return ErrorKind.INDEX;
    }
  }
}
