package com.flamingo.ai.docrag.service.rag;

import com.flamingo.ai.docrag.config.RagConfig;
import com.flamingo.ai.docrag.exception.DocRagException;
import com.flamingo.ai.docrag.exception.ProviderException;
import com.flamingo.ai.docrag.service.rag.context.AssembledContext;
import com.flamingo.ai.docrag.service.rag.context.ContextAssembler;
import com.flamingo.ai.docrag.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.docrag.service.rag.generation.AnswerGenerator;
import com.flamingo.ai.docrag.service.rag.retrieval.RankedChunk;
import com.flamingo.ai.docrag.service.rag.retrieval.RetrievalEngine;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Answers a question about one document: embed the question, retrieve the nearest chunks,
 * assemble context and generate.
 *
 * <p>Never throws for expected failures; each is returned as a {@link QueryOutcome.Failure}
 * variant.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnswerOrchestrator {

  private final EmbeddingService embeddingService;
  private final RetrievalEngine retrievalEngine;
  private final ContextAssembler contextAssembler;
  private final AnswerGenerator answerGenerator;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Timed(value = "query.answer", description = "Time to answer a question")
  public QueryOutcome answer(QueryCommand command) {
    QueryOutcome.InvalidRequest invalid = validate(command);
    if (invalid != null) {
      return record(invalid);
    }
    String fileId = command.fileId();
    int topK = command.topK() != null ? command.topK() : ragConfig.getRetrieval().getTopK();

    try {
      // Fail before paying for an embedding call
      retrievalEngine.requireReady(fileId);

      float[] queryVector = embeddingService.embedQuery(command.question());
      List<RankedChunk> chunks =
          retrievalEngine.retrieve(fileId, queryVector, topK, command.showSimilarity());
      if (chunks.isEmpty()) {
        // READY in the metadata store but nothing in the index, e.g. after the index was rebuilt
        return record(
            new QueryOutcome.DocumentNotFound(fileId, "No chunks found for file_id " + fileId));
      }
      AssembledContext context = contextAssembler.assemble(chunks);
      String answer = answerGenerator.generate(context.text(), command.question());

      log.info(
          "Answered query on {}: {} chunks retrieved, {} dropped, {} context chars",
          fileId,
          chunks.size(),
          context.dropped().size(),
          context.totalChars());
      return record(
          new QueryOutcome.Answered(
              fileId,
              command.question(),
              answer,
              chunks,
              command.showEmbedding() ? queryVector : null,
              context.droppedChunkIds(),
              context.totalChars()));
    } catch (DocRagException e) {
      return record(toFailure(fileId, e));
    }
  }

  private QueryOutcome.InvalidRequest validate(QueryCommand command) {
    if (command.fileId() == null || command.fileId().isBlank()) {
      return new QueryOutcome.InvalidRequest("file_id is required");
    }
    if (command.question() == null || command.question().isBlank()) {
      return new QueryOutcome.InvalidRequest("query is required");
    }
    int maxTopK = ragConfig.getRetrieval().getMaxTopK();
    if (command.topK() != null && (command.topK() <= 0 || command.topK() > maxTopK)) {
      return new QueryOutcome.InvalidRequest("top_k must be between 1 and " + maxTopK);
    }
    return null;
  }

  private QueryOutcome.Failure toFailure(String fileId, DocRagException e) {
    return switch (e.getKind()) {
      case VALIDATION -> new QueryOutcome.InvalidRequest(e.getMessage());
      case NOT_FOUND -> new QueryOutcome.DocumentNotFound(fileId, e.getUserMessage());
      case NOT_READY -> new QueryOutcome.DocumentNotReady(fileId, e.getUserMessage());
      case PROVIDER ->
          new QueryOutcome.ProviderUnavailable(
              e.getUserMessage(), e instanceof ProviderException pe && pe.isRateLimited());
      case INDEX -> new QueryOutcome.IndexUnavailable(e.getUserMessage());
      default -> throw e;
    };
  }

  private QueryOutcome record(QueryOutcome outcome) {
    String result =
        outcome instanceof QueryOutcome.Failure failure
            ? failure.kind().name().toLowerCase(Locale.ROOT)
            : "answered";
    meterRegistry.counter("query.outcome", "result", result).increment();
    if (outcome instanceof QueryOutcome.Failure failure) {
      log.warn("Query failed ({}): {}", failure.kind(), failure.message());
    }
    return outcome;
  }
}
