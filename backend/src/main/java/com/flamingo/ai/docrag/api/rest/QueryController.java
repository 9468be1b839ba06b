package com.flamingo.ai.docrag.api.rest;

import com.flamingo.ai.docrag.api.dto.request.QueryRequest;
import com.flamingo.ai.docrag.api.dto.response.QueryResponse;
import com.flamingo.ai.docrag.exception.ApiError;
import com.flamingo.ai.docrag.exception.ErrorKind;
import com.flamingo.ai.docrag.service.rag.AnswerOrchestrator;
import com.flamingo.ai.docrag.service.rag.QueryCommand;
import com.flamingo.ai.docrag.service.rag.QueryOutcome;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for question answering over one document. */
@RestController
@RequestMapping("/api/query")
@RequiredArgsConstructor
public class QueryController {

  private final AnswerOrchestrator answerOrchestrator;

  /**
   * Answers a question from the chunks of one document.
   *
   * <p>Failures are mapped to the status and error code of their kind.
   */
  @PostMapping
  public ResponseEntity<?> query(
      @Valid @RequestBody QueryRequest request,
      @RequestParam(name = "show_similarity", defaultValue = "false") boolean showSimilarity,
      @RequestParam(name = "show_embedding", defaultValue = "false") boolean showEmbedding,
      HttpServletRequest httpRequest) {
    QueryOutcome outcome =
        answerOrchestrator.answer(
            new QueryCommand(
                request.getFileId(),
                request.getQuery(),
                request.getTopK(),
                showSimilarity,
                showEmbedding));

    if (outcome instanceof QueryOutcome.Answered answered) {
      return ResponseEntity.ok(QueryResponse.from(answered, showSimilarity, showEmbedding));
    }
    QueryOutcome.Failure failure = (QueryOutcome.Failure) outcome;
    ErrorKind kind = failure.kind();
    return ResponseEntity.status(kind.getHttpStatus())
        .body(
            ApiError.builder()
                .errorId(UUID.randomUUID().toString().substring(0, 8))
                .code(errorCode(failure))
                .message(failure.message())
                .path(httpRequest.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private static String errorCode(QueryOutcome.Failure failure) {
    if (failure instanceof QueryOutcome.ProviderUnavailable provider && provider.rateLimited()) {
      return ApiError.PROVIDER_RATE_LIMITED;
    }
    return failure.kind().getCode();
  }
}
