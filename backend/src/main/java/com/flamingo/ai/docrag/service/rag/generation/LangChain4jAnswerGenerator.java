package com.flamingo.ai.docrag.service.rag.generation;

import com.flamingo.ai.docrag.agent.AnswerAgent;
import com.flamingo.ai.docrag.exception.ProviderException;
import com.flamingo.ai.docrag.exception.ProviderFailureReason;
import com.flamingo.ai.docrag.service.rag.retry.ProviderRetryPolicy;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.TimeoutException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** {@link AnswerGenerator} backed by the LangChain4j {@link AnswerAgent}. */
@Component
@RequiredArgsConstructor
@Slf4j
public class LangChain4jAnswerGenerator implements AnswerGenerator {

  private final AnswerAgent answerAgent;
  private final ProviderRetryPolicy providerRetryPolicy;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "generation.answer", description = "Time to generate an answer")
  public String generate(String context, String question) {
    try {
      String answer = providerRetryPolicy.execute(() -> callAgent(context, question));
      meterRegistry.counter("generation.requests.success").increment();
      return answer;
    } catch (ProviderException e) {
      meterRegistry
          .counter("generation.requests.failure", "reason", e.getReason().name())
          .increment();
      log.error("Answer generation failed: {}", e.getMessage());
      throw e;
    }
  }

  private String callAgent(String context, String question) {
    try {
      String answer = answerAgent.answer(context, question);
      if (answer == null) {
        throw new ProviderException(
            ProviderFailureReason.FAILURE, "Generation provider returned no answer");
      }
      return answer.strip();
    } catch (ProviderException e) {
      throw e;
    } catch (RateLimitException e) {
      throw new ProviderException(
          ProviderFailureReason.RATE_LIMITED, "Generation provider rate limited", e);
    } catch (TimeoutException e) {
      throw new ProviderException(
          ProviderFailureReason.TIMEOUT, "Generation provider timed out", e);
    } catch (RuntimeException e) {
      throw new ProviderException(
          ProviderFailureReason.FAILURE, "Generation provider failed: " + e.getMessage(), e);
    }
  }
}
