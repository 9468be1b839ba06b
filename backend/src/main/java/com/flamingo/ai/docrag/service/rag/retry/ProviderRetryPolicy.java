package com.flamingo.ai.docrag.service.rag.retry;

import com.flamingo.ai.docrag.config.RagConfig;
import com.flamingo.ai.docrag.exception.ProviderException;
import com.flamingo.ai.docrag.exception.ProviderFailureReason;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded retry with exponential backoff for embedding and generation provider calls.
 *
 * <p>Only {@link ProviderException}s whose reason is in the retryable set are retried. Any other
 * exception, and the last provider failure once attempts are exhausted, propagates unchanged.
 */
@Slf4j
public class ProviderRetryPolicy {

  private final int maxAttempts;
  private final Set<ProviderFailureReason> retryableReasons;
  private final Retry retry;

  public ProviderRetryPolicy(
      String name,
      int maxAttempts,
      long initialBackoffMs,
      double backoffMultiplier,
      Set<ProviderFailureReason> retryableReasons,
      MeterRegistry meterRegistry) {
    this.maxAttempts = maxAttempts;
    this.retryableReasons =
        retryableReasons.isEmpty()
            ? EnumSet.noneOf(ProviderFailureReason.class)
            : EnumSet.copyOf(retryableReasons);

    RetryConfig config =
        RetryConfig.custom()
            .maxAttempts(maxAttempts)
            .intervalFunction(
                IntervalFunction.ofExponentialBackoff(initialBackoffMs, backoffMultiplier))
            .retryOnException(this::isRetryable)
            .build();
    this.retry = Retry.of(name, config);
    this.retry
        .getEventPublisher()
        .onRetry(
            event -> {
              Throwable cause = event.getLastThrowable();
              String reason =
                  cause instanceof ProviderException pe ? pe.getReason().name() : "UNKNOWN";
              log.warn(
                  "{} call failed ({}), retry {}/{} in {} ms",
                  name,
                  reason,
                  event.getNumberOfRetryAttempts(),
                  maxAttempts - 1,
                  event.getWaitInterval().toMillis());
              meterRegistry
                  .counter("provider.retries", "policy", name, "reason", reason)
                  .increment();
            });
  }

  /** Builds a policy from the {@code rag.retry} settings. */
  public static ProviderRetryPolicy fromConfig(
      String name, RagConfig.Retry config, MeterRegistry meterRegistry) {
    return new ProviderRetryPolicy(
        name,
        config.getMaxAttempts(),
        config.getInitialBackoffMs(),
        config.getBackoffMultiplier(),
        config.getRetryableReasons(),
        meterRegistry);
  }

  /** Runs the call, retrying retryable provider failures. */
  public <T> T execute(Supplier<T> call) {
    return retry.executeSupplier(call);
  }

  public boolean isRetryable(Throwable throwable) {
    return throwable instanceof ProviderException pe && retryableReasons.contains(pe.getReason());
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }
}
