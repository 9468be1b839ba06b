package com.flamingo.ai.docrag.service.rag.retry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.docrag.exception.ProviderException;
import com.flamingo.ai.docrag.exception.ProviderFailureReason;
import com.flamingo.ai.docrag.exception.ValidationException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ProviderRetryPolicy")
class ProviderRetryPolicyTest {

  private SimpleMeterRegistry meterRegistry;
  private ProviderRetryPolicy policy;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    policy =
        new ProviderRetryPolicy(
            "test",
            3,
            1,
            2.0,
            EnumSet.of(ProviderFailureReason.RATE_LIMITED, ProviderFailureReason.TIMEOUT),
            meterRegistry);
  }

  @Test
  void shouldRetryRateLimitedCall_untilItSucceeds() {
    AtomicInteger attempts = new AtomicInteger();

    String result =
        policy.execute(
            () -> {
              if (attempts.incrementAndGet() < 3) {
                throw new ProviderException(ProviderFailureReason.RATE_LIMITED, "slow down");
              }
              return "ok";
            });

    assertThat(result).isEqualTo("ok");
    assertThat(attempts.get()).isEqualTo(3);
    assertThat(
            meterRegistry
                .counter("provider.retries", "policy", "test", "reason", "RATE_LIMITED")
                .count())
        .isEqualTo(2.0);
  }

  @Test
  @DisplayName("should give up after max attempts and rethrow the last failure")
  void shouldRethrowLastFailure_whenAttemptsExhausted() {
    AtomicInteger attempts = new AtomicInteger();

    assertThatThrownBy(
            () ->
                policy.execute(
                    () -> {
                      attempts.incrementAndGet();
                      throw new ProviderException(ProviderFailureReason.TIMEOUT, "timed out");
                    }))
        .isInstanceOf(ProviderException.class)
        .hasMessage("timed out");
    assertThat(attempts.get()).isEqualTo(3);
  }

  @Test
  void shouldNotRetry_whenReasonNotRetryable() {
    AtomicInteger attempts = new AtomicInteger();

    assertThatThrownBy(
            () ->
                policy.execute(
                    () -> {
                      attempts.incrementAndGet();
                      throw new ProviderException(ProviderFailureReason.FAILURE, "bad request");
                    }))
        .isInstanceOf(ProviderException.class);
    assertThat(attempts.get()).isEqualTo(1);
  }

  @Test
  void shouldNotRetry_whenExceptionIsNotAProviderFailure() {
    AtomicInteger attempts = new AtomicInteger();

    assertThatThrownBy(
            () ->
                policy.execute(
                    () -> {
                      attempts.incrementAndGet();
                      throw new ValidationException("bad input");
                    }))
        .isInstanceOf(ValidationException.class);
    assertThat(attempts.get()).isEqualTo(1);
  }

  @Test
  @DisplayName("an empty retryable set disables retries")
  void shouldAttemptOnce_whenNoReasonIsRetryable() {
    ProviderRetryPolicy noRetry =
        new ProviderRetryPolicy("none", 3, 1, 2.0, Set.of(), meterRegistry);

    assertThat(
            noRetry.isRetryable(
                new ProviderException(ProviderFailureReason.RATE_LIMITED, "slow down")))
        .isFalse();
    assertThat(noRetry.getMaxAttempts()).isEqualTo(3);
  }
}
