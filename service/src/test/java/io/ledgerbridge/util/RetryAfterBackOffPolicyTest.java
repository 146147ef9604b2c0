package io.ledgerbridge.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.Sleeper;

class RetryAfterBackOffPolicyTest {
  private final RetryAfterBackOffPolicy policy =
      new RetryAfterBackOffPolicy(
          Duration.ofSeconds(60), Duration.ofMillis(500), Duration.ofSeconds(30));

  private static class HintedFailure extends RuntimeException implements RetryAfterHint {
    private final Optional<Duration> retryAfter;

    HintedFailure(Optional<Duration> retryAfter) {
      this.retryAfter = retryAfter;
    }

    @Override
    public Optional<Duration> getRetryAfter() {
      return retryAfter;
    }
  }

  private static RetryContext contextWith(Throwable lastThrowable, int retryCount) {
    var context = mock(RetryContext.class);
    when(context.getLastThrowable()).thenReturn(lastThrowable);
    when(context.getRetryCount()).thenReturn(retryCount);
    return context;
  }

  @Test
  void testUsesRetryAfter() {
    var context = contextWith(new HintedFailure(Optional.of(Duration.ofSeconds(5))), 1);
    assertEquals(Duration.ofSeconds(5), policy.computeWait(context));
  }

  @Test
  void testRetryAfterIsCapped() {
    var context = contextWith(new HintedFailure(Optional.of(Duration.ofHours(1))), 1);
    assertEquals(Duration.ofSeconds(60), policy.computeWait(context));
  }

  @Test
  void testExponentialWithoutHint() {
    assertEquals(
        Duration.ofMillis(500),
        policy.computeWait(contextWith(new HintedFailure(Optional.empty()), 1)));
    assertEquals(
        Duration.ofMillis(1000),
        policy.computeWait(contextWith(new HintedFailure(Optional.empty()), 2)));
    assertEquals(
        Duration.ofMillis(2000), policy.computeWait(contextWith(new RuntimeException(), 3)));
    assertEquals(
        Duration.ofSeconds(30), policy.computeWait(contextWith(new RuntimeException(), 12)));
  }

  @Test
  void testBackOffSleepsThroughSleeper() throws Exception {
    var sleeper = mock(Sleeper.class);
    var sleepingPolicy = policy.withSleeper(sleeper);
    var context = contextWith(new HintedFailure(Optional.of(Duration.ofSeconds(7))), 1);

    sleepingPolicy.backOff(sleepingPolicy.start(context));

    verify(sleeper).sleep(7000L);
  }
}
