package io.ledgerbridge.util;

import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.SleepingBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;

/**
 * Waits for the Retry-After carried by the last failure (see {@link RetryAfterHint}), capped at
 * {@code maxWait}. Without a hint it falls back to {@code initialInterval * 2^(retryCount - 1)},
 * capped at {@code maxInterval}.
 */
@Slf4j
public class RetryAfterBackOffPolicy implements SleepingBackOffPolicy<RetryAfterBackOffPolicy> {
  private final Duration maxWait;
  private final Duration initialInterval;
  private final Duration maxInterval;
  private Sleeper sleeper = new ThreadWaitSleeper();

  public RetryAfterBackOffPolicy(Duration maxWait, Duration initialInterval, Duration maxInterval) {
    this.maxWait = maxWait;
    this.initialInterval = initialInterval;
    this.maxInterval = maxInterval;
  }

  @Override
  public RetryAfterBackOffPolicy withSleeper(Sleeper sleeper) {
    var policy = new RetryAfterBackOffPolicy(maxWait, initialInterval, maxInterval);
    policy.sleeper = sleeper;
    return policy;
  }

  @Override
  public BackOffContext start(RetryContext context) {
    return new RetryAfterBackOffContext(context);
  }

  @Override
  public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
    var retryContext = ((RetryAfterBackOffContext) backOffContext).retryContext;
    var wait = computeWait(retryContext);
    log.info("Rate limited, waiting {} ms before retrying", wait.toMillis());
    try {
      sleeper.sleep(wait.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BackOffInterruptedException("Thread interrupted while sleeping", e);
    }
  }

  Duration computeWait(RetryContext retryContext) {
    if (retryContext.getLastThrowable() instanceof RetryAfterHint hint
        && hint.getRetryAfter().isPresent()) {
      var requested = hint.getRetryAfter().get();
      return requested.compareTo(maxWait) > 0 ? maxWait : requested;
    }
    var exponent = Math.min(Math.max(retryContext.getRetryCount() - 1, 0), 20);
    var exponential = initialInterval.multipliedBy(1L << exponent);
    return exponential.compareTo(maxInterval) > 0 ? maxInterval : exponential;
  }

  private static class RetryAfterBackOffContext implements BackOffContext {
    private final RetryContext retryContext;

    private RetryAfterBackOffContext(RetryContext retryContext) {
      this.retryContext = retryContext;
    }
  }
}
