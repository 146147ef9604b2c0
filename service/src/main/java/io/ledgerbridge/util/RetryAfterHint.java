package io.ledgerbridge.util;

import java.time.Duration;
import java.util.Optional;

/** Implemented by failures that carry a server supplied wait before the next attempt. */
public interface RetryAfterHint {
  Optional<Duration> getRetryAfter();
}
