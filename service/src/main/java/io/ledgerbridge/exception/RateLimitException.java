package io.ledgerbridge.exception;

import jakarta.annotation.Nullable;

/** The backend kept answering 429 until the attempt budget ran out. */
public class RateLimitException extends ApiException {

  public RateLimitException(String path, @Nullable String responseBody) {
    super(429, path, responseBody);
  }
}
