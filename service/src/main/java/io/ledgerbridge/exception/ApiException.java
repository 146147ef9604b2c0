package io.ledgerbridge.exception;

import io.ledgerbridge.LedgerBridgeException;
import jakarta.annotation.Nullable;
import org.springframework.http.HttpStatus;

/**
 * A backend call that did not succeed. The status is the backend's status code, or 0 when no
 * response was received at all.
 */
public class ApiException extends LedgerBridgeException {
  public static final int MAX_EXCERPT_LENGTH = 500;

  private final int status;
  private final String responseExcerpt;
  private final String path;

  public ApiException(int status, String path, @Nullable String responseBody) {
    this(status, path, responseBody, null);
  }

  public ApiException(
      int status, String path, @Nullable String responseBody, @Nullable Throwable cause) {
    super(buildMessage(status, path, excerpt(responseBody)), cause, toHttpStatus(status));
    this.status = status;
    this.path = path;
    this.responseExcerpt = excerpt(responseBody);
  }

  public int getStatus() {
    return status;
  }

  public String getResponseExcerpt() {
    return responseExcerpt;
  }

  public String getPath() {
    return path;
  }

  public static String excerpt(@Nullable String responseBody) {
    if (responseBody == null) {
      return "";
    }
    return responseBody.length() <= MAX_EXCERPT_LENGTH
        ? responseBody
        : responseBody.substring(0, MAX_EXCERPT_LENGTH) + "...";
  }

  private static String buildMessage(int status, String path, String excerpt) {
    var prefix =
        status == 0
            ? "Request to %s failed".formatted(path)
            : "API error %d for %s".formatted(status, path);
    return excerpt.isEmpty() ? prefix : prefix + ": " + excerpt;
  }

  private static HttpStatus toHttpStatus(int status) {
    var resolved = HttpStatus.resolve(status);
    if (resolved == null || status < 400) {
      return HttpStatus.BAD_GATEWAY;
    }
    return resolved;
  }
}
