package dev.athenaeum.source;

import dev.athenaeum.paper.PaperSource;
import java.time.Duration;
import org.jspecify.annotations.Nullable;

/**
 * Non-2xx response from a source. Use {@link #forStatus} so that 429 and 5xx responses map to
 * their retryable subtypes.
 */
public class SourceHttpException extends SourceException {

  private final int statusCode;

  public SourceHttpException(PaperSource source, int statusCode, String message) {
    super(source, message);
    this.statusCode = statusCode;
  }

  public int getStatusCode() {
    return statusCode;
  }

  /**
   * Picks the exception type for an HTTP error status.
   *
   * @param source the source that answered
   * @param statusCode HTTP status code
   * @param retryAfterHeader raw {@code Retry-After} header, seconds form only
   * @return {@link SourceRateLimitedException} for 429, {@link TransientSourceException} for 5xx,
   *     otherwise a plain {@link SourceHttpException}
   */
  public static SourceHttpException forStatus(
      PaperSource source, int statusCode, @Nullable String retryAfterHeader) {
    String message = source.tag() + " returned HTTP " + statusCode;
    if (statusCode == 429) {
      return new SourceRateLimitedException(source, message, parseRetryAfter(retryAfterHeader));
    }
    if (statusCode >= 500) {
      return new TransientSourceException(source, statusCode, message);
    }
    return new SourceHttpException(source, statusCode, message);
  }

  static @Nullable Duration parseRetryAfter(@Nullable String header) {
    if (header == null || header.isBlank()) {
      return null;
    }
    try {
      long seconds = Long.parseLong(header.trim());
      return seconds > 0 ? Duration.ofSeconds(seconds) : null;
    } catch (NumberFormatException e) {
      // HTTP-date form is not honoured
      return null;
    }
  }
}
