package dev.athenaeum.source;

import dev.athenaeum.paper.PaperSource;
import java.time.Duration;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/** HTTP 429; retried with backoff, honouring {@code Retry-After} through the rate limiter. */
public class SourceRateLimitedException extends SourceHttpException {

  private final @Nullable Duration retryAfter;

  public SourceRateLimitedException(
      PaperSource source, String message, @Nullable Duration retryAfter) {
    super(source, 429, message);
    this.retryAfter = retryAfter;
  }

  public Optional<Duration> getRetryAfter() {
    return Optional.ofNullable(retryAfter);
  }
}
