package dev.athenaeum.source;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Skips a source for a cooldown period after a run of consecutive failures. Any success resets the
 * failure count.
 */
public class CircuitBreaker {

  private final int failureThreshold;
  private final long cooldownMs;
  private final Clock clock;
  private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
  private final AtomicLong openUntilMs = new AtomicLong(0L);

  public CircuitBreaker(int failureThreshold, Duration cooldown, Clock clock) {
    this.failureThreshold = Math.max(1, failureThreshold);
    this.cooldownMs = Math.max(1L, cooldown.toMillis());
    this.clock = clock;
  }

  public boolean allowRequest() {
    return clock.millis() >= openUntilMs.get();
  }

  public boolean isOpen() {
    return !allowRequest();
  }

  public void recordSuccess() {
    consecutiveFailures.set(0);
  }

  public void recordFailure() {
    int failures = consecutiveFailures.incrementAndGet();
    if (failures >= failureThreshold) {
      openUntilMs.set(clock.millis() + cooldownMs);
      consecutiveFailures.set(0);
    }
  }
}
