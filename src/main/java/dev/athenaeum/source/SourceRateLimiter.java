package dev.athenaeum.source;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Enforces a minimum interval between requests to one source, across all threads.
 *
 * <p>Each caller atomically reserves the next free slot and then sleeps until it. Reservation and
 * sleeping are separate, so concurrent callers queue up at {@code minInterval} spacing without
 * holding a lock while they wait.
 */
public class SourceRateLimiter {

  /** Blocks the calling thread; replaced in tests. */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }

  static final Sleeper THREAD_SLEEPER = duration -> Thread.sleep(duration.toMillis());

  private final long minIntervalMs;
  private final Clock clock;
  private final Sleeper sleeper;
  private final AtomicLong nextSlotMs = new AtomicLong(Long.MIN_VALUE);

  public SourceRateLimiter(Duration minInterval, Clock clock) {
    this(minInterval, clock, THREAD_SLEEPER);
  }

  public SourceRateLimiter(Duration minInterval, Clock clock, Sleeper sleeper) {
    this.minIntervalMs = Math.max(0L, minInterval.toMillis());
    this.clock = clock;
    this.sleeper = sleeper;
  }

  /**
   * Reserves the next slot and waits for it.
   *
   * @return how long the caller waited
   * @throws InterruptedException if interrupted while waiting; the slot stays consumed
   */
  public Duration acquire() throws InterruptedException {
    long now = clock.millis();
    long slot;
    while (true) {
      long reserved = nextSlotMs.get();
      slot = Math.max(now, reserved);
      if (nextSlotMs.compareAndSet(reserved, slot + minIntervalMs)) {
        break;
      }
    }
    long waitMs = slot - now;
    if (waitMs > 0) {
      sleeper.sleep(Duration.ofMillis(waitMs));
    }
    return Duration.ofMillis(waitMs);
  }

  /**
   * Pushes the next free slot back, e.g. after the source answered 429 with {@code Retry-After}.
   * Never moves it earlier.
   */
  public void deferFor(Duration delay) {
    long until = clock.millis() + delay.toMillis();
    nextSlotMs.accumulateAndGet(until, Math::max);
  }

  public Duration getMinInterval() {
    return Duration.ofMillis(minIntervalMs);
  }
}
