package dev.athenaeum.source;

import static org.assertj.core.api.Assertions.assertThat;

import dev.athenaeum.fixture.MutableClock;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SourceRateLimiterTest {

  private MutableClock clock;
  private List<Duration> sleeps;
  private SourceRateLimiter limiter;

  @BeforeEach
  void setUp() {
    clock = MutableClock.at("2024-01-01T00:00:00Z");
    sleeps = new ArrayList<>();
    limiter = new SourceRateLimiter(Duration.ofSeconds(1), clock, sleeps::add);
  }

  @Test
  void firstAcquireDoesNotWait() throws InterruptedException {
    assertThat(limiter.acquire()).isZero();
    assertThat(sleeps).isEmpty();
  }

  @Test
  void backToBackCallersAreSpacedByMinInterval() throws InterruptedException {
    limiter.acquire();
    Duration second = limiter.acquire();
    Duration third = limiter.acquire();

    assertThat(second).isEqualTo(Duration.ofSeconds(1));
    assertThat(third).isEqualTo(Duration.ofSeconds(2));
    assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
  }

  @Test
  void noWaitOnceIntervalHasPassed() throws InterruptedException {
    limiter.acquire();
    clock.advance(Duration.ofMillis(1500));

    assertThat(limiter.acquire()).isZero();
  }

  @Test
  void deferPushesNextSlotBack() throws InterruptedException {
    limiter.acquire();
    limiter.deferFor(Duration.ofSeconds(5));

    assertThat(limiter.acquire()).isEqualTo(Duration.ofSeconds(5));
  }

  @Test
  void deferNeverMovesSlotEarlier() throws InterruptedException {
    limiter.acquire();
    limiter.acquire();
    limiter.deferFor(Duration.ofMillis(100));

    assertThat(limiter.acquire()).isEqualTo(Duration.ofSeconds(2));
  }

  @Test
  void zeroIntervalNeverWaits() throws InterruptedException {
    SourceRateLimiter unthrottled = new SourceRateLimiter(Duration.ZERO, clock, sleeps::add);

    unthrottled.acquire();
    unthrottled.acquire();

    assertThat(sleeps).isEmpty();
  }

  @Test
  void concurrentCallersReserveDistinctSlots() throws Exception {
    int callers = 16;
    Clock fixed = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
    Queue<Duration> recorded = new ConcurrentLinkedQueue<>();
    SourceRateLimiter shared = new SourceRateLimiter(Duration.ofSeconds(1), fixed, recorded::add);
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(callers);
    try {
      List<Future<Duration>> waits = new ArrayList<>();
      for (int i = 0; i < callers; i++) {
        waits.add(
            pool.submit(
                () -> {
                  start.await();
                  return shared.acquire();
                }));
      }
      start.countDown();

      List<Duration> expected = new ArrayList<>();
      List<Duration> actual = new ArrayList<>();
      for (int i = 0; i < callers; i++) {
        expected.add(Duration.ofSeconds(i));
        actual.add(waits.get(i).get(10, TimeUnit.SECONDS));
      }
      assertThat(actual).containsExactlyInAnyOrderElementsOf(expected);
      assertThat(recorded).containsExactlyInAnyOrderElementsOf(expected.subList(1, callers));
    } finally {
      pool.shutdownNow();
    }
  }
}
