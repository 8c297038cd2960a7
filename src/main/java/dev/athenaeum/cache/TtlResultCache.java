package dev.athenaeum.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory {@link ResultCache} backed by an insertion-ordered {@link LinkedHashMap}.
 *
 * <p>Expiry is evaluated lazily on read against the injected {@link Clock}. When the entry count
 * exceeds {@code maxEntries}, expired entries are dropped first, then the oldest inserts. Storing a
 * key again counts as a new insert. All access is serialised on the cache instance; concurrent
 * misses for the same key may both fetch and both store, and the last write wins.
 */
public class TtlResultCache<V> implements ResultCache<V> {

  private final LinkedHashMap<String, CacheEntry<V>> entries = new LinkedHashMap<>();
  private final Clock clock;
  private final int maxEntries;

  public TtlResultCache(Clock clock, int maxEntries) {
    this.clock = clock;
    this.maxEntries = Math.max(1, maxEntries);
  }

  @Override
  public synchronized Optional<V> get(String key) {
    if (key == null) {
      return Optional.empty();
    }
    CacheEntry<V> entry = entries.get(key);
    if (entry == null) {
      return Optional.empty();
    }
    if (entry.isExpired(clock.instant())) {
      entries.remove(key);
      return Optional.empty();
    }
    return Optional.of(entry.value());
  }

  @Override
  public synchronized void put(String key, V value, Duration ttl) {
    if (key == null || value == null || ttl == null || ttl.isZero() || ttl.isNegative()) {
      return;
    }
    Instant now = clock.instant();
    // Re-inserting moves the key to the young end of the order.
    entries.remove(key);
    entries.put(key, new CacheEntry<>(value, now, now.plus(ttl)));
    evictIfNeeded(now);
  }

  @Override
  public synchronized boolean isExpired(String key) {
    if (key == null) {
      return true;
    }
    CacheEntry<V> entry = entries.get(key);
    return entry == null || entry.isExpired(clock.instant());
  }

  @Override
  public synchronized int size() {
    return entries.size();
  }

  @Override
  public synchronized void clear() {
    entries.clear();
  }

  private void evictIfNeeded(Instant now) {
    if (entries.size() <= maxEntries) {
      return;
    }
    entries.values().removeIf(entry -> entry.isExpired(now));
    Iterator<Map.Entry<String, CacheEntry<V>>> oldestFirst = entries.entrySet().iterator();
    while (entries.size() > maxEntries && oldestFirst.hasNext()) {
      oldestFirst.next();
      oldestFirst.remove();
    }
  }
}
