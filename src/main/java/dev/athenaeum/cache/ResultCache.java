package dev.athenaeum.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value cache whose entries expire after a per-entry time-to-live.
 *
 * @param <V> cached value type
 */
public interface ResultCache<V> {

  /** Returns the live value for {@code key}, or empty when absent or expired. */
  Optional<V> get(String key);

  /**
   * Stores a value. Null values and non-positive TTLs are ignored.
   *
   * @param key cache key
   * @param value value to store
   * @param ttl time-to-live measured from now
   */
  void put(String key, V value, Duration ttl);

  /** Whether {@code key} has no live entry (never stored, evicted, or past its TTL). */
  boolean isExpired(String key);

  /** Number of stored entries, including expired ones not yet purged. */
  int size();

  void clear();
}
