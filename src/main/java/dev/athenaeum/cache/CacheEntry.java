package dev.athenaeum.cache;

import java.time.Instant;

/**
 * A stored value with its insertion and expiry instants.
 *
 * @param value cached value
 * @param createdAt when the entry was stored
 * @param expiresAt first instant at which the entry is no longer served
 */
record CacheEntry<V>(V value, Instant createdAt, Instant expiresAt) {

  boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }
}
