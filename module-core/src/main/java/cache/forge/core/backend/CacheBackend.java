package cache.forge.core.backend;

import cache.forge.error.exception.CacheBackendException;
import cache.forge.error.exception.CacheConnectionException;
import cache.forge.error.exception.CacheSerializationException;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Cache Backend Contract
 *
 * <h3>Role</h3>
 *
 * <p>Uniform key/value contract with expiration and eviction. Every engine (memory, SQLite, Redis)
 * exposes the same blocking operations and a {@link CompletableFuture} twin for each of them.
 *
 * <h3>Semantics</h3>
 *
 * <ul>
 *   <li>An entry is <b>live</b> while it has no expiry or {@code now < expiresAt}. Expired entries
 *       are logically absent from every operation, even before they are physically removed.
 *   <li>A miss is never an error. Storage failures surface as {@link CacheBackendException},
 *       codec failures as {@link CacheSerializationException} and an unreachable remote store as
 *       {@link CacheConnectionException}. Only {@link #checkHealth()} turns failures into {@code
 *       false}.
 *   <li>{@code ttl == null} means the entry never expires.
 * </ul>
 *
 * <h3>Batch operations</h3>
 *
 * <p>{@link #getMany}, {@link #setMany} and {@link #deleteMany} default to sequential single-key
 * calls. Engines with native batches override them; the observable result must stay the same.
 *
 * @param <V> value type
 */
public interface CacheBackend<V> extends AutoCloseable {

  /** {@link #ttl(String)} result for a live entry without expiry */
  long TTL_NO_EXPIRY = -1L;

  /** {@link #ttl(String)} result for an absent or expired key */
  long TTL_ABSENT = -2L;

  /** Sentinel key written and removed by {@link #checkHealth()} */
  String HEALTH_CHECK_KEY = "__health_check__";

  int DEFAULT_SCAN_COUNT = 100;

  /**
   * Reads a live entry and moves it to the most-recently-used position.
   *
   * @return the value, or empty for a missing or expired key
   */
  Optional<V> get(String key);

  /**
   * Stores a value.
   *
   * @param ttl relative expiry, {@code null} for no expiry
   * @param nx write only when no live entry exists for the key
   * @return {@code true} when the value was written
   */
  boolean set(String key, V value, Duration ttl, boolean nx);

  default boolean set(String key, V value) {
    return set(key, value, null, false);
  }

  default boolean set(String key, V value, Duration ttl) {
    return set(key, value, ttl, false);
  }

  /**
   * @return {@code true} only when a live entry was removed
   */
  boolean delete(String key);

  /** Same lazy expiry check as {@link #get}, without touching the LRU position. */
  boolean exists(String key);

  /** Removes every entry owned by this backend. Irreversible. */
  void clear();

  /** Absent and expired keys are omitted from the result. Iteration order follows {@code keys}. */
  default Map<String, V> getMany(Collection<String> keys) {
    Map<String, V> found = new LinkedHashMap<>();
    for (String key : keys) {
      get(key).ifPresent(value -> found.put(key, value));
    }
    return found;
  }

  default void setMany(Map<String, ? extends V> entries, Duration ttl) {
    entries.forEach((key, value) -> set(key, value, ttl, false));
  }

  /**
   * @return number of live entries removed
   */
  default int deleteMany(Collection<String> keys) {
    int removed = 0;
    for (String key : keys) {
      if (delete(key)) {
        removed++;
      }
    }
    return removed;
  }

  /**
   * Lists live keys matching a glob pattern ({@code *}, {@code ?}, {@code [...]}).
   *
   * <p>Start with cursor {@code 0} and pass {@link KeysPage#cursor()} back until {@link
   * KeysPage#hasMore()} is {@code false}. One traversal of an unmodified store returns each key
   * once; pagination under concurrent writes is best-effort.
   *
   * @param count page size hint, must be positive
   * @param maxKeys optional upper bound for this page, {@code null} for none
   */
  KeysPage keys(String pattern, long cursor, int count, Integer maxKeys);

  default KeysPage keys(String pattern) {
    return keys(pattern, 0L, DEFAULT_SCAN_COUNT, null);
  }

  /**
   * @return remaining seconds (rounded up), {@link #TTL_NO_EXPIRY} or {@link #TTL_ABSENT}
   */
  long ttl(String key);

  /** Number of stored entries. Entries awaiting the sweeper may be counted. */
  long size();

  /** Writes, reads and deletes {@link #HEALTH_CHECK_KEY}; any failure yields {@code false}. */
  boolean checkHealth();

  /** Releases threads, file handles and connections. Safe to call more than once. */
  @Override
  void close();

  // ==================== Async ====================

  default CompletableFuture<Optional<V>> getAsync(String key) {
    return CompletableFutures.completed(() -> get(key));
  }

  default CompletableFuture<Boolean> setAsync(String key, V value, Duration ttl, boolean nx) {
    return CompletableFutures.completed(() -> set(key, value, ttl, nx));
  }

  default CompletableFuture<Boolean> setAsync(String key, V value, Duration ttl) {
    return setAsync(key, value, ttl, false);
  }

  default CompletableFuture<Boolean> deleteAsync(String key) {
    return CompletableFutures.completed(() -> delete(key));
  }

  default CompletableFuture<Boolean> existsAsync(String key) {
    return CompletableFutures.completed(() -> exists(key));
  }

  default CompletableFuture<Void> clearAsync() {
    return CompletableFutures.completed(
        () -> {
          clear();
          return null;
        });
  }

  default CompletableFuture<Map<String, V>> getManyAsync(Collection<String> keys) {
    return CompletableFutures.completed(() -> getMany(keys));
  }

  default CompletableFuture<Void> setManyAsync(Map<String, ? extends V> entries, Duration ttl) {
    return CompletableFutures.completed(
        () -> {
          setMany(entries, ttl);
          return null;
        });
  }

  default CompletableFuture<Integer> deleteManyAsync(Collection<String> keys) {
    return CompletableFutures.completed(() -> deleteMany(keys));
  }

  default CompletableFuture<KeysPage> keysAsync(
      String pattern, long cursor, int count, Integer maxKeys) {
    return CompletableFutures.completed(() -> keys(pattern, cursor, count, maxKeys));
  }

  default CompletableFuture<Long> ttlAsync(String key) {
    return CompletableFutures.completed(() -> ttl(key));
  }

  default CompletableFuture<Boolean> checkHealthAsync() {
    return CompletableFutures.completed(this::checkHealth);
  }

  default CompletableFuture<Void> closeAsync() {
    return CompletableFutures.completed(
        () -> {
          close();
          return null;
        });
  }
}
