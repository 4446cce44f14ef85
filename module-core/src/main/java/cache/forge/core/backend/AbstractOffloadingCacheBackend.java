package cache.forge.core.backend;

import cache.forge.error.exception.CacheBackendException;
import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * 블로킹 I/O 엔진의 Async 표면
 *
 * <p>모든 {@code *Async} 연산을 엔진이 소유한 {@link #asyncExecutor()}로 넘겨 호출 스레드를 막지 않습니다. 엔진이 닫힌 뒤 제출된 작업은
 * 실패한 future를 반환합니다.
 */
public abstract class AbstractOffloadingCacheBackend<V> implements CacheBackend<V> {

  protected abstract Executor asyncExecutor();

  protected <T> CompletableFuture<T> offload(Supplier<T> operation) {
    try {
      return CompletableFuture.supplyAsync(operation, asyncExecutor());
    } catch (RejectedExecutionException e) {
      return CompletableFuture.failedFuture(
          new CacheBackendException(getClass().getSimpleName() + " is closed", e));
    }
  }

  @Override
  public CompletableFuture<Optional<V>> getAsync(String key) {
    return offload(() -> get(key));
  }

  @Override
  public CompletableFuture<Boolean> setAsync(String key, V value, Duration ttl, boolean nx) {
    return offload(() -> set(key, value, ttl, nx));
  }

  @Override
  public CompletableFuture<Boolean> deleteAsync(String key) {
    return offload(() -> delete(key));
  }

  @Override
  public CompletableFuture<Boolean> existsAsync(String key) {
    return offload(() -> exists(key));
  }

  @Override
  public CompletableFuture<Void> clearAsync() {
    return offload(
        () -> {
          clear();
          return null;
        });
  }

  @Override
  public CompletableFuture<Map<String, V>> getManyAsync(Collection<String> keys) {
    return offload(() -> getMany(keys));
  }

  @Override
  public CompletableFuture<Void> setManyAsync(Map<String, ? extends V> entries, Duration ttl) {
    return offload(
        () -> {
          setMany(entries, ttl);
          return null;
        });
  }

  @Override
  public CompletableFuture<Integer> deleteManyAsync(Collection<String> keys) {
    return offload(() -> deleteMany(keys));
  }

  @Override
  public CompletableFuture<KeysPage> keysAsync(
      String pattern, long cursor, int count, Integer maxKeys) {
    return offload(() -> keys(pattern, cursor, count, maxKeys));
  }

  @Override
  public CompletableFuture<Long> ttlAsync(String key) {
    return offload(() -> ttl(key));
  }

  @Override
  public CompletableFuture<Boolean> checkHealthAsync() {
    return offload(this::checkHealth);
  }
}
