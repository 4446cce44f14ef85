package cache.forge.core.lock;

import cache.forge.common.function.ThrowingSupplier;
import cache.forge.core.backend.CacheBackend;
import cache.forge.error.exception.CacheLockException;
import cache.forge.error.exception.InvalidCacheArgumentException;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 캐시 백엔드 위의 TTL 기반 분산 락
 *
 * <h3>동작</h3>
 *
 * <ul>
 *   <li>락 레코드: 키 {@code "lock:{name}"}, 값은 인스턴스마다 고유한 UUID 토큰, TTL은 {@code timeout}
 *   <li>획득: {@code set(key, token, timeout, nx=true)}. 블로킹 모드는 10ms 간격으로 재시도
 *   <li>해제: 이 인스턴스가 락을 보유한 경우에만 현재 토큰을 읽고 일치할 때 삭제
 * </ul>
 *
 * <p>해제는 읽기와 삭제 두 단계로 이루어지므로, 그 사이에 락이 만료되고 다른 소유자가 획득하면 그 락을 지울 수 있습니다. {@code timeout}을
 * 임계 구역보다 충분히 길게 잡아야 합니다.
 *
 * <p>재진입을 지원하지 않습니다. 같은 인스턴스로 다시 {@link #acquire()}하면 다른 소유자와 똑같이 대기합니다.
 */
@Slf4j
public class DistributedLock {

  public static final String KEY_PREFIX = "lock:";
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
  static final Duration POLL_INTERVAL = Duration.ofMillis(10);

  private final CacheBackend<String> backend;
  @Getter private final String name;
  @Getter private final String lockKey;
  private final Duration timeout;
  private final boolean blocking;
  private final Duration blockingTimeout;
  private final String token = UUID.randomUUID().toString();

  private volatile boolean held;

  public DistributedLock(CacheBackend<String> backend, String name) {
    this(backend, name, null, null, null);
  }

  /**
   * @param timeout 락 TTL (기본 10초)
   * @param blocking {@code false}면 한 번만 시도 (기본 {@code true})
   * @param blockingTimeout 블로킹 대기 상한, {@code null}이면 무기한
   */
  @Builder
  private DistributedLock(
      CacheBackend<String> backend,
      String name,
      Duration timeout,
      Boolean blocking,
      Duration blockingTimeout) {
    if (backend == null) {
      throw new InvalidCacheArgumentException("backend must not be null");
    }
    if (name == null || name.isBlank()) {
      throw new InvalidCacheArgumentException("lock name must not be blank");
    }
    this.backend = backend;
    this.name = name;
    this.lockKey = KEY_PREFIX + name;
    this.timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
    if (this.timeout.isZero() || this.timeout.isNegative()) {
      throw new InvalidCacheArgumentException("lock timeout=" + timeout);
    }
    this.blocking = blocking == null || blocking;
    this.blockingTimeout = blockingTimeout;
  }

  /**
   * 락 획득
   *
   * @return 획득 성공 여부. 논블로킹이거나 {@code blockingTimeout}이 지나면 {@code false}
   * @throws CacheLockException 대기 중 인터럽트된 경우
   */
  public boolean acquire() {
    long deadline = deadlineNanos();
    while (true) {
      if (tryOnce()) {
        return true;
      }
      if (!shouldRetry(deadline)) {
        log.debug("[Lock] '{}' 획득 실패", lockKey);
        return false;
      }
      try {
        TimeUnit.MILLISECONDS.sleep(POLL_INTERVAL.toMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new CacheLockException(lockKey, e);
      }
    }
  }

  /**
   * 이 인스턴스가 락을 보유하고 토큰이 일치할 때만 삭제합니다.
   *
   * <p>백엔드 호출이 실패하면 보유 상태가 유지되므로 다시 호출해 해제할 수 있습니다.
   */
  public void release() {
    if (!held) {
      return;
    }
    Optional<String> owner = backend.get(lockKey);
    if (owner.isPresent() && owner.get().equals(token)) {
      backend.delete(lockKey);
      log.debug("[Lock] '{}' 해제 완료", lockKey);
    } else {
      log.warn("[Lock] '{}' 해제 시점에 소유권 없음 (만료 또는 다른 소유자)", lockKey);
    }
    held = false;
  }

  /**
   * {@link #acquire()}의 Async 버전. 각 재시도 사이의 대기는 스레드를 점유하지 않습니다.
   */
  public CompletableFuture<Boolean> acquireAsync() {
    return attemptAsync(deadlineNanos());
  }

  public CompletableFuture<Void> releaseAsync() {
    if (!held) {
      return CompletableFuture.completedFuture(null);
    }
    return backend
        .getAsync(lockKey)
        .thenCompose(
            owner -> {
              if (owner.isPresent() && owner.get().equals(token)) {
                return backend
                    .deleteAsync(lockKey)
                    .thenAccept(ignored -> log.debug("[Lock] '{}' 해제 완료", lockKey));
              }
              log.warn("[Lock] '{}' 해제 시점에 소유권 없음 (만료 또는 다른 소유자)", lockKey);
              return CompletableFuture.<Void>completedFuture(null);
            })
        .thenRun(() -> held = false);
  }

  /**
   * 락을 획득해 작업을 실행하고 반드시 해제합니다.
   *
   * @throws CacheLockException 락을 얻지 못한 경우
   */
  public <T> T executeWithLock(ThrowingSupplier<T> task) throws Throwable {
    if (!acquire()) {
      throw new CacheLockException(lockKey);
    }
    try {
      return task.get();
    } finally {
      release();
    }
  }

  /** 이 인스턴스가 획득한 뒤 아직 해제하지 않았는지 여부. 락 TTL 만료는 반영하지 않습니다. */
  public boolean isHeld() {
    return held;
  }

  /** 소유자와 관계없이 현재 살아 있는 락 레코드가 있는지 */
  public boolean isLocked() {
    return backend.exists(lockKey);
  }

  // ==================== internal ====================

  private boolean tryOnce() {
    if (backend.set(lockKey, token, timeout, true)) {
      held = true;
      log.debug("[Lock] '{}' 획득 성공", lockKey);
      return true;
    }
    return false;
  }

  private CompletableFuture<Boolean> attemptAsync(long deadline) {
    return backend
        .setAsync(lockKey, token, timeout, true)
        .thenCompose(
            acquired -> {
              if (acquired) {
                held = true;
                log.debug("[Lock] '{}' 획득 성공", lockKey);
                return CompletableFuture.completedFuture(true);
              }
              if (!shouldRetry(deadline)) {
                log.debug("[Lock] '{}' 획득 실패", lockKey);
                return CompletableFuture.completedFuture(false);
              }
              Executor delayed =
                  CompletableFuture.delayedExecutor(
                      POLL_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
              return CompletableFuture.supplyAsync(() -> deadline, delayed)
                  .thenCompose(this::attemptAsync);
            });
  }

  private long deadlineNanos() {
    return blockingTimeout == null ? Long.MAX_VALUE : System.nanoTime() + blockingTimeout.toNanos();
  }

  private boolean shouldRetry(long deadline) {
    if (!blocking) {
      return false;
    }
    return blockingTimeout == null || System.nanoTime() - deadline < 0;
  }
}
