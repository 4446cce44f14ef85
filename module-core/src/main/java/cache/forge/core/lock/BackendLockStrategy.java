package cache.forge.core.lock;

import cache.forge.common.function.ThrowingSupplier;
import cache.forge.core.backend.CacheBackend;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link CacheBackend} 기반 {@link LockStrategy}
 *
 * <p>호출마다 새 {@link DistributedLock}을 만들어 획득/실행/해제를 수행합니다. {@link #tryLockImmediately}로 얻은 락은 {@link
 * #unlock}까지 이 전략 인스턴스가 보관합니다.
 */
@Slf4j
@RequiredArgsConstructor
public class BackendLockStrategy implements LockStrategy {

  private final CacheBackend<String> backend;
  private final Map<String, DistributedLock> manualLocks = new ConcurrentHashMap<>();

  @Override
  public <T> T executeWithLock(
      String key, long waitTime, long leaseTime, ThrowingSupplier<T> task) throws Throwable {
    DistributedLock lock =
        DistributedLock.builder()
            .backend(backend)
            .name(key)
            .timeout(Duration.ofSeconds(leaseTime))
            .blocking(waitTime > 0)
            .blockingTimeout(Duration.ofSeconds(Math.max(0L, waitTime)))
            .build();
    return lock.executeWithLock(task);
  }

  @Override
  public boolean tryLockImmediately(String key, long leaseTime) {
    DistributedLock lock =
        DistributedLock.builder()
            .backend(backend)
            .name(key)
            .timeout(Duration.ofSeconds(leaseTime))
            .blocking(false)
            .build();
    if (!lock.acquire()) {
      return false;
    }
    DistributedLock previous = manualLocks.put(key, lock);
    if (previous != null) {
      log.warn("[Lock] '{}' 이전 수동 락 핸들을 덮어씀", lock.getLockKey());
    }
    return true;
  }

  @Override
  public void unlock(String key) {
    DistributedLock lock = manualLocks.remove(key);
    if (lock == null) {
      log.debug("[Lock] '{}' 보유 중인 수동 락 없음", DistributedLock.KEY_PREFIX + key);
      return;
    }
    lock.release();
  }
}
