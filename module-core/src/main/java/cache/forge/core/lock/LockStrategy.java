package cache.forge.core.lock;

import cache.forge.common.function.ThrowingSupplier;
import cache.forge.error.exception.InvalidCacheArgumentException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 분산 락 전략 인터페이스
 *
 * <p>대기 시간과 임대 시간은 초 단위입니다. 락을 얻지 못하면 구현체는 {@link
 * cache.forge.error.exception.CacheLockException}을 던집니다.
 */
public interface LockStrategy {

  long DEFAULT_WAIT_SECONDS = 10L;
  long DEFAULT_LEASE_SECONDS = 20L;

  // 1. 락을 획득하고 작업을 실행 (waitTime 동안 재시도)
  <T> T executeWithLock(String key, long waitTime, long leaseTime, ThrowingSupplier<T> task)
      throws Throwable;

  // 2. 기본 설정값으로 락 실행
  default <T> T executeWithLock(String key, ThrowingSupplier<T> task) throws Throwable {
    return executeWithLock(key, DEFAULT_WAIT_SECONDS, DEFAULT_LEASE_SECONDS, task);
  }

  // 3. 즉시 락 획득 시도 (기다리지 않고 성공 여부만 반환)
  boolean tryLockImmediately(String key, long leaseTime);

  // 4. tryLockImmediately로 얻은 락 수동 해제
  void unlock(String key);

  /**
   * 다중 키 락
   *
   * <p>중복을 제거한 키를 정렬 순서대로 하나씩 획득하고 역순으로 해제합니다. 겹치는 키 집합을 다루는 호출자는 공통 키에서 서로를 배제하며, 획득 순서가
   * 같으므로 교착되지 않습니다. 대기 시간은 키마다 적용됩니다. 중간 키에서 실패하면 이미 얻은 락을 해제하고 {@link
   * cache.forge.error.exception.CacheLockException}을 던집니다.
   */
  default <T> T executeWithOrderedLocks(
      List<String> keys, long waitTime, long leaseTime, ThrowingSupplier<T> task)
      throws Throwable {
    List<String> ordered = keys.stream().distinct().sorted().collect(Collectors.toList());
    if (ordered.isEmpty()) {
      throw new InvalidCacheArgumentException("keys=" + keys);
    }
    return lockInOrder(ordered, 0, waitTime, leaseTime, task);
  }

  private <T> T lockInOrder(
      List<String> ordered, int index, long waitTime, long leaseTime, ThrowingSupplier<T> task)
      throws Throwable {
    if (index == ordered.size()) {
      return task.get();
    }
    return executeWithLock(
        ordered.get(index),
        waitTime,
        leaseTime,
        () -> lockInOrder(ordered, index + 1, waitTime, leaseTime, task));
  }
}
