package cache.forge.core.lock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import cache.forge.core.backend.memory.MemoryCacheBackend;
import cache.forge.error.exception.CacheLockException;
import cache.forge.error.exception.InvalidCacheArgumentException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("BackendLockStrategy 단위 테스트")
class BackendLockStrategyTest {

  private MemoryCacheBackend<String> backend;
  private LockStrategy strategy;

  @BeforeEach
  void setUp() {
    backend = MemoryCacheBackend.<String>builder().cleanupInterval(Duration.ZERO).build();
    strategy = new BackendLockStrategy(backend);
  }

  @AfterEach
  void tearDown() {
    backend.close();
  }

  @Test
  @DisplayName("작업 실행 중에만 lock 키가 존재한다")
  void lockHeldDuringTask() throws Throwable {
    Boolean heldInside =
        strategy.executeWithLock("report", 0, 5, () -> backend.exists("lock:report"));

    assertThat(heldInside).isTrue();
    assertThat(backend.exists("lock:report")).isFalse();
  }

  @Test
  @DisplayName("waitTime 0이면 대기하지 않고 CacheLockException")
  void noWaitFailsFast() {
    assertThat(strategy.tryLockImmediately("report", 5)).isTrue();

    assertThatThrownBy(() -> strategy.executeWithLock("report", 0, 5, () -> "never"))
        .isInstanceOf(CacheLockException.class);
  }

  @Test
  @DisplayName("tryLockImmediately로 얻은 락은 unlock으로 해제된다")
  void manualLockCycle() {
    assertThat(strategy.tryLockImmediately("batch", 5)).isTrue();
    assertThat(strategy.tryLockImmediately("batch", 5)).isFalse();

    strategy.unlock("batch");

    assertThat(backend.exists("lock:batch")).isFalse();
    assertThat(strategy.tryLockImmediately("batch", 5)).isTrue();
  }

  @Test
  @DisplayName("다중 키 락은 키마다 락을 잡고 작업 후 모두 해제한다")
  void orderedLocksHoldEachKey() throws Throwable {
    // when
    List<Boolean> heldInside =
        strategy.executeWithOrderedLocks(
            List.of("b", "a", "b"),
            0,
            5,
            () -> List.of(backend.exists("lock:a"), backend.exists("lock:b")));

    // then
    assertThat(heldInside).containsExactly(true, true);
    assertThat(backend.exists("lock:a")).isFalse();
    assertThat(backend.exists("lock:b")).isFalse();
    assertThat(backend.exists("lock:a:b")).isFalse();
  }

  @Test
  @DisplayName("겹치는 키 집합은 공통 키에서 서로를 배제하고 먼저 얻은 락은 해제된다")
  void overlappingKeySetsExclude() throws Throwable {
    // given
    Boolean overlapBlocked =
        strategy.executeWithOrderedLocks(
            List.of("b", "c"),
            0,
            5,
            () -> {
              // when
              try {
                strategy.executeWithOrderedLocks(List.of("a", "b"), 0, 5, () -> "never");
                return false;
              } catch (CacheLockException e) {
                return !backend.exists("lock:a");
              }
            });

    // then
    assertThat(overlapBlocked).isTrue();
    assertThat(backend.exists("lock:b")).isFalse();
  }

  @Test
  @DisplayName("빈 키 목록은 거부한다")
  void emptyKeysRejected() {
    assertThatThrownBy(() -> strategy.executeWithOrderedLocks(List.of(), 0, 5, () -> "never"))
        .isInstanceOf(InvalidCacheArgumentException.class);
  }
}
