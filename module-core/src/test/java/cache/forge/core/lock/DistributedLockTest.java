package cache.forge.core.lock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

import cache.forge.core.backend.MutableClock;
import cache.forge.core.backend.memory.MemoryCacheBackend;
import cache.forge.error.exception.CacheBackendException;
import cache.forge.error.exception.CacheLockException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DistributedLock 단위 테스트")
class DistributedLockTest {

  private MemoryCacheBackend<String> backend;

  @BeforeEach
  void setUp() {
    backend = MemoryCacheBackend.<String>builder().cleanupInterval(Duration.ZERO).build();
  }

  @AfterEach
  void tearDown() {
    backend.close();
  }

  private DistributedLock nonBlocking(String name) {
    return DistributedLock.builder().backend(backend).name(name).blocking(false).build();
  }

  @Nested
  @DisplayName("획득")
  class Acquire {

    @Test
    @DisplayName("두 번째 논블로킹 획득은 즉시 실패한다")
    void mutualExclusion() {
      DistributedLock first = nonBlocking("job");
      DistributedLock second = nonBlocking("job");

      assertThat(first.acquire()).isTrue();
      assertThat(second.acquire()).isFalse();
      assertThat(backend.get("lock:job")).isPresent();
      assertThat(first.isLocked()).isTrue();
    }

    @Test
    @DisplayName("블로킹 타임아웃이 지나면 false를 반환한다")
    void blockingTimeout() {
      nonBlocking("job").acquire();
      DistributedLock waiter =
          DistributedLock.builder()
              .backend(backend)
              .name("job")
              .blockingTimeout(Duration.ofMillis(50))
              .build();

      long start = System.nanoTime();
      boolean acquired = waiter.acquire();
      long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

      assertThat(acquired).isFalse();
      assertThat(elapsedMillis).isGreaterThanOrEqualTo(50L);
    }

    @Test
    @DisplayName("블로킹 대기자는 해제 후 락을 얻는다")
    void blockingWaiterGetsLockAfterRelease() throws Exception {
      DistributedLock holder = nonBlocking("job");
      holder.acquire();
      DistributedLock waiter =
          DistributedLock.builder()
              .backend(backend)
              .name("job")
              .blockingTimeout(Duration.ofSeconds(2))
              .build();

      var pending = waiter.acquireAsync();
      Thread.sleep(30);
      assertThat(pending).isNotDone();
      holder.release();

      assertThat(pending.get(2, TimeUnit.SECONDS)).isTrue();
      assertThat(waiter.isHeld()).isTrue();
    }

    @Test
    @DisplayName("락 TTL이 만료되면 다른 소유자가 획득할 수 있다")
    void expiredLockCanBeTaken() {
      MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
      MemoryCacheBackend<String> clocked =
          MemoryCacheBackend.<String>builder().cleanupInterval(Duration.ZERO).clock(clock).build();
      DistributedLock first =
          DistributedLock.builder()
              .backend(clocked)
              .name("job")
              .timeout(Duration.ofSeconds(1))
              .blocking(false)
              .build();
      DistributedLock second =
          DistributedLock.builder().backend(clocked).name("job").blocking(false).build();

      first.acquire();
      clock.advance(Duration.ofSeconds(1));

      assertThat(second.acquire()).isTrue();
      clocked.close();
    }
  }

  @Nested
  @DisplayName("해제")
  class Release {

    @Test
    @DisplayName("보유하지 않은 인스턴스의 release는 다른 소유자의 락을 지우지 않는다")
    void nonOwnerReleaseIsNoop() {
      DistributedLock owner = nonBlocking("job");
      DistributedLock stranger = nonBlocking("job");
      owner.acquire();

      stranger.release();

      assertThat(backend.exists("lock:job")).isTrue();
    }

    @Test
    @DisplayName("토큰이 바뀌었으면 release는 삭제하지 않는다")
    void tokenMismatch() {
      DistributedLock owner = nonBlocking("job");
      owner.acquire();
      backend.set("lock:job", "someone-else");

      owner.release();

      assertThat(backend.get("lock:job")).contains("someone-else");
      assertThat(owner.isHeld()).isFalse();
    }

    @Test
    @DisplayName("백엔드 조회가 실패하면 보유 상태가 유지되어 재시도로 해제할 수 있다")
    void failedReleaseKeepsOwnership() {
      // given
      MemoryCacheBackend<String> flaky = spy(backend);
      doThrow(new CacheBackendException("일시 장애"))
          .doCallRealMethod()
          .when(flaky)
          .get("lock:job");
      DistributedLock owner =
          DistributedLock.builder().backend(flaky).name("job").blocking(false).build();
      owner.acquire();

      // when
      assertThatThrownBy(owner::release).isInstanceOf(CacheBackendException.class);

      // then
      assertThat(owner.isHeld()).isTrue();
      assertThat(backend.exists("lock:job")).isTrue();

      owner.release();

      assertThat(owner.isHeld()).isFalse();
      assertThat(backend.exists("lock:job")).isFalse();
    }

    @Test
    @DisplayName("releaseAsync가 실패하면 보유 상태가 유지된다")
    void failedReleaseAsyncKeepsOwnership() throws Exception {
      // given
      MemoryCacheBackend<String> flaky = spy(backend);
      doReturn(CompletableFuture.failedFuture(new CacheBackendException("일시 장애")))
          .doCallRealMethod()
          .when(flaky)
          .getAsync("lock:job");
      DistributedLock owner =
          DistributedLock.builder().backend(flaky).name("job").blocking(false).build();
      owner.acquire();

      // when
      CompletableFuture<Void> first = owner.releaseAsync();

      // then
      assertThat(first).isCompletedExceptionally();
      assertThat(owner.isHeld()).isTrue();

      owner.releaseAsync().get(1, TimeUnit.SECONDS);

      assertThat(owner.isHeld()).isFalse();
      assertThat(backend.exists("lock:job")).isFalse();
    }

    @Test
    @DisplayName("releaseAsync는 자신의 락을 삭제한다")
    void releaseAsync() throws Exception {
      DistributedLock owner = nonBlocking("job");
      owner.acquireAsync().get(1, TimeUnit.SECONDS);

      owner.releaseAsync().get(1, TimeUnit.SECONDS);

      assertThat(backend.exists("lock:job")).isFalse();
    }
  }

  @Nested
  @DisplayName("executeWithLock")
  class Execute {

    @Test
    @DisplayName("작업 결과를 반환하고 락을 해제한다")
    void releasesAfterTask() throws Throwable {
      DistributedLock lock = nonBlocking("job");

      String result = lock.executeWithLock(() -> "done");

      assertThat(result).isEqualTo("done");
      assertThat(backend.exists("lock:job")).isFalse();
    }

    @Test
    @DisplayName("작업이 실패해도 락을 해제한다")
    void releasesOnFailure() {
      DistributedLock lock = nonBlocking("job");

      assertThatThrownBy(
              () ->
                  lock.executeWithLock(
                      () -> {
                        throw new IllegalStateException("task failed");
                      }))
          .isInstanceOf(IllegalStateException.class);
      assertThat(backend.exists("lock:job")).isFalse();
    }

    @Test
    @DisplayName("락을 얻지 못하면 CacheLockException")
    void failsWhenLocked() {
      nonBlocking("job").acquire();

      assertThatThrownBy(() -> nonBlocking("job").executeWithLock(() -> "never"))
          .isInstanceOf(CacheLockException.class)
          .hasMessageContaining("lock:job");
    }

    @Test
    @DisplayName("동시 실행에서 임계 구역은 겹치지 않는다")
    void criticalSectionDoesNotOverlap() throws InterruptedException {
      int workers = 8;
      ExecutorService pool = Executors.newFixedThreadPool(workers);
      CountDownLatch start = new CountDownLatch(1);
      AtomicInteger inside = new AtomicInteger();
      List<Integer> maxConcurrent = Collections.synchronizedList(new ArrayList<>());

      for (int i = 0; i < workers; i++) {
        pool.submit(
            () -> {
              start.await();
              DistributedLock lock =
                  DistributedLock.builder()
                      .backend(backend)
                      .name("shared")
                      .blockingTimeout(Duration.ofSeconds(5))
                      .build();
              try {
                return lock.executeWithLock(
                    () -> {
                      maxConcurrent.add(inside.incrementAndGet());
                      Thread.sleep(5);
                      inside.decrementAndGet();
                      return null;
                    });
              } catch (Throwable t) {
                throw new IllegalStateException(t);
              }
            });
      }
      start.countDown();
      pool.shutdown();
      assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

      assertThat(maxConcurrent).hasSize(workers).containsOnly(1);
    }
  }
}
