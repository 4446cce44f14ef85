package cache.forge.core.backend;

import cache.forge.error.exception.InvalidCacheArgumentException;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * 만료 항목 백그라운드 정리기
 *
 * <p>엔진이 소유하는 단일 데몬 스레드에서 {@code interval}마다 sweep 작업을 실행합니다. 한 번의 sweep이 실패해도 경고만 남기고 다음 주기는
 * 계속 실행됩니다.
 *
 * <p>{@link #close()}는 새 주기를 막고, 진행 중인 sweep을 {@code joinTimeout}까지 기다린 뒤 남은 작업을 인터럽트합니다.
 */
@Slf4j
public final class ExpirySweeper implements AutoCloseable {

  public static final Duration DEFAULT_JOIN_TIMEOUT = Duration.ofSeconds(5);

  private final String name;
  private final ScheduledExecutorService scheduler;
  private final Duration joinTimeout;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private ExpirySweeper(String name, ScheduledExecutorService scheduler, Duration joinTimeout) {
    this.name = name;
    this.scheduler = scheduler;
    this.joinTimeout = joinTimeout;
  }

  /**
   * @param name 스레드 이름 및 로그 태그
   * @param interval sweep 주기, 양수여야 함
   * @param sweep 만료 항목 삭제 작업, 삭제한 개수를 반환
   */
  public static ExpirySweeper start(String name, Duration interval, SweepTask sweep) {
    return start(name, interval, DEFAULT_JOIN_TIMEOUT, sweep);
  }

  public static ExpirySweeper start(
      String name, Duration interval, Duration joinTimeout, SweepTask sweep) {
    if (interval == null || interval.isZero() || interval.isNegative()) {
      throw new InvalidCacheArgumentException("cleanupInterval=" + interval);
    }
    ScheduledExecutorService scheduler =
        Executors.newSingleThreadScheduledExecutor(
            runnable -> {
              Thread thread = new Thread(runnable, name);
              thread.setDaemon(true);
              return thread;
            });
    ExpirySweeper sweeper = new ExpirySweeper(name, scheduler, joinTimeout);
    long periodMillis = Math.max(1L, interval.toMillis());
    scheduler.scheduleWithFixedDelay(
        () -> sweeper.runOnce(sweep), periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    log.debug("[Sweeper] '{}' 시작 (interval: {})", name, interval);
    return sweeper;
  }

  private void runOnce(SweepTask sweep) {
    try {
      int removed = sweep.sweep();
      if (removed > 0) {
        log.debug("[Sweeper] '{}' 만료 항목 {}건 정리", name, removed);
      }
    } catch (RuntimeException e) {
      // 예외가 전파되면 ScheduledExecutorService가 이후 주기를 취소한다
      log.warn("[Sweeper] '{}' 정리 실패, 다음 주기에 재시도: {}", name, e.getMessage(), e);
    }
  }

  public boolean isRunning() {
    return !closed.get();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    scheduler.shutdown();
    try {
      if (!scheduler.awaitTermination(joinTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("[Sweeper] '{}' {} 내 종료되지 않아 강제 중단", name, joinTimeout);
        scheduler.shutdownNow();
      }
    } catch (InterruptedException e) {
      scheduler.shutdownNow();
      Thread.currentThread().interrupt();
    }
    log.debug("[Sweeper] '{}' 종료", name);
  }

  /** 한 번의 정리 작업 */
  @FunctionalInterface
  public interface SweepTask {
    int sweep();
  }
}
