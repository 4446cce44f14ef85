package cache.forge.common.function;

/**
 * 예외를 던질 수 있는 void 작업을 표현하는 함수형 인터페이스
 *
 * <p>표준 {@link Runnable}과 달리 Checked Exception을 던질 수 있습니다.
 *
 * <pre>{@code
 * executor.executeVoid(this::sweepExpired, TaskContext.of("SqliteCache", "Sweep"));
 * }</pre>
 *
 * @see ThrowingSupplier
 */
@FunctionalInterface
public interface ThrowingRunnable {

  void run() throws Throwable;
}
