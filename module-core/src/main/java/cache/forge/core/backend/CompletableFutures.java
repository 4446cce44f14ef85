package cache.forge.core.backend;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/** Async 표면을 동기 코드로 채우는 엔진을 위한 헬퍼 */
public final class CompletableFutures {

  private CompletableFutures() {}

  /** 호출 스레드에서 즉시 실행하고, 예외는 던지지 않고 실패한 future로 돌려줍니다. */
  public static <T> CompletableFuture<T> completed(Supplier<T> operation) {
    try {
      return CompletableFuture.completedFuture(operation.get());
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }
}
