package cache.forge.infrastructure.executor;

import cache.forge.common.function.ThrowingRunnable;
import cache.forge.common.function.ThrowingSupplier;
import cache.forge.error.exception.base.ClientBaseException;
import cache.forge.infrastructure.executor.strategy.ExceptionTranslator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * LogicExecutor 기본 구현체
 *
 * <ul>
 *   <li>Checked Exception → 캐시 예외 계층으로 변환
 *   <li>Micrometer 타이머 {@value #METRIC_NAME} 기록 (component/operation/result 태그)
 *   <li><b>Error 격리</b>: Error(OOM 등)는 절대 캐치하지 않고 상위로 전파
 *   <li><b>카디널리티 통제</b>: 캐시 키 같은 동적 값은 로그에만 기록
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultLogicExecutor implements LogicExecutor {

  public static final String METRIC_NAME = "cache.executor";

  private final MeterRegistry meterRegistry;

  @Override
  public <T> T execute(ThrowingSupplier<T> task, TaskContext context) {
    return executeWithMetrics(task, context, ExceptionTranslator.defaultTranslator());
  }

  @Override
  public <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      T result = task.get();
      recordSuccess(sample, context);
      return result;
    } catch (Throwable t) {
      if (t instanceof Error error) {
        throw error;
      }
      recordFailure(sample, context, t);
      log.warn("[{}] 실패, 기본값 반환: {}", context.toTaskName(), t.toString());
      return defaultValue;
    }
  }

  @Override
  public void executeVoid(ThrowingRunnable task, TaskContext context) {
    execute(
        () -> {
          task.run();
          return null;
        },
        context);
  }

  @Override
  public <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context) {
    return executeWithMetrics(task, context, translator);
  }

  private <T> T executeWithMetrics(
      ThrowingSupplier<T> task, TaskContext context, ExceptionTranslator translator) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      T result = task.get();
      recordSuccess(sample, context);
      return result;
    } catch (Throwable t) {
      // Error 격리 - Error는 절대 변환하지 않고 그대로 throw
      if (t instanceof Error error) {
        throw error;
      }
      recordFailure(sample, context, t);
      RuntimeException translated = translator.translate(t, context);
      logFailure(context, translated);
      throw translated;
    }
  }

  private void logFailure(TaskContext context, RuntimeException translated) {
    if (translated instanceof ClientBaseException) {
      log.debug("[{}] 잘못된 요청: {}", context.toTaskName(), translated.getMessage());
      return;
    }
    log.error("[{}] 실행 중 예외 발생", context.toTaskName(), translated);
  }

  private void recordSuccess(Timer.Sample sample, TaskContext context) {
    sample.stop(
        Timer.builder(METRIC_NAME)
            .tag("component", context.component())
            .tag("operation", context.operation())
            .tag("result", "success")
            .tag("exception", "none")
            .register(meterRegistry));
  }

  private void recordFailure(Timer.Sample sample, TaskContext context, Throwable t) {
    sample.stop(
        Timer.builder(METRIC_NAME)
            .tag("component", context.component())
            .tag("operation", context.operation())
            .tag("result", "failure")
            .tag("exception", t.getClass().getSimpleName())
            .register(meterRegistry));
  }
}
