package cache.forge.infrastructure.executor;

import cache.forge.common.function.ThrowingRunnable;
import cache.forge.common.function.ThrowingSupplier;
import cache.forge.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * 저장소 호출을 감싸는 실행 템플릿
 *
 * <p>try-catch 반복 대신 작업을 람다로 넘기면 메트릭 기록, 실패 로깅, 예외 변환을 한 곳에서 처리합니다.
 *
 * <ul>
 *   <li>{@link Error}는 절대 잡지 않습니다.
 *   <li>{@link cache.forge.error.exception.base.BaseException}은 그대로 전파됩니다.
 *   <li>그 외 예외는 {@link ExceptionTranslator}로 캐시 예외 계층에 맞춰 변환됩니다.
 * </ul>
 *
 * <pre>{@code
 * byte[] payload = executor.executeWithTranslation(
 *     () -> jdbcTemplate.query(SELECT_ENTRY, ROW_MAPPER, key),
 *     ExceptionTranslator.forSqlite(),
 *     TaskContext.of("SqliteCache", "Get", key));
 * }</pre>
 */
public interface LogicExecutor {

  /** 기본 변환기로 실행합니다. */
  <T> T execute(ThrowingSupplier<T> task, TaskContext context);

  /** 실패하면 로그를 남기고 {@code defaultValue}를 반환합니다. 헬스 체크 전용입니다. */
  <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context);

  void executeVoid(ThrowingRunnable task, TaskContext context);

  <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context);
}
