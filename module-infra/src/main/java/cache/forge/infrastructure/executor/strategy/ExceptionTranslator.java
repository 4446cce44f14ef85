package cache.forge.infrastructure.executor.strategy;

import cache.forge.error.exception.CacheBackendException;
import cache.forge.error.exception.CacheConnectionException;
import cache.forge.error.exception.base.BaseException;
import cache.forge.infrastructure.executor.TaskContext;
import java.sql.SQLException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.redisson.RedissonShutdownException;
import org.redisson.client.RedisConnectionException;
import org.redisson.client.RedisException;
import org.redisson.client.RedisTimeoutException;
import org.springframework.dao.DataAccessException;

/**
 * 저장소 예외를 캐시 예외 계층으로 변환하는 전략
 *
 * <h3>Error 격리</h3>
 *
 * <ul>
 *   <li>{@link Error}(OOM, StackOverflow 등)는 절대 변환하지 않고 그대로 throw
 *   <li>{@link BaseException}은 이미 캐시 예외이므로 그대로 pass-through
 *   <li>원본 예외를 cause로 보존하여 스택 트레이스 유지
 * </ul>
 */
@FunctionalInterface
public interface ExceptionTranslator {

  /**
   * @param e 원본 예외
   * @param context 실패한 작업 ({@code component:operation:key})
   * @return 변환된 RuntimeException
   * @throws Error Error 타입은 변환하지 않고 그대로 throw
   */
  RuntimeException translate(Throwable e, TaskContext context);

  /** BaseException은 통과, 나머지는 {@link CacheBackendException} */
  static ExceptionTranslator defaultTranslator() {
    return (e, context) -> {
      Throwable cause = unwrap(e);
      if (cause instanceof Error error) {
        throw error;
      }
      if (cause instanceof BaseException base) {
        return base;
      }
      return new CacheBackendException(context.toTaskName(), cause);
    };
  }

  /**
   * SQLite(JDBC) 예외 변환기
   *
   * <ul>
   *   <li>{@link SQLException}, {@link DataAccessException} → {@link CacheBackendException}
   *   <li>로컬 파일 저장소이므로 연결 실패도 저장소 작업 실패로 취급
   * </ul>
   */
  static ExceptionTranslator forSqlite() {
    return (e, context) -> {
      Throwable cause = unwrap(e);
      if (cause instanceof Error error) {
        throw error;
      }
      if (cause instanceof BaseException base) {
        return base;
      }
      if (cause instanceof SQLException || cause instanceof DataAccessException) {
        return new CacheBackendException(
            context.toTaskName() + " - " + rootMessage(cause), cause);
      }
      return new CacheBackendException(context.toTaskName(), cause);
    };
  }

  /**
   * Redis(Redisson) 예외 변환기
   *
   * <ul>
   *   <li>연결 실패, 타임아웃, 클라이언트 종료, 인증 실패 → {@link CacheConnectionException}
   *   <li>그 외 Redis 명령 오류 → {@link CacheBackendException}
   * </ul>
   */
  static ExceptionTranslator forRedis() {
    return (e, context) -> {
      Throwable cause = unwrap(e);
      if (cause instanceof Error error) {
        throw error;
      }
      if (cause instanceof BaseException base) {
        return base;
      }
      if (isConnectionFailure(cause)) {
        return new CacheConnectionException(
            context.toTaskName() + " - " + rootMessage(cause), cause);
      }
      return new CacheBackendException(context.toTaskName() + " - " + rootMessage(cause), cause);
    };
  }

  private static boolean isConnectionFailure(Throwable cause) {
    if (cause instanceof RedisConnectionException
        || cause instanceof RedisTimeoutException
        || cause instanceof RedissonShutdownException) {
      return true;
    }
    if (cause instanceof RedisException) {
      String message = String.valueOf(cause.getMessage());
      return message.contains("NOAUTH") || message.contains("WRONGPASS");
    }
    return false;
  }

  /** Async 경로에서 감싸진 원인 예외를 꺼냅니다. */
  static Throwable unwrap(Throwable e) {
    Throwable current = e;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private static String rootMessage(Throwable e) {
    Throwable root = e;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }
    return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
  }
}
