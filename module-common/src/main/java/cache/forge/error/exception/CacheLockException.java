package cache.forge.error.exception;

import cache.forge.error.CommonErrorCode;
import cache.forge.error.exception.base.ServerBaseException;

/** 분산 락 획득 실패 또는 대기 중 인터럽트 */
public class CacheLockException extends ServerBaseException {

  public CacheLockException(String lockKey) {
    super(CommonErrorCode.LOCK_NOT_ACQUIRED, lockKey);
  }

  public CacheLockException(String lockKey, Throwable cause) {
    super(CommonErrorCode.LOCK_NOT_ACQUIRED, cause, lockKey);
  }
}
