package cache.forge.error.exception.base;

import cache.forge.error.ErrorCode;

/**
 * ServerBaseException: 저장소 장애, 직렬화 실패, 네트워크 단절처럼 호출자가 고칠 수 없는 '서버 예외'입니다. 장애 분석을 위해 원인 예외(cause)를
 * 최대한 보존합니다.
 */
public abstract class ServerBaseException extends BaseException {

  protected ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  protected ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
