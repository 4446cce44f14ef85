package cache.forge.error.exception;

import cache.forge.error.CommonErrorCode;
import cache.forge.error.exception.base.ServerBaseException;

/** 원격 저장소에 연결할 수 없거나 인증에 실패했을 때 발생합니다. */
public class CacheConnectionException extends ServerBaseException {

  public CacheConnectionException(String detail, Throwable cause) {
    super(CommonErrorCode.BACKEND_CONNECTION_FAILED, cause, detail);
  }
}
