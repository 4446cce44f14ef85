package cache.forge.error.exception;

import cache.forge.error.CommonErrorCode;
import cache.forge.error.exception.base.ServerBaseException;

/** 코덱이 값을 바이트로 변환하거나 복원하지 못했을 때 발생합니다. */
public class CacheSerializationException extends ServerBaseException {

  public CacheSerializationException(String detail, Throwable cause) {
    super(CommonErrorCode.SERIALIZATION_FAILED, cause, detail);
  }
}
