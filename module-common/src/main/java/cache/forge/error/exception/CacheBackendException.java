package cache.forge.error.exception;

import cache.forge.error.CommonErrorCode;
import cache.forge.error.exception.base.ServerBaseException;

/**
 * 저장소 작업(조회, 쓰기, 삭제, 스캔) 자체가 실패했을 때 발생합니다.
 *
 * <p>미스와 구분되어야 하므로 어떤 엔진도 이 예외를 빈 결과로 바꾸지 않습니다.
 */
public class CacheBackendException extends ServerBaseException {

  public CacheBackendException(String detail) {
    super(CommonErrorCode.BACKEND_OPERATION_FAILED, detail);
  }

  public CacheBackendException(String detail, Throwable cause) {
    super(CommonErrorCode.BACKEND_OPERATION_FAILED, cause, detail);
  }
}
