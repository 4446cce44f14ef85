package cache.forge.error.exception.base;

import cache.forge.error.ErrorCode;

/** ClientBaseException: 잘못된 키, 음수 용량, 미등록 백엔드 이름 등 호출자의 사용 오류를 나타냅니다. */
public abstract class ClientBaseException extends BaseException {

  // "등록되지 않은 캐시 백엔드입니다: %s" 처럼 동적 인자로 메시지를 완성합니다.
  protected ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
