package cache.forge.error.exception.base;

import cache.forge.error.ErrorCode;
import lombok.Getter;

/** 모든 cache-forge 예외의 최상위 타입. {@link ErrorCode}와 포맷된 메시지를 함께 보관합니다. */
@Getter
public abstract class BaseException extends RuntimeException {

  private final ErrorCode errorCode;
  private final String message;

  protected BaseException(ErrorCode errorCode) {
    super(errorCode.getMessage());
    this.errorCode = errorCode;
    this.message = errorCode.getMessage();
  }

  // 동적 인자를 받는 생성자 (String.format 활용)
  protected BaseException(ErrorCode errorCode, Object... args) {
    this(errorCode, null, args);
  }

  protected BaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode.getMessage(), cause);
    this.errorCode = errorCode;
    this.message = errorCode.getMessage();
  }

  protected BaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(String.format(errorCode.getMessage(), args), cause);
    this.errorCode = errorCode;
    this.message = String.format(errorCode.getMessage(), args);
  }
}
