package cache.forge.error;

/** 캐시 계층 에러 코드 규격. 메시지는 {@link String#format} 템플릿입니다. */
public interface ErrorCode {
  String getCode();

  String getMessage();
}
