package cache.forge.error;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * cache-forge 공통 에러 코드
 *
 * <ul>
 *   <li>C0xx: 호출자의 잘못된 사용 (인자, 등록되지 않은 백엔드 등)
 *   <li>S0xx: 저장소/직렬화/네트워크 등 시스템 측 실패
 * </ul>
 */
@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {

  // === Client Errors ===
  INVALID_ARGUMENT("C001", "잘못된 캐시 인자입니다: %s"),
  BACKEND_NOT_REGISTERED("C002", "등록되지 않은 캐시 백엔드입니다: %s"),
  BACKEND_ALREADY_REGISTERED("C003", "이미 등록된 캐시 백엔드입니다: %s"),

  // === Server Errors ===
  SERIALIZATION_FAILED("S001", "캐시 값 직렬화 처리에 실패했습니다 (%s)"),
  BACKEND_OPERATION_FAILED("S002", "캐시 백엔드 작업에 실패했습니다 (%s)"),
  BACKEND_CONNECTION_FAILED("S003", "캐시 백엔드 연결에 실패했습니다 (%s)"),
  LOCK_NOT_ACQUIRED("S004", "분산 락을 획득하지 못했습니다 (key: %s)");

  private final String code;
  private final String message;
}
