package cache.forge.infrastructure.executor;

import java.util.Objects;

/**
 * 메트릭 카디널리티 통제를 위한 작업 컨텍스트
 *
 * <pre>
 * "component:operation:dynamicValue"
 *
 * 예시:
 * - TaskContext.of("SqliteCache", "Get", "user:1") → "SqliteCache:Get:user:1"
 * - TaskContext.of("RedisCache", "Clear")         → "RedisCache:Clear"
 * </pre>
 *
 * <ul>
 *   <li>component, operation: 메트릭 태그로 사용 (고정 값)
 *   <li>dynamicValue: 로그에만 기록 (메트릭에서 제외)
 * </ul>
 *
 * @param component 컴포넌트 이름 (예: "SqliteCache", "RedisCache")
 * @param operation 작업 유형 (예: "Get", "Set", "Scan")
 * @param dynamicValue 동적 값 (예: 캐시 키)
 */
public record TaskContext(String component, String operation, String dynamicValue) {

  public TaskContext {
    Objects.requireNonNull(component, "component");
    Objects.requireNonNull(operation, "operation");
    if (dynamicValue == null) {
      dynamicValue = "";
    }
  }

  public static TaskContext of(String component, String operation, String dynamicValue) {
    return new TaskContext(component, operation, dynamicValue);
  }

  public static TaskContext of(String component, String operation) {
    return new TaskContext(component, operation, "");
  }

  public String toTaskName() {
    if (dynamicValue.isEmpty()) {
      return component + ":" + operation;
    }
    return component + ":" + operation + ":" + dynamicValue;
  }
}
