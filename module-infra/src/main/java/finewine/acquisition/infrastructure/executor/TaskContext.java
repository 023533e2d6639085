package finewine.acquisition.infrastructure.executor;

import java.util.Objects;

/**
 * 실행 템플릿에 전달되는 작업 컨텍스트.
 *
 * <pre>
 * TaskContext.of("Orchestrator", "Fetch", "fangraphs") → "Orchestrator:Fetch:fangraphs"
 * TaskContext.of("Compliance", "Tick")                 → "Compliance:Tick"
 * </pre>
 *
 * <p>component, operation 은 고정 taxonomy 로 메트릭/로그 분류에 쓰고, dynamicValue 는 로그에만 남깁니다.
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

  /** "component:operation[:dynamicValue]" */
  public String toTaskName() {
    if (dynamicValue.isEmpty()) {
      return component + ":" + operation;
    }
    return component + ":" + operation + ":" + dynamicValue;
  }
}
