package finewine.acquisition.domain.model.circuit;

import finewine.acquisition.domain.model.source.CircuitBreakerSpec;
import finewine.acquisition.domain.model.source.SourceId;
import java.time.Instant;
import java.util.List;

/**
 * 특정 시점의 브레이커 상태 스냅샷 (읽기 전용).
 *
 * <p>{@code failureRate} 는 전체 요청 대비 실패 비율(0.0~1.0), 요청이 없으면 0.
 */
public record CircuitBreakerSnapshot(
    SourceId source,
    CircuitState state,
    int failureCount,
    int successCount,
    Instant lastFailureAt,
    Instant openedAt,
    Instant lastStateChange,
    long totalRequests,
    long totalFailures,
    long totalRejections,
    double failureRate,
    List<StateTransition> recentTransitions,
    CircuitBreakerSpec config) {

  public CircuitBreakerSnapshot {
    recentTransitions = List.copyOf(recentTransitions);
  }

  public boolean isClosed() {
    return state == CircuitState.CLOSED;
  }
}
