package finewine.acquisition.domain.model.circuit;

import java.time.Instant;

/** 상태 전이 이력 1건. {@code failureCount} 는 전이 직전의 연속 실패 수. */
public record StateTransition(
    CircuitState from, CircuitState to, Instant at, int failureCount, String reason) {}
