package finewine.acquisition.status;

import finewine.acquisition.domain.model.circuit.CircuitState;
import finewine.acquisition.domain.model.source.SourceId;
import java.time.Instant;

/**
 * 소스 하나의 운영 상태.
 *
 * @param rateLimiterLastCall 마지막 호출 허가 시각, 호출 이력이 없으면 null
 * @param lastSuccess 마지막 성공 시각, 없으면 null
 */
public record SourceHealth(
    SourceId source,
    CircuitState circuitState,
    int failureCount,
    Instant rateLimiterLastCall,
    boolean sourceActive,
    Instant lastSuccess,
    int failureStreak,
    double errorRate) {}
