package finewine.acquisition.infrastructure.ratelimit;

import finewine.acquisition.domain.model.source.RateLimitSpec;
import finewine.acquisition.domain.model.source.SourceId;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 리미터 상태 스냅샷.
 *
 * @param lastDispatch 마지막 허가 시각, 허가 이력이 없으면 null
 * @param recentDispatches 최근 허가 시각 (오래된 순, 최대 max(64, maxCalls + 1)건)
 */
public record RateLimiterSnapshot(
    SourceId source,
    RateLimitSpec spec,
    Instant lastDispatch,
    long totalPermits,
    Duration totalWait,
    List<Instant> recentDispatches) {

  public RateLimiterSnapshot {
    recentDispatches = List.copyOf(recentDispatches);
  }
}
