package finewine.acquisition.domain.model.monitor;

import finewine.acquisition.domain.model.source.SourceId;
import java.time.Duration;
import java.time.Instant;

/**
 * 신선도 판정 결과.
 *
 * @param age 마지막 성공 이후 경과 시간, 성공 이력이 없으면 null
 */
public record FreshnessReport(
    SourceId source,
    boolean fresh,
    Instant lastSuccess,
    Duration age,
    Duration maxAge,
    String reason) {}
