package finewine.acquisition.config;

import jakarta.validation.constraints.Min;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * 파이프라인 모니터 임계값.
 *
 * <pre>{@code
 * acquisition:
 *   monitor:
 *     consecutive-failure-threshold: 3   # 연속 실패 N회 → ERROR 알림
 *     rate-limit-hit-threshold: 5        # window 내 429 N회 → WARNING 알림
 *     rate-limit-window: 1h
 *     alert-history-size: 100
 *     default-max-age: 24h               # 신선도 기준
 * }</pre>
 */
@Validated
@ConfigurationProperties(prefix = "acquisition.monitor")
public record MonitorProperties(
    @DefaultValue("3") @Min(1) int consecutiveFailureThreshold,
    @DefaultValue("5") @Min(1) int rateLimitHitThreshold,
    @DefaultValue("1h") Duration rateLimitWindow,
    @DefaultValue("100") @Min(1) int alertHistorySize,
    @DefaultValue("24h") Duration defaultMaxAge) {

  public static MonitorProperties defaults() {
    return new MonitorProperties(3, 5, Duration.ofHours(1), 100, Duration.ofHours(24));
  }
}
