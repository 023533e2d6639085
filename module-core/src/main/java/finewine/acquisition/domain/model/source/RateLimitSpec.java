package finewine.acquisition.domain.model.source;

import java.time.Duration;
import java.util.Objects;

/**
 * 소스별 호출 한도: {@code period} 동안 최대 {@code maxCalls}회.
 *
 * <p>리미터는 이를 연속 호출 간 최소 간격({@link #minSpacing()})으로 환산해 강제합니다.
 */
public record RateLimitSpec(int maxCalls, Duration period) {

  public RateLimitSpec {
    Objects.requireNonNull(period, "period cannot be null");
    if (maxCalls < 1) {
      throw new IllegalArgumentException("maxCalls must be >= 1: " + maxCalls);
    }
    if (period.isNegative() || period.isZero()) {
      throw new IllegalArgumentException("period must be positive: " + period);
    }
  }

  public static RateLimitSpec of(int maxCalls, Duration period) {
    return new RateLimitSpec(maxCalls, period);
  }

  public static RateLimitSpec perSecond(int maxCalls) {
    return new RateLimitSpec(maxCalls, Duration.ofSeconds(1));
  }

  /** 연속된 두 호출 사이의 최소 간격 = period / maxCalls */
  public Duration minSpacing() {
    return period.dividedBy(maxCalls);
  }

  /** 다른 한도보다 간격이 좁으면(더 느슨하면) true */
  public boolean isLooserThan(RateLimitSpec other) {
    return minSpacing().compareTo(other.minSpacing()) < 0;
  }
}
