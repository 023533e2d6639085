package finewine.acquisition.domain.model.source;

import java.time.Duration;
import java.util.Objects;

/**
 * 소스별 서킷 브레이커 설정.
 *
 * @param failureThreshold CLOSED 상태에서 OPEN 으로 전이되는 연속 실패 횟수
 * @param recoveryTimeout OPEN 유지 시간. 경과 후 첫 호출이 HALF_OPEN 프로브가 된다
 * @param successThreshold HALF_OPEN 에서 CLOSED 로 복귀하기 위한 연속 성공 횟수
 */
public record CircuitBreakerSpec(
    int failureThreshold, Duration recoveryTimeout, int successThreshold) {

  public static final int DEFAULT_FAILURE_THRESHOLD = 5;
  public static final Duration DEFAULT_RECOVERY_TIMEOUT = Duration.ofSeconds(60);
  public static final int DEFAULT_SUCCESS_THRESHOLD = 3;

  public CircuitBreakerSpec {
    Objects.requireNonNull(recoveryTimeout, "recoveryTimeout cannot be null");
    if (failureThreshold < 1) {
      throw new IllegalArgumentException("failureThreshold must be >= 1: " + failureThreshold);
    }
    if (successThreshold < 1) {
      throw new IllegalArgumentException("successThreshold must be >= 1: " + successThreshold);
    }
    if (recoveryTimeout.isNegative()) {
      throw new IllegalArgumentException("recoveryTimeout must not be negative: " + recoveryTimeout);
    }
  }

  public static CircuitBreakerSpec defaults() {
    return new CircuitBreakerSpec(
        DEFAULT_FAILURE_THRESHOLD, DEFAULT_RECOVERY_TIMEOUT, DEFAULT_SUCCESS_THRESHOLD);
  }
}
