package finewine.acquisition.domain.model.source;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 등록된 데이터 소스의 정적 설정.
 *
 * <p>{@code priority} 가 낮을수록 먼저 시도됩니다. 같은 capability 를 가진 소스끼리만 비교합니다.
 */
public record SourceDefinition(
    SourceId id,
    int priority,
    List<Capability> capabilities,
    RateLimitSpec rateLimit,
    CircuitBreakerSpec circuitBreaker,
    Duration attemptTimeout,
    boolean active) {

  public static final Duration DEFAULT_ATTEMPT_TIMEOUT = Duration.ofSeconds(10);

  public SourceDefinition {
    Objects.requireNonNull(id, "id cannot be null");
    Objects.requireNonNull(rateLimit, "rateLimit cannot be null");
    Objects.requireNonNull(circuitBreaker, "circuitBreaker cannot be null");
    capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
    if (capabilities.isEmpty()) {
      throw new IllegalArgumentException("source '" + id + "' must declare at least one capability");
    }
    if (attemptTimeout == null) {
      attemptTimeout = DEFAULT_ATTEMPT_TIMEOUT;
    }
    if (attemptTimeout.isNegative() || attemptTimeout.isZero()) {
      throw new IllegalArgumentException("attemptTimeout must be positive: " + attemptTimeout);
    }
  }

  public boolean supports(Capability capability) {
    return capabilities.contains(capability);
  }

  public SourceDefinition withActive(boolean active) {
    return new SourceDefinition(
        id, priority, capabilities, rateLimit, circuitBreaker, attemptTimeout, active);
  }
}
