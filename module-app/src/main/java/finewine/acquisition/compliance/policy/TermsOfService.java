package finewine.acquisition.compliance.policy;

import finewine.acquisition.domain.model.source.RateLimitSpec;
import finewine.acquisition.domain.model.source.SourceId;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * 소스 이용약관 수락 기록.
 *
 * @param maxRequests 약관이 허용하는 최대 요청 수 ({@code period} 당), 명시가 없으면 null
 */
public record TermsOfService(
    SourceId source,
    String version,
    boolean accepted,
    Integer maxRequests,
    Duration period,
    List<String> keyTerms) {

  public TermsOfService {
    keyTerms = keyTerms == null ? List.of() : List.copyOf(keyTerms);
  }

  public Optional<RateLimitSpec> declaredRateLimit() {
    if (maxRequests == null || period == null) {
      return Optional.empty();
    }
    return Optional.of(RateLimitSpec.of(maxRequests, period));
  }
}
