package finewine.acquisition.compliance.check;

import finewine.acquisition.compliance.policy.TermsOfServiceRegistry;
import finewine.acquisition.domain.model.source.RateLimitSpec;
import finewine.acquisition.domain.model.source.SourceId;
import finewine.acquisition.infrastructure.ratelimit.SourceRateLimiter;
import finewine.acquisition.monitor.PipelineMonitor;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;

/**
 * 소스 하나의 rate limit 준수 여부를 판정합니다.
 *
 * <ul>
 *   <li>설정 한도가 약관 한도보다 느슨하지 않은지
 *   <li>실제 호출 이력에서 period 안에 maxCalls 를 넘긴 구간이 없는지
 *   <li>최근 제공자 429 응답이 있었는지
 * </ul>
 */
@RequiredArgsConstructor
public class RateLimitInspector {

  // 호출 시각은 wall-clock 으로 기록되므로 측정 오차를 허용
  static final Duration CLOCK_TOLERANCE = Duration.ofMillis(5);

  private final SourceRateLimiter rateLimiter;
  private final TermsOfServiceRegistry termsOfService;
  private final PipelineMonitor monitor;

  public List<String> issuesFor(SourceId source) {
    List<String> issues = new ArrayList<>();
    RateLimitSpec configured = rateLimiter.spec(source);

    termsOfService
        .declaredRateLimit(source)
        .filter(configured::isLooserThan)
        .ifPresent(
            declared ->
                issues.add(
                    String.format(
                        "Configured rate limit for %s (%d/%s) is looser than ToS limit (%d/%s)",
                        source,
                        configured.maxCalls(),
                        configured.period(),
                        declared.maxCalls(),
                        declared.period())));

    int burst = densestWindow(rateLimiter.recentDispatches(source), configured.period());
    if (burst > configured.maxCalls()) {
      issues.add(
          String.format(
              "Rate limit exceeded for %s: %d calls within %s (limit %d)",
              source, burst, configured.period(), configured.maxCalls()));
    }

    int hits = monitor.rateLimitHits(source);
    if (hits > 0) {
      issues.add(
          String.format("Provider returned RATE_LIMITED %d times recently for %s", hits, source));
    }
    return issues;
  }

  /** 길이 {@code period} 미만의 구간에 들어간 최대 호출 수. 시각은 오름차순이어야 합니다. */
  static int densestWindow(List<Instant> dispatches, Duration period) {
    Duration window = period.minus(CLOCK_TOLERANCE);
    int max = 0;
    int start = 0;
    for (int end = 0; end < dispatches.size(); end++) {
      while (start < end
          && Duration.between(dispatches.get(start), dispatches.get(end)).compareTo(window) >= 0) {
        start++;
      }
      max = Math.max(max, end - start + 1);
    }
    return max;
  }
}
